package com.eyegaze.heatmapapi.config;

import com.eyegaze.heatmapapi.storage.FileSystemImageStore;
import com.eyegaze.heatmapapi.storage.ImageStore;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StorageConfig {

  private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

  @Bean
  ImageStore heatmapStore(@Value("${heatmap.storage.path:data/heatmap_storage}") Path root) {
    log.info("Heatmap images stored under {}", root.toAbsolutePath());
    return new FileSystemImageStore(root);
  }

  @Bean
  ImageStore modelStore(@Value("${heatmap.storage.model-path:data/model_storage}") Path root) {
    log.info("Reference images stored under {}", root.toAbsolutePath());
    return new FileSystemImageStore(root);
  }
}
