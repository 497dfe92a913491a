package com.eyegaze.heatmapapi.config;

import com.eyegaze.heatmapapi.render.Colormaps;
import com.eyegaze.heatmapapi.render.Kernel;
import com.eyegaze.heatmapapi.render.KernelGenerator;
import com.eyegaze.heatmapapi.render.RenderSettings;
import com.eyegaze.heatmapapi.render.SmoothingFilters;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RenderConfig {

  private static final Logger log = LoggerFactory.getLogger(RenderConfig.class);

  @Bean
  RenderSettings renderSettings(
      @Value("${heatmap.render.kernel-size:200}") int kernelSize,
      @Value("${heatmap.render.alpha-background:0.8}") float alphaBackground,
      @Value("${heatmap.render.alpha-heatmap:0.8}") float alphaHeatmap,
      @Value("${heatmap.render.colormap:turbo}") String colormap,
      @Value("${heatmap.render.mask-fraction:0.5}") double maskFraction,
      @Value("${heatmap.render.smoothing:gaussian}") String smoothing,
      @Value("${heatmap.render.empty-base:black}") String emptyBase,
      @Value("${heatmap.render.max-canvas-pixels:16777216}") long maxCanvasPixels) {
    RenderSettings settings = new RenderSettings(
        kernelSize,
        alphaBackground,
        alphaHeatmap,
        Colormaps.byName(colormap),
        maskFraction,
        SmoothingFilters.byName(smoothing),
        parseEmptyBase(emptyBase),
        maxCanvasPixels);
    log.info("Heatmap rendering: kernel={}px, alpha(background={}, heatmap={}), colormap={}, "
            + "mask-fraction={}, smoothing={}, empty-base={}, max-canvas-pixels={}",
        settings.kernelSize(), settings.alphaBackground(), settings.alphaHeatmap(),
        settings.colormap().name(), settings.maskFraction(), settings.smoothing().name(),
        settings.emptyBase(), settings.maxCanvasPixels());
    return settings;
  }

  // Built once and shared read-only by every render.
  @Bean
  Kernel heatmapKernel(RenderSettings settings) {
    return KernelGenerator.forSize(settings.kernelSize());
  }

  private static RenderSettings.EmptyBase parseEmptyBase(String value) {
    try {
      return RenderSettings.EmptyBase.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "Invalid heatmap.render.empty-base '" + value + "'. Supported values: black,transparent.",
          ex);
    }
  }
}
