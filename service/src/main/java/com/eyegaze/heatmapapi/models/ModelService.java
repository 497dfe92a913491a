package com.eyegaze.heatmapapi.models;

import com.eyegaze.heatmapapi.render.EncodedImage;
import com.eyegaze.heatmapapi.render.PngEncoder;
import com.eyegaze.heatmapapi.render.RasterDecoder;
import com.eyegaze.heatmapapi.storage.ImageStore;
import java.awt.image.BufferedImage;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/** Reference images that heatmaps are drawn over, stored once and looked up by id. */
@Service
public class ModelService {

  private static final Logger log = LoggerFactory.getLogger(ModelService.class);

  private final ImageStore store;
  private final ModelRecordRepository repository;

  public ModelService(@Qualifier("modelStore") ImageStore store,
      ModelRecordRepository repository) {
    this.store = store;
    this.repository = repository;
  }

  public ModelCreatedResponse create(ModelUploadRequest request) {
    // Re-encoded, so every stored model is a PNG.
    BufferedImage image = RasterDecoder.decodeBase64(request.imageBase64());
    EncodedImage png = PngEncoder.encode(image);
    String reference = store.save(null, request.modelName(), png.bytes());
    ModelRecord saved;
    try {
      saved = repository.save(new ModelRecord(request.modelName(), reference, request.userId(),
          image.getWidth(), image.getHeight(), Instant.now()));
    } catch (RuntimeException ex) {
      store.delete(reference);
      throw ex;
    }
    log.info("Stored model {} '{}' ({}x{}, {} bytes) for user {}", saved.getId(),
        request.modelName(), image.getWidth(), image.getHeight(), png.length(), request.userId());
    return new ModelCreatedResponse("success", saved.getId(), image.getWidth(),
        image.getHeight());
  }

  public List<ModelSummary> list() {
    return repository.findAllByOrderByCreatedAtDescIdDesc().stream()
        .map(ModelSummary::of)
        .toList();
  }

  public boolean exists(String name) {
    if (!StringUtils.hasText(name)) {
      throw new IllegalArgumentException("name must be provided");
    }
    return repository.existsByModelName(name);
  }

  public ModelSummary get(long id) {
    return ModelSummary.of(find(id));
  }

  public byte[] file(long id) {
    return store.read(find(id).getModelPath());
  }

  /** The stored reference image decoded for compositing. */
  public BufferedImage image(long id) {
    return RasterDecoder.decode(file(id));
  }

  public void delete(long id) {
    ModelRecord record = find(id);
    if (!store.delete(record.getModelPath())) {
      throw new IllegalStateException("Failed to delete model file for model " + id);
    }
    repository.delete(record);
    log.info("Deleted model {} '{}'", id, record.getModelName());
  }

  private ModelRecord find(long id) {
    return repository.findById(id)
        .orElseThrow(() -> new NoSuchElementException("Model not found: " + id));
  }
}
