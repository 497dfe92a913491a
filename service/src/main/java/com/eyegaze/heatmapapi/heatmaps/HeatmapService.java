package com.eyegaze.heatmapapi.heatmaps;

import com.eyegaze.heatmapapi.models.ModelService;
import com.eyegaze.heatmapapi.render.CanvasSize;
import com.eyegaze.heatmapapi.render.EncodedImage;
import com.eyegaze.heatmapapi.render.HeatmapRenderer;
import com.eyegaze.heatmapapi.render.RasterDecoder;
import com.eyegaze.heatmapapi.render.WeightedPoint;
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

@Service
public class HeatmapService {

  private static final Logger log = LoggerFactory.getLogger(HeatmapService.class);

  private final HeatmapRenderer renderer;
  private final ImageStore store;
  private final HeatmapRecordRepository repository;
  private final ModelService models;

  public HeatmapService(HeatmapRenderer renderer, @Qualifier("heatmapStore") ImageStore store,
      HeatmapRecordRepository repository, ModelService models) {
    this.renderer = renderer;
    this.store = store;
    this.repository = repository;
    this.models = models;
  }

  public RenderResponse render(RenderRequest request) {
    EncodedImage image = renderImage(request, null);
    return new RenderResponse(request.width(), request.height(), request.points().size(),
        image.base64());
  }

  public HeatmapCreatedResponse create(HeatmapUploadRequest request) {
    EncodedImage image = renderImage(request.toRenderRequest(), request.modelId());
    String reference = store.save("user_" + request.userId(), request.name(), image.bytes());
    HeatmapRecord saved;
    try {
      saved = repository.save(new HeatmapRecord(request.name(), reference, request.modelId(),
          request.userId(), request.points().size(), Instant.now()));
    } catch (RuntimeException ex) {
      store.delete(reference);
      throw ex;
    }
    log.info("Stored heatmap {} '{}' for user {} ({} points, {} bytes)", saved.getId(),
        request.name(), request.userId(), request.points().size(), image.length());
    return new HeatmapCreatedResponse("success", request.points().size(), saved.getId());
  }

  public List<HeatmapSummary> listForUser(long userId) {
    return repository.findByUserIdOrderByCreatedAtDescIdDesc(userId).stream()
        .map(HeatmapSummary::of)
        .toList();
  }

  public boolean exists(long userId, String name) {
    if (!StringUtils.hasText(name)) {
      throw new IllegalArgumentException("name must be provided");
    }
    return repository.existsByUserIdAndImgName(userId, name);
  }

  public HeatmapDetails get(long id) {
    return HeatmapDetails.of(find(id));
  }

  public byte[] file(long id) {
    return store.read(find(id).getImagePath());
  }

  public void delete(long id) {
    HeatmapRecord record = find(id);
    if (!store.delete(record.getImagePath())) {
      throw new IllegalStateException("Failed to delete heatmap file for session " + id);
    }
    repository.delete(record);
    log.info("Deleted heatmap {} of user {}", id, record.getUserId());
  }

  private HeatmapRecord find(long id) {
    return repository.findById(id)
        .orElseThrow(() -> new NoSuchElementException("Heatmap not found: " + id));
  }

  // An inline background wins over the stored model image.
  private EncodedImage renderImage(RenderRequest request, Long modelId) {
    CanvasSize canvas = renderer.canvas(request.width(), request.height());
    BufferedImage background = null;
    if (StringUtils.hasText(request.backgroundBase64())) {
      background = RasterDecoder.decodeBase64(request.backgroundBase64());
    } else if (modelId != null) {
      background = models.image(modelId);
    }
    if (background != null && request.fitBackground()) {
      background = RasterDecoder.fit(background, canvas);
    }
    List<WeightedPoint> points = request.points().stream()
        .map(GazePointRequest::toWeightedPoint)
        .toList();
    return renderer.render(points, canvas.width(), canvas.height(), background);
  }
}
