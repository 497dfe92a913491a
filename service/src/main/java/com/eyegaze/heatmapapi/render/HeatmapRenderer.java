package com.eyegaze.heatmapapi.render;

import java.awt.image.BufferedImage;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs accumulate, composite and encode for one request. Holds no per-request state; the only
 * shared value is the read-only {@link Kernel}, so one instance serves concurrent callers.
 */
@Service
public class HeatmapRenderer {

  private static final Logger log = LoggerFactory.getLogger(HeatmapRenderer.class);

  private final DensityAccumulator accumulator;
  private final Compositor compositor;
  private final long maxCanvasPixels;

  public HeatmapRenderer(Kernel kernel, RenderSettings settings) {
    if (kernel.size() != settings.kernelSize()) {
      throw new IllegalArgumentException("kernel is " + kernel.size()
          + " wide but settings ask for " + settings.kernelSize());
    }
    this.accumulator = new DensityAccumulator(kernel);
    this.compositor = new Compositor(settings);
    this.maxCanvasPixels = settings.maxCanvasPixels();
  }

  /** Validates a requested canvas before anything is allocated for it. */
  public CanvasSize canvas(int width, int height) {
    CanvasSize canvas = new CanvasSize(width, height);
    requireWithinLimit(canvas);
    return canvas;
  }

  public EncodedImage render(List<WeightedPoint> points, int width, int height,
      byte[] background) {
    canvas(width, height);
    BufferedImage decoded = background == null ? null : RasterDecoder.decode(background);
    return render(points, width, height, decoded);
  }

  public EncodedImage render(List<WeightedPoint> points, int width, int height,
      BufferedImage background) {
    long start = System.nanoTime();
    CanvasSize canvas = canvas(width, height);
    List<WeightedPoint> safePoints = points == null ? List.of() : points;

    BufferedImage composite = compositeOf(safePoints, canvas, background);
    EncodedImage encoded = PngEncoder.encode(composite);

    if (log.isDebugEnabled()) {
      log.debug("Rendered heatmap {} from {} points (background={}) into {} bytes in {} ms",
          canvas, safePoints.size(), background != null, encoded.length(),
          (System.nanoTime() - start) / 1_000_000);
    }
    return encoded;
  }

  public BufferedImage compositeOf(List<WeightedPoint> points, CanvasSize canvas,
      BufferedImage background) {
    requireWithinLimit(canvas);
    DensityField density = accumulator.accumulate(points, canvas);
    return compositor.composite(density, background, canvas);
  }

  private void requireWithinLimit(CanvasSize canvas) {
    if (canvas.pixels() > maxCanvasPixels) {
      throw new InvalidDimensionsException("Canvas " + canvas + " has " + canvas.pixels()
          + " pixels; at most " + maxCanvasPixels + " are allowed.");
    }
  }
}
