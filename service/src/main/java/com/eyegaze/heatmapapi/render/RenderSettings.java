package com.eyegaze.heatmapapi.render;

/**
 * Fixed render configuration. {@code maskFraction} scales the mean positive density into the
 * visibility cutoff; {@code emptyBase} is the base layer used when no background is supplied.
 * {@code maxCanvasPixels} caps {@code width * height} of a single render.
 */
public record RenderSettings(
    int kernelSize,
    float alphaBackground,
    float alphaHeatmap,
    Colormap colormap,
    double maskFraction,
    SmoothingFilter smoothing,
    EmptyBase emptyBase,
    long maxCanvasPixels
) {

  // 4096 x 4096
  public static final long DEFAULT_MAX_CANVAS_PIXELS = 16_777_216L;

  public enum EmptyBase {
    BLACK,
    TRANSPARENT
  }

  public RenderSettings {
    if (kernelSize <= 0) {
      throw new IllegalArgumentException("kernelSize must be positive, got " + kernelSize);
    }
    requireUnit("alphaBackground", alphaBackground);
    requireUnit("alphaHeatmap", alphaHeatmap);
    requireUnit("maskFraction", maskFraction);
    if (colormap == null || smoothing == null || emptyBase == null) {
      throw new IllegalArgumentException("colormap, smoothing and emptyBase are required");
    }
    if (maxCanvasPixels <= 0) {
      throw new IllegalArgumentException("maxCanvasPixels must be positive, got "
          + maxCanvasPixels);
    }
  }

  public RenderSettings(int kernelSize, float alphaBackground, float alphaHeatmap,
      Colormap colormap, double maskFraction, SmoothingFilter smoothing, EmptyBase emptyBase) {
    this(kernelSize, alphaBackground, alphaHeatmap, colormap, maskFraction, smoothing, emptyBase,
        DEFAULT_MAX_CANVAS_PIXELS);
  }

  public static RenderSettings defaults() {
    return new RenderSettings(KernelGenerator.DEFAULT_SIZE, 0.8f, 0.8f, Colormaps.TURBO, 0.5,
        SmoothingFilters.GAUSSIAN, EmptyBase.BLACK);
  }

  public RenderSettings withEmptyBase(EmptyBase base) {
    return new RenderSettings(kernelSize, alphaBackground, alphaHeatmap, colormap, maskFraction,
        smoothing, base, maxCanvasPixels);
  }

  public RenderSettings withSmoothing(SmoothingFilter filter) {
    return new RenderSettings(kernelSize, alphaBackground, alphaHeatmap, colormap, maskFraction,
        filter, emptyBase, maxCanvasPixels);
  }

  public RenderSettings withMaxCanvasPixels(long pixels) {
    return new RenderSettings(kernelSize, alphaBackground, alphaHeatmap, colormap, maskFraction,
        smoothing, emptyBase, pixels);
  }

  private static void requireUnit(String name, double value) {
    if (!(value >= 0d && value <= 1d)) {
      throw new IllegalArgumentException(name + " must be within [0, 1], got " + value);
    }
  }
}
