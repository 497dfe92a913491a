package com.eyegaze.heatmapapi.render;

import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;
import java.util.Locale;

public final class SmoothingFilters {
  public static final SmoothingFilter NONE = new SmoothingFilter() {
    @Override
    public String name() {
      return "none";
    }

    @Override
    public BufferedImage apply(BufferedImage layer) {
      return layer;
    }
  };

  public static final SmoothingFilter GAUSSIAN = gaussian(2, 1.0);

  private SmoothingFilters() {
  }

  public static SmoothingFilter byName(String name) {
    String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    return switch (key) {
      case "gaussian" -> GAUSSIAN;
      case "none", "nearest" -> NONE;
      default -> throw new IllegalArgumentException(
          "Unknown smoothing filter '" + name + "'. Supported values: gaussian,none.");
    };
  }

  /**
   * Normalised Gaussian convolution of side {@code 2 * radius + 1}. Runs on premultiplied
   * pixels so transparent neighbours do not bleed their colour into the edge of a blob.
   */
  public static SmoothingFilter gaussian(int radius, double sigma) {
    int side = 2 * radius + 1;
    float[] weights = new float[side * side];
    double total = 0d;
    for (int y = -radius; y <= radius; y++) {
      for (int x = -radius; x <= radius; x++) {
        double w = Math.exp(-(x * x + y * y) / (2 * sigma * sigma));
        weights[(y + radius) * side + (x + radius)] = (float) w;
        total += w;
      }
    }
    for (int i = 0; i < weights.length; i++) {
      weights[i] = (float) (weights[i] / total);
    }
    ConvolveOp op = new ConvolveOp(new Kernel(side, side, weights), ConvolveOp.EDGE_NO_OP, null);

    return new SmoothingFilter() {
      @Override
      public String name() {
        return "gaussian";
      }

      @Override
      public BufferedImage apply(BufferedImage layer) {
        BufferedImage premultiplied = Rasters.copy(layer, BufferedImage.TYPE_INT_ARGB_PRE);
        BufferedImage out = new BufferedImage(layer.getWidth(), layer.getHeight(),
            BufferedImage.TYPE_INT_ARGB_PRE);
        return op.filter(premultiplied, out);
      }
    };
  }
}
