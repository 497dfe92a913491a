package com.eyegaze.heatmapapi.render;

import java.util.List;

/**
 * Scatters weighted kernel copies onto a padded field and crops it back to the canvas.
 *
 * <p>A point is kept only when it lies strictly inside the canvas. Its kernel window starts at
 * the raw point coordinate in the padded frame; since the padding equals the kernel centre,
 * the crop recentres the splat on the point. Windows near the far edges run past the padded
 * buffer and are clipped there.
 */
public class DensityAccumulator {
  private final Kernel kernel;

  public DensityAccumulator(Kernel kernel) {
    this.kernel = kernel;
  }

  public DensityField accumulate(List<WeightedPoint> points, CanvasSize canvas) {
    int size = kernel.size();
    int pad = size / 2;
    int cells = DensityField.cellCount((long) canvas.width() + 2L * pad,
        (long) canvas.height() + 2L * pad);
    int paddedWidth = canvas.width() + 2 * pad;
    int paddedHeight = canvas.height() + 2 * pad;
    double[] padded = new double[cells];

    for (WeightedPoint p : points) {
      if (!canvas.contains(p.x(), p.y())) {
        continue;
      }
      splat(padded, paddedWidth, paddedHeight, p);
    }

    int width = canvas.width();
    int height = canvas.height();
    double[] cropped = new double[DensityField.cellCount(width, height)];
    for (int row = 0; row < height; row++) {
      System.arraycopy(padded, (row + pad) * paddedWidth + pad, cropped, row * width, width);
    }
    return new DensityField(width, height, cropped);
  }

  private void splat(double[] padded, int paddedWidth, int paddedHeight, WeightedPoint p) {
    int size = kernel.size();
    int rows = Math.min(size, paddedHeight - p.y());
    int cols = Math.min(size, paddedWidth - p.x());
    double weight = p.weight();
    for (int ky = 0; ky < rows; ky++) {
      int target = (p.y() + ky) * paddedWidth + p.x();
      int source = ky * size;
      for (int kx = 0; kx < cols; kx++) {
        padded[target + kx] += kernel.cell(source + kx) * weight;
      }
    }
  }
}
