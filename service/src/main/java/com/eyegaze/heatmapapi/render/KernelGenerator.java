package com.eyegaze.heatmapapi.render;

public final class KernelGenerator {
  public static final int DEFAULT_SIZE = 200;

  private KernelGenerator() {
  }

  public static Kernel forSize(int size) {
    return generate(size, size / 6d);
  }

  /**
   * Cell {@code (i, j)} holds {@code exp(-((i - c)^2 + (j - c)^2) / (2 * stddev^2))} with
   * {@code c = size / 2}. The 2-D Gaussian is separable, so the grid is the outer product of one
   * 1-D profile with itself.
   */
  public static Kernel generate(int size, double stddev) {
    if (size <= 0) {
      throw new IllegalArgumentException("kernel size must be positive, got " + size);
    }
    if (!(stddev > 0d)) {
      throw new IllegalArgumentException("kernel stddev must be positive, got " + stddev);
    }
    int center = size / 2;
    double twoVariance = 2d * stddev * stddev;
    double[] profile = new double[size];
    for (int i = 0; i < size; i++) {
      double d = i - center;
      profile[i] = Math.exp(-(d * d) / twoVariance);
    }
    double[] cells = new double[size * size];
    for (int row = 0; row < size; row++) {
      double rowValue = profile[row];
      int offset = row * size;
      for (int col = 0; col < size; col++) {
        cells[offset + col] = rowValue * profile[col];
      }
    }
    return new Kernel(size, stddev, cells);
  }
}
