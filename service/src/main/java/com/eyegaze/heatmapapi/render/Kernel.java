package com.eyegaze.heatmapapi.render;

/**
 * Square Gaussian splat template. Built once by {@link KernelGenerator} and shared by every
 * render, so the backing array never escapes.
 */
public final class Kernel {
  private final int size;
  private final double stddev;
  private final double[] cells;

  Kernel(int size, double stddev, double[] cells) {
    this.size = size;
    this.stddev = stddev;
    this.cells = cells;
  }

  public int size() {
    return size;
  }

  public double stddev() {
    return stddev;
  }

  public int center() {
    return size / 2;
  }

  public double get(int row, int col) {
    return cells[row * size + col];
  }

  public double sum() {
    double total = 0d;
    for (double c : cells) {
      total += c;
    }
    return total;
  }

  // Raw row-major access for the accumulator inner loop.
  double cell(int index) {
    return cells[index];
  }
}
