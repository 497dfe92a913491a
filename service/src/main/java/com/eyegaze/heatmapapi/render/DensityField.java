package com.eyegaze.heatmapapi.render;

import java.util.Arrays;

/** Accumulated splat density, {@code height x width}, row-major. Read-only once built. */
public final class DensityField {
  // Largest array length the JVM reliably allocates.
  static final int MAX_CELLS = Integer.MAX_VALUE - 8;

  private final int width;
  private final int height;
  private final double[] cells;

  DensityField(int width, int height, double[] cells) {
    if (cells.length != (long) width * height) {
      throw new IllegalArgumentException("expected " + ((long) width * height) + " cells, got "
          + cells.length);
    }
    this.width = width;
    this.height = height;
    this.cells = cells;
  }

  public static DensityField empty(CanvasSize canvas) {
    return new DensityField(canvas.width(), canvas.height(),
        new double[cellCount(canvas.width(), canvas.height())]);
  }

  /** Cell count of a {@code width x height} grid; fails with 2001 when no array can hold it. */
  static int cellCount(long width, long height) {
    if (width > MAX_CELLS || height > MAX_CELLS || width * height > MAX_CELLS) {
      throw new InvalidDimensionsException("A " + width + "x" + height
          + " density grid exceeds the largest supported buffer of " + MAX_CELLS + " cells.");
    }
    return (int) (width * height);
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public double get(int x, int y) {
    return cells[y * width + x];
  }

  public double sum() {
    double total = 0d;
    for (double c : cells) {
      total += c;
    }
    return total;
  }

  public double max() {
    double max = Double.NEGATIVE_INFINITY;
    for (double c : cells) {
      if (c > max) {
        max = c;
      }
    }
    return max;
  }

  public boolean hasPositive() {
    for (double c : cells) {
      if (c > 0d) {
        return true;
      }
    }
    return false;
  }

  /** Mean over strictly positive cells, or 0 when there are none. */
  public double meanOfPositive() {
    double total = 0d;
    long count = 0;
    for (double c : cells) {
      if (c > 0d) {
        total += c;
        count++;
      }
    }
    return count == 0 ? 0d : total / count;
  }

  public DensityField plus(DensityField other) {
    if (other.width != width || other.height != height) {
      throw new IllegalArgumentException("cannot add a " + other.width + "x" + other.height
          + " field to a " + width + "x" + height + " field");
    }
    double[] out = new double[cells.length];
    for (int i = 0; i < out.length; i++) {
      out[i] = cells[i] + other.cells[i];
    }
    return new DensityField(width, height, out);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DensityField that)) {
      return false;
    }
    return width == that.width && height == that.height && Arrays.equals(cells, that.cells);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * width + height) + Arrays.hashCode(cells);
  }
}
