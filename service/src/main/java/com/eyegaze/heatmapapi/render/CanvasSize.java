package com.eyegaze.heatmapapi.render;

public record CanvasSize(int width, int height) {

  public CanvasSize {
    if (width <= 0 || height <= 0) {
      throw new InvalidDimensionsException(width, height);
    }
  }

  public long pixels() {
    return (long) width * height;
  }

  public boolean contains(int x, int y) {
    return x > 0 && x < width && y > 0 && y < height;
  }

  @Override
  public String toString() {
    return width + "x" + height;
  }
}
