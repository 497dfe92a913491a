package com.eyegaze.heatmapapi.render;

// Canvas pixel space, origin top-left, y grows downward.
public record WeightedPoint(int x, int y, double weight) {

  public static WeightedPoint of(int x, int y) {
    return new WeightedPoint(x, y, 1d);
  }
}
