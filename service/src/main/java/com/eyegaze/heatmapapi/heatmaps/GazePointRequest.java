package com.eyegaze.heatmapapi.heatmaps;

import com.eyegaze.heatmapapi.render.WeightedPoint;

// Weight is optional; recorded gaze carries no dwell time, so it defaults to 1.
public record GazePointRequest(int x, int y, Double weight) {

  public WeightedPoint toWeightedPoint() {
    return new WeightedPoint(x, y, weight == null ? 1d : weight);
  }
}
