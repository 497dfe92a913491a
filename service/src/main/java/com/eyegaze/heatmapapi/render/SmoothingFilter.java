package com.eyegaze.heatmapapi.render;

import java.awt.image.BufferedImage;

/** Softens cell boundaries of the rasterised heatmap layer before it is blended. */
public interface SmoothingFilter {

  String name();

  /** Returns a filtered image of the same size; the input is not modified. */
  BufferedImage apply(BufferedImage layer);
}
