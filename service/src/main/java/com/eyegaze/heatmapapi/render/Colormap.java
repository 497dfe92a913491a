package com.eyegaze.heatmapapi.render;

/** Maps a normalised intensity in {@code [0, 1]} to an opaque RGB colour. */
public interface Colormap {

  String name();

  /** Packed {@code 0xRRGGBB}; inputs outside {@code [0, 1]} are clamped. */
  int rgb(double t);
}
