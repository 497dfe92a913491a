package com.eyegaze.heatmapapi.render;

public class BackgroundSizeMismatchException extends HeatmapRenderException {
  public static final int ERROR_CODE = 2002;

  public BackgroundSizeMismatchException(int backgroundWidth, int backgroundHeight,
      CanvasSize canvas) {
    super("Background is " + backgroundWidth + "x" + backgroundHeight
        + " but the canvas is " + canvas + ".", ERROR_CODE);
  }
}
