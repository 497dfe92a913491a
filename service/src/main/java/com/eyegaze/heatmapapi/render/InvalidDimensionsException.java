package com.eyegaze.heatmapapi.render;

public class InvalidDimensionsException extends HeatmapRenderException {
  public static final int ERROR_CODE = 2001;

  public InvalidDimensionsException(int width, int height) {
    super("Canvas width and height must be positive, got " + width + "x" + height + ".",
        ERROR_CODE);
  }

  public InvalidDimensionsException(String message) {
    super(message, ERROR_CODE);
  }
}
