package com.eyegaze.heatmapapi.render;

public class EncodeFailureException extends HeatmapRenderException {
  public static final int ERROR_CODE = 2004;

  public EncodeFailureException(String message) {
    super(message, ERROR_CODE);
  }

  public EncodeFailureException(String message, Throwable cause) {
    super(message, ERROR_CODE, cause);
  }
}
