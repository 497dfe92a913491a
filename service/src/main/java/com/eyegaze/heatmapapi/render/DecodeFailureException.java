package com.eyegaze.heatmapapi.render;

public class DecodeFailureException extends HeatmapRenderException {
  public static final int ERROR_CODE = 2003;

  public DecodeFailureException(String message) {
    super(message, ERROR_CODE);
  }

  public DecodeFailureException(String message, Throwable cause) {
    super(message, ERROR_CODE, cause);
  }
}
