package com.eyegaze.heatmapapi.render;

public abstract class HeatmapRenderException extends RuntimeException {
  private final int errorCode;

  protected HeatmapRenderException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  protected HeatmapRenderException(String message, int errorCode, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public int errorCode() {
    return errorCode;
  }
}
