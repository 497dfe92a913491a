package com.eyegaze.heatmapapi.render;

import java.util.Arrays;
import java.util.Base64;

/** PNG bytes plus their base64 form for JSON payloads. */
public record EncodedImage(byte[] bytes, String base64) {

  public EncodedImage {
    bytes = bytes.clone();
  }

  public static EncodedImage of(byte[] bytes) {
    return new EncodedImage(bytes, Base64.getEncoder().encodeToString(bytes));
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  public int length() {
    return bytes.length;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof EncodedImage that && Arrays.equals(bytes, that.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "EncodedImage[" + bytes.length + " bytes]";
  }
}
