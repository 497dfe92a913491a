package com.eyegaze.heatmapapi.render;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Base64;
import javax.imageio.ImageIO;

/** Turns caller-supplied image bytes into ARGB rasters the compositor can draw. */
public final class RasterDecoder {
  private RasterDecoder() {
  }

  public static BufferedImage decode(byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      throw new DecodeFailureException("Background image is empty.");
    }
    BufferedImage image;
    try {
      image = ImageIO.read(new ByteArrayInputStream(bytes));
    } catch (IOException ex) {
      throw new DecodeFailureException("Background image could not be read: " + ex.getMessage(),
          ex);
    }
    if (image == null) {
      throw new DecodeFailureException("Background image is not in a supported format.");
    }
    return Rasters.toArgb(image);
  }

  /** Accepts plain base64 or a {@code data:image/...;base64,} URL. */
  public static BufferedImage decodeBase64(String encoded) {
    return decode(base64Bytes(encoded));
  }

  public static byte[] base64Bytes(String encoded) {
    if (encoded == null || encoded.isBlank()) {
      throw new DecodeFailureException("Background image is empty.");
    }
    String payload = encoded;
    int comma = payload.indexOf(',');
    if (comma >= 0) {
      payload = payload.substring(comma + 1);
    }
    try {
      return Base64.getMimeDecoder().decode(payload.trim());
    } catch (IllegalArgumentException ex) {
      throw new DecodeFailureException("Background image is not valid base64.", ex);
    }
  }

  public static BufferedImage fit(BufferedImage image, CanvasSize canvas) {
    if (image.getWidth() == canvas.width() && image.getHeight() == canvas.height()) {
      return image;
    }
    return Rasters.resize(image, canvas.width(), canvas.height());
  }
}
