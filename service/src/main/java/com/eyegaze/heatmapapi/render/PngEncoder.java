package com.eyegaze.heatmapapi.render;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;

public final class PngEncoder {
  private PngEncoder() {
  }

  public static EncodedImage encode(BufferedImage raster) {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    try {
      if (!ImageIO.write(raster, "png", buffer)) {
        throw new EncodeFailureException("No PNG writer available for image type "
            + raster.getType() + ".");
      }
    } catch (IOException ex) {
      throw new EncodeFailureException("Failed to encode heatmap as PNG: " + ex.getMessage(), ex);
    }
    return EncodedImage.of(buffer.toByteArray());
  }
}
