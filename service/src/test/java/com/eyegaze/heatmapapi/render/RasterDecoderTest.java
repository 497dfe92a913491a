package com.eyegaze.heatmapapi.render;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;

class RasterDecoderTest {

  @Test
  void decodesPngIntoArgb() throws Exception {
    BufferedImage decoded = RasterDecoder.decode(pngBytes(8, 5, 0x123456));

    assertEquals(BufferedImage.TYPE_INT_ARGB, decoded.getType());
    assertEquals(8, decoded.getWidth());
    assertEquals(5, decoded.getHeight());
    assertEquals(0xFF123456, decoded.getRGB(3, 2));
  }

  @Test
  void acceptsDataUrlPrefix() throws Exception {
    String dataUrl = "data:image/png;base64,"
        + Base64.getEncoder().encodeToString(pngBytes(3, 3, 0xABCDEF));

    assertEquals(0xFFABCDEF, RasterDecoder.decodeBase64(dataUrl).getRGB(1, 1));
  }

  @Test
  void malformedBytesAreADecodeFailure() {
    byte[] garbage = "definitely not an image".getBytes(StandardCharsets.UTF_8);

    DecodeFailureException ex =
        assertThrows(DecodeFailureException.class, () -> RasterDecoder.decode(garbage));
    assertEquals(DecodeFailureException.ERROR_CODE, ex.errorCode());
  }

  @Test
  void emptyInputIsADecodeFailure() {
    assertThrows(DecodeFailureException.class, () -> RasterDecoder.decode(new byte[0]));
    assertThrows(DecodeFailureException.class, () -> RasterDecoder.decode(null));
    assertThrows(DecodeFailureException.class, () -> RasterDecoder.decodeBase64("  "));
  }

  @Test
  void fitResamplesOnlyWhenSizesDiffer() throws Exception {
    BufferedImage source = RasterDecoder.decode(pngBytes(10, 10, 0x00FF00));

    assertSame(source, RasterDecoder.fit(source, new CanvasSize(10, 10)));

    BufferedImage fitted = RasterDecoder.fit(source, new CanvasSize(40, 25));
    assertEquals(40, fitted.getWidth());
    assertEquals(25, fitted.getHeight());
    assertEquals(0xFF00FF00, fitted.getRGB(20, 12));
  }

  static byte[] pngBytes(int width, int height, int rgb) throws Exception {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        image.setRGB(x, y, rgb);
      }
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ImageIO.write(image, "png", out);
    return out.toByteArray();
  }
}
