package com.eyegaze.heatmapapi.render;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Layers a background and the colour-mapped density onto a transparent ARGB canvas.
 *
 * <p>Layer one is the background at {@code alphaBackground} (or the configured empty base).
 * Layer two is drawn only when some cell is positive: cells below
 * {@code maskFraction * mean(positive cells)} stay transparent, the rest are normalised between
 * the smallest and largest visible value, colour-mapped, smoothed and blended at
 * {@code alphaHeatmap}.
 */
public class Compositor {
  private final RenderSettings settings;

  public Compositor(RenderSettings settings) {
    this.settings = settings;
  }

  public BufferedImage composite(DensityField density, BufferedImage background,
      CanvasSize canvas) {
    if (density.width() != canvas.width() || density.height() != canvas.height()) {
      throw new IllegalArgumentException("density field is " + density.width() + "x"
          + density.height() + " but the canvas is " + canvas);
    }
    if (background != null
        && (background.getWidth() != canvas.width() || background.getHeight() != canvas.height())) {
      throw new BackgroundSizeMismatchException(background.getWidth(), background.getHeight(),
          canvas);
    }

    BufferedImage out = new BufferedImage(canvas.width(), canvas.height(),
        BufferedImage.TYPE_INT_ARGB);
    Graphics2D g = out.createGraphics();
    try {
      drawBase(g, background, canvas);
      if (density.hasPositive()) {
        BufferedImage layer = settings.smoothing().apply(heatmapLayer(density));
        g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER,
            settings.alphaHeatmap()));
        g.drawImage(layer, 0, 0, null);
      }
    } finally {
      g.dispose();
    }
    return out;
  }

  private void drawBase(Graphics2D g, BufferedImage background, CanvasSize canvas) {
    if (background != null) {
      g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER,
          settings.alphaBackground()));
      g.drawImage(background, 0, 0, null);
    } else if (settings.emptyBase() == RenderSettings.EmptyBase.BLACK) {
      g.setComposite(AlphaComposite.Src);
      g.setColor(Color.BLACK);
      g.fillRect(0, 0, canvas.width(), canvas.height());
    }
  }

  BufferedImage heatmapLayer(DensityField density) {
    int width = density.width();
    int height = density.height();
    // With a positive mask fraction, zero and negative cells always fall below lowbound.
    double lowbound = density.meanOfPositive() * settings.maskFraction();

    double vmin = Double.POSITIVE_INFINITY;
    double vmax = Double.NEGATIVE_INFINITY;
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        double v = density.get(x, y);
        if (v >= lowbound) {
          vmin = Math.min(vmin, v);
          vmax = Math.max(vmax, v);
        }
      }
    }
    double span = vmax - vmin;

    Colormap colormap = settings.colormap();
    int[] argb = new int[width * height];
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        double v = density.get(x, y);
        if (v < lowbound) {
          continue;
        }
        double t = span > 0d ? (v - vmin) / span : 0d;
        argb[y * width + x] = 0xFF000000 | colormap.rgb(t);
      }
    }
    BufferedImage layer = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    layer.setRGB(0, 0, width, height, argb, 0, width);
    return layer;
  }
}
