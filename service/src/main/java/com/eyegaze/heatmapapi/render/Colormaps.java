package com.eyegaze.heatmapapi.render;

import java.util.Locale;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

public final class Colormaps {
  public static final String DEFAULT = "turbo";

  // Polynomial fit of the Turbo map (Mikhailov, Google AI, 2019).
  public static final Colormap TURBO = of("turbo",
      t -> 0.13572138 + t * (4.61539260 + t * (-42.66032258 + t * (132.13108234
          + t * (-152.94239396 + t * 59.28637943)))),
      t -> 0.09140261 + t * (2.19418839 + t * (4.84296658 + t * (-14.18503333
          + t * (4.27729857 + t * 2.82956604)))),
      t -> 0.10667330 + t * (12.64194608 + t * (-60.58204836 + t * (110.36276771
          + t * (-89.90310912 + t * 27.34824973)))));

  public static final Colormap JET = of("jet",
      t -> 1.5 - Math.abs(4 * t - 3),
      t -> 1.5 - Math.abs(4 * t - 2),
      t -> 1.5 - Math.abs(4 * t - 1));

  public static final Colormap HOT = of("hot",
      t -> 3 * t,
      t -> 3 * t - 1,
      t -> 3 * t - 2);

  public static final Colormap GRAY = of("gray", t -> t, t -> t, t -> t);

  private static final Map<String, Colormap> BY_NAME = Map.of(
      TURBO.name(), TURBO,
      JET.name(), JET,
      HOT.name(), HOT,
      GRAY.name(), GRAY);

  private Colormaps() {
  }

  public static Colormap byName(String name) {
    Colormap map = name == null ? null : BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
    if (map == null) {
      throw new IllegalArgumentException(
          "Unknown colormap '" + name + "'. Supported values: " + String.join(",",
              BY_NAME.keySet().stream().sorted().toList()) + ".");
    }
    return map;
  }

  private static Colormap of(String name, DoubleUnaryOperator red, DoubleUnaryOperator green,
      DoubleUnaryOperator blue) {
    return new Colormap() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public int rgb(double t) {
        double x = clamp01(t);
        return (channel(red.applyAsDouble(x)) << 16)
            | (channel(green.applyAsDouble(x)) << 8)
            | channel(blue.applyAsDouble(x));
      }

      @Override
      public String toString() {
        return name;
      }
    };
  }

  private static int channel(double v) {
    return (int) Math.round(255 * clamp01(v));
  }

  private static double clamp01(double x) {
    return x <= 0 ? 0 : Math.min(1, x);
  }
}
