package com.eyegaze.heatmapapi.render;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class KernelGeneratorTest {

  @Test
  void defaultKernelUsesSixthOfSizeAsStddev() {
    Kernel kernel = KernelGenerator.forSize(200);

    assertEquals(200, kernel.size());
    assertEquals(200 / 6d, kernel.stddev());
    assertEquals(100, kernel.center());
  }

  @Test
  void peakIsOneAtCentreAndIsTheMaximum() {
    Kernel kernel = KernelGenerator.forSize(200);
    int c = kernel.center();

    assertEquals(1.0, kernel.get(c, c));
    for (int row = 0; row < kernel.size(); row++) {
      for (int col = 0; col < kernel.size(); col++) {
        assertTrue(kernel.get(row, col) <= 1.0);
      }
    }
  }

  @Test
  void symmetricUnderHalfTurnAboutCentre() {
    Kernel kernel = KernelGenerator.generate(40, 7.5);
    int c = kernel.center();

    for (int d = -(c - 1); d < c; d++) {
      for (int e = -(c - 1); e < c; e++) {
        assertEquals(kernel.get(c + d, c + e), kernel.get(c - d, c - e));
        assertEquals(kernel.get(c + d, c + e), kernel.get(c + e, c + d));
      }
    }
  }

  @Test
  void nonIncreasingAwayFromCentre() {
    Kernel kernel = KernelGenerator.forSize(60);
    int c = kernel.center();

    for (int col = c + 1; col < kernel.size(); col++) {
      assertTrue(kernel.get(c, col) <= kernel.get(c, col - 1));
    }
    for (int d = 1; d < c; d++) {
      assertTrue(kernel.get(c + d, c + d) <= kernel.get(c + d - 1, c + d - 1));
    }
  }

  @Test
  void oddSizesStillPeakAtOne() {
    Kernel kernel = KernelGenerator.forSize(7);

    assertEquals(3, kernel.center());
    assertEquals(1.0, kernel.get(3, 3));
    assertEquals(kernel.get(0, 0), kernel.get(6, 6));
  }

  @Test
  void matchesClosedFormGaussian() {
    Kernel kernel = KernelGenerator.generate(20, 4.0);

    double expected = Math.exp(-((3 - 10) * (3 - 10) + (15 - 10) * (15 - 10)) / (2 * 16.0));
    assertEquals(expected, kernel.get(3, 15), 1e-12);
  }

  @Test
  void rejectsNonPositiveArguments() {
    assertThrows(IllegalArgumentException.class, () -> KernelGenerator.generate(0, 1.0));
    assertThrows(IllegalArgumentException.class, () -> KernelGenerator.generate(10, 0.0));
    assertThrows(IllegalArgumentException.class, () -> KernelGenerator.generate(10, Double.NaN));
  }
}
