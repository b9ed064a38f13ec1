package io.github.themoah.anomaly.detection.normality;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for the Shapiro-Wilk test.
 */
public class ShapiroWilkTest {

  @Test
  void statistic_matchesReferenceValues() {
    double[] result = ShapiroWilk.statistic(NormalitySamples.sequence(10));

    assertEquals(0.97016, result[0], 1e-4);
    assertEquals(0.89237, result[1], 1e-3);
  }

  @Test
  void twentyPoints_statistic() {
    double[] result = ShapiroWilk.statistic(NormalitySamples.sequence(20));

    assertEquals(0.96038, result[0], 1e-4);
    assertEquals(0.5514, result[1], 1e-3);
  }

  @Test
  void normalSample_passes() {
    NormalityVerdict verdict = ShapiroWilk.test(NormalitySamples.normal(50), 0.05);

    assertTrue(verdict.passes());
    assertFalse(verdict.skipped());
    assertEquals(ShapiroWilk.NAME, verdict.test());
  }

  @Test
  void skewedSamples_fail() {
    assertFalse(ShapiroWilk.test(NormalitySamples.exponential(50), 0.05).passes());
    assertFalse(ShapiroWilk.test(NormalitySamples.lognormal(50), 0.05).passes());
    assertFalse(ShapiroWilk.test(new double[] {1, 1, 1, 1, 1, 1, 100}, 0.05).passes());
  }

  @Test
  void threePoints_exactPValue() {
    // evenly spaced three points give W = 1
    double[] result = ShapiroWilk.statistic(new double[] {1, 2, 3});

    assertEquals(1.0, result[0], 1e-12);
    assertEquals(1.0, result[1], 1e-9);
  }

  @Test
  void coefficients_areNormalizedAndDecreasing() {
    double[] a = ShapiroWilk.coefficients(20);
    double sumSquares = 0.0;
    for (int i = 0; i < a.length; i++) {
      sumSquares += 2 * a[i] * a[i];
      if (i > 0) {
        assertTrue(a[i] < a[i - 1]);
      }
    }
    assertEquals(1.0, sumSquares, 1e-6);
  }

  @Test
  void outsideSupportedSizes_skipped() {
    NormalityVerdict tooFew = ShapiroWilk.test(new double[] {1, 2}, 0.05);
    assertTrue(tooFew.skipped());
    assertTrue(tooFew.passes());

    NormalityVerdict tooMany = ShapiroWilk.test(NormalitySamples.exponential(ShapiroWilk.MAX_SAMPLES + 1), 0.05);
    assertTrue(tooMany.skipped());
    assertTrue(tooMany.passes());
  }

  @Test
  void constantData_skipped() {
    assertTrue(ShapiroWilk.test(new double[] {2, 2, 2, 2}, 0.05).skipped());
  }
}
