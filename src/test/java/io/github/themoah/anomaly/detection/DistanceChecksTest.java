package io.github.themoah.anomaly.detection;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for DistanceChecks.
 */
public class DistanceChecksTest {

  private static final double EPS = 1e-12;

  @Test
  void checkStat_insideBand_isFraction() {
    // band = 3 * 2 = 6, distance 3
    assertEquals(0.5, DistanceChecks.checkStat(13, 10, 2, 3), EPS);
    assertEquals(0.5, DistanceChecks.checkStat(7, 10, 2, 3), EPS);
    assertEquals(0.0, DistanceChecks.checkStat(10, 10, 2, 3), EPS);
  }

  @Test
  void checkStat_onOrBeyondBand_isOne() {
    assertEquals(1.0, DistanceChecks.checkStat(16, 10, 2, 3), EPS);
    assertEquals(1.0, DistanceChecks.checkStat(1000, 10, 2, 3), EPS);
  }

  @Test
  void checkStat_zeroDistance() {
    assertEquals(0.0, DistanceChecks.checkStat(5, 5, 0, 3), EPS);
    assertEquals(1.0, DistanceChecks.checkStat(5.0001, 5, 0, 3), EPS);
  }

  @Test
  void checkSd_andCheckMad_useThreeByDefault() {
    assertEquals(1.0 / 3.0, DistanceChecks.checkSd(11, 10, 1), EPS);
    assertEquals(2.0 / 3.0, DistanceChecks.checkMad(8, 10, 1), EPS);
    assertEquals(0.5, DistanceChecks.checkSd(11, 10, 1, 2), EPS);
  }

  @Test
  void checkIqr_insideQuartiles_isZero() {
    // median 5, p25 3, p75 7, iqr 4
    assertEquals(0.0, DistanceChecks.checkIqr(4, 5, 3, 7, 4), EPS);
    assertEquals(0.0, DistanceChecks.checkIqr(6, 5, 3, 7, 4), EPS);
    assertEquals(0.0, DistanceChecks.checkIqr(5, 5, 3, 7, 4), EPS);
  }

  @Test
  void checkIqr_measuresFromNearestQuartile() {
    // band = 1.5 * 4 = 6
    assertEquals(0.5, DistanceChecks.checkIqr(10, 5, 3, 7, 4), EPS);
    assertEquals(0.5, DistanceChecks.checkIqr(0, 5, 3, 7, 4), EPS);
    assertEquals(1.0, DistanceChecks.checkIqr(13, 5, 3, 7, 4), EPS);
    assertEquals(1.0, DistanceChecks.checkIqr(-100, 5, 3, 7, 4), EPS);
  }

  @Test
  void checkIqr_onQuartileBoundary_isZero() {
    assertEquals(0.0, DistanceChecks.checkIqr(3, 5, 3, 7, 4), EPS);
    assertEquals(0.0, DistanceChecks.checkIqr(7, 5, 3, 7, 4), EPS);
  }

  @Test
  void checkIqr_zeroIqr() {
    assertEquals(1.0, DistanceChecks.checkIqr(9, 5, 5, 5, 0), EPS);
    assertEquals(0.0, DistanceChecks.checkIqr(5, 5, 5, 5, 0), EPS);
  }
}
