package io.github.themoah.anomaly.detection;

/**
 * Distance-from-middle checks used by the scoring ensemble.
 *
 * <p>Each check returns a score in [0, 1]: the distance of a value from a midpoint expressed
 * as a fraction of an allowed band (n * distance). Anything on or beyond the band scores 1.0.
 */
public final class DistanceChecks {

  public static final double DEFAULT_SD_MULTIPLIER = 3.0;
  public static final double DEFAULT_MAD_MULTIPLIER = 3.0;
  public static final double DEFAULT_IQR_MULTIPLIER = 1.5;

  private DistanceChecks() {}

  /**
   * Scores a value against a band of n * distance around a midpoint.
   *
   * <p>A zero distance means the data has no spread: any value away from the midpoint
   * scores 1.0 and the midpoint itself scores 0.0.
   *
   * @param value the value to score
   * @param midpoint centre of the band
   * @param distance spread measure
   * @param n number of spreads that make up the band
   * @return score in [0, 1]
   */
  public static double checkStat(double value, double midpoint, double distance, double n) {
    double delta = Math.abs(value - midpoint);
    if (distance == 0.0) {
      return value != midpoint ? 1.0 : 0.0;
    }
    double band = n * distance;
    if (delta < band) {
      return delta / band;
    }
    return 1.0;
  }

  public static double checkSd(double value, double mean, double sd) {
    return checkSd(value, mean, sd, DEFAULT_SD_MULTIPLIER);
  }

  public static double checkSd(double value, double mean, double sd, double k) {
    return checkStat(value, mean, sd, k);
  }

  public static double checkMad(double value, double median, double mad) {
    return checkMad(value, median, mad, DEFAULT_MAD_MULTIPLIER);
  }

  public static double checkMad(double value, double median, double mad, double k) {
    return checkStat(value, median, mad, k);
  }

  public static double checkIqr(double value, double median, double p25, double p75, double iqr) {
    return checkIqr(value, median, p25, p75, iqr, DEFAULT_IQR_MULTIPLIER);
  }

  /**
   * Asymmetric interquartile check. Values below the median are measured from p25, values
   * at or above it from p75. Anything strictly inside (p25, p75) scores 0.0.
   */
  public static double checkIqr(double value, double median, double p25, double p75, double iqr, double k) {
    if (value < median) {
      if (value > p25) {
        return 0.0;
      }
      return checkStat(value, p25, iqr, k);
    }
    if (value < p75) {
      return 0.0;
    }
    return checkStat(value, p75, iqr, k);
  }
}
