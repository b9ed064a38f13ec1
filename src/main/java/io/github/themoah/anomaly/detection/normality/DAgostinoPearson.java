package io.github.themoah.anomaly.detection.normality;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;

/**
 * D'Agostino-Pearson omnibus K² test, combining a skewness test and a kurtosis test.
 * K² follows a chi-squared distribution with 2 degrees of freedom under normality.
 */
public final class DAgostinoPearson {

  public static final String NAME = "dagostino_pearson";
  public static final int MIN_SAMPLES = 8;

  private static final ChiSquaredDistribution CHI_SQUARED_2 = new ChiSquaredDistribution(2);

  private DAgostinoPearson() {}

  public static NormalityVerdict test(double[] values, double alpha) {
    int n = values.length;
    if (n < MIN_SAMPLES) {
      return NormalityVerdict.skipped(NAME,
        "D'Agostino-Pearson skipped: needs at least " + MIN_SAMPLES + " points, got " + n + "; assuming normal.");
    }
    if (!NormalityTester.hasVariance(values)) {
      return NormalityVerdict.skipped(NAME, "D'Agostino-Pearson skipped: data has no variance.");
    }

    double[] moments = centralMoments(values);
    double zSkew = skewnessZ(moments, n);
    double zKurt = kurtosisZ(moments, n);
    double k2 = zSkew * zSkew + zKurt * zKurt;
    double p = 1.0 - CHI_SQUARED_2.cumulativeProbability(k2);
    boolean passes = p > alpha;

    return NormalityVerdict.of(NAME, passes, String.format(
      "D'Agostino-Pearson K2=%.4f (z_skew=%.3f, z_kurt=%.3f), p=%.4g; %s at alpha=%.2f.",
      k2, zSkew, zKurt, p, passes ? "cannot reject normality" : "data is not normally distributed", alpha));
  }

  /**
   * Biased central moments.
   *
   * @return {m2, m3, m4}
   */
  static double[] centralMoments(double[] values) {
    double mean = 0.0;
    for (double v : values) {
      mean += v;
    }
    mean /= values.length;

    double m2 = 0.0;
    double m3 = 0.0;
    double m4 = 0.0;
    for (double v : values) {
      double d = v - mean;
      double d2 = d * d;
      m2 += d2;
      m3 += d2 * d;
      m4 += d2 * d2;
    }
    return new double[] {m2 / values.length, m3 / values.length, m4 / values.length};
  }

  // n is a double: n * n overflows int from 46341 points
  static double skewnessZ(double[] moments, double n) {
    double b1 = moments[1] / Math.pow(moments[0], 1.5);
    double y = b1 * Math.sqrt((n + 1.0) * (n + 3.0) / (6.0 * (n - 2.0)));
    double beta2 = 3.0 * (n * n + 27.0 * n - 70.0) * (n + 1.0) * (n + 3.0)
      / ((n - 2.0) * (n + 5.0) * (n + 7.0) * (n + 9.0));
    double w2 = -1.0 + Math.sqrt(2.0 * (beta2 - 1.0));
    double delta = 1.0 / Math.sqrt(0.5 * Math.log(w2));
    double alpha = Math.sqrt(2.0 / (w2 - 1.0));
    double ratio = y / alpha;
    return delta * Math.log(ratio + Math.sqrt(ratio * ratio + 1.0));
  }

  static double kurtosisZ(double[] moments, double n) {
    double b2 = moments[2] / (moments[0] * moments[0]);
    double expected = 3.0 * (n - 1.0) / (n + 1.0);
    double variance = 24.0 * n * (n - 2.0) * (n - 3.0) / ((n + 1.0) * (n + 1.0) * (n + 3.0) * (n + 5.0));
    double x = (b2 - expected) / Math.sqrt(variance);
    double sqrtBeta1 = 6.0 * (n * n - 5.0 * n + 2.0) / ((n + 7.0) * (n + 9.0))
      * Math.sqrt(6.0 * (n + 3.0) * (n + 5.0) / (n * (n - 2.0) * (n - 3.0)));
    double a = 6.0 + 8.0 / sqrtBeta1 * (2.0 / sqrtBeta1 + Math.sqrt(1.0 + 4.0 / (sqrtBeta1 * sqrtBeta1)));
    double term1 = 1.0 - 2.0 / (9.0 * a);
    double denom = 1.0 + x * Math.sqrt(2.0 / (a - 4.0));
    double term2 = denom == 0.0
      ? 99.0
      : Math.signum(denom) * Math.cbrt((1.0 - 2.0 / a) / Math.abs(denom));
    return (term1 - term2) / Math.sqrt(2.0 / (9.0 * a));
  }
}
