package io.github.themoah.anomaly.detection.normality;

import java.util.Arrays;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Shapiro-Wilk W test using Royston's approximation (algorithm AS R94) for the coefficients
 * and the p-value. Valid for 3 to 5000 points.
 */
public final class ShapiroWilk {

  public static final String NAME = "shapiro_wilk";
  public static final int MIN_SAMPLES = 3;
  public static final int MAX_SAMPLES = 5000;

  private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

  private static final double[] C1 = {0.0, 0.221157, -0.147981, -2.07119, 4.434685, -2.706056};
  private static final double[] C2 = {0.0, 0.042981, -0.293762, -1.752461, 5.682633, -3.582633};
  private static final double[] C3 = {0.544, -0.39978, 0.025054, -6.714e-4};
  private static final double[] C4 = {1.3822, -0.77857, 0.062767, -0.0020322};
  private static final double[] C5 = {-1.5861, -0.31082, -0.083751, 0.0038915};
  private static final double[] C6 = {-0.4803, -0.082676, 0.0030302};
  private static final double[] G = {-2.273, 0.459};

  private ShapiroWilk() {}

  public static NormalityVerdict test(double[] values, double alpha) {
    int n = values.length;
    if (n > MAX_SAMPLES) {
      return NormalityVerdict.skipped(NAME,
        "Shapiro-Wilk skipped: " + n + " points exceeds the reliable limit of " + MAX_SAMPLES + "; assuming normal.");
    }
    if (n < MIN_SAMPLES) {
      return NormalityVerdict.skipped(NAME,
        "Shapiro-Wilk skipped: needs at least " + MIN_SAMPLES + " points; assuming normal.");
    }
    if (!NormalityTester.hasVariance(values)) {
      return NormalityVerdict.skipped(NAME, "Shapiro-Wilk skipped: data has no variance.");
    }

    double[] result = statistic(values);
    double w = result[0];
    double p = result[1];
    boolean passes = p > alpha;
    return NormalityVerdict.of(NAME, passes, String.format(
      "Shapiro-Wilk W=%.4f, p=%.4g; %s at alpha=%.2f.",
      w, p, passes ? "cannot reject normality" : "data is not normally distributed", alpha));
  }

  /**
   * Computes the W statistic and its p-value.
   *
   * @return {W, p}
   */
  static double[] statistic(double[] values) {
    int n = values.length;
    double[] x = values.clone();
    Arrays.sort(x);

    double[] a = coefficients(n);
    double mean = Arrays.stream(x).average().orElse(0.0);
    double ss = 0.0;
    for (double v : x) {
      ss += (v - mean) * (v - mean);
    }
    double b = 0.0;
    for (int i = 0; i < a.length; i++) {
      b += a[i] * (x[n - 1 - i] - x[i]);
    }
    double w = Math.min(1.0, b * b / ss);
    return new double[] {w, pValue(w, n)};
  }

  /**
   * Coefficients for the lower half of the order statistics; a[i] weights x(n-i) - x(i+1).
   */
  static double[] coefficients(int n) {
    int half = n / 2;
    double[] a = new double[half];
    if (n == 3) {
      a[0] = Math.sqrt(0.5);
      return a;
    }

    double[] m = new double[half];
    double summ2 = 0.0;
    for (int i = 0; i < half; i++) {
      m[i] = STANDARD_NORMAL.inverseCumulativeProbability((i + 1 - 0.375) / (n + 0.25));
      summ2 += m[i] * m[i];
    }
    summ2 *= 2.0;
    double ssumm2 = Math.sqrt(summ2);
    double rsn = 1.0 / Math.sqrt(n);
    double a1 = poly(C1, rsn) - m[0] / ssumm2;

    int first;
    double fac;
    if (n > 5) {
      double a2 = -m[1] / ssumm2 + poly(C2, rsn);
      fac = Math.sqrt((summ2 - 2.0 * m[0] * m[0] - 2.0 * m[1] * m[1])
        / (1.0 - 2.0 * a1 * a1 - 2.0 * a2 * a2));
      a[1] = a2;
      first = 2;
    } else {
      fac = Math.sqrt((summ2 - 2.0 * m[0] * m[0]) / (1.0 - 2.0 * a1 * a1));
      first = 1;
    }
    a[0] = a1;
    for (int i = first; i < half; i++) {
      a[i] = -m[i] / fac;
    }
    return a;
  }

  static double pValue(double w, int n) {
    if (n == 3) {
      double p = 6.0 / Math.PI * (Math.asin(Math.sqrt(w)) - Math.asin(Math.sqrt(0.75)));
      return Math.max(0.0, Math.min(1.0, p));
    }

    double y = Math.log(1.0 - w);
    double m;
    double s;
    if (n <= 11) {
      double gamma = poly(G, n);
      if (y >= gamma) {
        return 0.0;
      }
      y = -Math.log(gamma - y);
      m = poly(C3, n);
      s = Math.exp(poly(C4, n));
    } else {
      double logN = Math.log(n);
      m = poly(C5, logN);
      s = Math.exp(poly(C6, logN));
    }
    return 1.0 - STANDARD_NORMAL.cumulativeProbability((y - m) / s);
  }

  private static double poly(double[] c, double x) {
    double result = 0.0;
    for (int i = c.length - 1; i >= 0; i--) {
      result = result * x + c[i];
    }
    return result;
  }
}
