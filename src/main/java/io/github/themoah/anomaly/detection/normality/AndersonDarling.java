package io.github.themoah.anomaly.detection.normality;

import java.util.Arrays;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Anderson-Darling test against a normal distribution with estimated mean and variance.
 *
 * <p>The A² statistic is compared with Stephens' critical values, adjusted for sample size,
 * at the 15%, 10%, 5%, 2.5% and 1% significance levels. The data counts as normal only when
 * A² is below the critical value at every level.
 */
public final class AndersonDarling {

  public static final String NAME = "anderson_darling";
  // Below this the sample-size adjustment of the critical values breaks down
  public static final int MIN_SAMPLES = 8;

  static final double[] SIGNIFICANCE_LEVELS = {15.0, 10.0, 5.0, 2.5, 1.0};
  private static final double[] BASE_CRITICAL_VALUES = {0.576, 0.656, 0.787, 0.918, 1.092};

  private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

  private AndersonDarling() {}

  /**
   * Runs the test. {@code alpha} only appears in the narrative; the verdict uses every
   * tabulated significance level.
   */
  public static NormalityVerdict test(double[] values, double alpha) {
    int n = values.length;
    if (n < MIN_SAMPLES) {
      return NormalityVerdict.skipped(NAME,
        "Anderson-Darling skipped: needs at least " + MIN_SAMPLES + " points, got " + n + "; assuming normal.");
    }
    if (!NormalityTester.hasVariance(values)) {
      return NormalityVerdict.skipped(NAME, "Anderson-Darling skipped: data has no variance.");
    }

    double a2 = statistic(values);
    double[] critical = criticalValues(n);

    StringBuilder narrative = new StringBuilder(String.format("Anderson-Darling A2=%.4f.", a2));
    boolean passes = true;
    for (int i = 0; i < critical.length; i++) {
      boolean levelPasses = a2 < critical[i];
      passes &= levelPasses;
      narrative.append(String.format(" %s%% level (critical %.3f): %s.",
        SIGNIFICANCE_LEVELS[i], critical[i], levelPasses ? "normal" : "not normal"));
    }
    narrative.append(passes ? " Data looks normal" : " Data is not normally distributed")
      .append(String.format(" (requested alpha=%.2f).", alpha));

    return NormalityVerdict.of(NAME, passes, narrative.toString());
  }

  static double statistic(double[] values) {
    int n = values.length;
    double[] x = values.clone();
    Arrays.sort(x);

    double mean = Arrays.stream(x).average().orElse(0.0);
    double ss = 0.0;
    for (double v : x) {
      ss += (v - mean) * (v - mean);
    }
    double sd = Math.sqrt(ss / (n - 1));

    double[] logCdf = new double[n];
    double[] logSf = new double[n];
    for (int i = 0; i < n; i++) {
      double z = (x[i] - mean) / sd;
      logCdf[i] = Math.log(Math.max(STANDARD_NORMAL.cumulativeProbability(z), Double.MIN_VALUE));
      logSf[i] = Math.log(Math.max(STANDARD_NORMAL.cumulativeProbability(-z), Double.MIN_VALUE));
    }

    double sum = 0.0;
    for (int i = 0; i < n; i++) {
      sum += (2.0 * (i + 1) - 1.0) * (logCdf[i] + logSf[n - 1 - i]);
    }
    return -n - sum / n;
  }

  static double[] criticalValues(int n) {
    double adjustment = 1.0 + 4.0 / n - 25.0 / ((double) n * n);
    double[] critical = new double[BASE_CRITICAL_VALUES.length];
    for (int i = 0; i < critical.length; i++) {
      critical[i] = BASE_CRITICAL_VALUES[i] / adjustment;
    }
    return critical;
  }
}
