package io.github.themoah.anomaly.detection.outlier;

import java.util.List;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Two-sided Grubbs test for a single outlier.
 *
 * <p>G = max|xᵢ - mean| / sd is compared with
 * G_crit = (n-1)/√n · √(t² / (n-2+t²)), where t is the upper α/(2n) critical value of
 * Student's t with n-2 degrees of freedom.
 */
public final class Grubbs {

  public static final String NAME = "grubbs";
  public static final double DEFAULT_ALPHA = 0.05;
  static final int MIN_SAMPLES = 3;

  private Grubbs() {}

  public static OutlierTestResult test(double[] values) {
    return test(values, DEFAULT_ALPHA);
  }

  /**
   * Runs the test.
   *
   * @param values dataset in input order
   * @param alpha significance level
   * @return the single most extreme point when it is a significant outlier
   */
  public static OutlierTestResult test(double[] values, double alpha) {
    int n = values.length;
    if (n < MIN_SAMPLES) {
      return OutlierTestResult.notApplicable(NAME,
        "Grubbs test needs at least " + MIN_SAMPLES + " points, got " + n + ".");
    }

    DescriptiveStatistics stats = new DescriptiveStatistics(values);
    double sd = stats.getStandardDeviation();
    if (sd == 0.0) {
      return OutlierTestResult.notApplicable(NAME, "Grubbs test skipped: data has no variance.");
    }

    int extreme = mostExtremeIndex(values, stats.getMean());
    double g = Math.abs(values[extreme] - stats.getMean()) / sd;
    double gCritical = criticalValue(n, alpha);

    if (g > gCritical) {
      return OutlierTestResult.fromRemovedValues(NAME, values, List.of(values[extreme]),
        String.format("Grubbs statistic %.4f exceeds critical value %.4f; value %s is an outlier.",
          g, gCritical, values[extreme]));
    }
    return new OutlierTestResult(NAME, true, List.of(),
      String.format("Grubbs statistic %.4f does not exceed critical value %.4f; no outlier.", g, gCritical));
  }

  static double criticalValue(int n, double alpha) {
    double t = new TDistribution(n - 2).inverseCumulativeProbability(1.0 - alpha / (2.0 * n));
    return (n - 1) / Math.sqrt(n) * Math.sqrt(t * t / (n - 2 + t * t));
  }

  static int mostExtremeIndex(double[] values, double mean) {
    int extreme = 0;
    double maxDeviation = -1.0;
    for (int i = 0; i < values.length; i++) {
      double deviation = Math.abs(values[i] - mean);
      if (deviation > maxDeviation) {
        maxDeviation = deviation;
        extreme = i;
      }
    }
    return extreme;
  }
}
