package io.github.themoah.anomaly.detection.outlier;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.distribution.TDistribution;

/**
 * Generalized extreme Studentized deviate test (Rosner, 1983).
 *
 * <p>Removes the most extreme point up to {@code maxOutliers} times, recording
 * Rᵢ = max|x - mean| / sd and the critical value
 * λᵢ = (n-i)·t(p, n-i-1) / √((n-i-1+t²)(n-i+1)) with p = 1 - α/(2(n-i+1)).
 * The number of outliers is the largest i for which Rᵢ > λᵢ.
 */
public final class GeneralizedEsd {

  public static final String NAME = "gesd";
  public static final double DEFAULT_ALPHA = 0.05;

  private GeneralizedEsd() {}

  public static OutlierTestResult test(double[] values, int maxOutliers) {
    return test(values, maxOutliers, DEFAULT_ALPHA);
  }

  /**
   * Runs the test.
   *
   * @param values dataset in input order
   * @param maxOutliers upper bound on the number of outliers to look for
   * @param alpha significance level
   * @return the union of all points identified as outliers
   */
  public static OutlierTestResult test(double[] values, int maxOutliers, double alpha) {
    int n = values.length;
    if (n < Grubbs.MIN_SAMPLES) {
      return OutlierTestResult.notApplicable(NAME,
        "GESD test needs at least " + Grubbs.MIN_SAMPLES + " points, got " + n + ".");
    }
    if (maxOutliers < 1) {
      return OutlierTestResult.notApplicable(NAME, "GESD test needs a maximum outlier count of at least 1.");
    }

    // Sorted once; the most extreme remaining point is always at one end.
    // Running sums are over values centred on the full-sample mean.
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    double shift = Arrays.stream(values).average().orElse(0.0);
    double sum = 0.0;
    double sumSquares = 0.0;
    for (double v : sorted) {
      double d = v - shift;
      sum += d;
      sumSquares += d * d;
    }

    int lo = 0;
    int hi = n - 1;
    List<Double> removed = new ArrayList<>();
    int outlierCount = 0;

    for (int i = 1; i <= maxOutliers && hi - lo + 1 >= Grubbs.MIN_SAMPLES; i++) {
      if (sorted[lo] == sorted[hi]) {
        break;
      }
      int m = hi - lo + 1;
      double mean = sum / m;
      double sd = Math.sqrt(Math.max(0.0, (sumSquares - sum * mean) / (m - 1)));
      if (sd == 0.0) {
        break;
      }

      double lowDeviation = Math.abs(sorted[lo] - shift - mean);
      double highDeviation = Math.abs(sorted[hi] - shift - mean);
      double extreme = highDeviation >= lowDeviation ? sorted[hi--] : sorted[lo++];
      double r = Math.max(lowDeviation, highDeviation) / sd;
      double lambda = criticalValue(n, i, alpha);

      double d = extreme - shift;
      sum -= d;
      sumSquares -= d * d;
      removed.add(extreme);
      if (r > lambda) {
        outlierCount = i;
      }
    }

    List<Double> outliers = removed.subList(0, outlierCount);
    String narrative = outlierCount == 0
      ? "GESD found no outliers among up to " + maxOutliers + " candidates."
      : "GESD found " + outlierCount + " outlier(s) among up to " + maxOutliers + " candidates: " + outliers + ".";
    return OutlierTestResult.fromRemovedValues(NAME, values, outliers, narrative);
  }

  static double criticalValue(int n, int i, double alpha) {
    double p = 1.0 - alpha / (2.0 * (n - i + 1));
    int df = n - i - 1;
    double t = new TDistribution(df).inverseCumulativeProbability(p);
    return (n - i) * t / Math.sqrt((df + t * t) * (n - i + 1));
  }
}
