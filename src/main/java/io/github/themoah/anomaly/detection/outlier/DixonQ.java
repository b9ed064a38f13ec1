package io.github.themoah.anomaly.detection.outlier;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Dixon's Q test for an extreme value at either end of the sorted data.
 *
 * <p>Q = gap / range, where the gap is the distance from the smallest (or largest) value to its
 * neighbour. The extreme value is an outlier when Q exceeds the tabulated critical value for the
 * sample size. Critical values (Rorabacher, 1991) cover sample sizes 3 to 30.
 */
public final class DixonQ {

  public static final String NAME = "dixon";
  public static final int MIN_SAMPLES = 3;
  public static final int MAX_SAMPLES = 30;

  private static final double[] Q90_TABLE = {
    0.941, 0.765, 0.642, 0.560, 0.507, 0.468, 0.437, 0.412, 0.392, 0.376,
    0.361, 0.349, 0.338, 0.329, 0.320, 0.313, 0.306, 0.300, 0.295, 0.290,
    0.285, 0.281, 0.277, 0.273, 0.269, 0.266, 0.263, 0.260
  };

  private static final double[] Q95_TABLE = {
    0.970, 0.829, 0.710, 0.625, 0.568, 0.526, 0.493, 0.466, 0.444, 0.426,
    0.410, 0.396, 0.384, 0.374, 0.365, 0.356, 0.349, 0.342, 0.337, 0.331,
    0.326, 0.321, 0.317, 0.312, 0.308, 0.305, 0.301, 0.290
  };

  private static final double[] Q99_TABLE = {
    0.994, 0.926, 0.821, 0.740, 0.680, 0.634, 0.598, 0.568, 0.542, 0.522,
    0.503, 0.488, 0.475, 0.463, 0.452, 0.442, 0.433, 0.425, 0.418, 0.411,
    0.404, 0.399, 0.393, 0.388, 0.384, 0.380, 0.376, 0.372
  };

  /**
   * Supported confidence levels.
   */
  public enum Confidence {
    Q90(Q90_TABLE),
    Q95(Q95_TABLE),
    Q99(Q99_TABLE);

    private final double[] table;

    Confidence(double[] table) {
      this.table = table;
    }

    double criticalValue(int n) {
      return table[n - MIN_SAMPLES];
    }
  }

  private DixonQ() {}

  public static OutlierTestResult test(double[] values) {
    return test(values, Confidence.Q95);
  }

  /**
   * Runs the test at both ends of the data.
   *
   * @param values dataset in input order
   * @param confidence confidence level selecting the critical value table
   * @return positions holding the flagged minimum and/or maximum value
   */
  public static OutlierTestResult test(double[] values, Confidence confidence) {
    int n = values.length;
    if (n < MIN_SAMPLES || n > MAX_SAMPLES) {
      return OutlierTestResult.notApplicable(NAME,
        "Dixon's Q test applies to " + MIN_SAMPLES + " to " + MAX_SAMPLES + " points, got " + n + ".");
    }

    double[] sorted = values.clone();
    Arrays.sort(sorted);
    double range = sorted[n - 1] - sorted[0];

    // A constant dataset has no gaps to compare
    double qLow = range == 0.0 ? 0.0 : (sorted[1] - sorted[0]) / range;
    double qHigh = range == 0.0 ? 0.0 : (sorted[n - 1] - sorted[n - 2]) / range;
    double critical = confidence.criticalValue(n);

    List<Double> removed = new ArrayList<>();
    if (qLow > critical) {
      removed.add(sorted[0]);
    }
    if (qHigh > critical) {
      removed.add(sorted[n - 1]);
    }

    String narrative = String.format(
      "Q(low)=%.4f, Q(high)=%.4f, critical value %.3f at %s: %s.",
      qLow, qHigh, critical, confidence.name(),
      removed.isEmpty() ? "no outlier" : "outlier(s) " + removed);
    return OutlierTestResult.fromRemovedValues(NAME, values, removed, narrative);
  }
}
