package io.github.themoah.anomaly.detection.normality;

/**
 * Runs the Shapiro-Wilk, D'Agostino-Pearson and Anderson-Darling normality tests.
 */
public class NormalityTester {

  public static final double DEFAULT_ALPHA = 0.05;

  private final double alpha;

  public NormalityTester() {
    this(DEFAULT_ALPHA);
  }

  /**
   * @param alpha significance level for the p-value based tests
   */
  public NormalityTester(double alpha) {
    if (!(alpha > 0.0 && alpha < 1.0)) {
      throw new IllegalArgumentException("alpha must be in (0, 1), got " + alpha);
    }
    this.alpha = alpha;
  }

  public double alpha() {
    return alpha;
  }

  /**
   * Tests the values against each normality test.
   *
   * @param values the data, not modified
   * @return the individual verdicts
   */
  public NormalityReport test(double[] values) {
    return new NormalityReport(
      ShapiroWilk.test(values, alpha),
      DAgostinoPearson.test(values, alpha),
      AndersonDarling.test(values, alpha)
    );
  }

  static boolean hasVariance(double[] values) {
    for (int i = 1; i < values.length; i++) {
      if (values[i] != values[0]) {
        return true;
      }
    }
    return false;
  }
}
