package io.github.themoah.anomaly.detection.normality;

import io.github.themoah.anomaly.detection.StatisticalSummary;
import java.util.Arrays;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits a Box-Cox power transform to non-normal, strictly positive data.
 *
 * <p>Lambda is chosen by maximising the Box-Cox profile log-likelihood on the central 80% of
 * the sorted values, which keeps existing extremes from dominating the fit, and is then applied
 * to the whole dataset.
 */
public class BoxCoxNormalizer {

  private static final Logger log = LoggerFactory.getLogger(BoxCoxNormalizer.class);

  public static final int MIN_SAMPLES = 8;
  static final double LAMBDA_LOWER = -5.0;
  static final double LAMBDA_UPPER = 5.0;
  static final double TRIM_FRACTION = 0.1;

  private final NormalityTester tester;

  public BoxCoxNormalizer(NormalityTester tester) {
    this.tester = tester;
  }

  /**
   * Decides whether to transform the data and does so when eligible.
   *
   * @param values the raw dataset values
   * @param summary statistics of the raw values
   * @return the normalization outcome
   */
  public NormalizationResult normalize(double[] values, StatisticalSummary summary) {
    NormalityReport initial = tester.test(values);
    if (initial.isNormal()) {
      return new NormalizationResult(true, null, values.clone(), initial, null,
        "Data is already normally distributed; using raw values.");
    }

    String ineligible = ineligibilityReason(summary);
    if (ineligible != null) {
      log.debug("Box-Cox fitting skipped: {}", ineligible);
      return new NormalizationResult(false, null, null, initial, null, ineligible);
    }

    double lambda = fitLambda(trimmedSample(values));
    double[] transformed = Arrays.stream(values).map(v -> transform(v, lambda)).toArray();
    NormalityReport fitted = tester.test(transformed);
    log.debug("Fitted Box-Cox lambda={} on {} points, fitted data normal={}", lambda, values.length, fitted.isNormal());

    return new NormalizationResult(true, lambda, transformed, initial, fitted,
      String.format("Fitted Box-Cox transform with lambda=%.4f.", lambda));
  }

  static String ineligibilityReason(StatisticalSummary summary) {
    if (!(summary.min() < summary.max())) {
      return "Fitting skipped: data has insufficient variance (min == max).";
    }
    if (summary.min() <= 0.0) {
      return "Fitting skipped: Box-Cox requires strictly positive values (min=" + summary.min() + ").";
    }
    if (summary.count() < MIN_SAMPLES) {
      return "Fitting skipped: needs at least " + MIN_SAMPLES + " points, got " + summary.count() + ".";
    }
    return null;
  }

  /**
   * The sorted values with the lowest and highest 10% removed. Falls back to all sorted values
   * when the central slice is constant, since lambda cannot be fitted on zero variance.
   */
  static double[] trimmedSample(double[] values) {
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    int n = sorted.length;
    double[] trimmed = Arrays.copyOfRange(sorted, (int) (n * TRIM_FRACTION), (int) (n * (1.0 - TRIM_FRACTION)));
    if (trimmed.length < 2 || trimmed[0] == trimmed[trimmed.length - 1]) {
      return sorted;
    }
    return trimmed;
  }

  static double fitLambda(double[] sample) {
    double sumLog = 0.0;
    for (double v : sample) {
      sumLog += Math.log(v);
    }
    final double logSum = sumLog;

    BrentOptimizer optimizer = new BrentOptimizer(1e-10, 1e-12);
    UnivariatePointValuePair optimum = optimizer.optimize(
      new MaxEval(500),
      new UnivariateObjectiveFunction(lambda -> logLikelihood(sample, lambda, logSum)),
      GoalType.MAXIMIZE,
      new SearchInterval(LAMBDA_LOWER, LAMBDA_UPPER, 1.0)
    );
    return optimum.getPoint();
  }

  /**
   * Box-Cox profile log-likelihood: (λ - 1)·Σ ln x - n/2 · ln(σ²), where σ² is the population
   * variance of the transformed sample.
   */
  static double logLikelihood(double[] sample, double lambda, double sumLog) {
    int n = sample.length;
    double mean = 0.0;
    double[] transformed = new double[n];
    for (int i = 0; i < n; i++) {
      transformed[i] = transform(sample[i], lambda);
      mean += transformed[i];
    }
    mean /= n;
    double variance = 0.0;
    for (double t : transformed) {
      variance += (t - mean) * (t - mean);
    }
    variance /= n;

    double llf = (lambda - 1.0) * sumLog - n / 2.0 * Math.log(variance);
    return Double.isFinite(llf) ? llf : Double.NEGATIVE_INFINITY;
  }

  /**
   * Box-Cox transform: ln x when λ = 0, otherwise (x^λ - 1) / λ.
   */
  public static double transform(double value, double lambda) {
    if (lambda == 0.0) {
      return Math.log(value);
    }
    return Math.expm1(lambda * Math.log(value)) / lambda;
  }
}
