package io.github.themoah.anomaly.detection;

import io.vertx.core.json.JsonObject;
import java.util.Arrays;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Descriptive statistics for one dataset, computed once per detection call.
 *
 * <p>Uses the sample standard deviation (divide by n-1) and a median absolute deviation
 * scaled by 1/Φ⁻¹(0.75) so that it estimates the standard deviation of normal data.
 * Quantiles interpolate linearly between order statistics.
 *
 * @param count number of values
 * @param mean arithmetic mean
 * @param sd sample standard deviation, 0 for a single value
 * @param median the 50th percentile
 * @param mad scaled median absolute deviation, 0 for a single value
 * @param p25 the 25th percentile
 * @param p75 the 75th percentile
 * @param iqr interquartile range (p75 - p25)
 * @param min smallest value
 * @param max largest value
 */
public record StatisticalSummary(
  int count,
  double mean,
  double sd,
  double median,
  double mad,
  double p25,
  double p75,
  double iqr,
  double min,
  double max
) {

  /**
   * Normal consistency constant for the MAD, approximately 1.4826.
   */
  public static final double MAD_SCALE = 1.0 / new NormalDistribution().inverseCumulativeProbability(0.75);

  /**
   * Computes the summary for the given values.
   *
   * @param values the dataset values, not modified
   * @return the summary
   * @throws IllegalArgumentException if values is empty
   */
  public static StatisticalSummary of(double[] values) {
    if (values.length == 0) {
      throw new IllegalArgumentException("Cannot summarize an empty dataset");
    }

    DescriptiveStatistics stats = new DescriptiveStatistics(values);
    double median = quantile(values, 0.5);
    double p25 = quantile(values, 0.25);
    double p75 = quantile(values, 0.75);

    double mad = 0.0;
    if (values.length > 1) {
      double[] deviations = Arrays.stream(values).map(v -> Math.abs(v - median)).toArray();
      mad = quantile(deviations, 0.5) * MAD_SCALE;
    }

    return new StatisticalSummary(
      values.length,
      stats.getMean(),
      stats.getStandardDeviation(),
      median,
      mad,
      p25,
      p75,
      p75 - p25,
      stats.getMin(),
      stats.getMax()
    );
  }

  /**
   * Linear-interpolation quantile (the R-7 definition, numpy's "linear").
   *
   * @param values the values, in any order, not modified
   * @param p quantile in [0, 1]; values outside are clamped
   * @return the interpolated quantile, NaN for empty input
   */
  public static double quantile(double[] values, double p) {
    if (values.length == 0) {
      return Double.NaN;
    }
    if (p <= 0.0) {
      return Arrays.stream(values).min().getAsDouble();
    }
    if (p >= 1.0) {
      return Arrays.stream(values).max().getAsDouble();
    }
    return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, p * 100.0);
  }

  /**
   * Converts to the "base calculations" section of the diagnostics bundle.
   */
  public JsonObject toJson() {
    return new JsonObject()
      .put("len", count)
      .put("mean", mean)
      .put("sd", sd)
      .put("median", median)
      .put("mad", mad)
      .put("p25", p25)
      .put("p75", p75)
      .put("iqr", iqr)
      .put("min", min)
      .put("max", max);
  }
}
