package io.github.themoah.anomaly.detection;

import io.github.themoah.anomaly.model.Observation;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Scores every observation against a precomputed summary.
 *
 * <p>Each point depends only on its own value and the shared summary, so large datasets
 * are scored with a parallel index stream. Results are written by index, which keeps them
 * in input order.
 */
public class AnomalyScorer {

  private final Weights weights;
  private final int parallelThreshold;

  /**
   * @param weights weights used to combine the check scores
   * @param parallelThreshold minimum number of points before scoring runs in parallel
   */
  public AnomalyScorer(Weights weights, int parallelThreshold) {
    this.weights = weights;
    this.parallelThreshold = parallelThreshold;
  }

  public Weights weights() {
    return weights;
  }

  /**
   * Computes the per-check and combined scores.
   *
   * @param observations observations in input order
   * @param summary statistics of the same observations
   * @return scores, index-aligned with the observations
   */
  public PointScores[] score(List<Observation> observations, StatisticalSummary summary) {
    PointScores[] scores = new PointScores[observations.size()];
    IntStream indexes = IntStream.range(0, scores.length);
    if (scores.length >= parallelThreshold) {
      indexes = indexes.parallel();
    }
    indexes.forEach(i -> scores[i] = scorePoint(observations.get(i).value(), summary));
    return scores;
  }

  PointScores scorePoint(double value, StatisticalSummary s) {
    double sds = DistanceChecks.checkSd(value, s.mean(), s.sd());
    double mads = DistanceChecks.checkMad(value, s.median(), s.mad());
    double iqrs = DistanceChecks.checkIqr(value, s.median(), s.p25(), s.p75(), s.iqr());
    return new PointScores(sds, mads, iqrs, weights.combine(sds, mads, iqrs));
  }

  /**
   * Scores for one observation.
   */
  public record PointScores(double sds, double mads, double iqrs, double anomalyScore) {}
}
