package io.github.themoah.anomaly.detection;

/**
 * Turns anomaly scores into flags from a sensitivity score and a cap on the flagged fraction.
 */
public final class AnomalyClassifier {

  private AnomalyClassifier() {}

  /**
   * Maps a sensitivity score in (0, 100] to a score threshold. Higher sensitivity gives a
   * lower threshold.
   */
  public static double sensitivityThreshold(double sensitivityScore) {
    return (100.0 - sensitivityScore) / 100.0;
  }

  /**
   * Computes the threshold actually applied to the scores.
   *
   * <p>Starts from the sensitivity threshold and raises it to the (1 - maxFraction) quantile
   * of the scores when that is higher and the cap is below 1.0. The cap only ever makes
   * classification stricter.
   *
   * @param scores all anomaly scores of the dataset
   * @param sensitivityScore sensitivity in (0, 100]
   * @param maxFractionalAnomalies cap in (0, 1]
   * @return the effective threshold
   */
  public static double effectiveThreshold(double[] scores, double sensitivityScore, double maxFractionalAnomalies) {
    double threshold = sensitivityThreshold(sensitivityScore);
    double capScore = StatisticalSummary.quantile(scores, 1.0 - maxFractionalAnomalies);
    if (maxFractionalAnomalies < 1.0 && capScore > threshold) {
      threshold = capScore;
    }
    return threshold;
  }

  /**
   * Flags each score strictly above the threshold. Ties are not flagged.
   */
  public static boolean[] classify(double[] scores, double threshold) {
    boolean[] flags = new boolean[scores.length];
    for (int i = 0; i < scores.length; i++) {
      flags[i] = scores[i] > threshold;
    }
    return flags;
  }
}
