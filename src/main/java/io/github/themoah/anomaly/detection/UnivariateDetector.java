package io.github.themoah.anomaly.detection;

import io.github.themoah.anomaly.detection.AnomalyScorer.PointScores;
import io.github.themoah.anomaly.detection.normality.BoxCoxNormalizer;
import io.github.themoah.anomaly.detection.normality.NormalityTester;
import io.github.themoah.anomaly.detection.normality.NormalizationResult;
import io.github.themoah.anomaly.detection.outlier.DixonQ;
import io.github.themoah.anomaly.detection.outlier.GeneralizedEsd;
import io.github.themoah.anomaly.detection.outlier.Grubbs;
import io.github.themoah.anomaly.detection.outlier.OutlierTestResult;
import io.github.themoah.anomaly.model.AnnotatedObservation;
import io.github.themoah.anomaly.model.Observation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects anomalies in a univariate dataset with an ensemble of statistical checks.
 *
 * <p>Each value is scored against mean +/- 3 SD, median +/- 3 MAD and the quartiles +/- 1.5 IQR.
 * The weighted sum of those scores is compared with a threshold derived from the sensitivity
 * score and, when it is stricter, from the cap on the fraction of anomalies.
 *
 * <p>Invalid input never throws: the observations come back unflagged with zero scores and the
 * reason in the details. Normality checks, Box-Cox normalization and the Grubbs, GESD and
 * Dixon tests are diagnostics only and do not change any score.
 *
 * <p>Instances hold no per-call state and can be shared between threads.
 */
public class UnivariateDetector {

  private static final Logger log = LoggerFactory.getLogger(UnivariateDetector.class);

  public static final int MIN_OBSERVATIONS = 3;
  public static final double DEFAULT_SENSITIVITY_SCORE = 50.0;
  public static final double DEFAULT_MAX_FRACTIONAL_ANOMALIES = 1.0;

  static final String MSG_TOO_FEW_POINTS =
    "Must have a minimum of at least three data points for anomaly detection.";
  static final String MSG_INVALID_MAX_FRACTION =
    "Must have a valid max fraction of anomalies, 0 < x <= 1.0.";
  static final String MSG_INVALID_SENSITIVITY =
    "Must have a valid sensitivity score, 0 < x <= 100.";
  static final String MSG_ENSEMBLE =
    "Ensemble of [mean +/- 3*SD, median +/- 3*MAD, median +/- 1.5*IQR]";

  private final AnomalyScorer scorer;
  private final BoxCoxNormalizer normalizer;

  public UnivariateDetector() {
    this(Weights.DEFAULT, NormalityTester.DEFAULT_ALPHA, Integer.MAX_VALUE);
  }

  /**
   * @param weights weights for combining the checks
   * @param normalityAlpha significance level for the normality diagnostics
   * @param parallelThreshold point count from which scoring runs in parallel
   */
  public UnivariateDetector(Weights weights, double normalityAlpha, int parallelThreshold) {
    this.scorer = new AnomalyScorer(weights, parallelThreshold);
    this.normalizer = new BoxCoxNormalizer(new NormalityTester(normalityAlpha));
  }

  public Weights weights() {
    return scorer.weights();
  }

  public DetectionResult detect(
      List<Observation> observations, double sensitivityScore, double maxFractionalAnomalies) {
    return detect(observations, sensitivityScore, maxFractionalAnomalies, false);
  }

  /**
   * Scores and classifies every observation.
   *
   * @param observations the dataset, in order
   * @param sensitivityScore sensitivity in (0, 100]; higher flags more points
   * @param maxFractionalAnomalies cap in (0, 1] on the fraction of flagged points
   * @param includeDiagnostics whether to also run the normality and extended outlier diagnostics
   * @return one annotated observation per input, the weights and the details
   */
  public DetectionResult detect(
      List<Observation> observations,
      double sensitivityScore,
      double maxFractionalAnomalies,
      boolean includeDiagnostics
  ) {
    Objects.requireNonNull(observations, "observations");

    String rejection = validate(observations.size(), sensitivityScore, maxFractionalAnomalies);
    if (rejection != null) {
      log.debug("Rejected detection request for {} points: {}", observations.size(), rejection);
      List<AnnotatedObservation> unscored = observations.stream()
        .map(AnnotatedObservation::unscored)
        .toList();
      return new DetectionResult(unscored, weights(), DetectionDetails.rejected(rejection));
    }

    double[] values = observations.stream().mapToDouble(Observation::value).toArray();
    StatisticalSummary summary = StatisticalSummary.of(values);

    NormalizationResult normalization = null;
    List<OutlierTestResult> extendedTests = List.of();
    if (includeDiagnostics) {
      normalization = normalizer.normalize(values, summary);
      extendedTests = runExtendedTests(values, maxFractionalAnomalies);
    }

    PointScores[] scores = scorer.score(observations, summary);
    double[] combined = new double[scores.length];
    for (int i = 0; i < scores.length; i++) {
      combined[i] = scores[i].anomalyScore();
    }
    double threshold = AnomalyClassifier.effectiveThreshold(combined, sensitivityScore, maxFractionalAnomalies);
    boolean[] flags = AnomalyClassifier.classify(combined, threshold);

    List<AnnotatedObservation> annotated = new ArrayList<>(observations.size());
    for (int i = 0; i < scores.length; i++) {
      Observation o = observations.get(i);
      PointScores s = scores[i];
      annotated.add(new AnnotatedObservation(
        o.key(), o.value(), s.sds(), s.mads(), s.iqrs(), s.anomalyScore(), flags[i]));
    }

    DetectionResult result = new DetectionResult(annotated, weights(),
      new DetectionDetails(MSG_ENSEMBLE, summary, normalization, extendedTests));
    log.debug("Scored {} points: threshold={}, anomalies={}",
      values.length, String.format("%.4f", threshold), result.anomalyCount());
    return result;
  }

  /**
   * Returns the first violated precondition, or null when the request is valid.
   * NaN parameters fail every range check.
   */
  static String validate(int count, double sensitivityScore, double maxFractionalAnomalies) {
    if (count < MIN_OBSERVATIONS) {
      return MSG_TOO_FEW_POINTS;
    }
    if (!(maxFractionalAnomalies > 0.0 && maxFractionalAnomalies <= 1.0)) {
      return MSG_INVALID_MAX_FRACTION;
    }
    if (!(sensitivityScore > 0.0 && sensitivityScore <= 100.0)) {
      return MSG_INVALID_SENSITIVITY;
    }
    return null;
  }

  private List<OutlierTestResult> runExtendedTests(double[] values, double maxFractionalAnomalies) {
    // GESD critical values become unstable once most of the sample has been removed
    int maxOutliers = Math.max(1, Math.min(
      (int) Math.floor(values.length * maxFractionalAnomalies), values.length / 2));
    return List.of(
      Grubbs.test(values),
      GeneralizedEsd.test(values, maxOutliers),
      DixonQ.test(values)
    );
  }
}
