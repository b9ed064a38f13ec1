package io.github.themoah.anomaly.config;

import io.github.themoah.anomaly.detection.UnivariateDetector;
import io.github.themoah.anomaly.detection.Weights;
import io.github.themoah.anomaly.detection.normality.NormalityTester;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the detection endpoint.
 *
 * @param defaultSensitivityScore sensitivity used when a request does not supply one (default 50)
 * @param defaultMaxFractionalAnomalies cap used when a request does not supply one (default 1.0)
 * @param normalityAlpha significance level of the normality diagnostics (default 0.05)
 * @param parallelThreshold dataset size from which points are scored in parallel (default 10000)
 */
public record DetectionConfig(
  double defaultSensitivityScore,
  double defaultMaxFractionalAnomalies,
  double normalityAlpha,
  int parallelThreshold
) {

  private static final Logger log = LoggerFactory.getLogger(DetectionConfig.class);

  private static final int DEFAULT_PARALLEL_THRESHOLD = 10_000;

  public static DetectionConfig defaults() {
    return new DetectionConfig(
      UnivariateDetector.DEFAULT_SENSITIVITY_SCORE,
      UnivariateDetector.DEFAULT_MAX_FRACTIONAL_ANOMALIES,
      NormalityTester.DEFAULT_ALPHA,
      DEFAULT_PARALLEL_THRESHOLD
    );
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>DETECTION_DEFAULT_SENSITIVITY - default sensitivity score (default: 50)</li>
   *   <li>DETECTION_DEFAULT_MAX_FRACTION - default max fraction of anomalies (default: 1.0)</li>
   *   <li>DETECTION_NORMALITY_ALPHA - significance level for normality tests (default: 0.05)</li>
   *   <li>DETECTION_PARALLEL_THRESHOLD - points needed before scoring in parallel (default: 10000)</li>
   * </ul>
   */
  public static DetectionConfig fromEnvironment() {
    double sensitivity = parseDouble("DETECTION_DEFAULT_SENSITIVITY", UnivariateDetector.DEFAULT_SENSITIVITY_SCORE);
    double maxFraction = parseDouble("DETECTION_DEFAULT_MAX_FRACTION", UnivariateDetector.DEFAULT_MAX_FRACTIONAL_ANOMALIES);
    double alpha = parseDouble("DETECTION_NORMALITY_ALPHA", NormalityTester.DEFAULT_ALPHA);
    int parallelThreshold = parseInt("DETECTION_PARALLEL_THRESHOLD", DEFAULT_PARALLEL_THRESHOLD);

    if (!(alpha > 0.0 && alpha < 1.0)) {
      log.warn("DETECTION_NORMALITY_ALPHA must be in (0, 1), using default: {}", NormalityTester.DEFAULT_ALPHA);
      alpha = NormalityTester.DEFAULT_ALPHA;
    }
    if (parallelThreshold < 1) {
      log.warn("DETECTION_PARALLEL_THRESHOLD must be >= 1, using default: {}", DEFAULT_PARALLEL_THRESHOLD);
      parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;
    }

    DetectionConfig config = new DetectionConfig(sensitivity, maxFraction, alpha, parallelThreshold);
    log.info("Detection config: defaultSensitivity={}, defaultMaxFraction={}, normalityAlpha={}, parallelThreshold={}",
      sensitivity, maxFraction, alpha, parallelThreshold);
    return config;
  }

  /**
   * Creates the detector described by this configuration.
   */
  public UnivariateDetector createDetector() {
    return new UnivariateDetector(Weights.DEFAULT, normalityAlpha, parallelThreshold);
  }

  private static double parseDouble(String envVar, double defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }

  private static int parseInt(String envVar, int defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }
}
