package io.github.themoah.anomaly.detection;

import io.github.themoah.anomaly.detection.normality.NormalizationResult;
import io.github.themoah.anomaly.detection.outlier.OutlierTestResult;
import io.vertx.core.json.JsonObject;
import java.util.List;

/**
 * Diagnostics describing how a detection call was evaluated. Never consumed by scoring.
 *
 * @param message summary message, or the validation failure reason
 * @param baseCalculations statistics of the raw data, null when validation failed
 * @param normalization normality checks and Box-Cox fit, null when diagnostics were not requested
 * @param extendedTests Grubbs, GESD and Dixon results, empty when diagnostics were not requested
 */
public record DetectionDetails(
  String message,
  StatisticalSummary baseCalculations,
  NormalizationResult normalization,
  List<OutlierTestResult> extendedTests
) {

  public DetectionDetails {
    extendedTests = extendedTests == null ? List.of() : List.copyOf(extendedTests);
  }

  public static DetectionDetails rejected(String reason) {
    return new DetectionDetails(reason, null, null, List.of());
  }

  public boolean isRejection() {
    return baseCalculations == null;
  }

  /**
   * Converts to the "details" value of the response: the bare message for a rejection,
   * otherwise a structured object.
   */
  public Object toJson() {
    if (isRejection()) {
      return message;
    }
    JsonObject json = new JsonObject()
      .put("message", message)
      .put("base_calculations", baseCalculations.toJson());
    if (normalization != null) {
      json.put("normalization", normalization.toJson());
    }
    if (!extendedTests.isEmpty()) {
      JsonObject tests = new JsonObject();
      extendedTests.forEach(result -> tests.put(result.test(), result.toJson()));
      json.put("extended_tests", tests);
    }
    return json;
  }
}
