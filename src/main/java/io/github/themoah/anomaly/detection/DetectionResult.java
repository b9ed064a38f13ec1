package io.github.themoah.anomaly.detection;

import io.github.themoah.anomaly.model.AnnotatedObservation;
import java.util.List;

/**
 * Output of one detection call.
 *
 * @param anomalies one annotated entry per input observation, in input order
 * @param weights weights used to combine the checks
 * @param details diagnostics, or the validation failure message
 */
public record DetectionResult(
  List<AnnotatedObservation> anomalies,
  Weights weights,
  DetectionDetails details
) {

  public DetectionResult {
    anomalies = List.copyOf(anomalies);
  }

  public long anomalyCount() {
    return anomalies.stream().filter(AnnotatedObservation::isAnomaly).count();
  }

  public boolean isRejected() {
    return details.isRejection();
  }
}
