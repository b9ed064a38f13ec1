package io.github.themoah.anomaly.model;

import io.vertx.core.json.JsonObject;

/**
 * An observation together with every score derived for it.
 *
 * @param key the observation key
 * @param value the observation value
 * @param sds standard deviation check score in [0, 1]
 * @param mads median absolute deviation check score in [0, 1]
 * @param iqrs interquartile range check score in [0, 1]
 * @param anomalyScore weighted combination of the three check scores
 * @param isAnomaly whether the combined score exceeded the effective threshold
 */
public record AnnotatedObservation(
  String key,
  double value,
  double sds,
  double mads,
  double iqrs,
  double anomalyScore,
  boolean isAnomaly
) {

  /**
   * Creates the neutral annotation used when detection is rejected.
   */
  public static AnnotatedObservation unscored(Observation observation) {
    return new AnnotatedObservation(observation.key(), observation.value(), 0.0, 0.0, 0.0, 0.0, false);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("key", key)
      .put("value", value)
      .put("sds", sds)
      .put("mads", mads)
      .put("iqrs", iqrs)
      .put("anomaly_score", anomalyScore)
      .put("is_anomaly", isAnomaly);
  }
}
