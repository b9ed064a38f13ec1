package io.github.themoah.anomaly.health;

import io.vertx.core.json.JsonObject;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param detector detector readiness ("ready" or "starting"), null for the liveness check
 */
public record HealthCheckResponse(
  HealthStatus status,
  String detector
) {
  /** Creates a liveness response; the HTTP server answering is all it reports. */
  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null);
  }

  /**
   * Creates a readiness response.
   *
   * @param ready true once the detection endpoint accepts requests
   */
  public static HealthCheckResponse readiness(boolean ready) {
    return ready
      ? new HealthCheckResponse(HealthStatus.UP, "ready")
      : new HealthCheckResponse(HealthStatus.DOWN, "starting");
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (detector != null) {
      json.put("detector", detector);
    }
    return json;
  }
}
