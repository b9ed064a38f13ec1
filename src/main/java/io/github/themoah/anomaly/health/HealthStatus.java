package io.github.themoah.anomaly.health;

/**
 * Health status reported by the probes, with the HTTP status code each maps to.
 */
public enum HealthStatus {
  UP("UP", 200),
  DOWN("DOWN", 503);

  private final String value;
  private final int httpStatusCode;

  HealthStatus(String value, int httpStatusCode) {
    this.value = value;
    this.httpStatusCode = httpStatusCode;
  }

  public String getValue() {
    return value;
  }

  public int httpStatusCode() {
    return httpStatusCode;
  }
}
