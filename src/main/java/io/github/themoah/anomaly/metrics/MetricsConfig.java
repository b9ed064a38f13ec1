package io.github.themoah.anomaly.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics reporting configuration.
 *
 * @param enabled whether detection metrics are recorded
 * @param reporterType registry backend: "prometheus" or "otlp"
 * @param jvmMetricsEnabled whether JVM binders are registered
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled
) {

  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final String DEFAULT_REPORTER = "prometheus";

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>METRICS_ENABLED - enable metrics (default: true)</li>
   *   <li>METRICS_REPORTER - prometheus or otlp (default: prometheus)</li>
   *   <li>METRICS_JVM_ENABLED - bind JVM metrics (default: true)</li>
   * </ul>
   */
  public static MetricsConfig fromEnvironment() {
    boolean enabled = parseBoolean("METRICS_ENABLED", true);
    String reporter = System.getenv().getOrDefault("METRICS_REPORTER", DEFAULT_REPORTER);
    boolean jvm = parseBoolean("METRICS_JVM_ENABLED", true);

    MetricsConfig config = new MetricsConfig(enabled, reporter, jvm);
    log.info("Metrics config: enabled={}, reporter={}, jvmMetrics={}", enabled, reporter, jvm);
    return config;
  }

  public boolean isEnabled() {
    return enabled;
  }

  private static boolean parseBoolean(String envVar, boolean defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value);
  }
}
