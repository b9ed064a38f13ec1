package io.github.themoah.anomaly.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP server settings, loaded from environment variables.
 *
 * @param httpPort port to listen on; 0 picks a free port
 * @param maxBodyBytes largest accepted request body in bytes
 */
public record AppConfig(
  int httpPort,
  long maxBodyBytes
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  static final int DEFAULT_HTTP_PORT = 8080;
  static final long DEFAULT_MAX_BODY_BYTES = 10L * 1024 * 1024;

  public AppConfig {
    if (httpPort < 0 || httpPort > 65_535) {
      throw new IllegalArgumentException("httpPort must be in [0, 65535], got " + httpPort);
    }
    if (maxBodyBytes <= 0) {
      throw new IllegalArgumentException("maxBodyBytes must be positive, got " + maxBodyBytes);
    }
  }

  /**
   * Reads HTTP_PORT (default 8080) and HTTP_MAX_BODY_BYTES (default 10 MiB).
   * Unparseable or out-of-range values fall back to the defaults.
   */
  public static AppConfig fromEnvironment() {
    int port = getEnvInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    if (port < 0 || port > 65_535) {
      log.warn("HTTP_PORT out of range: {}, using default: {}", port, DEFAULT_HTTP_PORT);
      port = DEFAULT_HTTP_PORT;
    }
    long maxBodyBytes = getEnvLong("HTTP_MAX_BODY_BYTES", DEFAULT_MAX_BODY_BYTES);
    if (maxBodyBytes <= 0) {
      log.warn("HTTP_MAX_BODY_BYTES must be positive: {}, using default: {}", maxBodyBytes, DEFAULT_MAX_BODY_BYTES);
      maxBodyBytes = DEFAULT_MAX_BODY_BYTES;
    }

    log.info("AppConfig loaded: httpPort={}, maxBodyBytes={}", port, maxBodyBytes);
    return new AppConfig(port, maxBodyBytes);
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }

  private static long getEnvLong(String name, long defaultValue) {
    String value = System.getenv(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }
}
