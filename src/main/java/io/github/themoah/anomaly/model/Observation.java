package io.github.themoah.anomaly.model;

/**
 * A single measurement submitted for anomaly detection.
 *
 * @param key opaque caller-supplied identifier (not required to be unique)
 * @param value the measurement under test
 */
public record Observation(
  String key,
  double value
) {}
