package io.github.themoah.anomaly.http;

import io.github.themoah.anomaly.config.DetectionConfig;
import io.github.themoah.anomaly.model.Observation;
import io.vertx.core.MultiMap;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;

/**
 * A parsed request to the univariate detection endpoint.
 *
 * <p>Parsing only checks the shape of the request. Parameter ranges are left to the detector,
 * which answers out-of-range values with an unflagged result instead of an error.
 *
 * @param observations the submitted observations, in order
 * @param sensitivityScore requested sensitivity
 * @param maxFractionalAnomalies requested cap on the fraction of anomalies
 * @param debug whether weights and diagnostics should be returned
 */
public record DetectionRequest(
  List<Observation> observations,
  double sensitivityScore,
  double maxFractionalAnomalies,
  boolean debug
) {

  static final String PARAM_SENSITIVITY = "sensitivity_score";
  // Misspelled name accepted by earlier clients
  static final String PARAM_SENSITIVITY_LEGACY = "sensitivitiy_score";
  static final String PARAM_MAX_FRACTION = "max_fractional_anomalies";
  static final String PARAM_DEBUG = "debug";

  /**
   * Parses the body and query parameters.
   *
   * @param body request body, a JSON array of {"key", "value"} objects
   * @param params query parameters
   * @param defaults defaults for omitted parameters
   * @return the request
   * @throws IllegalArgumentException if the body or a parameter is malformed
   */
  public static DetectionRequest parse(Buffer body, MultiMap params, DetectionConfig defaults) {
    List<Observation> observations = parseObservations(body);

    String sensitivityParam = params.get(PARAM_SENSITIVITY);
    if (sensitivityParam == null) {
      sensitivityParam = params.get(PARAM_SENSITIVITY_LEGACY);
    }
    double sensitivity = parseDouble(PARAM_SENSITIVITY, sensitivityParam, defaults.defaultSensitivityScore());
    double maxFraction = parseDouble(PARAM_MAX_FRACTION, params.get(PARAM_MAX_FRACTION),
      defaults.defaultMaxFractionalAnomalies());
    boolean debug = parseBoolean(PARAM_DEBUG, params.get(PARAM_DEBUG));

    return new DetectionRequest(observations, sensitivity, maxFraction, debug);
  }

  static List<Observation> parseObservations(Buffer body) {
    if (body == null || body.length() == 0) {
      throw new IllegalArgumentException("Request body must be a JSON array of {\"key\", \"value\"} objects");
    }

    Object decoded;
    try {
      decoded = Json.decodeValue(body);
    } catch (DecodeException e) {
      throw new IllegalArgumentException("Request body is not valid JSON: " + e.getMessage(), e);
    }
    if (!(decoded instanceof JsonArray array)) {
      throw new IllegalArgumentException("Request body must be a JSON array of {\"key\", \"value\"} objects");
    }

    List<Observation> observations = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      if (!(array.getValue(i) instanceof JsonObject item)) {
        throw new IllegalArgumentException("Element " + i + " is not a JSON object");
      }
      observations.add(new Observation(parseKey(item, i), parseValue(item, i)));
    }
    return observations;
  }

  private static String parseKey(JsonObject item, int index) {
    Object key = item.getValue("key");
    if (key == null) {
      throw new IllegalArgumentException("Element " + index + " is missing \"key\"");
    }
    if (key instanceof JsonObject || key instanceof JsonArray) {
      throw new IllegalArgumentException("Element " + index + " has a non-scalar \"key\"");
    }
    return key.toString();
  }

  private static double parseValue(JsonObject item, int index) {
    Object value = item.getValue("value");
    double parsed;
    if (value instanceof Number number) {
      parsed = number.doubleValue();
    } else if (value instanceof String text) {
      try {
        parsed = Double.parseDouble(text.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Element " + index + " has a non-numeric \"value\": " + text, e);
      }
    } else if (value == null) {
      throw new IllegalArgumentException("Element " + index + " is missing \"value\"");
    } else {
      throw new IllegalArgumentException("Element " + index + " has a non-numeric \"value\"");
    }
    if (!Double.isFinite(parsed)) {
      throw new IllegalArgumentException("Element " + index + " has a non-finite \"value\"");
    }
    return parsed;
  }

  private static double parseDouble(String name, String value, double defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Query parameter " + name + " must be a number, got '" + value + "'", e);
    }
  }

  private static boolean parseBoolean(String name, String value) {
    if (value == null || value.isBlank()) {
      return false;
    }
    String normalized = value.trim().toLowerCase();
    return switch (normalized) {
      case "true", "1", "yes" -> true;
      case "false", "0", "no" -> false;
      default -> throw new IllegalArgumentException("Query parameter " + name + " must be a boolean, got '" + value + "'");
    };
  }
}
