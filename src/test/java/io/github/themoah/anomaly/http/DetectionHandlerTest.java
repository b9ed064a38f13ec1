package io.github.themoah.anomaly.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.anomaly.detection.DetectionResult;
import io.github.themoah.anomaly.detection.UnivariateDetector;
import io.github.themoah.anomaly.model.Observation;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the detection response format.
 */
public class DetectionHandlerTest {

  private final UnivariateDetector detector = new UnivariateDetector();

  private static final List<Observation> OBSERVATIONS = List.of(
    new Observation("a", 1), new Observation("b", 2), new Observation("c", 3),
    new Observation("d", 4), new Observation("e", 5), new Observation("f", 6),
    new Observation("g", 7), new Observation("h", 8), new Observation("i", 9),
    new Observation("j", 10), new Observation("k", 90));

  @Test
  void toResponse_plain() {
    DetectionResult result = detector.detect(OBSERVATIONS, 50, 0.5);
    JsonObject response = DetectionHandler.toResponse(result, false);

    assertEquals(1, response.size());
    JsonArray anomalies = response.getJsonArray("anomalies");
    assertEquals(11, anomalies.size());

    JsonObject last = anomalies.getJsonObject(10);
    assertEquals("k", last.getString("key"));
    assertEquals(90.0, last.getDouble("value"));
    assertTrue(last.getBoolean("is_anomaly"));
    assertTrue(last.containsKey("sds"));
    assertTrue(last.containsKey("mads"));
    assertTrue(last.containsKey("iqrs"));
    assertTrue(last.containsKey("anomaly_score"));
    assertFalse(anomalies.getJsonObject(0).getBoolean("is_anomaly"));
  }

  @Test
  void toResponse_debug() {
    DetectionResult result = detector.detect(OBSERVATIONS, 50, 0.5, true);
    JsonObject response = DetectionHandler.toResponse(result, true);

    assertEquals("Flagged 1 of 11 observations.", response.getString("debug_msg"));
    assertEquals(0.45, response.getJsonObject("weights").getDouble("mads"));
    JsonObject details = response.getJsonObject("details");
    assertEquals(11, details.getJsonObject("base_calculations").getInteger("len"));
    assertTrue(details.getJsonObject("extended_tests").getJsonObject("grubbs")
      .getJsonArray("outlier_indexes").contains(10));
  }

  @Test
  void toResponse_rejectedDebug_detailsIsMessage() {
    DetectionResult result = detector.detect(OBSERVATIONS.subList(0, 2), 50, 1.0, true);
    JsonObject response = DetectionHandler.toResponse(result, true);

    assertEquals(2, response.getJsonArray("anomalies").size());
    assertEquals("Must have a minimum of at least three data points for anomaly detection.",
      response.getString("details"));
    assertTrue(response.getString("debug_msg").startsWith("Detection rejected"));
  }
}
