package io.github.themoah.anomaly.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for health check components.
 */
public class HealthCheckResponseTest {

  @Test
  void healthStatus_values() {
    assertEquals("UP", HealthStatus.UP.getValue());
    assertEquals("DOWN", HealthStatus.DOWN.getValue());
    assertEquals(200, HealthStatus.UP.httpStatusCode());
    assertEquals(503, HealthStatus.DOWN.httpStatusCode());
  }

  @Test
  void liveness() {
    HealthCheckResponse response = HealthCheckResponse.liveness();

    assertEquals(HealthStatus.UP, response.status());
    assertNull(response.detector());

    JsonObject json = response.toJson();
    assertEquals("UP", json.getString("status"));
    assertFalse(json.containsKey("detector"));
  }

  @Test
  void readiness_ready() {
    HealthCheckResponse response = HealthCheckResponse.readiness(true);

    assertEquals(HealthStatus.UP, response.status());
    assertEquals("{\"status\":\"UP\",\"detector\":\"ready\"}", response.toJson().encode());
  }

  @Test
  void readiness_starting() {
    HealthCheckResponse response = HealthCheckResponse.readiness(false);

    assertEquals(HealthStatus.DOWN, response.status());
    assertEquals("{\"status\":\"DOWN\",\"detector\":\"starting\"}", response.toJson().encode());
  }
}
