package io.github.themoah.anomaly.http;

import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;

/**
 * Serves the welcome message at the root path.
 */
public class DocumentationHandler {

  static final JsonObject WELCOME = new JsonObject()
    .put("message", "Welcome to the anomaly detector service")
    .put("documentation", "POST a JSON array of {\"key\": string, \"value\": number} objects to "
      + DetectionHandler.PATH + " with optional sensitivity_score (0-100], "
      + "max_fractional_anomalies (0-1] and debug query parameters.");

  public void registerRoutes(Router router) {
    router.get("/").handler(ctx -> ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, "application/json")
      .end(WELCOME.encode()));
  }
}
