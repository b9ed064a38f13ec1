package io.github.themoah.anomaly.http;

import io.github.themoah.anomaly.config.DetectionConfig;
import io.github.themoah.anomaly.detection.DetectionResult;
import io.github.themoah.anomaly.detection.UnivariateDetector;
import io.github.themoah.anomaly.metrics.MetricsReporter;
import io.github.themoah.anomaly.model.AnnotatedObservation;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for the univariate detection endpoint.
 *
 * <p>Detection runs on the worker pool without ordering, so concurrent requests are scored in
 * parallel and the event loop is never blocked.
 */
public class DetectionHandler {

  private static final Logger log = LoggerFactory.getLogger(DetectionHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";
  static final String PATH = "/detect/univariate";

  private final Vertx vertx;
  private final UnivariateDetector detector;
  private final DetectionConfig config;
  private final MetricsReporter reporter;
  private final long maxBodyBytes;

  public DetectionHandler(
    Vertx vertx,
    UnivariateDetector detector,
    DetectionConfig config,
    MetricsReporter reporter,
    long maxBodyBytes
  ) {
    this.vertx = vertx;
    this.detector = detector;
    this.config = config;
    this.reporter = reporter;
    this.maxBodyBytes = maxBodyBytes;
  }

  public void registerRoutes(Router router) {
    router.post(PATH)
      .handler(BodyHandler.create(false).setBodyLimit(maxBodyBytes))
      .handler(this::handleDetect);
    log.info("Detection route registered: POST {}", PATH);
  }

  private void handleDetect(RoutingContext ctx) {
    DetectionRequest request;
    try {
      request = DetectionRequest.parse(ctx.body().buffer(), ctx.queryParams(), config);
    } catch (IllegalArgumentException e) {
      log.warn("Bad detection request: {}", e.getMessage());
      respond(ctx, 400, new JsonObject().put("error", e.getMessage()));
      return;
    }

    vertx.executeBlocking(() -> {
        long start = System.nanoTime();
        DetectionResult result = detector.detect(
          request.observations(),
          request.sensitivityScore(),
          request.maxFractionalAnomalies(),
          request.debug());
        reporter.recordDetection(result, System.nanoTime() - start);
        return result;
      }, false)
      .onSuccess(result -> respond(ctx, 200, toResponse(result, request.debug())))
      .onFailure(err -> {
        log.error("Detection failed for {} points", request.observations().size(), err);
        respond(ctx, 500, new JsonObject().put("error", "Internal Server Error"));
      });
  }

  /**
   * Builds the response body. Weights and details are only included in debug mode.
   */
  static JsonObject toResponse(DetectionResult result, boolean debug) {
    JsonArray anomalies = new JsonArray();
    for (AnnotatedObservation observation : result.anomalies()) {
      anomalies.add(observation.toJson());
    }

    JsonObject response = new JsonObject().put("anomalies", anomalies);
    if (debug) {
      String debugMsg = result.isRejected()
        ? "Detection rejected: " + result.details().message()
        : "Flagged " + result.anomalyCount() + " of " + result.anomalies().size() + " observations.";
      response.put("debug_msg", debugMsg);
      response.put("weights", result.weights().toJson());
      response.put("details", result.details().toJson());
    }
    return response;
  }

  private void respond(RoutingContext ctx, int statusCode, JsonObject body) {
    if (ctx.response().ended()) {
      return;
    }
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(statusCode)
      .end(body.encode());
  }
}
