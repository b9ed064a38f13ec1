package io.github.themoah.anomaly.health;

import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for health check endpoints.
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final BooleanSupplier readiness;

  /**
   * @param readiness reports whether the detection endpoint is accepting requests
   */
  public HealthCheckHandler(BooleanSupplier readiness) {
    this.readiness = readiness;
  }

  public void registerRoutes(Router router) {
    router.get("/healthz").handler(ctx -> respond(ctx, HealthCheckResponse.liveness()));
    router.get("/readyz").handler(ctx -> respond(ctx, HealthCheckResponse.readiness(readiness.getAsBoolean())));
    log.info("Health check routes registered: /healthz, /readyz");
  }

  private void respond(RoutingContext ctx, HealthCheckResponse response) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(response.status().httpStatusCode())
      .end(response.toJson().encode());
  }
}
