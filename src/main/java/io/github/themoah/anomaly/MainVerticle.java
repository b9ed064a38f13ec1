package io.github.themoah.anomaly;

import io.github.themoah.anomaly.config.AppConfig;
import io.github.themoah.anomaly.config.DetectionConfig;
import io.github.themoah.anomaly.health.HealthCheckHandler;
import io.github.themoah.anomaly.http.DetectionHandler;
import io.github.themoah.anomaly.http.DocumentationHandler;
import io.github.themoah.anomaly.metrics.MetricsConfig;
import io.github.themoah.anomaly.metrics.MetricsReporter;
import io.github.themoah.anomaly.metrics.MicrometerConfig;
import io.github.themoah.anomaly.metrics.MicrometerReporter;
import io.github.themoah.anomaly.metrics.PrometheusHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for the anomaly detector.
 * Wires the detector, metrics and health checks into the HTTP server.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private final AppConfig appConfig;
  private final DetectionConfig detectionConfig;
  private final MetricsConfig metricsConfig;
  private final AtomicBoolean ready = new AtomicBoolean(false);

  private MetricsReporter reporter = MetricsReporter.NOOP;
  private HttpServer httpServer;

  public MainVerticle() {
    this(AppConfig.fromEnvironment(), DetectionConfig.fromEnvironment(), MetricsConfig.fromEnvironment());
  }

  /**
   * Constructor for testing with explicit configuration.
   */
  MainVerticle(AppConfig appConfig, DetectionConfig detectionConfig, MetricsConfig metricsConfig) {
    this.appConfig = appConfig;
    this.detectionConfig = detectionConfig;
    this.metricsConfig = metricsConfig;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting anomaly detector MainVerticle");

    Router router = Router.router(vertx);
    reporter = createReporter(metricsConfig, router);

    new DocumentationHandler().registerRoutes(router);
    new HealthCheckHandler(ready::get).registerRoutes(router);
    new DetectionHandler(vertx, detectionConfig.createDetector(), detectionConfig, reporter,
      appConfig.maxBodyBytes()).registerRoutes(router);

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader("content-type", "application/json")
        .end("{\"error\": \"Not Found\"}");
    });

    startHttpServer(router, appConfig.httpPort())
      .onSuccess(server -> {
        httpServer = server;
        ready.set(true);
        log.info("Anomaly detector started successfully on port {}", server.actualPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start anomaly detector", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping anomaly detector MainVerticle");
    ready.set(false);

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    stopHttpServer
      .compose(v -> reporter.close())
      .onSuccess(v -> {
        log.info("Anomaly detector stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during anomaly detector shutdown", err);
        stopPromise.fail(err);
      });
  }

  /**
   * Returns the port the HTTP server is listening on, or -1 before startup.
   */
  int actualPort() {
    return httpServer != null ? httpServer.actualPort() : -1;
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", server.actualPort()))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private MetricsReporter createReporter(MetricsConfig config, Router router) {
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return MetricsReporter.NOOP;
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return MetricsReporter.NOOP;
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }

    return new MicrometerReporter(registry);
  }
}
