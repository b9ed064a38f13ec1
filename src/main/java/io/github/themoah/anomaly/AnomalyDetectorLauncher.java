package io.github.themoah.anomaly;

import io.github.themoah.anomaly.config.VertxConfig;
import io.vertx.core.Vertx;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the anomaly detector service.
 *
 * <p>Deploys {@link MainVerticle} and closes Vert.x on JVM shutdown so in-flight
 * detections finish and the meter registry is flushed.
 */
public class AnomalyDetectorLauncher {

  private static final Logger log = LoggerFactory.getLogger(AnomalyDetectorLauncher.class);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

  public static void main(String[] args) {
    Vertx vertx = Vertx.vertx(VertxConfig.createVertxOptions());
    Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(vertx), "anomaly-detector-shutdown"));

    vertx.deployVerticle(new MainVerticle(), VertxConfig.createDeploymentOptions())
      .onSuccess(id -> log.info("Anomaly detector deployed: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy anomaly detector", err);
        System.exit(1);
      });
  }

  private static void shutdown(Vertx vertx) {
    log.info("Shutdown requested, closing Vert.x");
    CountDownLatch closed = new CountDownLatch(1);
    vertx.close().onComplete(ar -> {
      if (ar.failed()) {
        log.error("Error while closing Vert.x", ar.cause());
      }
      closed.countDown();
    });
    try {
      if (!closed.await(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Vert.x did not close within {}s", SHUTDOWN_TIMEOUT_SECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
