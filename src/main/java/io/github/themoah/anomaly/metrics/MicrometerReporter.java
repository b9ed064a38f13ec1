package io.github.themoah.anomaly.metrics;

import io.github.themoah.anomaly.detection.DetectionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.vertx.core.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports detection metrics using a Micrometer MeterRegistry.
 */
public class MicrometerReporter implements MetricsReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerReporter.class);

  static final String REQUESTS = "anomaly.detection.requests";
  static final String POINTS = "anomaly.detection.points";
  static final String FLAGGED = "anomaly.detection.flagged";
  static final String DURATION = "anomaly.detection.duration";

  private final MeterRegistry registry;
  private final Counter scoredRequests;
  private final Counter rejectedRequests;
  private final Counter points;
  private final Counter flagged;
  private final Timer duration;

  public MicrometerReporter(MeterRegistry registry) {
    this.registry = registry;
    this.scoredRequests = Counter.builder(REQUESTS)
      .description("Detection requests by outcome")
      .tag("outcome", "scored")
      .register(registry);
    this.rejectedRequests = Counter.builder(REQUESTS)
      .description("Detection requests by outcome")
      .tag("outcome", "rejected")
      .register(registry);
    this.points = Counter.builder(POINTS)
      .description("Observations submitted for detection")
      .register(registry);
    this.flagged = Counter.builder(FLAGGED)
      .description("Observations flagged as anomalies")
      .register(registry);
    this.duration = Timer.builder(DURATION)
      .description("Time spent in detection")
      .register(registry);
  }

  @Override
  public void recordDetection(DetectionResult result, long durationNanos) {
    if (result.isRejected()) {
      rejectedRequests.increment();
    } else {
      scoredRequests.increment();
    }
    points.increment(result.anomalies().size());
    flagged.increment(result.anomalyCount());
    duration.record(durationNanos, TimeUnit.NANOSECONDS);
  }

  @Override
  public Future<Void> close() {
    log.info("Closing MicrometerReporter");
    registry.close();
    return Future.succeededFuture();
  }
}
