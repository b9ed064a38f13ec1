package io.github.themoah.anomaly.metrics;

import io.github.themoah.anomaly.detection.DetectionResult;
import io.vertx.core.Future;

/**
 * Records detection activity to an external metrics system.
 */
public interface MetricsReporter {

  /**
   * Reporter used when metrics are disabled.
   */
  MetricsReporter NOOP = new MetricsReporter() {
    @Override
    public void recordDetection(DetectionResult result, long durationNanos) {
    }

    @Override
    public Future<Void> close() {
      return Future.succeededFuture();
    }
  };

  /**
   * Records one completed detection call.
   *
   * @param result the detection outcome
   * @param durationNanos time spent detecting
   */
  void recordDetection(DetectionResult result, long durationNanos);

  /**
   * Closes the reporter and releases resources.
   *
   * @return Future that completes when closed
   */
  Future<Void> close();
}
