package io.github.themoah.anomaly.detection.normality;

import io.vertx.core.json.JsonObject;

/**
 * Verdict of a single normality test.
 *
 * @param test test name
 * @param passes true when the data is consistent with a normal distribution, or the test was skipped
 * @param skipped true when the test did not apply to this sample
 * @param narrative human-readable explanation for the diagnostics bundle
 */
public record NormalityVerdict(
  String test,
  boolean passes,
  boolean skipped,
  String narrative
) {

  /**
   * A skipped test defaults to "passes".
   */
  public static NormalityVerdict skipped(String test, String reason) {
    return new NormalityVerdict(test, true, true, reason);
  }

  public static NormalityVerdict of(String test, boolean passes, String narrative) {
    return new NormalityVerdict(test, passes, false, narrative);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("passes", passes)
      .put("skipped", skipped)
      .put("narrative", narrative);
  }
}
