package io.github.themoah.anomaly.detection.normality;

import io.vertx.core.json.JsonObject;

/**
 * The three individual normality verdicts for one dataset.
 *
 * <p>The verdicts are kept separate; {@link #isNormal()} applies the policy that every
 * test must pass.
 */
public record NormalityReport(
  NormalityVerdict shapiroWilk,
  NormalityVerdict dagostinoPearson,
  NormalityVerdict andersonDarling
) {

  public boolean isNormal() {
    return shapiroWilk.passes() && dagostinoPearson.passes() && andersonDarling.passes();
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("is_normal", isNormal())
      .put(shapiroWilk.test(), shapiroWilk.toJson())
      .put(dagostinoPearson.test(), dagostinoPearson.toJson())
      .put(andersonDarling.test(), andersonDarling.toJson());
  }
}
