package io.github.themoah.anomaly.detection;

import io.vertx.core.json.JsonObject;

/**
 * Weights applied to each distance check when combining them into one anomaly score.
 *
 * <p>The defaults sum to 1.05, so a point failing every check scores slightly above 1.0.
 *
 * @param sds weight of the standard deviation check
 * @param mads weight of the median absolute deviation check
 * @param iqrs weight of the interquartile range check
 */
public record Weights(
  double sds,
  double mads,
  double iqrs
) {

  public static final Weights DEFAULT = new Weights(0.25, 0.45, 0.35);

  public Weights {
    if (sds < 0 || mads < 0 || iqrs < 0) {
      throw new IllegalArgumentException("Weights must be non-negative: sds=" + sds
        + ", mads=" + mads + ", iqrs=" + iqrs);
    }
  }

  /**
   * Combines the three check scores of one observation.
   */
  public double combine(double sdsScore, double madsScore, double iqrsScore) {
    return sdsScore * sds + madsScore * mads + iqrsScore * iqrs;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("sds", sds)
      .put("mads", mads)
      .put("iqrs", iqrs);
  }
}
