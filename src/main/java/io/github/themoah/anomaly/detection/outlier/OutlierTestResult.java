package io.github.themoah.anomaly.detection.outlier;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one extended outlier test.
 *
 * @param test test name
 * @param applicable false when the test could not run on this dataset
 * @param outlierIndexes positions (in input order) flagged by the test
 * @param narrative human-readable explanation
 */
public record OutlierTestResult(
  String test,
  boolean applicable,
  List<Integer> outlierIndexes,
  String narrative
) {

  public OutlierTestResult {
    outlierIndexes = List.copyOf(outlierIndexes);
  }

  public static OutlierTestResult notApplicable(String test, String reason) {
    return new OutlierTestResult(test, false, List.of(), reason);
  }

  /**
   * Builds a result from the values a test removed.
   *
   * <p>The mask is a value set-difference: a position is flagged when its value no longer
   * occurs in the sequence left after removing {@code removedValues} (one occurrence each).
   * A removed value that still has a duplicate among the remaining values flags nothing.
   */
  static OutlierTestResult fromRemovedValues(
      String test, double[] values, List<Double> removedValues, String narrative) {
    Map<Double, Integer> remaining = new HashMap<>();
    for (double v : values) {
      remaining.merge(v, 1, Integer::sum);
    }
    for (Double removed : removedValues) {
      remaining.computeIfPresent(removed, (k, count) -> count > 1 ? count - 1 : null);
    }

    List<Integer> indexes = new ArrayList<>();
    for (int i = 0; i < values.length; i++) {
      if (!remaining.containsKey(values[i])) {
        indexes.add(i);
      }
    }
    return new OutlierTestResult(test, true, indexes, narrative);
  }

  public boolean isOutlier(int index) {
    return outlierIndexes.contains(index);
  }

  public int outlierCount() {
    return outlierIndexes.size();
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("test", test)
      .put("applicable", applicable)
      .put("outlier_count", outlierIndexes.size())
      .put("outlier_indexes", new JsonArray(new ArrayList<>(outlierIndexes)))
      .put("narrative", narrative);
  }
}
