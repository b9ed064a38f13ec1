package io.github.themoah.anomaly.detection.normality;

import io.vertx.core.json.JsonObject;

/**
 * Outcome of the normalization step.
 *
 * <p>{@code transformedValues} is for library callers and is not part of {@link #toJson()}.
 * It is an array, so the generated {@code equals} and {@code hashCode} compare it by reference.
 *
 * @param useFittedResults true when {@code transformedValues} holds usable normal-looking data
 * @param lambda fitted Box-Cox lambda, null when no transform was fitted
 * @param transformedValues raw values (already normal) or transformed values, null when skipped
 * @param initialChecks normality verdicts on the raw data
 * @param fittedChecks normality verdicts on the transformed data, null when no transform was fitted
 * @param status explanation of what was done, or why fitting was skipped
 */
public record NormalizationResult(
  boolean useFittedResults,
  Double lambda,
  double[] transformedValues,
  NormalityReport initialChecks,
  NormalityReport fittedChecks,
  String status
) {

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("use_fitted_results", useFittedResults)
      .put("initial_normality_checks", initialChecks.toJson())
      .put("fitting_status", status);
    if (lambda != null) {
      json.put("fitted_lambda", lambda);
    }
    if (fittedChecks != null) {
      json.put("fitted_normality_checks", fittedChecks.toJson());
    }
    return json;
  }
}
