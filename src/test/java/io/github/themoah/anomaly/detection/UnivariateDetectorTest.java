package io.github.themoah.anomaly.detection;

import static io.github.themoah.anomaly.detection.AnomalyScorerTest.observations;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.anomaly.detection.outlier.OutlierTestResult;
import io.github.themoah.anomaly.model.AnnotatedObservation;
import io.github.themoah.anomaly.model.Observation;
import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for UnivariateDetector.
 */
public class UnivariateDetectorTest {

  private static final double[] FIXTURE = {1, 1, 2, 2, 3, 3, 4, 4, 5, 5, 6, 7, 8, 9, 10, 2550, 9000};

  private final UnivariateDetector detector = new UnivariateDetector();

  @Test
  void fixture_sensitivitySweep() {
    Map<Integer, Integer> expected = Map.of(100, 17, 95, 15, 85, 8, 75, 5, 50, 2, 25, 2, 1, 1);
    List<Observation> observations = observations(FIXTURE);

    expected.forEach((sensitivity, count) -> assertEquals(count.longValue(),
      detector.detect(observations, sensitivity, 1.0).anomalyCount(),
      "sensitivity " + sensitivity));
  }

  @Test
  void fixture_defaultSensitivity_flagsTheTwoLargeValues() {
    DetectionResult result = detector.detect(observations(FIXTURE), 50, 1.0);

    for (int i = 0; i < FIXTURE.length; i++) {
      assertEquals(i >= 15, result.anomalies().get(i).isAnomaly(), "index " + i);
    }
  }

  @Test
  void fixture_capSweep() {
    double[] caps = {0.05, 0.1, 0.2, 0.3, 0.5, 0.9, 1.0};
    long[] expected = {1, 2, 3, 5, 8, 15, 17};
    List<Observation> observations = observations(FIXTURE);

    for (int i = 0; i < caps.length; i++) {
      assertEquals(expected[i], detector.detect(observations, 100, caps[i]).anomalyCount(), "cap " + caps[i]);
    }
  }

  @Test
  void singleDominantOutlier_isTheOnlyFlag() {
    DetectionResult result = detector.detect(observations(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 90), 50, 0.5);

    assertEquals(1, result.anomalyCount());
    AnnotatedObservation outlier = result.anomalies().get(10);
    assertTrue(outlier.isAnomaly());
    assertEquals("k10", outlier.key());
    assertEquals(90.0, outlier.value());
    assertEquals(1.0496778060969776, outlier.anomalyScore(), 1e-9);
  }

  @Test
  void capBelowSensitivityThreshold_hasNoEffect() {
    // sensitivity 75 alone flags the two ends of 1..10; a 0.2 cap allows the same two
    DetectionResult result = detector.detect(observations(1, 2, 3, 4, 5, 6, 7, 8, 9, 10), 75, 0.2);

    assertEquals(2, result.anomalyCount());
    assertTrue(result.anomalies().get(0).isAnomaly());
    assertTrue(result.anomalies().get(9).isAnomaly());
  }

  @Test
  void cardinality_isPreserved() {
    for (int n : new int[] {0, 1, 2, 3, 10}) {
      double[] values = new double[n];
      for (int i = 0; i < n; i++) {
        values[i] = i;
      }
      DetectionResult result = detector.detect(observations(values), 50, 1.0);
      assertEquals(n, result.anomalies().size(), "n=" + n);
    }
  }

  @Test
  void tooFewPoints_rejectedWithoutFlags() {
    List<Observation> observations = observations(1, 100);
    DetectionResult result = detector.detect(observations, 50, 1.0);

    assertTrue(result.isRejected());
    assertEquals(UnivariateDetector.MSG_TOO_FEW_POINTS, result.details().message());
    assertEquals(0, result.anomalyCount());
    for (int i = 0; i < observations.size(); i++) {
      AnnotatedObservation a = result.anomalies().get(i);
      assertEquals(observations.get(i).key(), a.key());
      assertEquals(observations.get(i).value(), a.value());
      assertEquals(0.0, a.anomalyScore());
      assertEquals(0.0, a.sds());
      assertEquals(0.0, a.mads());
      assertEquals(0.0, a.iqrs());
    }
  }

  @Test
  void invalidMaxFraction_rejected() {
    List<Observation> observations = observations(1, 2, 3, 4, 100);
    for (double cap : new double[] {0.0, -0.5, 1.5, Double.NaN}) {
      DetectionResult result = detector.detect(observations, 50, cap);
      assertTrue(result.isRejected(), "cap " + cap);
      assertEquals(UnivariateDetector.MSG_INVALID_MAX_FRACTION, result.details().message());
      assertEquals(0, result.anomalyCount());
    }
  }

  @Test
  void invalidSensitivity_rejected() {
    List<Observation> observations = observations(1, 2, 3, 4, 100);
    for (double sensitivity : new double[] {0.0, -1.0, 100.5, Double.NaN}) {
      DetectionResult result = detector.detect(observations, sensitivity, 1.0);
      assertTrue(result.isRejected(), "sensitivity " + sensitivity);
      assertEquals(UnivariateDetector.MSG_INVALID_SENSITIVITY, result.details().message());
      assertEquals(0, result.anomalyCount());
    }
  }

  @Test
  void validation_reportsFirstFailure() {
    assertEquals(UnivariateDetector.MSG_TOO_FEW_POINTS, UnivariateDetector.validate(2, 0, 0));
    assertEquals(UnivariateDetector.MSG_INVALID_MAX_FRACTION, UnivariateDetector.validate(3, 0, 0));
    assertEquals(UnivariateDetector.MSG_INVALID_SENSITIVITY, UnivariateDetector.validate(3, 0, 1));
    assertNull(UnivariateDetector.validate(3, 100, 1));
  }

  @Test
  void boundaryParameters_accepted() {
    DetectionResult result = detector.detect(observations(1, 2, 3), 100, 1.0);

    assertFalse(result.isRejected());
    assertEquals(UnivariateDetector.MSG_ENSEMBLE, result.details().message());
  }

  @Test
  void higherSensitivity_neverFlagsFewer() {
    List<Observation> observations = observations(FIXTURE);
    long previous = 0;
    for (int sensitivity = 1; sensitivity <= 100; sensitivity++) {
      long count = detector.detect(observations, sensitivity, 1.0).anomalyCount();
      assertTrue(count >= previous, "sensitivity " + sensitivity);
      previous = count;
    }
  }

  @Test
  void higherCap_neverFlagsFewer() {
    List<Observation> observations = observations(FIXTURE);
    long previous = 0;
    for (int step = 1; step <= 20; step++) {
      long count = detector.detect(observations, 90, step / 20.0).anomalyCount();
      assertTrue(count >= previous, "cap " + step / 20.0);
      previous = count;
    }
  }

  @Test
  void constantData_nothingFlagged() {
    DetectionResult result = detector.detect(observations(5, 5, 5, 5, 5), 100, 1.0);

    assertEquals(0, result.anomalyCount());
    result.anomalies().forEach(a -> assertEquals(0.0, a.anomalyScore()));
  }

  @Test
  void sameInput_sameResult() {
    List<Observation> observations = observations(FIXTURE);

    assertEquals(detector.detect(observations, 85, 0.5, true).anomalies(),
      detector.detect(observations, 85, 0.5, true).anomalies());
  }

  @Test
  void diagnostics_onlyWhenRequested() {
    DetectionResult plain = detector.detect(observations(FIXTURE), 50, 1.0);
    assertNull(plain.details().normalization());
    assertTrue(plain.details().extendedTests().isEmpty());
    assertNotNull(plain.details().baseCalculations());

    DetectionResult debug = detector.detect(observations(FIXTURE), 50, 1.0, true);
    assertNotNull(debug.details().normalization());
    assertEquals(3, debug.details().extendedTests().size());
  }

  @Test
  void diagnostics_doNotChangeScores() {
    List<Observation> observations = observations(FIXTURE);

    assertEquals(detector.detect(observations, 50, 1.0).anomalies(),
      detector.detect(observations, 50, 1.0, true).anomalies());
  }

  @Test
  void diagnostics_extendedTestsAgreeOnTheFixture() {
    List<OutlierTestResult> tests = detector.detect(observations(FIXTURE), 50, 1.0, true)
      .details().extendedTests();

    OutlierTestResult grubbs = tests.get(0);
    assertEquals("grubbs", grubbs.test());
    assertEquals(List.of(16), grubbs.outlierIndexes());

    OutlierTestResult gesd = tests.get(1);
    assertEquals("gesd", gesd.test());
    assertEquals(List.of(15, 16), gesd.outlierIndexes());

    OutlierTestResult dixon = tests.get(2);
    assertEquals("dixon", dixon.test());
    assertEquals(List.of(16), dixon.outlierIndexes());
  }

  @Test
  void details_json() {
    Object rejected = detector.detect(observations(1, 2), 50, 1.0).details().toJson();
    assertEquals(UnivariateDetector.MSG_TOO_FEW_POINTS, rejected);

    JsonObject details = (JsonObject) detector.detect(observations(FIXTURE), 50, 1.0, true).details().toJson();
    assertEquals(UnivariateDetector.MSG_ENSEMBLE, details.getString("message"));
    assertEquals(17, details.getJsonObject("base_calculations").getInteger("len"));
    assertFalse(details.getJsonObject("normalization").getJsonObject("initial_normality_checks")
      .getBoolean("is_normal"));
    assertTrue(details.getJsonObject("extended_tests").containsKey("gesd"));
  }

  @Test
  void nullObservations_rejected() {
    assertThrows(NullPointerException.class, () -> detector.detect(null, 50, 1.0));
  }

  @Test
  void weights_areReported() {
    assertEquals(Weights.DEFAULT, detector.detect(observations(1, 2, 3), 50, 1.0).weights());
  }
}
