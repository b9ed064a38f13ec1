package io.github.themoah.anomaly.detection.normality;

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Deterministic samples built from distribution quantiles.
 */
final class NormalitySamples {

  private NormalitySamples() {}

  static double[] normal(int n) {
    NormalDistribution standard = new NormalDistribution();
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = standard.inverseCumulativeProbability((i + 0.5) / n);
    }
    return values;
  }

  static double[] exponential(int n) {
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = -Math.log(1.0 - (i + 0.5) / n);
    }
    return values;
  }

  static double[] lognormal(int n) {
    double[] values = normal(n);
    for (int i = 0; i < n; i++) {
      values[i] = Math.exp(values[i]);
    }
    return values;
  }

  static double[] sequence(int n) {
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = i + 1;
    }
    return values;
  }
}
