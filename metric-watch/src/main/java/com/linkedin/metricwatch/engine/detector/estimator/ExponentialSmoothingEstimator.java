/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector.estimator;

import com.linkedin.metricwatch.engine.detector.DetectionThresholds;

import static com.linkedin.metricwatch.common.utils.SeriesStatistics.isZero;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.stdDev;


/**
 * Smooths the reference values with {@code S_t = alpha * x_t + (1 - alpha) * S_t-1} and flags an observation whose
 * residual against the last smoothed level exceeds the z-score threshold, in units of the standard deviation of the
 * one-step residuals of the reference values.
 */
public class ExponentialSmoothingEstimator implements Estimator {
  static final int MIN_REFERENCE = 3;

  @Override
  public EstimatorType type() {
    return EstimatorType.EXPONENTIAL_SMOOTHING;
  }

  @Override
  public EstimatorResult estimate(double[] reference, double current, DetectionThresholds thresholds) {
    if (reference.length < MIN_REFERENCE) {
      return EstimatorResult.abstain(type());
    }
    double alpha = thresholds.smoothingAlpha();
    double smoothed = reference[0];
    double[] residuals = new double[reference.length - 1];
    for (int i = 1; i < reference.length; i++) {
      residuals[i - 1] = reference[i] - smoothed;
      smoothed = alpha * reference[i] + (1 - alpha) * smoothed;
    }
    double residualStdDev = stdDev(residuals);
    if (isZero(residualStdDev)) {
      return EstimatorResult.abstain(type());
    }
    double normalizedResidual = Math.abs(current - smoothed) / residualStdDev;
    double threshold = thresholds.zScoreThreshold();
    return EstimatorResult.of(type(), normalizedResidual > threshold,
                              EstimatorResult.thresholdScore(normalizedResidual, threshold), normalizedResidual);
  }
}
