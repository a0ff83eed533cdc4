/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector.estimator;

import com.linkedin.metricwatch.engine.detector.DetectionThresholds;

import static com.linkedin.metricwatch.common.utils.SeriesStatistics.isZero;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.last;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.percentile;


/**
 * Flags an observation outside of the fences {@code [Q1 - k * IQR, Q3 + k * IQR]} of the trailing window. The fences
 * are {@code k + 1/2} interquartile ranges away from the midpoint of the quartiles, which is the threshold the score
 * is normalized with, see {@link EstimatorResult#thresholdScore(double, double)}.
 */
public class IqrEstimator implements Estimator {
  static final int MIN_WINDOW = 4;

  @Override
  public EstimatorType type() {
    return EstimatorType.IQR;
  }

  @Override
  public EstimatorResult estimate(double[] reference, double current, DetectionThresholds thresholds) {
    double[] window = last(reference, thresholds.zScoreWindow());
    if (window.length < MIN_WINDOW) {
      return EstimatorResult.abstain(type());
    }
    double q1 = percentile(window, 25.0);
    double q3 = percentile(window, 75.0);
    double iqr = q3 - q1;
    if (isZero(iqr)) {
      return EstimatorResult.abstain(type());
    }
    double lowerFence = q1 - thresholds.iqrMultiplier() * iqr;
    double upperFence = q3 + thresholds.iqrMultiplier() * iqr;
    double distance = Math.max(0.0, Math.max(lowerFence - current, current - upperFence));
    double midpointDistance = Math.abs(current - (q1 + q3) / 2.0) / iqr;
    return EstimatorResult.of(type(), distance > 0.0,
                              EstimatorResult.thresholdScore(midpointDistance, thresholds.iqrMultiplier() + 0.5),
                              distance);
  }
}
