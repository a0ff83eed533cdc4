/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector.estimator;

import com.linkedin.metricwatch.engine.detector.DetectionThresholds;

import static com.linkedin.metricwatch.common.utils.SeriesStatistics.isZero;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.last;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.mean;


/**
 * Flags an observation whose deviation from the trailing moving average, relative to the moving average, exceeds
 * the deviation threshold. If the moving average is zero, the absolute deviation is used instead.
 */
public class MovingAverageEstimator implements Estimator {

  @Override
  public EstimatorType type() {
    return EstimatorType.MOVING_AVERAGE;
  }

  @Override
  public EstimatorResult estimate(double[] reference, double current, DetectionThresholds thresholds) {
    double[] window = last(reference, thresholds.movingAverageWindow());
    if (window.length == 0) {
      return EstimatorResult.abstain(type());
    }
    double movingAverage = mean(window);
    double deviation = Math.abs(current - movingAverage);
    double relativeDeviation = isZero(movingAverage) ? deviation : deviation / Math.abs(movingAverage);
    double threshold = thresholds.movingAverageDeviation();
    return EstimatorResult.of(type(), relativeDeviation > threshold,
                              EstimatorResult.thresholdScore(relativeDeviation, threshold), relativeDeviation);
  }
}
