/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector.estimator;

import com.linkedin.metricwatch.engine.detector.DetectionThresholds;
import java.util.Arrays;

import static com.linkedin.metricwatch.common.utils.SeriesStatistics.isZero;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.slope;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.stdDev;


/**
 * Compares the least squares slope of the last K points, ending with the observation, to the slope of the K points
 * before them. Flags the observation if the slope changes by more than the trend threshold per step, relative to the
 * standard deviation of the 2K points. A sign reversal counts only if it is that large.
 */
public class TrendChangeEstimator implements Estimator {

  @Override
  public EstimatorType type() {
    return EstimatorType.TREND_CHANGE;
  }

  @Override
  public EstimatorResult estimate(double[] reference, double current, DetectionThresholds thresholds) {
    int k = thresholds.trendWindow();
    if (reference.length + 1 < 2 * k) {
      return EstimatorResult.abstain(type());
    }
    double[] window = Arrays.copyOfRange(reference, reference.length - (2 * k - 1), reference.length + 1);
    window[window.length - 1] = current;
    double windowStdDev = stdDev(window);
    if (isZero(windowStdDev)) {
      return EstimatorResult.abstain(type());
    }
    double previousSlope = slope(Arrays.copyOfRange(window, 0, k));
    double recentSlope = slope(Arrays.copyOfRange(window, k, 2 * k));
    double change = Math.abs(recentSlope - previousSlope) / windowStdDev;
    double threshold = thresholds.trendThreshold();
    return EstimatorResult.of(type(), change > threshold, EstimatorResult.thresholdScore(change, threshold), change);
  }
}
