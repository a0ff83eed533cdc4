/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector.estimator;

import com.linkedin.metricwatch.engine.detector.DetectionThresholds;

import static com.linkedin.metricwatch.common.utils.SeriesStatistics.isZero;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.last;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.mean;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.stdDev;


/**
 * Flags an observation whose distance to the mean of the trailing window exceeds the z-score threshold, in units of
 * the standard deviation of the window.
 */
public class ZScoreEstimator implements Estimator {

  @Override
  public EstimatorType type() {
    return EstimatorType.Z_SCORE;
  }

  @Override
  public EstimatorResult estimate(double[] reference, double current, DetectionThresholds thresholds) {
    double[] window = last(reference, thresholds.zScoreWindow());
    double stdDev = stdDev(window);
    if (window.length < 2 || isZero(stdDev)) {
      return EstimatorResult.abstain(type());
    }
    double zScore = Math.abs(current - mean(window)) / stdDev;
    double threshold = thresholds.zScoreThreshold();
    return EstimatorResult.of(type(), zScore > threshold, EstimatorResult.thresholdScore(zScore, threshold), zScore);
  }
}
