/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector.estimator;

import com.linkedin.metricwatch.engine.detector.DetectionThresholds;

import static com.linkedin.metricwatch.common.utils.SeriesStatistics.differences;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.isZero;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.stdDev;


/**
 * Flags a sudden jump: the difference between the observation and the previous value, in units of the standard
 * deviation of the first differences of the reference values, exceeds the spike threshold. Independent of the level
 * of the metric.
 */
public class SpikeEstimator implements Estimator {
  static final int MIN_REFERENCE = 3;

  @Override
  public EstimatorType type() {
    return EstimatorType.SPIKE;
  }

  @Override
  public EstimatorResult estimate(double[] reference, double current, DetectionThresholds thresholds) {
    if (reference.length < MIN_REFERENCE) {
      return EstimatorResult.abstain(type());
    }
    double diffStdDev = stdDev(differences(reference));
    if (isZero(diffStdDev)) {
      return EstimatorResult.abstain(type());
    }
    double jump = Math.abs(current - reference[reference.length - 1]) / diffStdDev;
    double threshold = thresholds.spikeThreshold();
    return EstimatorResult.of(type(), jump > threshold, EstimatorResult.thresholdScore(jump, threshold), jump);
  }
}
