/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector.estimator;

import com.linkedin.metricwatch.engine.detector.DetectionThresholds;


/**
 * A stateless statistical test of an observation against the values observed before it. Any state an estimator
 * needs, e.g. a smoothed level, is recomputed from the reference values on each call.
 */
public interface Estimator {

  /**
   * @return The type of this estimator.
   */
  EstimatorType type();

  /**
   * Judge the given observation. Implementations must not throw on degenerate input such as an empty or constant
   * reference window, they abstain instead.
   *
   * @param reference The values observed before the current one, oldest first.
   * @param current The observed value to judge.
   * @param thresholds The thresholds to apply.
   * @return The result of this estimator.
   */
  EstimatorResult estimate(double[] reference, double current, DetectionThresholds thresholds);
}
