/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector.estimator;

/**
 * The vote of a single estimator on an observation. An estimator abstains when it cannot judge the observation, e.g.
 * because its window has zero variance or too few values. An abstaining estimator never flags.
 */
public final class EstimatorResult {
  public static final double SATURATION_FACTOR = 5.0 / 3.0;
  private final EstimatorType _type;
  private final boolean _abstained;
  private final boolean _flagged;
  private final double _score;
  private final double _rawValue;

  private EstimatorResult(EstimatorType type, boolean abstained, boolean flagged, double score, double rawValue) {
    _type = type;
    _abstained = abstained;
    _flagged = flagged;
    _score = score;
    _rawValue = rawValue;
  }

  /**
   * @param type Estimator type.
   * @return The result of an estimator that abstains.
   */
  public static EstimatorResult abstain(EstimatorType type) {
    return new EstimatorResult(type, true, false, 0.0, Double.NaN);
  }

  /**
   * @param type Estimator type.
   * @param flagged Whether the estimator considers the observation anomalous.
   * @param score How extreme the observation is, clamped to [0, 1].
   * @param rawValue The statistic the estimator compared to its threshold.
   * @return The result of an estimator that voted.
   */
  public static EstimatorResult of(EstimatorType type, boolean flagged, double score, double rawValue) {
    return new EstimatorResult(type, false, flagged, Math.max(0.0, Math.min(1.0, score)), rawValue);
  }

  /**
   * Normalize the statistic of a threshold based estimator to [0, 1]. The score grows linearly with the statistic and
   * saturates at {@link #SATURATION_FACTOR} times the threshold, so a statistic at the threshold scores 0.6 and, with
   * the default z-score threshold of 3, a statistic of five standard deviations or beyond scores 1.
   *
   * @param rawValue The statistic.
   * @param threshold The threshold of the estimator.
   * @return The normalized score.
   */
  public static double thresholdScore(double rawValue, double threshold) {
    return Math.min(1.0, rawValue / (SATURATION_FACTOR * threshold));
  }

  public EstimatorType type() {
    return _type;
  }

  public boolean abstained() {
    return _abstained;
  }

  public boolean flagged() {
    return _flagged;
  }

  public double score() {
    return _score;
  }

  public double rawValue() {
    return _rawValue;
  }

  @Override
  public String toString() {
    if (_abstained) {
      return String.format("{%s: abstained}", _type);
    }
    return String.format("{%s: flagged=%s,score=%.3f,raw=%.3f}", _type, _flagged, _score, _rawValue);
  }
}
