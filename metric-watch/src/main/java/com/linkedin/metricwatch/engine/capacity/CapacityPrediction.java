/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.capacity;

import static com.linkedin.metricwatch.MetricWatchUtils.utcDateFor;


/**
 * The predicted breach of a capacity threshold by a metric within a horizon.
 */
public final class CapacityPrediction {
  private final String _metricName;
  private final double _threshold;
  private final BreachDirection _direction;
  private final double _currentValue;
  private final Long _predictedBreachAtMs;
  private final Double _hoursToBreach;
  private final Urgency _urgency;
  private final String _recommendation;
  private final int _horizonHours;

  public CapacityPrediction(String metricName,
                            double threshold,
                            BreachDirection direction,
                            double currentValue,
                            Long predictedBreachAtMs,
                            Double hoursToBreach,
                            Urgency urgency,
                            String recommendation,
                            int horizonHours) {
    _metricName = metricName;
    _threshold = threshold;
    _direction = direction;
    _currentValue = currentValue;
    _predictedBreachAtMs = predictedBreachAtMs;
    _hoursToBreach = hoursToBreach;
    _urgency = urgency;
    _recommendation = recommendation;
    _horizonHours = horizonHours;
  }

  public String metricName() {
    return _metricName;
  }

  public double threshold() {
    return _threshold;
  }

  public BreachDirection direction() {
    return _direction;
  }

  /**
   * @return The last observed value of the metric.
   */
  public double currentValue() {
    return _currentValue;
  }

  /**
   * @return {@code true} if the threshold is predicted to be breached within the horizon.
   */
  public boolean breachPredicted() {
    return _predictedBreachAtMs != null;
  }

  /**
   * @return Predicted time of the breach in milliseconds, or {@code null} if no breach is predicted.
   */
  public Long predictedBreachAtMs() {
    return _predictedBreachAtMs;
  }

  /**
   * @return Hours from the last observed sample to the predicted breach, or {@code null} if no breach is predicted.
   */
  public Double hoursToBreach() {
    return _hoursToBreach;
  }

  public Urgency urgency() {
    return _urgency;
  }

  public String recommendation() {
    return _recommendation;
  }

  public int horizonHours() {
    return _horizonHours;
  }

  @Override
  public String toString() {
    if (_predictedBreachAtMs == null) {
      return String.format("{%s %s %.3f: no breach within %dh}", _metricName, _direction, _threshold, _horizonHours);
    }
    return String.format("{%s %s %.3f: breach in %.1fh at %s, urgency=%s}", _metricName, _direction, _threshold,
                         _hoursToBreach, utcDateFor(_predictedBreachAtMs), _urgency);
  }
}
