/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.monitor.sampling;

import java.util.Objects;

import static com.linkedin.metricwatch.MetricWatchUtils.utcDateFor;


/**
 * A single observed value of a named metric. Immutable once created.
 */
public final class MetricSample {
  private final String _metricName;
  private final long _timeMs;
  private final double _value;

  public MetricSample(String metricName, long timeMs, double value) {
    _metricName = metricName;
    _timeMs = timeMs;
    _value = value;
  }

  /**
   * @return The name of the metric this sample belongs to.
   */
  public String metricName() {
    return _metricName;
  }

  /**
   * @return The time this sample was taken in milliseconds.
   */
  public long timeMs() {
    return _timeMs;
  }

  /**
   * @return The observed value.
   */
  public double value() {
    return _value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MetricSample that = (MetricSample) o;
    return _timeMs == that._timeMs && Double.compare(that._value, _value) == 0 && _metricName.equals(that._metricName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_metricName, _timeMs, _value);
  }

  @Override
  public String toString() {
    return String.format("{metric=%s,time=%s,value=%f}", _metricName, utcDateFor(_timeMs), _value);
  }
}
