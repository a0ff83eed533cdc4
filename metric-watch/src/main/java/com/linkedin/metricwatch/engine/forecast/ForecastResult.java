/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.linkedin.metricwatch.MetricWatchUtils.utcDateFor;


/**
 * The projection of a metric over a horizon. Created fresh on every forecast and never persisted.
 */
public final class ForecastResult {
  private final String _metricName;
  private final long _generatedAtMs;
  private final long _originMs;
  private final int _horizonHours;
  private final ForecastMethod _method;
  private final List<ForecastPoint> _points;
  private final Trend _trend;
  private final Double _rSquared;
  private final Map<ForecastMethod, Double> _methodWeights;

  public ForecastResult(String metricName,
                        long generatedAtMs,
                        long originMs,
                        int horizonHours,
                        ForecastMethod method,
                        List<ForecastPoint> points,
                        Trend trend,
                        Double rSquared,
                        Map<ForecastMethod, Double> methodWeights) {
    _metricName = metricName;
    _generatedAtMs = generatedAtMs;
    _originMs = originMs;
    _horizonHours = horizonHours;
    _method = method;
    _points = Collections.unmodifiableList(points);
    _trend = trend;
    _rSquared = rSquared;
    Map<ForecastMethod, Double> weights = new EnumMap<>(ForecastMethod.class);
    weights.putAll(methodWeights);
    _methodWeights = Collections.unmodifiableMap(weights);
  }

  public String metricName() {
    return _metricName;
  }

  public long generatedAtMs() {
    return _generatedAtMs;
  }

  /**
   * @return Time of the last observed sample in milliseconds. The offsets of the points are relative to it.
   */
  public long originMs() {
    return _originMs;
  }

  public int horizonHours() {
    return _horizonHours;
  }

  public ForecastMethod method() {
    return _method;
  }

  /**
   * @return One point per hour of the horizon, ordered by offset.
   */
  public List<ForecastPoint> points() {
    return _points;
  }

  public Trend trend() {
    return _trend;
  }

  /**
   * @return The coefficient of determination of the linear fit, or {@code null} if it is not defined for the method
   * or the history.
   */
  public Double rSquared() {
    return _rSquared;
  }

  /**
   * @return The weight of each method that contributed to this forecast. Weights sum up to 1.
   */
  public Map<ForecastMethod, Double> methodWeights() {
    return _methodWeights;
  }

  @Override
  public String toString() {
    return String.format("{metric=%s,origin=%s,horizon=%dh,method=%s,trend=%s,weights=%s}", _metricName,
                         utcDateFor(_originMs), _horizonHours, _method, _trend, _methodWeights);
  }
}
