/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast;

/**
 * A forecast value with its confidence band.
 */
public final class ForecastPoint {
  private final double _offsetHours;
  private final double _predictedValue;
  private final double _lowerBound;
  private final double _upperBound;

  public ForecastPoint(double offsetHours, double predictedValue, double lowerBound, double upperBound) {
    _offsetHours = offsetHours;
    _predictedValue = predictedValue;
    _lowerBound = lowerBound;
    _upperBound = upperBound;
  }

  /**
   * @return The offset of this point from the last observed sample in hours.
   */
  public double offsetHours() {
    return _offsetHours;
  }

  public double predictedValue() {
    return _predictedValue;
  }

  public double lowerBound() {
    return _lowerBound;
  }

  public double upperBound() {
    return _upperBound;
  }

  /**
   * @return The width of the confidence band.
   */
  public double bandWidth() {
    return _upperBound - _lowerBound;
  }

  @Override
  public String toString() {
    return String.format("{+%.1fh: %.3f [%.3f, %.3f]}", _offsetHours, _predictedValue, _lowerBound, _upperBound);
  }
}
