/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast.model;

import com.linkedin.metricwatch.engine.forecast.ForecastMethod;
import com.linkedin.metricwatch.exception.InsufficientHistoryException;
import com.linkedin.metricwatch.monitor.sampling.MetricSample;
import java.util.List;


/**
 * Holt double exponential smoothing. The level and the trend are smoothed over the samples in order, one step being
 * the median time between samples:
 * <pre>
 *   L_t = alpha * y_t + (1 - alpha) * (L_t-1 + T_t-1)
 *   T_t = beta * (L_t - L_t-1) + (1 - beta) * T_t-1
 * </pre>
 * The forecast k steps ahead is {@code L + k * T}. The band grows with the forecast variance of the method,
 * {@code s^2 * (1 + sum_{j=1..k-1} (alpha * (1 + j * beta))^2)}, where {@code s} is the root mean square of the
 * one-step residuals.
 */
public class ExpSmoothingForecaster implements Forecaster {

  @Override
  public ForecastMethod method() {
    return ForecastMethod.EXP_SMOOTHING;
  }

  @Override
  public FittedModel fit(List<MetricSample> history, ForecastParameters parameters) throws InsufficientHistoryException {
    ForecastUtils.ensureMinSamples(history, parameters.minSamples());
    double alpha = parameters.alpha();
    double beta = parameters.beta();
    double level = history.get(0).value();
    double trend = history.get(1).value() - history.get(0).value();
    double squaredResidualSum = 0.0;
    for (int i = 1; i < history.size(); i++) {
      double value = history.get(i).value();
      double residual = value - (level + trend);
      squaredResidualSum += residual * residual;
      double previousLevel = level;
      level = alpha * value + (1 - alpha) * (level + trend);
      trend = beta * (level - previousLevel) + (1 - beta) * trend;
    }
    double residualRms = Math.sqrt(squaredResidualSum / (history.size() - 1));
    return new HoltModel(parameters.z(), alpha, beta, level, trend, residualRms, ForecastUtils.medianStepHours(history));
  }

  private static final class HoltModel implements FittedModel {
    private final double _z;
    private final double _alpha;
    private final double _beta;
    private final double _level;
    private final double _trend;
    private final double _residualRms;
    private final double _stepHours;

    HoltModel(double z, double alpha, double beta, double level, double trend, double residualRms, double stepHours) {
      _z = z;
      _alpha = alpha;
      _beta = beta;
      _level = level;
      _trend = trend;
      _residualRms = residualRms;
      _stepHours = stepHours;
    }

    @Override
    public ForecastMethod method() {
      return ForecastMethod.EXP_SMOOTHING;
    }

    @Override
    public double predict(double offsetHours) {
      return _level + (offsetHours / _stepHours) * _trend;
    }

    @Override
    public double halfWidth(double offsetHours) {
      // Closed form of sum_{j=1..m-1} (1 + j * beta)^2.
      double m = Math.max(1.0, Math.ceil(offsetHours / _stepHours));
      double sumJ = (m - 1) * m / 2.0;
      double sumJSquared = (m - 1) * m * (2 * m - 1) / 6.0;
      double growth = (m - 1) + 2 * _beta * sumJ + _beta * _beta * sumJSquared;
      return _z * _residualRms * Math.sqrt(1.0 + _alpha * _alpha * growth);
    }
  }
}
