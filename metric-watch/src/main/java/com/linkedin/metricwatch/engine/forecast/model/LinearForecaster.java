/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast.model;

import com.linkedin.metricwatch.engine.forecast.ForecastMethod;
import com.linkedin.metricwatch.exception.InsufficientHistoryException;
import com.linkedin.metricwatch.monitor.sampling.MetricSample;
import java.util.List;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import static com.linkedin.metricwatch.MetricWatchUtils.hoursBetween;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.isZero;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.mean;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.stdDev;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.valuesOf;


/**
 * Ordinary least squares over (hours since the first sample, value). The band is the prediction interval
 * {@code z * s * sqrt(1 + 1/n + (x0 - mean(x))^2 / Sxx)}, where {@code s} is the residual standard error.
 */
public class LinearForecaster implements Forecaster {

  @Override
  public ForecastMethod method() {
    return ForecastMethod.LINEAR;
  }

  @Override
  public LinearModel fit(List<MetricSample> history, ForecastParameters parameters) throws InsufficientHistoryException {
    ForecastUtils.ensureMinSamples(history, parameters.minSamples());
    long firstMs = history.get(0).timeMs();
    SimpleRegression regression = new SimpleRegression();
    double xSum = 0.0;
    for (MetricSample sample : history) {
      double x = hoursBetween(firstMs, sample.timeMs());
      regression.addData(x, sample.value());
      xSum += x;
    }
    int n = history.size();
    double originX = hoursBetween(firstMs, ForecastUtils.originMs(history));
    if (isZero(regression.getXSumSquares())) {
      // Every sample at the same time, there is no slope to fit.
      double[] values = valuesOf(history);
      return new LinearModel(parameters.z(), n, originX, xSum / n, 0.0, 0.0, mean(values), stdDev(values), null);
    }
    double rSquared = regression.getRSquare();
    return new LinearModel(parameters.z(), n, originX, xSum / n, regression.getXSumSquares(), regression.getSlope(),
                           regression.getIntercept(), Math.sqrt(regression.getMeanSquareError()),
                           Double.isNaN(rSquared) ? null : rSquared);
  }

  /**
   * A fitted regression line.
   */
  public static final class LinearModel implements FittedModel {
    private final double _z;
    private final int _n;
    private final double _originX;
    private final double _meanX;
    private final double _sxx;
    private final double _slope;
    private final double _intercept;
    private final double _standardError;
    private final Double _rSquared;

    LinearModel(double z, int n, double originX, double meanX, double sxx, double slope, double intercept,
                double standardError, Double rSquared) {
      _z = z;
      _n = n;
      _originX = originX;
      _meanX = meanX;
      _sxx = sxx;
      _slope = slope;
      _intercept = intercept;
      _standardError = Double.isNaN(standardError) ? 0.0 : standardError;
      _rSquared = rSquared;
    }

    @Override
    public ForecastMethod method() {
      return ForecastMethod.LINEAR;
    }

    @Override
    public double predict(double offsetHours) {
      return _intercept + _slope * (_originX + offsetHours);
    }

    @Override
    public double halfWidth(double offsetHours) {
      double distance = _originX + offsetHours - _meanX;
      double leverage = isZero(_sxx) ? 0.0 : distance * distance / _sxx;
      return _z * _standardError * Math.sqrt(1.0 + 1.0 / _n + leverage);
    }

    /**
     * @return The slope of the line per hour.
     */
    public double slopePerHour() {
      return _slope;
    }

    /**
     * @return The coefficient of determination, or {@code null} if the history is constant.
     */
    public Double rSquared() {
      return _rSquared;
    }
  }
}
