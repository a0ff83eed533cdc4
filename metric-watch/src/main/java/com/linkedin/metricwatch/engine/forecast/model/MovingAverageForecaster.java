/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast.model;

import com.linkedin.metricwatch.engine.forecast.ForecastMethod;
import com.linkedin.metricwatch.exception.InsufficientHistoryException;
import com.linkedin.metricwatch.monitor.sampling.MetricSample;
import java.util.List;

import static com.linkedin.metricwatch.common.utils.SeriesStatistics.last;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.mean;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.stdDev;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.valuesOf;


/**
 * A flat forecast at the mean of the trailing window. The band is {@code z * stddev * sqrt(1 + k / w)} for a forecast
 * k steps ahead of a window of w samples.
 */
public class MovingAverageForecaster implements Forecaster {

  @Override
  public ForecastMethod method() {
    return ForecastMethod.MOVING_AVERAGE;
  }

  @Override
  public FittedModel fit(List<MetricSample> history, ForecastParameters parameters) throws InsufficientHistoryException {
    ForecastUtils.ensureMinSamples(history, parameters.minSamples());
    double[] window = last(valuesOf(history), parameters.movingAverageWindow());
    double average = mean(window);
    double stdDev = stdDev(window);
    double stepHours = ForecastUtils.medianStepHours(history);
    double z = parameters.z();
    int windowSize = window.length;
    return new FittedModel() {
      @Override
      public ForecastMethod method() {
        return ForecastMethod.MOVING_AVERAGE;
      }

      @Override
      public double predict(double offsetHours) {
        return average;
      }

      @Override
      public double halfWidth(double offsetHours) {
        double steps = offsetHours / stepHours;
        return z * stdDev * Math.sqrt(1.0 + steps / windowSize);
      }
    };
  }
}
