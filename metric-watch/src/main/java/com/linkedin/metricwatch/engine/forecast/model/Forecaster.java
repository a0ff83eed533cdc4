/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast.model;

import com.linkedin.metricwatch.engine.forecast.ForecastMethod;
import com.linkedin.metricwatch.exception.InsufficientHistoryException;
import com.linkedin.metricwatch.monitor.sampling.MetricSample;
import java.util.List;


/**
 * Fits a forecasting model to a history. Implementations are stateless, a model is fitted from scratch on each call.
 */
public interface Forecaster {

  /**
   * @return The method of the models this forecaster fits.
   */
  ForecastMethod method();

  /**
   * @param history The samples of a metric, oldest first.
   * @param parameters The forecast parameters.
   * @return The fitted model.
   * @throws InsufficientHistoryException if the history is too short for this method.
   */
  FittedModel fit(List<MetricSample> history, ForecastParameters parameters) throws InsufficientHistoryException;
}
