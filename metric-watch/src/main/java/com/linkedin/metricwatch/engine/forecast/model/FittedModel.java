/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast.model;

import com.linkedin.metricwatch.engine.forecast.ForecastMethod;


/**
 * A forecasting model fitted to a history. Offsets are in hours from the last sample of that history.
 * <p>
 * The prediction at an offset never depends on the horizon it is requested for, and the half width of the band is
 * non-decreasing in the offset.
 */
public interface FittedModel {

  /**
   * @return The method of this model.
   */
  ForecastMethod method();

  /**
   * @param offsetHours Offset from the last sample of the history in hours.
   * @return The predicted value.
   */
  double predict(double offsetHours);

  /**
   * @param offsetHours Offset from the last sample of the history in hours.
   * @return Half the width of the confidence band around the predicted value.
   */
  double halfWidth(double offsetHours);
}
