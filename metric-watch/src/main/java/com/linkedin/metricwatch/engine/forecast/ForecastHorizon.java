/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast;

/**
 * Named forecast horizons. Any horizon of 1 to 720 hours can be requested.
 */
public enum ForecastHorizon {
  DAY(24), THREE_DAYS(72), WEEK(168);

  private final int _hours;

  ForecastHorizon(int hours) {
    _hours = hours;
  }

  public int hours() {
    return _hours;
  }
}
