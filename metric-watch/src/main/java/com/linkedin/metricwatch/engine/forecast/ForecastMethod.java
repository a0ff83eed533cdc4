/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;


/**
 * The forecasting methods. {@link #ENSEMBLE} combines every other method that can be fitted to the history.
 */
public enum ForecastMethod {
  LINEAR, EXP_SMOOTHING, MOVING_AVERAGE, SEASONAL, ENSEMBLE;

  private static final List<ForecastMethod> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<ForecastMethod> cachedValues() {
    return CACHED_VALUES;
  }
}
