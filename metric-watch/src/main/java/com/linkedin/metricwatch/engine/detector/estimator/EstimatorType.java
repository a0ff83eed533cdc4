/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector.estimator;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;


/**
 * The statistical estimators voting in the anomaly detection ensemble.
 */
public enum EstimatorType {
  Z_SCORE, IQR, MOVING_AVERAGE, EXPONENTIAL_SMOOTHING, SPIKE, TREND_CHANGE;

  private static final List<EstimatorType> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));

  /**
   * @return The name of this estimator in persisted anomaly records.
   */
  public String persistedName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * @param persistedName The name of an estimator in persisted anomaly records.
   * @return The estimator type with the given name, or {@code null} if there is none.
   */
  public static EstimatorType forPersistedName(String persistedName) {
    for (EstimatorType type : CACHED_VALUES) {
      if (type.persistedName().equals(persistedName)) {
        return type;
      }
    }
    return null;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<EstimatorType> cachedValues() {
    return CACHED_VALUES;
  }
}
