/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;


/**
 * Severity of an anomaly, derived from the confidence of the ensemble. Listed in increasing order of severity.
 */
public enum AnomalySeverity {
  LOW, MEDIUM, HIGH, CRITICAL;

  private static final List<AnomalySeverity> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<AnomalySeverity> cachedValues() {
    return CACHED_VALUES;
  }
}
