/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;


/**
 * The lifecycle state of an anomaly record.
 *
 * <pre>
 *   NEW -&gt; ACKNOWLEDGED -&gt; RESOLVED
 *    |                        ^
 *    +------------------------+
 * </pre>
 *
 * Transitions are one-directional.
 */
public enum AnomalyStatus {
  NEW, ACKNOWLEDGED, RESOLVED;

  private static final List<AnomalyStatus> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));

  /**
   * @param target The target status.
   * @return {@code true} if a record in this status may move to the given status.
   */
  public boolean canTransitionTo(AnomalyStatus target) {
    switch (this) {
      case NEW:
        return target == ACKNOWLEDGED || target == RESOLVED;
      case ACKNOWLEDGED:
        return target == RESOLVED;
      case RESOLVED:
        return false;
      default:
        throw new IllegalStateException("Unsupported anomaly status " + this);
    }
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<AnomalyStatus> cachedValues() {
    return CACHED_VALUES;
  }
}
