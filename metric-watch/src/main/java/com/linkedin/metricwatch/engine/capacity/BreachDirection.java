/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.capacity;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;


/**
 * The side of a capacity threshold that counts as a breach. Reaching the threshold is a breach.
 */
public enum BreachDirection {
  ABOVE {
    @Override
    public boolean isBreached(double value, double threshold) {
      return value >= threshold;
    }
  },
  BELOW {
    @Override
    public boolean isBreached(double value, double threshold) {
      return value <= threshold;
    }
  };

  private static final List<BreachDirection> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));

  /**
   * @param value A value of the metric.
   * @param threshold The capacity threshold.
   * @return {@code true} if the value breaches the threshold in this direction.
   */
  public abstract boolean isBreached(double value, double threshold);

  /**
   * @return The name of this direction in configs.
   */
  public String configName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * @param configName The name of a direction in configs, case insensitive.
   * @return The direction, or {@code null} if no direction has the given name.
   */
  public static BreachDirection forConfigName(String configName) {
    for (BreachDirection direction : CACHED_VALUES) {
      if (direction.configName().equalsIgnoreCase(configName)) {
        return direction;
      }
    }
    return null;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<BreachDirection> cachedValues() {
    return CACHED_VALUES;
  }
}
