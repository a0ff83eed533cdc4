/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;


/**
 * The sensitivity of the anomaly detector. Every estimator threshold is multiplied by the scale of the sensitivity, so
 * a z-score threshold of 3 becomes 3.5 at {@link #LOW} and 2.5 at {@link #HIGH} sensitivity.
 */
public enum Sensitivity {
  LOW(3.5 / 3.0), MEDIUM(1.0), HIGH(2.5 / 3.0);

  private static final List<Sensitivity> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));
  private final double _thresholdScale;

  Sensitivity(double thresholdScale) {
    _thresholdScale = thresholdScale;
  }

  /**
   * @return The factor applied to the estimator thresholds.
   */
  public double thresholdScale() {
    return _thresholdScale;
  }

  /**
   * @return The name of this sensitivity in configs.
   */
  public String configName() {
    return name().toLowerCase();
  }

  /**
   * @param configName The name of a sensitivity in configs, case insensitive.
   * @return The sensitivity with the given name.
   */
  public static Sensitivity forConfigName(String configName) {
    for (Sensitivity sensitivity : CACHED_VALUES) {
      if (sensitivity.configName().equalsIgnoreCase(configName)) {
        return sensitivity;
      }
    }
    throw new IllegalArgumentException("Unsupported sensitivity " + configName);
  }

  /**
   * @return The names of every sensitivity in configs.
   */
  public static String[] configNames() {
    String[] names = new String[CACHED_VALUES.size()];
    for (int i = 0; i < names.length; i++) {
      names[i] = CACHED_VALUES.get(i).configName();
    }
    return names;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<Sensitivity> cachedValues() {
    return CACHED_VALUES;
  }
}
