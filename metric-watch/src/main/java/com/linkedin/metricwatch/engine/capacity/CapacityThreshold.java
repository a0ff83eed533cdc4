/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.capacity;

import com.linkedin.metricwatch.common.config.ConfigException;
import com.linkedin.metricwatch.engine.config.constants.CapacityPlannerConfig;
import java.util.Objects;

import static com.linkedin.metricwatch.common.utils.Utils.validateNotNull;


/**
 * A capacity threshold of a metric, as configured in {@link CapacityPlannerConfig#CAPACITY_THRESHOLDS_CONFIG}.
 */
public final class CapacityThreshold {
  static final char SEPARATOR = ':';
  private final String _metricName;
  private final double _threshold;
  private final BreachDirection _direction;

  public CapacityThreshold(String metricName, double threshold, BreachDirection direction) {
    _metricName = validateNotNull(metricName, "Metric name cannot be null.");
    _direction = validateNotNull(direction, "Breach direction cannot be null.");
    _threshold = threshold;
  }

  /**
   * Parse a threshold in the form {@code metric:threshold[:above|below]}. The direction defaults to above.
   *
   * @param thresholdString The threshold to parse.
   * @return The parsed threshold.
   * @throws ConfigException if the given threshold is malformed.
   */
  public static CapacityThreshold parse(String thresholdString) {
    String[] parts = thresholdString == null ? new String[0] : thresholdString.trim().split(String.valueOf(SEPARATOR), -1);
    if (parts.length < 2 || parts.length > 3 || parts[0].trim().isEmpty()) {
      throw new ConfigException(CapacityPlannerConfig.CAPACITY_THRESHOLDS_CONFIG, thresholdString,
                                "Capacity threshold must be in the form metric:threshold[:above|below].");
    }
    double threshold;
    try {
      threshold = Double.parseDouble(parts[1].trim());
    } catch (NumberFormatException nfe) {
      throw new ConfigException(CapacityPlannerConfig.CAPACITY_THRESHOLDS_CONFIG, thresholdString,
                                "Capacity threshold value " + parts[1] + " is not a number.");
    }
    if (Double.isNaN(threshold) || Double.isInfinite(threshold)) {
      throw new ConfigException(CapacityPlannerConfig.CAPACITY_THRESHOLDS_CONFIG, thresholdString,
                                "Capacity threshold value must be finite.");
    }
    BreachDirection direction = BreachDirection.ABOVE;
    if (parts.length == 3) {
      direction = BreachDirection.forConfigName(parts[2].trim());
      if (direction == null) {
        throw new ConfigException(CapacityPlannerConfig.CAPACITY_THRESHOLDS_CONFIG, thresholdString,
                                  "Unknown breach direction " + parts[2] + ", expected above or below.");
      }
    }
    return new CapacityThreshold(parts[0].trim(), threshold, direction);
  }

  public String metricName() {
    return _metricName;
  }

  public double threshold() {
    return _threshold;
  }

  public BreachDirection direction() {
    return _direction;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    CapacityThreshold that = (CapacityThreshold) o;
    return Double.compare(that._threshold, _threshold) == 0
           && _metricName.equals(that._metricName)
           && _direction == that._direction;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_metricName, _threshold, _direction);
  }

  @Override
  public String toString() {
    return _metricName + SEPARATOR + _threshold + SEPARATOR + _direction.configName();
  }
}
