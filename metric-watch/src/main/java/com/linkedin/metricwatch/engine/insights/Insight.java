/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.insights;

import java.util.Objects;

import static com.linkedin.metricwatch.common.utils.Utils.validateNotNull;


public final class Insight {
  private final InsightPriority _priority;
  private final InsightType _type;
  private final String _message;
  private final String _recommendation;
  private final String _relatedMetric;

  /**
   * @param priority Priority of the insight.
   * @param type Type of the insight.
   * @param message What was observed.
   * @param recommendation What to do about it.
   * @param relatedMetric The metric the insight is about, or {@code null} if it is not about a single metric.
   */
  public Insight(InsightPriority priority, InsightType type, String message, String recommendation, String relatedMetric) {
    _priority = validateNotNull(priority, "Insight priority cannot be null.");
    _type = validateNotNull(type, "Insight type cannot be null.");
    _message = validateNotNull(message, "Insight message cannot be null.");
    _recommendation = validateNotNull(recommendation, "Insight recommendation cannot be null.");
    _relatedMetric = relatedMetric;
  }

  public InsightPriority priority() {
    return _priority;
  }

  public InsightType type() {
    return _type;
  }

  public String message() {
    return _message;
  }

  public String recommendation() {
    return _recommendation;
  }

  public String relatedMetric() {
    return _relatedMetric;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Insight that = (Insight) o;
    return _priority == that._priority && _type == that._type && _message.equals(that._message)
           && _recommendation.equals(that._recommendation) && Objects.equals(_relatedMetric, that._relatedMetric);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_priority, _type, _message, _recommendation, _relatedMetric);
  }

  @Override
  public String toString() {
    return String.format("{%s %s%s: %s %s}", _priority, _type, _relatedMetric == null ? "" : " " + _relatedMetric,
                         _message, _recommendation);
  }
}
