/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.insights;

/**
 * The source of an insight.
 */
public enum InsightType {
  // Unresolved anomalies of critical severity.
  CRITICAL_ANOMALIES,
  // A capacity threshold predicted to be breached soon.
  CAPACITY_BREACH,
  // The metric with the most anomalies in the activity window.
  MOST_ANOMALOUS_METRIC,
  // More anomalies than usual in the activity window.
  ELEVATED_ANOMALY_ACTIVITY,
  // A rising forecast of a metric that has no open anomaly.
  RISING_TREND
}
