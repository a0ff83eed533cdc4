/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.insights;

public enum InsightPriority {
  CRITICAL, HIGH, MEDIUM
}
