/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.capacity;

/**
 * How soon a capacity threshold is predicted to be breached. {@link #NONE} if no breach is predicted within the
 * medium urgency window.
 */
public enum Urgency {
  NONE, MEDIUM, HIGH, CRITICAL
}
