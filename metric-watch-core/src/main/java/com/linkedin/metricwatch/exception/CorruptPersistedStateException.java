/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.exception;

/**
 * Thrown if a persisted state document cannot be parsed.
 */
public class CorruptPersistedStateException extends MetricWatchException {
  public CorruptPersistedStateException(String message, Throwable cause) {
    super(message, cause);
  }

  public CorruptPersistedStateException(String message) {
    super(message);
  }
}
