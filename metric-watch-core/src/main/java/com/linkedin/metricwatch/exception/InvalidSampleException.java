/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.exception;

/**
 * Thrown when a caller offers a sample that cannot be stored, e.g. a NaN or infinite value or a missing metric name.
 * The offending sample is rejected without any state change.
 */
public class InvalidSampleException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public InvalidSampleException(String message) {
    super(message);
  }
}
