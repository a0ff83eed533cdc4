/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.exception;

/**
 * Thrown when a metric does not have enough retained samples to compute a meaningful result, e.g. a forecast. This
 * is an expected condition for metrics that were only recently observed, and is distinct from "nothing wrong".
 */
public class InsufficientHistoryException extends MetricWatchException {
  private final String _metricName;
  private final int _available;
  private final int _required;

  public InsufficientHistoryException(String metricName, int available, int required) {
    this(metricName, available, required,
         String.format("Metric %s has %d samples, at least %d are required.", metricName, available, required));
  }

  public InsufficientHistoryException(String metricName, int available, int required, String msg) {
    super(msg);
    _metricName = metricName;
    _available = available;
    _required = required;
  }

  /**
   * @return The name of the metric which lacks history.
   */
  public String metricName() {
    return _metricName;
  }

  /**
   * @return Number of samples that were available.
   */
  public int available() {
    return _available;
  }

  /**
   * @return Number of samples that would have been required.
   */
  public int required() {
    return _required;
  }
}
