/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch;

import com.linkedin.metricwatch.exception.InvalidSampleException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoUnit;

/**
 * Utils class for Metric Watch
 */
public final class MetricWatchUtils {
  public static final double MS_PER_HOUR = 3_600_000.0;

  private MetricWatchUtils() {

  }

  /**
   * Ensure the given sample can be stored.
   *
   * @param metricName Name of the metric.
   * @param value Value of the sample.
   * @throws InvalidSampleException if the metric name is null or blank, or the value is NaN or infinite.
   */
  public static void ensureValidSample(String metricName, double value) {
    if (metricName == null || metricName.isBlank()) {
      throw new InvalidSampleException("Metric name cannot be null or blank.");
    }
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new InvalidSampleException(String.format("Value %s of metric %s is not a finite number.", value, metricName));
    }
  }

  /**
   * @param fromMs Start time in milliseconds.
   * @param toMs End time in milliseconds.
   * @return The elapsed time between the two in (fractional) hours.
   */
  public static double hoursBetween(long fromMs, long toMs) {
    return (toMs - fromMs) / MS_PER_HOUR;
  }

  /**
   * @param hours Duration in (fractional) hours.
   * @return The duration in milliseconds, rounded to the nearest millisecond.
   */
  public static long hoursToMs(double hours) {
    return Math.round(hours * MS_PER_HOUR);
  }

  /**
   * @param timeMs Time in milliseconds.
   * @return The date for the given time in ISO 8601 format with date, hour, minute, and seconds.
   */
  public static String utcDateFor(long timeMs) {
    DateTimeFormatter formatter = new DateTimeFormatterBuilder().appendInstant(0).toFormatter();
    return formatter.format(Instant.ofEpochMilli(timeMs).truncatedTo(ChronoUnit.SECONDS));
  }
}
