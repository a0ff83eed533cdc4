/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch;

import com.linkedin.metricwatch.exception.InvalidSampleException;
import org.junit.Test;

import static com.linkedin.metricwatch.TestConstants.HOUR_MS;
import static com.linkedin.metricwatch.TestConstants.START_MS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;


public class MetricWatchUtilsTest {

  @Test
  public void testEnsureValidSample() {
    MetricWatchUtils.ensureValidSample("cost", -1.5);
    assertThrows(InvalidSampleException.class, () -> MetricWatchUtils.ensureValidSample(" ", 1.0));
    assertThrows(InvalidSampleException.class, () -> MetricWatchUtils.ensureValidSample("cost", Double.NaN));
    assertThrows(InvalidSampleException.class,
                 () -> MetricWatchUtils.ensureValidSample("cost", Double.NEGATIVE_INFINITY));
  }

  @Test
  public void testHourConversions() {
    assertEquals(1.5, MetricWatchUtils.hoursBetween(START_MS, START_MS + HOUR_MS + HOUR_MS / 2), 0.0);
    assertEquals(-1.0, MetricWatchUtils.hoursBetween(START_MS + HOUR_MS, START_MS), 0.0);
    assertEquals(5_400_000L, MetricWatchUtils.hoursToMs(1.5));
  }

  @Test
  public void testUtcDate() {
    assertEquals("2023-11-14T22:13:20Z", MetricWatchUtils.utcDateFor(START_MS + 999));
  }
}
