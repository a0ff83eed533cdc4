/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.common.utils;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;


public class SeriesStatisticsTest {
  private static final double DELTA = 1e-9;

  @Test
  public void testStdDevIsSampleStandardDeviation() {
    assertEquals(0.0, SeriesStatistics.stdDev(new double[0]), 0.0);
    assertEquals(0.0, SeriesStatistics.stdDev(new double[]{5.0}), 0.0);
    assertEquals(Math.sqrt(2.5), SeriesStatistics.stdDev(new double[]{1, 2, 3, 4, 5}), DELTA);
  }

  @Test
  public void testQuartiles() {
    double[] values = {10, 10, 11, 9, 10, 10};
    assertEquals(9.75, SeriesStatistics.percentile(values, 25.0), DELTA);
    assertEquals(10.25, SeriesStatistics.percentile(values, 75.0), DELTA);
    assertEquals(10.0, SeriesStatistics.median(values), DELTA);
  }

  @Test
  public void testSlopeAndDifferences() {
    assertEquals(2.0, SeriesStatistics.slope(new double[]{1, 3, 5, 7}), DELTA);
    assertEquals(0.0, SeriesStatistics.slope(new double[]{4}), 0.0);
    assertArrayEquals(new double[]{2, -1, 4}, SeriesStatistics.differences(new double[]{1, 3, 2, 6}), DELTA);
    assertEquals(0, SeriesStatistics.differences(new double[]{1}).length);
  }

  @Test
  public void testLastAndRange() {
    double[] values = {3, 1, 4, 1, 5};
    assertArrayEquals(new double[]{1, 5}, SeriesStatistics.last(values, 2), 0.0);
    assertArrayEquals(values, SeriesStatistics.last(values, 10), 0.0);
    assertEquals(4.0, SeriesStatistics.range(values), 0.0);
    assertEquals(0.0, SeriesStatistics.range(new double[0]), 0.0);
  }

  @Test
  public void testIsZero() {
    assertTrue(SeriesStatistics.isZero(1e-12));
    assertFalse(SeriesStatistics.isZero(1e-6));
  }
}
