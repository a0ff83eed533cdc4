/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast;

import com.linkedin.metricwatch.exception.InsufficientHistoryException;
import com.linkedin.metricwatch.monitor.MetricStore;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.CONTEXT_USAGE;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.COST;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.ERROR_COUNT;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.HOUR_MS;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.START_MS;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.defaultConfig;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.fixedClock;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.populate;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class ForecastEngineTest {
  // 2023-11-14T00:00:00Z, aligned with the daily seasonal cycle.
  static final long DAY_ALIGNED_START_MS = 1_699_920_000_000L;
  private static final double DELTA = 1e-6;
  private MetricStore _store;
  private ForecastEngine _engine;
  private long _nowMs;

  @Before
  public void setUp() {
    _store = new MetricStore(1000);
    _nowMs = START_MS + 100 * HOUR_MS;
    _engine = new ForecastEngine(defaultConfig(), _store, fixedClock(_nowMs));
  }

  static double[] dailyCycle(int hours) {
    double[] values = new double[hours];
    for (int h = 0; h < hours; h++) {
      values[h] = 50.0 + 10.0 * Math.sin(2 * Math.PI * h / 24.0);
    }
    return values;
  }

  private static double[] line(int n, double intercept, double slope) {
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = intercept + slope * i;
    }
    return values;
  }

  @Test
  public void testSeasonalForecastFollowsDailyCycle() throws InsufficientHistoryException {
    assertSeasonalForecastFollowsDailyCycle(DAY_ALIGNED_START_MS);
  }

  @Test
  public void testSeasonalForecastOfCycleStartingMidDay() throws InsufficientHistoryException {
    // 22:13:20 UTC, so neither the day nor the hour of the samples is aligned to the epoch.
    assertSeasonalForecastFollowsDailyCycle(START_MS);
  }

  private void assertSeasonalForecastFollowsDailyCycle(long startMs) throws InsufficientHistoryException {
    long lastMs = populate(_store, CONTEXT_USAGE, startMs, HOUR_MS, dailyCycle(48));

    ForecastResult result = _engine.forecast(CONTEXT_USAGE, ForecastHorizon.DAY, ForecastMethod.SEASONAL);
    assertEquals(24, result.points().size());
    assertEquals(lastMs, result.originMs());
    assertEquals(_nowMs, result.generatedAtMs());
    assertNull(result.rSquared());
    assertEquals(Map.of(ForecastMethod.SEASONAL, 1.0), result.methodWeights());
    for (ForecastPoint point : result.points()) {
      double t = 47 + point.offsetHours();
      double expected = 50.0 + 10.0 * Math.sin(2 * Math.PI * t / 24.0);
      assertEquals("Offset " + point.offsetHours(), expected, point.predictedValue(), 2.0);
    }
  }

  @Test
  public void testSeasonalForecastRequiresTwoCycles() {
    populate(_store, CONTEXT_USAGE, DAY_ALIGNED_START_MS, HOUR_MS, dailyCycle(30));
    assertThrows(InsufficientHistoryException.class,
                 () -> _engine.forecast(CONTEXT_USAGE, 24, ForecastMethod.SEASONAL));
  }

  @Test
  public void testLinearForecastOfPerfectLine() throws InsufficientHistoryException {
    long lastMs = populate(_store, COST, START_MS, HOUR_MS, line(20, 10.0, 2.0));

    ForecastResult result = _engine.forecast(COST, 6, ForecastMethod.LINEAR);
    assertEquals(lastMs, result.originMs());
    assertEquals(6, result.horizonHours());
    assertEquals(1.0, result.rSquared(), 1e-9);
    assertEquals(Trend.INCREASING, result.trend());
    for (int h = 1; h <= 6; h++) {
      ForecastPoint point = result.points().get(h - 1);
      assertEquals(h, point.offsetHours(), 0.0);
      assertEquals(10.0 + 2.0 * (19 + h), point.predictedValue(), DELTA);
      assertEquals(0.0, point.bandWidth(), 1e-4);
    }
  }

  @Test
  public void testExpSmoothingCarriesTheTrend() throws InsufficientHistoryException {
    populate(_store, COST, START_MS, HOUR_MS, line(20, 100.0, -3.0));

    ForecastResult result = _engine.forecast(COST, 12, ForecastMethod.EXP_SMOOTHING);
    assertEquals(100.0 - 3.0 * 22, result.points().get(2).predictedValue(), DELTA);
    assertEquals(Trend.DECREASING, result.trend());
  }

  @Test
  public void testConstantHistoryIsStable() throws InsufficientHistoryException {
    double[] values = new double[10];
    Arrays.fill(values, 42.0);
    populate(_store, ERROR_COUNT, START_MS, HOUR_MS, values);

    for (ForecastMethod method : List.of(ForecastMethod.LINEAR, ForecastMethod.MOVING_AVERAGE,
                                         ForecastMethod.EXP_SMOOTHING, ForecastMethod.ENSEMBLE)) {
      ForecastResult result = _engine.forecast(ERROR_COUNT, 12, method);
      assertEquals(method.toString(), Trend.STABLE, result.trend());
      for (ForecastPoint point : result.points()) {
        assertEquals(42.0, point.predictedValue(), DELTA);
        assertEquals(0.0, point.bandWidth(), DELTA);
      }
    }
  }

  @Test
  public void testVolatileTrendWhenBandOutgrowsRange() {
    List<ForecastPoint> wideBand = List.of(new ForecastPoint(1, 0.5, -0.5, 1.5));
    assertEquals(Trend.VOLATILE, _engine.classifyTrend(new double[]{0.0, 1.0, 0.0, 1.0}, 0.0, wideBand));
    List<ForecastPoint> narrowBand = List.of(new ForecastPoint(1, 0.5, 0.4, 0.6));
    assertEquals(Trend.STABLE, _engine.classifyTrend(new double[]{0.0, 1.0, 0.0, 1.0}, 0.0, narrowBand));
  }

  @Test
  public void testEnsembleWeightsFavorAccurateMembers() throws InsufficientHistoryException {
    populate(_store, COST, START_MS, HOUR_MS, line(30, 5.0, 1.5));

    ForecastResult result = _engine.forecast(COST);
    assertEquals(ForecastMethod.ENSEMBLE, result.method());
    assertEquals(_engine.defaultHorizonHours(), result.points().size());
    Map<ForecastMethod, Double> weights = result.methodWeights();
    // Too short for a seasonal fit.
    assertEquals(List.of(ForecastMethod.LINEAR, ForecastMethod.EXP_SMOOTHING, ForecastMethod.MOVING_AVERAGE),
                 new ArrayList<>(weights.keySet()));
    assertEquals(1.0, weights.values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
    assertTrue(weights.get(ForecastMethod.LINEAR) > weights.get(ForecastMethod.MOVING_AVERAGE));
    assertNull(result.rSquared());
    assertEquals(Trend.INCREASING, result.trend());
  }

  @Test
  public void testInsufficientHistory() {
    populate(_store, ERROR_COUNT, START_MS, HOUR_MS, 1.0, 2.0, 3.0, 4.0);
    for (ForecastMethod method : ForecastMethod.cachedValues()) {
      assertThrows(InsufficientHistoryException.class, () -> _engine.forecast(ERROR_COUNT, 24, method));
    }
    assertThrows(InsufficientHistoryException.class, () -> _engine.forecast("unknown_metric"));
  }

  @Test
  public void testHorizonBounds() throws InsufficientHistoryException {
    populate(_store, COST, START_MS, HOUR_MS, line(10, 1.0, 1.0));
    assertThrows(IllegalArgumentException.class, () -> _engine.forecast(COST, 0, ForecastMethod.LINEAR));
    assertThrows(IllegalArgumentException.class, () -> _engine.forecast(COST, 721, ForecastMethod.LINEAR));
    assertEquals(720, _engine.forecast(COST, 720, ForecastMethod.LINEAR).points().size());
    ForecastResult week = _engine.forecast(COST, ForecastHorizon.WEEK, ForecastMethod.MOVING_AVERAGE);
    assertEquals(168, week.points().size());
    assertEquals(168.0, week.points().get(167).offsetHours(), 0.0);
  }

  @Test
  public void testForecastAllSkipsShortHistories() {
    populate(_store, COST, START_MS, HOUR_MS, line(10, 1.0, 1.0));
    populate(_store, ERROR_COUNT, START_MS, HOUR_MS, 1.0, 2.0);

    SortedMap<String, ForecastResult> forecasts = _engine.forecastAll(12);
    assertEquals(List.of(COST), new ArrayList<>(forecasts.keySet()));
    assertEquals(12, forecasts.get(COST).points().size());
  }
}
