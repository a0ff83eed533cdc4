/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector;

import com.linkedin.metricwatch.engine.config.constants.AnomalyDetectorConfig;
import com.linkedin.metricwatch.engine.detector.estimator.EstimatorResult;
import com.linkedin.metricwatch.engine.detector.estimator.EstimatorType;
import com.linkedin.metricwatch.exception.InvalidSampleException;
import com.linkedin.metricwatch.monitor.MetricStore;
import java.util.Arrays;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.metricwatch.common.utils.SeriesStatistics.last;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.mean;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.stdDev;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.CONTEXT_USAGE;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.COST;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.ERROR_COUNT;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.MINUTE_MS;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.START_MS;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.config;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.defaultConfig;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.fixedClock;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.populate;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class AnomalyDetectorTest {
  private static final long NOW_MS = START_MS + 120 * MINUTE_MS;
  private MetricStore _store;
  private AnomalyDetector _detector;

  @Before
  public void setUp() {
    _store = new MetricStore(1000);
    _detector = new AnomalyDetector(defaultConfig(), _store, fixedClock(NOW_MS));
  }

  @Test
  public void testErrorCountSpikeIsCritical() {
    populate(_store, ERROR_COUNT, START_MS, MINUTE_MS, 10, 10, 11, 9, 10, 10, 50, 11, 10, 9);
    long spikeMs = START_MS + 6 * MINUTE_MS;

    DetectionResult result = _detector.evaluate(ERROR_COUNT, spikeMs);
    assertEquals(DetectionVerdict.ANOMALOUS, result.verdict());
    assertEquals(spikeMs, result.timeMs());
    assertEquals(50.0, result.value(), 0.0);
    assertEquals(5, result.votes());
    assertEquals(5.0 / 6.0, result.confidence(), 1e-9);
    assertEquals(AnomalySeverity.CRITICAL, result.severity());
    for (EstimatorResult estimatorResult : result.estimatorResults()) {
      if (estimatorResult.type() == EstimatorType.TREND_CHANGE) {
        assertTrue(estimatorResult.abstained());
      } else {
        assertTrue(estimatorResult.type() + " should flag the spike", estimatorResult.flagged());
      }
    }

    AnomalyRecord record = result.record();
    assertNotNull(record);
    assertEquals(ERROR_COUNT, record.metricName());
    assertEquals(spikeMs, record.timeMs());
    assertEquals(AnomalyStatus.NEW, record.status());
    assertEquals(NOW_MS, record.createdAtMs());
    assertEquals(5, record.methodScores().size());
    assertFalse(record.methodScores().containsKey(EstimatorType.TREND_CHANGE));
  }

  @Test
  public void testCandidateValueIsNotAppended() {
    double[] values = new double[60];
    for (int i = 0; i < values.length; i++) {
      values[i] = 100.0 + 5.0 * Math.sin(2 * Math.PI * i / 12);
    }
    populate(_store, CONTEXT_USAGE, START_MS, MINUTE_MS, values);
    double[] window = last(values, AnomalyDetectorConfig.DEFAULT_ZSCORE_WINDOW);
    double spike = mean(window) + 6.0 * stdDev(window);

    DetectionResult result = _detector.evaluateValue(CONTEXT_USAGE, spike);
    assertTrue(result.isAnomalous());
    assertTrue(result.confidence() >= 0.4);
    assertEquals(NOW_MS, result.timeMs());
    assertEquals(values.length, _store.size(CONTEXT_USAGE));
  }

  @Test
  public void testCycleWithSpikeReachesQuorum() {
    double[] cycle = {19, 21, 20, 22, 18};
    double[] values = new double[51];
    for (int i = 0; i < 50; i++) {
      values[i] = cycle[i % cycle.length];
    }
    values[50] = 30;
    populate(_store, COST, START_MS, MINUTE_MS, values);

    DetectionResult result = _detector.evaluate(COST);
    assertTrue(result.isAnomalous());
    assertTrue(result.votes() >= 2);
    assertEquals(30.0, result.value(), 0.0);
  }

  @Test
  public void testConstantSeriesIsNormal() {
    double[] values = new double[101];
    Arrays.fill(values, 42.0);
    populate(_store, COST, START_MS, MINUTE_MS, values);

    DetectionResult result = _detector.evaluate(COST);
    assertEquals(DetectionVerdict.NORMAL, result.verdict());
    assertEquals(0, result.votes());
    assertEquals(0.0, result.confidence(), 0.0);
    assertNull(result.record());
    assertEquals(DetectionVerdict.NORMAL, _detector.evaluateValue(COST, 42.0).verdict());
  }

  @Test
  public void testInsufficientData() {
    populate(_store, ERROR_COUNT, START_MS, MINUTE_MS, 1, 2, 3, 4, 5);
    DetectionResult result = _detector.evaluate(ERROR_COUNT);
    assertEquals(DetectionVerdict.INSUFFICIENT_DATA, result.verdict());
    assertFalse(result.isAnomalous());
    assertNull(result.severity());
    assertNull(result.record());

    assertEquals(DetectionVerdict.INSUFFICIENT_DATA, _detector.evaluate("unknown").verdict());
    assertEquals(DetectionVerdict.INSUFFICIENT_DATA, _detector.evaluateValue(ERROR_COUNT, 100.0).verdict());
  }

  @Test
  public void testReplayOfMissingSample() {
    populate(_store, ERROR_COUNT, START_MS, MINUTE_MS, 10, 10, 11, 9, 10, 10, 50, 11, 10, 9);
    DetectionResult result = _detector.evaluate(ERROR_COUNT, START_MS + 30 * 1000L);
    assertEquals(DetectionVerdict.INSUFFICIENT_DATA, result.verdict());
  }

  @Test
  public void testMinHistoryIsConfigurable() {
    AnomalyDetector detector = new AnomalyDetector(config(Map.of(AnomalyDetectorConfig.MIN_HISTORY_CONFIG, 20)),
                                                   _store, fixedClock(NOW_MS));
    populate(_store, ERROR_COUNT, START_MS, MINUTE_MS, 10, 10, 11, 9, 10, 10, 50, 11, 10, 9);
    assertEquals(DetectionVerdict.INSUFFICIENT_DATA, detector.evaluate(ERROR_COUNT, START_MS + 6 * MINUTE_MS).verdict());
  }

  @Test
  public void testInvalidCandidateValue() {
    assertThrows(InvalidSampleException.class, () -> _detector.evaluateValue(ERROR_COUNT, Double.NaN));
  }

  @Test
  public void testSeverityBoundaries() {
    assertEquals(AnomalySeverity.CRITICAL, _detector.severityFor(0.8));
    assertEquals(AnomalySeverity.HIGH, _detector.severityFor(0.79));
    assertEquals(AnomalySeverity.HIGH, _detector.severityFor(0.6));
    assertEquals(AnomalySeverity.MEDIUM, _detector.severityFor(0.4));
    assertEquals(AnomalySeverity.LOW, _detector.severityFor(0.39));
  }
}
