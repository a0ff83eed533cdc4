/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.linkedin.metricwatch.common.config.ConfigException;
import com.linkedin.metricwatch.engine.config.MetricWatchConfig;
import com.linkedin.metricwatch.engine.config.constants.MetricStoreConfig;
import com.linkedin.metricwatch.engine.detector.AnomalyStatus;
import com.linkedin.metricwatch.engine.detector.DetectionResult;
import com.linkedin.metricwatch.engine.forecast.ForecastMethod;
import com.linkedin.metricwatch.engine.insights.Insight;
import com.linkedin.metricwatch.engine.insights.InsightType;
import com.linkedin.metricwatch.exception.InsufficientHistoryException;
import com.linkedin.metricwatch.exception.InvalidSampleException;
import com.linkedin.metricwatch.exception.MetricWatchException;
import com.linkedin.metricwatch.persisteddata.FileStateStore;
import com.linkedin.metricwatch.persisteddata.MemoryStateStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static com.linkedin.metricwatch.engine.MetricWatchEngine.SENSOR;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.COST;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.ERROR_COUNT;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.MINUTE_MS;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.START_MS;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.config;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.defaultConfig;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.fixedClock;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class MetricWatchEngineTest {
  private static final double[] CYCLE = {19, 21, 20, 22, 18};
  private static final int NUM_SAMPLES = 51;
  private static final long NOW_MS = START_MS + NUM_SAMPLES * MINUTE_MS;

  @Rule
  public TemporaryFolder _folder = new TemporaryFolder();
  private MetricRegistry _registry;

  @Before
  public void setUp() {
    _registry = new MetricRegistry();
  }

  /**
   * Record a short repeating cycle of the cost metric followed by a spike.
   */
  private static void recordCycleWithSpike(MetricWatchEngine engine) {
    for (int i = 0; i < NUM_SAMPLES - 1; i++) {
      engine.record(COST, START_MS + i * MINUTE_MS, CYCLE[i % CYCLE.length]);
    }
    engine.record(COST, START_MS + (NUM_SAMPLES - 1) * MINUTE_MS, 30.0);
  }

  private MetricWatchConfig fileStoreConfig() throws IOException {
    return config(Map.of(MetricStoreConfig.STATE_STORE_CLASS_CONFIG, FileStateStore.class.getName(),
                         MetricStoreConfig.STATE_STORE_DIR_CONFIG, _folder.newFolder("state").getAbsolutePath()));
  }

  @SuppressWarnings("unchecked")
  private int gauge(String name) {
    return ((Gauge<Integer>) _registry.getGauges().get(MetricRegistry.name(SENSOR, name))).getValue();
  }

  @Test
  public void testDetectRecordsAnomalies() throws MetricWatchException {
    MetricWatchEngine engine = new MetricWatchEngine(defaultConfig(), _registry, fixedClock(NOW_MS));
    assertTrue(engine.stateStore() instanceof MemoryStateStore);
    recordCycleWithSpike(engine);

    DetectionResult result = engine.detect(COST);
    assertTrue(result.isAnomalous());
    assertEquals(1, engine.anomalyLedger().size());
    assertEquals(AnomalyStatus.NEW, engine.anomalyLedger().get(result.record().id()).status());

    assertEquals(NUM_SAMPLES, _registry.meter(MetricRegistry.name(SENSOR, "samples-appended")).getCount());
    assertEquals(1, _registry.meter(MetricRegistry.name(SENSOR, "anomalies-recorded")).getCount());
    assertEquals(1, _registry.timer(MetricRegistry.name(SENSOR, "detection-timer")).getCount());
    assertEquals(1, gauge("tracked-metrics"));
    assertEquals(1, gauge("open-anomalies"));

    engine.anomalyLedger().resolve(result.record().id(), "expected batch job");
    assertEquals(0, gauge("open-anomalies"));
  }

  @Test
  public void testRepeatedDetectionRecordsObservationOnce() throws MetricWatchException {
    MetricWatchEngine engine = new MetricWatchEngine(defaultConfig(), _registry, fixedClock(NOW_MS));
    recordCycleWithSpike(engine);

    DetectionResult first = engine.detect(COST);
    DetectionResult second = engine.detect(COST);
    DetectionResult third = engine.detect(COST);
    assertTrue(first.isAnomalous());
    assertTrue(second.isAnomalous());
    assertTrue(third.isAnomalous());
    assertEquals(1, engine.anomalyLedger().size());
    assertEquals(first.record().id(), engine.anomalyLedger().recent(1).get(0).id());
    assertEquals(1, _registry.meter(MetricRegistry.name(SENSOR, "anomalies-recorded")).getCount());
    assertEquals(3, _registry.timer(MetricRegistry.name(SENSOR, "detection-timer")).getCount());

    // A new spike is a new observation.
    engine.record(COST, NOW_MS, 31.0);
    assertTrue(engine.detect(COST).isAnomalous());
    assertEquals(2, engine.anomalyLedger().size());
  }

  @Test
  public void testNormalObservationIsNotRecorded() throws MetricWatchException {
    MetricWatchEngine engine = new MetricWatchEngine(defaultConfig(), _registry, fixedClock(NOW_MS));
    recordCycleWithSpike(engine);

    DetectionResult result = engine.detectValue(COST, 20.0);
    assertFalse(result.isAnomalous());
    assertEquals(result.verdict(), engine.anomalyDetector().evaluateValue(COST, 20.0).verdict());
    assertEquals(0, engine.anomalyLedger().size());
    assertEquals(NUM_SAMPLES, engine.metricStore().size(COST));
  }

  @Test
  public void testRejectedSamplesAreCounted() throws MetricWatchException {
    MetricWatchEngine engine = new MetricWatchEngine(defaultConfig(), _registry, fixedClock(NOW_MS));
    assertThrows(InvalidSampleException.class, () -> engine.record(COST, START_MS, Double.NaN));
    assertThrows(InvalidSampleException.class, () -> engine.record(" ", START_MS, 1.0));
    assertEquals(2, _registry.meter(MetricRegistry.name(SENSOR, "samples-rejected")).getCount());
    assertEquals(0, _registry.meter(MetricRegistry.name(SENSOR, "samples-appended")).getCount());
    assertEquals(0, gauge("tracked-metrics"));
  }

  @Test
  public void testForecastAndInsights() throws MetricWatchException, InsufficientHistoryException {
    MetricWatchEngine engine = new MetricWatchEngine(defaultConfig(), _registry, fixedClock(NOW_MS));
    recordCycleWithSpike(engine);
    engine.record(ERROR_COUNT, START_MS, 1.0);
    engine.detect(COST);

    assertEquals(24, engine.forecast(COST, 24, ForecastMethod.MOVING_AVERAGE).points().size());
    assertEquals(List.of(COST), new ArrayList<>(engine.forecastAll(12).keySet()));
    assertEquals(3, engine.capacityPlanner().configuredThresholds().size());
    assertEquals(2, _registry.timer(MetricRegistry.name(SENSOR, "forecast-timer")).getCount());

    List<InsightType> types = new ArrayList<>();
    for (Insight insight : engine.insights()) {
      types.add(insight.type());
    }
    assertTrue(types.toString(), types.contains(InsightType.MOST_ANOMALOUS_METRIC));
  }

  @Test
  public void testPersistAndLoadThroughFileStateStore() throws MetricWatchException, IOException {
    MetricWatchConfig config = fileStoreConfig();
    MetricWatchEngine engine = new MetricWatchEngine(config, _registry, fixedClock(NOW_MS));
    assertTrue(engine.stateStore() instanceof FileStateStore);
    recordCycleWithSpike(engine);
    DetectionResult result = engine.detect(COST);
    engine.persist();

    MetricWatchEngine restarted = new MetricWatchEngine(config, new MetricRegistry(), fixedClock(NOW_MS));
    assertTrue(restarted.load());
    assertEquals(NUM_SAMPLES, restarted.metricStore().size(COST));
    assertEquals(30.0, restarted.metricStore().latest(COST).value(), 0.0);
    assertEquals(1, restarted.anomalyLedger().size());
    assertEquals(result.record().timeMs(), restarted.anomalyLedger().get(result.record().id()).timeMs());
  }

  @Test
  public void testLoadWithoutPersistedState() throws MetricWatchException, IOException {
    MetricWatchEngine engine = new MetricWatchEngine(fileStoreConfig(), _registry, fixedClock(NOW_MS));
    assertFalse(engine.load());
    assertTrue(engine.metricStore().metricNames().isEmpty());
  }

  @Test
  public void testFileStateStoreRequiresDirectory() {
    MetricWatchConfig config = config(Map.of(MetricStoreConfig.STATE_STORE_CLASS_CONFIG, FileStateStore.class.getName()));
    assertThrows(ConfigException.class, () -> new MetricWatchEngine(config, _registry, fixedClock(NOW_MS)));
  }
}
