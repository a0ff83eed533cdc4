/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector;

import com.linkedin.metricwatch.engine.detector.estimator.EstimatorType;
import com.linkedin.metricwatch.monitor.LoadStatus;
import com.linkedin.metricwatch.persisteddata.MemoryStateStore;
import com.linkedin.metricwatch.persisteddata.StateStore;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.easymock.EasyMock;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.CONTEXT_USAGE;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.COST;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.ERROR_COUNT;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.MINUTE_MS;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.START_MS;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.defaultConfig;
import static com.linkedin.metricwatch.engine.MetricWatchTestUtils.fixedClock;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class AnomalyLedgerTest {
  private static final String DOCUMENT = "anomalies.json";
  private static final long NOW_MS = START_MS + 60 * MINUTE_MS;
  private MemoryStateStore _stateStore;
  private AnomalyLedger _ledger;

  @Before
  public void setUp() {
    _stateStore = new MemoryStateStore();
    _ledger = new AnomalyLedger(defaultConfig(), _stateStore, fixedClock(NOW_MS));
  }

  private static AnomalyRecord record(String id, String metricName, int minute, AnomalySeverity severity) {
    return new AnomalyRecord(id, metricName, START_MS + minute * MINUTE_MS, 100.0 + minute,
                             Map.of(EstimatorType.Z_SCORE, 1.0, EstimatorType.IQR, 0.5), 2, 0.5, severity,
                             START_MS + minute * MINUTE_MS);
  }

  private static List<String> ids(List<AnomalyRecord> records) {
    List<String> ids = new ArrayList<>();
    for (AnomalyRecord record : records) {
      ids.add(record.id());
    }
    return ids;
  }

  @Test
  public void testLifecycle() {
    _ledger.record(record("a", ERROR_COUNT, 1, AnomalySeverity.HIGH));
    _ledger.record(record("b", ERROR_COUNT, 2, AnomalySeverity.LOW));

    assertTrue(_ledger.acknowledge("a"));
    AnomalyRecord acknowledged = _ledger.get("a");
    assertEquals(AnomalyStatus.ACKNOWLEDGED, acknowledged.status());
    assertEquals(Long.valueOf(NOW_MS), acknowledged.acknowledgedAtMs());
    assertTrue(acknowledged.isOpen());
    assertThrows(IllegalStateException.class, () -> _ledger.acknowledge("a"));

    assertTrue(_ledger.resolve("a", "restarted the collector"));
    AnomalyRecord resolved = _ledger.get("a");
    assertEquals(AnomalyStatus.RESOLVED, resolved.status());
    assertEquals("restarted the collector", resolved.resolutionNotes());
    assertEquals(Long.valueOf(NOW_MS), resolved.resolvedAtMs());
    assertEquals(Long.valueOf(NOW_MS), resolved.acknowledgedAtMs());
    assertFalse(resolved.isOpen());
    assertThrows(IllegalStateException.class, () -> _ledger.resolve("a", null));
    assertThrows(IllegalStateException.class, () -> _ledger.acknowledge("a"));

    // A new record can be resolved without an acknowledgement.
    assertTrue(_ledger.resolve("b", null));
    assertNull(_ledger.get("b").acknowledgedAtMs());
    assertNull(_ledger.get("b").resolutionNotes());

    assertFalse(_ledger.acknowledge("missing"));
    assertFalse(_ledger.resolve("missing", "notes"));
    assertNull(_ledger.get("missing"));
  }

  @Test
  public void testDuplicateIdIsRejected() {
    _ledger.record(record("a", ERROR_COUNT, 1, AnomalySeverity.HIGH));
    assertThrows(IllegalArgumentException.class, () -> _ledger.record(record("a", COST, 2, AnomalySeverity.LOW)));
    assertEquals(1, _ledger.size());
  }

  @Test
  public void testRecordIfAbsentSkipsRecordedObservation() {
    assertTrue(_ledger.recordIfAbsent(record("a", ERROR_COUNT, 1, AnomalySeverity.HIGH)));
    assertFalse(_ledger.recordIfAbsent(record("b", ERROR_COUNT, 1, AnomalySeverity.CRITICAL)));
    assertTrue(_ledger.recordIfAbsent(record("c", COST, 1, AnomalySeverity.HIGH)));
    assertTrue(_ledger.recordIfAbsent(record("d", ERROR_COUNT, 2, AnomalySeverity.HIGH)));
    assertEquals(Arrays.asList("d", "c", "a"), ids(_ledger.recent(10)));
    assertNull(_ledger.get("b"));
  }

  @Test
  public void testRetentionEvictsResolvedFirst() {
    AnomalyLedger ledger = new AnomalyLedger(3, 100, _stateStore, DOCUMENT, fixedClock(NOW_MS));
    ledger.record(record("a", ERROR_COUNT, 1, AnomalySeverity.HIGH));
    ledger.record(record("b", ERROR_COUNT, 2, AnomalySeverity.HIGH));
    ledger.record(record("c", ERROR_COUNT, 3, AnomalySeverity.HIGH));
    ledger.resolve("b", null);

    ledger.record(record("d", ERROR_COUNT, 4, AnomalySeverity.HIGH));
    assertEquals(List.of("d", "c", "a"), ids(ledger.recent(10)));

    // Without resolved records the oldest record goes.
    ledger.record(record("e", ERROR_COUNT, 5, AnomalySeverity.HIGH));
    assertEquals(List.of("e", "d", "c"), ids(ledger.recent(10)));
    assertEquals(3, ledger.size());
  }

  @Test
  public void testListFiltersNewestFirst() {
    _ledger.record(record("a", ERROR_COUNT, 1, AnomalySeverity.CRITICAL));
    _ledger.record(record("b", COST, 2, AnomalySeverity.HIGH));
    _ledger.record(record("c", ERROR_COUNT, 3, AnomalySeverity.HIGH));
    _ledger.record(record("d", CONTEXT_USAGE, 4, AnomalySeverity.CRITICAL));
    _ledger.acknowledge("c");
    _ledger.resolve("d", null);

    assertEquals(List.of("d", "c", "b", "a"), ids(_ledger.list(LedgerQuery.all())));
    assertEquals(List.of("b", "a"), ids(_ledger.list(LedgerQuery.withStatus(AnomalyStatus.NEW))));
    assertEquals(List.of("c", "a"), ids(_ledger.list(new LedgerQuery(null, null, ERROR_COUNT, 10))));
    assertEquals(List.of("d", "a"), ids(_ledger.list(new LedgerQuery(null, AnomalySeverity.CRITICAL, null, 10))));
    assertEquals(List.of("c"), ids(_ledger.list(new LedgerQuery(AnomalyStatus.ACKNOWLEDGED, AnomalySeverity.HIGH,
                                                                ERROR_COUNT, 10))));
    assertEquals(List.of("d"), ids(_ledger.list(new LedgerQuery(null, null, null, 1))));
    assertEquals(List.of("c", "b", "a"), ids(_ledger.openAnomalies()));
    assertThrows(IllegalArgumentException.class, () -> new LedgerQuery(null, null, null, 0));
  }

  @Test
  public void testPageSizeCapsListing() {
    AnomalyLedger ledger = new AnomalyLedger(100, 2, _stateStore, DOCUMENT, fixedClock(NOW_MS));
    for (int i = 0; i < 5; i++) {
      ledger.record(record("r" + i, ERROR_COUNT, i, AnomalySeverity.MEDIUM));
    }
    assertEquals(List.of("r4", "r3"), ids(ledger.list(new LedgerQuery(null, null, null, 50))));
    assertEquals(5, ledger.recent(50).size());
  }

  @Test
  public void testStatistics() {
    _ledger.record(record("a", ERROR_COUNT, 1, AnomalySeverity.CRITICAL));
    _ledger.record(record("b", COST, 2, AnomalySeverity.HIGH));
    _ledger.record(record("c", ERROR_COUNT, 3, AnomalySeverity.HIGH));
    _ledger.resolve("b", null);
    _ledger.acknowledge("c");

    AnomalyStatistics statistics = _ledger.statistics();
    assertEquals(3, statistics.total());
    assertEquals(1, statistics.resolvedCount());
    assertEquals(2, statistics.unresolvedCount());
    assertEquals(Integer.valueOf(2), statistics.countBySeverity().get(AnomalySeverity.HIGH));
    assertEquals(Integer.valueOf(0), statistics.countBySeverity().get(AnomalySeverity.LOW));
    assertEquals(Integer.valueOf(1), statistics.countByStatus().get(AnomalyStatus.NEW));
    assertEquals(Integer.valueOf(2), statistics.countByMetric().get(ERROR_COUNT));
    assertEquals(List.of(COST, ERROR_COUNT), new ArrayList<>(statistics.countByMetric().keySet()));
  }

  @Test
  public void testPersistAndLoadRoundTrip() throws IOException {
    _ledger.record(record("a", ERROR_COUNT, 1, AnomalySeverity.CRITICAL));
    _ledger.record(record("b", COST, 2, AnomalySeverity.HIGH));
    _ledger.acknowledge("a");
    _ledger.resolve("b", "budget raised");
    _ledger.persist();

    AnomalyLedger restored = new AnomalyLedger(defaultConfig(), _stateStore, fixedClock(NOW_MS));
    assertEquals(LoadStatus.LOADED, restored.load());
    assertEquals(List.of("b", "a"), ids(restored.recent(10)));
    AnomalyRecord a = restored.get("a");
    AnomalyRecord original = _ledger.get("a");
    assertEquals(original.metricName(), a.metricName());
    assertEquals(original.timeMs(), a.timeMs());
    assertEquals(original.observedValue(), a.observedValue(), 0.0);
    assertEquals(original.methodScores(), a.methodScores());
    assertEquals(original.votes(), a.votes());
    assertEquals(original.confidence(), a.confidence(), 0.0);
    assertEquals(AnomalySeverity.CRITICAL, a.severity());
    assertEquals(AnomalyStatus.ACKNOWLEDGED, a.status());
    assertEquals(original.acknowledgedAtMs(), a.acknowledgedAtMs());
    assertEquals("budget raised", restored.get("b").resolutionNotes());
    assertEquals(AnomalyStatus.RESOLVED, restored.get("b").status());
  }

  @Test
  public void testLoadSkipsInvalidRecords() throws IOException {
    _stateStore.write(DOCUMENT, resource("detector/anomalies-with-unknown-fields.json"));
    assertEquals(LoadStatus.LOADED, _ledger.load());
    assertEquals(List.of("a-3", "a-1"), ids(_ledger.recent(10)));

    AnomalyRecord first = _ledger.get("a-1");
    assertEquals(AnomalyStatus.ACKNOWLEDGED, first.status());
    assertEquals(AnomalySeverity.CRITICAL, first.severity());
    assertEquals(Map.of(EstimatorType.Z_SCORE, 1.0, EstimatorType.IQR, 1.0), first.methodScores());
    assertEquals(Long.valueOf(1_700_000_500_000L), first.acknowledgedAtMs());
    assertEquals(1_700_000_540_250L, _ledger.get("a-3").timeMs());
    assertEquals("cache resized", _ledger.get("a-3").resolutionNotes());
  }

  @Test
  public void testLoadCorruptOrMissingLedger() throws IOException {
    _ledger.record(record("a", ERROR_COUNT, 1, AnomalySeverity.CRITICAL));
    assertEquals(LoadStatus.MISSING, _ledger.load());
    assertEquals(0, _ledger.size());

    _stateStore.write(DOCUMENT, "{\"records\": []}");
    assertEquals(LoadStatus.CORRUPT, _ledger.load());
    _stateStore.write(DOCUMENT, "{\"anomalies\": [");
    assertEquals(LoadStatus.CORRUPT, _ledger.load());
    assertEquals(0, _ledger.size());
  }

  @Test
  public void testPersistFailureOfStateStore() throws IOException {
    StateStore stateStore = EasyMock.mock(StateStore.class);
    stateStore.write(EasyMock.eq(DOCUMENT), EasyMock.anyString());
    EasyMock.expectLastCall().andThrow(new IOException("read-only file system"));
    EasyMock.replay(stateStore);

    AnomalyLedger ledger = new AnomalyLedger(defaultConfig(), stateStore, fixedClock(NOW_MS));
    ledger.record(record("a", ERROR_COUNT, 1, AnomalySeverity.CRITICAL));
    assertThrows(IOException.class, ledger::persist);
    EasyMock.verify(stateStore);
  }

  private static String resource(String name) throws IOException {
    try (InputStream in = AnomalyLedgerTest.class.getClassLoader().getResourceAsStream(name)) {
      if (in == null) {
        throw new IOException("Missing test resource " + name);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
