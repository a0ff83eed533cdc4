/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.monitor;

import com.linkedin.metricwatch.exception.InvalidSampleException;
import com.linkedin.metricwatch.monitor.sampling.MetricSample;
import com.linkedin.metricwatch.persisteddata.MemoryStateStore;
import com.linkedin.metricwatch.persisteddata.StateStore;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import org.easymock.EasyMock;
import org.junit.Test;

import static com.linkedin.metricwatch.TestConstants.CONTEXT_USAGE;
import static com.linkedin.metricwatch.TestConstants.COST;
import static com.linkedin.metricwatch.TestConstants.ERROR_COUNT;
import static com.linkedin.metricwatch.TestConstants.MINUTE_MS;
import static com.linkedin.metricwatch.TestConstants.START_MS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class MetricStoreTest {
  private static final String DOCUMENT = MetricStore.DEFAULT_DOCUMENT_NAME;

  @Test
  public void testUnknownMetric() {
    MetricStore store = new MetricStore(10);
    assertTrue(store.tail(ERROR_COUNT, 5).isEmpty());
    assertTrue(store.all(ERROR_COUNT).isEmpty());
    assertNull(store.latest(ERROR_COUNT));
    assertEquals(0, store.size(ERROR_COUNT));
    assertTrue(store.metricNames().isEmpty());
  }

  @Test
  public void testInvalidSamplesAreRejected() {
    MetricStore store = new MetricStore(10);
    assertThrows(InvalidSampleException.class, () -> store.append(ERROR_COUNT, START_MS, Double.NaN));
    assertThrows(InvalidSampleException.class, () -> store.append(ERROR_COUNT, START_MS, Double.POSITIVE_INFINITY));
    assertThrows(InvalidSampleException.class, () -> store.append("", START_MS, 1.0));
    assertThrows(InvalidSampleException.class, () -> store.append(null, START_MS, 1.0));
    assertEquals(0, store.size(ERROR_COUNT));
    assertTrue(store.metricNames().isEmpty());
  }

  @Test
  public void testMetricsAreIndependent() {
    MetricStore store = new MetricStore(3);
    for (int i = 0; i < 5; i++) {
      store.append(ERROR_COUNT, START_MS + i * MINUTE_MS, i);
    }
    store.append(COST, START_MS, 42.0);
    assertEquals(3, store.size(ERROR_COUNT));
    assertEquals(1, store.size(COST));
    assertEquals(Set.of(COST, ERROR_COUNT), store.metricNames());
    assertEquals(4.0, store.latest(ERROR_COUNT).value(), 0.0);
  }

  @Test
  public void testPersistAndLoadRoundTrip() throws IOException {
    MemoryStateStore stateStore = new MemoryStateStore();
    MetricStore store = new MetricStore(100, stateStore, DOCUMENT);
    for (int i = 0; i < 20; i++) {
      store.append(ERROR_COUNT, START_MS + i * MINUTE_MS, i % 4);
      store.append(CONTEXT_USAGE, START_MS + i * MINUTE_MS, 40.0 + i * 0.25);
    }
    store.persist();

    MetricStore restored = new MetricStore(100, stateStore, DOCUMENT);
    assertEquals(LoadStatus.LOADED, restored.load());
    assertEquals(store.metricNames(), restored.metricNames());
    assertEquals(store.all(ERROR_COUNT), restored.all(ERROR_COUNT));
    assertEquals(store.all(CONTEXT_USAGE), restored.all(CONTEXT_USAGE));
  }

  @Test
  public void testLoadAppliesCapacity() throws IOException {
    MemoryStateStore stateStore = new MemoryStateStore();
    MetricStore store = new MetricStore(100, stateStore, DOCUMENT);
    for (int i = 0; i < 20; i++) {
      store.append(ERROR_COUNT, START_MS + i * MINUTE_MS, i);
    }
    store.persist();

    MetricStore smaller = new MetricStore(5, stateStore, DOCUMENT);
    assertEquals(LoadStatus.LOADED, smaller.load());
    List<MetricSample> samples = smaller.all(ERROR_COUNT);
    assertEquals(5, samples.size());
    assertEquals(15.0, samples.get(0).value(), 0.0);
    assertEquals(19.0, samples.get(4).value(), 0.0);
  }

  @Test
  public void testLoadMissingDocument() {
    MetricStore store = new MetricStore(10, new MemoryStateStore(), DOCUMENT);
    store.append(ERROR_COUNT, START_MS, 1.0);
    assertEquals(LoadStatus.MISSING, store.load());
    assertTrue(store.metricNames().isEmpty());
  }

  @Test
  public void testLoadCorruptDocument() throws IOException {
    MemoryStateStore stateStore = new MemoryStateStore();
    stateStore.write(DOCUMENT, resource("monitor/history-corrupt.json"));
    MetricStore store = new MetricStore(10, stateStore, DOCUMENT);
    assertEquals(LoadStatus.CORRUPT, store.load());
    assertTrue(store.metricNames().isEmpty());

    stateStore.write(DOCUMENT, "[1, 2, 3]");
    assertEquals(LoadStatus.CORRUPT, store.load());
    assertTrue(store.metricNames().isEmpty());
  }

  @Test
  public void testLoadSkipsInvalidEntriesAndIgnoresUnknownFields() throws IOException {
    MemoryStateStore stateStore = new MemoryStateStore();
    stateStore.write(DOCUMENT, resource("monitor/history-with-unknown-fields.json"));
    MetricStore store = new MetricStore(10, stateStore, DOCUMENT);
    assertEquals(LoadStatus.LOADED, store.load());

    assertEquals(Set.of(COST, ERROR_COUNT), store.metricNames());
    List<MetricSample> errors = store.all(ERROR_COUNT);
    assertEquals(3, errors.size());
    assertEquals(1_700_000_000_000L, errors.get(0).timeMs());
    assertEquals(3.0, errors.get(0).value(), 0.0);
    assertEquals(1_700_000_120_000L, errors.get(2).timeMs());
    assertEquals(7.5, errors.get(2).value(), 0.0);
    assertEquals(1_700_000_000_500L, store.latest(COST).timeMs());
  }

  @Test
  public void testLoadFailureOfStateStore() throws IOException {
    StateStore stateStore = EasyMock.mock(StateStore.class);
    EasyMock.expect(stateStore.read(DOCUMENT)).andThrow(new IOException("disk unavailable"));
    EasyMock.replay(stateStore);

    MetricStore store = new MetricStore(10, stateStore, DOCUMENT);
    assertEquals(LoadStatus.CORRUPT, store.load());
    assertTrue(store.metricNames().isEmpty());
    EasyMock.verify(stateStore);
  }

  @Test
  public void testPersistFailureOfStateStore() throws IOException {
    StateStore stateStore = EasyMock.mock(StateStore.class);
    stateStore.write(EasyMock.eq(DOCUMENT), EasyMock.anyString());
    EasyMock.expectLastCall().andThrow(new IOException("disk full"));
    EasyMock.replay(stateStore);

    MetricStore store = new MetricStore(10, stateStore, DOCUMENT);
    store.append(ERROR_COUNT, START_MS, 1.0);
    assertThrows(IOException.class, store::persist);
    assertEquals(1, store.size(ERROR_COUNT));
    EasyMock.verify(stateStore);
  }

  @Test
  public void testDroppedSampleIsReported() {
    MetricStore store = new MetricStore(1);
    assertTrue(store.append(ERROR_COUNT, START_MS + MINUTE_MS, 1.0));
    assertFalse(store.append(ERROR_COUNT, START_MS, 0.0));
    assertEquals(1.0, store.latest(ERROR_COUNT).value(), 0.0);
  }

  private static String resource(String name) throws IOException {
    try (InputStream in = MetricStoreTest.class.getClassLoader().getResourceAsStream(name)) {
      if (in == null) {
        throw new IOException("Missing test resource " + name);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
