/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.monitor;

import com.linkedin.metricwatch.exception.CorruptPersistedStateException;
import com.linkedin.metricwatch.exception.InvalidSampleException;
import com.linkedin.metricwatch.monitor.sampling.MetricSample;
import com.linkedin.metricwatch.monitor.sampling.MetricSeries;
import com.linkedin.metricwatch.persisteddata.MemoryStateStore;
import com.linkedin.metricwatch.persisteddata.StateStore;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.metricwatch.MetricWatchUtils.ensureValidSample;
import static com.linkedin.metricwatch.common.utils.Utils.validateNotNull;


/**
 * The bounded history of every tracked metric.
 * <p>
 * Each metric has its own {@link MetricSeries}, created on the first appended sample. Reads of an unknown metric
 * return empty results. The history survives a restart through {@link #persist()} and {@link #load()}, which are never
 * invoked implicitly.
 */
public class MetricStore {
  private static final Logger LOG = LoggerFactory.getLogger(MetricStore.class);
  public static final String DEFAULT_DOCUMENT_NAME = "history.json";
  private final int _capacityPerMetric;
  private final ConcurrentMap<String, MetricSeries> _seriesByMetric;
  private final StateStore _stateStore;
  private final String _documentName;
  private final MetricStoreSerde _serde;

  /**
   * Construct a metric store that keeps its persisted state in memory.
   *
   * @param capacityPerMetric Maximum number of samples retained per metric.
   */
  public MetricStore(int capacityPerMetric) {
    this(capacityPerMetric, new MemoryStateStore(), DEFAULT_DOCUMENT_NAME);
  }

  /**
   * @param capacityPerMetric Maximum number of samples retained per metric.
   * @param stateStore The storage of the persisted history.
   * @param documentName The name of the persisted history document in the state store.
   */
  public MetricStore(int capacityPerMetric, StateStore stateStore, String documentName) {
    if (capacityPerMetric <= 0) {
      throw new IllegalArgumentException("Capacity per metric must be positive, got " + capacityPerMetric);
    }
    _capacityPerMetric = capacityPerMetric;
    _stateStore = validateNotNull(stateStore, "State store cannot be null.");
    _documentName = validateNotNull(documentName, "Document name cannot be null.");
    _seriesByMetric = new ConcurrentHashMap<>();
    _serde = new MetricStoreSerde();
  }

  /**
   * Append a sample to the history of the given metric.
   *
   * @param metricName Name of the metric.
   * @param timeMs Time of the sample in milliseconds.
   * @param value Observed value.
   * @return {@code true} if the sample is retained, {@code false} if it is older than the whole retained history of a
   * full series.
   * @throws InvalidSampleException if the metric name is blank or the value is not finite.
   */
  public boolean append(String metricName, long timeMs, double value) {
    try {
      ensureValidSample(metricName, value);
    } catch (InvalidSampleException ise) {
      LOG.warn("Rejected sample at {}: {}", timeMs, ise.getMessage());
      throw ise;
    }
    MetricSeries series = _seriesByMetric.computeIfAbsent(metricName, m -> new MetricSeries(m, _capacityPerMetric));
    boolean retained = series.append(new MetricSample(metricName, timeMs, value));
    if (!retained) {
      LOG.debug("Dropped sample of {} at {}, it is older than the retained history.", metricName, timeMs);
    } else {
      LOG.trace("Appended {} = {} at {}.", metricName, value, timeMs);
    }
    return retained;
  }

  /**
   * @param metricName Name of the metric.
   * @param n Maximum number of samples.
   * @return The most recent {@code n} samples of the metric, oldest first, empty for an unknown metric.
   */
  public List<MetricSample> tail(String metricName, int n) {
    MetricSeries series = _seriesByMetric.get(metricName);
    return series == null ? Collections.emptyList() : series.tail(n);
  }

  /**
   * @param metricName Name of the metric.
   * @return All retained samples of the metric, oldest first, empty for an unknown metric.
   */
  public List<MetricSample> all(String metricName) {
    MetricSeries series = _seriesByMetric.get(metricName);
    return series == null ? Collections.emptyList() : series.all();
  }

  /**
   * @param metricName Name of the metric.
   * @return The newest sample of the metric, or {@code null} for an unknown metric.
   */
  public MetricSample latest(String metricName) {
    MetricSeries series = _seriesByMetric.get(metricName);
    return series == null ? null : series.latest();
  }

  /**
   * @param metricName Name of the metric.
   * @return Number of retained samples of the metric.
   */
  public int size(String metricName) {
    MetricSeries series = _seriesByMetric.get(metricName);
    return series == null ? 0 : series.size();
  }

  /**
   * @return The names of the tracked metrics in lexicographic order.
   */
  public Set<String> metricNames() {
    return Collections.unmodifiableSet(new TreeSet<>(_seriesByMetric.keySet()));
  }

  public int capacityPerMetric() {
    return _capacityPerMetric;
  }

  /**
   * Write the retained history of every metric to the state store.
   *
   * @throws IOException if the state store fails to write the document.
   */
  public synchronized void persist() throws IOException {
    Map<String, List<MetricSample>> snapshot = new TreeMap<>();
    for (Map.Entry<String, MetricSeries> entry : _seriesByMetric.entrySet()) {
      snapshot.put(entry.getKey(), entry.getValue().all());
    }
    _stateStore.write(_documentName, _serde.serialize(snapshot));
    LOG.info("Persisted the history of {} metrics to {}.", snapshot.size(), _documentName);
  }

  /**
   * Replace the current history with the persisted one. A missing, unreadable or corrupt document leaves the store
   * empty. The capacity of this store applies to the loaded history.
   *
   * @return The outcome of the load.
   */
  public synchronized LoadStatus load() {
    _seriesByMetric.clear();
    String json;
    try {
      json = _stateStore.read(_documentName);
    } catch (IOException e) {
      LOG.warn("Failed to read the persisted metric history {}, starting empty.", _documentName, e);
      return LoadStatus.CORRUPT;
    }
    if (json == null) {
      LOG.info("No persisted metric history {} is found, starting empty.", _documentName);
      return LoadStatus.MISSING;
    }

    Map<String, List<MetricSample>> samplesByMetric;
    try {
      samplesByMetric = _serde.deserialize(json);
    } catch (CorruptPersistedStateException e) {
      LOG.warn("The persisted metric history {} is corrupt, starting empty.", _documentName, e);
      return LoadStatus.CORRUPT;
    }

    int numSamples = 0;
    for (Map.Entry<String, List<MetricSample>> entry : samplesByMetric.entrySet()) {
      if (entry.getKey().isBlank()) {
        LOG.warn("Skip {} persisted samples with a blank metric name.", entry.getValue().size());
        continue;
      }
      for (MetricSample sample : entry.getValue()) {
        if (append(sample.metricName(), sample.timeMs(), sample.value())) {
          numSamples++;
        }
      }
    }
    LOG.info("Loaded {} samples of {} metrics from {}.", numSamples, _seriesByMetric.size(), _documentName);
    return LoadStatus.LOADED;
  }
}
