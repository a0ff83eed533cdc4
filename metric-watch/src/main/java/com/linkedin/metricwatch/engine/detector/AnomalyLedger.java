/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector;

import com.linkedin.metricwatch.common.utils.AutoCloseableLock;
import com.linkedin.metricwatch.engine.config.MetricWatchConfig;
import com.linkedin.metricwatch.engine.config.constants.AnomalyDetectorConfig;
import com.linkedin.metricwatch.exception.CorruptPersistedStateException;
import com.linkedin.metricwatch.monitor.LoadStatus;
import com.linkedin.metricwatch.persisteddata.StateStore;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.metricwatch.common.utils.Utils.validateNotNull;


/**
 * Keeps the anomaly records and their lifecycle: {@code NEW -> ACKNOWLEDGED -> RESOLVED}, or {@code NEW -> RESOLVED}.
 * <p>
 * The ledger keeps at most the configured number of records. Once the cap is exceeded, the oldest resolved record is
 * evicted. Only if there is no resolved record left, the oldest record of any status is evicted. Listings return the
 * most recently recorded records first.
 * <p>
 * Writers are serialized by a write lock. Readers run concurrently under a read lock and get immutable records.
 */
public class AnomalyLedger {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyLedger.class);
  private final int _retention;
  private final int _maxPageSize;
  private final StateStore _stateStore;
  private final String _documentName;
  private final Clock _clock;
  private final AnomalyLedgerSerde _serde;
  private final ReadWriteLock _lock;
  // Records by id in the order they were recorded.
  private final LinkedHashMap<String, AnomalyRecord> _records;

  public AnomalyLedger(MetricWatchConfig config, StateStore stateStore, Clock clock) {
    this(config.getInt(AnomalyDetectorConfig.LEDGER_RETENTION_CONFIG),
         config.getInt(AnomalyDetectorConfig.LEDGER_MAX_PAGE_SIZE_CONFIG),
         stateStore,
         config.getString(AnomalyDetectorConfig.LEDGER_DOCUMENT_NAME_CONFIG),
         clock);
  }

  /**
   * @param retention Maximum number of records kept.
   * @param maxPageSize Maximum number of records returned by a listing.
   * @param stateStore The storage of the persisted ledger.
   * @param documentName The name of the persisted ledger document in the state store.
   * @param clock The clock of lifecycle transitions.
   */
  public AnomalyLedger(int retention, int maxPageSize, StateStore stateStore, String documentName, Clock clock) {
    if (retention <= 0 || maxPageSize <= 0) {
      throw new IllegalArgumentException(String.format("Retention (%d) and max page size (%d) must be positive.",
                                                       retention, maxPageSize));
    }
    _retention = retention;
    _maxPageSize = maxPageSize;
    _stateStore = validateNotNull(stateStore, "State store cannot be null.");
    _documentName = validateNotNull(documentName, "Document name cannot be null.");
    _clock = validateNotNull(clock, "Clock cannot be null.");
    _serde = new AnomalyLedgerSerde();
    _lock = new ReentrantReadWriteLock();
    _records = new LinkedHashMap<>();
  }

  /**
   * Add a record to the ledger, evicting old records if the ledger exceeds its retention.
   *
   * @param record The record to add.
   * @throws IllegalArgumentException if a record with the same id exists.
   */
  public void record(AnomalyRecord record) {
    validateNotNull(record, "Anomaly record cannot be null.");
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.writeLock())) {
      if (_records.containsKey(record.id())) {
        throw new IllegalArgumentException("Anomaly " + record.id() + " is already recorded.");
      }
      _records.put(record.id(), record);
      enforceRetention();
    }
    LOG.debug("Recorded anomaly {}.", record);
  }

  /**
   * Add a record to the ledger unless it already holds a record of the same observation, i.e. of the same metric at
   * the same time. Evicts old records if the ledger exceeds its retention.
   *
   * @param record The record to add.
   * @return {@code true} if the record is added, {@code false} if the observation is already recorded.
   * @throws IllegalArgumentException if a record with the same id exists.
   */
  public boolean recordIfAbsent(AnomalyRecord record) {
    validateNotNull(record, "Anomaly record cannot be null.");
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.writeLock())) {
      for (AnomalyRecord existing : _records.values()) {
        if (existing.timeMs() == record.timeMs() && existing.metricName().equals(record.metricName())) {
          LOG.debug("Observation of {} at {} is already recorded as anomaly {}.", record.metricName(), record.timeMs(),
                    existing.id());
          return false;
        }
      }
      if (_records.containsKey(record.id())) {
        throw new IllegalArgumentException("Anomaly " + record.id() + " is already recorded.");
      }
      _records.put(record.id(), record);
      enforceRetention();
    }
    LOG.debug("Recorded anomaly {}.", record);
    return true;
  }

  /**
   * @param id Anomaly id.
   * @return The record with the given id, or {@code null} if there is no such record.
   */
  public AnomalyRecord get(String id) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      return _records.get(id);
    }
  }

  /**
   * @param query The filters and the limit of the listing.
   * @return The matching records, most recently recorded first, at most the smaller of the query limit and the
   * maximum page size.
   */
  public List<AnomalyRecord> list(LedgerQuery query) {
    int limit = Math.min(query.limit(), _maxPageSize);
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      return newestFirst(query, limit);
    }
  }

  /**
   * @param n Maximum number of records.
   * @return The {@code n} most recently recorded records of any status, most recent first. Not capped by the page size.
   */
  public List<AnomalyRecord> recent(int n) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      return newestFirst(null, n);
    }
  }

  /**
   * @return Every new or acknowledged record, most recently recorded first.
   */
  public List<AnomalyRecord> openAnomalies() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      List<AnomalyRecord> result = new ArrayList<>();
      ListIterator<AnomalyRecord> it = new ArrayList<>(_records.values()).listIterator(_records.size());
      while (it.hasPrevious()) {
        AnomalyRecord record = it.previous();
        if (record.isOpen()) {
          result.add(record);
        }
      }
      return result;
    }
  }

  /**
   * Move the record with the given id from {@link AnomalyStatus#NEW} to {@link AnomalyStatus#ACKNOWLEDGED}.
   *
   * @param id Anomaly id.
   * @return {@code true} if the record was acknowledged, {@code false} if there is no record with the given id.
   * @throws IllegalStateException if the record is not new.
   */
  public boolean acknowledge(String id) {
    AnomalyRecord updated;
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.writeLock())) {
      AnomalyRecord record = _records.get(id);
      if (record == null) {
        return false;
      }
      updated = record.acknowledged(_clock.millis());
      _records.put(id, updated);
    }
    LOG.info("Acknowledged anomaly {}.", updated);
    return true;
  }

  /**
   * Move the record with the given id from {@link AnomalyStatus#NEW} or {@link AnomalyStatus#ACKNOWLEDGED} to
   * {@link AnomalyStatus#RESOLVED}.
   *
   * @param id Anomaly id.
   * @param notes Optional free text resolution notes, may be {@code null}.
   * @return {@code true} if the record was resolved, {@code false} if there is no record with the given id.
   * @throws IllegalStateException if the record is already resolved.
   */
  public boolean resolve(String id, String notes) {
    AnomalyRecord updated;
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.writeLock())) {
      AnomalyRecord record = _records.get(id);
      if (record == null) {
        return false;
      }
      updated = record.resolved(notes, _clock.millis());
      _records.put(id, updated);
    }
    LOG.info("Resolved anomaly {}.", updated);
    return true;
  }

  /**
   * @return Counts of the records by severity, status and metric.
   */
  public AnomalyStatistics statistics() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      return new AnomalyStatistics(new ArrayList<>(_records.values()));
    }
  }

  /**
   * @return Number of records in the ledger.
   */
  public int size() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      return _records.size();
    }
  }

  /**
   * Write every record to the state store.
   *
   * @throws IOException if the state store fails to write the document.
   */
  public void persist() throws IOException {
    List<AnomalyRecord> snapshot;
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      snapshot = new ArrayList<>(_records.values());
    }
    _stateStore.write(_documentName, _serde.serialize(snapshot));
    LOG.info("Persisted {} anomaly records to {}.", snapshot.size(), _documentName);
  }

  /**
   * Replace the current records with the persisted ones. A missing, unreadable or corrupt document leaves the ledger
   * empty. The retention of this ledger applies to the loaded records.
   *
   * @return The outcome of the load.
   */
  public LoadStatus load() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.writeLock())) {
      _records.clear();
      String json;
      try {
        json = _stateStore.read(_documentName);
      } catch (IOException e) {
        LOG.warn("Failed to read the persisted anomaly ledger {}, starting empty.", _documentName, e);
        return LoadStatus.CORRUPT;
      }
      if (json == null) {
        LOG.info("No persisted anomaly ledger {} is found, starting empty.", _documentName);
        return LoadStatus.MISSING;
      }
      List<AnomalyRecord> records;
      try {
        records = _serde.deserialize(json);
      } catch (CorruptPersistedStateException e) {
        LOG.warn("The persisted anomaly ledger {} is corrupt, starting empty.", _documentName, e);
        return LoadStatus.CORRUPT;
      }
      for (AnomalyRecord record : records) {
        if (_records.putIfAbsent(record.id(), record) != null) {
          LOG.warn("Skip duplicate persisted anomaly {}.", record.id());
        }
      }
      enforceRetention();
      LOG.info("Loaded {} anomaly records from {}.", _records.size(), _documentName);
      return LoadStatus.LOADED;
    }
  }

  private List<AnomalyRecord> newestFirst(LedgerQuery query, int limit) {
    List<AnomalyRecord> result = new ArrayList<>(Math.min(limit, _records.size()));
    ListIterator<AnomalyRecord> it = new ArrayList<>(_records.values()).listIterator(_records.size());
    while (it.hasPrevious() && result.size() < limit) {
      AnomalyRecord record = it.previous();
      if (query == null || query.matches(record)) {
        result.add(record);
      }
    }
    return result;
  }

  private void enforceRetention() {
    while (_records.size() > _retention) {
      if (!evictOldest(true)) {
        evictOldest(false);
      }
    }
  }

  /**
   * @param resolvedOnly {@code true} to evict only a resolved record.
   * @return {@code true} if a record was evicted.
   */
  private boolean evictOldest(boolean resolvedOnly) {
    Iterator<Map.Entry<String, AnomalyRecord>> it = _records.entrySet().iterator();
    while (it.hasNext()) {
      AnomalyRecord record = it.next().getValue();
      if (!resolvedOnly || record.status() == AnomalyStatus.RESOLVED) {
        it.remove();
        if (record.isOpen()) {
          LOG.warn("Evicted open anomaly {} to keep the ledger within {} records.", record, _retention);
        } else {
          LOG.trace("Evicted resolved anomaly {}.", record.id());
        }
        return true;
      }
    }
    return false;
  }
}
