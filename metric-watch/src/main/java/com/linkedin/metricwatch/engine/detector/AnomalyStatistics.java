/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;


/**
 * Counts of the anomaly records kept by the anomaly ledger.
 */
public final class AnomalyStatistics {
  private final int _total;
  private final Map<AnomalySeverity, Integer> _countBySeverity;
  private final Map<AnomalyStatus, Integer> _countByStatus;
  private final SortedMap<String, Integer> _countByMetric;

  AnomalyStatistics(Iterable<AnomalyRecord> records) {
    Map<AnomalySeverity, Integer> bySeverity = new EnumMap<>(AnomalySeverity.class);
    Map<AnomalyStatus, Integer> byStatus = new EnumMap<>(AnomalyStatus.class);
    for (AnomalySeverity severity : AnomalySeverity.cachedValues()) {
      bySeverity.put(severity, 0);
    }
    for (AnomalyStatus status : AnomalyStatus.cachedValues()) {
      byStatus.put(status, 0);
    }
    SortedMap<String, Integer> byMetric = new TreeMap<>();
    int total = 0;
    for (AnomalyRecord record : records) {
      total++;
      bySeverity.merge(record.severity(), 1, Integer::sum);
      byStatus.merge(record.status(), 1, Integer::sum);
      byMetric.merge(record.metricName(), 1, Integer::sum);
    }
    _total = total;
    _countBySeverity = Collections.unmodifiableMap(bySeverity);
    _countByStatus = Collections.unmodifiableMap(byStatus);
    _countByMetric = Collections.unmodifiableSortedMap(byMetric);
  }

  public int total() {
    return _total;
  }

  public Map<AnomalySeverity, Integer> countBySeverity() {
    return _countBySeverity;
  }

  public Map<AnomalyStatus, Integer> countByStatus() {
    return _countByStatus;
  }

  public SortedMap<String, Integer> countByMetric() {
    return _countByMetric;
  }

  public int resolvedCount() {
    return _countByStatus.get(AnomalyStatus.RESOLVED);
  }

  /**
   * @return Number of new or acknowledged records.
   */
  public int unresolvedCount() {
    return _total - resolvedCount();
  }

  @Override
  public String toString() {
    return String.format("{total=%d,bySeverity=%s,byStatus=%s,byMetric=%s}", _total, _countBySeverity, _countByStatus,
                         _countByMetric);
  }
}
