/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector;

/**
 * A filter over the anomaly ledger. A {@code null} filter matches every record.
 */
public final class LedgerQuery {
  public static final int DEFAULT_LIMIT = 50;
  private final AnomalyStatus _status;
  private final AnomalySeverity _severity;
  private final String _metricName;
  private final int _limit;

  /**
   * @param status The status of the matching records, or {@code null} for any status.
   * @param severity The severity of the matching records, or {@code null} for any severity.
   * @param metricName The metric of the matching records, or {@code null} for any metric.
   * @param limit The maximum number of records to return, capped by the maximum page size of the ledger.
   */
  public LedgerQuery(AnomalyStatus status, AnomalySeverity severity, String metricName, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("Limit must be positive, got " + limit);
    }
    _status = status;
    _severity = severity;
    _metricName = metricName;
    _limit = limit;
  }

  /**
   * @return A query that matches every record, limited to {@link #DEFAULT_LIMIT} records.
   */
  public static LedgerQuery all() {
    return new LedgerQuery(null, null, null, DEFAULT_LIMIT);
  }

  /**
   * @param status The status of the matching records.
   * @return A query that matches the records in the given status, limited to {@link #DEFAULT_LIMIT} records.
   */
  public static LedgerQuery withStatus(AnomalyStatus status) {
    return new LedgerQuery(status, null, null, DEFAULT_LIMIT);
  }

  /**
   * @param record Anomaly record.
   * @return {@code true} if the given record passes every filter of this query.
   */
  public boolean matches(AnomalyRecord record) {
    return (_status == null || _status == record.status())
           && (_severity == null || _severity == record.severity())
           && (_metricName == null || _metricName.equals(record.metricName()));
  }

  public AnomalyStatus status() {
    return _status;
  }

  public AnomalySeverity severity() {
    return _severity;
  }

  public String metricName() {
    return _metricName;
  }

  public int limit() {
    return _limit;
  }

  @Override
  public String toString() {
    return String.format("{status=%s,severity=%s,metric=%s,limit=%d}", _status, _severity, _metricName, _limit);
  }
}
