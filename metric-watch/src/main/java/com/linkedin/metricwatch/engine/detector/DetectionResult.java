/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector;

import com.linkedin.metricwatch.engine.detector.estimator.EstimatorResult;
import java.util.Collections;
import java.util.List;


/**
 * The outcome of evaluating an observation of a metric. Only an {@link DetectionVerdict#ANOMALOUS} result carries an
 * {@link AnomalyRecord}.
 */
public final class DetectionResult {
  private final DetectionVerdict _verdict;
  private final String _metricName;
  private final long _timeMs;
  private final double _value;
  private final List<EstimatorResult> _estimatorResults;
  private final int _votes;
  private final double _confidence;
  private final AnomalySeverity _severity;
  private final AnomalyRecord _record;

  DetectionResult(DetectionVerdict verdict,
                  String metricName,
                  long timeMs,
                  double value,
                  List<EstimatorResult> estimatorResults,
                  int votes,
                  double confidence,
                  AnomalySeverity severity,
                  AnomalyRecord record) {
    _verdict = verdict;
    _metricName = metricName;
    _timeMs = timeMs;
    _value = value;
    _estimatorResults = Collections.unmodifiableList(estimatorResults);
    _votes = votes;
    _confidence = confidence;
    _severity = severity;
    _record = record;
  }

  static DetectionResult insufficientData(String metricName, long timeMs, double value) {
    return new DetectionResult(DetectionVerdict.INSUFFICIENT_DATA, metricName, timeMs, value, Collections.emptyList(),
                               0, 0.0, null, null);
  }

  public DetectionVerdict verdict() {
    return _verdict;
  }

  /**
   * @return {@code true} if the verdict is {@link DetectionVerdict#ANOMALOUS}.
   */
  public boolean isAnomalous() {
    return _verdict == DetectionVerdict.ANOMALOUS;
  }

  public String metricName() {
    return _metricName;
  }

  /**
   * @return Time of the evaluated observation in milliseconds, -1 if there is no such observation.
   */
  public long timeMs() {
    return _timeMs;
  }

  /**
   * @return The evaluated value, NaN if there is no such observation.
   */
  public double value() {
    return _value;
  }

  /**
   * @return The result of each estimator in {@link com.linkedin.metricwatch.engine.detector.estimator.EstimatorType}
   * order, empty for insufficient data.
   */
  public List<EstimatorResult> estimatorResults() {
    return _estimatorResults;
  }

  public int votes() {
    return _votes;
  }

  public double confidence() {
    return _confidence;
  }

  /**
   * @return The severity derived from the confidence, or {@code null} for insufficient data.
   */
  public AnomalySeverity severity() {
    return _severity;
  }

  /**
   * @return The anomaly record if the observation is anomalous, {@code null} otherwise.
   */
  public AnomalyRecord record() {
    return _record;
  }

  @Override
  public String toString() {
    return String.format("{verdict=%s,metric=%s,votes=%d,confidence=%.3f,severity=%s,estimators=%s}", _verdict,
                         _metricName, _votes, _confidence, _severity, _estimatorResults);
  }
}
