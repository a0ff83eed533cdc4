/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector;

import com.linkedin.metricwatch.engine.detector.estimator.EstimatorType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static com.linkedin.metricwatch.MetricWatchUtils.utcDateFor;
import static com.linkedin.metricwatch.common.utils.Utils.validateNotNull;


/**
 * An observation that the anomaly detection ensemble considered anomalous, together with its lifecycle state.
 * <p>
 * Instances are immutable. A lifecycle transition returns a new instance, see {@link #acknowledged(long)} and
 * {@link #resolved(String, long)}.
 */
public final class AnomalyRecord {
  private final String _id;
  private final String _metricName;
  private final long _timeMs;
  private final double _observedValue;
  private final Map<EstimatorType, Double> _methodScores;
  private final int _votes;
  private final double _confidence;
  private final AnomalySeverity _severity;
  private final AnomalyStatus _status;
  private final String _resolutionNotes;
  private final long _createdAtMs;
  private final Long _acknowledgedAtMs;
  private final Long _resolvedAtMs;

  /**
   * Construct a new anomaly record.
   *
   * @param id Unique id of the record.
   * @param metricName Name of the metric.
   * @param timeMs Time of the anomalous observation in milliseconds.
   * @param observedValue The anomalous value.
   * @param methodScores The score of each estimator that voted.
   * @param votes Number of estimators that flagged the observation.
   * @param confidence Confidence of the ensemble.
   * @param severity Severity derived from the confidence.
   * @param createdAtMs Creation time of the record in milliseconds.
   */
  public AnomalyRecord(String id,
                       String metricName,
                       long timeMs,
                       double observedValue,
                       Map<EstimatorType, Double> methodScores,
                       int votes,
                       double confidence,
                       AnomalySeverity severity,
                       long createdAtMs) {
    this(id, metricName, timeMs, observedValue, methodScores, votes, confidence, severity, AnomalyStatus.NEW, null,
         createdAtMs, null, null);
  }

  /**
   * Construct an anomaly record in any lifecycle state, e.g. when it is loaded from persisted state.
   */
  public AnomalyRecord(String id,
                       String metricName,
                       long timeMs,
                       double observedValue,
                       Map<EstimatorType, Double> methodScores,
                       int votes,
                       double confidence,
                       AnomalySeverity severity,
                       AnomalyStatus status,
                       String resolutionNotes,
                       long createdAtMs,
                       Long acknowledgedAtMs,
                       Long resolvedAtMs) {
    _id = validateNotNull(id, "Anomaly id cannot be null.");
    _metricName = validateNotNull(metricName, "Metric name cannot be null.");
    _timeMs = timeMs;
    _observedValue = observedValue;
    Map<EstimatorType, Double> scores = new EnumMap<>(EstimatorType.class);
    scores.putAll(validateNotNull(methodScores, "Method scores cannot be null."));
    _methodScores = Collections.unmodifiableMap(scores);
    _votes = votes;
    _confidence = confidence;
    _severity = validateNotNull(severity, "Severity cannot be null.");
    _status = validateNotNull(status, "Status cannot be null.");
    _resolutionNotes = resolutionNotes;
    _createdAtMs = createdAtMs;
    _acknowledgedAtMs = acknowledgedAtMs;
    _resolvedAtMs = resolvedAtMs;
  }

  /**
   * @param nowMs Time of the acknowledgement in milliseconds.
   * @return A copy of this record in {@link AnomalyStatus#ACKNOWLEDGED} state.
   * @throws IllegalStateException if this record cannot be acknowledged.
   */
  public AnomalyRecord acknowledged(long nowMs) {
    ensureTransition(AnomalyStatus.ACKNOWLEDGED);
    return new AnomalyRecord(_id, _metricName, _timeMs, _observedValue, _methodScores, _votes, _confidence, _severity,
                             AnomalyStatus.ACKNOWLEDGED, null, _createdAtMs, nowMs, null);
  }

  /**
   * @param notes Optional free text resolution notes.
   * @param nowMs Time of the resolution in milliseconds.
   * @return A copy of this record in {@link AnomalyStatus#RESOLVED} state.
   * @throws IllegalStateException if this record cannot be resolved.
   */
  public AnomalyRecord resolved(String notes, long nowMs) {
    ensureTransition(AnomalyStatus.RESOLVED);
    return new AnomalyRecord(_id, _metricName, _timeMs, _observedValue, _methodScores, _votes, _confidence, _severity,
                             AnomalyStatus.RESOLVED, notes, _createdAtMs, _acknowledgedAtMs, nowMs);
  }

  private void ensureTransition(AnomalyStatus target) {
    if (!_status.canTransitionTo(target)) {
      throw new IllegalStateException(String.format("Anomaly %s cannot transition from %s to %s.", _id, _status, target));
    }
  }

  public String id() {
    return _id;
  }

  public String metricName() {
    return _metricName;
  }

  /**
   * @return Time of the anomalous observation in milliseconds.
   */
  public long timeMs() {
    return _timeMs;
  }

  public double observedValue() {
    return _observedValue;
  }

  /**
   * @return The score in [0, 1] of each estimator that did not abstain.
   */
  public Map<EstimatorType, Double> methodScores() {
    return _methodScores;
  }

  public int votes() {
    return _votes;
  }

  public double confidence() {
    return _confidence;
  }

  public AnomalySeverity severity() {
    return _severity;
  }

  public AnomalyStatus status() {
    return _status;
  }

  /**
   * @return {@code true} if this anomaly is not resolved yet.
   */
  public boolean isOpen() {
    return _status != AnomalyStatus.RESOLVED;
  }

  /**
   * @return Resolution notes, or {@code null} if none were given.
   */
  public String resolutionNotes() {
    return _resolutionNotes;
  }

  public long createdAtMs() {
    return _createdAtMs;
  }

  /**
   * @return Acknowledgement time in milliseconds, or {@code null} if the anomaly was never acknowledged.
   */
  public Long acknowledgedAtMs() {
    return _acknowledgedAtMs;
  }

  /**
   * @return Resolution time in milliseconds, or {@code null} if the anomaly is not resolved.
   */
  public Long resolvedAtMs() {
    return _resolvedAtMs;
  }

  @Override
  public String toString() {
    return String.format("{id=%s,metric=%s,time=%s,value=%f,votes=%d,confidence=%.3f,severity=%s,status=%s}", _id,
                         _metricName, utcDateFor(_timeMs), _observedValue, _votes, _confidence, _severity, _status);
  }
}
