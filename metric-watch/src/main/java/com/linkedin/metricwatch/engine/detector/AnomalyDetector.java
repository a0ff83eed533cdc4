/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector;

import com.linkedin.metricwatch.engine.config.MetricWatchConfig;
import com.linkedin.metricwatch.engine.config.constants.AnomalyDetectorConfig;
import com.linkedin.metricwatch.engine.detector.estimator.Estimator;
import com.linkedin.metricwatch.engine.detector.estimator.EstimatorResult;
import com.linkedin.metricwatch.engine.detector.estimator.EstimatorType;
import com.linkedin.metricwatch.engine.detector.estimator.ExponentialSmoothingEstimator;
import com.linkedin.metricwatch.engine.detector.estimator.IqrEstimator;
import com.linkedin.metricwatch.engine.detector.estimator.MovingAverageEstimator;
import com.linkedin.metricwatch.engine.detector.estimator.SpikeEstimator;
import com.linkedin.metricwatch.engine.detector.estimator.TrendChangeEstimator;
import com.linkedin.metricwatch.engine.detector.estimator.ZScoreEstimator;
import com.linkedin.metricwatch.monitor.MetricStore;
import com.linkedin.metricwatch.monitor.sampling.MetricSample;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.metricwatch.MetricWatchUtils.ensureValidSample;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.valuesOf;
import static com.linkedin.metricwatch.common.utils.Utils.validateNotNull;


/**
 * Decides whether an observation of a metric is anomalous by a vote of six independent estimators, see
 * {@link EstimatorType}. Every estimator judges the observation against the retained samples observed before it.
 * <p>
 * The observation is anomalous if at least the quorum of estimators flags it. The confidence of the verdict is
 * {@code (votes / 6) * mean score of the flagging estimators}, and the severity is derived from the confidence.
 * <p>
 * The detector holds no mutable state. It reads a snapshot of the metric store on each call, so it can be used
 * concurrently for any number of metrics. It never records an anomaly itself, the caller decides whether to keep
 * the {@link AnomalyRecord} of an anomalous result in the {@link AnomalyLedger}.
 */
public class AnomalyDetector {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);
  public static final int NUM_ESTIMATORS = EstimatorType.cachedValues().size();
  private static final Map<EstimatorType, Estimator> ESTIMATORS;

  static {
    Map<EstimatorType, Estimator> estimators = new EnumMap<>(EstimatorType.class);
    for (Estimator estimator : Arrays.asList(new ZScoreEstimator(), new IqrEstimator(), new MovingAverageEstimator(),
                                             new ExponentialSmoothingEstimator(), new SpikeEstimator(),
                                             new TrendChangeEstimator())) {
      estimators.put(estimator.type(), estimator);
    }
    ESTIMATORS = Collections.unmodifiableMap(estimators);
  }

  private final MetricStore _metricStore;
  private final DetectionThresholds _thresholds;
  private final Sensitivity _sensitivity;
  private final int _minHistory;
  private final int _quorum;
  private final double _criticalThreshold;
  private final double _highThreshold;
  private final double _mediumThreshold;
  private final Clock _clock;

  public AnomalyDetector(MetricWatchConfig config, MetricStore metricStore, Clock clock) {
    _metricStore = validateNotNull(metricStore, "Metric store cannot be null.");
    _clock = validateNotNull(clock, "Clock cannot be null.");
    _thresholds = DetectionThresholds.fromConfig(config);
    _sensitivity = Sensitivity.forConfigName(config.getString(AnomalyDetectorConfig.SENSITIVITY_CONFIG));
    _minHistory = config.getInt(AnomalyDetectorConfig.MIN_HISTORY_CONFIG);
    _quorum = config.getInt(AnomalyDetectorConfig.QUORUM_CONFIG);
    _criticalThreshold = config.getDouble(AnomalyDetectorConfig.CRITICAL_SEVERITY_THRESHOLD_CONFIG);
    _highThreshold = config.getDouble(AnomalyDetectorConfig.HIGH_SEVERITY_THRESHOLD_CONFIG);
    _mediumThreshold = config.getDouble(AnomalyDetectorConfig.MEDIUM_SEVERITY_THRESHOLD_CONFIG);
  }

  /**
   * Evaluate the newest retained sample of the given metric against the samples before it, at the configured
   * sensitivity.
   *
   * @param metricName Name of the metric.
   * @return The detection result.
   */
  public DetectionResult evaluate(String metricName) {
    return evaluate(metricName, _sensitivity);
  }

  /**
   * Evaluate the newest retained sample of the given metric against the samples before it.
   *
   * @param metricName Name of the metric.
   * @param sensitivity Sensitivity of the detection.
   * @return The detection result.
   */
  public DetectionResult evaluate(String metricName, Sensitivity sensitivity) {
    List<MetricSample> samples = _metricStore.all(metricName);
    if (samples.size() < _minHistory) {
      MetricSample latest = samples.isEmpty() ? null : samples.get(samples.size() - 1);
      return insufficientData(metricName, samples.size(), latest == null ? -1L : latest.timeMs(),
                              latest == null ? Double.NaN : latest.value());
    }
    return evaluateSampleAt(samples, samples.size() - 1, sensitivity);
  }

  /**
   * Replay the evaluation of a retained sample of the given metric against the samples before it, at the configured
   * sensitivity. If several samples share the given time, the last one of them is evaluated.
   *
   * @param metricName Name of the metric.
   * @param timeMs Time of the sample to evaluate in milliseconds.
   * @return The detection result, insufficient data if no retained sample has the given time.
   */
  public DetectionResult evaluate(String metricName, long timeMs) {
    List<MetricSample> samples = _metricStore.all(metricName);
    if (samples.size() < _minHistory) {
      return insufficientData(metricName, samples.size(), timeMs, Double.NaN);
    }
    for (int i = samples.size() - 1; i >= 0; i--) {
      if (samples.get(i).timeMs() == timeMs) {
        return evaluateSampleAt(samples, i, _sensitivity);
      }
    }
    LOG.debug("No retained sample of {} at {} to evaluate.", metricName, timeMs);
    return DetectionResult.insufficientData(metricName, timeMs, Double.NaN);
  }

  /**
   * Evaluate a candidate value of the given metric against all retained samples without appending it, at the
   * configured sensitivity.
   *
   * @param metricName Name of the metric.
   * @param value The candidate value.
   * @return The detection result. The time of the result is the current time.
   */
  public DetectionResult evaluateValue(String metricName, double value) {
    return evaluateValue(metricName, value, _sensitivity);
  }

  /**
   * Evaluate a candidate value of the given metric against all retained samples without appending it.
   *
   * @param metricName Name of the metric.
   * @param value The candidate value.
   * @param sensitivity Sensitivity of the detection.
   * @return The detection result. The time of the result is the current time.
   */
  public DetectionResult evaluateValue(String metricName, double value, Sensitivity sensitivity) {
    ensureValidSample(metricName, value);
    long nowMs = _clock.millis();
    List<MetricSample> samples = _metricStore.all(metricName);
    if (samples.size() < _minHistory) {
      return insufficientData(metricName, samples.size(), nowMs, value);
    }
    return judge(metricName, nowMs, value, valuesOf(samples), sensitivity);
  }

  /**
   * @param confidence Confidence of the ensemble.
   * @return The severity for the given confidence.
   */
  public AnomalySeverity severityFor(double confidence) {
    if (confidence >= _criticalThreshold) {
      return AnomalySeverity.CRITICAL;
    } else if (confidence >= _highThreshold) {
      return AnomalySeverity.HIGH;
    } else if (confidence >= _mediumThreshold) {
      return AnomalySeverity.MEDIUM;
    }
    return AnomalySeverity.LOW;
  }

  private DetectionResult insufficientData(String metricName, int numSamples, long timeMs, double value) {
    LOG.debug("Metric {} has {} samples, at least {} are required for anomaly detection.", metricName, numSamples,
              _minHistory);
    return DetectionResult.insufficientData(metricName, timeMs, value);
  }

  private DetectionResult evaluateSampleAt(List<MetricSample> samples, int index, Sensitivity sensitivity) {
    MetricSample sample = samples.get(index);
    double[] reference = valuesOf(samples.subList(0, index));
    return judge(sample.metricName(), sample.timeMs(), sample.value(), reference, sensitivity);
  }

  private DetectionResult judge(String metricName, long timeMs, double value, double[] reference, Sensitivity sensitivity) {
    DetectionThresholds thresholds = _thresholds.scaledFor(sensitivity);
    List<EstimatorResult> results = new ArrayList<>(NUM_ESTIMATORS);
    Map<EstimatorType, Double> methodScores = new EnumMap<>(EstimatorType.class);
    int votes = 0;
    double flaggedScoreSum = 0.0;
    for (EstimatorType type : EstimatorType.cachedValues()) {
      EstimatorResult result = estimate(ESTIMATORS.get(type), reference, value, thresholds, metricName);
      LOG.trace("Estimator result of {} at {}: {}", metricName, timeMs, result);
      results.add(result);
      if (!result.abstained()) {
        methodScores.put(type, result.score());
      }
      if (result.flagged()) {
        votes++;
        flaggedScoreSum += result.score();
      }
    }

    double confidence = votes == 0 ? 0.0 : ((double) votes / NUM_ESTIMATORS) * (flaggedScoreSum / votes);
    confidence = Math.max(0.0, Math.min(1.0, confidence));
    AnomalySeverity severity = severityFor(confidence);
    DetectionResult detectionResult;
    if (votes >= _quorum) {
      AnomalyRecord record = new AnomalyRecord(UUID.randomUUID().toString(), metricName, timeMs, value, methodScores,
                                               votes, confidence, severity, _clock.millis());
      detectionResult = new DetectionResult(DetectionVerdict.ANOMALOUS, metricName, timeMs, value, results, votes,
                                            confidence, severity, record);
    } else {
      detectionResult = new DetectionResult(DetectionVerdict.NORMAL, metricName, timeMs, value, results, votes,
                                            confidence, severity, null);
    }
    LOG.debug("Evaluated {} = {} at {}: {}", metricName, value, timeMs, detectionResult);
    return detectionResult;
  }

  private static EstimatorResult estimate(Estimator estimator,
                                          double[] reference,
                                          double value,
                                          DetectionThresholds thresholds,
                                          String metricName) {
    try {
      return estimator.estimate(reference, value, thresholds);
    } catch (RuntimeException e) {
      LOG.warn("Estimator {} failed on metric {}, it abstains.", estimator.type(), metricName, e);
      return EstimatorResult.abstain(estimator.type());
    }
  }
}
