/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.linkedin.metricwatch.engine.capacity.BreachDirection;
import com.linkedin.metricwatch.engine.capacity.CapacityPlanner;
import com.linkedin.metricwatch.engine.capacity.CapacityPrediction;
import com.linkedin.metricwatch.engine.config.MetricWatchConfig;
import com.linkedin.metricwatch.engine.config.constants.InsightsConfig;
import com.linkedin.metricwatch.engine.config.constants.MetricStoreConfig;
import com.linkedin.metricwatch.engine.detector.AnomalyDetector;
import com.linkedin.metricwatch.engine.detector.AnomalyLedger;
import com.linkedin.metricwatch.engine.detector.DetectionResult;
import com.linkedin.metricwatch.engine.detector.Sensitivity;
import com.linkedin.metricwatch.engine.forecast.ForecastEngine;
import com.linkedin.metricwatch.engine.forecast.ForecastMethod;
import com.linkedin.metricwatch.engine.forecast.ForecastResult;
import com.linkedin.metricwatch.engine.insights.Insight;
import com.linkedin.metricwatch.engine.insights.InsightsGenerator;
import com.linkedin.metricwatch.exception.InsufficientHistoryException;
import com.linkedin.metricwatch.exception.InvalidSampleException;
import com.linkedin.metricwatch.exception.MetricWatchException;
import com.linkedin.metricwatch.monitor.LoadStatus;
import com.linkedin.metricwatch.monitor.MetricStore;
import com.linkedin.metricwatch.persisteddata.StateStore;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.SortedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.metricwatch.common.utils.Utils.validateNotNull;


/**
 * The entry point of Metric Watch. It wires the metric store, the anomaly detector and ledger, the forecast engine,
 * the capacity planner and the insights generator from a {@link MetricWatchConfig}, and reports its own activity to a
 * Dropwizard metric registry under the {@link #SENSOR} prefix.
 */
public class MetricWatchEngine {
  private static final Logger LOG = LoggerFactory.getLogger(MetricWatchEngine.class);
  public static final String SENSOR = "MetricWatch";
  private final MetricWatchConfig _config;
  private final Clock _clock;
  private final StateStore _stateStore;
  private final MetricStore _metricStore;
  private final AnomalyDetector _anomalyDetector;
  private final AnomalyLedger _anomalyLedger;
  private final ForecastEngine _forecastEngine;
  private final CapacityPlanner _capacityPlanner;
  private final InsightsGenerator _insightsGenerator;
  private final int _numRecentAnomalies;
  private final Meter _samplesAppended;
  private final Meter _samplesRejected;
  private final Meter _anomaliesRecorded;
  private final Timer _detectionTimer;
  private final Timer _forecastTimer;

  /**
   * Construct an engine that reports to a private metric registry and uses the system clock.
   *
   * @param config Metric Watch config.
   * @throws MetricWatchException if the configured state store cannot be instantiated.
   */
  public MetricWatchEngine(MetricWatchConfig config) throws MetricWatchException {
    this(config, new MetricRegistry(), Clock.systemUTC());
  }

  /**
   * @param config Metric Watch config.
   * @param dropwizardMetricRegistry The registry of the sensors of this engine.
   * @param clock The clock of detection results and anomaly lifecycle transitions.
   * @throws MetricWatchException if the configured state store cannot be instantiated.
   */
  public MetricWatchEngine(MetricWatchConfig config, MetricRegistry dropwizardMetricRegistry, Clock clock)
      throws MetricWatchException {
    _config = validateNotNull(config, "Config cannot be null.");
    _clock = validateNotNull(clock, "Clock cannot be null.");
    validateNotNull(dropwizardMetricRegistry, "Metric registry cannot be null.");
    _stateStore = config.getConfiguredInstance(MetricStoreConfig.STATE_STORE_CLASS_CONFIG, StateStore.class);
    _metricStore = new MetricStore(config.getInt(MetricStoreConfig.CAPACITY_PER_METRIC_CONFIG), _stateStore,
                                   config.getString(MetricStoreConfig.METRIC_STORE_DOCUMENT_NAME_CONFIG));
    _anomalyDetector = new AnomalyDetector(config, _metricStore, clock);
    _anomalyLedger = new AnomalyLedger(config, _stateStore, clock);
    _forecastEngine = new ForecastEngine(config, _metricStore, clock);
    _capacityPlanner = new CapacityPlanner(config, _forecastEngine, _metricStore);
    _insightsGenerator = new InsightsGenerator(config);
    _numRecentAnomalies = config.getInt(InsightsConfig.RECENT_ANOMALIES_CONFIG);

    _samplesAppended = dropwizardMetricRegistry.meter(MetricRegistry.name(SENSOR, "samples-appended"));
    _samplesRejected = dropwizardMetricRegistry.meter(MetricRegistry.name(SENSOR, "samples-rejected"));
    _anomaliesRecorded = dropwizardMetricRegistry.meter(MetricRegistry.name(SENSOR, "anomalies-recorded"));
    _detectionTimer = dropwizardMetricRegistry.timer(MetricRegistry.name(SENSOR, "detection-timer"));
    _forecastTimer = dropwizardMetricRegistry.timer(MetricRegistry.name(SENSOR, "forecast-timer"));
    dropwizardMetricRegistry.register(MetricRegistry.name(SENSOR, "tracked-metrics"),
                                      (Gauge<Integer>) () -> _metricStore.metricNames().size());
    dropwizardMetricRegistry.register(MetricRegistry.name(SENSOR, "open-anomalies"),
                                      (Gauge<Integer>) () -> _anomalyLedger.openAnomalies().size());
    config.logUnused();
  }

  /**
   * Record an observation of a metric.
   *
   * @param metricName Name of the metric.
   * @param timeMs Time of the observation in milliseconds.
   * @param value Observed value.
   * @return {@code true} if the observation is retained.
   * @throws InvalidSampleException if the metric name is blank or the value is not finite.
   */
  public boolean record(String metricName, long timeMs, double value) {
    try {
      boolean retained = _metricStore.append(metricName, timeMs, value);
      _samplesAppended.mark();
      return retained;
    } catch (InvalidSampleException ise) {
      _samplesRejected.mark();
      throw ise;
    }
  }

  /**
   * Evaluate the newest observation of the given metric. An anomalous observation is recorded in the ledger, once no
   * matter how often it is evaluated.
   *
   * @param metricName Name of the metric.
   * @return The detection result.
   */
  public DetectionResult detect(String metricName) {
    final Timer.Context ctx = _detectionTimer.time();
    try {
      return keep(_anomalyDetector.evaluate(metricName));
    } finally {
      ctx.stop();
    }
  }

  /**
   * Evaluate the newest observation of the given metric at the given sensitivity. An anomalous observation is
   * recorded in the ledger.
   *
   * @param metricName Name of the metric.
   * @param sensitivity Sensitivity of the detection.
   * @return The detection result.
   */
  public DetectionResult detect(String metricName, Sensitivity sensitivity) {
    final Timer.Context ctx = _detectionTimer.time();
    try {
      return keep(_anomalyDetector.evaluate(metricName, sensitivity));
    } finally {
      ctx.stop();
    }
  }

  /**
   * Evaluate a candidate value of the given metric without recording it as an observation. An anomalous value is
   * recorded in the ledger.
   *
   * @param metricName Name of the metric.
   * @param value The candidate value.
   * @return The detection result.
   */
  public DetectionResult detectValue(String metricName, double value) {
    final Timer.Context ctx = _detectionTimer.time();
    try {
      return keep(_anomalyDetector.evaluateValue(metricName, value));
    } finally {
      ctx.stop();
    }
  }

  private DetectionResult keep(DetectionResult result) {
    if (result.isAnomalous()) {
      if (_anomalyLedger.recordIfAbsent(result.record())) {
        _anomaliesRecorded.mark();
        LOG.info("Anomaly of {} detected: {}", result.metricName(), result.record());
      } else {
        LOG.debug("Anomaly of {} at {} is already in the ledger.", result.metricName(), result.timeMs());
      }
    }
    return result;
  }

  /**
   * @param metricName Name of the metric.
   * @param horizonHours Number of hours to forecast.
   * @param method The forecasting method.
   * @return The forecast.
   * @throws InsufficientHistoryException if the metric does not have enough history for the method.
   */
  public ForecastResult forecast(String metricName, int horizonHours, ForecastMethod method)
      throws InsufficientHistoryException {
    final Timer.Context ctx = _forecastTimer.time();
    try {
      return _forecastEngine.forecast(metricName, horizonHours, method);
    } finally {
      ctx.stop();
    }
  }

  /**
   * @param horizonHours Number of hours to forecast.
   * @return The ensemble forecast of every metric with enough history, by metric name.
   */
  public SortedMap<String, ForecastResult> forecastAll(int horizonHours) {
    final Timer.Context ctx = _forecastTimer.time();
    try {
      return _forecastEngine.forecastAll(horizonHours);
    } finally {
      ctx.stop();
    }
  }

  /**
   * @param metricName Name of the metric.
   * @param threshold The capacity threshold.
   * @param direction The side of the threshold that counts as a breach.
   * @param horizonHours The horizon in hours.
   * @return The capacity prediction.
   * @throws InsufficientHistoryException if the metric cannot be forecast.
   */
  public CapacityPrediction predictBreach(String metricName, double threshold, BreachDirection direction, int horizonHours)
      throws InsufficientHistoryException {
    return _capacityPlanner.predictBreach(metricName, threshold, direction, horizonHours);
  }

  /**
   * @return The predicted breaches of the configured capacity thresholds within the default capacity horizon.
   */
  public List<CapacityPrediction> predictConfiguredBreaches() {
    return _capacityPlanner.predictConfiguredBreaches();
  }

  /**
   * @return The insights drawn from the recent anomalies, the forecasts of every tracked metric and the predicted
   * breaches of the configured capacity thresholds.
   */
  public List<Insight> insights() {
    return _insightsGenerator.generate(_anomalyLedger.recent(_numRecentAnomalies),
                                       forecastAll(_forecastEngine.defaultHorizonHours()).values(),
                                       predictConfiguredBreaches(),
                                       _clock.millis());
  }

  /**
   * Persist both the metric history and the anomaly ledger.
   *
   * @throws IOException if the state store fails to write either of them.
   */
  public void persist() throws IOException {
    _metricStore.persist();
    _anomalyLedger.persist();
  }

  /**
   * Load the metric history and the anomaly ledger from the state store. Missing or corrupt state leaves the
   * respective component empty.
   *
   * @return {@code true} if both were loaded.
   */
  public boolean load() {
    LoadStatus historyStatus = _metricStore.load();
    LoadStatus ledgerStatus = _anomalyLedger.load();
    LOG.info("Loaded metric history: {}, anomaly ledger: {}.", historyStatus, ledgerStatus);
    return historyStatus == LoadStatus.LOADED && ledgerStatus == LoadStatus.LOADED;
  }

  public MetricWatchConfig config() {
    return _config;
  }

  public MetricStore metricStore() {
    return _metricStore;
  }

  public AnomalyDetector anomalyDetector() {
    return _anomalyDetector;
  }

  public AnomalyLedger anomalyLedger() {
    return _anomalyLedger;
  }

  public ForecastEngine forecastEngine() {
    return _forecastEngine;
  }

  public CapacityPlanner capacityPlanner() {
    return _capacityPlanner;
  }

  public StateStore stateStore() {
    return _stateStore;
  }
}
