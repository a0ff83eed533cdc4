/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.config.constants;

import com.linkedin.metricwatch.common.config.ConfigDef;
import com.linkedin.metricwatch.engine.detector.Sensitivity;

import static com.linkedin.metricwatch.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.metricwatch.common.config.ConfigDef.Range.between;
import static com.linkedin.metricwatch.common.config.ConfigDef.Range.nullOrBetween;


/**
 * A class to keep Metric Watch Anomaly Detector and Anomaly Ledger configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class AnomalyDetectorConfig {

  /**
   * <code>anomaly.detection.sensitivity</code>
   */
  public static final String SENSITIVITY_CONFIG = "anomaly.detection.sensitivity";
  public static final String DEFAULT_SENSITIVITY = Sensitivity.MEDIUM.configName();
  public static final String SENSITIVITY_DOC = "The sensitivity of the anomaly detector, one of low, medium or high. A "
      + "higher sensitivity lowers every estimator threshold, e.g. the z-score threshold is 3.5, 3 and 2.5 respectively.";

  /**
   * <code>anomaly.detection.min.history</code>
   */
  public static final String MIN_HISTORY_CONFIG = "anomaly.detection.min.history";
  public static final int DEFAULT_MIN_HISTORY = 10;
  public static final String MIN_HISTORY_DOC = "The minimum number of retained samples of a metric before the anomaly "
      + "detector gives a verdict. Metrics with a shorter history are reported as having insufficient data.";

  /**
   * <code>anomaly.detection.quorum</code>
   */
  public static final String QUORUM_CONFIG = "anomaly.detection.quorum";
  public static final int DEFAULT_QUORUM = 2;
  public static final String QUORUM_DOC = "The minimum number of estimators that must flag an observation for it to be "
      + "considered anomalous.";

  /**
   * <code>anomaly.detection.zscore.window</code>
   */
  public static final String ZSCORE_WINDOW_CONFIG = "anomaly.detection.zscore.window";
  public static final int DEFAULT_ZSCORE_WINDOW = 50;
  public static final String ZSCORE_WINDOW_DOC = "The number of trailing samples used by the z-score and the IQR "
      + "estimators.";

  /**
   * <code>anomaly.detection.zscore.threshold</code>
   */
  public static final String ZSCORE_THRESHOLD_CONFIG = "anomaly.detection.zscore.threshold";
  public static final double DEFAULT_ZSCORE_THRESHOLD = 3.0;
  public static final String ZSCORE_THRESHOLD_DOC = "The number of standard deviations from the trailing mean beyond "
      + "which the z-score estimator flags an observation at medium sensitivity.";

  /**
   * <code>anomaly.detection.iqr.multiplier</code>
   */
  public static final String IQR_MULTIPLIER_CONFIG = "anomaly.detection.iqr.multiplier";
  public static final double DEFAULT_IQR_MULTIPLIER = 1.5;
  public static final String IQR_MULTIPLIER_DOC = "The multiple of the interquartile range that places the fences of the "
      + "IQR estimator at medium sensitivity.";

  /**
   * <code>anomaly.detection.moving.average.window</code>
   */
  public static final String MOVING_AVERAGE_WINDOW_CONFIG = "anomaly.detection.moving.average.window";
  public static final int DEFAULT_MOVING_AVERAGE_WINDOW = 10;
  public static final String MOVING_AVERAGE_WINDOW_DOC = "The number of trailing samples of the moving average.";

  /**
   * <code>anomaly.detection.moving.average.deviation</code>
   */
  public static final String MOVING_AVERAGE_DEVIATION_CONFIG = "anomaly.detection.moving.average.deviation";
  public static final double DEFAULT_MOVING_AVERAGE_DEVIATION = 0.4;
  public static final String MOVING_AVERAGE_DEVIATION_DOC = "The relative deviation from the moving average beyond "
      + "which the moving average estimator flags an observation at medium sensitivity.";

  /**
   * <code>anomaly.detection.smoothing.alpha</code>
   */
  public static final String SMOOTHING_ALPHA_CONFIG = "anomaly.detection.smoothing.alpha";
  public static final double DEFAULT_SMOOTHING_ALPHA = 0.3;
  public static final String SMOOTHING_ALPHA_DOC = "The smoothing factor of the exponential smoothing estimator.";

  /**
   * <code>anomaly.detection.spike.threshold</code>
   */
  public static final String SPIKE_THRESHOLD_CONFIG = "anomaly.detection.spike.threshold";
  public static final Double DEFAULT_SPIKE_THRESHOLD = null;
  public static final String SPIKE_THRESHOLD_DOC = "The number of standard deviations of the first differences beyond "
      + "which the spike estimator flags a jump at medium sensitivity. Defaults to the z-score threshold if not set.";

  /**
   * <code>anomaly.detection.trend.window</code>
   */
  public static final String TREND_WINDOW_CONFIG = "anomaly.detection.trend.window";
  public static final int DEFAULT_TREND_WINDOW = 5;
  public static final String TREND_WINDOW_DOC = "The number of points of each of the two adjacent windows whose slopes "
      + "are compared by the trend change estimator.";

  /**
   * <code>anomaly.detection.trend.threshold</code>
   */
  public static final String TREND_THRESHOLD_CONFIG = "anomaly.detection.trend.threshold";
  public static final double DEFAULT_TREND_THRESHOLD = 1.0;
  public static final String TREND_THRESHOLD_DOC = "The change of slope per step, relative to the standard deviation "
      + "of the compared windows, beyond which the trend change estimator flags an observation at medium sensitivity.";

  /**
   * <code>anomaly.severity.critical.threshold</code>
   */
  public static final String CRITICAL_SEVERITY_THRESHOLD_CONFIG = "anomaly.severity.critical.threshold";
  public static final double DEFAULT_CRITICAL_SEVERITY_THRESHOLD = 0.8;
  public static final String CRITICAL_SEVERITY_THRESHOLD_DOC = "The minimum confidence of a critical anomaly.";

  /**
   * <code>anomaly.severity.high.threshold</code>
   */
  public static final String HIGH_SEVERITY_THRESHOLD_CONFIG = "anomaly.severity.high.threshold";
  public static final double DEFAULT_HIGH_SEVERITY_THRESHOLD = 0.6;
  public static final String HIGH_SEVERITY_THRESHOLD_DOC = "The minimum confidence of a high severity anomaly.";

  /**
   * <code>anomaly.severity.medium.threshold</code>
   */
  public static final String MEDIUM_SEVERITY_THRESHOLD_CONFIG = "anomaly.severity.medium.threshold";
  public static final double DEFAULT_MEDIUM_SEVERITY_THRESHOLD = 0.4;
  public static final String MEDIUM_SEVERITY_THRESHOLD_DOC = "The minimum confidence of a medium severity anomaly. "
      + "Anomalies with a lower confidence have low severity.";

  /**
   * <code>anomaly.ledger.retention</code>
   */
  public static final String LEDGER_RETENTION_CONFIG = "anomaly.ledger.retention";
  public static final int DEFAULT_LEDGER_RETENTION = 1000;
  public static final String LEDGER_RETENTION_DOC = "The maximum number of anomaly records kept by the anomaly ledger. "
      + "The oldest resolved records are evicted first.";

  /**
   * <code>anomaly.ledger.max.page.size</code>
   */
  public static final String LEDGER_MAX_PAGE_SIZE_CONFIG = "anomaly.ledger.max.page.size";
  public static final int DEFAULT_LEDGER_MAX_PAGE_SIZE = 100;
  public static final String LEDGER_MAX_PAGE_SIZE_DOC = "The maximum number of anomaly records returned by a single "
      + "listing of the anomaly ledger.";

  /**
   * <code>anomaly.ledger.document.name</code>
   */
  public static final String LEDGER_DOCUMENT_NAME_CONFIG = "anomaly.ledger.document.name";
  public static final String DEFAULT_LEDGER_DOCUMENT_NAME = "anomalies.json";
  public static final String LEDGER_DOCUMENT_NAME_DOC = "The name of the document that keeps the persisted anomaly "
      + "ledger in the state store.";

  private AnomalyDetectorConfig() {
  }

  /**
   * Define configs for Anomaly Detector.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for Anomaly Detector.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(SENSITIVITY_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_SENSITIVITY,
                            ConfigDef.ValidString.in(Sensitivity.configNames()),
                            ConfigDef.Importance.HIGH,
                            SENSITIVITY_DOC)
                    .define(MIN_HISTORY_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MIN_HISTORY,
                            atLeast(3),
                            ConfigDef.Importance.MEDIUM,
                            MIN_HISTORY_DOC)
                    .define(QUORUM_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_QUORUM,
                            between(1, 6),
                            ConfigDef.Importance.HIGH,
                            QUORUM_DOC)
                    .define(ZSCORE_WINDOW_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ZSCORE_WINDOW,
                            atLeast(2),
                            ConfigDef.Importance.MEDIUM,
                            ZSCORE_WINDOW_DOC)
                    .define(ZSCORE_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_ZSCORE_THRESHOLD,
                            between(0.1, 100.0),
                            ConfigDef.Importance.MEDIUM,
                            ZSCORE_THRESHOLD_DOC)
                    .define(IQR_MULTIPLIER_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_IQR_MULTIPLIER,
                            between(0.1, 100.0),
                            ConfigDef.Importance.MEDIUM,
                            IQR_MULTIPLIER_DOC)
                    .define(MOVING_AVERAGE_WINDOW_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MOVING_AVERAGE_WINDOW,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            MOVING_AVERAGE_WINDOW_DOC)
                    .define(MOVING_AVERAGE_DEVIATION_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_MOVING_AVERAGE_DEVIATION,
                            between(0.01, 100.0),
                            ConfigDef.Importance.MEDIUM,
                            MOVING_AVERAGE_DEVIATION_DOC)
                    .define(SMOOTHING_ALPHA_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_SMOOTHING_ALPHA,
                            between(0.01, 1.0),
                            ConfigDef.Importance.LOW,
                            SMOOTHING_ALPHA_DOC)
                    .define(SPIKE_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_SPIKE_THRESHOLD,
                            nullOrBetween(0.1, 100.0),
                            ConfigDef.Importance.LOW,
                            SPIKE_THRESHOLD_DOC)
                    .define(TREND_WINDOW_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_TREND_WINDOW,
                            atLeast(2),
                            ConfigDef.Importance.LOW,
                            TREND_WINDOW_DOC)
                    .define(TREND_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_TREND_THRESHOLD,
                            between(0.01, 100.0),
                            ConfigDef.Importance.LOW,
                            TREND_THRESHOLD_DOC)
                    .define(CRITICAL_SEVERITY_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_CRITICAL_SEVERITY_THRESHOLD,
                            between(0.0, 1.0),
                            ConfigDef.Importance.LOW,
                            CRITICAL_SEVERITY_THRESHOLD_DOC)
                    .define(HIGH_SEVERITY_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_HIGH_SEVERITY_THRESHOLD,
                            between(0.0, 1.0),
                            ConfigDef.Importance.LOW,
                            HIGH_SEVERITY_THRESHOLD_DOC)
                    .define(MEDIUM_SEVERITY_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_MEDIUM_SEVERITY_THRESHOLD,
                            between(0.0, 1.0),
                            ConfigDef.Importance.LOW,
                            MEDIUM_SEVERITY_THRESHOLD_DOC)
                    .define(LEDGER_RETENTION_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_LEDGER_RETENTION,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            LEDGER_RETENTION_DOC)
                    .define(LEDGER_MAX_PAGE_SIZE_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_LEDGER_MAX_PAGE_SIZE,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            LEDGER_MAX_PAGE_SIZE_DOC)
                    .define(LEDGER_DOCUMENT_NAME_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_LEDGER_DOCUMENT_NAME,
                            ConfigDef.Importance.LOW,
                            LEDGER_DOCUMENT_NAME_DOC);
  }
}
