/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector;

import com.linkedin.metricwatch.engine.config.MetricWatchConfig;
import com.linkedin.metricwatch.engine.config.constants.AnomalyDetectorConfig;


/**
 * The parameters of the estimators. The thresholds of an instance are the ones at {@link Sensitivity#MEDIUM}, use
 * {@link #scaledFor(Sensitivity)} to get the thresholds at another sensitivity.
 */
public final class DetectionThresholds {
  private final int _zScoreWindow;
  private final double _zScoreThreshold;
  private final double _iqrMultiplier;
  private final int _movingAverageWindow;
  private final double _movingAverageDeviation;
  private final double _smoothingAlpha;
  private final double _spikeThreshold;
  private final int _trendWindow;
  private final double _trendThreshold;

  public DetectionThresholds(int zScoreWindow,
                             double zScoreThreshold,
                             double iqrMultiplier,
                             int movingAverageWindow,
                             double movingAverageDeviation,
                             double smoothingAlpha,
                             double spikeThreshold,
                             int trendWindow,
                             double trendThreshold) {
    _zScoreWindow = zScoreWindow;
    _zScoreThreshold = zScoreThreshold;
    _iqrMultiplier = iqrMultiplier;
    _movingAverageWindow = movingAverageWindow;
    _movingAverageDeviation = movingAverageDeviation;
    _smoothingAlpha = smoothingAlpha;
    _spikeThreshold = spikeThreshold;
    _trendWindow = trendWindow;
    _trendThreshold = trendThreshold;
  }

  /**
   * @return The thresholds with the default values of every config.
   */
  public static DetectionThresholds defaults() {
    return new DetectionThresholds(AnomalyDetectorConfig.DEFAULT_ZSCORE_WINDOW,
                                   AnomalyDetectorConfig.DEFAULT_ZSCORE_THRESHOLD,
                                   AnomalyDetectorConfig.DEFAULT_IQR_MULTIPLIER,
                                   AnomalyDetectorConfig.DEFAULT_MOVING_AVERAGE_WINDOW,
                                   AnomalyDetectorConfig.DEFAULT_MOVING_AVERAGE_DEVIATION,
                                   AnomalyDetectorConfig.DEFAULT_SMOOTHING_ALPHA,
                                   AnomalyDetectorConfig.DEFAULT_ZSCORE_THRESHOLD,
                                   AnomalyDetectorConfig.DEFAULT_TREND_WINDOW,
                                   AnomalyDetectorConfig.DEFAULT_TREND_THRESHOLD);
  }

  /**
   * @param config Metric Watch config.
   * @return The thresholds in the given config. The spike threshold falls back to the z-score threshold.
   */
  public static DetectionThresholds fromConfig(MetricWatchConfig config) {
    double zScoreThreshold = config.getDouble(AnomalyDetectorConfig.ZSCORE_THRESHOLD_CONFIG);
    Double spikeThreshold = config.getDouble(AnomalyDetectorConfig.SPIKE_THRESHOLD_CONFIG);
    return new DetectionThresholds(config.getInt(AnomalyDetectorConfig.ZSCORE_WINDOW_CONFIG),
                                   zScoreThreshold,
                                   config.getDouble(AnomalyDetectorConfig.IQR_MULTIPLIER_CONFIG),
                                   config.getInt(AnomalyDetectorConfig.MOVING_AVERAGE_WINDOW_CONFIG),
                                   config.getDouble(AnomalyDetectorConfig.MOVING_AVERAGE_DEVIATION_CONFIG),
                                   config.getDouble(AnomalyDetectorConfig.SMOOTHING_ALPHA_CONFIG),
                                   spikeThreshold == null ? zScoreThreshold : spikeThreshold,
                                   config.getInt(AnomalyDetectorConfig.TREND_WINDOW_CONFIG),
                                   config.getDouble(AnomalyDetectorConfig.TREND_THRESHOLD_CONFIG));
  }

  /**
   * @param sensitivity The sensitivity.
   * @return The thresholds at the given sensitivity. Window sizes and the smoothing factor are not affected.
   */
  public DetectionThresholds scaledFor(Sensitivity sensitivity) {
    double scale = sensitivity.thresholdScale();
    return new DetectionThresholds(_zScoreWindow,
                                   _zScoreThreshold * scale,
                                   _iqrMultiplier * scale,
                                   _movingAverageWindow,
                                   _movingAverageDeviation * scale,
                                   _smoothingAlpha,
                                   _spikeThreshold * scale,
                                   _trendWindow,
                                   _trendThreshold * scale);
  }

  public int zScoreWindow() {
    return _zScoreWindow;
  }

  public double zScoreThreshold() {
    return _zScoreThreshold;
  }

  public double iqrMultiplier() {
    return _iqrMultiplier;
  }

  public int movingAverageWindow() {
    return _movingAverageWindow;
  }

  public double movingAverageDeviation() {
    return _movingAverageDeviation;
  }

  public double smoothingAlpha() {
    return _smoothingAlpha;
  }

  public double spikeThreshold() {
    return _spikeThreshold;
  }

  public int trendWindow() {
    return _trendWindow;
  }

  public double trendThreshold() {
    return _trendThreshold;
  }

  @Override
  public String toString() {
    return String.format("{zScoreWindow=%d,zScoreThreshold=%.3f,iqrMultiplier=%.3f,movingAverageWindow=%d,"
                         + "movingAverageDeviation=%.3f,smoothingAlpha=%.3f,spikeThreshold=%.3f,trendWindow=%d,"
                         + "trendThreshold=%.3f}", _zScoreWindow, _zScoreThreshold, _iqrMultiplier, _movingAverageWindow,
                         _movingAverageDeviation, _smoothingAlpha, _spikeThreshold, _trendWindow, _trendThreshold);
  }
}
