/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast.model;

import com.linkedin.metricwatch.engine.config.MetricWatchConfig;
import com.linkedin.metricwatch.engine.config.constants.ForecastConfig;
import java.util.concurrent.TimeUnit;
import org.apache.commons.math3.distribution.NormalDistribution;


/**
 * The parameters shared by the forecasting models.
 */
public final class ForecastParameters {
  private final int _minSamples;
  private final double _z;
  private final double _alpha;
  private final double _beta;
  private final int _movingAverageWindow;
  private final long _seasonalPeriodMs;
  private final long _seasonalBucketMs;
  private final int _seasonalMinCycles;
  private final double _backtestFraction;

  /**
   * @param minSamples Minimum number of samples to fit a model.
   * @param confidenceLevel Two sided confidence level of the bands.
   * @param alpha Level smoothing factor.
   * @param beta Trend smoothing factor.
   * @param movingAverageWindow Number of trailing samples of the moving average.
   * @param seasonalPeriodMs Length of a seasonal cycle in milliseconds.
   * @param seasonalBucketMs Width of a seasonal phase bucket in milliseconds.
   * @param seasonalMinCycles Number of cycles the history must cover for a seasonal fit.
   * @param backtestFraction Fraction of the history held out to back-test the ensemble members.
   */
  public ForecastParameters(int minSamples,
                            double confidenceLevel,
                            double alpha,
                            double beta,
                            int movingAverageWindow,
                            long seasonalPeriodMs,
                            long seasonalBucketMs,
                            int seasonalMinCycles,
                            double backtestFraction) {
    _minSamples = minSamples;
    _z = new NormalDistribution().inverseCumulativeProbability(0.5 + confidenceLevel / 2.0);
    _alpha = alpha;
    _beta = beta;
    _movingAverageWindow = movingAverageWindow;
    _seasonalPeriodMs = seasonalPeriodMs;
    _seasonalBucketMs = seasonalBucketMs;
    _seasonalMinCycles = seasonalMinCycles;
    _backtestFraction = backtestFraction;
  }

  /**
   * @param config Metric Watch config.
   * @return The forecast parameters in the given config.
   */
  public static ForecastParameters fromConfig(MetricWatchConfig config) {
    return new ForecastParameters(config.getInt(ForecastConfig.MIN_SAMPLES_CONFIG),
                                  config.getDouble(ForecastConfig.CONFIDENCE_LEVEL_CONFIG),
                                  config.getDouble(ForecastConfig.SMOOTHING_ALPHA_CONFIG),
                                  config.getDouble(ForecastConfig.SMOOTHING_BETA_CONFIG),
                                  config.getInt(ForecastConfig.MOVING_AVERAGE_WINDOW_CONFIG),
                                  TimeUnit.HOURS.toMillis(config.getInt(ForecastConfig.SEASONAL_PERIOD_HOURS_CONFIG)),
                                  TimeUnit.MINUTES.toMillis(config.getInt(ForecastConfig.SEASONAL_BUCKET_MINUTES_CONFIG)),
                                  config.getInt(ForecastConfig.SEASONAL_MIN_CYCLES_CONFIG),
                                  config.getDouble(ForecastConfig.BACKTEST_FRACTION_CONFIG));
  }

  public int minSamples() {
    return _minSamples;
  }

  /**
   * @return The standard normal quantile of the confidence level, e.g. 1.96 for 95%.
   */
  public double z() {
    return _z;
  }

  public double alpha() {
    return _alpha;
  }

  public double beta() {
    return _beta;
  }

  public int movingAverageWindow() {
    return _movingAverageWindow;
  }

  public long seasonalPeriodMs() {
    return _seasonalPeriodMs;
  }

  public long seasonalBucketMs() {
    return _seasonalBucketMs;
  }

  public int seasonalMinCycles() {
    return _seasonalMinCycles;
  }

  public double backtestFraction() {
    return _backtestFraction;
  }
}
