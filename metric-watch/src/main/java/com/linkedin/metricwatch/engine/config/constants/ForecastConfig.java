/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.config.constants;

import com.linkedin.metricwatch.common.config.ConfigDef;

import static com.linkedin.metricwatch.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.metricwatch.common.config.ConfigDef.Range.between;


/**
 * A class to keep Metric Watch Forecast Engine configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class ForecastConfig {
  public static final int MAX_HORIZON_HOURS = 720;

  /**
   * <code>forecast.min.samples</code>
   */
  public static final String MIN_SAMPLES_CONFIG = "forecast.min.samples";
  public static final int DEFAULT_MIN_SAMPLES = 5;
  public static final String MIN_SAMPLES_DOC = "The minimum number of retained samples of a metric to forecast it. "
      + "Forecasting a metric with a shorter history fails with an insufficient history error.";

  /**
   * <code>forecast.default.horizon.hours</code>
   */
  public static final String DEFAULT_HORIZON_HOURS_CONFIG = "forecast.default.horizon.hours";
  public static final int DEFAULT_DEFAULT_HORIZON_HOURS = 24;
  public static final String DEFAULT_HORIZON_HOURS_DOC = "The forecast horizon in hours used when the caller does not "
      + "request one, e.g. for the forecasts summarized by the insights.";

  /**
   * <code>forecast.confidence.level</code>
   */
  public static final String CONFIDENCE_LEVEL_CONFIG = "forecast.confidence.level";
  public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;
  public static final String CONFIDENCE_LEVEL_DOC = "The two sided confidence level of the forecast bands.";

  /**
   * <code>forecast.smoothing.alpha</code>
   */
  public static final String SMOOTHING_ALPHA_CONFIG = "forecast.smoothing.alpha";
  public static final double DEFAULT_SMOOTHING_ALPHA = 0.3;
  public static final String SMOOTHING_ALPHA_DOC = "The level smoothing factor of the exponential smoothing forecast.";

  /**
   * <code>forecast.smoothing.beta</code>
   */
  public static final String SMOOTHING_BETA_CONFIG = "forecast.smoothing.beta";
  public static final double DEFAULT_SMOOTHING_BETA = 0.1;
  public static final String SMOOTHING_BETA_DOC = "The trend smoothing factor of the exponential smoothing forecast.";

  /**
   * <code>forecast.moving.average.window</code>
   */
  public static final String MOVING_AVERAGE_WINDOW_CONFIG = "forecast.moving.average.window";
  public static final int DEFAULT_MOVING_AVERAGE_WINDOW = 24;
  public static final String MOVING_AVERAGE_WINDOW_DOC = "The number of trailing samples averaged by the moving "
      + "average forecast.";

  /**
   * <code>forecast.seasonal.period.hours</code>
   */
  public static final String SEASONAL_PERIOD_HOURS_CONFIG = "forecast.seasonal.period.hours";
  public static final int DEFAULT_SEASONAL_PERIOD_HOURS = 24;
  public static final String SEASONAL_PERIOD_HOURS_DOC = "The length of the cycle of the seasonal forecast in hours.";

  /**
   * <code>forecast.seasonal.bucket.minutes</code>
   */
  public static final String SEASONAL_BUCKET_MINUTES_CONFIG = "forecast.seasonal.bucket.minutes";
  public static final int DEFAULT_SEASONAL_BUCKET_MINUTES = 60;
  public static final String SEASONAL_BUCKET_MINUTES_DOC = "The width of a phase bucket of the seasonal forecast in "
      + "minutes. The seasonal period must be a multiple of it.";

  /**
   * <code>forecast.seasonal.min.cycles</code>
   */
  public static final String SEASONAL_MIN_CYCLES_CONFIG = "forecast.seasonal.min.cycles";
  public static final int DEFAULT_SEASONAL_MIN_CYCLES = 2;
  public static final String SEASONAL_MIN_CYCLES_DOC = "The number of full cycles the history must cover for the "
      + "seasonal forecast to be computed.";

  /**
   * <code>forecast.backtest.fraction</code>
   */
  public static final String BACKTEST_FRACTION_CONFIG = "forecast.backtest.fraction";
  public static final double DEFAULT_BACKTEST_FRACTION = 0.2;
  public static final String BACKTEST_FRACTION_DOC = "The fraction of the most recent samples held out to back-test "
      + "each method when weighting the ensemble forecast.";

  /**
   * <code>forecast.trend.stable.threshold</code>
   */
  public static final String TREND_STABLE_THRESHOLD_CONFIG = "forecast.trend.stable.threshold";
  public static final double DEFAULT_TREND_STABLE_THRESHOLD = 0.5;
  public static final String TREND_STABLE_THRESHOLD_DOC = "The trend is stable if the change the regression slope "
      + "predicts over the horizon is smaller than this many standard deviations of the history.";

  /**
   * <code>forecast.volatile.range.fraction</code>
   */
  public static final String VOLATILE_RANGE_FRACTION_CONFIG = "forecast.volatile.range.fraction";
  public static final double DEFAULT_VOLATILE_RANGE_FRACTION = 1.5;
  public static final String VOLATILE_RANGE_FRACTION_DOC = "The trend is volatile if the width of the confidence band "
      + "at the end of the horizon exceeds this multiple of the observed range of the history.";

  private ForecastConfig() {
  }

  /**
   * Define configs for Forecast Engine.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for Forecast Engine.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(MIN_SAMPLES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MIN_SAMPLES,
                            atLeast(3),
                            ConfigDef.Importance.MEDIUM,
                            MIN_SAMPLES_DOC)
                    .define(DEFAULT_HORIZON_HOURS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_DEFAULT_HORIZON_HOURS,
                            between(1, MAX_HORIZON_HOURS),
                            ConfigDef.Importance.MEDIUM,
                            DEFAULT_HORIZON_HOURS_DOC)
                    .define(CONFIDENCE_LEVEL_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_CONFIDENCE_LEVEL,
                            between(0.5, 0.999),
                            ConfigDef.Importance.MEDIUM,
                            CONFIDENCE_LEVEL_DOC)
                    .define(SMOOTHING_ALPHA_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_SMOOTHING_ALPHA,
                            between(0.01, 1.0),
                            ConfigDef.Importance.LOW,
                            SMOOTHING_ALPHA_DOC)
                    .define(SMOOTHING_BETA_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_SMOOTHING_BETA,
                            between(0.0, 1.0),
                            ConfigDef.Importance.LOW,
                            SMOOTHING_BETA_DOC)
                    .define(MOVING_AVERAGE_WINDOW_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MOVING_AVERAGE_WINDOW,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            MOVING_AVERAGE_WINDOW_DOC)
                    .define(SEASONAL_PERIOD_HOURS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_SEASONAL_PERIOD_HOURS,
                            between(1, MAX_HORIZON_HOURS),
                            ConfigDef.Importance.LOW,
                            SEASONAL_PERIOD_HOURS_DOC)
                    .define(SEASONAL_BUCKET_MINUTES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_SEASONAL_BUCKET_MINUTES,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            SEASONAL_BUCKET_MINUTES_DOC)
                    .define(SEASONAL_MIN_CYCLES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_SEASONAL_MIN_CYCLES,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            SEASONAL_MIN_CYCLES_DOC)
                    .define(BACKTEST_FRACTION_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_BACKTEST_FRACTION,
                            between(0.05, 0.5),
                            ConfigDef.Importance.LOW,
                            BACKTEST_FRACTION_DOC)
                    .define(TREND_STABLE_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_TREND_STABLE_THRESHOLD,
                            atLeast(0.0),
                            ConfigDef.Importance.LOW,
                            TREND_STABLE_THRESHOLD_DOC)
                    .define(VOLATILE_RANGE_FRACTION_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_VOLATILE_RANGE_FRACTION,
                            atLeast(0.0),
                            ConfigDef.Importance.LOW,
                            VOLATILE_RANGE_FRACTION_DOC);
  }
}
