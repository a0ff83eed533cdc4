/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast;

import com.linkedin.metricwatch.engine.config.MetricWatchConfig;
import com.linkedin.metricwatch.engine.config.constants.ForecastConfig;
import com.linkedin.metricwatch.engine.forecast.model.EnsembleForecaster;
import com.linkedin.metricwatch.engine.forecast.model.ExpSmoothingForecaster;
import com.linkedin.metricwatch.engine.forecast.model.FittedModel;
import com.linkedin.metricwatch.engine.forecast.model.ForecastParameters;
import com.linkedin.metricwatch.engine.forecast.model.ForecastUtils;
import com.linkedin.metricwatch.engine.forecast.model.Forecaster;
import com.linkedin.metricwatch.engine.forecast.model.LinearForecaster;
import com.linkedin.metricwatch.engine.forecast.model.MovingAverageForecaster;
import com.linkedin.metricwatch.engine.forecast.model.SeasonalForecaster;
import com.linkedin.metricwatch.exception.InsufficientHistoryException;
import com.linkedin.metricwatch.monitor.MetricStore;
import com.linkedin.metricwatch.monitor.sampling.MetricSample;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.metricwatch.common.utils.SeriesStatistics.isZero;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.range;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.stdDev;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.valuesOf;
import static com.linkedin.metricwatch.common.utils.Utils.validateNotNull;


/**
 * Forecasts the future values of a metric from its retained history. Models are fitted from scratch on each call,
 * so the engine holds no mutable state and can be used concurrently.
 * <p>
 * A forecast has one point per hour of the horizon, at offsets 1, 2, ..., H hours from the last observed sample.
 * The point at a given offset does not depend on the horizon, and the width of the confidence band never shrinks
 * along the horizon.
 */
public class ForecastEngine {
  private static final Logger LOG = LoggerFactory.getLogger(ForecastEngine.class);
  private static final LinearForecaster TREND_FORECASTER = new LinearForecaster();
  private static final Map<ForecastMethod, Forecaster> FORECASTERS;

  static {
    Map<ForecastMethod, Forecaster> members = new EnumMap<>(ForecastMethod.class);
    members.put(ForecastMethod.LINEAR, TREND_FORECASTER);
    members.put(ForecastMethod.EXP_SMOOTHING, new ExpSmoothingForecaster());
    members.put(ForecastMethod.MOVING_AVERAGE, new MovingAverageForecaster());
    members.put(ForecastMethod.SEASONAL, new SeasonalForecaster());
    Map<ForecastMethod, Forecaster> forecasters = new EnumMap<>(members);
    forecasters.put(ForecastMethod.ENSEMBLE, new EnsembleForecaster(members));
    FORECASTERS = Collections.unmodifiableMap(forecasters);
  }

  private final MetricStore _metricStore;
  private final ForecastParameters _parameters;
  private final int _defaultHorizonHours;
  private final double _trendStableThreshold;
  private final double _volatileRangeFraction;
  private final Clock _clock;

  public ForecastEngine(MetricWatchConfig config, MetricStore metricStore, Clock clock) {
    _metricStore = validateNotNull(metricStore, "Metric store cannot be null.");
    _clock = validateNotNull(clock, "Clock cannot be null.");
    _parameters = ForecastParameters.fromConfig(config);
    _defaultHorizonHours = config.getInt(ForecastConfig.DEFAULT_HORIZON_HOURS_CONFIG);
    _trendStableThreshold = config.getDouble(ForecastConfig.TREND_STABLE_THRESHOLD_CONFIG);
    _volatileRangeFraction = config.getDouble(ForecastConfig.VOLATILE_RANGE_FRACTION_CONFIG);
  }

  /**
   * Ensemble forecast of the given metric over the default horizon.
   *
   * @param metricName Name of the metric.
   * @return The forecast.
   * @throws InsufficientHistoryException if the metric has fewer retained samples than a forecast requires.
   */
  public ForecastResult forecast(String metricName) throws InsufficientHistoryException {
    return forecast(metricName, _defaultHorizonHours, ForecastMethod.ENSEMBLE);
  }

  /**
   * @param metricName Name of the metric.
   * @param horizon A named horizon.
   * @param method The forecasting method.
   * @return The forecast.
   * @throws InsufficientHistoryException if the metric has fewer retained samples than the method requires.
   */
  public ForecastResult forecast(String metricName, ForecastHorizon horizon, ForecastMethod method)
      throws InsufficientHistoryException {
    return forecast(metricName, validateNotNull(horizon, "Horizon cannot be null.").hours(), method);
  }

  /**
   * Forecast the given metric.
   *
   * @param metricName Name of the metric.
   * @param horizonHours Number of hours to forecast, between 1 and {@link ForecastConfig#MAX_HORIZON_HOURS}.
   * @param method The forecasting method.
   * @return The forecast.
   * @throws InsufficientHistoryException if the metric has fewer retained samples than the method requires, or the
   * seasonal method is requested for a history that does not cover enough cycles.
   */
  public ForecastResult forecast(String metricName, int horizonHours, ForecastMethod method)
      throws InsufficientHistoryException {
    validateNotNull(method, "Forecast method cannot be null.");
    if (horizonHours < 1 || horizonHours > ForecastConfig.MAX_HORIZON_HOURS) {
      throw new IllegalArgumentException(String.format("Forecast horizon %d is out of range [1, %d] hours.",
                                                       horizonHours, ForecastConfig.MAX_HORIZON_HOURS));
    }
    List<MetricSample> history = _metricStore.all(metricName);
    if (history.size() < _parameters.minSamples()) {
      throw new InsufficientHistoryException(metricName, history.size(), _parameters.minSamples());
    }

    FittedModel model = FORECASTERS.get(method).fit(history, _parameters);
    List<ForecastPoint> points = new ArrayList<>(horizonHours);
    double halfWidth = 0.0;
    for (int h = 1; h <= horizonHours; h++) {
      double predicted = model.predict(h);
      // Keep the band from narrowing further out.
      halfWidth = Math.max(halfWidth, model.halfWidth(h));
      points.add(new ForecastPoint(h, predicted, predicted - halfWidth, predicted + halfWidth));
    }

    LinearForecaster.LinearModel linearModel = model instanceof LinearForecaster.LinearModel
                                               ? (LinearForecaster.LinearModel) model
                                               : TREND_FORECASTER.fit(history, _parameters);
    Trend trend = classifyTrend(valuesOf(history), linearModel.slopePerHour(), points);
    Map<ForecastMethod, Double> weights;
    if (model instanceof EnsembleForecaster.EnsembleModel) {
      weights = ((EnsembleForecaster.EnsembleModel) model).weights();
    } else {
      weights = Collections.singletonMap(method, 1.0);
    }
    Double rSquared = method == ForecastMethod.LINEAR ? linearModel.rSquared() : null;
    ForecastResult result = new ForecastResult(metricName, _clock.millis(), ForecastUtils.originMs(history),
                                               horizonHours, method, points, trend, rSquared, weights);
    LOG.debug("Forecast of {}: {}", metricName, result);
    return result;
  }

  /**
   * Ensemble forecast of every tracked metric. Metrics without enough history are skipped.
   *
   * @param horizonHours Number of hours to forecast.
   * @return The forecast of each metric that could be forecast, by metric name.
   */
  public SortedMap<String, ForecastResult> forecastAll(int horizonHours) {
    SortedMap<String, ForecastResult> forecasts = new TreeMap<>();
    for (String metricName : _metricStore.metricNames()) {
      try {
        forecasts.put(metricName, forecast(metricName, horizonHours, ForecastMethod.ENSEMBLE));
      } catch (InsufficientHistoryException ihe) {
        LOG.debug("Skip forecasting {}: {}", metricName, ihe.getMessage());
      }
    }
    return forecasts;
  }

  /**
   * @return The horizon in hours used when the caller does not specify one.
   */
  public int defaultHorizonHours() {
    return _defaultHorizonHours;
  }

  /**
   * The trend is volatile if the final band is wide compared to the observed range. Otherwise it is judged by the
   * change the regression slope predicts over the horizon, relative to the standard deviation of the history.
   */
  Trend classifyTrend(double[] values, double slopePerHour, List<ForecastPoint> points) {
    double lastBandWidth = points.get(points.size() - 1).bandWidth();
    if (!isZero(lastBandWidth) && lastBandWidth > _volatileRangeFraction * range(values)) {
      return Trend.VOLATILE;
    }
    double stdDev = stdDev(values);
    if (isZero(stdDev)) {
      return Trend.STABLE;
    }
    double relativeChange = slopePerHour * points.size() / stdDev;
    if (Math.abs(relativeChange) < _trendStableThreshold) {
      return Trend.STABLE;
    } else {
      return relativeChange > 0 ? Trend.INCREASING : Trend.DECREASING;
    }
  }
}
