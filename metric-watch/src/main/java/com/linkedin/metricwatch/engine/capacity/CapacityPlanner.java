/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.capacity;

import com.linkedin.metricwatch.engine.config.MetricWatchConfig;
import com.linkedin.metricwatch.engine.config.constants.CapacityPlannerConfig;
import com.linkedin.metricwatch.engine.forecast.ForecastEngine;
import com.linkedin.metricwatch.engine.forecast.ForecastMethod;
import com.linkedin.metricwatch.engine.forecast.ForecastPoint;
import com.linkedin.metricwatch.engine.forecast.ForecastResult;
import com.linkedin.metricwatch.exception.InsufficientHistoryException;
import com.linkedin.metricwatch.monitor.MetricStore;
import com.linkedin.metricwatch.monitor.sampling.MetricSample;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.metricwatch.MetricWatchUtils.hoursToMs;
import static com.linkedin.metricwatch.common.utils.Utils.validateNotNull;


/**
 * Predicts when a metric breaches a capacity threshold from its ensemble forecast.
 * <p>
 * The planner walks the forecast points starting from the last observed value and reports the first crossing of the
 * threshold, linearly interpolated between the two points around it. Since a forecast point does not depend on the
 * horizon, a breach predicted within a horizon is predicted at the same time within any longer horizon.
 */
public class CapacityPlanner {
  private static final Logger LOG = LoggerFactory.getLogger(CapacityPlanner.class);
  private final ForecastEngine _forecastEngine;
  private final MetricStore _metricStore;
  private final List<CapacityThreshold> _thresholds;
  private final int _defaultHorizonHours;
  private final double _criticalUrgencyHours;
  private final double _highUrgencyHours;
  private final double _mediumUrgencyHours;

  public CapacityPlanner(MetricWatchConfig config, ForecastEngine forecastEngine, MetricStore metricStore) {
    _forecastEngine = validateNotNull(forecastEngine, "Forecast engine cannot be null.");
    _metricStore = validateNotNull(metricStore, "Metric store cannot be null.");
    List<CapacityThreshold> thresholds = new ArrayList<>();
    for (String threshold : config.getList(CapacityPlannerConfig.CAPACITY_THRESHOLDS_CONFIG)) {
      thresholds.add(CapacityThreshold.parse(threshold));
    }
    _thresholds = Collections.unmodifiableList(thresholds);
    _defaultHorizonHours = config.getInt(CapacityPlannerConfig.DEFAULT_HORIZON_HOURS_CONFIG);
    _criticalUrgencyHours = config.getDouble(CapacityPlannerConfig.CRITICAL_URGENCY_HOURS_CONFIG);
    _highUrgencyHours = config.getDouble(CapacityPlannerConfig.HIGH_URGENCY_HOURS_CONFIG);
    _mediumUrgencyHours = config.getDouble(CapacityPlannerConfig.MEDIUM_URGENCY_HOURS_CONFIG);
  }

  /**
   * Predict whether the given metric breaches the given threshold within the horizon.
   *
   * @param metricName Name of the metric.
   * @param threshold The capacity threshold.
   * @param direction The side of the threshold that counts as a breach.
   * @param horizonHours The horizon in hours.
   * @return The prediction. If the last observed value already breaches the threshold, the breach is at the time of
   * that value.
   * @throws InsufficientHistoryException if the metric cannot be forecast.
   */
  public CapacityPrediction predictBreach(String metricName, double threshold, BreachDirection direction, int horizonHours)
      throws InsufficientHistoryException {
    validateNotNull(direction, "Breach direction cannot be null.");
    ForecastResult forecast = _forecastEngine.forecast(metricName, horizonHours, ForecastMethod.ENSEMBLE);
    MetricSample latest = _metricStore.latest(metricName);
    double currentValue = latest == null ? forecast.points().get(0).predictedValue() : latest.value();

    Double hoursToBreach = null;
    if (direction.isBreached(currentValue, threshold)) {
      hoursToBreach = 0.0;
    } else {
      double previousOffset = 0.0;
      double previousValue = currentValue;
      for (ForecastPoint point : forecast.points()) {
        double value = point.predictedValue();
        if (direction.isBreached(value, threshold)) {
          double fraction = (threshold - previousValue) / (value - previousValue);
          hoursToBreach = previousOffset + fraction * (point.offsetHours() - previousOffset);
          break;
        }
        previousOffset = point.offsetHours();
        previousValue = value;
      }
    }

    CapacityPrediction prediction;
    if (hoursToBreach == null) {
      prediction = new CapacityPrediction(metricName, threshold, direction, currentValue, null, null, Urgency.NONE,
                                          String.format("No breach of %s %s %s predicted within %d hours.", metricName,
                                                        direction.configName(), threshold, horizonHours),
                                          horizonHours);
    } else {
      Urgency urgency = urgencyFor(hoursToBreach);
      prediction = new CapacityPrediction(metricName, threshold, direction, currentValue,
                                          forecast.originMs() + hoursToMs(hoursToBreach), hoursToBreach, urgency,
                                          recommendation(metricName, threshold, direction, hoursToBreach, urgency),
                                          horizonHours);
    }
    LOG.debug("Capacity prediction of {}: {}", metricName, prediction);
    return prediction;
  }

  /**
   * Predict the breaches of the configured capacity thresholds within the horizon. Thresholds of metrics that cannot
   * be forecast are skipped.
   *
   * @param horizonHours The horizon in hours.
   * @return The predictions of the thresholds that are predicted to be breached, soonest first.
   */
  public List<CapacityPrediction> predictConfiguredBreaches(int horizonHours) {
    List<CapacityPrediction> breaches = new ArrayList<>();
    for (CapacityThreshold threshold : _thresholds) {
      try {
        CapacityPrediction prediction = predictBreach(threshold.metricName(), threshold.threshold(),
                                                      threshold.direction(), horizonHours);
        if (prediction.breachPredicted()) {
          breaches.add(prediction);
        }
      } catch (InsufficientHistoryException ihe) {
        LOG.debug("Skip capacity threshold {}: {}", threshold, ihe.getMessage());
      }
    }
    breaches.sort(Comparator.comparingDouble(CapacityPrediction::hoursToBreach));
    return breaches;
  }

  /**
   * @return The predicted breaches of the configured thresholds within the default horizon.
   */
  public List<CapacityPrediction> predictConfiguredBreaches() {
    return predictConfiguredBreaches(_defaultHorizonHours);
  }

  /**
   * @return The configured capacity thresholds.
   */
  public List<CapacityThreshold> configuredThresholds() {
    return _thresholds;
  }

  /**
   * @param hoursToBreach Hours until the breach.
   * @return The urgency of a breach in the given number of hours.
   */
  public Urgency urgencyFor(double hoursToBreach) {
    if (hoursToBreach < _criticalUrgencyHours) {
      return Urgency.CRITICAL;
    } else if (hoursToBreach < _highUrgencyHours) {
      return Urgency.HIGH;
    } else if (hoursToBreach < _mediumUrgencyHours) {
      return Urgency.MEDIUM;
    }
    return Urgency.NONE;
  }

  private static String recommendation(String metricName,
                                       double threshold,
                                       BreachDirection direction,
                                       double hoursToBreach,
                                       Urgency urgency) {
    String breach = String.format("%s is predicted to go %s %s in %.1f hours.", metricName,
                                  direction.configName(), threshold, hoursToBreach);
    switch (urgency) {
      case CRITICAL:
        return breach + " Immediate attention required.";
      case HIGH:
        return breach + " Plan capacity changes within the next few days.";
      case MEDIUM:
        return breach + " Review capacity within the week.";
      default:
        return breach + " Keep monitoring.";
    }
  }
}
