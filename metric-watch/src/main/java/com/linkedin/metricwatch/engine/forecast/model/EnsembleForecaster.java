/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast.model;

import com.linkedin.metricwatch.engine.forecast.ForecastMethod;
import com.linkedin.metricwatch.exception.InsufficientHistoryException;
import com.linkedin.metricwatch.monitor.sampling.MetricSample;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.metricwatch.MetricWatchUtils.hoursBetween;
import static com.linkedin.metricwatch.common.utils.Utils.validateNotNull;


/**
 * A weighted average of every member method that can be fitted to the history. A member that cannot be fitted, e.g.
 * a seasonal model without enough cycles, is left out.
 * <p>
 * The weight of a member is inversely proportional to its root mean square error when it is fitted to the history
 * without its most recent samples and predicts the held out samples. A member that cannot be back-tested gets the
 * mean weight of the back-tested members. If no member can be back-tested, all members get equal weights.
 */
public class EnsembleForecaster implements Forecaster {
  private static final Logger LOG = LoggerFactory.getLogger(EnsembleForecaster.class);
  // Lower bound of the back-test error, so that a perfect back-test does not get an infinite weight.
  static final double MIN_BACKTEST_RMSE = 1e-6;
  private final Map<ForecastMethod, Forecaster> _members;

  /**
   * @param members The forecaster of each member method.
   */
  public EnsembleForecaster(Map<ForecastMethod, Forecaster> members) {
    validateNotNull(members, "Ensemble members cannot be null.");
    if (members.isEmpty() || members.containsKey(ForecastMethod.ENSEMBLE)) {
      throw new IllegalArgumentException("Ensemble members must be a non-empty set of non-ensemble methods.");
    }
    _members = Collections.unmodifiableMap(new EnumMap<>(members));
  }

  @Override
  public ForecastMethod method() {
    return ForecastMethod.ENSEMBLE;
  }

  @Override
  public EnsembleModel fit(List<MetricSample> history, ForecastParameters parameters) throws InsufficientHistoryException {
    ForecastUtils.ensureMinSamples(history, parameters.minSamples());
    Map<ForecastMethod, FittedModel> models = new EnumMap<>(ForecastMethod.class);
    for (Forecaster forecaster : _members.values()) {
      try {
        models.put(forecaster.method(), forecaster.fit(history, parameters));
      } catch (InsufficientHistoryException ihe) {
        LOG.debug("Leave {} out of the ensemble: {}", forecaster.method(), ihe.getMessage());
      }
    }
    if (models.isEmpty()) {
      throw new InsufficientHistoryException(history.get(0).metricName(), history.size(), parameters.minSamples(),
                                             "No forecasting method can be fitted to the history of "
                                             + history.get(0).metricName());
    }
    Map<ForecastMethod, Double> weights = weigh(history, parameters, models.keySet());
    LOG.debug("Ensemble weights of {}: {}", history.get(0).metricName(), weights);
    return new EnsembleModel(models, weights);
  }

  private Map<ForecastMethod, Double> weigh(List<MetricSample> history,
                                            ForecastParameters parameters,
                                            Iterable<ForecastMethod> methods) {
    int numHeldOut = Math.max(1, (int) Math.round(history.size() * parameters.backtestFraction()));
    int numTraining = history.size() - numHeldOut;
    Map<ForecastMethod, Double> rawWeights = new EnumMap<>(ForecastMethod.class);
    List<ForecastMethod> notBacktested = new ArrayList<>();
    if (numTraining >= parameters.minSamples()) {
      List<MetricSample> training = history.subList(0, numTraining);
      List<MetricSample> heldOut = history.subList(numTraining, history.size());
      for (ForecastMethod method : methods) {
        Double rmse = backtest(_members.get(method), training, heldOut, parameters);
        if (rmse == null) {
          notBacktested.add(method);
        } else {
          rawWeights.put(method, 1.0 / Math.max(rmse, MIN_BACKTEST_RMSE));
        }
      }
    } else {
      for (ForecastMethod method : methods) {
        notBacktested.add(method);
      }
    }

    double fallbackWeight = rawWeights.isEmpty()
                            ? 1.0
                            : rawWeights.values().stream().mapToDouble(Double::doubleValue).average().orElse(1.0);
    for (ForecastMethod method : notBacktested) {
      rawWeights.put(method, fallbackWeight);
    }
    double total = rawWeights.values().stream().mapToDouble(Double::doubleValue).sum();
    Map<ForecastMethod, Double> weights = new EnumMap<>(ForecastMethod.class);
    rawWeights.forEach((method, weight) -> weights.put(method, weight / total));
    return weights;
  }

  /**
   * @return The root mean square error of the member on the held out samples, or {@code null} if the member cannot be
   * fitted to the training samples.
   */
  private static Double backtest(Forecaster forecaster,
                                 List<MetricSample> training,
                                 List<MetricSample> heldOut,
                                 ForecastParameters parameters) {
    FittedModel model;
    try {
      model = forecaster.fit(training, parameters);
    } catch (InsufficientHistoryException ihe) {
      LOG.trace("Cannot back-test {}: {}", forecaster.method(), ihe.getMessage());
      return null;
    }
    long trainingOriginMs = ForecastUtils.originMs(training);
    double squaredErrorSum = 0.0;
    for (MetricSample sample : heldOut) {
      double error = sample.value() - model.predict(hoursBetween(trainingOriginMs, sample.timeMs()));
      squaredErrorSum += error * error;
    }
    return Math.sqrt(squaredErrorSum / heldOut.size());
  }

  /**
   * The fitted ensemble. Both the prediction and the band half width are the weighted averages of those of the
   * members.
   */
  public static final class EnsembleModel implements FittedModel {
    private final Map<ForecastMethod, FittedModel> _models;
    private final Map<ForecastMethod, Double> _weights;

    EnsembleModel(Map<ForecastMethod, FittedModel> models, Map<ForecastMethod, Double> weights) {
      _models = models;
      _weights = Collections.unmodifiableMap(weights);
    }

    @Override
    public ForecastMethod method() {
      return ForecastMethod.ENSEMBLE;
    }

    @Override
    public double predict(double offsetHours) {
      double prediction = 0.0;
      for (Map.Entry<ForecastMethod, FittedModel> entry : _models.entrySet()) {
        prediction += _weights.get(entry.getKey()) * entry.getValue().predict(offsetHours);
      }
      return prediction;
    }

    @Override
    public double halfWidth(double offsetHours) {
      double halfWidth = 0.0;
      for (Map.Entry<ForecastMethod, FittedModel> entry : _models.entrySet()) {
        halfWidth += _weights.get(entry.getKey()) * entry.getValue().halfWidth(offsetHours);
      }
      return halfWidth;
    }

    /**
     * @return The normalized weight of each member that contributes to the ensemble.
     */
    public Map<ForecastMethod, Double> weights() {
      return _weights;
    }
  }
}
