/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast.model;

import com.linkedin.metricwatch.engine.forecast.ForecastMethod;
import com.linkedin.metricwatch.exception.InsufficientHistoryException;
import com.linkedin.metricwatch.monitor.sampling.MetricSample;
import java.util.List;

import static com.linkedin.metricwatch.MetricWatchUtils.MS_PER_HOUR;
import static com.linkedin.metricwatch.MetricWatchUtils.hoursToMs;


/**
 * Predicts the average of the historical values at the same phase of the cycle. The phase of a time is the bucket of
 * {@code time mod period}, so cycles are aligned to the epoch, e.g. daily cycles start at midnight UTC. A phase without
 * history is predicted at the overall mean.
 * <p>
 * The history must cover the configured number of full cycles, the coverage being the time between the first and the
 * last sample plus one sampling step. The band is {@code z * s * sqrt(1 + h / period)}, where {@code s} is the
 * standard deviation of the values around their phase averages.
 */
public class SeasonalForecaster implements Forecaster {

  @Override
  public ForecastMethod method() {
    return ForecastMethod.SEASONAL;
  }

  @Override
  public FittedModel fit(List<MetricSample> history, ForecastParameters parameters) throws InsufficientHistoryException {
    ForecastUtils.ensureMinSamples(history, parameters.minSamples());
    long periodMs = parameters.seasonalPeriodMs();
    long bucketMs = parameters.seasonalBucketMs();
    int numBuckets = (int) (periodMs / bucketMs);
    double stepHours = ForecastUtils.medianStepHours(history);
    long coverageMs = ForecastUtils.originMs(history) - history.get(0).timeMs() + hoursToMs(stepHours);
    long requiredCoverageMs = parameters.seasonalMinCycles() * periodMs;
    if (coverageMs < requiredCoverageMs) {
      int required = (int) Math.ceil(requiredCoverageMs / (stepHours * MS_PER_HOUR));
      throw new InsufficientHistoryException(history.get(0).metricName(), history.size(), required,
                                             String.format("Seasonal forecast of %s requires %d cycles of %.1f hours, "
                                                           + "the history covers %.1f hours.",
                                                           history.get(0).metricName(), parameters.seasonalMinCycles(),
                                                           periodMs / MS_PER_HOUR, coverageMs / MS_PER_HOUR));
    }

    double[] sums = new double[numBuckets];
    int[] counts = new int[numBuckets];
    double total = 0.0;
    for (MetricSample sample : history) {
      int bucket = bucketOf(sample.timeMs(), periodMs, bucketMs);
      sums[bucket] += sample.value();
      counts[bucket]++;
      total += sample.value();
    }
    double overallMean = total / history.size();
    double[] averages = new double[numBuckets];
    int populated = 0;
    for (int i = 0; i < numBuckets; i++) {
      if (counts[i] > 0) {
        averages[i] = sums[i] / counts[i];
        populated++;
      } else {
        averages[i] = overallMean;
      }
    }
    double squaredResidualSum = 0.0;
    for (MetricSample sample : history) {
      double residual = sample.value() - averages[bucketOf(sample.timeMs(), periodMs, bucketMs)];
      squaredResidualSum += residual * residual;
    }
    double residualStdDev = Math.sqrt(squaredResidualSum / Math.max(1, history.size() - populated));
    return new SeasonalModel(parameters.z(), averages, residualStdDev, ForecastUtils.originMs(history), periodMs, bucketMs);
  }

  static int bucketOf(long timeMs, long periodMs, long bucketMs) {
    return (int) (Math.floorMod(timeMs, periodMs) / bucketMs);
  }

  private static final class SeasonalModel implements FittedModel {
    private final double _z;
    private final double[] _averages;
    private final double _residualStdDev;
    private final long _originMs;
    private final long _periodMs;
    private final long _bucketMs;

    SeasonalModel(double z, double[] averages, double residualStdDev, long originMs, long periodMs, long bucketMs) {
      _z = z;
      _averages = averages;
      _residualStdDev = residualStdDev;
      _originMs = originMs;
      _periodMs = periodMs;
      _bucketMs = bucketMs;
    }

    @Override
    public ForecastMethod method() {
      return ForecastMethod.SEASONAL;
    }

    @Override
    public double predict(double offsetHours) {
      return _averages[bucketOf(_originMs + hoursToMs(offsetHours), _periodMs, _bucketMs)];
    }

    @Override
    public double halfWidth(double offsetHours) {
      return _z * _residualStdDev * Math.sqrt(1.0 + offsetHours * MS_PER_HOUR / _periodMs);
    }
  }
}
