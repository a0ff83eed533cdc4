/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast.model;

import com.linkedin.metricwatch.exception.InsufficientHistoryException;
import com.linkedin.metricwatch.monitor.sampling.MetricSample;
import java.util.ArrayList;
import java.util.List;

import static com.linkedin.metricwatch.MetricWatchUtils.MS_PER_HOUR;
import static com.linkedin.metricwatch.common.utils.SeriesStatistics.median;


/**
 * Helpers of the forecasting models.
 */
public final class ForecastUtils {
  // Used as sampling step if the history has no two samples at distinct times.
  static final double DEFAULT_STEP_HOURS = 1.0;

  private ForecastUtils() {

  }

  /**
   * @param history Samples, oldest first.
   * @param minSamples Minimum number of samples.
   * @throws InsufficientHistoryException if the history has fewer than the given number of samples.
   */
  public static void ensureMinSamples(List<MetricSample> history, int minSamples) throws InsufficientHistoryException {
    if (history.size() < minSamples) {
      String metricName = history.isEmpty() ? null : history.get(0).metricName();
      throw new InsufficientHistoryException(metricName, history.size(), minSamples);
    }
  }

  /**
   * @param history Samples, oldest first.
   * @return The median time between two consecutive samples at distinct times in hours.
   */
  public static double medianStepHours(List<MetricSample> history) {
    List<Double> steps = new ArrayList<>();
    for (int i = 1; i < history.size(); i++) {
      long step = history.get(i).timeMs() - history.get(i - 1).timeMs();
      if (step > 0) {
        steps.add(step / MS_PER_HOUR);
      }
    }
    if (steps.isEmpty()) {
      return DEFAULT_STEP_HOURS;
    }
    double[] values = new double[steps.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = steps.get(i);
    }
    return median(values);
  }

  /**
   * @param history Samples, oldest first.
   * @return Time of the last sample in milliseconds.
   */
  public static long originMs(List<MetricSample> history) {
    return history.get(history.size() - 1).timeMs();
  }
}
