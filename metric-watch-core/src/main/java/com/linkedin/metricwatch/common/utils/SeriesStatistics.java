/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.common.utils;

import com.linkedin.metricwatch.monitor.sampling.MetricSample;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.regression.SimpleRegression;


/**
 * Descriptive statistics over a window of metric values.
 */
public final class SeriesStatistics {
  // Values whose magnitude is below this are treated as zero, e.g. the standard deviation of a constant window.
  public static final double EPSILON = 1e-9;

  private SeriesStatistics() {

  }

  /**
   * @param samples Metric samples.
   * @return The values of the given samples in the same order.
   */
  public static double[] valuesOf(List<MetricSample> samples) {
    double[] values = new double[samples.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = samples.get(i).value();
    }
    return values;
  }

  /**
   * @param values Values.
   * @param n Maximum number of values.
   * @return The last {@code n} values (or all of them if there are fewer).
   */
  public static double[] last(double[] values, int n) {
    return Arrays.copyOfRange(values, Math.max(0, values.length - n), values.length);
  }

  public static double mean(double[] values) {
    return StatUtils.mean(values);
  }

  /**
   * @param values Values.
   * @return The sample standard deviation, 0 for fewer than two values.
   */
  public static double stdDev(double[] values) {
    if (values.length < 2) {
      return 0.0;
    }
    return new DescriptiveStatistics(values).getStandardDeviation();
  }

  /**
   * @param values Values.
   * @param p The percentile in (0, 100].
   * @return The estimated percentile of the values.
   */
  public static double percentile(double[] values, double p) {
    Percentile percentile = new Percentile();
    percentile.setData(values);
    return percentile.evaluate(p);
  }

  public static double median(double[] values) {
    return percentile(values, 50.0);
  }

  /**
   * @param values Values.
   * @return The difference between the largest and the smallest value, 0 for an empty array.
   */
  public static double range(double[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    return StatUtils.max(values) - StatUtils.min(values);
  }

  /**
   * @param values Values equally spaced in time.
   * @return The least squares slope of the values per step, 0 for fewer than two values.
   */
  public static double slope(double[] values) {
    if (values.length < 2) {
      return 0.0;
    }
    SimpleRegression regression = new SimpleRegression();
    for (int i = 0; i < values.length; i++) {
      regression.addData(i, values[i]);
    }
    return regression.getSlope();
  }

  /**
   * @param values Values.
   * @return The first differences {@code values[i + 1] - values[i]}.
   */
  public static double[] differences(double[] values) {
    if (values.length < 2) {
      return new double[0];
    }
    double[] diffs = new double[values.length - 1];
    for (int i = 1; i < values.length; i++) {
      diffs[i - 1] = values[i] - values[i - 1];
    }
    return diffs;
  }

  /**
   * @param value A value.
   * @return {@code true} if the magnitude of the value is negligible.
   */
  public static boolean isZero(double value) {
    return Math.abs(value) < EPSILON;
  }
}
