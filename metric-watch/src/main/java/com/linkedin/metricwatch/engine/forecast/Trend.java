/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.forecast;

/**
 * The direction of a forecast metric.
 *
 * <ul>
 *   <li>{@link #VOLATILE}: The confidence band at the end of the horizon is wide compared to the observed range.</li>
 *   <li>{@link #STABLE}: The regression slope changes the metric by less than a fraction of its standard deviation
 *   over the horizon.</li>
 *   <li>{@link #INCREASING}, {@link #DECREASING}: The sign of the regression slope otherwise.</li>
 * </ul>
 */
public enum Trend {
  INCREASING, DECREASING, STABLE, VOLATILE
}
