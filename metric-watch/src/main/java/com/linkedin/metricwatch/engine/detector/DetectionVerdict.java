/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector;

/**
 * The verdict of an anomaly detection.
 *
 * <ul>
 *   <li>{@link #INSUFFICIENT_DATA}: The metric does not have enough history to tell. This is not an anomaly.</li>
 *   <li>{@link #NORMAL}: Fewer estimators than the quorum flagged the observation.</li>
 *   <li>{@link #ANOMALOUS}: At least the quorum of estimators flagged the observation.</li>
 * </ul>
 */
public enum DetectionVerdict {
  INSUFFICIENT_DATA, NORMAL, ANOMALOUS
}
