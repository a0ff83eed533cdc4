/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector.estimator;

import com.linkedin.metricwatch.engine.detector.DetectionThresholds;
import com.linkedin.metricwatch.engine.detector.Sensitivity;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;


public class EstimatorsTest {
  private static final double DELTA = 1e-6;
  private static final DetectionThresholds THRESHOLDS = DetectionThresholds.defaults();
  private static final double[] FLAT = {5, 5, 5, 5, 5, 5, 5, 5, 5, 5};
  private static final double[] STEADY = {10, 10, 11, 9, 10, 10};

  @Test
  public void testZScore() {
    Estimator estimator = new ZScoreEstimator();
    double[] reference = {1, 2, 3, 4, 5};
    double sigma = Math.sqrt(2.5);

    EstimatorResult result = estimator.estimate(reference, 10.0, THRESHOLDS);
    assertTrue(result.flagged());
    assertEquals(7.0 / sigma, result.rawValue(), DELTA);
    assertEquals(7.0 / sigma / 5.0, result.score(), DELTA);

    assertFalse(estimator.estimate(reference, 4.0, THRESHOLDS).flagged());
    assertTrue(estimator.estimate(FLAT, 100.0, THRESHOLDS).abstained());
    assertTrue(estimator.estimate(new double[]{1}, 100.0, THRESHOLDS).abstained());
  }

  @Test
  public void testSensitivityScalesThresholds() {
    Estimator estimator = new ZScoreEstimator();
    double[] reference = {1, 2, 3, 4, 5};
    // z = 3.2
    double current = 3.0 + 3.2 * Math.sqrt(2.5);
    assertTrue(estimator.estimate(reference, current, THRESHOLDS.scaledFor(Sensitivity.HIGH)).flagged());
    assertTrue(estimator.estimate(reference, current, THRESHOLDS.scaledFor(Sensitivity.MEDIUM)).flagged());
    assertFalse(estimator.estimate(reference, current, THRESHOLDS.scaledFor(Sensitivity.LOW)).flagged());
  }

  @Test
  public void testIqr() {
    Estimator estimator = new IqrEstimator();
    // Q1 = 9.75, Q3 = 10.25, fences at 9 and 11, two interquartile ranges away from 10.
    EstimatorResult spike = estimator.estimate(STEADY, 50.0, THRESHOLDS);
    assertTrue(spike.flagged());
    assertEquals(39.0, spike.rawValue(), DELTA);
    assertEquals(1.0, spike.score(), 0.0);

    EstimatorResult inside = estimator.estimate(STEADY, 10.5, THRESHOLDS);
    assertFalse(inside.flagged());
    assertEquals(0.3, inside.score(), DELTA);

    EstimatorResult justOutside = estimator.estimate(STEADY, 8.9, THRESHOLDS);
    assertTrue(justOutside.flagged());
    assertEquals(0.66, justOutside.score(), DELTA);

    assertTrue(estimator.estimate(new double[]{1, 2, 3}, 50.0, THRESHOLDS).abstained());
    assertTrue(estimator.estimate(FLAT, 50.0, THRESHOLDS).abstained());
  }

  @Test
  public void testMovingAverage() {
    Estimator estimator = new MovingAverageEstimator();
    double[] reference = {10, 10, 10, 10, 10, 10, 10, 10, 10, 10};
    EstimatorResult high = estimator.estimate(reference, 15.0, THRESHOLDS);
    assertTrue(high.flagged());
    assertEquals(0.5, high.rawValue(), DELTA);
    assertEquals(0.75, high.score(), DELTA);

    EstimatorResult close = estimator.estimate(reference, 13.0, THRESHOLDS);
    assertFalse(close.flagged());
    assertEquals(0.45, close.score(), DELTA);

    // A zero average falls back to the absolute deviation.
    assertTrue(estimator.estimate(new double[]{0, 0}, 0.5, THRESHOLDS).flagged());
    assertTrue(estimator.estimate(new double[0], 1.0, THRESHOLDS).abstained());
  }

  @Test
  public void testExponentialSmoothing() {
    Estimator estimator = new ExponentialSmoothingEstimator();
    assertTrue(estimator.estimate(STEADY, 50.0, THRESHOLDS).flagged());
    assertFalse(estimator.estimate(STEADY, 10.0, THRESHOLDS).flagged());
    assertTrue(estimator.estimate(new double[]{1, 2}, 50.0, THRESHOLDS).abstained());
    assertTrue(estimator.estimate(FLAT, 50.0, THRESHOLDS).abstained());
  }

  @Test
  public void testSpike() {
    Estimator estimator = new SpikeEstimator();
    double[] alternating = {10, 11, 10, 11, 10};
    double diffSigma = Math.sqrt(4.0 / 3.0);
    EstimatorResult jump = estimator.estimate(alternating, 20.0, THRESHOLDS);
    assertTrue(jump.flagged());
    assertEquals(10.0 / diffSigma, jump.rawValue(), DELTA);
    assertFalse(estimator.estimate(alternating, 11.0, THRESHOLDS).flagged());

    // Evenly spaced values have no variation of the steps.
    assertTrue(estimator.estimate(new double[]{1, 2, 3, 4, 5}, 20.0, THRESHOLDS).abstained());
  }

  @Test
  public void testTrendChange() {
    Estimator estimator = new TrendChangeEstimator();
    // Slope -2 followed by slope +2, the window standard deviation is sqrt(80 / 9).
    double[] valley = {10, 8, 6, 4, 2, 2, 4, 6, 8};
    EstimatorResult reversal = estimator.estimate(valley, 10.0, THRESHOLDS);
    assertTrue(reversal.flagged());
    assertEquals(4.0 / Math.sqrt(80.0 / 9.0), reversal.rawValue(), DELTA);

    double[] line = {1, 2, 3, 4, 5, 6, 7, 8, 9};
    EstimatorResult straight = estimator.estimate(line, 10.0, THRESHOLDS);
    assertFalse(straight.flagged());
    assertEquals(0.0, straight.rawValue(), DELTA);

    assertTrue(estimator.estimate(new double[]{1, 2, 3, 4, 5, 6, 7, 8}, 9.0, THRESHOLDS).abstained());
    assertTrue(estimator.estimate(FLAT, 5.0, THRESHOLDS).abstained());
  }

  @Test
  public void testThresholdScoreIsClamped() {
    assertEquals(0.3, EstimatorResult.thresholdScore(1.5, 3.0), DELTA);
    assertEquals(0.6, EstimatorResult.thresholdScore(3.0, 3.0), DELTA);
    assertEquals(1.0, EstimatorResult.thresholdScore(5.0, 3.0), DELTA);
    assertEquals(1.0, EstimatorResult.thresholdScore(100.0, 3.0), 0.0);
    assertEquals(1.0, EstimatorResult.of(EstimatorType.IQR, true, 7.0, 7.0).score(), 0.0);
  }
}
