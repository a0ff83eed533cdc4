/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.insights;

import com.linkedin.metricwatch.engine.capacity.CapacityPrediction;
import com.linkedin.metricwatch.engine.capacity.Urgency;
import com.linkedin.metricwatch.engine.config.MetricWatchConfig;
import com.linkedin.metricwatch.engine.config.constants.InsightsConfig;
import com.linkedin.metricwatch.engine.detector.AnomalyRecord;
import com.linkedin.metricwatch.engine.detector.AnomalySeverity;
import com.linkedin.metricwatch.engine.forecast.ForecastResult;
import com.linkedin.metricwatch.engine.forecast.Trend;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.metricwatch.common.utils.Utils.validateNotNull;


/**
 * Turns recent anomalies, forecasts and capacity predictions into a ranked list of insights. The generator is a pure
 * function of its arguments and never modifies them.
 * <p>
 * Insights are ranked as follows:
 * <ol>
 *   <li>Unresolved critical anomalies, one insight per metric.</li>
 *   <li>Capacity predictions of critical urgency, then those of high urgency, soonest first.</li>
 *   <li>The metric with the most anomalies in the activity window, and elevated anomaly activity.</li>
 *   <li>Rising forecasts of metrics without an open anomaly.</li>
 * </ol>
 */
public class InsightsGenerator {
  private static final Logger LOG = LoggerFactory.getLogger(InsightsGenerator.class);
  private final long _activityWindowMs;
  private final int _activityThreshold;

  public InsightsGenerator(MetricWatchConfig config) {
    this(config.getInt(InsightsConfig.ACTIVITY_WINDOW_HOURS_CONFIG),
         config.getInt(InsightsConfig.ACTIVITY_THRESHOLD_CONFIG));
  }

  /**
   * @param activityWindowHours The trailing window in hours of the anomaly pattern insights.
   * @param activityThreshold More anomalies than this in the window is elevated activity.
   */
  public InsightsGenerator(int activityWindowHours, int activityThreshold) {
    _activityWindowMs = TimeUnit.HOURS.toMillis(activityWindowHours);
    _activityThreshold = activityThreshold;
  }

  /**
   * @param recentAnomalies The most recent anomaly records.
   * @param forecasts Recent forecasts of the tracked metrics.
   * @param capacityPredictions Capacity predictions of the tracked metrics.
   * @param nowMs The current time in milliseconds.
   * @return The insights, highest priority first.
   */
  public List<Insight> generate(Collection<AnomalyRecord> recentAnomalies,
                                Collection<ForecastResult> forecasts,
                                Collection<CapacityPrediction> capacityPredictions,
                                long nowMs) {
    validateNotNull(recentAnomalies, "Recent anomalies cannot be null.");
    validateNotNull(forecasts, "Forecasts cannot be null.");
    validateNotNull(capacityPredictions, "Capacity predictions cannot be null.");
    List<Insight> insights = new ArrayList<>();
    addCriticalAnomalyInsights(recentAnomalies, insights);
    addCapacityInsights(capacityPredictions, insights);
    addAnomalyPatternInsights(recentAnomalies, nowMs, insights);
    addRisingTrendInsights(recentAnomalies, forecasts, insights);
    LOG.debug("Generated {} insights from {} anomalies, {} forecasts and {} capacity predictions.", insights.size(),
              recentAnomalies.size(), forecasts.size(), capacityPredictions.size());
    return insights;
  }

  private static void addCriticalAnomalyInsights(Collection<AnomalyRecord> recentAnomalies, List<Insight> insights) {
    SortedMap<String, Integer> criticalCountByMetric = new TreeMap<>();
    for (AnomalyRecord record : recentAnomalies) {
      if (record.severity() == AnomalySeverity.CRITICAL && record.isOpen()) {
        criticalCountByMetric.merge(record.metricName(), 1, Integer::sum);
      }
    }
    List<Map.Entry<String, Integer>> entries = new ArrayList<>(criticalCountByMetric.entrySet());
    // Most critical anomalies first, ties by metric name.
    entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
    for (Map.Entry<String, Integer> entry : entries) {
      insights.add(new Insight(InsightPriority.CRITICAL, InsightType.CRITICAL_ANOMALIES,
                               String.format("%d critical anomalies detected on %s", entry.getValue(), entry.getKey()),
                               "Immediate attention required", entry.getKey()));
    }
  }

  private static void addCapacityInsights(Collection<CapacityPrediction> capacityPredictions, List<Insight> insights) {
    List<CapacityPrediction> urgent = new ArrayList<>();
    for (CapacityPrediction prediction : capacityPredictions) {
      if (prediction.breachPredicted()
          && (prediction.urgency() == Urgency.CRITICAL || prediction.urgency() == Urgency.HIGH)) {
        urgent.add(prediction);
      }
    }
    urgent.sort(Comparator.comparing((CapacityPrediction p) -> p.urgency() == Urgency.CRITICAL ? 0 : 1)
                          .thenComparingDouble(CapacityPrediction::hoursToBreach));
    for (CapacityPrediction prediction : urgent) {
      InsightPriority priority = prediction.urgency() == Urgency.CRITICAL ? InsightPriority.CRITICAL
                                                                          : InsightPriority.HIGH;
      insights.add(new Insight(priority, InsightType.CAPACITY_BREACH,
                               String.format("%s is predicted to go %s %s in %.1f hours", prediction.metricName(),
                                             prediction.direction().configName(), prediction.threshold(),
                                             prediction.hoursToBreach()),
                               prediction.recommendation(), prediction.metricName()));
    }
  }

  private void addAnomalyPatternInsights(Collection<AnomalyRecord> recentAnomalies, long nowMs, List<Insight> insights) {
    long windowStartMs = nowMs - _activityWindowMs;
    SortedMap<String, Integer> countByMetric = new TreeMap<>();
    int numInWindow = 0;
    for (AnomalyRecord record : recentAnomalies) {
      if (record.timeMs() > windowStartMs && record.timeMs() <= nowMs) {
        countByMetric.merge(record.metricName(), 1, Integer::sum);
        numInWindow++;
      }
    }
    if (numInWindow == 0) {
      return;
    }
    String mostAnomalous = null;
    int mostAnomalies = 0;
    for (Map.Entry<String, Integer> entry : countByMetric.entrySet()) {
      if (entry.getValue() > mostAnomalies) {
        mostAnomalous = entry.getKey();
        mostAnomalies = entry.getValue();
      }
    }
    long windowHours = TimeUnit.MILLISECONDS.toHours(_activityWindowMs);
    insights.add(new Insight(InsightPriority.HIGH, InsightType.MOST_ANOMALOUS_METRIC,
                             String.format("%s has %d anomalies in last %dh", mostAnomalous, mostAnomalies, windowHours),
                             String.format("Investigate %s for potential issues", mostAnomalous), mostAnomalous));
    if (numInWindow > _activityThreshold) {
      insights.add(new Insight(InsightPriority.MEDIUM, InsightType.ELEVATED_ANOMALY_ACTIVITY,
                               String.format("Increased anomaly activity: %d anomalies in %dh", numInWindow, windowHours),
                               "System may be experiencing degradation", null));
    }
  }

  private static void addRisingTrendInsights(Collection<AnomalyRecord> recentAnomalies,
                                             Collection<ForecastResult> forecasts,
                                             List<Insight> insights) {
    Set<String> metricsWithOpenAnomalies = new HashSet<>();
    for (AnomalyRecord record : recentAnomalies) {
      if (record.isOpen()) {
        metricsWithOpenAnomalies.add(record.metricName());
      }
    }
    List<ForecastResult> rising = new ArrayList<>();
    for (ForecastResult forecast : forecasts) {
      if (forecast.trend() == Trend.INCREASING && !metricsWithOpenAnomalies.contains(forecast.metricName())) {
        rising.add(forecast);
      }
    }
    rising.sort(Comparator.comparing(ForecastResult::metricName));
    for (ForecastResult forecast : rising) {
      insights.add(new Insight(InsightPriority.MEDIUM, InsightType.RISING_TREND,
                               String.format("%s is trending up over the next %d hours", forecast.metricName(),
                                             forecast.horizonHours()),
                               String.format("Watch %s before it turns into an anomaly", forecast.metricName()),
                               forecast.metricName()));
    }
  }
}
