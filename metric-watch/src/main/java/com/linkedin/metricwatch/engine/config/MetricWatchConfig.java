/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.config;

import com.linkedin.metricwatch.common.config.AbstractConfig;
import com.linkedin.metricwatch.common.config.ConfigDef;
import com.linkedin.metricwatch.common.config.ConfigException;
import com.linkedin.metricwatch.engine.capacity.CapacityThreshold;
import com.linkedin.metricwatch.engine.config.constants.AnomalyDetectorConfig;
import com.linkedin.metricwatch.engine.config.constants.CapacityPlannerConfig;
import com.linkedin.metricwatch.engine.config.constants.ForecastConfig;
import com.linkedin.metricwatch.engine.config.constants.InsightsConfig;
import com.linkedin.metricwatch.engine.config.constants.MetricStoreConfig;
import java.util.Map;


/**
 * The configuration class of Metric Watch.
 *
 * To avoid having a huge monolithic class that mixes unrelated configs, config names, their defaults, and definitions
 * reside in the relevant classes under {@link com.linkedin.metricwatch.engine.config.constants}.
 */
public class MetricWatchConfig extends AbstractConfig {
  private static final ConfigDef CONFIG;

  static {
    CONFIG = InsightsConfig.define(CapacityPlannerConfig.define(ForecastConfig.define(
        AnomalyDetectorConfig.define(MetricStoreConfig.define(new ConfigDef())))));
  }

  public MetricWatchConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public MetricWatchConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
    sanityCheckSeverityThresholds();
    sanityCheckUrgencyThresholds();
    sanityCheckSeasonalBuckets();
    sanityCheckCapacityThresholds();
  }

  /**
   * @return The definition of every Metric Watch config.
   */
  public static ConfigDef definition() {
    return CONFIG;
  }

  private void sanityCheckSeverityThresholds() {
    double critical = getDouble(AnomalyDetectorConfig.CRITICAL_SEVERITY_THRESHOLD_CONFIG);
    double high = getDouble(AnomalyDetectorConfig.HIGH_SEVERITY_THRESHOLD_CONFIG);
    double medium = getDouble(AnomalyDetectorConfig.MEDIUM_SEVERITY_THRESHOLD_CONFIG);
    if (!(medium <= high && high <= critical)) {
      throw new ConfigException(String.format("Severity thresholds must satisfy %s (%f) <= %s (%f) <= %s (%f).",
                                              AnomalyDetectorConfig.MEDIUM_SEVERITY_THRESHOLD_CONFIG, medium,
                                              AnomalyDetectorConfig.HIGH_SEVERITY_THRESHOLD_CONFIG, high,
                                              AnomalyDetectorConfig.CRITICAL_SEVERITY_THRESHOLD_CONFIG, critical));
    }
  }

  private void sanityCheckUrgencyThresholds() {
    double critical = getDouble(CapacityPlannerConfig.CRITICAL_URGENCY_HOURS_CONFIG);
    double high = getDouble(CapacityPlannerConfig.HIGH_URGENCY_HOURS_CONFIG);
    double medium = getDouble(CapacityPlannerConfig.MEDIUM_URGENCY_HOURS_CONFIG);
    if (!(critical <= high && high <= medium)) {
      throw new ConfigException(String.format("Urgency thresholds must satisfy %s (%f) <= %s (%f) <= %s (%f).",
                                              CapacityPlannerConfig.CRITICAL_URGENCY_HOURS_CONFIG, critical,
                                              CapacityPlannerConfig.HIGH_URGENCY_HOURS_CONFIG, high,
                                              CapacityPlannerConfig.MEDIUM_URGENCY_HOURS_CONFIG, medium));
    }
  }

  private void sanityCheckSeasonalBuckets() {
    int periodMinutes = getInt(ForecastConfig.SEASONAL_PERIOD_HOURS_CONFIG) * 60;
    int bucketMinutes = getInt(ForecastConfig.SEASONAL_BUCKET_MINUTES_CONFIG);
    if (bucketMinutes > periodMinutes || periodMinutes % bucketMinutes != 0) {
      throw new ConfigException(ForecastConfig.SEASONAL_BUCKET_MINUTES_CONFIG, bucketMinutes,
                                "The seasonal period of " + periodMinutes + " minutes must be a multiple of the bucket width.");
    }
  }

  private void sanityCheckCapacityThresholds() {
    for (String threshold : getList(CapacityPlannerConfig.CAPACITY_THRESHOLDS_CONFIG)) {
      CapacityThreshold.parse(threshold);
    }
  }
}
