/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.config.constants;

import com.linkedin.metricwatch.common.config.ConfigDef;

import static com.linkedin.metricwatch.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep Metric Watch Insights Generator configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class InsightsConfig {

  /**
   * <code>insights.recent.anomalies</code>
   */
  public static final String RECENT_ANOMALIES_CONFIG = "insights.recent.anomalies";
  public static final int DEFAULT_RECENT_ANOMALIES = 50;
  public static final String RECENT_ANOMALIES_DOC = "The number of most recent anomaly records the insights are "
      + "generated from.";

  /**
   * <code>insights.activity.window.hours</code>
   */
  public static final String ACTIVITY_WINDOW_HOURS_CONFIG = "insights.activity.window.hours";
  public static final int DEFAULT_ACTIVITY_WINDOW_HOURS = 24;
  public static final String ACTIVITY_WINDOW_HOURS_DOC = "The trailing window in hours of the anomaly pattern insights.";

  /**
   * <code>insights.activity.threshold</code>
   */
  public static final String ACTIVITY_THRESHOLD_CONFIG = "insights.activity.threshold";
  public static final int DEFAULT_ACTIVITY_THRESHOLD = 5;
  public static final String ACTIVITY_THRESHOLD_DOC = "An elevated anomaly activity insight is generated if more than "
      + "this many anomalies were detected within the activity window.";

  private InsightsConfig() {
  }

  /**
   * Define configs for Insights Generator.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for Insights Generator.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(RECENT_ANOMALIES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_RECENT_ANOMALIES,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            RECENT_ANOMALIES_DOC)
                    .define(ACTIVITY_WINDOW_HOURS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ACTIVITY_WINDOW_HOURS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            ACTIVITY_WINDOW_HOURS_DOC)
                    .define(ACTIVITY_THRESHOLD_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ACTIVITY_THRESHOLD,
                            atLeast(0),
                            ConfigDef.Importance.LOW,
                            ACTIVITY_THRESHOLD_DOC);
  }
}
