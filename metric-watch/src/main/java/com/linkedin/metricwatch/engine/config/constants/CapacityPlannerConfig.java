/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.config.constants;

import com.linkedin.metricwatch.common.config.ConfigDef;

import static com.linkedin.metricwatch.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.metricwatch.common.config.ConfigDef.Range.between;


/**
 * A class to keep Metric Watch Capacity Planner configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class CapacityPlannerConfig {

  /**
   * <code>capacity.thresholds</code>
   */
  public static final String CAPACITY_THRESHOLDS_CONFIG = "capacity.thresholds";
  public static final String DEFAULT_CAPACITY_THRESHOLDS = "context_usage:85:above,error_count:50:above,cost:100:above";
  public static final String CAPACITY_THRESHOLDS_DOC = "A list of capacity thresholds checked by the capacity planner, "
      + "each in the form metric:threshold[:above|below]. The direction defaults to above.";

  /**
   * <code>capacity.default.horizon.hours</code>
   */
  public static final String DEFAULT_HORIZON_HOURS_CONFIG = "capacity.default.horizon.hours";
  public static final int DEFAULT_DEFAULT_HORIZON_HOURS = 168;
  public static final String DEFAULT_HORIZON_HOURS_DOC = "The horizon in hours over which the configured capacity "
      + "thresholds are checked.";

  /**
   * <code>capacity.urgency.critical.hours</code>
   */
  public static final String CRITICAL_URGENCY_HOURS_CONFIG = "capacity.urgency.critical.hours";
  public static final double DEFAULT_CRITICAL_URGENCY_HOURS = 24.0;
  public static final String CRITICAL_URGENCY_HOURS_DOC = "A predicted breach sooner than this many hours is critical.";

  /**
   * <code>capacity.urgency.high.hours</code>
   */
  public static final String HIGH_URGENCY_HOURS_CONFIG = "capacity.urgency.high.hours";
  public static final double DEFAULT_HIGH_URGENCY_HOURS = 72.0;
  public static final String HIGH_URGENCY_HOURS_DOC = "A predicted breach sooner than this many hours has high urgency.";

  /**
   * <code>capacity.urgency.medium.hours</code>
   */
  public static final String MEDIUM_URGENCY_HOURS_CONFIG = "capacity.urgency.medium.hours";
  public static final double DEFAULT_MEDIUM_URGENCY_HOURS = 168.0;
  public static final String MEDIUM_URGENCY_HOURS_DOC = "A predicted breach sooner than this many hours has medium "
      + "urgency. Later breaches have no urgency.";

  private CapacityPlannerConfig() {
  }

  /**
   * Define configs for Capacity Planner.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for Capacity Planner.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(CAPACITY_THRESHOLDS_CONFIG,
                            ConfigDef.Type.LIST,
                            DEFAULT_CAPACITY_THRESHOLDS,
                            ConfigDef.Importance.HIGH,
                            CAPACITY_THRESHOLDS_DOC)
                    .define(DEFAULT_HORIZON_HOURS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_DEFAULT_HORIZON_HOURS,
                            between(1, ForecastConfig.MAX_HORIZON_HOURS),
                            ConfigDef.Importance.MEDIUM,
                            DEFAULT_HORIZON_HOURS_DOC)
                    .define(CRITICAL_URGENCY_HOURS_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_CRITICAL_URGENCY_HOURS,
                            atLeast(0.0),
                            ConfigDef.Importance.LOW,
                            CRITICAL_URGENCY_HOURS_DOC)
                    .define(HIGH_URGENCY_HOURS_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_HIGH_URGENCY_HOURS,
                            atLeast(0.0),
                            ConfigDef.Importance.LOW,
                            HIGH_URGENCY_HOURS_DOC)
                    .define(MEDIUM_URGENCY_HOURS_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_MEDIUM_URGENCY_HOURS,
                            atLeast(0.0),
                            ConfigDef.Importance.LOW,
                            MEDIUM_URGENCY_HOURS_DOC);
  }
}
