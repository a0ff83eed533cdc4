/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.config.constants;

import com.linkedin.metricwatch.common.config.ConfigDef;
import com.linkedin.metricwatch.monitor.MetricStore;
import com.linkedin.metricwatch.persisteddata.FileStateStore;
import com.linkedin.metricwatch.persisteddata.MemoryStateStore;

import static com.linkedin.metricwatch.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep Metric Watch metric store and state storage configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class MetricStoreConfig {

  /**
   * <code>metric.store.capacity.per.metric</code>
   */
  public static final String CAPACITY_PER_METRIC_CONFIG = "metric.store.capacity.per.metric";
  public static final int DEFAULT_CAPACITY_PER_METRIC = 1000;
  public static final String CAPACITY_PER_METRIC_DOC = "The maximum number of samples retained per metric. Once a metric "
      + "reaches this number of samples, every new sample evicts the oldest one.";

  /**
   * <code>metric.store.document.name</code>
   */
  public static final String METRIC_STORE_DOCUMENT_NAME_CONFIG = "metric.store.document.name";
  public static final String DEFAULT_METRIC_STORE_DOCUMENT_NAME = MetricStore.DEFAULT_DOCUMENT_NAME;
  public static final String METRIC_STORE_DOCUMENT_NAME_DOC = "The name of the document that keeps the persisted metric "
      + "history in the state store.";

  /**
   * <code>state.store.class</code>
   */
  public static final String STATE_STORE_CLASS_CONFIG = "state.store.class";
  public static final String DEFAULT_STATE_STORE_CLASS = MemoryStateStore.class.getName();
  public static final String STATE_STORE_CLASS_DOC = "The name of the class that implements the state store used to "
      + "persist the metric history and the anomaly ledger, e.g. " + FileStateStore.class.getName() + ".";

  /**
   * <code>state.store.dir</code>
   */
  public static final String STATE_STORE_DIR_CONFIG = FileStateStore.STATE_STORE_DIR_CONFIG;
  public static final String DEFAULT_STATE_STORE_DIR = "";
  public static final String STATE_STORE_DIR_DOC = "The directory in which the file based state store keeps its "
      + "documents. Required if the state store class is " + FileStateStore.class.getSimpleName() + ".";

  private MetricStoreConfig() {
  }

  /**
   * Define configs for Metric Store.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for Metric Store.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(CAPACITY_PER_METRIC_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_CAPACITY_PER_METRIC,
                            atLeast(1),
                            ConfigDef.Importance.HIGH,
                            CAPACITY_PER_METRIC_DOC)
                    .define(METRIC_STORE_DOCUMENT_NAME_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_METRIC_STORE_DOCUMENT_NAME,
                            ConfigDef.Importance.LOW,
                            METRIC_STORE_DOCUMENT_NAME_DOC)
                    .define(STATE_STORE_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_STATE_STORE_CLASS,
                            ConfigDef.Importance.MEDIUM,
                            STATE_STORE_CLASS_DOC)
                    .define(STATE_STORE_DIR_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_STATE_STORE_DIR,
                            ConfigDef.Importance.MEDIUM,
                            STATE_STORE_DIR_DOC);
  }
}
