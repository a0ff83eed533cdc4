/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.metricwatch.common.config;

import com.linkedin.metricwatch.common.MetricWatchConfigurable;
import com.linkedin.metricwatch.common.utils.Utils;
import com.linkedin.metricwatch.exception.MetricWatchException;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * The parsed values of a {@link ConfigDef}, with typed getters. Keeps the supplied configs as well, to hand them to
 * configurable plugins and to report the supplied keys that no getter asked for.
 */
public class AbstractConfig {
  private final Logger _log = LoggerFactory.getLogger(getClass());
  private final Map<String, ?> _originals;
  private final Map<String, Object> _values;
  // Keys read through a getter.
  private final Set<String> _used;

  @SuppressWarnings("unchecked")
  public AbstractConfig(ConfigDef definition, Map<?, ?> originals, boolean doLog) {
    for (Object key : originals.keySet()) {
      if (!(key instanceof String)) {
        throw new ConfigException(String.valueOf(key), originals.get(key), "Key must be a string.");
      }
    }
    _originals = (Map<String, ?>) originals;
    _values = definition.parse(_originals);
    _used = Collections.synchronizedSet(new HashSet<>());
    if (doLog) {
      _log.info("{} values:{}", getClass().getSimpleName(), describe(_values));
    }
  }

  public AbstractConfig(ConfigDef definition, Map<?, ?> originals) {
    this(definition, originals, true);
  }

  protected Object get(String key) {
    if (!_values.containsKey(key)) {
      throw new ConfigException(String.format("Unknown configuration '%s'", key));
    }
    _used.add(key);
    return _values.get(key);
  }

  public Integer getInt(String key) {
    return (Integer) get(key);
  }

  public Double getDouble(String key) {
    return (Double) get(key);
  }

  @SuppressWarnings("unchecked")
  public List<String> getList(String key) {
    return (List<String>) get(key);
  }

  public String getString(String key) {
    return (String) get(key);
  }

  public Class<?> getClass(String key) {
    return (Class<?>) get(key);
  }

  /**
   * Warn about every supplied key that no getter has read, typically a misspelled key. Call it once all components
   * read their configs.
   */
  public void logUnused() {
    for (String key : new TreeMap<>(_originals).keySet()) {
      if (!_used.contains(key)) {
        _log.warn("The configuration '{}' was supplied but isn't a known config.", key);
      }
    }
  }

  /**
   * Instantiate the class configured under the given key. If the instance is {@link MetricWatchConfigurable}, it is
   * configured with the supplied configs, completed with the parsed value of each key that was not supplied.
   *
   * @param key The configuration key for the class
   * @param t The interface the class should implement
   * @param <T> The type of the configured instance to be returned.
   * @return A configured instance of the class, {@code null} if no class is configured.
   * @throws MetricWatchException if the class cannot be instantiated or does not implement the interface.
   */
  public <T> T getConfiguredInstance(String key, Class<T> t) throws MetricWatchException {
    Class<?> c = getClass(key);
    if (c == null) {
      return null;
    }
    Object o = Utils.newInstance(c);
    if (!t.isInstance(o)) {
      throw new MetricWatchException(c.getName() + " is not an instance of " + t.getName());
    }
    if (o instanceof MetricWatchConfigurable) {
      Map<String, Object> configs = new HashMap<>(_originals);
      for (Map.Entry<String, Object> entry : _values.entrySet()) {
        configs.putIfAbsent(entry.getKey(), entry.getValue());
      }
      ((MetricWatchConfigurable) o).configure(configs);
    }
    return t.cast(o);
  }

  private static String describe(Map<String, Object> values) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, Object> entry : new TreeMap<>(values).entrySet()) {
      sb.append(System.lineSeparator()).append('\t').append(entry.getKey()).append(" = ").append(entry.getValue());
    }
    return sb.toString();
  }
}
