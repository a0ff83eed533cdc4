/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.metricwatch.common.config;

import com.linkedin.metricwatch.common.utils.Utils;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * The definition of the Metric Watch configs: name, type, default value, optional validator, importance and
 * documentation of each key. Per-area constant classes add their keys through chained {@code define} calls, e.g.
 * <pre>
 * ConfigDef definition = new ConfigDef()
 *     .define(&quot;metric.store.capacity.per.metric&quot;, Type.INT, 1000, Range.atLeast(1), Importance.HIGH,
 *             &quot;Samples retained per metric.&quot;);
 * Map&lt;String, Object&gt; values = definition.parse(props);
 * </pre>
 * Every key has a default value, so a missing key is never an error. {@link AbstractConfig} wraps the parsed values
 * with typed getters.
 */
public class ConfigDef {
  private final Map<String, ConfigKey> _configKeys;

  public ConfigDef() {
    _configKeys = new LinkedHashMap<>();
  }

  /**
   * @return The names of the defined keys.
   */
  public Set<String> names() {
    return Collections.unmodifiableSet(_configKeys.keySet());
  }

  /**
   * Define a key checked by the given validator.
   *
   * @param name Name of the key.
   * @param type Type of the value.
   * @param defaultValue Value of the key when it is not set, typed or as a string.
   * @param validator Validator of the parsed value, or {@code null} to accept any value of the type.
   * @param importance How likely a user needs to change the key.
   * @param documentation What the key configures.
   * @return This definition.
   * @throws ConfigException if the key is already defined or its default value is invalid.
   */
  public ConfigDef define(String name, Type type, Object defaultValue, Validator validator, Importance importance,
                          String documentation) {
    ConfigKey existing = _configKeys.get(name);
    if (existing != null) {
      throw new ConfigException("Configuration " + name + " is defined twice, first as " + existing);
    }
    _configKeys.put(name, new ConfigKey(name, type, defaultValue, validator, importance, documentation));
    return this;
  }

  /**
   * Define a key that accepts any value of its type.
   *
   * @param name Name of the key.
   * @param type Type of the value.
   * @param defaultValue Value of the key when it is not set, typed or as a string.
   * @param importance How likely a user needs to change the key.
   * @param documentation What the key configures.
   * @return This definition.
   */
  public ConfigDef define(String name, Type type, Object defaultValue, Importance importance, String documentation) {
    return define(name, type, defaultValue, null, importance, documentation);
  }

  /**
   * Parse and validate the given configs. Values may be strings, e.g. from a properties file, or already typed.
   * Keys missing from the given configs take their default value.
   *
   * @param props The configs to parse and validate.
   * @return The typed value of every defined key, by name.
   * @throws ConfigException if a value cannot be parsed or fails its validator.
   */
  public Map<String, Object> parse(Map<?, ?> props) {
    Map<String, Object> values = new HashMap<>();
    for (ConfigKey key : _configKeys.values()) {
      Object value = props.containsKey(key._name) ? key._type.parse(key._name, props.get(key._name)) : key._defaultValue;
      key.validate(value);
      values.put(key._name, value);
    }
    return values;
  }

  /**
   * The config types. Each type parses the string form of its values and accepts the typed form as is.
   */
  public enum Type {
    STRING {
      @Override
      Object parseTyped(String name, Object value) {
        if (value instanceof String) {
          return ((String) value).trim();
        }
        throw new ConfigException(name, value, "Expected a string, got a " + value.getClass().getName());
      }
    },
    INT {
      @Override
      Object parseTyped(String name, Object value) {
        if (value instanceof Integer) {
          return value;
        }
        if (value instanceof String) {
          return Integer.parseInt(((String) value).trim());
        }
        throw new ConfigException(name, value, "Expected a 32-bit integer, got a " + value.getClass().getName());
      }
    },
    DOUBLE {
      @Override
      Object parseTyped(String name, Object value) {
        if (value instanceof Number) {
          return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
          return Double.parseDouble(((String) value).trim());
        }
        throw new ConfigException(name, value, "Expected a double, got a " + value.getClass().getName());
      }
    },
    LIST {
      @Override
      Object parseTyped(String name, Object value) {
        if (value instanceof List) {
          return value;
        }
        if (value instanceof String) {
          String trimmed = ((String) value).trim();
          return trimmed.isEmpty() ? Collections.emptyList() : Arrays.asList(trimmed.split("\\s*,\\s*", -1));
        }
        throw new ConfigException(name, value, "Expected a comma separated list.");
      }
    },
    CLASS {
      @Override
      Object parseTyped(String name, Object value) {
        if (value instanceof Class) {
          return value;
        }
        if (value instanceof String) {
          String className = ((String) value).trim();
          try {
            return Class.forName(className, true, Utils.getContextOrMetricWatchClassLoader());
          } catch (ClassNotFoundException e) {
            throw new ConfigException(name, value, "Class " + className + " could not be found.");
          }
        }
        throw new ConfigException(name, value, "Expected a Class instance or class name.");
      }
    };

    abstract Object parseTyped(String name, Object value);

    /**
     * @param name Name of the key.
     * @param value The value to parse, may be {@code null}.
     * @return The value of this type, {@code null} for a {@code null} value.
     * @throws ConfigException if the value is not of this type.
     */
    public Object parse(String name, Object value) {
      if (value == null) {
        return null;
      }
      try {
        return parseTyped(name, value);
      } catch (NumberFormatException e) {
        throw new ConfigException(name, value, "Not a number of type " + this);
      }
    }
  }

  /**
   * The importance level for a configuration
   */
  public enum Importance {
    HIGH, MEDIUM, LOW
  }

  /**
   * Checks a single parsed value.
   */
  public interface Validator {
    /**
     * @param name The name of the configuration
     * @param value The parsed value of the configuration
     * @throws ConfigException if the value is invalid.
     */
    void ensureValid(String name, Object value);
  }

  /**
   * Bounds of a numeric value, inclusive.
   */
  public static final class Range implements Validator {
    private final Number _min;
    private final Number _max;
    private final boolean _nullable;

    private Range(Number min, Number max, boolean nullable) {
      _min = min;
      _max = max;
      _nullable = nullable;
    }

    public static Range atLeast(Number min) {
      return new Range(min, null, false);
    }

    public static Range between(Number min, Number max) {
      return new Range(min, max, false);
    }

    /**
     * Same as {@link #between(Number, Number)}, but an unset value is accepted. Used by the configurations whose
     * absence means the value is derived from another configuration.
     *
     * @param min Minimum bound.
     * @param max Maximum bound.
     * @return A numeric range that accepts null.
     */
    public static Range nullOrBetween(Number min, Number max) {
      return new Range(min, max, true);
    }

    @Override
    public void ensureValid(String name, Object value) {
      if (value == null) {
        if (!_nullable) {
          throw new ConfigException(name, null, "Value must be non-null");
        }
        return;
      }
      double number = ((Number) value).doubleValue();
      if ((_min != null && number < _min.doubleValue()) || (_max != null && number > _max.doubleValue())) {
        throw new ConfigException(name, value, "Value must be in " + this);
      }
    }

    @Override
    public String toString() {
      return "[" + (_min == null ? "..." : _min) + "," + (_max == null ? "..." : _max) + "]";
    }
  }

  /**
   * Accepts one of a fixed set of strings.
   */
  public static final class ValidString implements Validator {
    private final List<String> _validStrings;

    private ValidString(List<String> validStrings) {
      _validStrings = validStrings;
    }

    public static ValidString in(String... validStrings) {
      return new ValidString(Arrays.asList(validStrings));
    }

    @Override
    public void ensureValid(String name, Object value) {
      if (!_validStrings.contains(value)) {
        throw new ConfigException(name, value, "String must be one of: " + Utils.join(_validStrings, ", "));
      }
    }

    @Override
    public String toString() {
      return "[" + Utils.join(_validStrings, ", ") + "]";
    }
  }

  private static final class ConfigKey {
    private final String _name;
    private final Type _type;
    private final Object _defaultValue;
    private final Validator _validator;
    private final Importance _importance;
    private final String _documentation;

    ConfigKey(String name, Type type, Object defaultValue, Validator validator, Importance importance,
              String documentation) {
      _name = name;
      _type = type;
      _defaultValue = type.parse(name, defaultValue);
      _validator = validator;
      _importance = importance;
      _documentation = documentation;
      validate(_defaultValue);
    }

    void validate(Object value) {
      if (_validator != null) {
        _validator.ensureValid(_name, value);
      }
    }

    @Override
    public String toString() {
      return String.format("%s (%s, default %s, %s importance): %s", _name, _type, _defaultValue, _importance,
                           _documentation);
    }
  }
}
