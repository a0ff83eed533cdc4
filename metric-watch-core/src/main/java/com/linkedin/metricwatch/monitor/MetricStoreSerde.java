/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.monitor;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.linkedin.metricwatch.exception.CorruptPersistedStateException;
import com.linkedin.metricwatch.monitor.sampling.MetricSample;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Maps the retained metric history to and from its persisted JSON layout:
 * <pre>
 *   {
 *     "metric_name": [{"t": epoch_seconds, "v": value}, ...],
 *     ...
 *   }
 * </pre>
 * Times are written as fractional epoch seconds. Unknown fields of an entry are ignored. An entry without a finite
 * numeric time and value is skipped, the rest of the document is still used.
 */
public class MetricStoreSerde {
  private static final Logger LOG = LoggerFactory.getLogger(MetricStoreSerde.class);
  public static final String TIME = "t";
  public static final String VALUE = "v";
  private final Gson _gson;

  public MetricStoreSerde() {
    _gson = new GsonBuilder().setPrettyPrinting().create();
  }

  /**
   * @param samplesByMetric The samples of each metric, oldest first.
   * @return The JSON document.
   */
  public String serialize(Map<String, List<MetricSample>> samplesByMetric) {
    JsonObject root = new JsonObject();
    for (Map.Entry<String, List<MetricSample>> entry : samplesByMetric.entrySet()) {
      JsonArray samples = new JsonArray();
      for (MetricSample sample : entry.getValue()) {
        JsonObject s = new JsonObject();
        s.add(TIME, new JsonPrimitive(sample.timeMs() / 1000.0));
        s.add(VALUE, new JsonPrimitive(sample.value()));
        samples.add(s);
      }
      root.add(entry.getKey(), samples);
    }
    return _gson.toJson(root);
  }

  /**
   * @param json The JSON document.
   * @return The samples of each metric in document order.
   * @throws CorruptPersistedStateException if the document is not a JSON object.
   */
  public Map<String, List<MetricSample>> deserialize(String json) throws CorruptPersistedStateException {
    JsonElement root;
    try {
      root = JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new CorruptPersistedStateException("Metric history is not valid JSON.", e);
    }
    if (!root.isJsonObject()) {
      throw new CorruptPersistedStateException("Metric history must be a JSON object, got " + root);
    }

    Map<String, List<MetricSample>> samplesByMetric = new LinkedHashMap<>();
    int skipped = 0;
    for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject().entrySet()) {
      String metricName = entry.getKey();
      if (!entry.getValue().isJsonArray()) {
        LOG.warn("Skip persisted history of metric {}, it is not a JSON array.", metricName);
        continue;
      }
      List<MetricSample> samples = new ArrayList<>();
      for (JsonElement element : entry.getValue().getAsJsonArray()) {
        MetricSample sample = toSample(metricName, element);
        if (sample == null) {
          skipped++;
        } else {
          samples.add(sample);
        }
      }
      samplesByMetric.put(metricName, samples);
    }
    if (skipped > 0) {
      LOG.warn("Skipped {} invalid entries of the persisted metric history.", skipped);
    }
    return samplesByMetric;
  }

  private static MetricSample toSample(String metricName, JsonElement element) {
    if (!element.isJsonObject()) {
      return null;
    }
    JsonObject object = element.getAsJsonObject();
    Double time = finiteNumber(object.get(TIME));
    Double value = finiteNumber(object.get(VALUE));
    if (time == null || value == null) {
      return null;
    }
    return new MetricSample(metricName, Math.round(time * 1000.0), value);
  }

  private static Double finiteNumber(JsonElement element) {
    if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
      return null;
    }
    double d = element.getAsDouble();
    return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
  }
}
