/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.engine.detector;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.linkedin.metricwatch.engine.detector.estimator.EstimatorType;
import com.linkedin.metricwatch.exception.CorruptPersistedStateException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Maps the anomaly records to and from their persisted JSON layout {@code {"anomalies": [record, ...]}}. Times are
 * written as fractional epoch seconds, enums in lower case. Unknown fields are ignored. A record without an id, a
 * metric name, a time, an observed value or a known severity and status is skipped.
 */
public class AnomalyLedgerSerde {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyLedgerSerde.class);
  public static final String ANOMALIES = "anomalies";
  public static final String ID = "id";
  public static final String METRIC_NAME = "metric_name";
  public static final String TIMESTAMP = "timestamp";
  public static final String OBSERVED_VALUE = "observed_value";
  public static final String METHOD_SCORES = "method_scores";
  public static final String VOTES = "votes";
  public static final String CONFIDENCE = "confidence";
  public static final String SEVERITY = "severity";
  public static final String STATUS = "status";
  public static final String RESOLUTION_NOTES = "resolution_notes";
  public static final String CREATED_AT = "created_at";
  public static final String ACKNOWLEDGED_AT = "acknowledged_at";
  public static final String RESOLVED_AT = "resolved_at";
  private final Gson _gson;

  public AnomalyLedgerSerde() {
    _gson = new GsonBuilder().setPrettyPrinting().create();
  }

  /**
   * @param records Anomaly records, oldest first.
   * @return The JSON document.
   */
  public String serialize(List<AnomalyRecord> records) {
    JsonArray anomalies = new JsonArray();
    for (AnomalyRecord record : records) {
      anomalies.add(toJson(record));
    }
    JsonObject root = new JsonObject();
    root.add(ANOMALIES, anomalies);
    return _gson.toJson(root);
  }

  /**
   * @param json The JSON document.
   * @return The valid anomaly records in document order.
   * @throws CorruptPersistedStateException if the document is not a JSON object with an array of anomalies.
   */
  public List<AnomalyRecord> deserialize(String json) throws CorruptPersistedStateException {
    JsonElement root;
    try {
      root = JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new CorruptPersistedStateException("Anomaly ledger is not valid JSON.", e);
    }
    if (!root.isJsonObject()) {
      throw new CorruptPersistedStateException("Anomaly ledger must be a JSON object, got " + root);
    }
    JsonElement anomalies = root.getAsJsonObject().get(ANOMALIES);
    if (anomalies == null || !anomalies.isJsonArray()) {
      throw new CorruptPersistedStateException("Anomaly ledger does not have an array of " + ANOMALIES + ".");
    }

    List<AnomalyRecord> records = new ArrayList<>();
    int skipped = 0;
    for (JsonElement element : anomalies.getAsJsonArray()) {
      AnomalyRecord record = element.isJsonObject() ? fromJson(element.getAsJsonObject()) : null;
      if (record == null) {
        skipped++;
      } else {
        records.add(record);
      }
    }
    if (skipped > 0) {
      LOG.warn("Skipped {} invalid records of the persisted anomaly ledger.", skipped);
    }
    return records;
  }

  private static JsonObject toJson(AnomalyRecord record) {
    JsonObject object = new JsonObject();
    object.addProperty(ID, record.id());
    object.addProperty(METRIC_NAME, record.metricName());
    object.addProperty(TIMESTAMP, toSeconds(record.timeMs()));
    object.addProperty(OBSERVED_VALUE, record.observedValue());
    JsonObject scores = new JsonObject();
    for (Map.Entry<EstimatorType, Double> entry : record.methodScores().entrySet()) {
      scores.addProperty(entry.getKey().persistedName(), entry.getValue());
    }
    object.add(METHOD_SCORES, scores);
    object.addProperty(VOTES, record.votes());
    object.addProperty(CONFIDENCE, record.confidence());
    object.addProperty(SEVERITY, record.severity().name().toLowerCase(Locale.ROOT));
    object.addProperty(STATUS, record.status().name().toLowerCase(Locale.ROOT));
    if (record.resolutionNotes() != null) {
      object.addProperty(RESOLUTION_NOTES, record.resolutionNotes());
    }
    object.addProperty(CREATED_AT, toSeconds(record.createdAtMs()));
    if (record.acknowledgedAtMs() != null) {
      object.addProperty(ACKNOWLEDGED_AT, toSeconds(record.acknowledgedAtMs()));
    }
    if (record.resolvedAtMs() != null) {
      object.addProperty(RESOLVED_AT, toSeconds(record.resolvedAtMs()));
    }
    return object;
  }

  private static AnomalyRecord fromJson(JsonObject object) {
    String id = string(object, ID);
    String metricName = string(object, METRIC_NAME);
    Long timeMs = millis(object, TIMESTAMP);
    Double observedValue = number(object, OBSERVED_VALUE);
    AnomalySeverity severity = enumValue(AnomalySeverity.class, string(object, SEVERITY));
    AnomalyStatus status = enumValue(AnomalyStatus.class, string(object, STATUS));
    if (id == null || metricName == null || timeMs == null || observedValue == null || severity == null || status == null) {
      return null;
    }

    Map<EstimatorType, Double> scores = new EnumMap<>(EstimatorType.class);
    JsonElement scoresElement = object.get(METHOD_SCORES);
    if (scoresElement != null && scoresElement.isJsonObject()) {
      JsonObject scoresObject = scoresElement.getAsJsonObject();
      for (String name : scoresObject.keySet()) {
        EstimatorType type = EstimatorType.forPersistedName(name);
        Double score = number(scoresObject, name);
        if (type != null && score != null) {
          scores.put(type, score);
        }
      }
    }
    Double votes = number(object, VOTES);
    Double confidence = number(object, CONFIDENCE);
    Long createdAtMs = millis(object, CREATED_AT);
    return new AnomalyRecord(id, metricName, timeMs, observedValue, scores, votes == null ? 0 : votes.intValue(),
                             confidence == null ? 0.0 : confidence, severity, status, string(object, RESOLUTION_NOTES),
                             createdAtMs == null ? timeMs : createdAtMs, millis(object, ACKNOWLEDGED_AT),
                             millis(object, RESOLVED_AT));
  }

  private static double toSeconds(long timeMs) {
    return timeMs / 1000.0;
  }

  private static String string(JsonObject object, String key) {
    JsonElement element = object.get(key);
    if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
      return null;
    }
    return element.getAsString();
  }

  private static Double number(JsonObject object, String key) {
    JsonElement element = object.get(key);
    if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
      return null;
    }
    double d = element.getAsDouble();
    return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
  }

  private static Long millis(JsonObject object, String key) {
    Double seconds = number(object, key);
    return seconds == null ? null : Math.round(seconds * 1000.0);
  }

  private static <E extends Enum<E>> E enumValue(Class<E> enumClass, String name) {
    if (name == null) {
      return null;
    }
    for (E constant : enumClass.getEnumConstants()) {
      if (constant.name().equalsIgnoreCase(name)) {
        return constant;
      }
    }
    return null;
  }
}
