/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.serde;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.linkedin.costguard.detector.DetectionResult;
import com.linkedin.costguard.detector.baseline.AnomalyAlert;
import com.linkedin.costguard.detector.baseline.ForecastPoint;
import com.linkedin.costguard.detector.changepoint.ChangePointEvent;
import com.linkedin.costguard.detector.changepoint.Segment;
import com.linkedin.costguard.detector.ensemble.EnsembleResult;
import com.linkedin.costguard.detector.ensemble.HighConfidenceEvent;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Map;


/**
 * A serializer of detection output to flat JSON objects with snake_case field names. Dates are written as ISO-8601
 * dates and dimension maps are written in key order, so equal inputs always give byte-identical output.
 */
public class DetectionResultSerde {
  public static final String TIMESTAMP = "timestamp";
  public static final String DIMENSIONS = "dimensions";
  public static final String MESSAGE = "message";
  public static final String SEVERITY = "severity";
  public static final String CONFIDENCE = "confidence";
  public static final String ACTUAL_VALUE = "actual_value";
  public static final String EXPECTED_VALUE = "expected_value";
  public static final String CHANGE_PERCENT = "change_percent";
  public static final String CHANGE_TYPE = "change_type";
  private final Gson _gson;

  public DetectionResultSerde() {
    this(false);
  }

  /**
   * @param prettyPrint {@code true} to indent the output.
   */
  public DetectionResultSerde(boolean prettyPrint) {
    GsonBuilder builder = new GsonBuilder()
        .registerTypeAdapter(LocalDate.class, new LocalDateSerializer())
        .registerTypeAdapter(AnomalyAlert.class, new AnomalyAlertSerializer())
        .registerTypeAdapter(ChangePointEvent.class, new ChangePointEventSerializer())
        .registerTypeAdapter(Segment.class, new SegmentSerializer())
        .registerTypeAdapter(HighConfidenceEvent.class, new HighConfidenceEventSerializer())
        .registerTypeAdapter(EnsembleResult.class, new EnsembleResultSerializer())
        .registerTypeAdapter(ForecastPoint.class, new ForecastPointSerializer())
        .registerTypeHierarchyAdapter(DetectionResult.class, new DetectionResultSerializer());
    if (prettyPrint) {
      builder.setPrettyPrinting();
    }
    _gson = builder.create();
  }

  /**
   * @param output Any detection output, e.g. an {@link EnsembleResult}, a {@link DetectionResult}, a list of
   *               {@link Segment}s or a map of results by dimension value.
   * @return The JSON representation of the given output.
   */
  public String toJson(Object output) {
    return _gson.toJson(output);
  }

  public JsonElement toJsonTree(Object output) {
    return _gson.toJsonTree(output);
  }

  public byte[] serialize(Object output) {
    return toJson(output).getBytes(StandardCharsets.UTF_8);
  }

  private static JsonObject dimensions(Map<String, String> dimensions) {
    JsonObject result = new JsonObject();
    dimensions.forEach(result::addProperty);
    return result;
  }

  /**
   * Writes dates as {@code yyyy-MM-dd}.
   */
  static class LocalDateSerializer implements JsonSerializer<LocalDate> {
    @Override
    public JsonElement serialize(LocalDate date, Type typeOfSrc, JsonSerializationContext context) {
      return new JsonPrimitive(date.toString());
    }
  }

  /**
   * Writes the detected items of a result as an array.
   */
  static class DetectionResultSerializer implements JsonSerializer<DetectionResult<?>> {
    @Override
    public JsonElement serialize(DetectionResult<?> result, Type typeOfSrc, JsonSerializationContext context) {
      JsonArray items = new JsonArray();
      for (Object item : result) {
        items.add(context.serialize(item, item.getClass()));
      }
      return items;
    }
  }

  static class AnomalyAlertSerializer implements JsonSerializer<AnomalyAlert> {
    @Override
    public JsonElement serialize(AnomalyAlert alert, Type typeOfSrc, JsonSerializationContext context) {
      JsonObject result = new JsonObject();
      result.addProperty(TIMESTAMP, alert.timestamp().toString());
      result.addProperty("metric_name", alert.metricName());
      result.addProperty(ACTUAL_VALUE, alert.actualValue());
      result.addProperty(EXPECTED_VALUE, alert.expectedValue());
      result.addProperty("deviation_percent", alert.deviationPercent());
      result.addProperty(SEVERITY, alert.severity().toString());
      result.addProperty(CONFIDENCE, alert.confidence());
      result.add(DIMENSIONS, dimensions(alert.dimensions()));
      result.addProperty(MESSAGE, alert.message());
      return result;
    }
  }

  static class ChangePointEventSerializer implements JsonSerializer<ChangePointEvent> {
    @Override
    public JsonElement serialize(ChangePointEvent event, Type typeOfSrc, JsonSerializationContext context) {
      JsonObject result = new JsonObject();
      result.addProperty(TIMESTAMP, event.timestamp().toString());
      result.addProperty("index", event.index());
      result.addProperty("before_mean", event.beforeMean());
      result.addProperty("after_mean", event.afterMean());
      result.addProperty(CHANGE_PERCENT, event.changePercent());
      result.addProperty(CHANGE_TYPE, event.changeType().toString());
      result.addProperty(SEVERITY, event.severity().toString());
      result.addProperty("method", event.method());
      result.addProperty(MESSAGE, event.message());
      return result;
    }
  }

  static class SegmentSerializer implements JsonSerializer<Segment> {
    @Override
    public JsonElement serialize(Segment segment, Type typeOfSrc, JsonSerializationContext context) {
      JsonObject result = new JsonObject();
      result.addProperty("segment_number", segment.segmentNumber());
      result.addProperty("start_timestamp", segment.startTimestamp().toString());
      result.addProperty("end_timestamp", segment.endTimestamp().toString());
      result.addProperty("mean", segment.mean());
      result.addProperty("median", segment.median());
      result.addProperty("std", segment.stdDev());
      result.addProperty("min", segment.min());
      result.addProperty("max", segment.max());
      result.addProperty("sum", segment.sum());
      result.addProperty("count", segment.count());
      return result;
    }
  }

  static class HighConfidenceEventSerializer implements JsonSerializer<HighConfidenceEvent> {
    @Override
    public JsonElement serialize(HighConfidenceEvent event, Type typeOfSrc, JsonSerializationContext context) {
      AnomalyAlert alert = event.alert();
      ChangePointEvent changePoint = event.changePoint();
      JsonObject result = new JsonObject();
      result.addProperty(TIMESTAMP, event.timestamp().toString());
      result.addProperty("type", HighConfidenceEvent.TYPE);
      result.addProperty("baseline_severity", alert.severity().toString());
      result.addProperty("baseline_deviation", alert.deviationPercent());
      result.addProperty(ACTUAL_VALUE, alert.actualValue());
      result.addProperty(EXPECTED_VALUE, alert.expectedValue());
      result.addProperty(CONFIDENCE, alert.confidence());
      result.addProperty("changepoint_timestamp", changePoint.timestamp().toString());
      result.addProperty(CHANGE_PERCENT, changePoint.changePercent());
      result.addProperty(CHANGE_TYPE, changePoint.changeType().toString());
      result.addProperty(MESSAGE, event.message());
      result.add(DIMENSIONS, dimensions(alert.dimensions()));
      return result;
    }
  }

  static class EnsembleResultSerializer implements JsonSerializer<EnsembleResult> {
    @Override
    public JsonElement serialize(EnsembleResult ensembleResult, Type typeOfSrc, JsonSerializationContext context) {
      JsonObject result = new JsonObject();
      result.add("baseline_anomalies", context.serialize(ensembleResult.baselineAnomalies(), DetectionResult.class));
      result.add("changepoint_events", context.serialize(ensembleResult.changePointEvents(), DetectionResult.class));
      JsonArray highConfidence = new JsonArray();
      ensembleResult.highConfidenceEvents().forEach(event -> highConfidence.add(context.serialize(event)));
      result.add("high_confidence_anomalies", highConfidence);
      result.addProperty("total_anomalies", ensembleResult.totalAnomalies());
      result.addProperty("total_changepoints", ensembleResult.totalChangePoints());
      result.addProperty("high_confidence_count", ensembleResult.highConfidenceCount());
      return result;
    }
  }

  static class ForecastPointSerializer implements JsonSerializer<ForecastPoint> {
    @Override
    public JsonElement serialize(ForecastPoint point, Type typeOfSrc, JsonSerializationContext context) {
      JsonObject result = new JsonObject();
      result.addProperty(TIMESTAMP, point.timestamp().toString());
      result.addProperty("forecast", point.forecast());
      return result;
    }
  }
}
