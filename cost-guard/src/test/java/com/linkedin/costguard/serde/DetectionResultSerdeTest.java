/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.serde;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.linkedin.costguard.detector.baseline.BaselineDetector;
import com.linkedin.costguard.detector.changepoint.ChangepointDetector;
import com.linkedin.costguard.detector.changepoint.Segment;
import com.linkedin.costguard.detector.ensemble.EnsembleDetector;
import com.linkedin.costguard.detector.ensemble.EnsembleResult;
import com.linkedin.costguard.detector.reporter.NoopDetectionReporter;
import com.linkedin.costguard.model.TimeSeries;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.Test;

import static com.linkedin.costguard.CostGuardTestUtils.COST;
import static com.linkedin.costguard.CostGuardTestUtils.START;
import static com.linkedin.costguard.CostGuardTestUtils.config;
import static com.linkedin.costguard.CostGuardTestUtils.dailyCosts;
import static com.linkedin.costguard.CostGuardTestUtils.levelShift;
import static com.linkedin.costguard.CostGuardTestUtils.spikeBeforeShift;
import static com.linkedin.costguard.CostGuardTestUtils.taggedDailyCosts;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;


public class DetectionResultSerdeTest {
  private static final double DELTA = 1E-9;
  private final DetectionResultSerde _serde = new DetectionResultSerde();

  private static EnsembleResult ensembleResult(TimeSeries series) {
    return new EnsembleDetector(config(), new NoopDetectionReporter()).detect(series, COST);
  }

  @Test
  public void testEnsembleResult() {
    Map<String, String> dimensions = new HashMap<>();
    dimensions.put("team", "data");
    dimensions.put("service", "storage");
    EnsembleResult result = ensembleResult(new TimeSeries(taggedDailyCosts(dimensions, spikeBeforeShift())));
    JsonObject json = _serde.toJsonTree(result).getAsJsonObject();

    assertEquals(Arrays.asList("baseline_anomalies", "changepoint_events", "high_confidence_anomalies", "total_anomalies",
                               "total_changepoints", "high_confidence_count"), Arrays.asList(json.keySet().toArray()));
    assertEquals(result.totalAnomalies(), json.get("total_anomalies").getAsInt());
    assertEquals(result.highConfidenceCount(), json.getAsJsonArray("high_confidence_anomalies").size());

    JsonObject alert = json.getAsJsonArray("baseline_anomalies").get(0).getAsJsonObject();
    assertEquals(Arrays.asList("timestamp", "metric_name", "actual_value", "expected_value", "deviation_percent", "severity",
                               "confidence", "dimensions", "message"), Arrays.asList(alert.keySet().toArray()));
    assertEquals("2024-01-26", alert.get("timestamp").getAsString());
    assertEquals("cost", alert.get("metric_name").getAsString());
    assertEquals(400.0, alert.get("deviation_percent").getAsDouble(), DELTA);
    assertEquals("critical", alert.get("severity").getAsString());
    assertEquals("{\"service\":\"storage\",\"team\":\"data\"}", alert.get("dimensions").toString());

    JsonObject changePoint = json.getAsJsonArray("changepoint_events").get(0).getAsJsonObject();
    assertEquals(25, changePoint.get("index").getAsInt());
    assertEquals(100.0, changePoint.get("before_mean").getAsDouble(), DELTA);
    assertEquals(300.0, changePoint.get("after_mean").getAsDouble(), DELTA);
    assertEquals("increase", changePoint.get("change_type").getAsString());
    assertEquals("optimal", changePoint.get("method").getAsString());

    JsonObject highConfidence = json.getAsJsonArray("high_confidence_anomalies").get(0).getAsJsonObject();
    assertEquals("high_confidence_anomaly", highConfidence.get("type").getAsString());
    assertEquals("critical", highConfidence.get("baseline_severity").getAsString());
    assertEquals(400.0, highConfidence.get("baseline_deviation").getAsDouble(), DELTA);
    assertEquals("2024-01-26", highConfidence.get("changepoint_timestamp").getAsString());
    assertEquals(200.0, highConfidence.get("change_percent").getAsDouble(), DELTA);
    assertTrue(highConfidence.get("message").getAsString().startsWith("High-confidence anomaly"));
    assertEquals("storage", highConfidence.getAsJsonObject("dimensions").get("service").getAsString());
  }

  @Test
  public void testSegments() {
    ChangepointDetector detector = new ChangepointDetector(config(), new NoopDetectionReporter());
    List<Segment> segments = detector.analyzeSegments(dailyCosts(levelShift()), Collections.singletonList(20), COST);
    JsonArray json = JsonParser.parseString(_serde.toJson(segments)).getAsJsonArray();
    assertEquals(2, json.size());
    JsonObject second = json.get(1).getAsJsonObject();
    assertEquals(Arrays.asList("segment_number", "start_timestamp", "end_timestamp", "mean", "median", "std", "min", "max",
                               "sum", "count"), Arrays.asList(second.keySet().toArray()));
    assertEquals(2, second.get("segment_number").getAsInt());
    assertEquals("2024-01-21", second.get("start_timestamp").getAsString());
    assertEquals("2024-02-09", second.get("end_timestamp").getAsString());
    assertEquals(3000.0, second.get("sum").getAsDouble(), DELTA);
    assertEquals(20, second.get("count").getAsInt());
  }

  @Test
  public void testResultsByDimensionAndForecast() {
    BaselineDetector detector = new BaselineDetector(config(), new NoopDetectionReporter());
    TimeSeries series = new TimeSeries(taggedDailyCosts(Map.of("service", "storage"), spikeBeforeShift()));
    JsonObject byDimension = _serde.toJsonTree(detector.detectByDimension(series, "service", COST)).getAsJsonObject();
    assertEquals("storage", byDimension.getAsJsonArray("storage").get(0).getAsJsonObject()
                                       .getAsJsonObject("dimensions").get("service").getAsString());

    JsonArray forecast = _serde.toJsonTree(detector.forecast(series, 2, COST)).getAsJsonArray();
    assertEquals(2, forecast.size());
    assertEquals(START.plusDays(47).toString(), forecast.get(0).getAsJsonObject().get("timestamp").getAsString());
    assertEquals(300.0, forecast.get(1).getAsJsonObject().get("forecast").getAsDouble(), DELTA);
    assertEquals("\"2024-01-01\"", _serde.toJson(START));
  }

  @Test
  public void testSerializeIsDeterministic() {
    Map<String, String> forward = new HashMap<>();
    forward.put("service", "storage");
    forward.put("team", "data");
    forward.put("region", "us-east-1");
    Map<String, String> backward = new TreeMap<>(Comparator.reverseOrder());
    backward.putAll(forward);
    byte[] first = _serde.serialize(ensembleResult(new TimeSeries(taggedDailyCosts(forward, spikeBeforeShift()))));
    byte[] second = _serde.serialize(ensembleResult(new TimeSeries(taggedDailyCosts(backward, spikeBeforeShift()))));
    assertEquals(new String(first, StandardCharsets.UTF_8), new String(second, StandardCharsets.UTF_8));
  }

  @Test
  public void testPrettyPrinting() {
    String json = new DetectionResultSerde(true).toJson(ensembleResult(dailyCosts(spikeBeforeShift())));
    assertTrue(json.contains("\n  \"total_anomalies\""));
  }
}
