/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard;

import com.linkedin.costguard.config.CostGuardConfig;
import com.linkedin.costguard.model.CostRecord;
import com.linkedin.costguard.model.TimeSeries;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;


/**
 * Series and configurations shared by the detector tests.
 */
public final class CostGuardTestUtils {
  public static final LocalDate START = LocalDate.of(2024, 1, 1);
  public static final String COST = "cost";

  private CostGuardTestUtils() {

  }

  /**
   * @param keyValues Alternating configuration keys and values to override the defaults with.
   * @return A configuration that reports nothing.
   */
  public static CostGuardConfig config(String... keyValues) {
    Properties props = new Properties();
    props.setProperty(CostGuardConfig.DETECTION_REPORTER_CLASS_CONFIG,
                      "com.linkedin.costguard.detector.reporter.NoopDetectionReporter");
    for (int i = 0; i < keyValues.length; i += 2) {
      props.setProperty(keyValues[i], keyValues[i + 1]);
    }
    return new CostGuardConfig(props, false);
  }

  /**
   * @param value Value to repeat.
   * @param count Number of repetitions.
   * @return An array holding the given value the given number of times.
   */
  public static double[] repeat(double value, int count) {
    double[] values = new double[count];
    Arrays.fill(values, value);
    return values;
  }

  public static double[] concat(double[]... parts) {
    int length = 0;
    for (double[] part : parts) {
      length += part.length;
    }
    double[] values = new double[length];
    int offset = 0;
    for (double[] part : parts) {
      System.arraycopy(part, 0, values, offset, part.length);
      offset += part.length;
    }
    return values;
  }

  /**
   * @param values Daily costs, the first one on {@link #START}.
   * @return A series with the given daily costs.
   */
  public static TimeSeries dailyCosts(double... values) {
    return TimeSeries.daily(START, COST, values);
  }

  /**
   * @param dimensions Dimension tags of every record.
   * @param values Daily costs, the first one on {@link #START}.
   * @return Records with the given daily costs and dimension tags.
   */
  public static List<CostRecord> taggedDailyCosts(Map<String, String> dimensions, double... values) {
    List<CostRecord> records = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      records.add(CostRecord.of(START.plusDays(i), COST, values[i], dimensions));
    }
    return records;
  }

  /**
   * 20 days at 100, a single day at 500, then 19 days at 100.
   */
  public static double[] isolatedSpike() {
    return concat(repeat(100.0, 20), new double[]{500.0}, repeat(100.0, 19));
  }

  /**
   * 20 days at 50 followed by 20 days at 150.
   */
  public static double[] levelShift() {
    return concat(repeat(50.0, 20), repeat(150.0, 20));
  }

  /**
   * 25 days at 100, a spike of 500 on day 25, back to 100 on day 26, then 20 days at 300.
   */
  public static double[] spikeBeforeShift() {
    return concat(repeat(100.0, 25), new double[]{500.0, 100.0}, repeat(300.0, 20));
  }
}
