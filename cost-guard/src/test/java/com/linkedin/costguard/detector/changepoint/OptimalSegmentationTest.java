/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.changepoint;

import com.linkedin.costguard.config.CostGuardConfig;
import com.linkedin.costguard.exception.DependencyUnavailableException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import org.junit.Test;

import static com.linkedin.costguard.CostGuardTestUtils.concat;
import static com.linkedin.costguard.CostGuardTestUtils.isolatedSpike;
import static com.linkedin.costguard.CostGuardTestUtils.levelShift;
import static com.linkedin.costguard.CostGuardTestUtils.repeat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;


public class OptimalSegmentationTest {

  private static OptimalSegmentation segmentation(String... keyValues) {
    Map<String, Object> configs = new HashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      configs.put(keyValues[i], keyValues[i + 1]);
    }
    OptimalSegmentation segmentation = new OptimalSegmentation();
    segmentation.configure(configs);
    return segmentation;
  }

  private static double[] scale(double[] values, double factor) {
    double[] scaled = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      scaled[i] = values[i] * factor;
    }
    return scaled;
  }

  @Test
  public void testSingleShift() throws DependencyUnavailableException {
    assertEquals(Arrays.asList(20, 40), segmentation().breaks(levelShift()));
  }

  @Test
  public void testMultipleShifts() throws DependencyUnavailableException {
    double[] values = concat(repeat(0.0, 10), repeat(100.0, 10), repeat(0.0, 10));
    assertEquals(Arrays.asList(10, 20, 30), segmentation().breaks(values));
  }

  @Test
  public void testConstantSeries() throws DependencyUnavailableException {
    assertEquals(Collections.singletonList(30), segmentation().breaks(repeat(7.0, 30)));
  }

  @Test
  public void testPenaltyIsRelativeToNoiseLevel() throws DependencyUnavailableException {
    // Splitting gains 20 * 0.5^2 = 5 in squared error, about 5 noise variances at the 1% noise floor.
    double[] values = concat(repeat(100.0, 10), repeat(101.0, 10));
    assertEquals(Collections.singletonList(20), segmentation().breaks(values));
    assertEquals(Arrays.asList(10, 20), segmentation(CostGuardConfig.CHANGEPOINT_PENALTY_CONFIG, "1.0").breaks(values));
  }

  @Test
  public void testSegmentationIsScaleInvariant() throws DependencyUnavailableException {
    double[] step = concat(repeat(100.0, 10), repeat(101.0, 10));
    OptimalSegmentation lowPenalty = segmentation(CostGuardConfig.CHANGEPOINT_PENALTY_CONFIG, "1.0");
    for (double factor : new double[]{0.01, 10.0, 1000.0}) {
      assertEquals(Arrays.asList(20, 40), segmentation().breaks(scale(levelShift(), factor)));
      assertEquals(Collections.singletonList(20), segmentation().breaks(scale(step, factor)));
      assertEquals(Arrays.asList(10, 20), lowPenalty.breaks(scale(step, factor)));
    }
  }

  @Test
  public void testFlatNoisySeriesAtAnyLevel() throws DependencyUnavailableException {
    for (double level : new double[]{100.0, 1000.0, 10000.0, 1000000.0}) {
      for (int seed = 0; seed < 50; seed++) {
        Random random = new Random(seed);
        double[] values = new double[40];
        for (int i = 0; i < values.length; i++) {
          values[i] = level * (1.0 + (2.0 * random.nextDouble() - 1.0) * 0.0099);
        }
        assertEquals("level " + level + ", seed " + seed, Collections.singletonList(40), segmentation().breaks(values));
      }
    }
  }

  @Test
  public void testNoisierSeriesNeedLargerShifts() throws DependencyUnavailableException {
    // A shift of 3 under a +/-10 zigzag: the whole squared error is below one penalty.
    double[] values = new double[40];
    for (int i = 0; i < values.length; i++) {
      values[i] = (i < 20 ? 100.0 : 103.0) + (i % 2 == 0 ? 10.0 : -10.0);
    }
    assertEquals(Collections.singletonList(40), segmentation().breaks(values));
    assertEquals(Arrays.asList(20, 40), segmentation().breaks(concat(repeat(100.0, 20), repeat(103.0, 20))));
  }

  @Test
  public void testIsolatedSpikeIsSplitOut() throws DependencyUnavailableException {
    assertEquals(Arrays.asList(18, 21, 40), segmentation().breaks(isolatedSpike()));
  }

  @Test
  public void testNoiseEstimate() throws DependencyUnavailableException {
    // Day-over-day differences are all 4: 1.4826 * 4 / sqrt(2).
    assertEquals(4.193, OptimalSegmentation.noiseStdDev(new double[]{100.0, 104.0, 100.0, 104.0, 100.0}), 1E-3);
    assertEquals(1.0, OptimalSegmentation.noiseStdDev(levelShift()), 1E-12);
    assertEquals(0.0, OptimalSegmentation.noiseStdDev(repeat(0.0, 10)), 0.0);
    assertEquals(Collections.singletonList(10), segmentation().breaks(repeat(0.0, 10)));
  }

  @Test
  public void testMinSegmentLength() throws DependencyUnavailableException {
    double[] values = concat(repeat(0.0, 4), repeat(100.0, 4), repeat(0.0, 12));
    assertEquals(Arrays.asList(4, 8, 20), segmentation().breaks(values));
    // The 4-point block cannot be isolated, so the cheapest split keeps it with the leading zeros.
    assertEquals(Arrays.asList(8, 20),
                 segmentation(CostGuardConfig.CHANGEPOINT_MIN_SEGMENT_LENGTH_CONFIG, "5").breaks(values));
  }

  @Test
  public void testShortSeries() throws DependencyUnavailableException {
    assertEquals(Collections.singletonList(5), segmentation().breaks(new double[]{1.0, 9.0, 1.0, 9.0, 1.0}));
  }

  @Test
  public void testSeriesTooLong() {
    OptimalSegmentation segmentation = segmentation(CostGuardConfig.CHANGEPOINT_OPTIMAL_MAX_SERIES_LENGTH_CONFIG, "30");
    assertThrows(DependencyUnavailableException.class, () -> segmentation.breaks(levelShift()));
  }
}
