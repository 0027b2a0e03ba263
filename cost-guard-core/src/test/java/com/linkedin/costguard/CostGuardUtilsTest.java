/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard;

import java.time.LocalDate;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;


public class CostGuardUtilsTest {
  private static final double DELTA = 1E-9;

  @Test
  public void testPercentChange() {
    assertEquals(400.0, CostGuardUtils.percentChange(100.0, 500.0), DELTA);
    assertEquals(-50.0, CostGuardUtils.percentChange(100.0, 50.0), DELTA);
    assertEquals(0.0, CostGuardUtils.percentChange(80.0, 80.0), DELTA);
  }

  @Test
  public void testPercentChangeOfNonPositiveBaseIsZero() {
    assertEquals(0.0, CostGuardUtils.percentChange(0.0, 500.0), DELTA);
    assertEquals(0.0, CostGuardUtils.percentChange(-10.0, 500.0), DELTA);
  }

  @Test
  public void testAbsoluteDaysBetween() {
    LocalDate day = LocalDate.of(2024, 2, 27);
    assertEquals(3L, CostGuardUtils.absoluteDaysBetween(day, day.plusDays(3)));
    assertEquals(3L, CostGuardUtils.absoluteDaysBetween(day.plusDays(3), day));
    assertEquals(0L, CostGuardUtils.absoluteDaysBetween(day, day));
  }

  @Test
  public void testCapitalize() {
    assertEquals("Cost", CostGuardUtils.capitalize("cost"));
    assertEquals("", CostGuardUtils.capitalize(""));
  }

  @Test
  public void testEnsureValidString() {
    CostGuardUtils.ensureValidString("field", "cost");
    assertThrows(IllegalArgumentException.class, () -> CostGuardUtils.ensureValidString("field", null));
    assertThrows(IllegalArgumentException.class, () -> CostGuardUtils.ensureValidString("field", ""));
  }
}
