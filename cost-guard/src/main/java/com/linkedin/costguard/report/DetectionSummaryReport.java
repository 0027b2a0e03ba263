/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.report;

import com.linkedin.costguard.detector.baseline.AnomalyAlert;
import com.linkedin.costguard.detector.changepoint.ChangePointEvent;
import com.linkedin.costguard.detector.ensemble.EnsembleResult;
import com.linkedin.costguard.detector.ensemble.HighConfidenceEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static com.linkedin.costguard.common.utils.Utils.validateNotNull;


/**
 * A human readable summary of an {@link EnsembleResult}.
 */
public final class DetectionSummaryReport {
  static final String RULE = String.join("", Collections.nCopies(70, "="));
  static final String SEPARATOR = String.join("", Collections.nCopies(70, "-"));
  static final String TITLE = "ANOMALY DETECTION SUMMARY";

  private DetectionSummaryReport() {

  }

  /**
   * @param result The result to summarize.
   * @return The summary: the totals, followed by a block per high-confidence anomaly and per change point.
   */
  public static String generate(EnsembleResult result) {
    validateNotNull(result, "Result cannot be null.");
    List<String> lines = new ArrayList<>();
    lines.add(RULE);
    lines.add(TITLE);
    lines.add(RULE);
    lines.add("");
    lines.add("Total Baseline Anomalies: " + result.totalAnomalies());
    lines.add("Total Change Points: " + result.totalChangePoints());
    lines.add("High-Confidence Anomalies: " + result.highConfidenceCount());
    lines.add("");

    if (!result.highConfidenceEvents().isEmpty()) {
      lines.add("HIGH-CONFIDENCE ANOMALIES:");
      lines.add(SEPARATOR);
      for (HighConfidenceEvent event : result.highConfidenceEvents()) {
        AnomalyAlert alert = event.alert();
        lines.add("  Date: " + event.timestamp());
        lines.add("  Severity: " + alert.severity());
        lines.add(String.format(Locale.ROOT, "  Cost: $%.2f (expected: $%.2f)", alert.actualValue(), alert.expectedValue()));
        lines.add(String.format(Locale.ROOT, "  Deviation: %+.1f%%", alert.deviationPercent()));
        lines.add("");
      }
    }

    if (!result.changePointEvents().isEmpty()) {
      lines.add("STRUCTURAL CHANGES:");
      lines.add(SEPARATOR);
      for (ChangePointEvent event : result.changePointEvents()) {
        lines.add("  Date: " + event.timestamp());
        lines.add("  Type: " + event.changeType());
        lines.add("  Severity: " + event.severity());
        lines.add(String.format(Locale.ROOT, "  Change: $%.2f -> $%.2f (%+.1f%%)", event.beforeMean(), event.afterMean(),
                                event.changePercent()));
        lines.add("");
      }
    }

    lines.add(RULE);
    return String.join("\n", lines);
  }
}
