/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.costguard.detector.reporter;

import com.linkedin.costguard.detector.baseline.AnomalyAlert;
import com.linkedin.costguard.detector.baseline.BaselineDetector;
import com.linkedin.costguard.detector.changepoint.ChangePointEvent;
import com.linkedin.costguard.detector.changepoint.ChangepointDetector;
import com.linkedin.costguard.detector.ensemble.EnsembleDetector;
import com.linkedin.costguard.detector.ensemble.EnsembleResult;
import com.linkedin.costguard.detector.ensemble.HighConfidenceEvent;
import com.linkedin.costguard.exception.InsufficientDataException;
import java.util.Collections;
import org.easymock.Capture;
import org.easymock.CaptureType;
import org.easymock.EasyMock;
import org.junit.Test;

import static com.linkedin.costguard.CostGuardTestUtils.COST;
import static com.linkedin.costguard.CostGuardTestUtils.config;
import static com.linkedin.costguard.CostGuardTestUtils.dailyCosts;
import static com.linkedin.costguard.CostGuardTestUtils.spikeBeforeShift;
import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expectLastCall;
import static org.junit.Assert.assertEquals;


public class DetectionReporterTest {

  @Test
  public void testEveryFindingIsReported() {
    DetectionReporter reporter = EasyMock.mock(DetectionReporter.class);
    Capture<AnomalyAlert> alerts = Capture.newInstance(CaptureType.ALL);
    Capture<ChangePointEvent> changePoints = Capture.newInstance(CaptureType.ALL);
    Capture<HighConfidenceEvent> highConfidenceEvents = Capture.newInstance(CaptureType.ALL);
    reporter.onAnomalyAlert(capture(alerts));
    expectLastCall().atLeastOnce();
    reporter.onChangePoint(capture(changePoints));
    expectLastCall().once();
    reporter.onHighConfidenceEvent(capture(highConfidenceEvents));
    expectLastCall().atLeastOnce();
    EasyMock.replay(reporter);

    EnsembleResult result = new EnsembleDetector(config(), reporter).detect(dailyCosts(spikeBeforeShift()), COST);

    EasyMock.verify(reporter);
    assertEquals(result.baselineAnomalies().items(), alerts.getValues());
    assertEquals(result.changePointEvents().items(), changePoints.getValues());
    assertEquals(result.highConfidenceEvents(), highConfidenceEvents.getValues());
  }

  @Test
  public void testInsufficientDataIsReported() {
    DetectionReporter reporter = EasyMock.strictMock(DetectionReporter.class);
    reporter.onInsufficientData(eq(BaselineDetector.NAME), anyObject(InsufficientDataException.class));
    reporter.onInsufficientData(eq(ChangepointDetector.NAME), anyObject(InsufficientDataException.class));
    EasyMock.replay(reporter);

    new EnsembleDetector(config(), reporter).detect(dailyCosts(100.0, 100.0, 500.0), COST);

    EasyMock.verify(reporter);
  }

  @Test
  public void testCompositeFansOut() {
    DetectionReporter first = EasyMock.strictMock(DetectionReporter.class);
    DetectionReporter second = EasyMock.strictMock(DetectionReporter.class);
    for (DetectionReporter reporter : new DetectionReporter[]{first, second}) {
      reporter.configure(Collections.emptyMap());
      reporter.onInsufficientData(eq(BaselineDetector.NAME), anyObject(InsufficientDataException.class));
      reporter.onInsufficientData(eq(ChangepointDetector.NAME), anyObject(InsufficientDataException.class));
    }
    EasyMock.replay(first, second);

    CompositeDetectionReporter composite = new CompositeDetectionReporter(first, second);
    composite.configure(Collections.emptyMap());
    new EnsembleDetector(config(), composite).detect(dailyCosts(1.0, 2.0), COST);

    EasyMock.verify(first, second);
    assertEquals(2, composite.reporters().size());
  }

  @Test
  public void testLoggingAndNoopReportersAcceptFindings() {
    CompositeDetectionReporter composite = new CompositeDetectionReporter(new LoggingDetectionReporter(),
                                                                          new NoopDetectionReporter());
    EnsembleResult result = new EnsembleDetector(config(), composite).detect(dailyCosts(spikeBeforeShift()), COST);
    assertEquals(1, result.totalChangePoints());
  }
}
