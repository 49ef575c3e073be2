/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.anomalydetection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.amazon.anomalydetection.config.ReclusterPolicy;
import com.amazon.anomalydetection.density.DBSCANDetector;
import com.amazon.anomalydetection.event.AnomalyEvent;
import com.amazon.anomalydetection.event.AnomalyEventArgs;
import com.amazon.anomalydetection.event.IAnomalyListener;
import com.amazon.anomalydetection.monitoring.DetectorMetrics;
import com.amazon.anomalydetection.statistical.EMAAnomalyDetector;
import com.amazon.anomalydetection.statistical.ThreeSigmaDetector;

@ExtendWith(MockitoExtension.class)
public class AbstractAnomalyDetectorTest {

    @Mock
    private IAnomalyListener listener;

    @Captor
    private ArgumentCaptor<AnomalyEventArgs> events;

    private ThreeSigmaDetector detector;

    @BeforeEach
    public void setUp() {
        detector = new ThreeSigmaDetector();
        // mean 10, standard deviation sqrt(2/3)
        detector.addValues(new double[] { 9, 10, 11, 9, 10, 11 });
        detector.build();
    }

    @Test
    public void testTransitionsAreNotified() {
        detector.addListener(listener);

        detector.detect(10);
        verifyNoInteractions(listener);

        detector.detect(20);
        detector.detect(13);
        detector.detect(10);

        verify(listener, times(3)).onAnomalyEvent(events.capture());
        List<AnomalyEventArgs> received = events.getAllValues();
        assertEquals(AnomalyEvent.ANOMALY_DETECTED, received.get(0).getEventType());
        assertEquals(AnomalyEvent.THRESHOLD_EXCEEDED, received.get(1).getEventType());
        assertEquals(AnomalyEvent.NORMAL_RESUMED, received.get(2).getEventType());
        assertEquals(ThreeSigmaDetector.NAME, received.get(0).getDetectorName());
        assertEquals(20, received.get(0).getResult().getValue(), 1e-12);
        assertNotNull(received.get(0).getTimestamp());
    }

    @Test
    public void testModerateAnomalyDoesNotExceedThreshold() {
        detector.addListener(listener);

        // z of about 3.7 is an anomaly but below 1.5 times the sigma multiplier
        assertTrue(detector.detect(13).isAnomaly());

        verify(listener).onAnomalyEvent(events.capture());
        assertEquals(AnomalyEvent.ANOMALY_DETECTED, events.getValue().getEventType());
    }

    @Test
    public void testRemovedListenerIsNotCalled() {
        detector.addListener(listener);
        detector.addListener(listener);
        detector.removeListener(listener);

        detector.detect(20);

        verifyNoInteractions(listener);
    }

    @Test
    public void testListenerExceptionPropagates() {
        doThrow(new IllegalStateException("listener failure")).when(listener).onAnomalyEvent(any());
        detector.addListener(listener);

        assertThrows(IllegalStateException.class, () -> detector.detect(20));
    }

    @Test
    public void testTransitionIsRecordedWhenListenerFails() {
        doThrow(new IllegalStateException("listener failure")).doNothing().when(listener).onAnomalyEvent(any());
        detector.addListener(listener);

        assertThrows(IllegalStateException.class, () -> detector.detect(20));
        assertTrue(detector.detect(21).isAnomaly());
        detector.detect(10);

        verify(listener, times(2)).onAnomalyEvent(events.capture());
        List<AnomalyEventArgs> received = events.getAllValues();
        assertEquals(AnomalyEvent.ANOMALY_DETECTED, received.get(0).getEventType());
        assertEquals(AnomalyEvent.NORMAL_RESUMED, received.get(1).getEventType());
    }

    @Test
    public void testUninitializedDetectionDoesNotNotify() {
        EMAAnomalyDetector ema = new EMAAnomalyDetector();
        ema.addListener(listener);

        assertFalse(ema.detect(5).isAnomaly());

        verify(listener, never()).onAnomalyEvent(any());
    }

    @Test
    public void testDensityDetectorNeverReportsThresholdExceeded() {
        DBSCANDetector dbscan = new DBSCANDetector(1.0, 3, 1, 100, ReclusterPolicy.eager());
        dbscan.addValues(new double[] { 0, 0.1, 0.2, 0.3 });
        dbscan.addListener(listener);

        assertTrue(dbscan.detect(1000).isAnomaly());

        verify(listener).onAnomalyEvent(events.capture());
        assertEquals(AnomalyEvent.ANOMALY_DETECTED, events.getValue().getEventType());
    }

    @Test
    public void testDetectionsAreMonitored() {
        detector.detect(10);
        detector.detect(20);
        detector.detect(10.5);

        DetectorMetrics metrics = detector.getPerformanceMonitor().getCurrentMetrics();
        assertEquals(3, metrics.getTotalDetections());
        assertEquals(1, metrics.getAnomaliesDetected());
        assertEquals(2, metrics.getNormalValuesDetected());
        assertTrue(metrics.getMinProcessingTimeMs() <= metrics.getMaxProcessingTimeMs());
    }

    @Test
    public void testFailedDetectionIsNotMonitored() {
        ThreeSigmaDetector untrained = new ThreeSigmaDetector();

        assertThrows(IllegalStateException.class, () -> untrained.detect(1));

        assertEquals(0, untrained.getPerformanceMonitor().getCurrentMetrics().getTotalDetections());
    }

    @Test
    public void testConvenienceQueries() {
        assertTrue(detector.isAnomaly(20));
        assertFalse(detector.isAnomaly(10));
        assertTrue(detector.getAnomalyInfo(20).startsWith("ANOMALY"));
        assertTrue(detector.getAnomalyInfo(10).startsWith("Normal"));
    }
}
