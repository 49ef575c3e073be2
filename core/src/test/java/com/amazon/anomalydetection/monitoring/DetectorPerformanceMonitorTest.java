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

package com.amazon.anomalydetection.monitoring;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class DetectorPerformanceMonitorTest {

    @Test
    public void testCounts() {
        DetectorPerformanceMonitor monitor = new DetectorPerformanceMonitor();
        for (int i = 0; i < 10; i++) {
            monitor.stopMeasurement(monitor.startMeasurement(), i % 5 == 0);
        }

        DetectorMetrics metrics = monitor.getCurrentMetrics();
        assertEquals(10, metrics.getTotalDetections());
        assertEquals(2, metrics.getAnomaliesDetected());
        assertEquals(8, metrics.getNormalValuesDetected());
        assertEquals(0.2, metrics.getAnomalyRate(), 1e-12);
        assertThat(metrics.getMaxProcessingTimeMs(), greaterThanOrEqualTo(metrics.getMinProcessingTimeMs()));
        assertThat(metrics.getAverageProcessingTimeMs(), greaterThanOrEqualTo(0.0));
    }

    @Test
    public void testDisabledMonitorIgnoresMeasurements() {
        DetectorPerformanceMonitor monitor = new DetectorPerformanceMonitor();
        monitor.setEnabled(false);
        monitor.stopMeasurement(monitor.startMeasurement(), true);
        monitor.recordGroundTruth(true, true);

        DetectorMetrics metrics = monitor.getCurrentMetrics();
        assertEquals(0, metrics.getTotalDetections());
        assertEquals(0, metrics.getGroundTruth().getTotal());
        assertEquals(0, metrics.getMinProcessingTimeMs());
    }

    @Test
    public void testGroundTruthAndReset() {
        DetectorPerformanceMonitor monitor = new DetectorPerformanceMonitor();
        monitor.stopMeasurement(monitor.startMeasurement(), true);
        monitor.recordGroundTruth(true, true);
        monitor.recordGroundTruth(false, true);

        DetectorMetrics metrics = monitor.getCurrentMetrics();
        assertEquals(1, metrics.getGroundTruth().getTruePositives());
        assertEquals(1, metrics.getGroundTruth().getFalsePositives());
        assertThat(monitor.getReport(), containsString("TP=1"));

        monitor.reset();
        assertEquals(0, monitor.getCurrentMetrics().getTotalDetections());
        assertEquals(0, monitor.getCurrentMetrics().getGroundTruth().getTotal());
    }
}
