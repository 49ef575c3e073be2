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

import lombok.Getter;
import lombok.Setter;

/**
 * Records how many detections a detector made, how many of them were
 * anomalies, how long they took and, when the caller supplies labels, how they
 * compare to ground truth. A disabled monitor ignores every measurement.
 */
public class DetectorPerformanceMonitor {

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    @Getter
    @Setter
    private boolean enabled = true;

    private long totalDetections;

    private long anomalies;

    private long totalNanos;

    private long minNanos = Long.MAX_VALUE;

    private long maxNanos;

    private final ConfusionMatrix groundTruth = new ConfusionMatrix();

    /**
     * @return a start token for {@link #stopMeasurement(long, boolean)}
     */
    public long startMeasurement() {
        return System.nanoTime();
    }

    public void stopMeasurement(long startToken, boolean isAnomaly) {
        if (!enabled) {
            return;
        }
        long elapsed = System.nanoTime() - startToken;
        ++totalDetections;
        if (isAnomaly) {
            ++anomalies;
        }
        totalNanos += elapsed;
        minNanos = Math.min(minNanos, elapsed);
        maxNanos = Math.max(maxNanos, elapsed);
    }

    public void recordGroundTruth(boolean actualAnomaly, boolean predictedAnomaly) {
        if (enabled) {
            groundTruth.record(actualAnomaly, predictedAnomaly);
        }
    }

    public void reset() {
        totalDetections = 0;
        anomalies = 0;
        totalNanos = 0;
        minNanos = Long.MAX_VALUE;
        maxNanos = 0;
        groundTruth.reset();
    }

    public DetectorMetrics getCurrentMetrics() {
        double totalMs = totalNanos / NANOS_PER_MILLI;
        return DetectorMetrics.builder().totalDetections(totalDetections).anomaliesDetected(anomalies)
                .normalValuesDetected(totalDetections - anomalies).totalProcessingTimeMs(totalMs)
                .averageProcessingTimeMs((totalDetections > 0) ? totalMs / totalDetections : 0)
                .minProcessingTimeMs((totalDetections > 0) ? minNanos / NANOS_PER_MILLI : 0)
                .maxProcessingTimeMs(maxNanos / NANOS_PER_MILLI)
                .throughputPerSecond((totalNanos > 0) ? totalDetections * 1000.0 / totalMs : 0)
                .groundTruth(new ConfusionMatrix(groundTruth)).build();
    }

    public String getReport() {
        DetectorMetrics metrics = getCurrentMetrics();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Total detections:   %d%n", metrics.getTotalDetections()));
        sb.append(String.format("Anomalies:          %d (%.2f%%)%n", metrics.getAnomaliesDetected(),
                100 * metrics.getAnomalyRate()));
        sb.append(String.format("Normal values:      %d%n", metrics.getNormalValuesDetected()));
        sb.append(String.format("Average time (ms):  %.4f%n", metrics.getAverageProcessingTimeMs()));
        sb.append(String.format("Min/Max time (ms):  %.4f / %.4f%n", metrics.getMinProcessingTimeMs(),
                metrics.getMaxProcessingTimeMs()));
        sb.append(String.format("Throughput (/s):    %.1f%n", metrics.getThroughputPerSecond()));
        if (metrics.getGroundTruth().getTotal() > 0) {
            sb.append(metrics.getGroundTruth().toString()).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
