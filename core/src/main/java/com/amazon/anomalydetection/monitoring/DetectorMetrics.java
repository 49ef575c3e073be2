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

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * An immutable snapshot of the counters kept by a
 * {@link DetectorPerformanceMonitor}.
 */
@Getter
@Builder
@ToString
public class DetectorMetrics {

    private final long totalDetections;

    private final long anomaliesDetected;

    private final long normalValuesDetected;

    private final double totalProcessingTimeMs;

    private final double averageProcessingTimeMs;

    private final double minProcessingTimeMs;

    private final double maxProcessingTimeMs;

    private final double throughputPerSecond;

    private final ConfusionMatrix groundTruth;

    public double getAnomalyRate() {
        return (totalDetections > 0) ? (double) anomaliesDetected / totalDetections : 0;
    }
}
