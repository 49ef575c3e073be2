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

import com.amazon.anomalydetection.config.DetectionConfig;
import com.amazon.anomalydetection.event.IAnomalyListener;
import com.amazon.anomalydetection.monitoring.DetectorPerformanceMonitor;
import com.amazon.anomalydetection.returntypes.AnomalyResult;

/**
 * The capability set shared by every detector: ingest values, construct a
 * model and query it.
 * <p>
 * {@link #detect(double)} never changes the model. Detectors are not
 * thread-safe; callers that share an instance must serialize mutating calls
 * with respect to each other and to {@code detect}.
 */
public interface IAnomalyDetector {

    String getName();

    DetectionConfig getConfig();

    /**
     * Buffers a value for model construction. Incremental detectors fold the
     * value into their statistics immediately.
     *
     * @param value a finite value
     */
    void addValue(double value);

    default void addValues(double[] values) {
        CommonUtils.checkNotNull(values, "values must not be null");
        for (double value : values) {
            addValue(value);
        }
    }

    /**
     * Materializes the model from the buffered data. Incremental detectors
     * recompute or treat this as a re-fit.
     */
    void build();

    AnomalyResult detect(double value);

    default boolean isAnomaly(double value) {
        return detect(value).isAnomaly();
    }

    default String getAnomalyInfo(double value) {
        return detect(value).getDescription();
    }

    /**
     * @return true once a query against the model is meaningful
     */
    boolean isInitialized();

    void addListener(IAnomalyListener listener);

    void removeListener(IAnomalyListener listener);

    DetectorPerformanceMonitor getPerformanceMonitor();
}
