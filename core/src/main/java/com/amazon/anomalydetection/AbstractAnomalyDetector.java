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

import static com.amazon.anomalydetection.CommonUtils.checkNotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import lombok.Getter;

import com.amazon.anomalydetection.config.DetectionConfig;
import com.amazon.anomalydetection.event.AnomalyEvent;
import com.amazon.anomalydetection.event.AnomalyEventArgs;
import com.amazon.anomalydetection.event.IAnomalyListener;
import com.amazon.anomalydetection.monitoring.DetectorPerformanceMonitor;
import com.amazon.anomalydetection.returntypes.AnomalyResult;

/**
 * Holds the state every detector shares (name, configuration, listeners and
 * performance monitor) and runs each detection through the same steps: the
 * caller validates the input, then {@link #runDetection(Supplier)} times the
 * computation, records it and notifies listeners of state transitions.
 * <p>
 * The transition state kept for notification is separate from the model and
 * never influences a detection.
 */
public abstract class AbstractAnomalyDetector implements IAnomalyDetector {

    /**
     * A result whose |score| exceeds this multiple of the sigma multiplier also
     * raises {@link AnomalyEvent#THRESHOLD_EXCEEDED}.
     */
    public static final double THRESHOLD_EXCEEDED_FACTOR = 1.5;

    @Getter
    private final String name;

    @Getter
    protected final DetectionConfig config;

    @Getter
    private final DetectorPerformanceMonitor performanceMonitor;

    private final List<IAnomalyListener> listeners;

    private boolean lastWasAnomaly;

    protected AbstractAnomalyDetector(String name, DetectionConfig config) {
        this.name = checkNotNull(name, "name must not be null");
        this.config = checkNotNull(config, "config must not be null");
        this.performanceMonitor = new DetectorPerformanceMonitor();
        this.listeners = new ArrayList<>();
    }

    @Override
    public void addListener(IAnomalyListener listener) {
        checkNotNull(listener, "listener must not be null");
        if (!listeners.contains(listener)) {
            listeners.add(listener);
        }
    }

    @Override
    public void removeListener(IAnomalyListener listener) {
        listeners.remove(listener);
    }

    /**
     * Times the computation, records it with the performance monitor and notifies
     * listeners. Exceptions thrown by the computation propagate unrecorded.
     *
     * @param computation produces the detection result
     * @return the result of the computation
     */
    protected AnomalyResult runDetection(Supplier<AnomalyResult> computation) {
        long start = performanceMonitor.startMeasurement();
        AnomalyResult result = computation.get();
        performanceMonitor.stopMeasurement(start, result.isAnomaly());
        if (isInitialized()) {
            notifyTransition(result);
        }
        return result;
    }

    /**
     * @return true if the detector compares z-scores against the sigma multiplier
     */
    protected boolean reportsThresholdExceeded() {
        return this instanceof IStatisticalAnomalyDetector;
    }

    private void notifyTransition(AnomalyResult result) {
        boolean wasAnomaly = lastWasAnomaly;
        // set before listeners run so a failing listener cannot replay the transition
        lastWasAnomaly = result.isAnomaly();
        if (result.isAnomaly() && !wasAnomaly) {
            fire(AnomalyEvent.ANOMALY_DETECTED, result, result.getDescription());
            double limit = THRESHOLD_EXCEEDED_FACTOR * config.getSigmaMultiplier();
            if (reportsThresholdExceeded() && Math.abs(result.getScore()) > limit) {
                fire(AnomalyEvent.THRESHOLD_EXCEEDED, result,
                        String.format("|score| %.2f exceeds %.2f", Math.abs(result.getScore()), limit));
            }
        } else if (!result.isAnomaly() && wasAnomaly) {
            fire(AnomalyEvent.NORMAL_RESUMED, result, result.getDescription());
        }
    }

    private void fire(AnomalyEvent type, AnomalyResult result, String info) {
        if (listeners.isEmpty()) {
            return;
        }
        AnomalyEventArgs args = new AnomalyEventArgs(type, Instant.now(), result, name, info);
        for (IAnomalyListener listener : new ArrayList<>(listeners)) {
            listener.onAnomalyEvent(args);
        }
    }
}
