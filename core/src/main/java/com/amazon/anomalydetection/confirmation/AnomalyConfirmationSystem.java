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

package com.amazon.anomalydetection.confirmation;

import static com.amazon.anomalydetection.CommonUtils.checkConfiguration;
import static com.amazon.anomalydetection.CommonUtils.checkFinite;
import static com.amazon.anomalydetection.CommonUtils.checkNotNull;

import java.util.ArrayDeque;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalydetection.returntypes.AnomalyResult;

/**
 * Turns isolated detections into confirmed alerts. The system remembers the
 * last {@code windowSize} flagged values; a value is confirmed when at least
 * {@code confirmationThreshold} of them are similar to it, where {@code h} is
 * similar to {@code v} if {@code |h - v| < max(|v|, 1) * tolerance}.
 * <p>
 * The system holds no detector state and can sit downstream of any detector or
 * of a vote across several.
 */
@Slf4j
public class AnomalyConfirmationSystem {

    public static final int DEFAULT_WINDOW_SIZE = 10;

    public static final int DEFAULT_CONFIRMATION_THRESHOLD = 3;

    public static final double DEFAULT_TOLERANCE = 0.1;

    @Getter
    private final int windowSize;

    @Getter
    private final int confirmationThreshold;

    @Getter
    private final double tolerance;

    private final ArrayDeque<Double> recentAnomalies;

    public AnomalyConfirmationSystem() {
        this(DEFAULT_WINDOW_SIZE, DEFAULT_CONFIRMATION_THRESHOLD, DEFAULT_TOLERANCE);
    }

    public AnomalyConfirmationSystem(int windowSize, int confirmationThreshold, double tolerance) {
        checkConfiguration(windowSize > 0, "windowSize must be greater than 0");
        checkConfiguration(confirmationThreshold >= 1 && confirmationThreshold <= windowSize,
                "confirmationThreshold must be between 1 and windowSize");
        checkConfiguration(tolerance >= 0 && tolerance < 1, "tolerance must be in [0, 1)");
        this.windowSize = windowSize;
        this.confirmationThreshold = confirmationThreshold;
        this.tolerance = tolerance;
        this.recentAnomalies = new ArrayDeque<>(windowSize);
    }

    /**
     * Records a flagged value, evicting the oldest beyond the window.
     *
     * @param value the flagged value
     */
    public void addPotentialAnomaly(double value) {
        checkFinite(value);
        if (recentAnomalies.size() == windowSize) {
            recentAnomalies.removeFirst();
        }
        recentAnomalies.addLast(value);
    }

    /**
     * @param value a candidate value
     * @return true if at least {@code confirmationThreshold} recorded values are
     *         similar to it
     */
    public boolean isConfirmedAnomaly(double value) {
        checkFinite(value);
        double band = Math.max(Math.abs(value), 1) * tolerance;
        int similar = 0;
        for (double recent : recentAnomalies) {
            if (Math.abs(recent - value) < band) {
                ++similar;
            }
        }
        return similar >= confirmationThreshold;
    }

    /**
     * Checks the value against the values recorded so far and then records it.
     *
     * @param value a newly flagged value
     * @return whether the value was confirmed by the earlier ones
     */
    public boolean process(double value) {
        boolean confirmed = isConfirmedAnomaly(value);
        addPotentialAnomaly(value);
        if (confirmed) {
            log.debug("confirmed anomaly {}", value);
        }
        return confirmed;
    }

    /**
     * Feeds a detection result through {@link #process(double)}. Normal results
     * are ignored and never confirmed.
     *
     * @param result the output of a detector
     * @return whether the result is a confirmed anomaly
     */
    public boolean process(AnomalyResult result) {
        checkNotNull(result, "result must not be null");
        return result.isAnomaly() && process(result.getValue());
    }

    /**
     * @return the recorded values, oldest first
     */
    public double[] getRecentAnomalies() {
        return recentAnomalies.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public void reset() {
        recentAnomalies.clear();
    }
}
