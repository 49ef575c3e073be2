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

package com.amazon.anomalydetection.returntypes;

import static com.amazon.anomalydetection.CommonUtils.checkArgument;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The outcome of a single detection. For the statistical detectors
 * {@code score} is the signed z-score of the value against the current mean and
 * standard deviation, and the limits are the bounds of the normal band. For the
 * density detectors {@code score} is the normalized anomaly score of the
 * algorithm; the limits then describe the range of normal scores, or are
 * undefined ({@link Double#NaN}) when the algorithm has no one dimensional
 * threshold.
 */
@Getter
@ToString
@EqualsAndHashCode
public class AnomalyResult {

    private final boolean anomaly;

    /**
     * the value that was queried; for a point this is the mean of its coordinates
     */
    private final double value;

    private final double score;

    private final double lowerLimit;

    private final double upperLimit;

    private final String description;

    @Builder
    public AnomalyResult(boolean anomaly, double value, double score, double lowerLimit, double upperLimit,
            String description) {
        checkArgument(Double.isNaN(lowerLimit) || Double.isNaN(upperLimit) || lowerLimit <= upperLimit,
                "lowerLimit cannot exceed upperLimit");
        this.anomaly = anomaly;
        this.value = value;
        this.score = score;
        this.lowerLimit = lowerLimit;
        this.upperLimit = upperLimit;
        this.description = (description == null) ? "" : description;
    }

    /**
     * @return true if both limits are defined
     */
    public boolean hasLimits() {
        return !Double.isNaN(lowerLimit) && !Double.isNaN(upperLimit);
    }

    /**
     * A normal result returned by the incremental detectors before they have seen
     * any data; they tolerate an empty model instead of failing.
     *
     * @param value       the queried value
     * @param description the reason
     * @return a normal result without limits
     */
    public static AnomalyResult notInitialized(double value, String description) {
        return new AnomalyResult(false, value, 0, Double.NaN, Double.NaN, description);
    }

    public static class AnomalyResultBuilder {
        private double lowerLimit = Double.NaN;
        private double upperLimit = Double.NaN;
    }
}
