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

package com.amazon.anomalydetection.statistical;

import static com.amazon.anomalydetection.CommonUtils.checkFinite;

import com.amazon.anomalydetection.AbstractAnomalyDetector;
import com.amazon.anomalydetection.IStatisticalAnomalyDetector;
import com.amazon.anomalydetection.config.DetectionConfig;
import com.amazon.anomalydetection.returntypes.AnomalyResult;

/**
 * Base of the univariate detectors. Subclasses maintain a mean and a raw
 * standard deviation; this class applies the z-score rule
 * {@code z = (x - mean) / max(stdDev, minStdDev)}, anomalous iff
 * {@code |z| > sigmaMultiplier}, with the normal band
 * {@code mean +/- sigmaMultiplier * max(stdDev, minStdDev)}.
 */
public abstract class AbstractStatisticalDetector extends AbstractAnomalyDetector
        implements IStatisticalAnomalyDetector {

    protected AbstractStatisticalDetector(String name, DetectionConfig config) {
        super(name, config);
    }

    @Override
    public AnomalyResult detect(double value) {
        checkFinite(value);
        return runDetection(() -> computeDetection(value));
    }

    protected abstract AnomalyResult computeDetection(double value);

    /**
     * @return the standard deviation before the minimum is applied
     */
    protected abstract double getRawStdDev();

    @Override
    public double getStdDev() {
        return config.clampStdDev(getRawStdDev());
    }

    @Override
    public double getLowerLimit() {
        return getMean() - config.getSigmaMultiplier() * getStdDev();
    }

    @Override
    public double getUpperLimit() {
        return getMean() + config.getSigmaMultiplier() * getStdDev();
    }

    /**
     * Scores a value against the current mean and standard deviation.
     *
     * @param value  the queried value
     * @param prefix label used in the description of an anomaly
     * @return the detection result
     */
    protected AnomalyResult scoreAgainstModel(double value, String prefix) {
        double mean = getMean();
        double stdDev = getStdDev();
        double zScore = (value - mean) / stdDev;
        double lower = getLowerLimit();
        double upper = getUpperLimit();
        boolean anomaly = Math.abs(zScore) > config.getSigmaMultiplier();
        String description;
        if (anomaly) {
            description = String.format("%s: Value %.2f %s limit (%.2f), Z-score: %.2f", prefix, value,
                    (zScore < 0) ? "below lower" : "above upper", (zScore < 0) ? lower : upper, zScore);
        } else {
            description = String.format("Normal value: %.2f (mean: %.2f, range: %.2f - %.2f), Z-score: %.2f", value,
                    mean, lower, upper, zScore);
        }
        return AnomalyResult.builder().anomaly(anomaly).value(value).score(zScore).lowerLimit(lower)
                .upperLimit(upper).description(description).build();
    }
}
