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

import static com.amazon.anomalydetection.CommonUtils.checkConfiguration;
import static com.amazon.anomalydetection.CommonUtils.checkFinite;
import static com.amazon.anomalydetection.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.anomalydetection.IUpdatableDetector;
import com.amazon.anomalydetection.config.DetectionConfig;
import com.amazon.anomalydetection.returntypes.AnomalyResult;

/**
 * Exponentially weighted mean and variance. For every value {@code x}, with
 * {@code delta = x - mean} taken before the update,
 *
 * <pre>
 * mean     = alpha * x + (1 - alpha) * mean
 * variance = alpha * delta * delta + (1 - alpha) * variance
 * </pre>
 *
 * The first value sets the mean and leaves the variance at 0. A smaller alpha
 * adapts more slowly and is less sensitive to transients.
 */
public class EMAAnomalyDetector extends AbstractStatisticalDetector implements IUpdatableDetector {

    public static final String NAME = "Exponential Moving Average Detector";

    public static final double DEFAULT_ALPHA = 0.1;

    @Getter
    private final double alpha;

    private double mean;

    private double variance;

    @Getter
    private long sampleCount;

    public EMAAnomalyDetector() {
        this(DEFAULT_ALPHA, DetectionConfig.defaults());
    }

    public EMAAnomalyDetector(double alpha) {
        this(alpha, DetectionConfig.defaults());
    }

    public EMAAnomalyDetector(double alpha, DetectionConfig config) {
        super(NAME, config);
        checkConfiguration(alpha > 0 && alpha <= 1, "alpha must be in (0, 1]");
        this.alpha = alpha;
    }

    @Override
    public void addValue(double value) {
        checkFinite(value);
        if (sampleCount == 0) {
            mean = value;
            variance = 0;
        } else {
            double delta = value - mean;
            mean = alpha * value + (1 - alpha) * mean;
            variance = alpha * delta * delta + (1 - alpha) * variance;
        }
        ++sampleCount;
    }

    /**
     * Feeds a batch of historical values in order. Nothing is folded in unless all
     * of them are valid.
     *
     * @param values historical values, oldest first
     */
    public void warmUp(double[] values) {
        checkNotNull(values, "values must not be null");
        for (double value : values) {
            checkFinite(value);
        }
        for (double value : values) {
            addValue(value);
        }
    }

    /**
     * The model is always current; there is nothing to build.
     */
    @Override
    public void build() {
    }

    @Override
    public void updateWithNormal(double value) {
        addValue(value);
    }

    @Override
    protected AnomalyResult computeDetection(double value) {
        if (sampleCount == 0) {
            return AnomalyResult.notInitialized(value, String.format("EMA not initialized. Value: %.2f", value));
        }
        return scoreAgainstModel(value, "EMA ANOMALY");
    }

    @Override
    public boolean isInitialized() {
        return sampleCount > 0;
    }

    /**
     * @return the moving average, NaN before the first value
     */
    @Override
    public double getMean() {
        return (sampleCount > 0) ? mean : Double.NaN;
    }

    @Override
    protected double getRawStdDev() {
        return (sampleCount > 0) ? Math.sqrt(variance) : Double.NaN;
    }
}
