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

import java.util.ArrayDeque;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalydetection.IUpdatableDetector;
import com.amazon.anomalydetection.config.DetectionConfig;
import com.amazon.anomalydetection.returntypes.AnomalyResult;
import com.amazon.anomalydetection.statistics.Deviation;

/**
 * Scores values against the last {@code windowSize} values seen. Each new value
 * evicts the oldest once the window is full, and the statistics are recomputed
 * from the window contents so that evictions never accumulate rounding error.
 * With fewer than two values in the window the standard deviation is the
 * configured minimum.
 */
@Slf4j
public class SlidingWindowDetector extends AbstractStatisticalDetector implements IUpdatableDetector {

    public static final String NAME = "Sliding Window Detector";

    public static final int DEFAULT_WINDOW_SIZE = 100;

    @Getter
    private final int windowSize;

    private final ArrayDeque<Double> window;

    private double mean = Double.NaN;

    private double stdDev = Double.NaN;

    public SlidingWindowDetector() {
        this(DEFAULT_WINDOW_SIZE, DetectionConfig.defaults());
    }

    public SlidingWindowDetector(int windowSize) {
        this(windowSize, DetectionConfig.defaults());
    }

    public SlidingWindowDetector(int windowSize, DetectionConfig config) {
        super(NAME, config);
        checkConfiguration(windowSize > 0, "windowSize must be greater than 0");
        this.windowSize = windowSize;
        this.window = new ArrayDeque<>(windowSize);
    }

    @Override
    public void addValue(double value) {
        checkFinite(value);
        if (window.size() == windowSize) {
            window.removeFirst();
        }
        window.addLast(value);
        recompute();
    }

    /**
     * Replaces the window contents with the most recent {@code windowSize} of the
     * given values.
     *
     * @param values initial values, oldest first
     */
    public void initializeWindow(double[] values) {
        checkNotNull(values, "values must not be null");
        for (double value : values) {
            checkFinite(value);
        }
        window.clear();
        for (int i = Math.max(0, values.length - windowSize); i < values.length; i++) {
            window.addLast(values[i]);
        }
        recompute();
        log.debug("window initialized with {} of {} values", window.size(), values.length);
    }

    @Override
    public void build() {
        recompute();
    }

    @Override
    public void updateWithNormal(double value) {
        addValue(value);
    }

    private void recompute() {
        if (window.isEmpty()) {
            mean = Double.NaN;
            stdDev = Double.NaN;
            return;
        }
        Deviation deviation = Deviation.of(window);
        mean = deviation.getMean();
        stdDev = (window.size() < 2) ? 0 : deviation.getDeviation();
    }

    @Override
    protected AnomalyResult computeDetection(double value) {
        if (window.isEmpty()) {
            return AnomalyResult.notInitialized(value, "window is empty");
        }
        return scoreAgainstModel(value, "WINDOW ANOMALY");
    }

    @Override
    public boolean isInitialized() {
        return !window.isEmpty();
    }

    /**
     * @return the mean of the window, NaN while it is empty
     */
    @Override
    public double getMean() {
        return mean;
    }

    public double getCurrentMean() {
        return mean;
    }

    @Override
    protected double getRawStdDev() {
        return stdDev;
    }

    public int getCurrentSize() {
        return window.size();
    }

    /**
     * @return a copy of the window, oldest first
     */
    public double[] getWindowValues() {
        return window.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
