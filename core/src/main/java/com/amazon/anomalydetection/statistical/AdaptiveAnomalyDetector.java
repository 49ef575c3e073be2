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
import static com.amazon.anomalydetection.CommonUtils.checkSufficientData;

import java.util.ArrayDeque;
import java.util.Arrays;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalydetection.IUpdatableDetector;
import com.amazon.anomalydetection.config.DetectionConfig;
import com.amazon.anomalydetection.returntypes.AnomalyResult;
import com.amazon.anomalydetection.statistics.Deviation;

/**
 * A baseline that moves toward the values it is told are normal.
 * <p>
 * {@link #initializeWithNormalData(double[])} (or {@link #build()} over the
 * values collected with {@link #addValue(double)}) sets the initial mean and
 * standard deviation. After that {@link #updateNormal(double)} is the only
 * method that changes them: with {@code delta = x - mean} it applies
 *
 * <pre>
 * mean     = mean + rate * delta
 * variance = (1 - rate) * variance + rate * delta * (x - mean)
 * </pre>
 *
 * where the second line uses the updated mean. The detector does not check that
 * an updated value is normal. A caller that updates with a value
 * {@link #detect(double)} flagged lets the anomaly leak into the baseline;
 * {@link #processValue(double)} performs the gated update.
 * <p>
 * Values accepted through {@code updateNormal} also join the buffer a later
 * {@link #build()} initializes from, and {@code build()} leaves an existing
 * baseline alone unless {@link #addValue(double)} collected new values since it
 * was set.
 */
@Slf4j
public class AdaptiveAnomalyDetector extends AbstractStatisticalDetector implements IUpdatableDetector {

    public static final String NAME = "Adaptive Detector";

    public static final int DEFAULT_WINDOW_SIZE = 1000;

    public static final double DEFAULT_ADAPTATION_RATE = 0.01;

    @Getter
    private final int windowSize;

    @Getter
    private final double adaptationRate;

    private final ArrayDeque<Double> pending;

    private double mean;

    private double variance;

    private boolean initialized;

    private boolean pendingChanged;

    @Getter
    private long sampleCount;

    public AdaptiveAnomalyDetector() {
        this(DEFAULT_WINDOW_SIZE, DEFAULT_ADAPTATION_RATE, DetectionConfig.defaults());
    }

    public AdaptiveAnomalyDetector(int windowSize, double adaptationRate) {
        this(windowSize, adaptationRate, DetectionConfig.defaults());
    }

    public AdaptiveAnomalyDetector(int windowSize, double adaptationRate, DetectionConfig config) {
        super(NAME, config);
        checkConfiguration(windowSize > 0, "windowSize must be greater than 0");
        checkConfiguration(adaptationRate > 0 && adaptationRate <= 1, "adaptationRate must be in (0, 1]");
        this.windowSize = windowSize;
        this.adaptationRate = adaptationRate;
        this.pending = new ArrayDeque<>();
    }

    /**
     * Collects a value for the next {@link #build()}. Only the most recent
     * {@code windowSize} values are kept. The current baseline is not changed.
     */
    @Override
    public void addValue(double value) {
        checkFinite(value);
        buffer(value);
        pendingChanged = true;
    }

    private void buffer(double value) {
        if (pending.size() == windowSize) {
            pending.removeFirst();
        }
        pending.addLast(value);
    }

    @Override
    public void build() {
        if (initialized && !pendingChanged) {
            log.debug("no values added since the baseline was set, keeping mean {}", mean);
            return;
        }
        initializeWithNormalData(pending.stream().mapToDouble(Double::doubleValue).toArray());
    }

    /**
     * Sets the baseline from a batch of values known to be normal. Only the most
     * recent {@code windowSize} values are used.
     *
     * @param values normal values, oldest first
     */
    public void initializeWithNormalData(double[] values) {
        checkNotNull(values, "values must not be null");
        checkSufficientData(values.length > 0, "no values to initialize the baseline from");
        for (double value : values) {
            checkFinite(value);
        }
        double[] used = Arrays.copyOfRange(values, Math.max(0, values.length - windowSize), values.length);
        Deviation deviation = Deviation.of(used);
        mean = deviation.getMean();
        double stdDev = deviation.getDeviation();
        variance = stdDev * stdDev;
        sampleCount = used.length;
        initialized = true;
        pending.clear();
        for (double value : used) {
            pending.addLast(value);
        }
        pendingChanged = false;
        log.info("baseline initialized from {} values: mean {}, standard deviation {}", used.length, mean, stdDev);
    }

    /**
     * Moves the baseline toward {@code value}. Without a baseline the value
     * becomes the mean with zero variance.
     *
     * @param value a value the caller considers normal
     */
    public void updateNormal(double value) {
        checkFinite(value);
        if (!initialized) {
            mean = value;
            variance = 0;
            initialized = true;
        } else {
            double delta = value - mean;
            mean += adaptationRate * delta;
            variance = (1 - adaptationRate) * variance + adaptationRate * delta * (value - mean);
        }
        buffer(value);
        ++sampleCount;
    }

    @Override
    public void updateWithNormal(double value) {
        updateNormal(value);
    }

    /**
     * Detects and then, only when the value is normal, folds it into the
     * baseline.
     *
     * @param value the observed value
     * @return the detection result computed before the update
     */
    public AnomalyResult processValue(double value) {
        AnomalyResult result = detect(value);
        if (!result.isAnomaly()) {
            updateNormal(value);
        }
        return result;
    }

    @Override
    protected AnomalyResult computeDetection(double value) {
        if (!initialized) {
            return AnomalyResult.notInitialized(value,
                    String.format("Adaptive detector not initialized. Value: %.2f", value));
        }
        return scoreAgainstModel(value, "ADAPTIVE ANOMALY");
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    /**
     * @return the baseline mean, NaN before initialization
     */
    @Override
    public double getMean() {
        return initialized ? mean : Double.NaN;
    }

    @Override
    protected double getRawStdDev() {
        return initialized ? Math.sqrt(Math.max(variance, 0)) : Double.NaN;
    }
}
