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
import static com.amazon.anomalydetection.CommonUtils.checkSufficientData;
import static com.amazon.anomalydetection.CommonUtils.checkTrained;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalydetection.config.DetectionConfig;
import com.amazon.anomalydetection.returntypes.AnomalyResult;
import com.amazon.anomalydetection.statistics.Deviation;

/**
 * Batch detector over a stationary baseline. Values are collected with
 * {@link #addValue(double)} and {@link #build()} computes the population mean
 * and standard deviation over all of them. Values collected after a build only
 * take effect at the next build.
 */
@Slf4j
public class ThreeSigmaDetector extends AbstractStatisticalDetector {

    public static final String NAME = "3-Sigma Detector";

    private final List<Double> data = new ArrayList<>();

    private double mean;

    private double stdDev;

    private boolean built;

    public ThreeSigmaDetector() {
        this(DetectionConfig.defaults());
    }

    public ThreeSigmaDetector(DetectionConfig config) {
        super(NAME, config);
    }

    @Override
    public void addValue(double value) {
        data.add(checkFinite(value));
    }

    @Override
    public void build() {
        checkSufficientData(!data.isEmpty(), "no values to build the model from");
        Deviation deviation = Deviation.of(data);
        mean = deviation.getMean();
        stdDev = deviation.getDeviation();
        built = true;
        log.info("built model from {} values: mean {}, standard deviation {}", data.size(), mean, stdDev);
    }

    @Override
    protected AnomalyResult computeDetection(double value) {
        checkTrained(built, "build() must be called before detect()");
        return scoreAgainstModel(value, "ANOMALY");
    }

    @Override
    public boolean isInitialized() {
        return built;
    }

    @Override
    public double getMean() {
        checkTrained(built, "model has not been built");
        return mean;
    }

    @Override
    protected double getRawStdDev() {
        checkTrained(built, "model has not been built");
        return stdDev;
    }

    /**
     * @return the number of values collected, including those not yet built into
     *         the model
     */
    public int getDataCount() {
        return data.size();
    }
}
