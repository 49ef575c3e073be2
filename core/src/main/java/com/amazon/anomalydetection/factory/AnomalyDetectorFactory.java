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

package com.amazon.anomalydetection.factory;

import static com.amazon.anomalydetection.CommonUtils.checkNotNull;

import com.amazon.anomalydetection.IAnomalyDetector;
import com.amazon.anomalydetection.config.DetectionConfig;
import com.amazon.anomalydetection.config.DetectorType;
import com.amazon.anomalydetection.config.ReclusterPolicy;
import com.amazon.anomalydetection.density.DBSCANDetector;
import com.amazon.anomalydetection.density.IsolationForestDetector;
import com.amazon.anomalydetection.density.LOFDetector;
import com.amazon.anomalydetection.statistical.AdaptiveAnomalyDetector;
import com.amazon.anomalydetection.statistical.EMAAnomalyDetector;
import com.amazon.anomalydetection.statistical.SlidingWindowDetector;
import com.amazon.anomalydetection.statistical.ThreeSigmaDetector;

/**
 * Creates detectors by type and from named presets for common monitoring
 * scenarios.
 */
public class AnomalyDetectorFactory {

    public static final double WEB_TRAFFIC_SIGMA = 2.5;

    public static final int WEB_TRAFFIC_WINDOW = 100;

    public static final double FINANCIAL_SIGMA = 3.0;

    public static final double FINANCIAL_MIN_STD_DEV = 0.01;

    public static final double FINANCIAL_ALPHA = 0.1;

    public static final double IOT_SIGMA = 2.0;

    public static final int IOT_WINDOW = 1000;

    public static final double IOT_ADAPTATION_RATE = 0.01;

    public static final double HIGH_DIMENSIONAL_SIGMA = 2.5;

    public static final double HISTORICAL_SIGMA = 3.0;

    public static final double REAL_TIME_SIGMA = 2.5;

    private AnomalyDetectorFactory() {
    }

    public static ThreeSigmaDetector createThreeSigma(DetectionConfig config) {
        return new ThreeSigmaDetector(config);
    }

    public static SlidingWindowDetector createSlidingWindow(int windowSize, DetectionConfig config) {
        return new SlidingWindowDetector(windowSize, config);
    }

    public static EMAAnomalyDetector createEMA(double alpha, DetectionConfig config) {
        return new EMAAnomalyDetector(alpha, config);
    }

    public static AdaptiveAnomalyDetector createAdaptive(int windowSize, double adaptationRate,
            DetectionConfig config) {
        return new AdaptiveAnomalyDetector(windowSize, adaptationRate, config);
    }

    public static IsolationForestDetector createIsolationForest(int numberOfTrees, int subSampleSize, int maxDepth,
            int dimensions, DetectionConfig config) {
        return IsolationForestDetector.builder().numberOfTrees(numberOfTrees).subSampleSize(subSampleSize)
                .maxDepth(maxDepth).dimensions(dimensions).config(config).build();
    }

    public static DBSCANDetector createDBSCAN(double epsilon, int minPoints, int dimensions) {
        return new DBSCANDetector(epsilon, minPoints, dimensions);
    }

    public static LOFDetector createLOF(int k, int dimensions) {
        return new LOFDetector(k, dimensions);
    }

    /**
     * Creates a detector of the given type with its default parameters and, for
     * the density detectors, one dimension.
     *
     * @param type   the algorithm
     * @param config sensitivity settings
     * @return a new detector
     */
    public static IAnomalyDetector create(DetectorType type, DetectionConfig config) {
        checkNotNull(type, "type must not be null");
        switch (type) {
        case THREE_SIGMA:
            return createThreeSigma(config);
        case SLIDING_WINDOW:
            return createSlidingWindow(SlidingWindowDetector.DEFAULT_WINDOW_SIZE, config);
        case EMA:
            return createEMA(EMAAnomalyDetector.DEFAULT_ALPHA, config);
        case ADAPTIVE:
            return createAdaptive(AdaptiveAnomalyDetector.DEFAULT_WINDOW_SIZE,
                    AdaptiveAnomalyDetector.DEFAULT_ADAPTATION_RATE, config);
        case ISOLATION_FOREST:
            return IsolationForestDetector.builder().dimensions(1).config(config).build();
        case DBSCAN:
            return new DBSCANDetector(DBSCANDetector.DEFAULT_EPSILON, DBSCANDetector.DEFAULT_MIN_POINTS, 1,
                    DBSCANDetector.DEFAULT_MAX_HISTORY, ReclusterPolicy.periodic(), config);
        case LOF:
            return LOFDetector.builder().k(LOFDetector.DEFAULT_K).dimensions(1).config(config).build();
        default:
            throw new IllegalArgumentException("unknown detector type " + type);
        }
    }

    public static IAnomalyDetector createForWebTrafficMonitoring() {
        return createSlidingWindow(WEB_TRAFFIC_WINDOW, sigma(WEB_TRAFFIC_SIGMA).build());
    }

    public static IAnomalyDetector createForFinancialData() {
        return createEMA(FINANCIAL_ALPHA, sigma(FINANCIAL_SIGMA).minStdDev(FINANCIAL_MIN_STD_DEV).build());
    }

    public static IAnomalyDetector createForIoTSensors() {
        return createAdaptive(IOT_WINDOW, IOT_ADAPTATION_RATE, sigma(IOT_SIGMA).build());
    }

    public static IsolationForestDetector createForHighDimensionalData(int dimensions) {
        return createIsolationForest(IsolationForestDetector.DEFAULT_NUMBER_OF_TREES,
                IsolationForestDetector.DEFAULT_SUB_SAMPLE_SIZE, IsolationForestDetector.DEFAULT_MAX_DEPTH,
                dimensions, sigma(HIGH_DIMENSIONAL_SIGMA).build());
    }

    public static IAnomalyDetector createForHistoricalAnalysis() {
        return createThreeSigma(sigma(HISTORICAL_SIGMA).build());
    }

    public static IAnomalyDetector createForRealTimeStreaming(double alpha) {
        return createEMA(alpha, sigma(REAL_TIME_SIGMA).build());
    }

    private static DetectionConfig.DetectionConfigBuilder sigma(double sigmaMultiplier) {
        return DetectionConfig.builder().sigmaMultiplier(sigmaMultiplier);
    }
}
