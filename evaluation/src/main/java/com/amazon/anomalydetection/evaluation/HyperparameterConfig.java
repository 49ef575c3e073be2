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

package com.amazon.anomalydetection.evaluation;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One point of the hyperparameter search space. Only the fields relevant to
 * the tuned detector type are used; the others keep their defaults.
 */
@Getter
@ToString
@EqualsAndHashCode
public class HyperparameterConfig {

    private final String name;

    private final double sigmaMultiplier;

    private final double minStdDev;

    /**
     * window of the sliding-window and adaptive detectors
     */
    private final int windowSize;

    /**
     * smoothing factor of the EMA detector
     */
    private final double alpha;

    /**
     * learning rate of the adaptive detector
     */
    private final double adaptationRate;

    private final int numberOfTrees;

    private final int subSampleSize;

    private final int maxDepth;

    @Builder(toBuilder = true)
    public HyperparameterConfig(String name, double sigmaMultiplier, double minStdDev, int windowSize, double alpha,
            double adaptationRate, int numberOfTrees, int subSampleSize, int maxDepth) {
        this.name = name;
        this.sigmaMultiplier = sigmaMultiplier;
        this.minStdDev = minStdDev;
        this.windowSize = windowSize;
        this.alpha = alpha;
        this.adaptationRate = adaptationRate;
        this.numberOfTrees = numberOfTrees;
        this.subSampleSize = subSampleSize;
        this.maxDepth = maxDepth;
    }

    public static HyperparameterConfig defaults() {
        return builder().build();
    }

    public static class HyperparameterConfigBuilder {
        private String name = "Default";
        private double sigmaMultiplier = 3.0;
        private double minStdDev = 0.001;
        private int windowSize = 100;
        private double alpha = 0.3;
        private double adaptationRate = 0.1;
        private int numberOfTrees = 100;
        private int subSampleSize = 256;
        private int maxDepth = 10;
    }
}
