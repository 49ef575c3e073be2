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

package com.amazon.anomalydetection.config;

import static com.amazon.anomalydetection.CommonUtils.checkConfiguration;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Sensitivity settings shared by every detector. The sigma multiplier is the
 * z-score magnitude beyond which a value is anomalous; the minimum standard
 * deviation is the floor applied to every deviation estimate so that a
 * (near-)constant baseline does not turn every small fluctuation into an
 * anomaly.
 */
@Getter
@ToString
@EqualsAndHashCode
public class DetectionConfig {

    public static final double DEFAULT_SIGMA_MULTIPLIER = 3.0;

    public static final double DEFAULT_MIN_STD_DEV = 0.001;

    private static final DetectionConfig DEFAULT = new DetectionConfig(DEFAULT_SIGMA_MULTIPLIER, DEFAULT_MIN_STD_DEV);

    private final double sigmaMultiplier;

    private final double minStdDev;

    @Builder(toBuilder = true)
    public DetectionConfig(double sigmaMultiplier, double minStdDev) {
        checkConfiguration(Double.isFinite(sigmaMultiplier) && sigmaMultiplier > 0,
                "sigmaMultiplier must be a positive number");
        checkConfiguration(Double.isFinite(minStdDev) && minStdDev > 0, "minStdDev must be a positive number");
        this.sigmaMultiplier = sigmaMultiplier;
        this.minStdDev = minStdDev;
    }

    public static DetectionConfig defaults() {
        return DEFAULT;
    }

    /**
     * @param stdDev a raw deviation estimate
     * @return the estimate, floored at {@link #getMinStdDev()}
     */
    public double clampStdDev(double stdDev) {
        return Math.max(stdDev, minStdDev);
    }

    public static class DetectionConfigBuilder {
        private double sigmaMultiplier = DEFAULT_SIGMA_MULTIPLIER;
        private double minStdDev = DEFAULT_MIN_STD_DEV;
    }
}
