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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.anomalydetection.errors.ConfigurationException;

public class DetectionConfigTest {

    @Test
    public void testDefaults() {
        DetectionConfig config = DetectionConfig.builder().build();
        assertEquals(DetectionConfig.DEFAULT_SIGMA_MULTIPLIER, config.getSigmaMultiplier());
        assertEquals(DetectionConfig.DEFAULT_MIN_STD_DEV, config.getMinStdDev());
        assertEquals(config, DetectionConfig.defaults());
    }

    @Test
    public void testToBuilderKeepsOtherFields() {
        DetectionConfig config = DetectionConfig.builder().sigmaMultiplier(2.0).minStdDev(0.5).build();
        DetectionConfig changed = config.toBuilder().sigmaMultiplier(4.0).build();
        assertEquals(4.0, changed.getSigmaMultiplier());
        assertEquals(0.5, changed.getMinStdDev());
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY })
    public void testInvalidSigmaMultiplier(double sigma) {
        assertThrows(ConfigurationException.class, () -> DetectionConfig.builder().sigmaMultiplier(sigma).build());
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, -0.001, Double.NaN })
    public void testInvalidMinStdDev(double minStdDev) {
        assertThrows(ConfigurationException.class, () -> DetectionConfig.builder().minStdDev(minStdDev).build());
    }

    @Test
    public void testClampStdDev() {
        DetectionConfig config = DetectionConfig.builder().minStdDev(0.1).build();
        assertEquals(0.1, config.clampStdDev(0));
        assertEquals(0.1, config.clampStdDev(0.05));
        assertEquals(2.0, config.clampStdDev(2.0));
    }
}
