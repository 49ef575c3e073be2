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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.amazon.anomalydetection.errors.ConfigurationException;
import com.amazon.anomalydetection.errors.InsufficientDataException;
import com.amazon.anomalydetection.errors.ValidationException;
import com.amazon.anomalydetection.returntypes.AnomalyResult;
import com.amazon.anomalydetection.testutils.ExampleDataSets;

public class AdaptiveAnomalyDetectorTest {

    @Test
    public void testInvalidParameters() {
        assertThrows(ConfigurationException.class, () -> new AdaptiveAnomalyDetector(0, 0.1));
        assertThrows(ConfigurationException.class, () -> new AdaptiveAnomalyDetector(10, 0));
        assertThrows(ConfigurationException.class, () -> new AdaptiveAnomalyDetector(10, 1.5));
    }

    @Test
    public void testInitializeWithNormalData() {
        AdaptiveAnomalyDetector detector = new AdaptiveAnomalyDetector(10, 0.1);
        detector.initializeWithNormalData(new double[] { 10, 12, 8, 10 });

        assertTrue(detector.isInitialized());
        assertEquals(10.0, detector.getMean(), 1e-12);
        assertEquals(Math.sqrt(2), detector.getStdDev(), 1e-12);
        assertEquals(4, detector.getSampleCount());
    }

    @Test
    public void testInitializeKeepsMostRecentValues() {
        AdaptiveAnomalyDetector detector = new AdaptiveAnomalyDetector(3, 0.1);
        detector.initializeWithNormalData(new double[] { 100, 1, 2, 3 });
        assertEquals(2.0, detector.getMean(), 1e-12);
        assertEquals(3, detector.getSampleCount());
    }

    @Test
    public void testInitializeWithoutDataThrows() {
        AdaptiveAnomalyDetector detector = new AdaptiveAnomalyDetector();
        assertThrows(InsufficientDataException.class, () -> detector.initializeWithNormalData(new double[0]));
        assertThrows(InsufficientDataException.class, detector::build);
    }

    @Test
    public void testUpdateRule() {
        AdaptiveAnomalyDetector detector = new AdaptiveAnomalyDetector(10, 0.1);
        detector.initializeWithNormalData(new double[] { 10, 12, 8, 10 });
        detector.updateNormal(12);

        // delta 2: mean 10 + 0.1 * 2, variance 0.9 * 2 + 0.1 * 2 * (12 - 10.2)
        assertEquals(10.2, detector.getMean(), 1e-12);
        assertEquals(Math.sqrt(2.16), detector.getStdDev(), 1e-12);
        assertEquals(5, detector.getSampleCount());
    }

    @Test
    public void testDetectDoesNotChangeBaseline() {
        AdaptiveAnomalyDetector detector = new AdaptiveAnomalyDetector(10, 0.5);
        detector.initializeWithNormalData(new double[] { 10, 12, 8, 10 });
        detector.detect(11);
        detector.detect(1000);
        assertEquals(10.0, detector.getMean(), 1e-12);
    }

    @Test
    public void testAddValueOnlyTakesEffectOnBuild() {
        AdaptiveAnomalyDetector detector = new AdaptiveAnomalyDetector(10, 0.1);
        detector.addValues(new double[] { 4, 6 });
        assertFalse(detector.isInitialized());

        detector.build();
        assertEquals(5.0, detector.getMean(), 1e-12);
    }

    @Test
    public void testBuildKeepsAcceptedUpdates() {
        AdaptiveAnomalyDetector detector = new AdaptiveAnomalyDetector(50, 0.1);
        detector.initializeWithNormalData(ExampleDataSets.normalSeries(50, 102, 1, 9));
        for (int i = 0; i < 200; i++) {
            detector.updateNormal(103);
        }
        double adapted = detector.getMean();
        assertEquals(103.0, adapted, 1e-6);

        detector.build();
        assertEquals(adapted, detector.getMean(), 0.0);
        assertEquals(250, detector.getSampleCount());
    }

    @Test
    public void testBuildAfterUpdatesOnly() {
        AdaptiveAnomalyDetector detector = new AdaptiveAnomalyDetector(10, 0.5);
        detector.updateNormal(10);
        detector.updateNormal(11);
        assertTrue(detector.isInitialized());

        detector.build();
        assertEquals(10.5, detector.getMean(), 1e-12);
    }

    @Test
    public void testRebuildIncludesAcceptedValues() {
        AdaptiveAnomalyDetector detector = new AdaptiveAnomalyDetector(10, 0.5);
        detector.initializeWithNormalData(new double[] { 100, 102, 104 });
        detector.updateNormal(110);
        detector.addValue(108);

        detector.build();
        assertEquals(104.8, detector.getMean(), 1e-9);
        assertEquals(5, detector.getSampleCount());
    }

    @Test
    public void testInvalidValues() {
        AdaptiveAnomalyDetector detector = new AdaptiveAnomalyDetector(10, 0.1);
        assertThrows(ValidationException.class, () -> detector.addValue(Double.NaN));
        assertThrows(ValidationException.class, () -> detector.updateNormal(Double.POSITIVE_INFINITY));
        assertThrows(ValidationException.class, () -> detector.updateWithNormal(Double.NaN));
        assertThrows(ValidationException.class, () -> detector.processValue(Double.NEGATIVE_INFINITY));
        assertFalse(detector.isInitialized());

        detector.initializeWithNormalData(new double[] { 1, 2, 3 });
        assertThrows(ValidationException.class, () -> detector.detect(Double.NaN));
        assertEquals(2.0, detector.getMean(), 1e-12);
    }

    @Test
    public void testFirstUpdateInitializes() {
        AdaptiveAnomalyDetector detector = new AdaptiveAnomalyDetector(10, 0.1);
        AnomalyResult first = detector.processValue(42);
        assertFalse(first.isAnomaly());
        assertFalse(first.hasLimits());
        assertEquals(42.0, detector.getMean(), 1e-12);
    }

    @Test
    public void testProcessValueSkipsAnomalies() {
        AdaptiveAnomalyDetector detector = new AdaptiveAnomalyDetector(100, 0.1);
        detector.initializeWithNormalData(ExampleDataSets.normalSeries(100, 50, 2, 3));
        double mean = detector.getMean();

        assertTrue(detector.processValue(500).isAnomaly());
        assertEquals(mean, detector.getMean(), 0.0);
        assertEquals(100, detector.getSampleCount());
    }

    @Test
    public void testUpdatingWithAnAnomalyShiftsTheBaseline() {
        AdaptiveAnomalyDetector detector = new AdaptiveAnomalyDetector(100, 0.1);
        detector.initializeWithNormalData(ExampleDataSets.normalSeries(100, 50, 2, 3));
        double mean = detector.getMean();

        assertTrue(detector.detect(500).isAnomaly());
        detector.updateNormal(500);

        assertEquals(mean + 0.1 * (500 - mean), detector.getMean(), 1e-9);
    }

    @Tag("functional")
    @Test
    public void testGatedUpdatesMoveAtMostOneStep() {
        double rate = 0.05;
        AdaptiveAnomalyDetector detector = new AdaptiveAnomalyDetector(200, rate);
        detector.initializeWithNormalData(ExampleDataSets.normalSeries(200, 50, 2, 5));
        double[] stream = ExampleDataSets.normalSeries(1000, 50, 4, 6);

        for (double value : stream) {
            double mean = detector.getMean();
            double band = detector.getConfig().getSigmaMultiplier() * detector.getStdDev();
            AnomalyResult result = detector.detect(value);
            if (!result.isAnomaly()) {
                detector.updateNormal(value);
                assertTrue(Math.abs(detector.getMean() - mean) <= rate * band + 1e-9);
            } else {
                assertEquals(mean, detector.getMean(), 0.0);
            }
        }
    }

    @Tag("functional")
    @Test
    public void testConvergesToNewLevel() {
        AdaptiveAnomalyDetector detector = new AdaptiveAnomalyDetector(100, 0.05);
        detector.initializeWithNormalData(ExampleDataSets.normalSeries(100, 50, 2, 7));
        for (int i = 0; i < 1000; i++) {
            detector.updateNormal(80);
        }
        assertEquals(80.0, detector.getMean(), 0.01);
        assertFalse(detector.detect(80).isAnomaly());
    }
}
