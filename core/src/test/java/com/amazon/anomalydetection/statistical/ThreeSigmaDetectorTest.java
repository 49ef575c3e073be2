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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.amazon.anomalydetection.config.DetectionConfig;
import com.amazon.anomalydetection.errors.InsufficientDataException;
import com.amazon.anomalydetection.errors.NotTrainedException;
import com.amazon.anomalydetection.errors.ValidationException;
import com.amazon.anomalydetection.returntypes.AnomalyResult;
import com.amazon.anomalydetection.testutils.ExampleDataSets;

public class ThreeSigmaDetectorTest {

    @Test
    public void testDetectBeforeBuildThrows() {
        ThreeSigmaDetector detector = new ThreeSigmaDetector();
        detector.addValue(1.0);
        assertFalse(detector.isInitialized());
        assertThrows(NotTrainedException.class, () -> detector.detect(1.0));
        assertThrows(NotTrainedException.class, detector::getMean);
    }

    @Test
    public void testBuildWithoutDataThrows() {
        assertThrows(InsufficientDataException.class, () -> new ThreeSigmaDetector().build());
    }

    @Test
    public void testInvalidValues() {
        ThreeSigmaDetector detector = new ThreeSigmaDetector();
        assertThrows(ValidationException.class, () -> detector.addValue(Double.NaN));
        detector.addValues(new double[] { 1, 2, 3 });
        detector.build();
        assertThrows(ValidationException.class, () -> detector.detect(Double.POSITIVE_INFINITY));
    }

    @Test
    public void testPopulationStatisticsAndLimits() {
        ThreeSigmaDetector detector = new ThreeSigmaDetector(
                DetectionConfig.builder().sigmaMultiplier(2.0).build());
        detector.addValues(new double[] { 2, 4, 4, 4, 5, 5, 7, 9 });
        detector.build();

        assertEquals(5.0, detector.getMean(), 1e-12);
        assertEquals(2.0, detector.getStdDev(), 1e-12);
        assertEquals(1.0, detector.getLowerLimit(), 1e-12);
        assertEquals(9.0, detector.getUpperLimit(), 1e-12);

        AnomalyResult below = detector.detect(0.0);
        assertTrue(below.isAnomaly());
        assertEquals(-2.5, below.getScore(), 1e-12);
        assertTrue(below.getDescription().contains("below lower limit"));

        AnomalyResult edge = detector.detect(9.0);
        assertFalse(edge.isAnomaly());
        assertEquals(1.0, edge.getLowerLimit(), 1e-12);
        assertEquals(9.0, edge.getUpperLimit(), 1e-12);
    }

    @Test
    public void testValuesAfterBuildTakeEffectOnRebuild() {
        ThreeSigmaDetector detector = new ThreeSigmaDetector();
        detector.addValues(new double[] { 10, 10, 10 });
        detector.build();
        detector.addValues(new double[] { 20, 20, 20 });

        assertEquals(10.0, detector.getMean(), 1e-12);
        assertEquals(6, detector.getDataCount());

        detector.build();
        assertEquals(15.0, detector.getMean(), 1e-12);
        assertEquals(5.0, detector.getStdDev(), 1e-12);
    }

    @Tag("functional")
    @Test
    public void testNormalBaseline() {
        ThreeSigmaDetector detector = new ThreeSigmaDetector();
        detector.addValues(ExampleDataSets.normalSeries(700, 100, 10, 42));
        detector.build();

        assertThat(detector.getMean(), closeTo(100, 2));
        assertThat(detector.getStdDev(), closeTo(10, 1));

        assertFalse(detector.detect(100).isAnomaly());

        AnomalyResult result = detector.detect(140);
        assertTrue(result.isAnomaly());
        assertThat(result.getScore(), closeTo(4, 0.5));
    }
}
