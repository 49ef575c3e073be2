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

package com.amazon.anomalydetection.density;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.amazon.anomalydetection.config.ReclusterPolicy;
import com.amazon.anomalydetection.errors.ConfigurationException;
import com.amazon.anomalydetection.errors.InsufficientDataException;
import com.amazon.anomalydetection.errors.NotTrainedException;
import com.amazon.anomalydetection.errors.ValidationException;
import com.amazon.anomalydetection.returntypes.AnomalyResult;
import com.amazon.anomalydetection.testutils.ExampleDataSets;

public class DBSCANDetectorTest {

    private static DBSCANDetector twoClusters() {
        DBSCANDetector detector = new DBSCANDetector(1.0, 4, 2, 1000, ReclusterPolicy.manual());
        for (double[] point : ExampleDataSets.gaussianClusters(new double[][] { { 0, 0 }, { 10, 10 } }, 30, 0.25,
                13)) {
            detector.addPoint(point);
        }
        detector.recluster();
        return detector;
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(ConfigurationException.class, () -> new DBSCANDetector(0, 4, 2));
        assertThrows(ConfigurationException.class, () -> new DBSCANDetector(1.0, 0, 2));
        assertThrows(ConfigurationException.class, () -> new DBSCANDetector(1.0, 4, 0));
        assertThrows(ConfigurationException.class,
                () -> new DBSCANDetector(1.0, 10, 2, 5, ReclusterPolicy.eager()));
    }

    @Test
    public void testTwoClusters() {
        DBSCANDetector detector = twoClusters();

        assertEquals(2, detector.getClusterCount());
        int[] labels = detector.getClusterLabels();
        assertEquals(60, labels.length);
        assertTrue(Arrays.stream(labels).allMatch(label -> label != DBSCANDetector.UNCLASSIFIED));
        assertTrue(detector.getLastClusteringTime().isPresent());
    }

    @Test
    public void testDetection() {
        DBSCANDetector detector = twoClusters();

        AnomalyResult inside = detector.detectMultiDimensional(new double[] { 0.1, 0.1 });
        assertFalse(inside.isAnomaly());
        assertFalse(inside.hasLimits());

        AnomalyResult between = detector.detectMultiDimensional(new double[] { 5, 5 });
        assertTrue(between.isAnomaly());
        assertThat(between.getScore(), greaterThan(1.0));
    }

    @Test
    public void testFarPointIsOutlier() {
        DBSCANDetector detector = twoClusters();
        detector.addPoint(new double[] { 50, 50 });
        detector.recluster();

        assertEquals(1, detector.getOutlierCount());
        int[] labels = detector.getClusterLabels();
        assertEquals(DBSCANDetector.NOISE, labels[labels.length - 1]);
        assertEquals(2, detector.getClusterCount());
    }

    @Test
    public void testBorderPointVisitedFirstJoinsCluster() {
        DBSCANDetector detector = new DBSCANDetector(1.0, 3, 1, 100, ReclusterPolicy.manual());
        // 2.4 has only one neighbor, but it is within reach of the core point 1.5
        detector.addValues(new double[] { 2.4, 1.0, 0.5, 1.5 });
        detector.recluster();

        assertArrayEquals(new int[] { 1, 1, 1, 1 }, detector.getClusterLabels());
        assertEquals(0, detector.getOutlierCount());
        assertEquals(1, detector.getClusterCount());
    }

    @Test
    public void testTooFewPoints() {
        DBSCANDetector detector = new DBSCANDetector(1.0, 5, 1);
        detector.addValues(new double[] { 1, 2, 3 });
        assertThrows(InsufficientDataException.class, () -> detector.detect(1));
        assertThrows(InsufficientDataException.class, () -> new DBSCANDetector().recluster());
    }

    @Test
    public void testManualPolicyRequiresRecluster() {
        DBSCANDetector detector = new DBSCANDetector(1.0, 3, 1, 100, ReclusterPolicy.manual());
        detector.addValues(new double[] { 1, 1.1, 1.2, 1.3, 1.4 });
        assertFalse(detector.isInitialized());
        assertThrows(NotTrainedException.class, () -> detector.detect(1));

        detector.build();
        assertTrue(detector.isInitialized());
        assertFalse(detector.detect(1.05).isAnomaly());
    }

    @Test
    public void testPeriodicPolicy() {
        DBSCANDetector detector = new DBSCANDetector(1.0, 5, 1, 100, ReclusterPolicy.periodic(10));
        detector.addValues(new double[] { 1, 1.1, 1.2, 1.3, 1.4 });
        // the first clustering happens as soon as there are enough points
        assertTrue(detector.isInitialized());

        detector.addValues(new double[] { 1.5, 1.6, 1.7 });
        int[] labels = detector.getClusterLabels();
        assertEquals(DBSCANDetector.UNCLASSIFIED, labels[7]);

        detector.addValues(new double[] { 1.8, 1.9, 2.0, 2.1, 2.2, 2.3, 2.4 });
        assertTrue(Arrays.stream(detector.getClusterLabels()).allMatch(label -> label == 1));
    }

    @Test
    public void testEagerPolicy() {
        DBSCANDetector detector = new DBSCANDetector(1.0, 3, 1, 100, ReclusterPolicy.eager());
        detector.addValues(new double[] { 1, 1.1, 1.2, 50 });
        int[] labels = detector.getClusterLabels();
        assertEquals(DBSCANDetector.NOISE, labels[3]);
    }

    @Test
    public void testHistoryIsBounded() {
        DBSCANDetector detector = new DBSCANDetector(1.0, 3, 1, 10, ReclusterPolicy.manual());
        for (int i = 0; i < 15; i++) {
            detector.addValue(i * 0.1);
        }
        assertEquals(10, detector.getHistorySize());
    }

    @Test
    public void testReset() {
        DBSCANDetector detector = twoClusters();
        detector.reset();
        assertEquals(0, detector.getHistorySize());
        assertEquals(0, detector.getClusterCount());
        assertFalse(detector.isInitialized());
        assertFalse(detector.getLastClusteringTime().isPresent());
    }

    @Test
    public void testInvalidPoints() {
        DBSCANDetector detector = twoClusters();
        int size = detector.getHistorySize();

        assertThrows(ValidationException.class, () -> detector.addPoint(new double[] { 1, 2, 3 }));
        assertThrows(ValidationException.class, () -> detector.addPoint(new double[] { 1, Double.NaN }));
        assertThrows(ValidationException.class, () -> detector.addPoint(null));
        assertThrows(ValidationException.class, () -> detector.addValue(1.0));
        assertEquals(size, detector.getHistorySize());

        assertThrows(ValidationException.class, () -> detector.detectMultiDimensional(new double[] { 0 }));
        assertThrows(ValidationException.class,
                () -> detector.detectMultiDimensional(new double[] { Double.POSITIVE_INFINITY, 0 }));
        assertThrows(ValidationException.class, () -> detector.detect(0.0));
    }
}
