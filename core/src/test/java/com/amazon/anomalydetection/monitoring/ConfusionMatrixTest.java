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

package com.amazon.anomalydetection.monitoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class ConfusionMatrixTest {

    @Test
    public void testMetrics() {
        ConfusionMatrix matrix = new ConfusionMatrix(40, 10, 45, 5);
        assertEquals(100, matrix.getTotal());
        assertEquals(0.85, matrix.getAccuracy(), 1e-12);
        assertEquals(0.8, matrix.getPrecision(), 1e-12);
        assertEquals(40.0 / 45, matrix.getRecall(), 1e-12);
        assertEquals(2 * 0.8 * (40.0 / 45) / (0.8 + 40.0 / 45), matrix.getF1Score(), 1e-12);
        assertEquals(45.0 / 55, matrix.getSpecificity(), 1e-12);
        assertEquals(10.0 / 55, matrix.getFalsePositiveRate(), 1e-12);
        assertEquals(5.0 / 45, matrix.getFalseNegativeRate(), 1e-12);
        assertEquals(1750 / Math.sqrt(50.0 * 45 * 55 * 50), matrix.getMatthewsCorrelationCoefficient(), 1e-12);
    }

    @Test
    public void testZeroDenominators() {
        ConfusionMatrix matrix = new ConfusionMatrix();
        assertEquals(0, matrix.getAccuracy());
        assertEquals(0, matrix.getPrecision());
        assertEquals(0, matrix.getRecall());
        assertEquals(0, matrix.getF1Score());
        assertEquals(0, matrix.getMatthewsCorrelationCoefficient());
    }

    @Test
    public void testRecordAndAdd() {
        ConfusionMatrix matrix = new ConfusionMatrix();
        matrix.record(true, true);
        matrix.record(true, false);
        matrix.record(false, true);
        matrix.record(false, false);
        matrix.record(false, false);
        assertEquals(1, matrix.getTruePositives());
        assertEquals(1, matrix.getFalseNegatives());
        assertEquals(1, matrix.getFalsePositives());
        assertEquals(2, matrix.getTrueNegatives());

        ConfusionMatrix total = new ConfusionMatrix(matrix);
        total.add(matrix);
        assertEquals(10, total.getTotal());

        matrix.reset();
        assertEquals(0, matrix.getTotal());
        assertEquals(10, total.getTotal());
    }

    @Test
    public void testReports() {
        ConfusionMatrix matrix = new ConfusionMatrix(1, 2, 3, 4);
        assertTrue(matrix.toString().contains("TP=1"));
        assertTrue(matrix.toDetailedString().contains("MCC"));
    }
}
