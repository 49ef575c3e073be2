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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import com.amazon.anomalydetection.monitoring.ConfusionMatrix;

public class OptimizationMetricTest {

    @Test
    public void testEachMetricReadsTheMatrix() {
        ConfusionMatrix matrix = new ConfusionMatrix(8, 2, 85, 5);

        assertEquals(matrix.getF1Score(), OptimizationMetric.F1.score(matrix), 0.0);
        assertEquals(0.8, OptimizationMetric.PRECISION.score(matrix), 1e-12);
        assertEquals(8.0 / 13, OptimizationMetric.RECALL.score(matrix), 1e-12);
        assertEquals(0.93, OptimizationMetric.ACCURACY.score(matrix), 1e-12);
        assertEquals(matrix.getMatthewsCorrelationCoefficient(), OptimizationMetric.MCC.score(matrix), 0.0);
    }
}
