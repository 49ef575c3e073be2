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

package com.amazon.anomalydetection.statistics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class DeviationTest {

    @Test
    public void testPopulationStatistics() {
        Deviation deviation = Deviation.of(new double[] { 2, 4, 4, 4, 5, 5, 7, 9 });
        assertEquals(5.0, deviation.getMean(), 1e-12);
        assertEquals(2.0, deviation.getDeviation(), 1e-12);
        assertEquals(8, deviation.getCount());
    }

    @Test
    public void testLargeOffsetKeepsPrecision() {
        double offset = 1e9;
        Deviation deviation = Deviation
                .of(new double[] { offset + 4, offset + 7, offset + 13, offset + 16 });
        assertEquals(offset + 10, deviation.getMean(), 1e-6);
        assertEquals(Math.sqrt(22.5), deviation.getDeviation(), 1e-6);
    }

    @Test
    public void testSingleValue() {
        Deviation deviation = new Deviation();
        deviation.update(3.0);
        assertEquals(3.0, deviation.getMean());
        assertEquals(0.0, deviation.getDeviation());
    }

    @Test
    public void testEmpty() {
        Deviation deviation = new Deviation();
        assertTrue(deviation.isEmpty());
        assertThrows(IllegalStateException.class, deviation::getMean);
        assertThrows(IllegalStateException.class, deviation::getDeviation);

        deviation.update(1);
        deviation.reset();
        assertTrue(deviation.isEmpty());
    }
}
