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

package com.amazon.anomalydetection.returntypes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class AnomalyResultTest {

    @Test
    public void testLimitsMustBeOrdered() {
        assertThrows(IllegalArgumentException.class,
                () -> AnomalyResult.builder().lowerLimit(2).upperLimit(1).build());
    }

    @Test
    public void testUndefinedLimits() {
        AnomalyResult result = AnomalyResult.builder().anomaly(true).score(3.0).build();
        assertFalse(result.hasLimits());
        assertTrue(Double.isNaN(result.getLowerLimit()));
        assertEquals("", result.getDescription());

        AnomalyResult halfDefined = AnomalyResult.builder().lowerLimit(5).build();
        assertFalse(halfDefined.hasLimits());
    }

    @Test
    public void testNotInitialized() {
        AnomalyResult result = AnomalyResult.notInitialized(4.0, "empty");
        assertFalse(result.isAnomaly());
        assertFalse(result.hasLimits());
        assertEquals(4.0, result.getValue());
        assertEquals("empty", result.getDescription());
    }

    @Test
    public void testNeighborOrdering() {
        Neighbor near = new Neighbor(7, 1.0);
        Neighbor tie = new Neighbor(3, 1.0);
        Neighbor far = new Neighbor(0, 2.0);
        assertTrue(Neighbor.BY_DISTANCE.compare(near, far) < 0);
        assertTrue(Neighbor.BY_DISTANCE.compare(tie, near) < 0);
    }
}
