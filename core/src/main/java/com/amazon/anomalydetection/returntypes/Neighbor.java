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

import java.util.Comparator;

/**
 * A Neighbor represents a stored point together with a distance, where the
 * distance is with respect to some query point. The point is referred to by its
 * position in the history of the detector that produced it.
 */
public class Neighbor {

    /**
     * Orders neighbors by increasing distance, ties broken by history position so
     * that neighbor lists are deterministic.
     */
    public static final Comparator<Neighbor> BY_DISTANCE = Comparator.<Neighbor>comparingDouble(n -> n.distance)
            .thenComparingInt(n -> n.index);

    /**
     * The position of the neighbor point in the detector history.
     */
    public final int index;

    /**
     * The distance between the neighbor point and the query point it was found
     * for.
     */
    public final double distance;

    /**
     * Create a new Neighbor.
     *
     * @param index    The position of the neighbor point in the history.
     * @param distance The distance between the neighbor point and the query point.
     */
    public Neighbor(int index, double distance) {
        this.index = index;
        this.distance = distance;
    }

    @Override
    public String toString() {
        return String.format("Neighbor(%d, %f)", index, distance);
    }
}
