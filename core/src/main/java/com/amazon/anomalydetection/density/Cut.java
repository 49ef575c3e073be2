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

/**
 * An axis-parallel split of the space in an isolation tree. Points whose
 * coordinate in the cut dimension is strictly smaller than the cut value go to
 * the left.
 */
public class Cut {

    private final int dimension;
    private final double value;

    /**
     * @param dimension The 0-based index of the dimension that the cut is made in.
     * @param value     The split value.
     */
    public Cut(int dimension, double value) {
        this.dimension = dimension;
        this.value = value;
    }

    public static boolean isLeftOf(double[] point, Cut cut) {
        return point[cut.getDimension()] < cut.getValue();
    }

    public int getDimension() {
        return dimension;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("Cut(%d, %f)", dimension, value);
    }
}
