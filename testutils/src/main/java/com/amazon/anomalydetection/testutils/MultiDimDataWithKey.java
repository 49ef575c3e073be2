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

package com.amazon.anomalydetection.testutils;

/**
 * Generated rows together with the ground truth: whether each row was drawn
 * from the anomaly distribution, and the rows at which the generator switched
 * between the base and the anomaly distribution.
 */
public class MultiDimDataWithKey {

    public final double[][] data;

    public final boolean[] labels;

    public final int[] changeIndices;

    public MultiDimDataWithKey(double[][] data, boolean[] labels, int[] changeIndices) {
        this.data = data;
        this.labels = labels;
        this.changeIndices = changeIndices;
    }

    public int getAnomalyCount() {
        int count = 0;
        for (boolean label : labels) {
            if (label) {
                ++count;
            }
        }
        return count;
    }
}
