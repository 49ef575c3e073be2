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

import static com.amazon.anomalydetection.CommonUtils.checkState;

/**
 * Population mean and standard deviation of a sequence of values, maintained
 * with Welford's update so that long sequences of large, nearly equal values
 * do not lose precision the way a sum and sum of squares would.
 */
public class Deviation {

    protected double mean = 0;

    // sum of squared differences from the current mean
    protected double squaredDifferences = 0;

    protected long count = 0;

    public Deviation() {
    }

    public static Deviation of(double[] values) {
        Deviation deviation = new Deviation();
        for (double value : values) {
            deviation.update(value);
        }
        return deviation;
    }

    public static Deviation of(Iterable<Double> values) {
        Deviation deviation = new Deviation();
        for (double value : values) {
            deviation.update(value);
        }
        return deviation;
    }

    public void update(double value) {
        ++count;
        double delta = value - mean;
        mean += delta / count;
        squaredDifferences += delta * (value - mean);
    }

    public double getMean() {
        checkState(count > 0, "incorrect invocation for mean");
        return mean;
    }

    /**
     * @return the population standard deviation; 0 for a single value
     */
    public double getDeviation() {
        checkState(count > 0, "incorrect invocation for standard deviation");
        double variance = squaredDifferences / count;
        return (variance > 0) ? Math.sqrt(variance) : 0;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public long getCount() {
        return count;
    }

    public void reset() {
        mean = 0;
        squaredDifferences = 0;
        count = 0;
    }
}
