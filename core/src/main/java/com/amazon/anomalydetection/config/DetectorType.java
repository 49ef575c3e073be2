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

package com.amazon.anomalydetection.config;

/**
 * The detector algorithms available in this library.
 */
public enum DetectorType {
    /**
     * batch mean and standard deviation over a fixed training set
     */
    THREE_SIGMA,
    /**
     * statistics over the most recent N values
     */
    SLIDING_WINDOW,
    /**
     * exponentially weighted mean and variance
     */
    EMA,
    /**
     * baseline that only learns from values the caller confirms as normal
     */
    ADAPTIVE,
    /**
     * random isolation trees over multi-dimensional points
     */
    ISOLATION_FOREST,
    /**
     * density based clustering, outliers are points reachable from no core point
     */
    DBSCAN,
    /**
     * local outlier factor, ratio of neighbor density to the density at a point
     */
    LOF;

    /**
     * @return true for the univariate detectors that expose mean and standard
     *         deviation
     */
    public boolean isStatistical() {
        return this == THREE_SIGMA || this == SLIDING_WINDOW || this == EMA || this == ADAPTIVE;
    }
}
