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
 * Seeded data sets with a known shape, used to check that detectors find what
 * was planted.
 */
public class ExampleDataSets {

    private ExampleDataSets() {
    }

    public static double[] normalSeries(int size, double mean, double stdDev, long seed) {
        NormalDistribution dist = new NormalDistribution(seed);
        double[] result = new double[size];
        for (int i = 0; i < size; i++) {
            result[i] = dist.nextDouble(mean, stdDev);
        }
        return result;
    }

    /**
     * Consecutive regimes of {@code valuesPerRegime} values, regime i centered at
     * {@code centers[i]}.
     */
    public static double[] regimeShifts(double[] centers, int valuesPerRegime, double stdDev, long seed) {
        NormalDistribution dist = new NormalDistribution(seed);
        double[] result = new double[centers.length * valuesPerRegime];
        for (int r = 0; r < centers.length; r++) {
            for (int i = 0; i < valuesPerRegime; i++) {
                result[r * valuesPerRegime + i] = dist.nextDouble(centers[r], stdDev);
            }
        }
        return result;
    }

    /**
     * Spherical normal clusters, {@code pointsPerCluster} points around each
     * center, emitted cluster by cluster.
     */
    public static double[][] gaussianClusters(double[][] centers, int pointsPerCluster, double stdDev, long seed) {
        NormalDistribution dist = new NormalDistribution(seed);
        double[][] result = new double[centers.length * pointsPerCluster][];
        int row = 0;
        for (double[] center : centers) {
            for (int i = 0; i < pointsPerCluster; i++) {
                double[] point = new double[center.length];
                for (int j = 0; j < center.length; j++) {
                    point[j] = dist.nextDouble(center[j], stdDev);
                }
                result[row++] = point;
            }
        }
        return result;
    }

    /**
     * Points on a regular grid with the given spacing, starting at the origin;
     * every interior point has the same neighborhood.
     */
    public static double[][] grid(int pointsPerSide, double spacing) {
        double[][] result = new double[pointsPerSide * pointsPerSide][];
        for (int i = 0; i < pointsPerSide; i++) {
            for (int j = 0; j < pointsPerSide; j++) {
                result[i * pointsPerSide + j] = new double[] { i * spacing, j * spacing };
            }
        }
        return result;
    }
}
