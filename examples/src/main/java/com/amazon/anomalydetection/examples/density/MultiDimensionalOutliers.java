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

package com.amazon.anomalydetection.examples.density;

import java.util.Arrays;
import java.util.List;

import com.amazon.anomalydetection.IDensityAnomalyDetector;
import com.amazon.anomalydetection.config.ReclusterPolicy;
import com.amazon.anomalydetection.density.DBSCANDetector;
import com.amazon.anomalydetection.density.IsolationForestDetector;
import com.amazon.anomalydetection.density.LOFDetector;
import com.amazon.anomalydetection.examples.Example;
import com.amazon.anomalydetection.returntypes.AnomalyResult;
import com.amazon.anomalydetection.testutils.ExampleDataSets;

/**
 * Trains the three density detectors on two well separated clusters and asks
 * each of them about points inside the clusters, between them and far away.
 */
public class MultiDimensionalOutliers implements Example {

    public static void main(String[] args) throws Exception {
        new MultiDimensionalOutliers().run();
    }

    @Override
    public String command() {
        return "density";
    }

    @Override
    public String description() {
        return "isolation forest, DBSCAN and LOF on two dimensional clusters";
    }

    @Override
    public void run() throws Exception {
        int dimensions = 2;
        double[][] training = ExampleDataSets.gaussianClusters(new double[][] { { 0, 0 }, { 8, 8 } }, 200, 1.0, 7);

        IsolationForestDetector forest = IsolationForestDetector.builder().dimensions(dimensions).numberOfTrees(100)
                .subSampleSize(256).randomSeed(42).build();
        DBSCANDetector dbscan = new DBSCANDetector(0.8, 5, dimensions, 1000, ReclusterPolicy.manual());
        LOFDetector lof = LOFDetector.builder().k(10).dimensions(dimensions).build();
        List<IDensityAnomalyDetector> detectors = Arrays.asList(forest, dbscan, lof);

        for (IDensityAnomalyDetector detector : detectors) {
            for (double[] point : training) {
                detector.addTrainingData(point);
            }
            detector.train();
        }
        System.out.printf("DBSCAN found %d clusters and %d outliers in %d training points%n%n",
                dbscan.getClusterCount(), dbscan.getOutlierCount(), dbscan.getHistorySize());

        double[][] queries = { { 0.5, 0.2 }, { 8.0, 7.5 }, { 4.0, 4.0 }, { 20.0, -5.0 } };
        for (double[] query : queries) {
            System.out.printf("point (%.1f, %.1f)%n", query[0], query[1]);
            for (IDensityAnomalyDetector detector : detectors) {
                AnomalyResult result = detector.detectMultiDimensional(query);
                System.out.printf("  %-26s %-8s score %6.3f  %s%n", detector.getName(),
                        result.isAnomaly() ? "ANOMALY" : "normal", result.getScore(), result.getDescription());
            }
        }
    }
}
