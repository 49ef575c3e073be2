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

import java.util.Arrays;

/**
 * This class samples point from a mixture of 2 multi-variate normal
 * distribution with covariance matrices of the form sigma * I. One of the
 * normal distributions is considered the base distribution, the second is
 * considered the anomaly distribution, and there are random transitions between
 * the two. Both the samples and the transitions come from the seeded generator.
 */
public class NormalMixtureTestData {

    private final double baseMu;
    private final double baseSigma;
    private final double anomalyMu;
    private final double anomalySigma;
    private final double transitionToAnomalyProbability;
    private final double transitionToBaseProbability;

    public NormalMixtureTestData(double baseMu, double baseSigma, double anomalyMu, double anomalySigma,
            double transitionToAnomalyProbability, double transitionToBaseProbability) {
        this.baseMu = baseMu;
        this.baseSigma = baseSigma;
        this.anomalyMu = anomalyMu;
        this.anomalySigma = anomalySigma;
        this.transitionToAnomalyProbability = transitionToAnomalyProbability;
        this.transitionToBaseProbability = transitionToBaseProbability;
    }

    public NormalMixtureTestData() {
        this(0.0, 1.0, 4.0, 2.0, 0.01, 0.3);
    }

    public NormalMixtureTestData(double baseMu, double anomalyMu) {
        this(baseMu, 1.0, anomalyMu, 2.0, 0.01, 0.3);
    }

    public double[][] generateTestData(int numberOfRows, int numberOfColumns, long seed) {
        return generateTestDataWithKey(numberOfRows, numberOfColumns, seed).data;
    }

    /**
     * @return the first column of {@link #generateTestData(int, int, long)}
     */
    public double[] generateSeries(int numberOfRows, long seed) {
        double[][] rows = generateTestData(numberOfRows, 1, seed);
        double[] series = new double[numberOfRows];
        for (int i = 0; i < numberOfRows; i++) {
            series[i] = rows[i][0];
        }
        return series;
    }

    public MultiDimDataWithKey generateTestDataWithKey(int numberOfRows, int numberOfColumns, long seed) {
        double[][] resultData = new double[numberOfRows][numberOfColumns];
        boolean[] labels = new boolean[numberOfRows];
        int[] change = new int[numberOfRows];
        int numberOfChanges = 0;
        boolean anomaly = false;

        NormalDistribution dist = new NormalDistribution(seed);

        for (int i = 0; i < numberOfRows; i++) {
            labels[i] = anomaly;
            if (!anomaly) {
                fillRow(resultData[i], dist, baseMu, baseSigma);
                if (dist.getRandom().nextDouble() < transitionToAnomalyProbability) {
                    change[numberOfChanges++] = i + 1; // next item is different
                    anomaly = true;
                }
            } else {
                fillRow(resultData[i], dist, anomalyMu, anomalySigma);
                if (dist.getRandom().nextDouble() < transitionToBaseProbability) {
                    anomaly = false;
                    change[numberOfChanges++] = i + 1; // next item is different
                }
            }
        }

        return new MultiDimDataWithKey(resultData, labels, Arrays.copyOf(change, numberOfChanges));
    }

    private void fillRow(double[] row, NormalDistribution dist, double mu, double sigma) {
        for (int j = 0; j < row.length; j++) {
            row[j] = dist.nextDouble(mu, sigma);
        }
    }
}
