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

package com.amazon.anomalydetection.examples.evaluation;

import java.util.List;

import com.amazon.anomalydetection.config.DetectorType;
import com.amazon.anomalydetection.evaluation.AnomalyDetectorEvaluator;
import com.amazon.anomalydetection.evaluation.EvaluationResult;
import com.amazon.anomalydetection.evaluation.HyperparameterTuner;
import com.amazon.anomalydetection.evaluation.LabeledDataset;
import com.amazon.anomalydetection.evaluation.OptimizationMetric;
import com.amazon.anomalydetection.examples.Example;
import com.amazon.anomalydetection.statistical.ThreeSigmaDetector;

/**
 * Scores a detector on a generated labeled data set with a train/test split
 * and with cross validation, then searches for a better sigma multiplier.
 */
public class DetectorTuning implements Example {

    public static void main(String[] args) throws Exception {
        new DetectorTuning().run();
    }

    @Override
    public String command() {
        return "tuning";
    }

    @Override
    public String description() {
        return "evaluate a detector on labeled data and tune its parameters";
    }

    @Override
    public void run() throws Exception {
        LabeledDataset dataset = new LabeledDataset("generated", 2024L);
        dataset.setDescription("normal(100, 10) with 5% anomalies");
        dataset.generateMixedDataset(950, 50, 100, 10);
        System.out.printf("%s: %d points, %.1f%% anomalies%n%n", dataset.getName(), dataset.size(),
                dataset.getAnomalyPercentage());

        AnomalyDetectorEvaluator evaluator = new AnomalyDetectorEvaluator(new ThreeSigmaDetector(), dataset);
        EvaluationResult split = evaluator.evaluateWithTrainTestSplit(0.7);
        System.out.println(evaluator.generateReport(split));

        List<EvaluationResult> folds = evaluator.crossValidate(5, ThreeSigmaDetector::new);
        System.out.println(evaluator.generateCrossValidationReport(folds));

        HyperparameterTuner tuner = new HyperparameterTuner(DetectorType.SLIDING_WINDOW, dataset);
        tuner.setOptimizationMetric(OptimizationMetric.MCC);
        tuner.gridSearch(new double[] { 2.0, 2.5, 3.0, 3.5 }, new double[] { 0.001, 0.1 }, new int[] { 50, 200 },
                null);
        System.out.println(tuner.generateTuningReport());
    }
}
