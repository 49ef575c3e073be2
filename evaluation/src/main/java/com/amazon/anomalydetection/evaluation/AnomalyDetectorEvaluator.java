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

package com.amazon.anomalydetection.evaluation;

import static com.amazon.anomalydetection.CommonUtils.checkArgument;
import static com.amazon.anomalydetection.CommonUtils.checkNotNull;
import static com.amazon.anomalydetection.CommonUtils.checkSufficientData;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalydetection.IAnomalyDetector;
import com.amazon.anomalydetection.monitoring.ConfusionMatrix;

/**
 * Runs a detector over a labeled data set and compares every verdict with the
 * ground truth label. Each verdict is also recorded in the detector's
 * performance monitor, so that its metrics carry the same confusion matrix.
 */
@Slf4j
public class AnomalyDetectorEvaluator {

    public static final double DEFAULT_TRAIN_RATIO = 0.7;

    public static final int DEFAULT_FOLDS = 5;

    @Getter
    private final IAnomalyDetector detector;

    @Getter
    private final LabeledDataset dataset;

    public AnomalyDetectorEvaluator(IAnomalyDetector detector, LabeledDataset dataset) {
        this.detector = checkNotNull(detector, "detector must not be null");
        this.dataset = checkNotNull(dataset, "dataset must not be null");
    }

    /**
     * Evaluates the detector, which must already be trained, on every point of
     * the data set.
     *
     * @return the evaluation result
     */
    public EvaluationResult evaluate() {
        checkSufficientData(!dataset.isEmpty(), "cannot evaluate on an empty dataset");
        return evaluate(detector, dataset.getPoints());
    }

    public EvaluationResult evaluateWithTrainTestSplit() {
        return evaluateWithTrainTestSplit(DEFAULT_TRAIN_RATIO);
    }

    /**
     * Feeds the leading {@code trainRatio} share of the data set to the detector
     * as training data, builds it and evaluates it on the remaining points.
     *
     * @param trainRatio the share of points used for training, in (0, 1)
     * @return the evaluation result on the test part
     */
    public EvaluationResult evaluateWithTrainTestSplit(double trainRatio) {
        checkSufficientData(!dataset.isEmpty(), "cannot evaluate on an empty dataset");
        checkArgument(trainRatio > 0 && trainRatio < 1, "trainRatio must be in (0, 1)");
        List<LabeledDataPoint> points = dataset.getPoints();
        int trainSize = (int) Math.floor(points.size() * trainRatio);
        checkSufficientData(trainSize > 0, "train part is empty");
        checkSufficientData(trainSize < points.size(), "test part is empty");
        log.debug("train/test split: {} train, {} test", trainSize, points.size() - trainSize);

        train(detector, points.subList(0, trainSize));
        return evaluate(detector, points.subList(trainSize, points.size()));
    }

    public List<EvaluationResult> crossValidate(Supplier<? extends IAnomalyDetector> detectorSupplier) {
        return crossValidate(DEFAULT_FOLDS, detectorSupplier);
    }

    /**
     * K-fold cross validation over contiguous folds. Every fold is scored by a
     * fresh detector trained on all the points outside the fold; the last fold
     * absorbs the remainder of the division.
     *
     * @param folds            number of folds, at least 2 and at most the size of
     *                         the data set
     * @param detectorSupplier creates an untrained detector per fold
     * @return one result per fold
     */
    public List<EvaluationResult> crossValidate(int folds, Supplier<? extends IAnomalyDetector> detectorSupplier) {
        checkNotNull(detectorSupplier, "detectorSupplier must not be null");
        checkSufficientData(!dataset.isEmpty(), "cannot evaluate on an empty dataset");
        checkArgument(folds >= 2, "folds must be at least 2");
        List<LabeledDataPoint> points = dataset.getPoints();
        checkArgument(folds <= points.size(),
                String.format("folds (%d) cannot exceed the dataset size (%d)", folds, points.size()));

        int foldSize = points.size() / folds;
        List<EvaluationResult> results = new ArrayList<>(folds);
        for (int i = 0; i < folds; i++) {
            int start = i * foldSize;
            int end = (i == folds - 1) ? points.size() : start + foldSize;
            List<LabeledDataPoint> trainPoints = new ArrayList<>(points.subList(0, start));
            trainPoints.addAll(points.subList(end, points.size()));

            IAnomalyDetector foldDetector = checkNotNull(detectorSupplier.get(), "supplier returned null");
            train(foldDetector, trainPoints);
            EvaluationResult result = evaluate(foldDetector, points.subList(start, end));
            log.debug("fold {}/{}: {}", i + 1, folds, result.getConfusionMatrix());
            results.add(result);
        }
        return results;
    }

    public String generateReport(EvaluationResult result) {
        return checkNotNull(result, "result must not be null").getSummary();
    }

    public String generateCrossValidationReport(List<EvaluationResult> results) {
        checkArgument(results != null && !results.isEmpty(), "results must not be empty");
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Cross-Validation Results (%d folds):%n", results.size()));
        sb.append("=".repeat(60)).append(System.lineSeparator()).append(System.lineSeparator());
        double accuracy = 0;
        double precision = 0;
        double recall = 0;
        double f1 = 0;
        for (int i = 0; i < results.size(); i++) {
            ConfusionMatrix matrix = results.get(i).getConfusionMatrix();
            sb.append(String.format("Fold %d: %s%n", i + 1, matrix));
            accuracy += matrix.getAccuracy();
            precision += matrix.getPrecision();
            recall += matrix.getRecall();
            f1 += matrix.getF1Score();
        }
        int n = results.size();
        sb.append(System.lineSeparator()).append("Average Metrics:").append(System.lineSeparator());
        sb.append(String.format("  Accuracy:  %.3f%n", accuracy / n));
        sb.append(String.format("  Precision: %.3f%n", precision / n));
        sb.append(String.format("  Recall:    %.3f%n", recall / n));
        sb.append(String.format("  F1-Score:  %.3f%n", f1 / n));
        return sb.toString();
    }

    private static void train(IAnomalyDetector detector, List<LabeledDataPoint> points) {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        detector.addValues(values);
        detector.build();
    }

    static EvaluationResult evaluate(IAnomalyDetector detector, List<LabeledDataPoint> points) {
        long start = System.currentTimeMillis();
        ConfusionMatrix matrix = new ConfusionMatrix();
        int anomalies = 0;
        for (LabeledDataPoint point : points) {
            boolean predicted = detector.detect(point.getValue()).isAnomaly();
            matrix.record(point.isAnomaly(), predicted);
            detector.getPerformanceMonitor().recordGroundTruth(point.isAnomaly(), predicted);
            if (point.isAnomaly()) {
                ++anomalies;
            }
        }
        EvaluationResult result = EvaluationResult.builder().detectorName(detector.getName()).confusionMatrix(matrix)
                .datasetSize(points.size()).anomaliesInDataset(anomalies).normalInDataset(points.size() - anomalies)
                .evaluationTimeMs(System.currentTimeMillis() - start).build();
        log.info("evaluated {} on {} points: {}", detector.getName(), points.size(), matrix);
        return result;
    }
}
