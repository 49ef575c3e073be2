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

import static com.amazon.anomalydetection.CommonUtils.checkConfiguration;
import static com.amazon.anomalydetection.CommonUtils.checkNotNull;
import static com.amazon.anomalydetection.CommonUtils.checkPoint;
import static com.amazon.anomalydetection.CommonUtils.checkSufficientData;
import static com.amazon.anomalydetection.CommonUtils.checkTrained;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalydetection.CommonUtils;
import com.amazon.anomalydetection.config.DetectionConfig;
import com.amazon.anomalydetection.returntypes.AnomalyResult;

/**
 * Isolation Forest over points in {@code dimensions} dimensions. Training
 * builds {@code numberOfTrees} {@link IsolationTree}s, each over a uniform
 * sub-sample without replacement of {@code min(subSampleSize, n)} buffered
 * points. The score of a point is {@code 2^(-E[h] / c(s))}, where {@code E[h]}
 * is its mean adjusted path length over the trees and {@code c(s)} the average
 * path length for the sub-sample size. Scores close to 1 mark points that are
 * isolated quickly; the point is an anomaly when its score exceeds
 * {@code anomalyThreshold}.
 * <p>
 * All randomness comes from the generator given to the builder, so a fixed seed
 * reproduces the same forest.
 */
@Slf4j
public class IsolationForestDetector extends AbstractDensityDetector {

    public static final String NAME = "Isolation Forest Detector";

    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    public static final int DEFAULT_SUB_SAMPLE_SIZE = 256;

    public static final int DEFAULT_MAX_DEPTH = 10;

    public static final double DEFAULT_ANOMALY_THRESHOLD = 0.6;

    /**
     * Calibration sets the threshold to this percentile of the training scores.
     */
    public static final double CALIBRATION_PERCENTILE = 0.9;

    public static final int CALIBRATION_SAMPLE_SIZE = 100;

    public static final double MIN_CALIBRATED_THRESHOLD = 0.5;

    public static final double MAX_CALIBRATED_THRESHOLD = 0.9;

    @Getter
    private final int numberOfTrees;

    @Getter
    private final int subSampleSize;

    @Getter
    private final int maxDepth;

    @Getter
    private final boolean thresholdCalibrationEnabled;

    private final Optional<Integer> autoTrainThreshold;

    private final Random random;

    private final List<double[]> trainingData;

    private final List<IsolationTree> trees;

    @Getter
    private double anomalyThreshold;

    // the sub-sample size the current trees were built with
    private int effectiveSampleSize;

    private boolean trained;

    protected IsolationForestDetector(Builder<?> builder) {
        super(NAME, builder.config, builder.dimensions);
        checkConfiguration(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkConfiguration(builder.subSampleSize > 1, "subSampleSize must be greater than 1");
        checkConfiguration(builder.maxDepth > 0, "maxDepth must be greater than 0");
        checkConfiguration(builder.anomalyThreshold > 0 && builder.anomalyThreshold < 1,
                "anomalyThreshold must be in (0, 1)");
        builder.autoTrainThreshold
                .ifPresent(n -> checkConfiguration(n >= 2, "autoTrainThreshold must be at least 2"));
        numberOfTrees = builder.numberOfTrees;
        subSampleSize = builder.subSampleSize;
        maxDepth = builder.maxDepth;
        anomalyThreshold = builder.anomalyThreshold;
        thresholdCalibrationEnabled = builder.thresholdCalibrationEnabled;
        autoTrainThreshold = builder.autoTrainThreshold;
        random = builder.getRandom();
        trainingData = new ArrayList<>();
        trees = new ArrayList<>(numberOfTrees);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void addTrainingData(double[] point) {
        trainingData.add(checkPoint(point, dimensions).clone());
        autoTrainThreshold.ifPresent(n -> {
            if (!trained && trainingData.size() >= n) {
                log.info("training automatically after {} points", trainingData.size());
                train();
            }
        });
    }

    /**
     * Replaces the buffered points with the given data set and trains on it.
     *
     * @param dataset the training points
     */
    public void trainFromDataset(double[][] dataset) {
        checkNotNull(dataset, "dataset must not be null");
        for (double[] point : dataset) {
            checkPoint(point, dimensions);
        }
        trainingData.clear();
        for (double[] point : dataset) {
            trainingData.add(point.clone());
        }
        train();
    }

    @Override
    public void train() {
        int n = trainingData.size();
        checkSufficientData(n >= 2, "at least 2 training points are required");
        if (subSampleSize > n) {
            log.warn("subSampleSize {} exceeds the {} training points; using all of them", subSampleSize, n);
        }
        effectiveSampleSize = Math.min(subSampleSize, n);
        double[][] data = trainingData.toArray(new double[0][]);
        trees.clear();
        for (int i = 0; i < numberOfTrees; i++) {
            trees.add(IsolationTree.build(subSample(data, effectiveSampleSize), maxDepth, random));
        }
        trained = true;
        if (thresholdCalibrationEnabled) {
            calibrateThreshold(data);
        }
        log.info("trained {} trees over {} points, sub-sample size {}, threshold {}", numberOfTrees, n,
                effectiveSampleSize, anomalyThreshold);
    }

    // partial Fisher-Yates shuffle over a copy of the references
    private double[][] subSample(double[][] data, int size) {
        double[][] pool = Arrays.copyOf(data, data.length);
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(pool.length - i);
            double[] t = pool[i];
            pool[i] = pool[j];
            pool[j] = t;
        }
        return Arrays.copyOf(pool, size);
    }

    private void calibrateThreshold(double[][] data) {
        int stride = Math.max(1, data.length / CALIBRATION_SAMPLE_SIZE);
        List<Double> scores = new ArrayList<>();
        for (int i = 0; i < data.length && scores.size() < CALIBRATION_SAMPLE_SIZE; i += stride) {
            scores.add(score(data[i]));
        }
        scores.sort(Double::compare);
        int index = Math.max(0, (int) Math.ceil(CALIBRATION_PERCENTILE * scores.size()) - 1);
        double calibrated = Math.min(MAX_CALIBRATED_THRESHOLD, Math.max(MIN_CALIBRATED_THRESHOLD, scores.get(index)));
        log.debug("calibrated threshold from {} training scores: {}", scores.size(), calibrated);
        anomalyThreshold = calibrated;
    }

    /**
     * @param point a point of the detector's dimensionality
     * @return the anomaly score in (0, 1]
     */
    public double getAnomalyScore(double[] point) {
        checkPoint(point, dimensions);
        checkTrained(trained, "train() must be called before scoring");
        return score(point);
    }

    private double score(double[] point) {
        double total = 0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        double normalizer = IsolationTree.averagePathLength(effectiveSampleSize);
        return Math.pow(2, -(total / trees.size()) / normalizer);
    }

    @Override
    protected AnomalyResult computeDetection(double[] point) {
        checkTrained(trained, "train() must be called before detect()");
        double score = score(point);
        boolean anomaly = score > anomalyThreshold;
        String description = anomaly
                ? String.format("ISOLATION FOREST ANOMALY: Score %.4f (threshold %.4f)", score, anomalyThreshold)
                : String.format("Normal: Score %.4f (threshold %.4f)", score, anomalyThreshold);
        return AnomalyResult.builder().anomaly(anomaly).value(CommonUtils.coordinateMean(point)).score(score)
                .lowerLimit(0).upperLimit(anomalyThreshold).description(description).build();
    }

    @Override
    public boolean isInitialized() {
        return trained;
    }

    public int getTrainingDataSize() {
        return trainingData.size();
    }

    public Optional<Integer> getAutoTrainThreshold() {
        return autoTrainThreshold;
    }

    public static class Builder<T extends Builder<T>> {

        // Optional is used for settings without a constant default.

        private int dimensions;
        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int subSampleSize = DEFAULT_SUB_SAMPLE_SIZE;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private double anomalyThreshold = DEFAULT_ANOMALY_THRESHOLD;
        private boolean thresholdCalibrationEnabled = false;
        private Optional<Integer> autoTrainThreshold = Optional.empty();
        private Optional<Long> randomSeed = Optional.empty();
        private Optional<Random> random = Optional.empty();
        private DetectionConfig config = DetectionConfig.defaults();

        public T dimensions(int dimensions) {
            this.dimensions = dimensions;
            return (T) this;
        }

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T subSampleSize(int subSampleSize) {
            this.subSampleSize = subSampleSize;
            return (T) this;
        }

        public T maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return (T) this;
        }

        public T anomalyThreshold(double anomalyThreshold) {
            this.anomalyThreshold = anomalyThreshold;
            return (T) this;
        }

        public T thresholdCalibrationEnabled(boolean thresholdCalibrationEnabled) {
            this.thresholdCalibrationEnabled = thresholdCalibrationEnabled;
            return (T) this;
        }

        public T autoTrainThreshold(int autoTrainThreshold) {
            this.autoTrainThreshold = Optional.of(autoTrainThreshold);
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        /**
         * Uses the given generator; takes precedence over {@link #randomSeed(long)}.
         */
        public T random(Random random) {
            this.random = Optional.of(checkNotNull(random, "random must not be null"));
            return (T) this;
        }

        public T config(DetectionConfig config) {
            this.config = checkNotNull(config, "config must not be null");
            return (T) this;
        }

        public IsolationForestDetector build() {
            return new IsolationForestDetector(this);
        }

        public Random getRandom() {
            return random.orElseGet(() -> randomSeed.map(Random::new).orElseGet(Random::new));
        }
    }
}
