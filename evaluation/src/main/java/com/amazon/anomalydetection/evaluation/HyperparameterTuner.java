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
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalydetection.IAnomalyDetector;
import com.amazon.anomalydetection.config.DetectionConfig;
import com.amazon.anomalydetection.config.DetectorType;
import com.amazon.anomalydetection.factory.AnomalyDetectorFactory;

/**
 * Searches detector parameters that maximize a metric on a labeled data set.
 * Every candidate detector is trained on the normal points of the data set and
 * then evaluated on the whole data set. Grid search tries every combination of
 * the supplied values; random search draws configurations from fixed ranges.
 */
@Slf4j
public class HyperparameterTuner {

    public static final int REPORT_SIZE = 5;

    @Getter
    private final DetectorType detectorType;

    @Getter
    private final LabeledDataset dataset;

    @Getter
    @Setter
    private OptimizationMetric optimizationMetric = OptimizationMetric.F1;

    private final Random random;

    private final List<TuningResult> results = new ArrayList<>();

    public HyperparameterTuner(DetectorType detectorType, LabeledDataset dataset) {
        this(detectorType, dataset, new Random());
    }

    public HyperparameterTuner(DetectorType detectorType, LabeledDataset dataset, Random random) {
        checkNotNull(detectorType, "detectorType must not be null");
        checkArgument(detectorType.isStatistical() || detectorType == DetectorType.ISOLATION_FOREST,
                "tuning is not supported for " + detectorType);
        this.detectorType = detectorType;
        this.dataset = checkNotNull(dataset, "dataset must not be null");
        this.random = checkNotNull(random, "random must not be null");
    }

    /**
     * @return the results of the most recent search, in evaluation order
     */
    public List<TuningResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    /**
     * Tries every combination of the given values. Only the sigma multipliers
     * are required; an empty or null array for the other parameters keeps the
     * default value of {@link HyperparameterConfig}.
     *
     * @return the best result
     */
    public TuningResult gridSearch(double[] sigmaMultipliers, double[] minStdDevs, int[] windowSizes,
            double[] alphas) {
        checkArgument(sigmaMultipliers != null && sigmaMultipliers.length > 0, "sigmaMultipliers cannot be empty");
        checkSufficientData(!dataset.isEmpty(), "cannot tune on an empty dataset");
        HyperparameterConfig defaults = HyperparameterConfig.defaults();
        double[] minStdDevValues = orDefault(minStdDevs, defaults.getMinStdDev());
        int[] windowValues = (windowSizes == null || windowSizes.length == 0) ? new int[] { defaults.getWindowSize() }
                : windowSizes;
        double[] alphaValues = orDefault(alphas, defaults.getAlpha());
        int total = sigmaMultipliers.length * minStdDevValues.length * windowValues.length * alphaValues.length;
        log.info("grid search over {} configurations of {}", total, detectorType);

        results.clear();
        int iteration = 0;
        for (double sigma : sigmaMultipliers) {
            for (double minStdDev : minStdDevValues) {
                for (int window : windowValues) {
                    for (double alpha : alphaValues) {
                        ++iteration;
                        HyperparameterConfig config = defaults.toBuilder().name("Config_" + iteration)
                                .sigmaMultiplier(sigma).minStdDev(minStdDev).windowSize(window).alpha(alpha).build();
                        run(config);
                    }
                }
            }
        }
        return best();
    }

    /**
     * Evaluates {@code iterations} random configurations with sigma multiplier
     * in [2, 4), minimum standard deviation in [0.0001, 0.0101), window size in
     * [50, 200), alpha in [0.1, 0.5) and adaptation rate in [0.01, 0.2).
     *
     * @return the best result
     */
    public TuningResult randomSearch(int iterations) {
        checkArgument(iterations > 0, "iterations must be positive");
        checkSufficientData(!dataset.isEmpty(), "cannot tune on an empty dataset");
        log.info("random search over {} configurations of {}", iterations, detectorType);

        results.clear();
        for (int i = 1; i <= iterations; i++) {
            HyperparameterConfig config = HyperparameterConfig.builder().name("Random_" + i)
                    .sigmaMultiplier(2.0 + random.nextDouble() * 2.0)
                    .minStdDev(0.0001 + random.nextDouble() * 0.01).windowSize(50 + random.nextInt(150))
                    .alpha(0.1 + random.nextDouble() * 0.4).adaptationRate(0.01 + random.nextDouble() * 0.19)
                    .build();
            run(config);
        }
        return best();
    }

    /**
     * @param count maximum number of results
     * @return the best results of the most recent search, best first; ties keep
     *         evaluation order
     */
    public List<TuningResult> getTopConfigurations(int count) {
        checkArgument(count > 0, "count must be positive");
        return results.stream().sorted(Comparator.comparingDouble(TuningResult::getScore).reversed()).limit(count)
                .collect(Collectors.toList());
    }

    public String generateTuningReport() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Hyperparameter Tuning Report (%s optimization)%n", optimizationMetric));
        sb.append("=".repeat(70)).append(System.lineSeparator());
        sb.append(String.format("Total configurations tested: %d%n", results.size()));
        sb.append(String.format("Dataset: %s (%d points)%n%n", dataset.getName(), dataset.size()));
        sb.append(String.format("Top %d Configurations:%n", REPORT_SIZE));
        sb.append("-".repeat(70)).append(System.lineSeparator());
        List<TuningResult> top = getTopConfigurations(REPORT_SIZE);
        for (int i = 0; i < top.size(); i++) {
            HyperparameterConfig config = top.get(i).getConfig();
            sb.append(String.format("%d. %s%n", i + 1, top.get(i)));
            sb.append(String.format("   Sigma=%.2f, MinStdDev=%.4f, Window=%d, Alpha=%.2f%n%n",
                    config.getSigmaMultiplier(), config.getMinStdDev(), config.getWindowSize(), config.getAlpha()));
        }
        return sb.toString();
    }

    /**
     * Creates a detector of the tuned type for the configuration and trains it
     * on the normal points of the data set, if there are any.
     */
    IAnomalyDetector createDetector(HyperparameterConfig config) {
        DetectionConfig detectionConfig = DetectionConfig.builder().sigmaMultiplier(config.getSigmaMultiplier())
                .minStdDev(config.getMinStdDev()).build();
        IAnomalyDetector detector;
        switch (detectorType) {
        case THREE_SIGMA:
            detector = AnomalyDetectorFactory.createThreeSigma(detectionConfig);
            break;
        case SLIDING_WINDOW:
            detector = AnomalyDetectorFactory.createSlidingWindow(config.getWindowSize(), detectionConfig);
            break;
        case EMA:
            detector = AnomalyDetectorFactory.createEMA(config.getAlpha(), detectionConfig);
            break;
        case ADAPTIVE:
            detector = AnomalyDetectorFactory.createAdaptive(config.getWindowSize(), config.getAdaptationRate(),
                    detectionConfig);
            break;
        case ISOLATION_FOREST:
            detector = AnomalyDetectorFactory.createIsolationForest(config.getNumberOfTrees(),
                    config.getSubSampleSize(), config.getMaxDepth(), 1, detectionConfig);
            break;
        default:
            throw new IllegalStateException("tuning is not supported for " + detectorType);
        }

        double[] normalValues = dataset.getNormalValues();
        checkSufficientData(normalValues.length > 0,
                String.format("dataset %s holds no normal values to train on", dataset.getName()));
        detector.addValues(normalValues);
        detector.build();
        return detector;
    }

    private void run(HyperparameterConfig config) {
        IAnomalyDetector detector = createDetector(config);
        EvaluationResult evaluation = AnomalyDetectorEvaluator.evaluate(detector, dataset.getPoints());
        TuningResult result = new TuningResult(config, evaluation,
                optimizationMetric.score(evaluation.getConfusionMatrix()));
        log.debug("{}", result);
        results.add(result);
    }

    private TuningResult best() {
        TuningResult best = null;
        for (TuningResult result : results) {
            if (best == null || result.getScore() > best.getScore()) {
                best = result;
            }
        }
        log.info("best configuration: {}", best);
        return best;
    }

    private static double[] orDefault(double[] values, double defaultValue) {
        return (values == null || values.length == 0) ? new double[] { defaultValue } : values;
    }
}
