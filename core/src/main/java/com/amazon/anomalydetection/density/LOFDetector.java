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
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalydetection.CommonUtils;
import com.amazon.anomalydetection.config.DetectionConfig;
import com.amazon.anomalydetection.returntypes.AnomalyResult;
import com.amazon.anomalydetection.returntypes.Neighbor;

/**
 * Local Outlier Factor over the stored points.
 * <p>
 * {@link #build()} finds the {@code k} nearest neighbors of every stored point
 * (the point itself excluded), its k-distance (the distance to the k-th
 * neighbor) and its local reachability density
 *
 * <pre>
 * lrd(p) = k / sum over neighbors o of max(d(p, o), kDistance(o))
 * </pre>
 *
 * The LOF of a query point q is the mean lrd of its k nearest stored points
 * divided by lrd(q). Values near 1 mean q is as dense as its neighborhood;
 * values well above 1 mean it is sparser. The point is an anomaly when its LOF
 * exceeds {@code threshold}.
 * <p>
 * No spatial index is kept. Each query scans every stored point, which costs
 * O(n log k) distance work for n stored points, and {@code build()} costs
 * O(n^2 log k). Large histories should be bounded with {@code maxHistory}.
 * Adding points invalidates the model until the next {@code build()}.
 */
@Slf4j
public class LOFDetector extends AbstractDensityDetector {

    public static final String NAME = "LOF Detector";

    public static final int DEFAULT_K = 20;

    public static final double DEFAULT_THRESHOLD = 1.5;

    // lower bound for a mean reachability distance, so duplicates keep a finite
    // density
    static final double MIN_REACHABILITY = 1e-10;

    @Getter
    private final int k;

    @Getter
    private final double threshold;

    private final Optional<Integer> maxHistory;

    private final List<double[]> points;

    private double[] kDistances;

    private double[] densities;

    private double[] trainingScores;

    private boolean built;

    protected LOFDetector(Builder<?> builder) {
        super(NAME, builder.config, builder.dimensions);
        checkConfiguration(builder.k > 0, "k must be greater than 0");
        checkConfiguration(Double.isFinite(builder.threshold) && builder.threshold > 0,
                "threshold must be a positive number");
        builder.maxHistory.ifPresent(
                n -> checkConfiguration(n > builder.k, "maxHistory must be greater than k"));
        k = builder.k;
        threshold = builder.threshold;
        maxHistory = builder.maxHistory;
        points = new ArrayList<>();
    }

    public LOFDetector(int k, int dimensions) {
        this(builder().k(k).dimensions(dimensions));
    }

    public static Builder builder() {
        return new Builder();
    }

    public void addPoint(double[] point) {
        points.add(checkPoint(point, dimensions).clone());
        maxHistory.ifPresent(n -> {
            if (points.size() > n) {
                points.remove(0);
            }
        });
        built = false;
    }

    public void addPoints(double[][] newPoints) {
        checkNotNull(newPoints, "points must not be null");
        for (double[] point : newPoints) {
            checkPoint(point, dimensions);
        }
        for (double[] point : newPoints) {
            addPoint(point);
        }
    }

    @Override
    public void addTrainingData(double[] point) {
        addPoint(point);
    }

    @Override
    public void train() {
        int n = points.size();
        checkSufficientData(n > k, String.format("at least %d points are required, %d stored", k + 1, n));
        int[][] neighbors = new int[n][];
        kDistances = new double[n];
        for (int i = 0; i < n; i++) {
            List<Neighbor> nearest = nearestNeighbors(points.get(i), i);
            neighbors[i] = nearest.stream().mapToInt(nb -> nb.index).toArray();
            kDistances[i] = nearest.get(nearest.size() - 1).distance;
        }
        densities = new double[n];
        for (int i = 0; i < n; i++) {
            double reach = 0;
            for (int o : neighbors[i]) {
                reach += Math.max(CommonUtils.euclideanDistance(points.get(i), points.get(o)), kDistances[o]);
            }
            densities[i] = 1.0 / Math.max(reach / k, MIN_REACHABILITY);
        }
        trainingScores = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0;
            for (int o : neighbors[i]) {
                sum += densities[o];
            }
            trainingScores[i] = sum / k / densities[i];
        }
        built = true;
        log.info("built LOF model over {} points with k = {}", n, k);
    }

    /**
     * @param query   the query point
     * @param exclude index of a stored point to skip, or -1
     * @return the k nearest stored points, nearest first
     */
    private List<Neighbor> nearestNeighbors(double[] query, int exclude) {
        PriorityQueue<Neighbor> heap = new PriorityQueue<>(k + 1, Neighbor.BY_DISTANCE.reversed());
        for (int j = 0; j < points.size(); j++) {
            if (j == exclude) {
                continue;
            }
            heap.add(new Neighbor(j, CommonUtils.euclideanDistance(query, points.get(j))));
            if (heap.size() > k) {
                heap.poll();
            }
        }
        List<Neighbor> result = new ArrayList<>(heap);
        result.sort(Neighbor.BY_DISTANCE);
        return result;
    }

    /**
     * @param point a point of the detector's dimensionality
     * @return the local outlier factor of the point against the stored points
     */
    public double getLofScore(double[] point) {
        checkPoint(point, dimensions);
        checkTrained(built, "build() must be called before scoring");
        return lof(point);
    }

    private double lof(double[] point) {
        List<Neighbor> nearest = nearestNeighbors(point, -1);
        double reach = 0;
        double neighborDensity = 0;
        for (Neighbor neighbor : nearest) {
            reach += Math.max(neighbor.distance, kDistances[neighbor.index]);
            neighborDensity += densities[neighbor.index];
        }
        double density = 1.0 / Math.max(reach / nearest.size(), MIN_REACHABILITY);
        return neighborDensity / nearest.size() / density;
    }

    @Override
    protected AnomalyResult computeDetection(double[] point) {
        checkTrained(built, "build() must be called before detect()");
        double score = lof(point);
        boolean anomaly = score > threshold;
        String description = anomaly
                ? String.format("ANOMALY: LOF score %.3f (threshold: %.2f) - lower density than neighbors", score,
                        threshold)
                : String.format("Normal: LOF score %.3f (similar density to neighbors)", score);
        return AnomalyResult.builder().anomaly(anomaly).value(CommonUtils.coordinateMean(point)).score(score)
                .lowerLimit(0).upperLimit(threshold).description(description).build();
    }

    @Override
    public boolean isInitialized() {
        return built;
    }

    /**
     * @return the LOF of every stored point as computed by the last build, in
     *         insertion order
     */
    public double[] getTrainingScores() {
        checkTrained(built, "model has not been built");
        return trainingScores.clone();
    }

    public int getDataPointsCount() {
        return points.size();
    }

    public Optional<Integer> getMaxHistory() {
        return maxHistory;
    }

    public void clear() {
        points.clear();
        kDistances = null;
        densities = null;
        trainingScores = null;
        built = false;
    }

    public static class Builder<T extends Builder<T>> {

        private int dimensions = 1;
        private int k = DEFAULT_K;
        private double threshold = DEFAULT_THRESHOLD;
        private Optional<Integer> maxHistory = Optional.empty();
        private DetectionConfig config = DetectionConfig.defaults();

        public T dimensions(int dimensions) {
            this.dimensions = dimensions;
            return (T) this;
        }

        public T k(int k) {
            this.k = k;
            return (T) this;
        }

        public T threshold(double threshold) {
            this.threshold = threshold;
            return (T) this;
        }

        public T maxHistory(int maxHistory) {
            this.maxHistory = Optional.of(maxHistory);
            return (T) this;
        }

        public T config(DetectionConfig config) {
            this.config = checkNotNull(config, "config must not be null");
            return (T) this;
        }

        public LOFDetector build() {
            return new LOFDetector(this);
        }
    }
}
