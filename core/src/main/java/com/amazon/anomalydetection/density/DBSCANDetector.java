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

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalydetection.CommonUtils;
import com.amazon.anomalydetection.config.DetectionConfig;
import com.amazon.anomalydetection.config.ReclusterPolicy;
import com.amazon.anomalydetection.returntypes.AnomalyResult;

/**
 * Density based clustering (DBSCAN) over a bounded history of points.
 * <p>
 * A point with at least {@code minPoints} points within {@code epsilon}
 * (itself included) is a core point. Clusters are the transitive closure of
 * core points and their neighbors; a point reached from no core point is noise.
 * {@link #recluster()} recomputes the labels of the whole history from scratch,
 * at quadratic cost in the history size, and the {@link ReclusterPolicy}
 * decides how often adding a point triggers it.
 * <p>
 * Detection classifies a point against the labels of the last clustering: it
 * is normal when it lies within {@code epsilon} of a core point, or when it has
 * enough clustered neighbors within {@code epsilon} to be a core point itself.
 * The score is the distance to the nearest clustered point in units of
 * {@code epsilon}.
 */
@Slf4j
public class DBSCANDetector extends AbstractDensityDetector {

    public static final String NAME = "DBSCAN Detector";

    public static final double DEFAULT_EPSILON = 0.5;

    public static final int DEFAULT_MIN_POINTS = 5;

    public static final int DEFAULT_MAX_HISTORY = 1000;

    public static final int NOISE = -1;

    public static final int UNCLASSIFIED = 0;

    @Getter
    private final double epsilon;

    @Getter
    private final int minPoints;

    @Getter
    private final int maxHistory;

    @Getter
    private final ReclusterPolicy reclusterPolicy;

    private final List<Entry> history;

    private int pointsSinceClustering;

    private boolean hasSnapshot;

    @Getter
    private int clusterCount;

    private Instant lastClusteringTime;

    public DBSCANDetector() {
        this(DEFAULT_EPSILON, DEFAULT_MIN_POINTS, 1);
    }

    public DBSCANDetector(double epsilon, int minPoints, int dimensions) {
        this(epsilon, minPoints, dimensions, DEFAULT_MAX_HISTORY, ReclusterPolicy.periodic(),
                DetectionConfig.defaults());
    }

    public DBSCANDetector(double epsilon, int minPoints, int dimensions, int maxHistory,
            ReclusterPolicy reclusterPolicy) {
        this(epsilon, minPoints, dimensions, maxHistory, reclusterPolicy, DetectionConfig.defaults());
    }

    public DBSCANDetector(double epsilon, int minPoints, int dimensions, int maxHistory,
            ReclusterPolicy reclusterPolicy, DetectionConfig config) {
        super(NAME, config, dimensions);
        checkConfiguration(Double.isFinite(epsilon) && epsilon > 0, "epsilon must be a positive number");
        checkConfiguration(minPoints > 0, "minPoints must be greater than 0");
        checkConfiguration(maxHistory >= minPoints, "maxHistory must be at least minPoints");
        this.epsilon = epsilon;
        this.minPoints = minPoints;
        this.maxHistory = maxHistory;
        this.reclusterPolicy = checkNotNull(reclusterPolicy, "reclusterPolicy must not be null");
        this.history = new ArrayList<>();
    }

    /**
     * Appends a point to the history, evicting the oldest one beyond
     * {@code maxHistory}, and reclusters if the policy says so.
     *
     * @param point a point of the detector's dimensionality
     */
    public void addPoint(double[] point) {
        history.add(new Entry(checkPoint(point, dimensions).clone()));
        if (history.size() > maxHistory) {
            history.remove(0);
        }
        ++pointsSinceClustering;
        if (reclusterPolicy.shouldRecluster(pointsSinceClustering, hasSnapshot, history.size(), minPoints)) {
            recluster();
        }
    }

    @Override
    public void addTrainingData(double[] point) {
        addPoint(point);
    }

    @Override
    public void train() {
        recluster();
    }

    /**
     * Recomputes the cluster labels of the whole history.
     */
    public void recluster() {
        checkSufficientData(!history.isEmpty(), "no points to cluster");
        long start = System.nanoTime();
        int n = history.size();
        List<List<Integer>> neighborhoods = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            neighborhoods.add(regionQuery(i));
        }
        for (int i = 0; i < n; i++) {
            Entry entry = history.get(i);
            entry.label = UNCLASSIFIED;
            entry.core = neighborhoods.get(i).size() >= minPoints;
        }
        int cluster = 0;
        for (int i = 0; i < n; i++) {
            Entry entry = history.get(i);
            if (entry.label != UNCLASSIFIED) {
                continue;
            }
            if (!entry.core) {
                // may still be claimed as a border point by a later cluster
                entry.label = NOISE;
                continue;
            }
            expandCluster(i, ++cluster, neighborhoods);
        }
        clusterCount = cluster;
        hasSnapshot = true;
        pointsSinceClustering = 0;
        lastClusteringTime = Instant.now();
        log.info("clustered {} points into {} clusters with {} outliers in {} ms", n, clusterCount,
                getOutlierCount(), (System.nanoTime() - start) / 1_000_000);
    }

    private void expandCluster(int seed, int cluster, List<List<Integer>> neighborhoods) {
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        history.get(seed).label = cluster;
        queue.add(seed);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (!history.get(current).core) {
                continue;
            }
            for (int neighbor : neighborhoods.get(current)) {
                Entry entry = history.get(neighbor);
                if (entry.label == UNCLASSIFIED) {
                    entry.label = cluster;
                    queue.add(neighbor);
                } else if (entry.label == NOISE) {
                    entry.label = cluster;
                }
            }
        }
    }

    // indices of all history points within epsilon of point i, i included
    private List<Integer> regionQuery(int i) {
        double[] point = history.get(i).point;
        List<Integer> result = new ArrayList<>();
        for (int j = 0; j < history.size(); j++) {
            if (CommonUtils.euclideanDistance(point, history.get(j).point) <= epsilon) {
                result.add(j);
            }
        }
        return result;
    }

    @Override
    protected AnomalyResult computeDetection(double[] point) {
        checkSufficientData(history.size() >= minPoints,
                String.format("at least %d points are required, history holds %d", minPoints, history.size()));
        checkTrained(hasSnapshot, "recluster() must run before detect()");
        double nearest = Double.POSITIVE_INFINITY;
        boolean nearCore = false;
        int clusteredNeighbors = 0;
        for (Entry entry : history) {
            if (entry.label == UNCLASSIFIED) {
                continue;
            }
            double distance = CommonUtils.euclideanDistance(point, entry.point);
            if (entry.label > 0) {
                nearest = Math.min(nearest, distance);
            }
            if (distance <= epsilon) {
                nearCore |= entry.core;
                if (entry.label > 0) {
                    ++clusteredNeighbors;
                }
            }
        }
        boolean normal = nearCore || clusteredNeighbors + 1 >= minPoints;
        String description;
        if (normal) {
            description = "Normal";
        } else if (clusteredNeighbors > 0) {
            description = String.format("Low density region: %d clustered neighbors within %.4f", clusteredNeighbors,
                    epsilon);
        } else {
            description = "Not in any cluster";
        }
        return AnomalyResult.builder().anomaly(!normal).value(CommonUtils.coordinateMean(point))
                .score(nearest / epsilon).description(description).build();
    }

    @Override
    public boolean isInitialized() {
        return hasSnapshot;
    }

    /**
     * @return the label of every history point, oldest first: a cluster id
     *         starting at 1, {@link #NOISE}, or {@link #UNCLASSIFIED} for points
     *         added since the last clustering
     */
    public int[] getClusterLabels() {
        return history.stream().mapToInt(e -> e.label).toArray();
    }

    public int getOutlierCount() {
        return (int) history.stream().filter(e -> e.label == NOISE).count();
    }

    public int getHistorySize() {
        return history.size();
    }

    public Optional<Instant> getLastClusteringTime() {
        return Optional.ofNullable(lastClusteringTime);
    }

    /**
     * Drops the history and the clustering.
     */
    public void reset() {
        history.clear();
        pointsSinceClustering = 0;
        hasSnapshot = false;
        clusterCount = 0;
        lastClusteringTime = null;
    }

    private static class Entry {
        private final double[] point;
        private int label = UNCLASSIFIED;
        private boolean core;

        Entry(double[] point) {
            this.point = point;
        }
    }
}
