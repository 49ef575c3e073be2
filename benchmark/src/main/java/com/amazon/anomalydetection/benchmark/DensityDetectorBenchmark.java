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

package com.amazon.anomalydetection.benchmark;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.anomalydetection.config.ReclusterPolicy;
import com.amazon.anomalydetection.density.DBSCANDetector;
import com.amazon.anomalydetection.density.IsolationForestDetector;
import com.amazon.anomalydetection.density.LOFDetector;
import com.amazon.anomalydetection.testutils.NormalMixtureTestData;

/**
 * Model construction and query cost of the density detectors as the history
 * grows. LOF training and DBSCAN clustering compare every pair of points, so
 * their cost grows quadratically with {@code historySize}.
 */
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class DensityDetectorBenchmark {

    public final static int QUERY_SIZE = 1_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "250", "500", "1000" })
        int historySize;

        @Param({ "2", "8" })
        int dimensions;

        double[][] history;
        double[][] queries;
        LOFDetector lof;
        DBSCANDetector dbscan;
        IsolationForestDetector forest;

        @Setup(Level.Trial)
        public void setUpData() {
            NormalMixtureTestData testData = new NormalMixtureTestData();
            history = testData.generateTestData(historySize, dimensions, 17);
            queries = testData.generateTestData(QUERY_SIZE, dimensions, 18);
        }

        @Setup(Level.Invocation)
        public void setUpDetectors() {
            lof = LOFDetector.builder().k(LOFDetector.DEFAULT_K).dimensions(dimensions).build();
            lof.addPoints(history);
            dbscan = new DBSCANDetector(1.0, DBSCANDetector.DEFAULT_MIN_POINTS, dimensions, historySize,
                    ReclusterPolicy.manual());
            forest = IsolationForestDetector.builder().dimensions(dimensions).randomSeed(99).build();
            for (double[] point : history) {
                dbscan.addPoint(point);
                forest.addTrainingData(point);
            }
        }
    }

    @Benchmark
    public LOFDetector lofTrain(BenchmarkState state) {
        state.lof.train();
        return state.lof;
    }

    @Benchmark
    public DBSCANDetector dbscanRecluster(BenchmarkState state) {
        state.dbscan.recluster();
        return state.dbscan;
    }

    @Benchmark
    public IsolationForestDetector isolationForestTrain(BenchmarkState state) {
        state.forest.train();
        return state.forest;
    }

    @Benchmark
    @OperationsPerInvocation(QUERY_SIZE)
    public void lofTrainAndQuery(BenchmarkState state, Blackhole blackhole) {
        state.lof.train();
        for (double[] query : state.queries) {
            blackhole.consume(state.lof.getLofScore(query));
        }
    }

    @Benchmark
    @OperationsPerInvocation(QUERY_SIZE)
    public void isolationForestTrainAndQuery(BenchmarkState state, Blackhole blackhole) {
        state.forest.train();
        for (double[] query : state.queries) {
            blackhole.consume(state.forest.getAnomalyScore(query));
        }
    }
}
