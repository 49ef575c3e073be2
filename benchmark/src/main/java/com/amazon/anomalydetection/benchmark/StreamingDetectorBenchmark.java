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

import com.amazon.anomalydetection.IUpdatableDetector;
import com.amazon.anomalydetection.config.DetectionConfig;
import com.amazon.anomalydetection.config.DetectorType;
import com.amazon.anomalydetection.factory.AnomalyDetectorFactory;
import com.amazon.anomalydetection.returntypes.AnomalyResult;
import com.amazon.anomalydetection.testutils.NormalMixtureTestData;

/**
 * Per value cost of the streaming detectors when every value is scored and
 * then learned.
 */
@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class StreamingDetectorBenchmark {

    public final static int DATA_SIZE = 50_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "SLIDING_WINDOW", "EMA", "ADAPTIVE" })
        DetectorType detectorType;

        double[] data;
        IUpdatableDetector detector;

        @Setup(Level.Trial)
        public void setUpData() {
            data = new NormalMixtureTestData().generateSeries(DATA_SIZE, 31);
        }

        @Setup(Level.Invocation)
        public void setUpDetector() {
            detector = (IUpdatableDetector) AnomalyDetectorFactory.create(detectorType, DetectionConfig.defaults());
            detector.addValues(data);
            detector.build();
        }
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public void detectOnly(BenchmarkState state, Blackhole blackhole) {
        for (double value : state.data) {
            blackhole.consume(state.detector.detect(value));
        }
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public void detectAndUpdate(BenchmarkState state, Blackhole blackhole) {
        IUpdatableDetector detector = state.detector;
        AnomalyResult result = null;
        for (double value : state.data) {
            result = detector.detect(value);
            detector.updateWithNormal(value);
        }
        blackhole.consume(result);
    }
}
