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

package com.amazon.anomalydetection.examples.streaming;

import java.util.Arrays;
import java.util.List;

import com.amazon.anomalydetection.IUpdatableDetector;
import com.amazon.anomalydetection.event.AnomalyEvent;
import com.amazon.anomalydetection.examples.Example;
import com.amazon.anomalydetection.returntypes.AnomalyResult;
import com.amazon.anomalydetection.statistical.AdaptiveAnomalyDetector;
import com.amazon.anomalydetection.statistical.EMAAnomalyDetector;
import com.amazon.anomalydetection.statistical.SlidingWindowDetector;
import com.amazon.anomalydetection.testutils.ExampleDataSets;

/**
 * Streams a series with a level shift and two spikes through the three
 * incremental detectors. Each detector learns only from the values it judged
 * normal.
 */
public class StreamingComparison implements Example {

    public static void main(String[] args) throws Exception {
        new StreamingComparison().run();
    }

    @Override
    public String command() {
        return "streaming";
    }

    @Override
    public String description() {
        return "compare sliding window, EMA and adaptive detectors on a shifting stream";
    }

    @Override
    public void run() throws Exception {
        int warmUp = 100;
        double[] series = ExampleDataSets.regimeShifts(new double[] { 100, 112 }, 500, 5, 42);
        series[250] += 60;
        series[750] -= 60;

        SlidingWindowDetector slidingWindow = new SlidingWindowDetector(100);
        EMAAnomalyDetector ema = new EMAAnomalyDetector(0.05);
        AdaptiveAnomalyDetector adaptive = new AdaptiveAnomalyDetector(warmUp, 0.02);
        List<IUpdatableDetector> detectors = Arrays.asList(slidingWindow, ema, adaptive);

        slidingWindow.addListener(args -> {
            if (args.getEventType() != AnomalyEvent.NORMAL_RESUMED) {
                System.out.printf("  [%s] %s%n", args.getEventType(), args.getResult().getDescription());
            }
        });

        double[] head = Arrays.copyOf(series, warmUp);
        slidingWindow.initializeWindow(head);
        ema.warmUp(head);
        adaptive.initializeWithNormalData(head);

        int[] flagged = new int[detectors.size()];
        System.out.println("Events reported by the sliding window detector:");
        for (int i = warmUp; i < series.length; i++) {
            for (int d = 0; d < detectors.size(); d++) {
                IUpdatableDetector detector = detectors.get(d);
                AnomalyResult result = detector.detect(series[i]);
                if (result.isAnomaly()) {
                    ++flagged[d];
                } else {
                    detector.updateWithNormal(series[i]);
                }
            }
        }

        System.out.println();
        System.out.printf("%-22s %8s %10s %10s%n", "detector", "flagged", "mean", "stddev");
        for (int d = 0; d < detectors.size(); d++) {
            IUpdatableDetector detector = detectors.get(d);
            System.out.printf("%-22s %8d %10.2f %10.2f%n", detector.getName(), flagged[d], detector.getMean(),
                    detector.getStdDev());
        }
        System.out.println();
        System.out.println(slidingWindow.getPerformanceMonitor().getReport());
    }
}
