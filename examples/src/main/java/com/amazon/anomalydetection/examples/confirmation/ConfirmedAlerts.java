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

package com.amazon.anomalydetection.examples.confirmation;

import java.util.Arrays;

import com.amazon.anomalydetection.confirmation.AnomalyConfirmationSystem;
import com.amazon.anomalydetection.examples.Example;
import com.amazon.anomalydetection.returntypes.AnomalyResult;
import com.amazon.anomalydetection.statistical.SlidingWindowDetector;
import com.amazon.anomalydetection.testutils.ExampleDataSets;

/**
 * Puts a confirmation stage behind a detector: a single spike is reported as a
 * candidate only, while a value that keeps coming back is confirmed.
 */
public class ConfirmedAlerts implements Example {

    public static void main(String[] args) throws Exception {
        new ConfirmedAlerts().run();
    }

    @Override
    public String command() {
        return "confirmation";
    }

    @Override
    public String description() {
        return "alert only on anomalies that repeat";
    }

    @Override
    public void run() throws Exception {
        double[] series = ExampleDataSets.normalSeries(400, 50, 2, 11);
        series[60] = 95;
        for (int i = 200; i < 400; i += 40) {
            series[i] = 80 + (i % 3);
        }

        SlidingWindowDetector detector = new SlidingWindowDetector(100);
        AnomalyConfirmationSystem confirmation = new AnomalyConfirmationSystem(10, 3, 0.1);
        detector.initializeWindow(Arrays.copyOf(series, 50));

        for (int i = 50; i < series.length; i++) {
            AnomalyResult result = detector.detect(series[i]);
            if (!result.isAnomaly()) {
                detector.updateWithNormal(series[i]);
                continue;
            }
            boolean confirmed = confirmation.process(result);
            System.out.printf("t=%3d value %6.2f z=%6.2f -> %s%n", i, series[i], result.getScore(),
                    confirmed ? "CONFIRMED" : "candidate");
        }
    }
}
