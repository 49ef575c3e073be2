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

import com.amazon.anomalydetection.monitoring.ConfusionMatrix;

/**
 * The metric a {@link HyperparameterTuner} maximizes.
 */
public enum OptimizationMetric {
    F1 {
        @Override
        public double score(ConfusionMatrix matrix) {
            return matrix.getF1Score();
        }
    },
    PRECISION {
        @Override
        public double score(ConfusionMatrix matrix) {
            return matrix.getPrecision();
        }
    },
    RECALL {
        @Override
        public double score(ConfusionMatrix matrix) {
            return matrix.getRecall();
        }
    },
    ACCURACY {
        @Override
        public double score(ConfusionMatrix matrix) {
            return matrix.getAccuracy();
        }
    },
    /**
     * Matthews correlation coefficient, the only metric here that can be
     * negative.
     */
    MCC {
        @Override
        public double score(ConfusionMatrix matrix) {
            return matrix.getMatthewsCorrelationCoefficient();
        }
    };

    public abstract double score(ConfusionMatrix matrix);
}
