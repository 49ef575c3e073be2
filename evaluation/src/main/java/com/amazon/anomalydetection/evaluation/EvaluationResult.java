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

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import com.amazon.anomalydetection.monitoring.ConfusionMatrix;

/**
 * The outcome of evaluating one detector on one labeled data set.
 */
@Getter
@Builder
@ToString
public class EvaluationResult {

    private final String detectorName;

    private final ConfusionMatrix confusionMatrix;

    private final int datasetSize;

    private final int anomaliesInDataset;

    private final int normalInDataset;

    private final long evaluationTimeMs;

    public String getSummary() {
        return String.format("Evaluation Results for %s:%n", detectorName)
                + String.format("Dataset: %d points (%d anomalies, %d normal)%n", datasetSize, anomaliesInDataset,
                        normalInDataset)
                + String.format("Evaluation time: %d ms%n%n", evaluationTimeMs) + confusionMatrix.toDetailedString();
    }
}
