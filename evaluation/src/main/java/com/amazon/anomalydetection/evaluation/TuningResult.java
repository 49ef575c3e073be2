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

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A configuration together with its evaluation and the value of the optimized
 * metric.
 */
@Getter
@AllArgsConstructor
public class TuningResult {

    private final HyperparameterConfig config;

    private final EvaluationResult evaluationResult;

    private final double score;

    @Override
    public String toString() {
        return String.format("%s: Score=%.3f | %s", config.getName(), score, evaluationResult.getConfusionMatrix());
    }
}
