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
import static com.amazon.anomalydetection.CommonUtils.checkPoint;

import lombok.Getter;

import com.amazon.anomalydetection.AbstractAnomalyDetector;
import com.amazon.anomalydetection.IDensityAnomalyDetector;
import com.amazon.anomalydetection.config.DetectionConfig;
import com.amazon.anomalydetection.returntypes.AnomalyResult;

/**
 * Base of the detectors over points. The scalar methods wrap the value in a
 * one-dimensional point, so they are rejected with a dimension mismatch unless
 * the detector was created with one dimension.
 */
public abstract class AbstractDensityDetector extends AbstractAnomalyDetector implements IDensityAnomalyDetector {

    @Getter
    protected final int dimensions;

    protected AbstractDensityDetector(String name, DetectionConfig config, int dimensions) {
        super(name, config);
        checkConfiguration(dimensions > 0, "dimensions must be greater than 0");
        this.dimensions = dimensions;
    }

    @Override
    public void addValue(double value) {
        addTrainingData(new double[] { value });
    }

    @Override
    public void build() {
        train();
    }

    @Override
    public AnomalyResult detect(double value) {
        return detectMultiDimensional(new double[] { value });
    }

    @Override
    public AnomalyResult detectMultiDimensional(double[] point) {
        double[] query = checkPoint(point, dimensions).clone();
        return runDetection(() -> computeDetection(query));
    }

    protected abstract AnomalyResult computeDetection(double[] point);
}
