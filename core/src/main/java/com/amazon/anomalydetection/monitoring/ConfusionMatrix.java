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

package com.amazon.anomalydetection.monitoring;

import lombok.Getter;

/**
 * Counts of a binary anomaly classification against ground truth. The anomaly
 * class is the positive class. Every ratio is 0 when its denominator is 0.
 */
@Getter
public class ConfusionMatrix {

    private long truePositives;

    private long falsePositives;

    private long trueNegatives;

    private long falseNegatives;

    public ConfusionMatrix() {
    }

    public ConfusionMatrix(long truePositives, long falsePositives, long trueNegatives, long falseNegatives) {
        this.truePositives = truePositives;
        this.falsePositives = falsePositives;
        this.trueNegatives = trueNegatives;
        this.falseNegatives = falseNegatives;
    }

    public ConfusionMatrix(ConfusionMatrix other) {
        this(other.truePositives, other.falsePositives, other.trueNegatives, other.falseNegatives);
    }

    /**
     * @param actual    the ground truth label
     * @param predicted the detector verdict
     */
    public void record(boolean actual, boolean predicted) {
        if (actual) {
            if (predicted) {
                ++truePositives;
            } else {
                ++falseNegatives;
            }
        } else {
            if (predicted) {
                ++falsePositives;
            } else {
                ++trueNegatives;
            }
        }
    }

    public void add(ConfusionMatrix other) {
        truePositives += other.truePositives;
        falsePositives += other.falsePositives;
        trueNegatives += other.trueNegatives;
        falseNegatives += other.falseNegatives;
    }

    public void reset() {
        truePositives = 0;
        falsePositives = 0;
        trueNegatives = 0;
        falseNegatives = 0;
    }

    public long getTotal() {
        return truePositives + falsePositives + trueNegatives + falseNegatives;
    }

    public double getAccuracy() {
        return ratio(truePositives + trueNegatives, getTotal());
    }

    public double getPrecision() {
        return ratio(truePositives, truePositives + falsePositives);
    }

    public double getRecall() {
        return ratio(truePositives, truePositives + falseNegatives);
    }

    public double getF1Score() {
        double precision = getPrecision();
        double recall = getRecall();
        return (precision + recall > 0) ? 2 * precision * recall / (precision + recall) : 0;
    }

    public double getSpecificity() {
        return ratio(trueNegatives, trueNegatives + falsePositives);
    }

    public double getFalsePositiveRate() {
        return ratio(falsePositives, falsePositives + trueNegatives);
    }

    public double getFalseNegativeRate() {
        return ratio(falseNegatives, falseNegatives + truePositives);
    }

    public double getMatthewsCorrelationCoefficient() {
        double tp = truePositives;
        double fp = falsePositives;
        double tn = trueNegatives;
        double fn = falseNegatives;
        double denominator = Math.sqrt((tp + fp) * (tp + fn) * (tn + fp) * (tn + fn));
        return (denominator > 0) ? (tp * tn - fp * fn) / denominator : 0;
    }

    private static double ratio(long numerator, long denominator) {
        return (denominator > 0) ? (double) numerator / denominator : 0;
    }

    @Override
    public String toString() {
        return String.format("TP=%d FP=%d TN=%d FN=%d | Accuracy=%.3f Precision=%.3f Recall=%.3f F1=%.3f",
                truePositives, falsePositives, trueNegatives, falseNegatives, getAccuracy(), getPrecision(),
                getRecall(), getF1Score());
    }

    public String toDetailedString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Confusion Matrix").append(System.lineSeparator());
        sb.append(String.format("                    Predicted Anomaly   Predicted Normal%n"));
        sb.append(String.format("  Actual Anomaly    %17d   %16d%n", truePositives, falseNegatives));
        sb.append(String.format("  Actual Normal     %17d   %16d%n", falsePositives, trueNegatives));
        sb.append(String.format("  Accuracy:    %.4f%n", getAccuracy()));
        sb.append(String.format("  Precision:   %.4f%n", getPrecision()));
        sb.append(String.format("  Recall:      %.4f%n", getRecall()));
        sb.append(String.format("  F1 Score:    %.4f%n", getF1Score()));
        sb.append(String.format("  Specificity: %.4f%n", getSpecificity()));
        sb.append(String.format("  FPR:         %.4f%n", getFalsePositiveRate()));
        sb.append(String.format("  FNR:         %.4f%n", getFalseNegativeRate()));
        sb.append(String.format("  MCC:         %.4f%n", getMatthewsCorrelationCoefficient()));
        return sb.toString();
    }
}
