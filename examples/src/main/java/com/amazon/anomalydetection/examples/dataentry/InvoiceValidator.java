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

package com.amazon.anomalydetection.examples.dataentry;

import static com.amazon.anomalydetection.CommonUtils.checkArgument;
import static com.amazon.anomalydetection.CommonUtils.checkNotNull;

import java.util.HashMap;
import java.util.Map;

import com.amazon.anomalydetection.returntypes.AnomalyResult;
import com.amazon.anomalydetection.statistical.SlidingWindowDetector;

/**
 * Checks invoice amounts against the recent invoices of the same supplier.
 * Each supplier gets its own sliding window; an amount only enters the window
 * when it is learned from history or confirmed after review, never when it is
 * merely validated.
 */
public class InvoiceValidator {

    public static final int DEFAULT_MIN_SAMPLES = 10;

    public static final int WINDOW_SIZE = 50;

    private final Map<String, SlidingWindowDetector> detectors = new HashMap<>();

    private final int minSamplesForValidation;

    public InvoiceValidator() {
        this(DEFAULT_MIN_SAMPLES);
    }

    public InvoiceValidator(int minSamplesForValidation) {
        checkArgument(minSamplesForValidation > 0, "minSamplesForValidation must be positive");
        this.minSamplesForValidation = minSamplesForValidation;
    }

    /**
     * The verdict on one invoice. An invoice that could not be validated for lack
     * of history is not valid and carries the reason as its warning.
     */
    public static class Outcome {

        private final boolean valid;

        private final String warning;

        Outcome(boolean valid, String warning) {
            this.valid = valid;
            this.warning = warning;
        }

        public boolean isValid() {
            return valid;
        }

        public String getWarning() {
            return warning;
        }
    }

    public void learnInvoiceAmount(String supplierCode, double amount) {
        detectorFor(supplierCode).addValue(amount);
    }

    public void confirmInvoiceAmount(String supplierCode, double amount) {
        detectorFor(supplierCode).updateWithNormal(amount);
    }

    public Outcome validateInvoiceAmount(String supplierCode, double amount) {
        SlidingWindowDetector detector = detectorFor(supplierCode);
        int samples = detector.getCurrentSize();
        if (samples < minSamplesForValidation) {
            return new Outcome(false,
                    String.format("Cannot validate - only %d invoices for supplier %s (need %d)", samples,
                            supplierCode, minSamplesForValidation));
        }
        AnomalyResult result = detector.detect(amount);
        if (result.isAnomaly()) {
            return new Outcome(false,
                    String.format("Unusual amount for supplier %s: %.2f (expected range %.2f - %.2f, z-score %.2f)",
                            supplierCode, amount, result.getLowerLimit(), result.getUpperLimit(), result.getScore()));
        }
        return new Outcome(true, "");
    }

    public boolean canValidateSupplier(String supplierCode) {
        SlidingWindowDetector detector = detectors.get(supplierCode);
        return detector != null && detector.getCurrentSize() >= minSamplesForValidation;
    }

    public int getSupplierCount() {
        return detectors.size();
    }

    private SlidingWindowDetector detectorFor(String supplierCode) {
        checkNotNull(supplierCode, "supplierCode must not be null");
        return detectors.computeIfAbsent(supplierCode, code -> new SlidingWindowDetector(WINDOW_SIZE));
    }
}
