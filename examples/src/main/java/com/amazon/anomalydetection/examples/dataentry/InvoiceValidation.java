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

import com.amazon.anomalydetection.examples.Example;
import com.amazon.anomalydetection.testutils.ExampleDataSets;

/**
 * Learns the invoice history of two suppliers and validates new invoices,
 * confirming the ones a reviewer accepted.
 */
public class InvoiceValidation implements Example {

    public static void main(String[] args) throws Exception {
        new InvoiceValidation().run();
    }

    @Override
    public String command() {
        return "invoices";
    }

    @Override
    public String description() {
        return "validate invoice amounts per supplier";
    }

    @Override
    public void run() throws Exception {
        InvoiceValidator validator = new InvoiceValidator();
        for (double amount : ExampleDataSets.normalSeries(30, 1200, 80, 3)) {
            validator.learnInvoiceAmount("SUP001", amount);
        }
        for (double amount : ExampleDataSets.normalSeries(5, 300, 20, 4)) {
            validator.learnInvoiceAmount("SUP002", amount);
        }

        check(validator, "SUP001", 1250);
        check(validator, "SUP001", 4800);
        check(validator, "SUP002", 310);
        check(validator, "SUP003", 99);

        validator.confirmInvoiceAmount("SUP001", 1250);
        System.out.printf("tracking %d suppliers%n", validator.getSupplierCount());
    }

    private static void check(InvoiceValidator validator, String supplier, double amount) {
        InvoiceValidator.Outcome outcome = validator.validateInvoiceAmount(supplier, amount);
        System.out.printf("%s %8.2f -> %s %s%n", supplier, amount, outcome.isValid() ? "OK" : "REVIEW",
                outcome.getWarning());
    }
}
