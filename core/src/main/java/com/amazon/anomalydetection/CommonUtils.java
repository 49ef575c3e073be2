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

package com.amazon.anomalydetection;

import java.util.Objects;

import com.amazon.anomalydetection.errors.ConfigurationException;
import com.amazon.anomalydetection.errors.InsufficientDataException;
import com.amazon.anomalydetection.errors.NotTrainedException;
import com.amazon.anomalydetection.errors.ValidationException;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Throws a {@link ConfigurationException} if a construction parameter is out of
     * its legal range.
     *
     * @param condition A condition to test.
     * @param message   The error message.
     * @throws ConfigurationException if {@code condition} is false.
     */
    public static void checkConfiguration(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }

    /**
     * Throws a {@link NotTrainedException} if the model a query depends on has not
     * been constructed.
     *
     * @param condition A condition to test.
     * @param message   The error message.
     * @throws NotTrainedException if {@code condition} is false.
     */
    public static void checkTrained(boolean condition, String message) {
        if (!condition) {
            throw new NotTrainedException(message);
        }
    }

    /**
     * Throws an {@link InsufficientDataException} if a model cannot be constructed
     * from the data seen so far.
     *
     * @param condition A condition to test.
     * @param message   The error message.
     * @throws InsufficientDataException if {@code condition} is false.
     */
    public static void checkSufficientData(boolean condition, String message) {
        if (!condition) {
            throw new InsufficientDataException(message);
        }
    }

    /**
     * Rejects NaN and infinite inputs.
     *
     * @param value the value presented to a detector
     * @return the value
     * @throws ValidationException if the value is not finite
     */
    public static double checkFinite(double value) {
        if (!Double.isFinite(value)) {
            throw new ValidationException(String.format("invalid value: %s", value));
        }
        return value;
    }

    /**
     * Checks that a point is non-null, has the expected dimensionality and only
     * holds finite coordinates.
     *
     * @param point      the point presented to a detector
     * @param dimensions the expected number of coordinates
     * @return the point
     * @throws ValidationException if any of the checks fail
     */
    public static double[] checkPoint(double[] point, int dimensions) {
        if (point == null) {
            throw new ValidationException("point cannot be null");
        }
        if (point.length != dimensions) {
            throw new ValidationException(
                    String.format("point dimension mismatch: expected %d, got %d", dimensions, point.length));
        }
        for (int i = 0; i < point.length; i++) {
            if (!Double.isFinite(point[i])) {
                throw new ValidationException(String.format("invalid value %s at coordinate %d", point[i], i));
            }
        }
        return point;
    }

    /**
     * Euclidean distance between two points of the same length.
     *
     * @param a first point
     * @param b second point
     * @return the L2 distance
     */
    public static double euclideanDistance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double t = a[i] - b[i];
            sum += t * t;
        }
        return Math.sqrt(sum);
    }

    /**
     * Arithmetic mean of the coordinates, used as the scalar stand-in for a point
     * in a detection result.
     *
     * @param point a non-empty point
     * @return the mean coordinate
     */
    public static double coordinateMean(double[] point) {
        double sum = 0;
        for (double v : point) {
            sum += v;
        }
        return sum / point.length;
    }
}
