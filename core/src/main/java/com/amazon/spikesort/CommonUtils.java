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

package com.amazon.spikesort;

import java.util.Objects;

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
     * Euclidean distance between two points of equal length.
     *
     * @param a first point
     * @param b second point
     * @return the L2 distance
     */
    public static double euclideanDistance(double[] a, double[] b) {
        return Math.sqrt(squaredDistance(a, b));
    }

    public static double squaredDistance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double t = a[i] - b[i];
            sum += t * t;
        }
        return sum;
    }

    /**
     * Checks that a two dimensional array is non-empty, rectangular and contains
     * only finite values.
     *
     * @param values the array to check
     * @param name   the name used in error messages
     * @return the common row length
     */
    public static int checkRectangular(double[][] values, String name) {
        checkNotNull(values, name + " must not be null");
        checkArgument(values.length > 0, name + " must contain at least one row");
        checkNotNull(values[0], name + " must not contain null rows");
        int width = values[0].length;
        checkArgument(width > 0, name + " rows must not be empty");
        for (double[] row : values) {
            checkNotNull(row, name + " must not contain null rows");
            checkArgument(row.length == width, name + " must be rectangular");
            for (double value : row) {
                checkArgument(Double.isFinite(value), name + " must contain finite values");
            }
        }
        return width;
    }

    /**
     * Creates a deep copy of a two dimensional array.
     *
     * @param values the array to copy, may be null
     * @return the copy, or null
     */
    public static double[][] deepCopy(double[][] values) {
        if (values == null) {
            return null;
        }
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }
}
