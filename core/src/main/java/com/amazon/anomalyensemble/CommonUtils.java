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

package com.amazon.anomalyensemble;

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
     *                  {@code IllegalStateException} if {@code condition} is false.
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
     * Checks that a fraction lies in the closed unit interval.
     *
     * @param value   the value to test
     * @param message the error message
     * @throws IllegalArgumentException if the value is outside [0, 1]
     */
    public static void checkFraction(double value, String message) {
        checkArgument(value >= 0 && value <= 1, message);
    }

    /**
     * Checks that a value is finite and strictly positive.
     *
     * @param value   the value to test
     * @param message the error message
     * @throws IllegalArgumentException if the value is not a positive finite
     *                                  number
     */
    public static void checkPositive(double value, String message) {
        checkArgument(Double.isFinite(value) && value > 0, message);
    }

    /**
     * Returns true if the hour lies in the inclusive hour window. Windows whose
     * start is after their end wrap around midnight, so 23 to 6 covers 23:00 to
     * 06:59.
     *
     * @param hour      hour of day in [0, 23]
     * @param startHour first hour of the window
     * @param endHour   last hour of the window
     * @return true if the hour falls inside the window
     */
    public static boolean inHourWindow(int hour, int startHour, int endHour) {
        if (startHour <= endHour) {
            return hour >= startHour && hour <= endHour;
        }
        return hour >= startHour || hour <= endHour;
    }
}
