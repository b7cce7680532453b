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

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class CommonUtilsTest {

    @Test
    public void testCheckArgument() {
        assertDoesNotThrow(() -> CommonUtils.checkArgument(true, "fine"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CommonUtils.checkArgument(false, "bad argument"));
        assertEquals("bad argument", e.getMessage());
    }

    @Test
    public void testCheckState() {
        assertThrows(IllegalStateException.class, () -> CommonUtils.checkState(false, "bad state"));
    }

    @Test
    public void testCheckNotNull() {
        assertEquals("x", CommonUtils.checkNotNull("x", "unused"));
        assertThrows(NullPointerException.class, () -> CommonUtils.checkNotNull(null, "null"));
    }

    @Test
    public void testCheckFractionAndPositive() {
        assertDoesNotThrow(() -> CommonUtils.checkFraction(0, "fraction"));
        assertDoesNotThrow(() -> CommonUtils.checkFraction(1, "fraction"));
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.checkFraction(1.01, "fraction"));
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.checkPositive(0, "positive"));
        assertThrows(IllegalArgumentException.class,
                () -> CommonUtils.checkPositive(Double.POSITIVE_INFINITY, "positive"));
    }

    @ParameterizedTest
    @CsvSource({ "12,12,14,true", "14,12,14,true", "15,12,14,false", "11,12,14,false", "23,23,6,true",
            "0,23,6,true", "6,23,6,true", "7,23,6,false", "22,23,6,false", "5,5,5,true" })
    public void testInHourWindow(int hour, int start, int end, boolean expected) {
        assertEquals(expected, CommonUtils.inHourWindow(hour, start, end));
    }

    @Test
    public void testInHourWindowWrapsMidnight() {
        for (int hour = 0; hour < 24; hour++) {
            boolean night = hour >= 23 || hour <= 6;
            assertEquals(night, CommonUtils.inHourWindow(hour, 23, 6));
        }
        assertTrue(CommonUtils.inHourWindow(3, 3, 6));
        assertFalse(CommonUtils.inHourWindow(2, 3, 6));
    }
}
