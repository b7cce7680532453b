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

package com.amazon.anomalyensemble.signal;

import static com.amazon.anomalyensemble.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.amazon.anomalyensemble.TestUtils;

public class SignalTest {

    private static final Instant T0 = Instant.parse("2024-01-01T08:00:00Z");

    @Test
    public void testValuesOnly() {
        Signal signal = Signal.of(100, 110, 120);
        assertEquals(3, signal.size());
        assertFalse(signal.hasTimestamps());
        assertNull(signal.getTimestamp(1));
        assertFalse(signal.getHourOfDay(1, ZoneOffset.UTC).isPresent());
        assertEquals(110, signal.getValue(1));
        assertArrayEquals(new double[] { 0, 15, 30 }, signal.getMinuteOffsets(15), EPSILON);
        assertEquals(30, signal.minutesBetween(0, 2, 15), EPSILON);
    }

    @Test
    public void testTimestamps() {
        Signal signal = TestUtils.timestamped(new double[] { 100, 110, 120 }, 5);
        assertTrue(signal.hasTimestamps());
        assertEquals(T0.plusSeconds(300), signal.getTimestamp(1));
        assertArrayEquals(new double[] { 0, 5, 10 }, signal.getMinuteOffsets(15), EPSILON);
        assertEquals(8, signal.getHourOfDay(0, ZoneOffset.UTC).getAsInt());
        assertEquals(3, signal.getHourOfDay(0, ZoneId.of("America/New_York")).getAsInt());
    }

    @Test
    public void testGetValuesReturnsCopy() {
        double[] values = { 1, 2, 3 };
        Signal signal = Signal.of(values);
        values[0] = 99;
        signal.getValues()[1] = 99;
        assertArrayEquals(new double[] { 1, 2, 3 }, signal.getValues(), EPSILON);
    }

    @Test
    public void testWindowIsClamped() {
        Signal signal = Signal.of(1, 2, 3, 4, 5);
        assertArrayEquals(new double[] { 1, 2 }, signal.window(-2, 2), EPSILON);
        assertArrayEquals(new double[] { 4, 5 }, signal.window(3, 10), EPSILON);
    }

    @Test
    public void testEmptySignalIsRejected() {
        assertThrows(MalformedSignalException.class, () -> Signal.of());
        assertThrows(MalformedSignalException.class, () -> Signal.builder().build());
        assertThrows(MalformedSignalException.class, () -> Signal.of((double[]) null));
    }

    @Test
    public void testNonFiniteValuesAreRejected() {
        assertThrows(MalformedSignalException.class, () -> Signal.of(1, Double.NaN, 3));
        assertThrows(MalformedSignalException.class, () -> Signal.of(Double.NEGATIVE_INFINITY));
    }

    @Test
    public void testDecreasingTimestampsAreRejected() {
        Signal.Builder builder = Signal.builder().add(T0, 100).add(T0.minusSeconds(60), 100);
        assertThrows(MalformedSignalException.class, builder::build);
    }

    @Test
    public void testRepeatedTimestampsAreAccepted() {
        Signal signal = Signal.builder().add(T0, 100).add(T0, 101).build();
        assertEquals(0, signal.minutesBetween(0, 1, 15), EPSILON);
    }

    @Test
    public void testMixedTimestampsAreRejected() {
        Signal.Builder builder = Signal.builder().add(T0, 100);
        assertThrows(MalformedSignalException.class, () -> builder.add(101));
        assertThrows(MalformedSignalException.class,
                () -> Signal.of(Arrays.asList(Sample.of(100), Sample.of(T0, 101))));
    }

    @Test
    public void testNullSampleIsRejected() {
        assertThrows(MalformedSignalException.class, () -> Signal.of(Arrays.asList(Sample.of(100), null)));
        assertThrows(MalformedSignalException.class, () -> Signal.of((List<Sample>) null));
    }

    @Test
    public void testSamplesRoundTrip() {
        Signal signal = TestUtils.timestamped(new double[] { 100, 110 }, 5);
        List<Sample> samples = signal.getSamples();
        assertEquals(Sample.of(T0, 100), samples.get(0));
        assertEquals(signal, Signal.of(samples));
        assertNotEquals(signal, Signal.of(100, 110));
    }
}
