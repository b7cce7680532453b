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

package com.amazon.anomalyensemble.testutils;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Random;

/**
 * Deterministic synthetic glucose series in mg/dL. Every generator that draws
 * random numbers takes a seed, so tests built on these series are reproducible.
 */
public class GlucoseDataSets {

    /** 08:00 UTC on a Monday. */
    public static final Instant START = Instant.parse("2024-01-01T08:00:00Z");

    public static final double BASELINE = 100.0;

    public static final double NOISE_AMPLITUDE = 4.0;

    public static final int SCENARIO_LENGTH = 200;

    public static final int FLAT_START = 40;

    public static final int FLAT_END = 60;

    public static final int SPIKE_INDEX = 150;

    public static final double SPIKE_VALUE = 400.0;

    private GlucoseDataSets() {
    }

    /**
     * @param size      number of readings
     * @param base      central value
     * @param amplitude noise is uniform in [-amplitude, amplitude)
     * @param seed      random seed
     * @return base plus uniform noise
     */
    public static double[] uniformNoise(int size, double base, double amplitude, long seed) {
        Random prg = new Random(seed);
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = base + amplitude * (2 * prg.nextDouble() - 1);
        }
        return values;
    }

    public static double[] baseline(int size, long seed) {
        return uniformNoise(size, BASELINE, NOISE_AMPLITUDE, seed);
    }

    /**
     * A noisy baseline with a stuck sensor run at exactly the baseline value over
     * [{@link #FLAT_START}, {@link #FLAT_END}] and an isolated spike at
     * {@link #SPIKE_INDEX}.
     */
    public static double[] flatRunAndSpike(long seed) {
        double[] values = baseline(SCENARIO_LENGTH, seed);
        Arrays.fill(values, FLAT_START, FLAT_END + 1, BASELINE);
        values[SPIKE_INDEX] = SPIKE_VALUE;
        return values;
    }

    /**
     * A noisy baseline with one reading replaced.
     */
    public static double[] singleReading(int size, int index, double value, long seed) {
        double[] values = baseline(size, seed);
        values[index] = value;
        return values;
    }

    public static double[] constant(int size, double value) {
        double[] values = new double[size];
        Arrays.fill(values, value);
        return values;
    }

    /**
     * A day of readings: fasting baseline, three meal excursions and sensor noise.
     *
     * @param size            number of readings
     * @param intervalMinutes spacing of the readings, starting at {@link #START}
     * @param seed            random seed
     * @return the series
     */
    public static double[] dailyProfile(int size, double intervalMinutes, long seed) {
        Random prg = new Random(seed);
        double[] mealHours = { 12.5, 18.5, 7.5 };
        double startHour = START.atZone(ZoneOffset.UTC).getHour();
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            double hour = (startHour + i * intervalMinutes / 60.0) % 24;
            double value = 95;
            for (double meal : mealHours) {
                double elapsed = (hour - meal + 24) % 24;
                if (elapsed < 3) {
                    value += 60 * Math.sin(Math.PI * elapsed / 3);
                }
            }
            values[i] = value + 2 * (2 * prg.nextDouble() - 1);
        }
        return values;
    }

    /**
     * A sawtooth that repeats every period readings, the signature of an
     * electrically coupled artifact.
     */
    public static double[] sawtooth(int size, int period, double base, double amplitude) {
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = base + amplitude * (i % period) / (period - 1);
        }
        return values;
    }

    /**
     * Evenly spaced timestamps starting at {@link #START}.
     */
    public static Instant[] timestamps(int size, double intervalMinutes) {
        return timestamps(START, size, intervalMinutes);
    }

    public static Instant[] timestamps(Instant start, int size, double intervalMinutes) {
        Instant[] result = new Instant[size];
        long stepMillis = Math.round(intervalMinutes * 60_000);
        for (int i = 0; i < size; i++) {
            result[i] = start.plus(Duration.ofMillis(i * stepMillis));
        }
        return result;
    }
}
