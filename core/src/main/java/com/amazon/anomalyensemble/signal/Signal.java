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

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * An ordered, time-ascending sequence of samples. Instances are immutable and
 * validated on construction, so detectors may share one instance across threads
 * without copying.
 */
public final class Signal {

    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private final double[] values;

    // null when the signal carries no timestamps
    private final long[] epochMillis;

    private Signal(double[] values, long[] epochMillis) {
        this.values = values;
        this.epochMillis = epochMillis;
        validate();
    }

    /**
     * Creates a signal without timestamps.
     *
     * @param values the readings in order
     * @return a new signal
     * @throws MalformedSignalException if the values are empty or not finite
     */
    public static Signal of(double... values) {
        if (values == null) {
            throw new MalformedSignalException("values must not be null");
        }
        return new Signal(Arrays.copyOf(values, values.length), null);
    }

    /**
     * Creates a signal from samples. Either all samples carry a timestamp or none
     * does.
     *
     * @param samples the readings in order
     * @return a new signal
     * @throws MalformedSignalException if the samples violate the input contract
     */
    public static Signal of(List<Sample> samples) {
        if (samples == null) {
            throw new MalformedSignalException("samples must not be null");
        }
        Builder builder = builder();
        for (Sample sample : samples) {
            if (sample == null) {
                throw new MalformedSignalException("null sample at position " + builder.values.size());
            }
            builder.add(sample);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Re-checks the input contract. Construction already validates, this exists
     * so that callers holding a signal of unknown origin can assert it cheaply.
     *
     * @throws MalformedSignalException if the contract is violated
     */
    public void validate() {
        if (values.length == 0) {
            throw new MalformedSignalException("signal must contain at least one sample");
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new MalformedSignalException("non-finite value " + values[i] + " at position " + i);
            }
        }
        if (epochMillis != null) {
            if (epochMillis.length != values.length) {
                throw new MalformedSignalException("timestamps and values differ in length");
            }
            for (int i = 1; i < epochMillis.length; i++) {
                if (epochMillis[i] < epochMillis[i - 1]) {
                    throw new MalformedSignalException("timestamps decrease at position " + i);
                }
            }
        }
    }

    public int size() {
        return values.length;
    }

    public double getValue(int index) {
        return values[index];
    }

    /**
     * @return a copy of the readings
     */
    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    public boolean hasTimestamps() {
        return epochMillis != null;
    }

    /**
     * @param index position in the signal
     * @return the timestamp of the sample, or null if the signal has none
     */
    public Instant getTimestamp(int index) {
        if (epochMillis == null) {
            return null;
        }
        return Instant.ofEpochMilli(epochMillis[index]);
    }

    public Sample getSample(int index) {
        return new Sample(getTimestamp(index), values[index]);
    }

    public List<Sample> getSamples() {
        List<Sample> samples = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            samples.add(getSample(i));
        }
        return Collections.unmodifiableList(samples);
    }

    /**
     * Minutes elapsed from the first sample to each sample. Without timestamps
     * the samples are assumed to be spaced by the nominal interval.
     *
     * @param nominalIntervalMinutes spacing used when there are no timestamps
     * @return an array of offsets in minutes, starting at 0
     */
    public double[] getMinuteOffsets(double nominalIntervalMinutes) {
        double[] offsets = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            offsets[i] = (epochMillis == null) ? i * nominalIntervalMinutes
                    : (epochMillis[i] - epochMillis[0]) / MILLIS_PER_MINUTE;
        }
        return offsets;
    }

    /**
     * @param from                   earlier position
     * @param to                     later position
     * @param nominalIntervalMinutes spacing used when there are no timestamps
     * @return minutes elapsed between the two samples
     */
    public double minutesBetween(int from, int to, double nominalIntervalMinutes) {
        if (epochMillis == null) {
            return (to - from) * nominalIntervalMinutes;
        }
        return (epochMillis[to] - epochMillis[from]) / MILLIS_PER_MINUTE;
    }

    /**
     * @param index position in the signal
     * @param zone  zone in which the hour is read
     * @return the hour of day of the sample, or empty when the signal has no
     *         timestamps
     */
    public OptionalInt getHourOfDay(int index, ZoneId zone) {
        if (epochMillis == null) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Instant.ofEpochMilli(epochMillis[index]).atZone(zone).getHour());
    }

    /**
     * @param from first position, inclusive
     * @param to   last position, exclusive
     * @return the readings in the range
     */
    public double[] window(int from, int to) {
        return Arrays.copyOfRange(values, Math.max(0, from), Math.min(values.length, to));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Signal)) {
            return false;
        }
        Signal other = (Signal) o;
        return Arrays.equals(values, other.values) && Arrays.equals(epochMillis, other.epochMillis);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + Arrays.hashCode(epochMillis);
    }

    @Override
    public String toString() {
        return "Signal[size=" + values.length + ", timestamps=" + hasTimestamps() + "]";
    }

    public static class Builder {

        private final List<Double> values = new ArrayList<>();
        private final List<Long> epochMillis = new ArrayList<>();
        private Boolean timestamped;

        public Builder add(double value) {
            return add(new Sample(null, value));
        }

        public Builder add(Instant timestamp, double value) {
            return add(new Sample(timestamp, value));
        }

        public Builder add(Sample sample) {
            boolean hasTimestamp = sample.getTimestamp() != null;
            if (timestamped == null) {
                timestamped = hasTimestamp;
            } else if (timestamped != hasTimestamp) {
                throw new MalformedSignalException(
                        "either every sample or no sample must carry a timestamp, position " + values.size());
            }
            values.add(sample.getValue());
            if (hasTimestamp) {
                epochMillis.add(sample.getTimestamp().toEpochMilli());
            }
            return this;
        }

        public Signal build() {
            double[] array = new double[values.size()];
            for (int i = 0; i < array.length; i++) {
                array[i] = values.get(i);
            }
            long[] times = null;
            if (Boolean.TRUE.equals(timestamped)) {
                times = new long[epochMillis.size()];
                for (int i = 0; i < times.length; i++) {
                    times[i] = epochMillis.get(i);
                }
            }
            return new Signal(array, times);
        }
    }
}
