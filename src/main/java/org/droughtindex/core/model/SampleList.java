/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Immutable, array-backed list of samples. Callers are encouraged to read raw timestamps and values
 * through {@link #getTimestamp(int)} and {@link #getValue(int)} instead of materializing
 * {@link Sample} objects.
 */
public final class SampleList implements Iterable<Sample> {

    private static final SampleList EMPTY = new SampleList(new long[0], new double[0]);

    private final long[] timestamps;
    private final double[] values;

    private SampleList(long[] timestamps, double[] values) {
        this.timestamps = timestamps;
        this.values = values;
    }

    /**
     * Create a list from parallel arrays, the arrays are copied.
     *
     * @param timestamps sample timestamps
     * @param values sample values, same length as timestamps
     * @return the list
     */
    public static SampleList of(long[] timestamps, double[] values) {
        if (timestamps.length != values.length) {
            throw new IllegalArgumentException(
                "timestamps and values must have the same length, got " + timestamps.length + " and " + values.length
            );
        }
        return new SampleList(timestamps.clone(), values.clone());
    }

    /**
     * Create a list from sample objects.
     */
    public static SampleList fromList(List<? extends Sample> samples) {
        long[] timestamps = new long[samples.size()];
        double[] values = new double[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            Sample sample = samples.get(i);
            timestamps[i] = sample.getTimestamp();
            values[i] = sample.getValue();
        }
        return new SampleList(timestamps, values);
    }

    public static SampleList empty() {
        return EMPTY;
    }

    public int size() {
        return timestamps.length;
    }

    public boolean isEmpty() {
        return timestamps.length == 0;
    }

    /**
     * Get the sample value at specific index, could be {@link Double#NaN}
     */
    public double getValue(int index) {
        return values[index];
    }

    public long getTimestamp(int index) {
        return timestamps[index];
    }

    public Sample getSample(int index) {
        return new Observation(timestamps[index], values[index]);
    }

    /**
     * @return a copy of the timestamps
     */
    public long[] timestamps() {
        return timestamps.clone();
    }

    /**
     * @return a copy of the values
     */
    public double[] values() {
        return values.clone();
    }

    /**
     * Like {@link List#subList(int, int)} but returns an independent copy.
     */
    public SampleList subList(int fromIndex, int toIndex) {
        return new SampleList(Arrays.copyOfRange(timestamps, fromIndex, toIndex), Arrays.copyOfRange(values, fromIndex, toIndex));
    }

    /**
     * Binary search on the timestamp array, same contract as {@link Arrays#binarySearch(long[], long)}.
     * Only meaningful on a validated (strictly increasing) list.
     */
    public int binarySearch(long timestamp) {
        return Arrays.binarySearch(timestamps, timestamp);
    }

    public List<Sample> toList() {
        List<Sample> result = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            result.add(getSample(i));
        }
        return result;
    }

    @Override
    public Iterator<Sample> iterator() {
        return new Iterator<>() {
            private int index = 0;

            @Override
            public boolean hasNext() {
                return index < timestamps.length;
            }

            @Override
            public Sample next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Sample sample = getSample(index);
                index++;
                return sample;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SampleList that = (SampleList) o;
        return Arrays.equals(timestamps, that.timestamps) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(timestamps) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < timestamps.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(timestamps[i]).append('=').append(values[i]);
        }
        return sb.append(']').toString();
    }
}
