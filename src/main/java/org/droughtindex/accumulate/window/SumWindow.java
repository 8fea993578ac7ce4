/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.accumulate.window;

/**
 * Trailing sum over the last {@code capacity} values, kept in a circular buffer.
 *
 * The sum is recomputed from the buffer, oldest value first, each time it is read, so it always
 * equals the plain left-to-right sum of the window members.
 */
public class SumWindow implements WindowTransformer {

    private final double[] buffer;
    private int head;
    private int size;
    private int missing;

    /**
     * @param capacity number of values in a full window, must be positive
     */
    public SumWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("window capacity must be positive, got: " + capacity);
        }
        this.buffer = new double[capacity];
    }

    @Override
    public void add(double value) {
        if (size == buffer.length) {
            if (Double.isFinite(buffer[head]) == false) {
                missing--;
            }
        } else {
            size++;
        }
        buffer[head] = value;
        if (Double.isFinite(value) == false) {
            missing++;
        }
        head = (head + 1) % buffer.length;
    }

    @Override
    public boolean isFull() {
        return size == buffer.length;
    }

    @Override
    public double value() {
        if (missing > 0) {
            return Double.NaN;
        }
        // oldest slot is head when full, 0 otherwise
        int start = size == buffer.length ? head : 0;
        double sum = 0.0;
        for (int i = 0; i < size; i++) {
            sum += buffer[(start + i) % buffer.length];
        }
        return sum;
    }

    @Override
    public int getMissingCount() {
        return missing;
    }
}
