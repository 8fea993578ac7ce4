/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.accumulate.window;

/**
 * Interface for transformers that aggregate a fixed number of trailing observations.
 *
 * <h2>Missing values</h2>
 * A non-finite value is a missing marker. It occupies a slot in the window like any other value,
 * and an aggregate over a window that holds one is itself missing ({@link Double#NaN}). Once the
 * missing value slides out of the window the aggregate becomes finite again.
 */
public interface WindowTransformer {
    /**
     * Push a value into the window, evicting the oldest one when the window is full.
     *
     * @param value the observed value, non-finite when missing
     */
    void add(double value);

    /**
     * @return whether the window holds as many values as its capacity
     */
    boolean isFull();

    /**
     * Get the aggregate of the values currently in the window.
     *
     * @return the aggregate, or {@link Double#NaN} if any value in the window is non-finite
     */
    double value();

    /**
     * @return the number of non-finite values currently in the window
     */
    int getMissingCount();
}
