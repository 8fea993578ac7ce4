/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.core.model;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;

import java.io.IOException;
import java.time.Instant;

/**
 * One measured value of a hydrological variable (precipitation, water balance, groundwater level)
 * at an instant. A gap in the record is an observation whose value is {@link Double#NaN}.
 */
public final class Observation implements Sample {

    private final long timestamp;
    private final double value;

    public Observation(long timestamp, double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    public static Observation missing(long timestamp) {
        return new Observation(timestamp, Double.NaN);
    }

    @Override
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public double getValue() {
        return value;
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeLong(timestamp);
        out.writeDouble(value);
    }

    public static Observation readFrom(StreamInput in) throws IOException {
        return new Observation(in.readLong(), in.readDouble());
    }

    /**
     * Equal timestamps and bitwise-equal values, so two gaps at the same instant are equal.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Observation other = (Observation) o;
        return timestamp == other.timestamp && Double.doubleToLongBits(value) == Double.doubleToLongBits(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(timestamp) + Double.hashCode(value);
    }

    @Override
    public String toString() {
        return Instant.ofEpochMilli(timestamp) + "=" + (isFinite() ? Double.toString(value) : "missing");
    }
}
