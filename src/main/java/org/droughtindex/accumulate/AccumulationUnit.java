/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.accumulate;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * Unit in which an accumulation window length is expressed.
 */
public enum AccumulationUnit implements Writeable {
    /** Window of W observations, the series' native time step. */
    STEPS((byte) 0),
    /** Calendar window of W days ending at the observation. */
    DAYS((byte) 1),
    /** Calendar window of W months ending at the observation. */
    MONTHS((byte) 2);

    private final byte id;

    AccumulationUnit(byte id) {
        this.id = id;
    }

    /**
     * Index of the calendar period holding a timestamp: epoch day for {@link #DAYS}, months since
     * year zero for {@link #MONTHS}. Consecutive periods have consecutive indices.
     */
    long periodIndex(long timestamp, ZoneId zone) {
        ZonedDateTime dateTime = Instant.ofEpochMilli(timestamp).atZone(zone);
        return switch (this) {
            case DAYS -> dateTime.toLocalDate().toEpochDay();
            case MONTHS -> dateTime.getYear() * 12L + dateTime.getMonthValue() - 1;
            case STEPS -> throw new IllegalStateException("steps are not a calendar unit");
        };
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeByte(id);
    }

    public static AccumulationUnit readFrom(StreamInput in) throws IOException {
        byte id = in.readByte();
        for (AccumulationUnit unit : values()) {
            if (unit.id == id) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown accumulation unit ID: " + id);
    }

    public static AccumulationUnit fromString(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "steps", "step", "observations" -> STEPS;
            case "days", "day", "d" -> DAYS;
            case "months", "month", "m" -> MONTHS;
            default -> throw new IllegalArgumentException("Invalid accumulation unit: " + value);
        };
    }
}
