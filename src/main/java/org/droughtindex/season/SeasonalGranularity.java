/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.season;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;

import java.io.IOException;
import java.time.Instant;
import java.time.MonthDay;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * Calendar granularity used to split an accumulated series into seasonal groups.
 */
public enum SeasonalGranularity implements Writeable {
    /** One pooled group for the whole series. */
    NONE((byte) 0),
    /** One group per month of year, ordinals 1 to 12. */
    MONTH((byte) 1),
    /**
     * One group per calendar day. The ordinal is {@code month * 100 + day}; 29 February is folded into
     * 28 February so that leap and non-leap years share keys.
     */
    DAY_OF_YEAR((byte) 2);

    private final byte id;

    SeasonalGranularity(byte id) {
        this.id = id;
    }

    public byte getId() {
        return id;
    }

    /**
     * Compute the season key of a timestamp.
     *
     * @param timestamp epoch milliseconds
     * @param zone zone in which calendar fields are evaluated
     * @return the key of the group the timestamp belongs to
     */
    public SeasonKey keyOf(long timestamp, ZoneId zone) {
        if (this == NONE) {
            return SeasonKey.ALL;
        }
        ZonedDateTime dateTime = Instant.ofEpochMilli(timestamp).atZone(zone);
        return switch (this) {
            case MONTH -> new SeasonKey(this, dateTime.getMonthValue());
            case DAY_OF_YEAR -> {
                int month = dateTime.getMonthValue();
                int day = dateTime.getDayOfMonth();
                if (month == 2 && day == 29) {
                    day = 28;
                }
                yield new SeasonKey(this, month * 100 + day);
            }
            default -> throw new IllegalStateException("unhandled granularity " + this);
        };
    }

    /**
     * Render the label of a key of this granularity.
     */
    String label(int ordinal) {
        return switch (this) {
            case NONE -> "all";
            case MONTH -> "month=" + ordinal;
            case DAY_OF_YEAR -> {
                MonthDay monthDay = MonthDay.of(ordinal / 100, ordinal % 100);
                yield String.format(Locale.ROOT, "day=%02d-%02d", monthDay.getMonthValue(), monthDay.getDayOfMonth());
            }
        };
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeByte(id);
    }

    public static SeasonalGranularity readFrom(StreamInput in) throws IOException {
        return fromId(in.readByte());
    }

    public static SeasonalGranularity fromId(byte id) {
        for (SeasonalGranularity granularity : values()) {
            if (granularity.id == id) {
                return granularity;
            }
        }
        throw new IllegalArgumentException("Unknown seasonal granularity ID: " + id);
    }

    public static SeasonalGranularity fromString(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "none", "all" -> NONE;
            case "month", "monthly" -> MONTH;
            case "day_of_year", "day-of-year", "doy", "day", "daily" -> DAY_OF_YEAR;
            default -> throw new IllegalArgumentException("Invalid seasonal granularity: " + value);
        };
    }
}
