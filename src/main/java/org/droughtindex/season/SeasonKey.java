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
import java.util.Comparator;

/**
 * Identifies one seasonal group: the granularity plus its calendar ordinal.
 *
 * @param granularity the granularity the key was computed with
 * @param ordinal month number, {@code month * 100 + day}, or 0 for the pooled group
 */
public record SeasonKey(SeasonalGranularity granularity, int ordinal) implements Comparable<SeasonKey>, Writeable {

    /** Key of the single pooled group. */
    public static final SeasonKey ALL = new SeasonKey(SeasonalGranularity.NONE, 0);

    private static final Comparator<SeasonKey> ORDER = Comparator.comparing(SeasonKey::granularity)
        .thenComparingInt(SeasonKey::ordinal);

    public SeasonKey {
        if (granularity == null) {
            throw new NullPointerException("granularity must not be null");
        }
    }

    public static SeasonKey month(int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be in [1, 12], got: " + month);
        }
        return new SeasonKey(SeasonalGranularity.MONTH, month);
    }

    /**
     * @return human readable label such as {@code month=12} or {@code day=02-28}
     */
    public String label() {
        return granularity.label(ordinal);
    }

    @Override
    public int compareTo(SeasonKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        granularity.writeTo(out);
        out.writeVInt(ordinal);
    }

    public static SeasonKey readFrom(StreamInput in) throws IOException {
        SeasonalGranularity granularity = SeasonalGranularity.readFrom(in);
        int ordinal = in.readVInt();
        return new SeasonKey(granularity, ordinal);
    }

    @Override
    public String toString() {
        return label();
    }
}
