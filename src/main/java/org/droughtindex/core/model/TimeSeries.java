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
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of timestamped scalar observations.
 *
 * <p>Iteration order is timestamp order; every pipeline stage preserves it. Construction does not
 * check ordering or uniqueness, use {@link org.droughtindex.core.validation.SeriesValidator} for
 * that. The optional alias names the series in log lines and error messages.</p>
 *
 * <h2>Usage Examples:</h2>
 * <pre>{@code
 * List<Sample> samples = List.of(new Observation(t0, 12.5), new Observation(t1, 0.0));
 * TimeSeries precipitation = new TimeSeries(samples, "station-42/precipitation");
 * }</pre>
 */
public class TimeSeries implements Writeable, ToXContentObject {

    private final SampleList samples;
    private final String alias;

    /**
     * @param samples observations in timestamp order
     * @param alias optional name of the series (can be null)
     */
    public TimeSeries(List<? extends Sample> samples, String alias) {
        this(SampleList.fromList(samples), alias);
    }

    /**
     * Similar to {@link #TimeSeries(List, String)}
     */
    public TimeSeries(SampleList samples, String alias) {
        this.samples = Objects.requireNonNull(samples, "samples must not be null");
        this.alias = alias;
    }

    public SampleList getSamples() {
        return samples;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /**
     * @return the alias name, or null if not set
     */
    public String getAlias() {
        return alias;
    }

    /**
     * @return the alias, or a placeholder for unnamed series, for use in messages
     */
    public String displayName() {
        return alias != null ? alias : "<unnamed>";
    }

    /**
     * Create a new series with the same alias and different samples.
     */
    public TimeSeries withSamples(SampleList newSamples) {
        return new TimeSeries(newSamples, alias);
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeOptionalString(alias);
        out.writeVInt(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            out.writeLong(samples.getTimestamp(i));
            out.writeDouble(samples.getValue(i));
        }
    }

    public static TimeSeries readFrom(StreamInput in) throws IOException {
        String alias = in.readOptionalString();
        int size = in.readVInt();
        long[] timestamps = new long[size];
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            timestamps[i] = in.readLong();
            values[i] = in.readDouble();
        }
        return new TimeSeries(SampleList.of(timestamps, values), alias);
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        if (alias != null) {
            builder.field("alias", alias);
        }
        builder.startArray("samples");
        for (int i = 0; i < samples.size(); i++) {
            double value = samples.getValue(i);
            builder.startObject().field("timestamp", samples.getTimestamp(i));
            // JSON has no NaN, missing values are written as null
            if (Double.isFinite(value)) {
                builder.field("value", value);
            } else {
                builder.nullField("value");
            }
            builder.endObject();
        }
        builder.endArray();
        return builder.endObject();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeSeries that = (TimeSeries) o;
        return Objects.equals(samples, that.samples) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(samples, alias);
    }

    @Override
    public String toString() {
        return "TimeSeries{" + "samples=" + samples + ", alias='" + alias + '\'' + '}';
    }
}
