/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.pipeline;

import org.droughtindex.core.model.TimeSeries;
import org.droughtindex.distribution.FittedDistribution;
import org.droughtindex.season.SeasonKey;
import org.droughtindex.standardize.StandardizationStage;
import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Output of a {@link StandardizedIndexPipeline} run. The index series has the timestamps of the
 * accumulated series; {@link #getStandardization()} can score later observations with the same fits.
 */
public class StandardizedIndexResult implements ToXContentObject {

    private final IndexFamily family;
    private final TimeSeries index;
    private final TimeSeries accumulated;
    private final StandardizationStage standardization;

    public StandardizedIndexResult(IndexFamily family, TimeSeries index, TimeSeries accumulated, StandardizationStage standardization) {
        this.family = Objects.requireNonNull(family, "family must not be null");
        this.index = Objects.requireNonNull(index, "index must not be null");
        this.accumulated = Objects.requireNonNull(accumulated, "accumulated must not be null");
        this.standardization = Objects.requireNonNull(standardization, "standardization must not be null");
    }

    public IndexFamily getFamily() {
        return family;
    }

    public TimeSeries getIndex() {
        return index;
    }

    public TimeSeries getAccumulated() {
        return accumulated;
    }

    public StandardizationStage getStandardization() {
        return standardization;
    }

    public SortedMap<SeasonKey, FittedDistribution> getFits() {
        return standardization.getFits();
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("family", family.name().toLowerCase(Locale.ROOT));
        builder.field("index");
        index.toXContent(builder, params);
        builder.startObject(StandardizationStage.NAME);
        standardization.toXContent(builder, params);
        builder.endObject();
        return builder.endObject();
    }
}
