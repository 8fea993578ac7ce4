/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.standardize;

import org.droughtindex.common.exception.ConfigurationException;
import org.droughtindex.core.model.SampleList;
import org.droughtindex.core.model.TimeSeries;
import org.droughtindex.distribution.DistributionRegistry;
import org.droughtindex.distribution.FittedDistribution;
import org.droughtindex.pipeline.stage.PipelineStage;
import org.droughtindex.season.SeasonKey;
import org.droughtindex.season.SeasonalGranularity;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.time.ZoneId;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Pipeline stage turning accumulated values into index values with the per-season fitted
 * distributions. The fits are part of the stage, so a stage produced by one run can score later
 * observations of the same series.
 */
public class StandardizationStage implements PipelineStage {
    /** The name of this stage. */
    public static final String NAME = "standardize";

    private final SortedMap<SeasonKey, FittedDistribution> fits;
    private final SeasonalGranularity granularity;
    private final ZoneId zone;
    private final Standardizer standardizer;

    public StandardizationStage(
        Map<SeasonKey, FittedDistribution> fits,
        SeasonalGranularity granularity,
        ZoneId zone,
        Standardizer standardizer
    ) {
        Objects.requireNonNull(fits, "fits must not be null");
        this.fits = Collections.unmodifiableSortedMap(new TreeMap<>(fits));
        this.granularity = Objects.requireNonNull(granularity, "granularity must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.standardizer = Objects.requireNonNull(standardizer, "standardizer must not be null");
        for (SeasonKey key : this.fits.keySet()) {
            if (key.granularity() != granularity) {
                throw new ConfigurationException(key, "season [{}] does not match granularity [{}]", key, granularity);
            }
        }
    }

    /**
     * @throws ConfigurationException if a finite value falls in a season that has no fit
     */
    @Override
    public TimeSeries process(TimeSeries input) {
        if (input == null) {
            throw new NullPointerException(getName() + " stage received null input");
        }
        SampleList samples = input.getSamples();
        long[] timestamps = samples.timestamps();
        double[] indices = new double[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            double value = samples.getValue(i);
            if (Double.isFinite(value) == false) {
                indices[i] = Double.NaN;
                continue;
            }
            indices[i] = standardizer.standardize(fitFor(samples.getTimestamp(i)), value);
        }
        return input.withSamples(SampleList.of(timestamps, indices));
    }

    /**
     * @param timestamp epoch milliseconds
     * @return the fit of the season the timestamp falls in
     * @throws ConfigurationException if that season has no fit
     */
    public FittedDistribution fitFor(long timestamp) {
        SeasonKey key = granularity.keyOf(timestamp, zone);
        FittedDistribution fitted = fits.get(key);
        if (fitted == null) {
            throw new ConfigurationException(key, "no fitted distribution for season [{}]", key);
        }
        return fitted;
    }

    @Override
    public String getName() {
        return NAME;
    }

    public SortedMap<SeasonKey, FittedDistribution> getFits() {
        return fits;
    }

    public SeasonalGranularity getGranularity() {
        return granularity;
    }

    public ZoneId getZone() {
        return zone;
    }

    public Standardizer getStandardizer() {
        return standardizer;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("granularity", granularity.toString().toLowerCase(Locale.ROOT));
        builder.field("time_zone", zone.getId());
        builder.field("probability_epsilon", standardizer.getEpsilon());
        builder.startObject("fits");
        for (Map.Entry<SeasonKey, FittedDistribution> entry : fits.entrySet()) {
            builder.field(entry.getKey().label());
            entry.getValue().toXContent(builder, params);
        }
        builder.endObject();
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        granularity.writeTo(out);
        out.writeString(zone.getId());
        out.writeDouble(standardizer.getEpsilon());
        out.writeVInt(fits.size());
        for (Map.Entry<SeasonKey, FittedDistribution> entry : fits.entrySet()) {
            entry.getKey().writeTo(out);
            entry.getValue().writeTo(out);
        }
    }

    /**
     * Deserializes a StandardizationStage, resolving distributions by name in {@code registry}.
     */
    public static StandardizationStage readFrom(StreamInput in, DistributionRegistry registry) throws IOException {
        SeasonalGranularity granularity = SeasonalGranularity.readFrom(in);
        ZoneId zone = ZoneId.of(in.readString());
        Standardizer standardizer = new Standardizer(in.readDouble());
        int size = in.readVInt();
        SortedMap<SeasonKey, FittedDistribution> fits = new TreeMap<>();
        for (int i = 0; i < size; i++) {
            SeasonKey key = SeasonKey.readFrom(in);
            fits.put(key, FittedDistribution.readFrom(in, registry));
        }
        return new StandardizationStage(fits, granularity, zone, standardizer);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        StandardizationStage that = (StandardizationStage) obj;
        return granularity == that.granularity
            && zone.equals(that.zone)
            && Double.compare(standardizer.getEpsilon(), that.standardizer.getEpsilon()) == 0
            && fits.equals(that.fits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fits, granularity, zone, standardizer.getEpsilon());
    }

    @Override
    public String toString() {
        return "StandardizationStage{granularity=" + granularity + ", zone=" + zone + ", seasons=" + fits.keySet() + '}';
    }
}
