/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.season;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.droughtindex.common.exception.InsufficientDataException;
import org.droughtindex.core.model.SampleList;
import org.droughtindex.core.model.TimeSeries;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Partitions an accumulated series into disjoint seasonal groups keyed by calendar position.
 *
 * <p>Every observation lands in exactly one group; groups come back in key order. {@link #group(TimeSeries)}
 * additionally enforces the minimum sample size so that an undersized season fails fast instead of
 * producing an unreliable fit.</p>
 */
public class SeasonalGrouper {

    private static final Logger logger = LogManager.getLogger(SeasonalGrouper.class);

    private final SeasonalGranularity granularity;
    private final ZoneId zone;
    private final int minSampleSize;

    /**
     * @param granularity calendar granularity of the groups
     * @param zone zone in which calendar fields are evaluated
     * @param minSampleSize minimum number of finite observations per group
     */
    public SeasonalGrouper(SeasonalGranularity granularity, ZoneId zone, int minSampleSize) {
        this.granularity = Objects.requireNonNull(granularity, "granularity must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        if (minSampleSize < 1) {
            throw new IllegalArgumentException("minSampleSize must be positive, got: " + minSampleSize);
        }
        this.minSampleSize = minSampleSize;
    }

    /**
     * Split the series into seasonal groups without any sample size check.
     *
     * @param series the accumulated series
     * @return groups in key order
     */
    public List<SeasonalGroup> partition(TimeSeries series) {
        if (series == null) {
            throw new NullPointerException("seasonal grouper received null input");
        }
        SampleList samples = series.getSamples();
        Map<SeasonKey, List<Integer>> membership = new TreeMap<>();
        for (int i = 0; i < samples.size(); i++) {
            SeasonKey key = granularity.keyOf(samples.getTimestamp(i), zone);
            membership.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
        }

        List<SeasonalGroup> groups = new ArrayList<>(membership.size());
        for (Map.Entry<SeasonKey, List<Integer>> entry : membership.entrySet()) {
            List<Integer> members = entry.getValue();
            int[] positions = new int[members.size()];
            double[] values = new double[members.size()];
            for (int j = 0; j < positions.length; j++) {
                positions[j] = members.get(j);
                values[j] = samples.getValue(positions[j]);
            }
            groups.add(new SeasonalGroup(entry.getKey(), positions, values));
        }
        return groups;
    }

    /**
     * Split the series into seasonal groups and require each to hold at least the minimum number of
     * finite observations.
     *
     * @param series the accumulated series
     * @return groups in key order
     * @throws InsufficientDataException naming the first undersized season
     */
    public List<SeasonalGroup> group(TimeSeries series) {
        List<SeasonalGroup> groups = partition(series);
        for (SeasonalGroup group : groups) {
            if (group.finiteCount() < minSampleSize) {
                throw new InsufficientDataException(group.getKey(), group.finiteCount(), minSampleSize);
            }
        }
        logger.debug("Split series [{}] into {} groups by {}", series.displayName(), groups.size(), granularity);
        return groups;
    }

    public SeasonalGranularity getGranularity() {
        return granularity;
    }

    public ZoneId getZone() {
        return zone;
    }

    public int getMinSampleSize() {
        return minSampleSize;
    }
}
