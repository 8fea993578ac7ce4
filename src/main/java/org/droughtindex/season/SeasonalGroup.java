/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.season;

import java.util.Arrays;

/**
 * Members of one season: their positions in the accumulated series and their values.
 *
 * <p>Non-finite members are kept so the groups partition the series, but only finite values are
 * part of the fitting {@link #sample()}.</p>
 */
public final class SeasonalGroup {

    private final SeasonKey key;
    private final int[] positions;
    private final double[] values;
    private final int finiteCount;

    SeasonalGroup(SeasonKey key, int[] positions, double[] values) {
        this.key = key;
        this.positions = positions;
        this.values = values;
        int count = 0;
        for (double value : values) {
            if (Double.isFinite(value)) {
                count++;
            }
        }
        this.finiteCount = count;
    }

    public SeasonKey getKey() {
        return key;
    }

    /**
     * @return positions of the members in the accumulated series, increasing
     */
    public int[] positions() {
        return positions.clone();
    }

    public int size() {
        return positions.length;
    }

    /**
     * @return number of members with a finite value
     */
    public int finiteCount() {
        return finiteCount;
    }

    /**
     * @return the finite member values in series order, the sample a distribution is fit to
     */
    public double[] sample() {
        double[] sample = new double[finiteCount];
        int i = 0;
        for (double value : values) {
            if (Double.isFinite(value)) {
                sample[i++] = value;
            }
        }
        return sample;
    }

    @Override
    public String toString() {
        return "SeasonalGroup{key=" + key.label() + ", positions=" + Arrays.toString(positions) + ", finiteCount=" + finiteCount + '}';
    }
}
