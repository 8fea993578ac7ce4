/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.common.exception;

import org.droughtindex.season.SeasonKey;

/**
 * A seasonal group holds fewer usable observations than the configured minimum.
 */
public class InsufficientDataException extends StandardizedIndexException {

    private final int sampleSize;
    private final int minimumSampleSize;

    public InsufficientDataException(SeasonKey season, int sampleSize, int minimumSampleSize) {
        super(
            season,
            "season [{}] has [{}] usable observations but at least [{}] are required; "
                + "supply more history, shorten the window or coarsen the seasonal granularity",
            season == null ? "all" : season.label(),
            sampleSize,
            minimumSampleSize
        );
        this.sampleSize = sampleSize;
        this.minimumSampleSize = minimumSampleSize;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getMinimumSampleSize() {
        return minimumSampleSize;
    }
}
