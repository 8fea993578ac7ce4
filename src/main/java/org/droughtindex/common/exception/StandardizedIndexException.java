/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.common.exception;

import org.droughtindex.season.SeasonKey;
import org.opensearch.OpenSearchException;
import org.opensearch.core.rest.RestStatus;

/**
 * Base class for every failure raised while computing a standardized index.
 *
 * <p>Failures are never recoverable inside a run: the pipeline aborts and the caller gets the
 * specific subclass. When a failure can be attributed to one seasonal group, the group's
 * {@link SeasonKey} is available from {@link #getSeason()} and as the {@value #SEASON_METADATA_KEY}
 * metadata entry.</p>
 */
public abstract class StandardizedIndexException extends OpenSearchException {

    /** Metadata key carrying the label of the season a failure belongs to. */
    public static final String SEASON_METADATA_KEY = "opensearch.sdi.season";

    private final SeasonKey season;

    protected StandardizedIndexException(SeasonKey season, String msg, Object... args) {
        super(msg, args);
        this.season = season;
        if (season != null) {
            addMetadata(SEASON_METADATA_KEY, season.label());
        }
    }

    protected StandardizedIndexException(SeasonKey season, String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
        this.season = season;
        if (season != null) {
            addMetadata(SEASON_METADATA_KEY, season.label());
        }
    }

    /**
     * @return the season this failure belongs to, or null when it concerns the whole run
     */
    public SeasonKey getSeason() {
        return season;
    }

    @Override
    public RestStatus status() {
        return RestStatus.BAD_REQUEST;
    }
}
