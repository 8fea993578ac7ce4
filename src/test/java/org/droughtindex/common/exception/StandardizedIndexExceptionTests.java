/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.common.exception;

import org.droughtindex.season.SeasonKey;
import org.opensearch.core.rest.RestStatus;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

public class StandardizedIndexExceptionTests extends OpenSearchTestCase {

    public void testSeasonMetadata() {
        FitConvergenceException e = new FitConvergenceException(SeasonKey.month(7), "cannot fit season [{}]", SeasonKey.month(7));

        assertEquals(SeasonKey.month(7), e.getSeason());
        assertEquals(List.of(SeasonKey.month(7).label()), e.getMetadata(StandardizedIndexException.SEASON_METADATA_KEY));
        assertEquals(RestStatus.BAD_REQUEST, e.status());
    }

    public void testWithoutSeason() {
        ConfigurationException e = new ConfigurationException("unknown distribution [{}]", "weibull");

        assertNull(e.getSeason());
        assertNull(e.getMetadata(StandardizedIndexException.SEASON_METADATA_KEY));
        assertEquals("unknown distribution [weibull]", e.getMessage());
    }

    public void testInsufficientDataMessage() {
        InsufficientDataException e = new InsufficientDataException(SeasonKey.month(1), 9, 10);

        assertEquals(9, e.getSampleSize());
        assertEquals(10, e.getMinimumSampleSize());
        assertTrue(e.getMessage(), e.getMessage().startsWith("season [" + SeasonKey.month(1).label() + "] has [9] usable observations"));
    }

    public void testCauseIsKept() {
        IllegalStateException cause = new IllegalStateException("diverged");
        FitConvergenceException e = new FitConvergenceException(SeasonKey.ALL, "failed to fit [{}]", cause, "gamma");

        assertSame(cause, e.getCause());
        assertEquals("failed to fit [gamma]", e.getMessage());
        assertEquals(RestStatus.BAD_REQUEST, e.status());
    }
}
