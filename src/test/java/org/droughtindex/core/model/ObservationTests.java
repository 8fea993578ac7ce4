/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.core.model;

import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.test.AbstractWireSerializingTestCase;

public class ObservationTests extends AbstractWireSerializingTestCase<Observation> {

    public void testFinite() {
        assertTrue(new Observation(0L, 0.0).isFinite());
        assertFalse(new Observation(0L, Double.NaN).isFinite());
        assertFalse(new Observation(0L, Double.NEGATIVE_INFINITY).isFinite());
    }

    public void testMissing() {
        Observation gap = Observation.missing(86_400_000L);

        assertTrue(Double.isNaN(gap.getValue()));
        assertEquals(gap, new Observation(86_400_000L, Double.NaN));
        assertEquals(gap.hashCode(), new Observation(86_400_000L, Double.NaN).hashCode());
        assertEquals("1970-01-02T00:00:00Z=missing", gap.toString());
        assertEquals("1970-01-01T00:00:00Z=2.5", new Observation(0L, 2.5).toString());
    }

    @Override
    protected Writeable.Reader<Observation> instanceReader() {
        return Observation::readFrom;
    }

    @Override
    protected Observation createTestInstance() {
        return new Observation(randomLong(), randomDouble());
    }
}
