/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.core.model;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.Writeable;

import java.io.IOException;

/**
 * A timestamped value. Non-finite values mark missing observations.
 */
public interface Sample extends Writeable {

    /** Epoch milliseconds. */
    long getTimestamp();

    double getValue();

    default boolean isFinite() {
        return Double.isFinite(getValue());
    }

    static Sample readFrom(StreamInput in) throws IOException {
        return Observation.readFrom(in);
    }
}
