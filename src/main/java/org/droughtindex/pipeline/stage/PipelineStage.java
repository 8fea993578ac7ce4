/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.pipeline.stage;

import org.droughtindex.core.model.TimeSeries;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;

/**
 * A step of the index computation that maps one series onto another, keeping timestamp order.
 *
 * <p>A built stage does not change. The standardization stage of a finished run keeps its fitted
 * distributions, so it can be written out and later applied to observations the fits never saw.</p>
 */
public interface PipelineStage extends Writeable {

    String getName();

    /**
     * @param input series to transform, never null
     * @return the transformed series, possibly shorter than the input
     */
    TimeSeries process(TimeSeries input);

    /**
     * Write the stage's parameters as fields into the object the caller has opened.
     */
    void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException;
}
