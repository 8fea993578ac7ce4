/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.pipeline;

/**
 * Lifecycle of a {@link StandardizedIndexPipeline}. {@link #STANDARDIZED} and {@link #FAILED} are terminal.
 */
public enum PipelineState {
    CONFIGURED,
    FITTING,
    STANDARDIZED,
    FAILED;

    public boolean isTerminal() {
        return this == STANDARDIZED || this == FAILED;
    }
}
