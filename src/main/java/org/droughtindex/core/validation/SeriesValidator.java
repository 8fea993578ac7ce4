/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.core.validation;

import org.droughtindex.common.exception.InputValidationException;
import org.droughtindex.core.model.SampleList;
import org.droughtindex.core.model.TimeSeries;

/**
 * Structural checks applied to a caller supplied series before any computation.
 */
public final class SeriesValidator {

    private SeriesValidator() {}

    /**
     * Require a non-empty series with strictly increasing timestamps. Non-finite values are allowed
     * and travel through the pipeline as missing markers.
     *
     * @param series the series to check
     * @throws InputValidationException on the first violation
     */
    public static void validate(TimeSeries series) {
        validate(series, false);
    }

    /**
     * @param series the series to check
     * @param requireFinite when true, any non-finite value is rejected as well
     * @throws InputValidationException on the first violation
     */
    public static void validate(TimeSeries series, boolean requireFinite) {
        if (series == null) {
            throw new InputValidationException("input series must not be null");
        }
        SampleList samples = series.getSamples();
        if (samples.isEmpty()) {
            throw new InputValidationException("input series [{}] is empty", series.displayName());
        }
        for (int i = 1; i < samples.size(); i++) {
            long previous = samples.getTimestamp(i - 1);
            long current = samples.getTimestamp(i);
            if (current == previous) {
                throw new InputValidationException(
                    "input series [{}] has duplicate timestamp [{}] at index [{}]",
                    series.displayName(),
                    current,
                    i
                );
            }
            if (current < previous) {
                throw new InputValidationException(
                    "input series [{}] is not ordered: timestamp [{}] at index [{}] precedes [{}] at index [{}]",
                    series.displayName(),
                    current,
                    i,
                    previous,
                    i - 1
                );
            }
        }
        if (requireFinite) {
            for (int i = 0; i < samples.size(); i++) {
                if (Double.isFinite(samples.getValue(i)) == false) {
                    throw new InputValidationException(
                        "input series [{}] has non-finite value [{}] at index [{}] but missing data is not allowed",
                        series.displayName(),
                        samples.getValue(i),
                        i
                    );
                }
            }
        }
    }
}
