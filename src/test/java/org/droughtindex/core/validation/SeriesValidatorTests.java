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
import org.opensearch.test.OpenSearchTestCase;

import static org.droughtindex.TestUtils.monthlySeries;

public class SeriesValidatorTests extends OpenSearchTestCase {

    public void testValidSeriesPasses() {
        SeriesValidator.validate(monthlySeries(2000, 1.0, 2.0, Double.NaN, 4.0));
    }

    public void testNullSeries() {
        expectThrows(InputValidationException.class, () -> SeriesValidator.validate(null));
    }

    public void testEmptySeries() {
        InputValidationException e = expectThrows(
            InputValidationException.class,
            () -> SeriesValidator.validate(new TimeSeries(SampleList.empty(), "rain"))
        );
        assertTrue(e.getMessage().contains("[rain] is empty"));
    }

    public void testDuplicateTimestamp() {
        TimeSeries series = new TimeSeries(SampleList.of(new long[] { 1L, 2L, 2L }, new double[] { 1.0, 2.0, 3.0 }), "rain");
        InputValidationException e = expectThrows(InputValidationException.class, () -> SeriesValidator.validate(series));
        assertTrue(e.getMessage().contains("duplicate timestamp [2] at index [2]"));
    }

    public void testUnorderedTimestamps() {
        TimeSeries series = new TimeSeries(SampleList.of(new long[] { 1L, 5L, 3L }, new double[] { 1.0, 2.0, 3.0 }), "rain");
        InputValidationException e = expectThrows(InputValidationException.class, () -> SeriesValidator.validate(series));
        assertTrue(e.getMessage().contains("timestamp [3] at index [2] precedes [5] at index [1]"));
    }

    public void testRequireFinite() {
        TimeSeries series = monthlySeries(2000, 1.0, Double.POSITIVE_INFINITY, 3.0);
        SeriesValidator.validate(series, false);
        InputValidationException e = expectThrows(InputValidationException.class, () -> SeriesValidator.validate(series, true));
        assertTrue(e.getMessage().contains("at index [1]"));
    }
}
