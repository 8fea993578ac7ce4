/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.core.validation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.droughtindex.core.model.SampleList;
import org.droughtindex.core.model.TimeSeries;
import org.droughtindex.season.SeasonalGranularity;

import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * Native time step of a series, inferred from the spacing of its timestamps.
 */
public enum TimeStep {
    DAILY,
    WEEKLY,
    MONTHLY,
    IRREGULAR;

    private static final Logger logger = LogManager.getLogger(TimeStep.class);

    private static final long DAY_MILLIS = TimeUnit.DAYS.toMillis(1);

    /**
     * Classify the median spacing between consecutive timestamps. Months are 28 to 31 days long, so
     * any median spacing in that range is monthly.
     *
     * @param series a validated series
     * @return the step, never {@link #IRREGULAR} for fewer than two observations (falls back to monthly)
     */
    public static TimeStep infer(TimeSeries series) {
        SampleList samples = series.getSamples();
        if (samples.size() < 2) {
            logger.info("Could not infer time step of series [{}] from {} observation(s), using monthly", series.displayName(), samples.size());
            return MONTHLY;
        }
        long[] spacing = new long[samples.size() - 1];
        for (int i = 1; i < samples.size(); i++) {
            spacing[i - 1] = samples.getTimestamp(i) - samples.getTimestamp(i - 1);
        }
        Arrays.sort(spacing);
        long median = spacing[spacing.length / 2];

        if (median == DAY_MILLIS) {
            return DAILY;
        } else if (median == 7 * DAY_MILLIS) {
            return WEEKLY;
        } else if (median >= 28 * DAY_MILLIS && median <= 31 * DAY_MILLIS) {
            return MONTHLY;
        }
        logger.info("Could not infer a regular time step of series [{}], median spacing is {} ms", series.displayName(), median);
        return IRREGULAR;
    }

    /**
     * @return the seasonal granularity used when the caller does not choose one
     */
    public SeasonalGranularity defaultGranularity() {
        return switch (this) {
            // a weekly step drifts through the calendar, so no day of year recurs every year
            case MONTHLY, WEEKLY -> SeasonalGranularity.MONTH;
            case DAILY -> SeasonalGranularity.DAY_OF_YEAR;
            case IRREGULAR -> SeasonalGranularity.NONE;
        };
    }
}
