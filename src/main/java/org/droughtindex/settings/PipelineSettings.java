/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.settings;

import org.droughtindex.common.exception.ConfigurationException;
import org.droughtindex.standardize.Standardizer;
import org.opensearch.common.settings.Settings;

import java.time.ZoneId;

/**
 * Resolved values of {@link StandardizedIndexSettings}.
 *
 * @param minSampleSize fewest finite observations per season
 * @param probabilityEpsilon probability clipping bound
 * @param timeZone zone for calendar fields
 * @param parallelFitEnabled whether seasons may be fit in parallel
 * @param parallelFitMinGroups fewest seasons for a parallel fit
 * @param parallelFitPoolSize size of the fitting pool
 * @param maxEvaluations likelihood evaluation budget per fit
 */
public record PipelineSettings(
    int minSampleSize,
    double probabilityEpsilon,
    ZoneId timeZone,
    boolean parallelFitEnabled,
    int parallelFitMinGroups,
    int parallelFitPoolSize,
    int maxEvaluations
) {

    public PipelineSettings {
        if ((probabilityEpsilon > 0.0 && probabilityEpsilon < 0.5) == false) {
            throw new ConfigurationException("probability epsilon must be in (0, 0.5), got [{}]", probabilityEpsilon);
        }
        if (minSampleSize < 3) {
            throw new ConfigurationException("minimum sample size must be at least 3, got [{}]", minSampleSize);
        }
    }

    public static PipelineSettings fromSettings(Settings settings) {
        try {
            return new PipelineSettings(
                StandardizedIndexSettings.MIN_SAMPLE_SIZE.get(settings),
                StandardizedIndexSettings.PROBABILITY_EPSILON.get(settings),
                StandardizedIndexSettings.TIME_ZONE.get(settings),
                StandardizedIndexSettings.PARALLEL_FIT_ENABLED.get(settings),
                StandardizedIndexSettings.PARALLEL_FIT_MIN_GROUPS.get(settings),
                StandardizedIndexSettings.PARALLEL_FIT_POOL_SIZE.get(settings),
                StandardizedIndexSettings.MAX_EVALUATIONS.get(settings)
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid settings: {}", e.getMessage());
        }
    }

    public static PipelineSettings defaults() {
        return fromSettings(Settings.EMPTY);
    }

    public Standardizer standardizer() {
        return new Standardizer(probabilityEpsilon);
    }
}
