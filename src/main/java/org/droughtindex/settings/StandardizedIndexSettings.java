/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.settings;

import org.droughtindex.distribution.AbstractMaximumLikelihoodDistribution;
import org.droughtindex.standardize.Standardizer;
import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;

import java.io.IOException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;

/**
 * Settings controlling index computation. They can be read from a YAML or JSON file with
 * {@link #load(Path)} or built with {@link Settings#builder()}.
 */
public final class StandardizedIndexSettings {

    private StandardizedIndexSettings() {}

    /**
     * Smallest number of finite observations a season must hold to be fit.
     */
    public static final Setting<Integer> MIN_SAMPLE_SIZE = Setting.intSetting(
        "sdi.fit.min_sample_size",
        10,
        3,
        Setting.Property.NodeScope
    );

    /**
     * Probabilities are clipped to {@code [epsilon, 1 - epsilon]} before conversion to an index.
     * Must be below 0.5.
     */
    public static final Setting<Double> PROBABILITY_EPSILON = Setting.doubleSetting(
        "sdi.standardize.probability_epsilon",
        Standardizer.DEFAULT_EPSILON,
        Double.MIN_VALUE,
        Setting.Property.NodeScope
    );

    /**
     * Zone in which calendar months and days are determined.
     */
    public static final Setting<ZoneId> TIME_ZONE = new Setting<>("sdi.season.time_zone", "UTC", value -> {
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid time zone [" + value + "] for [sdi.season.time_zone]", e);
        }
    }, Setting.Property.NodeScope);

    public static final Setting<Boolean> PARALLEL_FIT_ENABLED = Setting.boolSetting(
        "sdi.fit.parallel.enabled",
        true,
        Setting.Property.NodeScope
    );

    /**
     * Fewest seasons for which fits run in parallel.
     */
    public static final Setting<Integer> PARALLEL_FIT_MIN_GROUPS = Setting.intSetting(
        "sdi.fit.parallel.min_groups",
        4,
        1,
        Setting.Property.NodeScope
    );

    /**
     * Size of the dedicated fitting pool, half the available processors by default.
     */
    public static final Setting<Integer> PARALLEL_FIT_POOL_SIZE = Setting.intSetting(
        "sdi.fit.parallel.pool_size",
        Math.max(1, Runtime.getRuntime().availableProcessors() / 2),
        1,
        Setting.Property.NodeScope
    );

    /**
     * Likelihood evaluation budget of one iterative fit.
     */
    public static final Setting<Integer> MAX_EVALUATIONS = Setting.intSetting(
        "sdi.fit.max_evaluations",
        AbstractMaximumLikelihoodDistribution.DEFAULT_MAX_EVALUATIONS,
        10,
        Setting.Property.NodeScope
    );

    public static List<Setting<?>> all() {
        return List.of(
            MIN_SAMPLE_SIZE,
            PROBABILITY_EPSILON,
            TIME_ZONE,
            PARALLEL_FIT_ENABLED,
            PARALLEL_FIT_MIN_GROUPS,
            PARALLEL_FIT_POOL_SIZE,
            MAX_EVALUATIONS
        );
    }

    /**
     * Load settings from a YAML or JSON file.
     */
    public static Settings load(Path path) throws IOException {
        return Settings.builder().loadFromPath(path).build();
    }
}
