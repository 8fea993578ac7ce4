/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.droughtindex.accumulate.AccumulationUnit;
import org.droughtindex.common.exception.ConfigurationException;
import org.droughtindex.core.validation.TimeStep;
import org.droughtindex.distribution.ContinuousDistribution;
import org.droughtindex.distribution.DistributionRegistry;
import org.droughtindex.season.SeasonalGranularity;

import java.util.Objects;

/**
 * Configuration of one index computation. Only the index family is required; every other field may
 * be left unset and is filled in by {@link #resolve(TimeStep, DistributionRegistry)}:
 * <ul>
 *   <li>window: 1 (no accumulation)</li>
 *   <li>accumulation unit: {@link AccumulationUnit#STEPS}</li>
 *   <li>granularity: from the series time step, see {@link TimeStep#defaultGranularity()}</li>
 *   <li>distribution and zero-mass correction: the index family's recommendation</li>
 * </ul>
 */
public final class IndexConfig {

    private static final Logger logger = LogManager.getLogger(IndexConfig.class);

    private final IndexFamily family;
    private final Integer window;
    private final AccumulationUnit unit;
    private final SeasonalGranularity granularity;
    private final ContinuousDistribution distribution;
    private final String distributionName;
    private final Boolean zeroCorrection;
    private final boolean requireFinite;

    private IndexConfig(Builder builder) {
        this.family = builder.family;
        this.window = builder.window;
        this.unit = builder.unit;
        this.granularity = builder.granularity;
        this.distribution = builder.distribution;
        this.distributionName = builder.distributionName;
        this.zeroCorrection = builder.zeroCorrection;
        this.requireFinite = builder.requireFinite;
    }

    public static Builder builder(IndexFamily family) {
        return new Builder(family);
    }

    /**
     * Fill every unset field.
     *
     * @param step time step of the input series, used to choose the granularity
     * @param registry resolves a distribution given by name
     * @return a configuration with every field set
     * @throws ConfigurationException if the distribution name is unknown
     */
    public IndexConfig resolve(TimeStep step, DistributionRegistry registry) {
        Objects.requireNonNull(step, "step must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        Builder resolved = new Builder(family).requireFinite(requireFinite);
        resolved.window(window != null ? window : 1);
        resolved.unit(unit != null ? unit : AccumulationUnit.STEPS);
        if (granularity != null) {
            resolved.granularity(granularity);
        } else {
            resolved.granularity(step.defaultGranularity());
            logger.info("No seasonal granularity given, using [{}] for a [{}] series", resolved.granularity, step);
        }
        if (distribution != null) {
            resolved.distribution(distribution);
        } else if (distributionName != null) {
            resolved.distribution(registry.get(distributionName));
        } else {
            resolved.distribution(registry.get(family.defaultDistribution().familyName()));
            logger.info("No distribution given, using the [{}] default [{}]", family, resolved.distribution.name());
        }
        if (zeroCorrection != null) {
            resolved.zeroCorrection(zeroCorrection);
        } else {
            resolved.zeroCorrection(family.defaultZeroCorrection());
            logger.info("No zero-mass correction flag given, using the [{}] default [{}]", family, resolved.zeroCorrection);
        }
        return resolved.build();
    }

    /**
     * @return whether every field is set
     */
    public boolean isResolved() {
        return window != null && unit != null && granularity != null && distribution != null && zeroCorrection != null;
    }

    public IndexFamily getFamily() {
        return family;
    }

    public Integer getWindow() {
        return window;
    }

    public AccumulationUnit getUnit() {
        return unit;
    }

    public SeasonalGranularity getGranularity() {
        return granularity;
    }

    /**
     * @return the distribution, null if it is given by name or not at all and the configuration is not resolved
     */
    public ContinuousDistribution getDistribution() {
        return distribution;
    }

    public String getDistributionName() {
        return distribution != null ? distribution.name() : distributionName;
    }

    public Boolean getZeroCorrection() {
        return zeroCorrection;
    }

    public boolean isRequireFinite() {
        return requireFinite;
    }

    @Override
    public String toString() {
        return "IndexConfig{family="
            + family
            + ", window="
            + window
            + ", unit="
            + unit
            + ", granularity="
            + granularity
            + ", distribution="
            + getDistributionName()
            + ", zeroCorrection="
            + zeroCorrection
            + ", requireFinite="
            + requireFinite
            + '}';
    }

    public static final class Builder {
        private final IndexFamily family;
        private Integer window;
        private AccumulationUnit unit;
        private SeasonalGranularity granularity;
        private ContinuousDistribution distribution;
        private String distributionName;
        private Boolean zeroCorrection;
        private boolean requireFinite;

        private Builder(IndexFamily family) {
            this.family = Objects.requireNonNull(family, "family must not be null");
        }

        public Builder window(int window) {
            if (window <= 0) {
                throw new ConfigurationException("accumulation window must be positive, got [{}]", window);
            }
            this.window = window;
            return this;
        }

        public Builder unit(AccumulationUnit unit) {
            this.unit = Objects.requireNonNull(unit, "unit must not be null");
            return this;
        }

        public Builder granularity(SeasonalGranularity granularity) {
            this.granularity = Objects.requireNonNull(granularity, "granularity must not be null");
            return this;
        }

        /**
         * Use a distribution instance, replacing any name given before.
         */
        public Builder distribution(ContinuousDistribution distribution) {
            this.distribution = Objects.requireNonNull(distribution, "distribution must not be null");
            this.distributionName = null;
            return this;
        }

        /**
         * Use the registered distribution with this name, replacing any instance given before.
         */
        public Builder distribution(String name) {
            if (name == null || name.isEmpty()) {
                throw new ConfigurationException("distribution name must not be empty");
            }
            this.distributionName = name;
            this.distribution = null;
            return this;
        }

        public Builder zeroCorrection(boolean zeroCorrection) {
            this.zeroCorrection = zeroCorrection;
            return this;
        }

        /**
         * Reject input holding non-finite values instead of propagating them as missing.
         */
        public Builder requireFinite(boolean requireFinite) {
            this.requireFinite = requireFinite;
            return this;
        }

        public IndexConfig build() {
            return new IndexConfig(this);
        }
    }
}
