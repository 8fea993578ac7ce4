/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.pipeline;

import org.droughtindex.distribution.DistributionFamily;

import java.util.Locale;

/**
 * Standardized index families and their recommended distribution and zero-mass correction.
 */
public enum IndexFamily {
    /** Standardized Precipitation Index. */
    SPI(DistributionFamily.GAMMA, true),
    /** Standardized Precipitation Evapotranspiration Index; the water balance can be negative. */
    SPEI(DistributionFamily.LOG_LOGISTIC, false),
    /** Standardized Groundwater Index. */
    SGI(DistributionFamily.NORMAL, true);

    private final DistributionFamily defaultDistribution;
    private final boolean defaultZeroCorrection;

    IndexFamily(DistributionFamily defaultDistribution, boolean defaultZeroCorrection) {
        this.defaultDistribution = defaultDistribution;
        this.defaultZeroCorrection = defaultZeroCorrection;
    }

    public DistributionFamily defaultDistribution() {
        return defaultDistribution;
    }

    public boolean defaultZeroCorrection() {
        return defaultZeroCorrection;
    }

    public static IndexFamily fromString(String value) {
        try {
            return valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid index family: " + value, e);
        }
    }
}
