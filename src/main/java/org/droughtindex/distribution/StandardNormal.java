/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.distribution;

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Standard normal distribution functions shared by the families and the standardizer.
 */
public final class StandardNormal {

    // no random generator: the instance is only used for cdf and quantile evaluation
    private static final NormalDistribution STANDARD = new NormalDistribution(null, 0.0, 1.0);

    private StandardNormal() {}

    public static double cdf(double z) {
        return STANDARD.cumulativeProbability(z);
    }

    /**
     * @param p probability strictly inside (0, 1)
     * @return the standard normal quantile of p
     */
    public static double inverseCdf(double p) {
        return STANDARD.inverseCumulativeProbability(p);
    }

    public static double logDensity(double z) {
        return STANDARD.logDensity(z);
    }
}
