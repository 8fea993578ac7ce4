/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.standardize;

import org.droughtindex.common.exception.ConfigurationException;
import org.droughtindex.distribution.FittedDistribution;
import org.droughtindex.distribution.StandardNormal;

/**
 * Maps cumulative probabilities to standard normal quantiles. Probabilities are clipped to
 * {@code [epsilon, 1 - epsilon]} first, so the index stays finite and bounded by
 * {@link #maxAbsoluteIndex()}.
 */
public class Standardizer {

    /** Default clipping bound, giving an index within about +/-6.36. */
    public static final double DEFAULT_EPSILON = 1e-10;

    private final double epsilon;

    public Standardizer() {
        this(DEFAULT_EPSILON);
    }

    /**
     * @param epsilon clipping bound in (0, 0.5)
     */
    public Standardizer(double epsilon) {
        if ((epsilon > 0.0 && epsilon < 0.5) == false) {
            throw new ConfigurationException("probability epsilon must be in (0, 0.5), got [{}]", epsilon);
        }
        this.epsilon = epsilon;
    }

    /**
     * @param probability a cumulative probability, or {@code NaN} for a missing value
     * @return the standard normal quantile of the clipped probability, {@code NaN} for {@code NaN}
     */
    public double toIndex(double probability) {
        if (Double.isNaN(probability)) {
            return Double.NaN;
        }
        double clipped = Math.min(1.0 - epsilon, Math.max(epsilon, probability));
        return StandardNormal.inverseCdf(clipped);
    }

    /**
     * Index of {@code value} under {@code fitted}; non-finite values give {@code NaN}.
     */
    public double standardize(FittedDistribution fitted, double value) {
        if (Double.isFinite(value) == false) {
            return Double.NaN;
        }
        return toIndex(fitted.cdf(value));
    }

    public double getEpsilon() {
        return epsilon;
    }

    /**
     * @return the largest index magnitude this standardizer can produce
     */
    public double maxAbsoluteIndex() {
        return -StandardNormal.inverseCdf(epsilon);
    }
}
