/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.distribution;

import java.util.List;

/**
 * Normal distribution, parameters {@code (loc, scale)}. Supports values of both signs.
 */
public class NormalDistributionFamily extends AbstractContinuousDistribution {

    public static final String NAME = "normal";

    public NormalDistributionFamily() {
        super(NAME, List.of("loc", "scale"));
    }

    @Override
    protected double[] estimate(double[] sample) {
        return new double[] { mean(sample), populationStandardDeviation(sample) };
    }

    @Override
    public double cdf(double x, double[] parameters) {
        return StandardNormal.cdf((x - parameters[0]) / parameters[1]);
    }

    @Override
    public boolean isValid(double[] parameters) {
        return super.isValid(parameters) && parameters[1] > 0.0;
    }
}
