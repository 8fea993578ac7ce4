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
 * Two-parameter log-normal distribution {@code (s, scale)} on positive values: {@code ln X} is normal
 * with mean {@code ln(scale)} and standard deviation {@code s}. Estimated in closed form from the
 * log values.
 */
public class LogNormalDistributionFamily extends AbstractContinuousDistribution {

    public static final String NAME = "lognorm";

    public LogNormalDistributionFamily() {
        super(NAME, List.of("s", "scale"));
    }

    @Override
    protected double[] estimate(double[] sample) {
        requirePositive(NAME, sample);
        double[] logs = new double[sample.length];
        for (int i = 0; i < sample.length; i++) {
            logs[i] = Math.log(sample[i]);
        }
        return new double[] { populationStandardDeviation(logs), Math.exp(mean(logs)) };
    }

    @Override
    public double cdf(double x, double[] parameters) {
        if (x <= 0.0) {
            return 0.0;
        }
        return StandardNormal.cdf((Math.log(x) - Math.log(parameters[1])) / parameters[0]);
    }

    @Override
    public boolean isValid(double[] parameters) {
        return super.isValid(parameters) && parameters[0] > 0.0 && parameters[1] > 0.0;
    }
}
