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
 * Logistic distribution {@code (loc, scale)}, fit by maximum likelihood.
 */
public class LogisticDistributionFamily extends AbstractMaximumLikelihoodDistribution {

    public static final String NAME = "logistic";

    private static final double SQRT3_OVER_PI = Math.sqrt(3.0) / Math.PI;

    public LogisticDistributionFamily() {
        this(DEFAULT_MAX_EVALUATIONS);
    }

    public LogisticDistributionFamily(int maxEvaluations) {
        super(NAME, List.of("loc", "scale"), 0, 1, maxEvaluations);
    }

    @Override
    protected double[] momentEstimate(double[] standardizedSample) {
        // variance of the logistic is (pi * scale)^2 / 3
        return new double[] { 0.0, SQRT3_OVER_PI };
    }

    @Override
    protected double logDensity(double x, double[] parameters) {
        double z = Math.abs((x - parameters[0]) / parameters[1]);
        return -z - 2.0 * Math.log1p(Math.exp(-z)) - Math.log(parameters[1]);
    }

    @Override
    protected double[] toUnconstrained(double[] parameters, double[] standardizedSample) {
        return new double[] { parameters[0], Math.log(parameters[1]) };
    }

    @Override
    protected double[] fromUnconstrained(double[] theta, double[] standardizedSample) {
        return new double[] { theta[0], Math.exp(theta[1]) };
    }

    @Override
    public double cdf(double x, double[] parameters) {
        double z = (x - parameters[0]) / parameters[1];
        return 1.0 / (1.0 + Math.exp(-z));
    }
}
