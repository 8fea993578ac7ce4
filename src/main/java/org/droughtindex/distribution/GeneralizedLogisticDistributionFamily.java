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
 * Generalized (type I) logistic distribution {@code (c, loc, scale)} with
 * {@code F(x) = (1 + exp(-y))^(-c)}, {@code y = (x - loc) / scale} and {@code c > 0}. It is the
 * logistic distribution for {@code c = 1}, skewed right for larger {@code c} and left for smaller.
 */
public class GeneralizedLogisticDistributionFamily extends AbstractMaximumLikelihoodDistribution {

    public static final String NAME = "genlogistic";

    private static final double SQRT3_OVER_PI = Math.sqrt(3.0) / Math.PI;

    public GeneralizedLogisticDistributionFamily() {
        this(DEFAULT_MAX_EVALUATIONS);
    }

    public GeneralizedLogisticDistributionFamily(int maxEvaluations) {
        super(NAME, List.of("c", "loc", "scale"), 1, 2, maxEvaluations);
    }

    @Override
    protected double[] momentEstimate(double[] standardizedSample) {
        return new double[] { 1.0, 0.0, SQRT3_OVER_PI };
    }

    @Override
    protected double logDensity(double x, double[] parameters) {
        double c = parameters[0];
        double y = (x - parameters[1]) / parameters[2];
        // log(1 + exp(-y)) = softplus(-y)
        return Math.log(c) - y - (c + 1.0) * softplus(-y) - Math.log(parameters[2]);
    }

    @Override
    public double cdf(double x, double[] parameters) {
        double y = (x - parameters[1]) / parameters[2];
        return Math.exp(-parameters[0] * softplus(-y));
    }

    @Override
    protected double[] toUnconstrained(double[] parameters, double[] standardizedSample) {
        return new double[] { Math.log(parameters[0]), parameters[1], Math.log(parameters[2]) };
    }

    @Override
    protected double[] fromUnconstrained(double[] theta, double[] standardizedSample) {
        return new double[] { Math.exp(theta[0]), theta[1], Math.exp(theta[2]) };
    }

    @Override
    public boolean isValid(double[] parameters) {
        return super.isValid(parameters) && parameters[0] > 0.0;
    }
}
