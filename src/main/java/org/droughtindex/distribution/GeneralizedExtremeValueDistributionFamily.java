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
 * Generalized extreme value distribution {@code (c, loc, scale)} with
 * {@code F(x) = exp(-(1 - c y)^(1/c))}, {@code y = (x - loc) / scale}. Positive {@code c} bounds the
 * support above at {@code loc + scale / c}, negative {@code c} bounds it below; {@code c = 0} is the
 * Gumbel distribution {@code exp(-exp(-y))}.
 *
 * <p>The fit starts from the Gumbel moments estimate, which covers any sample.</p>
 */
public class GeneralizedExtremeValueDistributionFamily extends AbstractMaximumLikelihoodDistribution {

    public static final String NAME = "genextreme";

    private static final double GUMBEL_SHAPE_THRESHOLD = 1e-8;
    private static final double EULER_MASCHERONI = 0.5772156649015329;
    private static final double GUMBEL_SCALE_PER_SD = Math.sqrt(6.0) / Math.PI;

    public GeneralizedExtremeValueDistributionFamily() {
        this(DEFAULT_MAX_EVALUATIONS);
    }

    public GeneralizedExtremeValueDistributionFamily(int maxEvaluations) {
        super(NAME, List.of("c", "loc", "scale"), 1, 2, maxEvaluations);
    }

    @Override
    protected double[] momentEstimate(double[] standardizedSample) {
        // Gumbel: sd = pi * scale / sqrt(6), mean = loc + euler * scale
        double scale = GUMBEL_SCALE_PER_SD;
        return new double[] { 0.0, -EULER_MASCHERONI * scale, scale };
    }

    @Override
    protected double logDensity(double x, double[] parameters) {
        double c = parameters[0];
        double scale = parameters[2];
        double y = (x - parameters[1]) / scale;
        if (Math.abs(c) < GUMBEL_SHAPE_THRESHOLD) {
            return -y - Math.exp(-y) - Math.log(scale);
        }
        double t = 1.0 - c * y;
        if (t <= 0.0) {
            return Double.NEGATIVE_INFINITY;
        }
        double logT = Math.log(t);
        return -Math.exp(logT / c) + (1.0 / c - 1.0) * logT - Math.log(scale);
    }

    @Override
    public double cdf(double x, double[] parameters) {
        double c = parameters[0];
        double y = (x - parameters[1]) / parameters[2];
        if (Math.abs(c) < GUMBEL_SHAPE_THRESHOLD) {
            return Math.exp(-Math.exp(-y));
        }
        double t = 1.0 - c * y;
        if (t <= 0.0) {
            return c > 0 ? 1.0 : 0.0;
        }
        return Math.exp(-Math.exp(Math.log(t) / c));
    }

    @Override
    protected double[] toUnconstrained(double[] parameters, double[] standardizedSample) {
        return new double[] { parameters[0], parameters[1], Math.log(parameters[2]) };
    }

    @Override
    protected double[] fromUnconstrained(double[] theta, double[] standardizedSample) {
        return new double[] { theta[0], theta[1], Math.exp(theta[2]) };
    }
}
