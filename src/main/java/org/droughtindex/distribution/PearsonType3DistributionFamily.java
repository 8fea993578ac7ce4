/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.distribution;

import org.apache.commons.math3.special.Gamma;

import java.util.Arrays;
import java.util.List;

/**
 * Pearson type III distribution {@code (skew, loc, scale)}, a gamma distribution shifted and scaled
 * to the given mean ({@code loc}), standard deviation ({@code scale}) and skewness. Negative skew
 * mirrors the gamma; near-zero skew reduces to the normal distribution.
 */
public class PearsonType3DistributionFamily extends AbstractMaximumLikelihoodDistribution {

    public static final String NAME = "pearson3";

    private static final double NORMAL_SKEW_THRESHOLD = 1e-6;
    /** Distance, in scale units, kept between the bound of a moved start and the sample extreme. */
    private static final double SUPPORT_GAP = 0.1;

    public PearsonType3DistributionFamily() {
        this(DEFAULT_MAX_EVALUATIONS);
    }

    public PearsonType3DistributionFamily(int maxEvaluations) {
        super(NAME, List.of("skew", "loc", "scale"), 1, 2, maxEvaluations);
    }

    @Override
    protected double[] momentEstimate(double[] standardizedSample) {
        return new double[] { skewness(standardizedSample), 0.0, 1.0 };
    }

    /**
     * The bound {@code loc - 2 scale / skew} lies beyond the sample extreme on the bounded side only
     * when {@code |skew| < 2 scale / reach}; a start that is too skewed is flattened to just inside
     * that limit.
     */
    @Override
    protected double[] coverSample(double[] start, double[] standardizedSample) {
        double skew = start[0];
        double loc = start[1];
        double scale = start[2];
        if (Math.abs(skew) < NORMAL_SKEW_THRESHOLD) {
            return start;
        }
        double reach = skew > 0
            ? loc - Arrays.stream(standardizedSample).min().getAsDouble()
            : Arrays.stream(standardizedSample).max().getAsDouble() - loc;
        double limit = 2.0 * scale / (Math.max(reach, 0.0) + SUPPORT_GAP * scale);
        if (Math.abs(skew) < limit) {
            return start;
        }
        return new double[] { Math.copySign(limit, skew), loc, scale };
    }

    @Override
    protected double logDensity(double x, double[] parameters) {
        double skew = parameters[0];
        double loc = parameters[1];
        double scale = parameters[2];
        if (Math.abs(skew) < NORMAL_SKEW_THRESHOLD) {
            return StandardNormal.logDensity((x - loc) / scale) - Math.log(scale);
        }
        double shape = 4.0 / (skew * skew);
        double gammaScale = scale * Math.abs(skew) / 2.0;
        double t = reducedVariate(x, skew, loc, scale);
        if (t <= 0.0) {
            return Double.NEGATIVE_INFINITY;
        }
        return (shape - 1.0) * Math.log(t) - t - Gamma.logGamma(shape) - Math.log(gammaScale);
    }

    @Override
    public double cdf(double x, double[] parameters) {
        double skew = parameters[0];
        double loc = parameters[1];
        double scale = parameters[2];
        if (Math.abs(skew) < NORMAL_SKEW_THRESHOLD) {
            return StandardNormal.cdf((x - loc) / scale);
        }
        double t = reducedVariate(x, skew, loc, scale);
        if (t <= 0.0) {
            return skew > 0 ? 0.0 : 1.0;
        }
        double p = Gamma.regularizedGammaP(4.0 / (skew * skew), t);
        return skew > 0 ? p : 1.0 - p;
    }

    /**
     * Distance from the distribution's bound in gamma scale units; positive inside the support.
     */
    private static double reducedVariate(double x, double skew, double loc, double scale) {
        double gammaScale = scale * Math.abs(skew) / 2.0;
        double bound = loc - 2.0 * scale / skew;
        return skew > 0 ? (x - bound) / gammaScale : (bound - x) / gammaScale;
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
