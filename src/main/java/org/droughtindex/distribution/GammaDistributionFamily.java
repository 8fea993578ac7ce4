/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.distribution;

import org.apache.commons.math3.special.Gamma;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.droughtindex.common.exception.FitConvergenceException;

import java.util.List;

/**
 * Two-parameter gamma distribution {@code (shape, scale)} on positive values.
 *
 * <p>The shape is the root of {@code ln(a) - digamma(a) = ln(mean) - mean(ln x)}, found by
 * Newton-Raphson from Thom's approximation; the scale follows as {@code mean / shape}. If the
 * iteration does not converge the moments estimate {@code (mean^2 / var, var / mean)} is used.</p>
 */
public class GammaDistributionFamily extends AbstractContinuousDistribution {

    private static final Logger logger = LogManager.getLogger(GammaDistributionFamily.class);

    public static final String NAME = "gamma";

    private static final int MAX_ITERATIONS = 100;
    private static final double TOLERANCE = 1e-10;

    public GammaDistributionFamily() {
        super(NAME, List.of("shape", "scale"));
    }

    @Override
    protected double[] estimate(double[] sample) {
        requirePositive(NAME, sample);
        double mean = mean(sample);
        double meanLog = 0.0;
        for (double value : sample) {
            meanLog += Math.log(value);
        }
        meanLog /= sample.length;
        double a = Math.log(mean) - meanLog;
        if (a <= 0.0 || Double.isFinite(a) == false) {
            throw new FitConvergenceException("cannot fit [gamma]: degenerate log-moment statistic [{}]", a);
        }

        // Thom (1958)
        double shape = (1.0 + Math.sqrt(1.0 + 4.0 * a / 3.0)) / (4.0 * a);
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double f = Math.log(shape) - Gamma.digamma(shape) - a;
            double derivative = 1.0 / shape - Gamma.trigamma(shape);
            double next = shape - f / derivative;
            if (next <= 0.0) {
                next = shape / 2.0;
            }
            if (Math.abs(next - shape) <= TOLERANCE * shape) {
                return new double[] { next, mean / next };
            }
            shape = next;
        }

        double variance = Math.pow(populationStandardDeviation(sample), 2);
        logger.warn("Gamma shape iteration did not converge after {} steps, using the moments estimate", MAX_ITERATIONS);
        return new double[] { mean * mean / variance, variance / mean };
    }

    @Override
    public double cdf(double x, double[] parameters) {
        if (x <= 0.0) {
            return 0.0;
        }
        return Gamma.regularizedGammaP(parameters[0], x / parameters[1]);
    }

    @Override
    public boolean isValid(double[] parameters) {
        return super.isValid(parameters) && parameters[0] > 0.0 && parameters[1] > 0.0;
    }
}
