/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.distribution;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.droughtindex.common.exception.FitConvergenceException;

import java.util.Arrays;
import java.util.List;

/**
 * Base class for location-scale families estimated by numerical maximum likelihood.
 *
 * <p>The sample is standardized to zero mean and unit standard deviation, a moments-type estimate
 * seeds a Nelder-Mead search over an unconstrained reparameterization of the parameters, and the
 * optimum is mapped back to the original units. Maximum likelihood estimates are equivariant under
 * this affine change, so only the location and scale parameters need mapping back.</p>
 *
 * <p>The starting point must give every observation a positive density; a family whose moments
 * estimate can miss part of the sample moves it through {@link #coverSample(double[], double[])},
 * and the fit fails if the sample is still not covered. When the optimizer runs out of
 * evaluations, fails, or ends on a worse likelihood than its starting point, the starting estimate
 * is returned instead and a warning is logged.</p>
 */
public abstract class AbstractMaximumLikelihoodDistribution extends AbstractContinuousDistribution {

    private static final Logger logger = LogManager.getLogger(AbstractMaximumLikelihoodDistribution.class);

    /** Default budget of likelihood evaluations for one fit. */
    public static final int DEFAULT_MAX_EVALUATIONS = 2000;

    private static final double SIMPLEX_STEP = 0.1;
    private static final double RELATIVE_TOLERANCE = 1e-10;
    private static final double ABSOLUTE_TOLERANCE = 1e-12;

    private final int locationIndex;
    private final int scaleIndex;
    private final int maxEvaluations;

    /**
     * @param name family name
     * @param parameterNames parameter names
     * @param locationIndex position of the location parameter
     * @param scaleIndex position of the scale parameter
     * @param maxEvaluations likelihood evaluation budget per fit
     */
    protected AbstractMaximumLikelihoodDistribution(
        String name,
        List<String> parameterNames,
        int locationIndex,
        int scaleIndex,
        int maxEvaluations
    ) {
        super(name, parameterNames);
        if (maxEvaluations <= 0) {
            throw new IllegalArgumentException("maxEvaluations must be positive, got: " + maxEvaluations);
        }
        this.locationIndex = locationIndex;
        this.scaleIndex = scaleIndex;
        this.maxEvaluations = maxEvaluations;
    }

    public int getMaxEvaluations() {
        return maxEvaluations;
    }

    @Override
    protected double[] estimate(double[] sample) {
        double mean = mean(sample);
        double sd = populationStandardDeviation(sample);
        double[] z = new double[sample.length];
        for (int i = 0; i < sample.length; i++) {
            z[i] = (sample[i] - mean) / sd;
        }

        double[] start = momentEstimate(z);
        if (isValid(start) == false) {
            throw new FitConvergenceException("no valid starting estimate for [{}]: {}", name(), Arrays.toString(start));
        }
        double startValue = negativeLogLikelihood(start, z);
        if (Double.isFinite(startValue) == false) {
            start = coverSample(start, z);
            startValue = negativeLogLikelihood(start, z);
            if (Double.isFinite(startValue) == false) {
                throw new FitConvergenceException(
                    "starting estimate {} of [{}] gives zero density to part of the sample",
                    Arrays.toString(start),
                    name()
                );
            }
            logger.debug("Moved the starting estimate of [{}] to cover the sample: {}", name(), Arrays.toString(start));
        }

        double[] best = start;
        try {
            SimplexOptimizer optimizer = new SimplexOptimizer(new SimpleValueChecker(RELATIVE_TOLERANCE, ABSOLUTE_TOLERANCE));
            double[] theta0 = toUnconstrained(start, z);
            double[] steps = new double[theta0.length];
            Arrays.fill(steps, SIMPLEX_STEP);
            PointValuePair optimum = optimizer.optimize(
                new MaxEval(maxEvaluations),
                new ObjectiveFunction(theta -> negativeLogLikelihood(fromUnconstrained(theta, z), z)),
                GoalType.MINIMIZE,
                new InitialGuess(theta0),
                new NelderMeadSimplex(steps)
            );
            double[] candidate = fromUnconstrained(optimum.getPoint(), z);
            if (isValid(candidate) && Double.isFinite(optimum.getValue()) && optimum.getValue() <= startValue) {
                best = candidate;
            } else {
                logger.warn("Maximum likelihood for [{}] ended on invalid parameters {}, using the moments estimate", name(), Arrays.toString(candidate));
            }
        } catch (MathIllegalStateException e) {
            logger.warn("Maximum likelihood for [{}] did not converge ({}), using the moments estimate", name(), e.getMessage());
        }
        return toOriginalUnits(best, mean, sd);
    }

    private double negativeLogLikelihood(double[] parameters, double[] sample) {
        if (isValid(parameters) == false) {
            return Double.POSITIVE_INFINITY;
        }
        double sum = 0.0;
        for (double x : sample) {
            double logDensity = logDensity(x, parameters);
            if (Double.isFinite(logDensity) == false) {
                return Double.POSITIVE_INFINITY;
            }
            sum -= logDensity;
        }
        return sum;
    }

    private double[] toOriginalUnits(double[] standardized, double mean, double sd) {
        double[] parameters = standardized.clone();
        parameters[locationIndex] = mean + sd * standardized[locationIndex];
        parameters[scaleIndex] = sd * standardized[scaleIndex];
        return parameters;
    }

    /**
     * Closed-form estimate from a standardized sample, used as the optimizer's starting point and as
     * the fallback result.
     */
    protected abstract double[] momentEstimate(double[] standardizedSample);

    /**
     * Move a starting estimate whose support excludes part of the standardized sample so that it
     * covers the sample. Families with unbounded support keep the default, which returns the
     * estimate unchanged.
     */
    protected double[] coverSample(double[] start, double[] standardizedSample) {
        return start;
    }

    /**
     * Log of the probability density, {@link Double#NEGATIVE_INFINITY} outside the support.
     */
    protected abstract double logDensity(double x, double[] parameters);

    /**
     * Map parameters to an unconstrained vector. The sample is passed for families whose support
     * constraint depends on it.
     */
    protected abstract double[] toUnconstrained(double[] parameters, double[] standardizedSample);

    /**
     * Inverse of {@link #toUnconstrained(double[], double[])}.
     */
    protected abstract double[] fromUnconstrained(double[] theta, double[] standardizedSample);

    @Override
    public boolean isValid(double[] parameters) {
        return super.isValid(parameters) && parameters[scaleIndex] > 0.0;
    }

    /**
     * Numerically stable {@code log(1 + exp(t))}.
     */
    static double softplus(double t) {
        return t > 0 ? t + Math.log1p(Math.exp(-t)) : Math.log1p(Math.exp(t));
    }
}
