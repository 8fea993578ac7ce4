/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.distribution;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.droughtindex.common.exception.FitConvergenceException;

import java.util.Arrays;
import java.util.List;

/**
 * Base class for the built-in families. {@link #fit(double[])} rejects samples no family can be
 * estimated from before delegating to {@link #estimate(double[])}, and validates what comes back.
 */
public abstract class AbstractContinuousDistribution implements ContinuousDistribution {

    /** Smallest sample any family is fit to. */
    public static final int MIN_FIT_SAMPLE_SIZE = 3;

    private final String name;
    private final List<String> parameterNames;

    protected AbstractContinuousDistribution(String name, List<String> parameterNames) {
        this.name = name;
        this.parameterNames = List.copyOf(parameterNames);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> parameterNames() {
        return parameterNames;
    }

    @Override
    public final double[] fit(double[] sample) {
        if (sample == null) {
            throw new NullPointerException("sample must not be null");
        }
        if (sample.length < MIN_FIT_SAMPLE_SIZE) {
            throw new FitConvergenceException(
                "cannot fit [{}] to [{}] values, at least [{}] are required",
                name,
                sample.length,
                MIN_FIT_SAMPLE_SIZE
            );
        }
        for (double value : sample) {
            if (Double.isFinite(value) == false) {
                throw new FitConvergenceException("cannot fit [{}] to a sample holding non-finite value [{}]", name, value);
            }
        }
        if (populationStandardDeviation(sample) == 0.0) {
            throw new FitConvergenceException("cannot fit [{}]: all [{}] values are identical ([{}])", name, sample.length, sample[0]);
        }
        double[] parameters = estimate(sample);
        if (isValid(parameters) == false) {
            throw new FitConvergenceException("fitting [{}] produced invalid parameters {}", name, Arrays.toString(parameters));
        }
        return parameters;
    }

    /**
     * Estimate parameters from a sample of at least {@link #MIN_FIT_SAMPLE_SIZE} finite, non-constant values.
     */
    protected abstract double[] estimate(double[] sample);

    @Override
    public String toString() {
        return name;
    }

    static double mean(double[] sample) {
        return new Mean().evaluate(sample);
    }

    /**
     * Maximum likelihood (divide by n) standard deviation.
     */
    static double populationStandardDeviation(double[] sample) {
        return new StandardDeviation(false).evaluate(sample);
    }

    /**
     * Population skewness, the third standardized moment.
     */
    static double skewness(double[] sample) {
        double mean = mean(sample);
        double m2 = 0.0;
        double m3 = 0.0;
        for (double value : sample) {
            double d = value - mean;
            m2 += d * d;
            m3 += d * d * d;
        }
        m2 /= sample.length;
        m3 /= sample.length;
        return m3 / Math.pow(m2, 1.5);
    }

    static void requirePositive(String family, double[] sample) {
        for (double value : sample) {
            if (value <= 0.0) {
                throw new FitConvergenceException(
                    "[{}] requires strictly positive values but got [{}]; enable zero-mass correction for samples with zeros",
                    family,
                    value
                );
            }
        }
    }
}
