/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.distribution;

import org.droughtindex.common.exception.FitConvergenceException;

import java.util.List;

/**
 * Capability of a parametric family that can be fit to a sample and evaluated through its
 * cumulative distribution function.
 *
 * <p>Implementations are stateless: parameters live in the arrays passed around, so one instance
 * can serve any number of concurrent fits. Additional families can be plugged into the pipeline by
 * implementing this interface and, when fitted parameters are persisted, registering the
 * implementation with a {@link DistributionRegistry}.</p>
 *
 * <h2>Usage Examples:</h2>
 * <pre>{@code
 * ContinuousDistribution gamma = DistributionFamily.GAMMA.distribution();
 * double[] params = gamma.fit(sample);
 * double p = gamma.cdf(42.0, params);
 * }</pre>
 */
public interface ContinuousDistribution {

    /**
     * @return unique short name of the family, such as {@code gamma}
     */
    String name();

    /**
     * @return names of the parameters in the order used by {@link #fit(double[])} and {@link #cdf(double, double[])}
     */
    List<String> parameterNames();

    /**
     * Estimate the parameters of the family from a sample of finite values.
     *
     * @param sample the observations, not modified
     * @return estimated parameters, in {@link #parameterNames()} order
     * @throws FitConvergenceException if the sample is degenerate or no valid estimate exists
     */
    double[] fit(double[] sample);

    /**
     * Evaluate the cumulative distribution function.
     *
     * @param x the value
     * @param parameters parameters returned by {@link #fit(double[])}
     * @return {@code P(X <= x)}
     */
    double cdf(double x, double[] parameters);

    /**
     * Check that a parameter vector is usable by {@link #cdf(double, double[])}.
     *
     * @param parameters the parameters
     * @return whether they are valid for this family
     */
    default boolean isValid(double[] parameters) {
        if (parameters == null || parameters.length != parameterNames().size()) {
            return false;
        }
        for (double parameter : parameters) {
            if (Double.isFinite(parameter) == false) {
                return false;
            }
        }
        return true;
    }
}
