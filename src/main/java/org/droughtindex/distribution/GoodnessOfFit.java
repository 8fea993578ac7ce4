/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.distribution;

import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.droughtindex.common.exception.StandardizedIndexException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Kolmogorov-Smirnov goodness-of-fit reports for candidate distributions. Reports only; choosing a
 * family is left to the caller.
 */
public final class GoodnessOfFit {

    private static final Logger logger = LogManager.getLogger(GoodnessOfFit.class);

    public static final double DEFAULT_ALPHA = 0.05;

    private GoodnessOfFit() {}

    /**
     * Outcome of one test. {@code rejected} is true when the p-value is below alpha or the fit failed.
     */
    public record Result(String distribution, double statistic, double pValue, boolean rejected, double[] parameters) {

        public Result {
            parameters = parameters == null ? new double[0] : parameters.clone();
        }

        @Override
        public double[] parameters() {
            return parameters.clone();
        }

        @Override
        public String toString() {
            return "Result{distribution="
                + distribution
                + ", statistic="
                + statistic
                + ", pValue="
                + pValue
                + ", rejected="
                + rejected
                + ", parameters="
                + Arrays.toString(parameters)
                + '}';
        }
    }

    /**
     * Fit {@code distribution} to {@code sample} and test the fit with a two-sided one-sample KS test.
     *
     * @throws StandardizedIndexException if the fit fails
     */
    public static Result test(double[] sample, ContinuousDistribution distribution, double alpha) {
        Objects.requireNonNull(sample, "sample must not be null");
        Objects.requireNonNull(distribution, "distribution must not be null");
        if (alpha <= 0.0 || alpha >= 1.0) {
            throw new IllegalArgumentException("alpha must be in (0, 1), got: " + alpha);
        }
        double[] parameters = distribution.fit(sample);
        double statistic = statistic(sample, distribution, parameters);
        double pValue = 1.0 - new KolmogorovSmirnovTest().cdf(statistic, sample.length, false);
        pValue = Math.min(1.0, Math.max(0.0, pValue));
        return new Result(distribution.name(), statistic, pValue, pValue < alpha, parameters);
    }

    /**
     * Test every distribution in turn. A distribution that cannot be fit is reported as rejected with
     * a {@code NaN} statistic and p-value.
     */
    public static List<Result> compare(double[] sample, Collection<? extends ContinuousDistribution> distributions, double alpha) {
        List<Result> results = new ArrayList<>(distributions.size());
        for (ContinuousDistribution distribution : distributions) {
            try {
                results.add(test(sample, distribution, alpha));
            } catch (StandardizedIndexException e) {
                logger.debug("[{}] could not be fit for comparison: {}", distribution.name(), e.getMessage());
                results.add(new Result(distribution.name(), Double.NaN, Double.NaN, true, null));
            }
        }
        return results;
    }

    /**
     * {@link #compare(double[], Collection, double)} over all built-in families at {@link #DEFAULT_ALPHA}.
     */
    public static List<Result> compare(double[] sample) {
        List<ContinuousDistribution> builtIns = new ArrayList<>();
        for (DistributionFamily family : DistributionFamily.values()) {
            builtIns.add(family.distribution());
        }
        return compare(sample, builtIns, DEFAULT_ALPHA);
    }

    /**
     * Supremum distance between the empirical distribution of {@code sample} and the fitted cdf.
     */
    static double statistic(double[] sample, ContinuousDistribution distribution, double[] parameters) {
        double[] sorted = sample.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        double d = 0.0;
        for (int i = 0; i < n; i++) {
            double f = distribution.cdf(sorted[i], parameters);
            d = Math.max(d, Math.max((i + 1.0) / n - f, f - (double) i / n));
        }
        return d;
    }
}
