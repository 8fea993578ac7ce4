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
 * Three-parameter log-logistic (Fisk) distribution {@code (c, loc, scale)}:
 * {@code F(x) = 1 / (1 + ((x - loc) / scale)^-c)} for {@code x > loc}.
 *
 * <p>The starting estimate uses unbiased probability-weighted moments {@code w0, w1, w2} with
 * plotting positions {@code (i - 0.35) / n} (Vicente-Serrano et al., 2010):</p>
 * <pre>
 * c     = (2 w1 - w0) / (6 w1 - w0 - 6 w2)
 * scale = (w0 - 2 w1) c / (G(1 + 1/c) G(1 - 1/c))
 * loc   = w0 - scale G(1 + 1/c) G(1 - 1/c)
 * </pre>
 * <p>When that estimate is unusable ({@code c <= 1}, or a location above the sample minimum), the
 * location is placed a tenth of a standard deviation below the minimum and the other parameters
 * come from the logistic moments of {@code ln(x - loc)}.</p>
 */
public class LogLogisticDistributionFamily extends AbstractMaximumLikelihoodDistribution {

    public static final String NAME = "fisk";

    private static final double PLOTTING_POSITION_OFFSET = 0.35;
    private static final double FALLBACK_LOCATION_GAP = 0.1;

    public LogLogisticDistributionFamily() {
        this(DEFAULT_MAX_EVALUATIONS);
    }

    public LogLogisticDistributionFamily(int maxEvaluations) {
        super(NAME, List.of("c", "loc", "scale"), 1, 2, maxEvaluations);
    }

    @Override
    protected double[] momentEstimate(double[] standardizedSample) {
        double[] sorted = standardizedSample.clone();
        Arrays.sort(sorted);
        double[] pwm = probabilityWeightedMoments(sorted);
        double c = (2.0 * pwm[1] - pwm[0]) / (6.0 * pwm[1] - pwm[0] - 6.0 * pwm[2]);
        if (Double.isFinite(c) && c > 1.0) {
            double gammaProduct = Math.exp(Gamma.logGamma(1.0 + 1.0 / c) + Gamma.logGamma(1.0 - 1.0 / c));
            double scale = (pwm[0] - 2.0 * pwm[1]) * c / gammaProduct;
            double loc = pwm[0] - scale * gammaProduct;
            if (scale > 0.0 && loc < sorted[0]) {
                return new double[] { c, loc, scale };
            }
        }
        return logMomentEstimate(sorted);
    }

    /**
     * PWMs {@code w_s = 1/n sum (1 - F_i)^s x_(i)} for s = 0, 1, 2 over an ascending sample.
     */
    static double[] probabilityWeightedMoments(double[] sorted) {
        int n = sorted.length;
        double[] pwm = new double[3];
        for (int i = 0; i < n; i++) {
            double survival = 1.0 - (i + 1 - PLOTTING_POSITION_OFFSET) / n;
            pwm[0] += sorted[i];
            pwm[1] += survival * sorted[i];
            pwm[2] += survival * survival * sorted[i];
        }
        pwm[0] /= n;
        pwm[1] /= n;
        pwm[2] /= n;
        return pwm;
    }

    private double[] logMomentEstimate(double[] sorted) {
        double loc = sorted[0] - FALLBACK_LOCATION_GAP;
        double[] logs = new double[sorted.length];
        for (int i = 0; i < sorted.length; i++) {
            logs[i] = Math.log(sorted[i] - loc);
        }
        // ln(X - loc) is logistic with location ln(scale) and scale 1/c
        double s = populationStandardDeviation(logs) * Math.sqrt(3.0) / Math.PI;
        return new double[] { 1.0 / s, loc, Math.exp(mean(logs)) };
    }

    @Override
    protected double logDensity(double x, double[] parameters) {
        double c = parameters[0];
        double y = (x - parameters[1]) / parameters[2];
        if (y <= 0.0) {
            return Double.NEGATIVE_INFINITY;
        }
        double logY = Math.log(y);
        return Math.log(c) - Math.log(parameters[2]) + (c - 1.0) * logY - 2.0 * softplus(c * logY);
    }

    @Override
    protected double[] toUnconstrained(double[] parameters, double[] standardizedSample) {
        double min = min(standardizedSample);
        return new double[] { Math.log(parameters[0]), Math.log(min - parameters[1]), Math.log(parameters[2]) };
    }

    @Override
    protected double[] fromUnconstrained(double[] theta, double[] standardizedSample) {
        double min = min(standardizedSample);
        return new double[] { Math.exp(theta[0]), min - Math.exp(theta[1]), Math.exp(theta[2]) };
    }

    @Override
    public double cdf(double x, double[] parameters) {
        double y = (x - parameters[1]) / parameters[2];
        if (y <= 0.0) {
            return 0.0;
        }
        return 1.0 / (1.0 + Math.exp(-parameters[0] * Math.log(y)));
    }

    @Override
    public boolean isValid(double[] parameters) {
        return super.isValid(parameters) && parameters[0] > 0.0;
    }

    private static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
        }
        return min;
    }
}
