/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.distribution;

import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.random.Well19937c;
import org.droughtindex.common.exception.FitConvergenceException;
import org.droughtindex.common.exception.InputValidationException;
import org.droughtindex.common.exception.StandardizedIndexException;
import org.droughtindex.season.SeasonKey;
import org.opensearch.test.OpenSearchTestCase;

import java.util.Arrays;
import java.util.List;

public class DistributionFitterTests extends OpenSearchTestCase {

    private static final SeasonKey JULY = SeasonKey.month(7);

    public void testZeroProbabilityIsSharedWithEvaluation() {
        GammaDistribution rain = new GammaDistribution(new Well19937c(randomLong()), 1.5, 20.0);
        double[] positive = rain.sample(80);
        double[] sample = Arrays.copyOf(positive, 100);   // 20 dry months

        FittedDistribution fitted = new DistributionFitter(new GammaDistributionFamily(), true).fit(JULY, sample);

        assertTrue(fitted.isZeroCorrected());
        assertEquals(0.2, fitted.getZeroProbability(), 0.0);
        assertEquals(0.2, fitted.cdf(0.0), 0.0);
        assertEquals(1.0, fitted.cdf(1e6), 1e-9);
        assertEquals(100, fitted.getSampleSize());
        // the continuous part is fit to the wet months only
        assertArrayEquals(new GammaDistributionFamily().fit(positive), fitted.getParameters(), 1e-12);
    }

    public void testWithoutZerosCorrectionIsNeutral() {
        double[] sample = { 3.0, 5.0, 2.0, 8.0, 4.0, 6.0 };
        FittedDistribution corrected = new DistributionFitter(new GammaDistributionFamily(), true).fit(JULY, sample);
        FittedDistribution plain = new DistributionFitter(new GammaDistributionFamily(), false).fit(JULY, sample);
        assertEquals(0.0, corrected.getZeroProbability(), 0.0);
        for (double x : sample) {
            assertEquals(plain.cdf(x), corrected.cdf(x), 1e-15);
        }
    }

    public void testNegativeValueWithCorrection() {
        InputValidationException e = expectThrows(
            InputValidationException.class,
            () -> new DistributionFitter(new NormalDistributionFamily(), true).fit(JULY, new double[] { 1.0, -2.0, 3.0, 4.0 })
        );
        assertEquals(JULY, e.getSeason());
        assertTrue(e.getMessage().contains("month=7"));
    }

    public void testTooFewNonZeroValues() {
        FitConvergenceException e = expectThrows(
            FitConvergenceException.class,
            () -> new DistributionFitter(new GammaDistributionFamily(), true).fit(JULY, new double[] { 0, 0, 0, 0, 0, 0, 0, 0, 1.0, 2.0 })
        );
        assertEquals(JULY, e.getSeason());
        assertTrue(e.getMessage().contains("[2] non-zero values"));
    }

    public void testIdenticalValuesAttributedToSeason() {
        double[] sample = new double[12];
        Arrays.fill(sample, 7.5);
        FitConvergenceException e = expectThrows(
            FitConvergenceException.class,
            () -> new DistributionFitter(new LogLogisticDistributionFamily(), false).fit(JULY, sample)
        );
        assertEquals(JULY, e.getSeason());
        assertEquals(List.of("month=7"), e.getMetadata(StandardizedIndexException.SEASON_METADATA_KEY));
    }

    public void testUnexpectedFailureIsWrapped() {
        ContinuousDistribution broken = new UniformDistribution() {
            @Override
            protected double[] estimate(double[] sample) {
                throw new ArithmeticException("boom");
            }
        };
        FitConvergenceException e = expectThrows(
            FitConvergenceException.class,
            () -> new DistributionFitter(broken, false).fit(JULY, new double[] { 1.0, 2.0, 3.0 })
        );
        assertEquals(JULY, e.getSeason());
        assertTrue(e.getCause() instanceof ArithmeticException);
    }

    public void testCustomDistribution() {
        FittedDistribution fitted = new DistributionFitter(new UniformDistribution(), false).fit(SeasonKey.ALL, new double[] { 0.0, 4.0, 2.0 });
        assertEquals(0.5, fitted.cdf(2.0), 1e-15);
    }
}
