/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.distribution;

import org.apache.commons.math3.distribution.ExponentialDistribution;
import org.apache.commons.math3.random.Well19937c;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;
import java.util.stream.Collectors;

public class GoodnessOfFitTests extends OpenSearchTestCase {

    /**
     * Normal quantiles at plotting positions fit a normal distribution almost exactly.
     */
    public void testExactNormalSampleIsAccepted() {
        double[] sample = normalQuantiles(200, 5.0, 2.0);

        GoodnessOfFit.Result result = GoodnessOfFit.test(sample, new NormalDistributionFamily(), GoodnessOfFit.DEFAULT_ALPHA);

        assertEquals(NormalDistributionFamily.NAME, result.distribution());
        assertTrue(result.statistic() < 0.01);
        assertTrue(result.pValue() > 0.99);
        assertFalse(result.rejected());
        assertEquals(5.0, result.parameters()[0], 1e-6);
    }

    public void testSkewedSampleRejectsNormal() {
        double[] sample = new ExponentialDistribution(new Well19937c(randomLong()), 3.0).sample(2000);

        GoodnessOfFit.Result normal = GoodnessOfFit.test(sample, new NormalDistributionFamily(), 0.05);
        GoodnessOfFit.Result gamma = GoodnessOfFit.test(sample, new GammaDistributionFamily(), 0.05);

        assertTrue(normal.rejected());
        assertTrue(normal.pValue() < 1e-6);
        assertTrue(gamma.statistic() < normal.statistic());
        assertTrue(gamma.pValue() > normal.pValue());
    }

    public void testCompareReportsFailedFits() {
        double[] sample = normalQuantiles(100, 0.0, 1.0);

        List<GoodnessOfFit.Result> results = GoodnessOfFit.compare(sample);

        assertEquals(DistributionFamily.values().length, results.size());
        assertEquals(
            List.of("normal", "gamma", "lognorm", "logistic", "fisk", "pearson3", "genextreme", "genlogistic"),
            results.stream().map(GoodnessOfFit.Result::distribution).collect(Collectors.toList())
        );
        for (GoodnessOfFit.Result result : results) {
            if (result.distribution().equals(GammaDistributionFamily.NAME) || result.distribution().equals(LogNormalDistributionFamily.NAME)) {
                assertTrue(result.rejected());
                assertTrue(Double.isNaN(result.pValue()));
                assertEquals(0, result.parameters().length);
            } else {
                assertFalse(Double.isNaN(result.statistic()));
            }
        }
    }

    public void testInvalidAlpha() {
        expectThrows(IllegalArgumentException.class, () -> GoodnessOfFit.test(new double[] { 1, 2, 3 }, new NormalDistributionFamily(), 0.0));
    }

    private static double[] normalQuantiles(int n, double mean, double sd) {
        double[] sample = new double[n];
        for (int i = 0; i < n; i++) {
            sample[i] = mean + sd * StandardNormal.inverseCdf((i + 0.5) / n);
        }
        return sample;
    }
}
