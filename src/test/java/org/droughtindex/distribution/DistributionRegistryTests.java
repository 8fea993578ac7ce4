/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.distribution;

import org.droughtindex.common.exception.ConfigurationException;
import org.opensearch.test.OpenSearchTestCase;

public class DistributionRegistryTests extends OpenSearchTestCase {

    public void testBuiltInsAreRegistered() {
        DistributionRegistry registry = new DistributionRegistry();
        for (DistributionFamily family : DistributionFamily.values()) {
            assertTrue(registry.contains(family.familyName()));
            assertSame(family.distribution(), registry.get(family.familyName()));
        }
        assertEquals(DistributionFamily.values().length, registry.all().size());
    }

    public void testCustomBudget() {
        DistributionRegistry registry = new DistributionRegistry(100);
        assertEquals(100, ((AbstractMaximumLikelihoodDistribution) registry.get(LogLogisticDistributionFamily.NAME)).getMaxEvaluations());
    }

    public void testUnknownName() {
        ConfigurationException e = expectThrows(ConfigurationException.class, () -> new DistributionRegistry().get("weibull"));
        assertTrue(e.getMessage().contains("unknown distribution [weibull]"));
    }

    public void testRegisterCustomDistribution() {
        DistributionRegistry registry = new DistributionRegistry().register(new UniformDistribution());
        assertEquals(UniformDistribution.NAME, registry.get(UniformDistribution.NAME).name());
    }

    public void testDuplicateNameRejected() {
        DistributionRegistry registry = new DistributionRegistry();
        ConfigurationException e = expectThrows(ConfigurationException.class, () -> registry.register(new GammaDistributionFamily()));
        assertTrue(e.getMessage().contains("already registered"));
    }
}
