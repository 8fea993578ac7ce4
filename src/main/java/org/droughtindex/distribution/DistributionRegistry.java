/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.distribution;

import org.droughtindex.common.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Looks up distributions by {@link ContinuousDistribution#name()}. The built-in families are
 * registered up front; further families may be added with {@link #register(ContinuousDistribution)}.
 *
 * Thread-safe.
 */
public class DistributionRegistry {

    private final Map<String, ContinuousDistribution> distributions = new LinkedHashMap<>();

    /**
     * Registry with the built-in families using the default evaluation budget.
     */
    public DistributionRegistry() {
        this(AbstractMaximumLikelihoodDistribution.DEFAULT_MAX_EVALUATIONS);
    }

    /**
     * @param maxEvaluations likelihood evaluation budget for the built-in iterative families
     */
    public DistributionRegistry(int maxEvaluations) {
        for (DistributionFamily family : DistributionFamily.values()) {
            register(maxEvaluations == AbstractMaximumLikelihoodDistribution.DEFAULT_MAX_EVALUATIONS
                ? family.distribution()
                : family.distribution(maxEvaluations));
        }
    }

    public synchronized DistributionRegistry register(ContinuousDistribution distribution) {
        Objects.requireNonNull(distribution, "distribution must not be null");
        String name = distribution.name();
        if (name == null || name.isEmpty()) {
            throw new ConfigurationException("distribution [{}] has no name", distribution.getClass().getName());
        }
        if (distributions.containsKey(name)) {
            throw new ConfigurationException("a distribution named [{}] is already registered", name);
        }
        distributions.put(name, distribution);
        return this;
    }

    /**
     * @throws ConfigurationException if no distribution has that name
     */
    public synchronized ContinuousDistribution get(String name) {
        ContinuousDistribution distribution = distributions.get(name);
        if (distribution == null) {
            throw new ConfigurationException("unknown distribution [{}], registered distributions are {}", name, distributions.keySet());
        }
        return distribution;
    }

    public synchronized boolean contains(String name) {
        return distributions.containsKey(name);
    }

    public synchronized Collection<ContinuousDistribution> all() {
        return Collections.unmodifiableList(new ArrayList<>(distributions.values()));
    }
}
