/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.distribution;

import java.util.Locale;
import java.util.function.IntFunction;

/**
 * The built-in distribution families. Any other {@link ContinuousDistribution} can be used in their
 * place.
 */
public enum DistributionFamily {
    NORMAL(NormalDistributionFamily.NAME, maxEvaluations -> new NormalDistributionFamily()),
    GAMMA(GammaDistributionFamily.NAME, maxEvaluations -> new GammaDistributionFamily()),
    LOGNORMAL(LogNormalDistributionFamily.NAME, maxEvaluations -> new LogNormalDistributionFamily()),
    LOGISTIC(LogisticDistributionFamily.NAME, LogisticDistributionFamily::new),
    LOG_LOGISTIC(LogLogisticDistributionFamily.NAME, LogLogisticDistributionFamily::new),
    PEARSON3(PearsonType3DistributionFamily.NAME, PearsonType3DistributionFamily::new),
    GENERALIZED_EXTREME_VALUE(GeneralizedExtremeValueDistributionFamily.NAME, GeneralizedExtremeValueDistributionFamily::new),
    GENERALIZED_LOGISTIC(GeneralizedLogisticDistributionFamily.NAME, GeneralizedLogisticDistributionFamily::new);

    private final String familyName;
    private final IntFunction<ContinuousDistribution> factory;
    private final ContinuousDistribution defaultInstance;

    DistributionFamily(String familyName, IntFunction<ContinuousDistribution> factory) {
        this.familyName = familyName;
        this.factory = factory;
        this.defaultInstance = factory.apply(AbstractMaximumLikelihoodDistribution.DEFAULT_MAX_EVALUATIONS);
    }

    public String familyName() {
        return familyName;
    }

    /**
     * @return the shared instance using the default evaluation budget
     */
    public ContinuousDistribution distribution() {
        return defaultInstance;
    }

    /**
     * @param maxEvaluations likelihood evaluation budget, ignored by closed-form families
     * @return a new instance with the given budget
     */
    public ContinuousDistribution distribution(int maxEvaluations) {
        return factory.apply(maxEvaluations);
    }

    public static DistributionFamily fromString(String name) {
        String normalized = name.toLowerCase(Locale.ROOT);
        for (DistributionFamily family : values()) {
            if (family.familyName.equals(normalized) || family.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return family;
            }
        }
        throw new IllegalArgumentException("Unknown distribution family: " + name);
    }
}
