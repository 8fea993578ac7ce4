/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.distribution;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.droughtindex.common.exception.FitConvergenceException;
import org.droughtindex.common.exception.InputValidationException;
import org.droughtindex.common.exception.StandardizedIndexException;
import org.droughtindex.season.SeasonKey;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fits one distribution family to the values of a season, optionally with zero-mass correction.
 * Every failure is reported against the season being fit.
 */
public class DistributionFitter {

    private static final Logger logger = LogManager.getLogger(DistributionFitter.class);

    private final ContinuousDistribution distribution;
    private final boolean zeroCorrection;

    public DistributionFitter(ContinuousDistribution distribution, boolean zeroCorrection) {
        this.distribution = Objects.requireNonNull(distribution, "distribution must not be null");
        this.zeroCorrection = zeroCorrection;
    }

    /**
     * @param season the season the sample belongs to, used in errors
     * @param sample finite values of the season
     * @return the fitted distribution
     * @throws InputValidationException if zero correction is on and the sample holds a negative value
     * @throws FitConvergenceException if the family cannot be fit
     */
    public FittedDistribution fit(SeasonKey season, double[] sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        double[] fitSample = sample;
        double zeroProbability = 0.0;
        if (zeroCorrection) {
            int zeros = 0;
            for (double value : sample) {
                if (value < 0.0) {
                    throw new InputValidationException(
                        season,
                        "zero-mass correction needs non-negative values but season [{}] holds [{}]",
                        season,
                        value
                    );
                }
                if (value == 0.0) {
                    zeros++;
                }
            }
            zeroProbability = sample.length == 0 ? 0.0 : (double) zeros / sample.length;
            fitSample = Arrays.stream(sample).filter(value -> value != 0.0).toArray();
            if (fitSample.length < AbstractContinuousDistribution.MIN_FIT_SAMPLE_SIZE) {
                throw new FitConvergenceException(
                    season,
                    "season [{}] has [{}] non-zero values, at least [{}] are needed to fit [{}]",
                    season,
                    fitSample.length,
                    AbstractContinuousDistribution.MIN_FIT_SAMPLE_SIZE,
                    distribution.name()
                );
            }
        }

        double[] parameters;
        try {
            parameters = distribution.fit(fitSample);
        } catch (StandardizedIndexException e) {
            if (Objects.equals(e.getSeason(), season)) {
                throw e;
            }
            throw new FitConvergenceException(season, "failed to fit [{}] for season [{}]: {}", e, distribution.name(), season, e.getMessage());
        } catch (RuntimeException e) {
            throw new FitConvergenceException(season, "failed to fit [{}] for season [{}]", e, distribution.name(), season);
        }
        if (distribution.isValid(parameters) == false) {
            throw new FitConvergenceException(
                season,
                "fitting [{}] for season [{}] produced invalid parameters {}",
                distribution.name(),
                season,
                Arrays.toString(parameters)
            );
        }

        FittedDistribution fitted = new FittedDistribution(distribution, parameters, zeroProbability, zeroCorrection, sample.length);
        logger.debug("Fitted season [{}]: {}", season, fitted);
        return fitted;
    }

    public ContinuousDistribution getDistribution() {
        return distribution;
    }

    public boolean isZeroCorrection() {
        return zeroCorrection;
    }
}
