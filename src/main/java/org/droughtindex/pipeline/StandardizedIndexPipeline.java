/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.droughtindex.accumulate.AccumulationStage;
import org.droughtindex.common.exception.FitConvergenceException;
import org.droughtindex.common.exception.InputValidationException;
import org.droughtindex.core.model.TimeSeries;
import org.droughtindex.core.validation.SeriesValidator;
import org.droughtindex.core.validation.TimeStep;
import org.droughtindex.distribution.DistributionFitter;
import org.droughtindex.distribution.DistributionRegistry;
import org.droughtindex.distribution.FittedDistribution;
import org.droughtindex.season.SeasonKey;
import org.droughtindex.season.SeasonalGroup;
import org.droughtindex.season.SeasonalGrouper;
import org.droughtindex.settings.PipelineSettings;
import org.droughtindex.standardize.StandardizationStage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Computes a standardized index for one series:
 * <ol>
 *   <li>validate the series and resolve the configuration</li>
 *   <li>accumulate over the window</li>
 *   <li>split the accumulated series into seasons and fit one distribution per season</li>
 *   <li>map every accumulated value to a standard normal quantile</li>
 * </ol>
 * A pipeline runs once. Its fits belong to that run only.
 */
public class StandardizedIndexPipeline {

    private static final Logger logger = LogManager.getLogger(StandardizedIndexPipeline.class);

    private final IndexConfig config;
    private final PipelineSettings settings;
    private final DistributionRegistry registry;
    private final ParallelFittingConfig parallelConfig;
    private final AtomicReference<PipelineState> state = new AtomicReference<>(PipelineState.CONFIGURED);

    public StandardizedIndexPipeline(IndexConfig config) {
        this(config, PipelineSettings.defaults());
    }

    public StandardizedIndexPipeline(IndexConfig config, PipelineSettings settings) {
        this(config, settings, new DistributionRegistry(settings.maxEvaluations()), ParallelFittingConfig.fromSettings(settings));
    }

    public StandardizedIndexPipeline(
        IndexConfig config,
        PipelineSettings settings,
        DistributionRegistry registry,
        ParallelFittingConfig parallelConfig
    ) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.parallelConfig = Objects.requireNonNull(parallelConfig, "parallelConfig must not be null");
    }

    /**
     * Run the pipeline.
     *
     * @param series the raw observations
     * @return the index series together with the accumulated series and the fits
     * @throws IllegalStateException if the pipeline has already run
     * @throws org.droughtindex.common.exception.StandardizedIndexException if the input, the configuration or a fit is invalid
     */
    public StandardizedIndexResult run(TimeSeries series) {
        if (series == null) {
            throw new NullPointerException("pipeline received null input");
        }
        if (state.compareAndSet(PipelineState.CONFIGURED, PipelineState.FITTING) == false) {
            throw new IllegalStateException("pipeline already ran, state is [" + state.get() + "]");
        }
        try {
            StandardizedIndexResult result = doRun(series);
            state.set(PipelineState.STANDARDIZED);
            return result;
        } catch (RuntimeException | Error e) {
            state.set(PipelineState.FAILED);
            logger.info("Index computation for series [{}] failed: {}", series.displayName(), e.getMessage());
            throw e;
        }
    }

    private StandardizedIndexResult doRun(TimeSeries series) {
        SeriesValidator.validate(series, config.isRequireFinite());
        IndexConfig resolved = config.resolve(TimeStep.infer(series), registry);
        logger.info("Computing [{}] for series [{}] of {} observations with {}", resolved.getFamily(), series.displayName(), series.size(), resolved);

        AccumulationStage accumulation = new AccumulationStage(resolved.getWindow(), resolved.getUnit(), settings.timeZone());
        TimeSeries accumulated = accumulation.process(series);
        if (accumulated.isEmpty()) {
            throw new InputValidationException(
                "series [{}] has [{}] observations, too few for an accumulation window of [{}] {}",
                series.displayName(),
                series.size(),
                resolved.getWindow(),
                resolved.getUnit()
            );
        }

        SeasonalGrouper grouper = new SeasonalGrouper(resolved.getGranularity(), settings.timeZone(), settings.minSampleSize());
        List<SeasonalGroup> groups = grouper.group(accumulated);
        DistributionFitter fitter = new DistributionFitter(resolved.getDistribution(), resolved.getZeroCorrection());
        SortedMap<SeasonKey, FittedDistribution> fits = fitGroups(groups, fitter);

        StandardizationStage standardization = new StandardizationStage(
            fits,
            resolved.getGranularity(),
            settings.timeZone(),
            settings.standardizer()
        );
        TimeSeries index = standardization.process(accumulated);
        logger.info("Computed [{}] for series [{}]: {} values over {} seasons", resolved.getFamily(), series.displayName(), index.size(), fits.size());
        return new StandardizedIndexResult(resolved.getFamily(), index, accumulated, standardization);
    }

    /**
     * Fit every season. All fits complete before the result map is published; the failure of the
     * first season in key order is rethrown as is.
     */
    SortedMap<SeasonKey, FittedDistribution> fitGroups(List<SeasonalGroup> groups, DistributionFitter fitter) {
        SortedMap<SeasonKey, FittedDistribution> fits = new TreeMap<>();
        if (parallelConfig.shouldFitInParallel(groups.size())) {
            logger.debug("Fitting {} seasons in parallel", groups.size());
            List<Callable<FittedDistribution>> tasks = new ArrayList<>(groups.size());
            for (SeasonalGroup group : groups) {
                tasks.add(() -> fitter.fit(group.getKey(), group.sample()));
            }
            ForkJoinPool pool = ParallelFittingConfig.getOrCreatePool(settings.parallelFitPoolSize());
            List<Future<FittedDistribution>> futures = pool.invokeAll(tasks);
            for (int i = 0; i < groups.size(); i++) {
                fits.put(groups.get(i).getKey(), await(futures.get(i), groups.get(i).getKey()));
            }
        } else {
            logger.debug("Fitting {} seasons sequentially", groups.size());
            for (SeasonalGroup group : groups) {
                fits.put(group.getKey(), fitter.fit(group.getKey(), group.sample()));
            }
        }
        return Collections.unmodifiableSortedMap(fits);
    }

    private static FittedDistribution await(Future<FittedDistribution> future, SeasonKey season) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FitConvergenceException(season, "interrupted while fitting season [{}]", e, season);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new FitConvergenceException(season, "failed to fit season [{}]", cause, season);
        }
    }

    public PipelineState state() {
        return state.get();
    }

    public IndexConfig getConfig() {
        return config;
    }

    public PipelineSettings getSettings() {
        return settings;
    }
}
