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
import org.droughtindex.settings.PipelineSettings;

import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decides whether the seasons of a run are fit in parallel.
 *
 * <p>Parallel fits run on a dedicated {@link ForkJoinPool} of daemon threads, created lazily by the
 * first parallel run and released by {@link #shutdown()}.</p>
 *
 * @param enabled whether parallel fitting is enabled
 * @param minGroups fewest seasons for which fitting runs in parallel
 */
public record ParallelFittingConfig(boolean enabled, int minGroups) {

    private static final Logger logger = LogManager.getLogger(ParallelFittingConfig.class);

    private static final int POOL_SHUTDOWN_TIMEOUT_SECONDS = 30;

    private static final AtomicReference<ForkJoinPool> dedicatedPool = new AtomicReference<>();

    /**
     * @return the dedicated pool, or commonPool() if none is initialized
     */
    static ForkJoinPool getPool() {
        ForkJoinPool pool = dedicatedPool.get();
        return pool != null ? pool : ForkJoinPool.commonPool();
    }

    /**
     * @param poolSize parallelism used if the pool has to be created
     * @return the dedicated pool, created on first use
     */
    public static ForkJoinPool getOrCreatePool(int poolSize) {
        while (true) {
            ForkJoinPool pool = dedicatedPool.get();
            if (pool != null) {
                return pool;
            }
            ForkJoinPool created = createPool(poolSize);
            if (dedicatedPool.compareAndSet(null, created)) {
                logger.info("Created parallel fitting pool of size {}", poolSize);
                return created;
            }
            created.shutdown();
        }
    }

    /**
     * Create the dedicated pool, replacing and shutting down any previous one.
     *
     * @param poolSize parallelism of the pool
     */
    static void initialize(int poolSize) {
        ForkJoinPool oldPool = dedicatedPool.getAndSet(createPool(poolSize));
        if (oldPool != null) {
            oldPool.shutdown();
        }
        logger.info("Initialized parallel fitting pool of size {}", poolSize);
    }

    private static ForkJoinPool createPool(int parallelism) {
        return new ForkJoinPool(parallelism, pool -> {
            var thread = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
            thread.setDaemon(true);
            thread.setName("sdi-parallel-fit-" + thread.getPoolIndex());
            return thread;
        }, null, false);
    }

    /**
     * Shut down the dedicated pool and wait for running fits to complete.
     */
    public static void shutdown() {
        ForkJoinPool pool = dedicatedPool.getAndSet(null);
        if (pool != null) {
            pool.shutdown();
            try {
                if (pool.awaitTermination(POOL_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS) == false) {
                    logger.warn("Parallel fitting pool did not terminate within {}s, forcing shutdown", POOL_SHUTDOWN_TIMEOUT_SECONDS);
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                pool.shutdownNow();
                Thread.currentThread().interrupt();
            }
            logger.info("Shut down parallel fitting pool");
        }
    }

    /**
     * @param groupCount number of seasons to fit
     * @return true if the seasons should be fit in parallel
     */
    public boolean shouldFitInParallel(int groupCount) {
        return enabled && groupCount > 1 && groupCount >= minGroups;
    }

    public static ParallelFittingConfig fromSettings(PipelineSettings settings) {
        return new ParallelFittingConfig(settings.parallelFitEnabled(), settings.parallelFitMinGroups());
    }

    public static ParallelFittingConfig defaultConfig() {
        return new ParallelFittingConfig(true, 4);
    }

    public static ParallelFittingConfig sequentialOnly() {
        return new ParallelFittingConfig(false, Integer.MAX_VALUE);
    }

    /**
     * Parallel whenever there is more than one season. Useful for testing parallel code paths.
     */
    public static ParallelFittingConfig alwaysParallel() {
        return new ParallelFittingConfig(true, 0);
    }
}
