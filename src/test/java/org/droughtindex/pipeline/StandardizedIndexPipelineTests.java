/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.pipeline;

import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;

import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.Well19937c;
import org.droughtindex.accumulate.AccumulationUnit;
import org.droughtindex.common.exception.ConfigurationException;
import org.droughtindex.common.exception.FitConvergenceException;
import org.droughtindex.common.exception.InputValidationException;
import org.droughtindex.common.exception.InsufficientDataException;
import org.droughtindex.core.model.SampleList;
import org.droughtindex.core.model.TimeSeries;
import org.droughtindex.distribution.DistributionFitter;
import org.droughtindex.distribution.DistributionRegistry;
import org.droughtindex.distribution.FittedDistribution;
import org.droughtindex.distribution.GammaDistributionFamily;
import org.droughtindex.distribution.LogisticDistributionFamily;
import org.droughtindex.season.SeasonKey;
import org.droughtindex.season.SeasonalGranularity;
import org.droughtindex.settings.PipelineSettings;
import org.droughtindex.settings.StandardizedIndexSettings;
import org.droughtindex.standardize.Standardizer;
import org.opensearch.common.settings.Settings;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

import static org.droughtindex.TestUtils.epochMillis;
import static org.droughtindex.TestUtils.monthlySeries;
import static org.droughtindex.TestUtils.toJson;

/**
 * End to end runs of the index pipeline. Uses ThreadLeakScope.NONE because parallel fits may run on
 * ForkJoinPool.commonPool(), whose workers outlive the test.
 */
@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class StandardizedIndexPipelineTests extends OpenSearchTestCase {

    private static PipelineSettings settingsWithMinSampleSize(int minSampleSize) {
        return PipelineSettings.fromSettings(
            Settings.builder().put(StandardizedIndexSettings.MIN_SAMPLE_SIZE.getKey(), minSampleSize).build()
        );
    }

    private double[] precipitation(int months) {
        double[] values = new GammaDistribution(new Well19937c(randomLong()), 2.0, 30.0).sample(months);
        // a few dry months
        for (int i = 0; i < months; i += 17) {
            values[i] = 0.0;
        }
        return values;
    }

    /**
     * Ten years of monthly precipitation, 3-month SPI. January and February only have nine 3-month
     * totals, so the minimum sample size is lowered to nine.
     */
    public void testThreeMonthSpiOverTenYears() {
        double[] rain = precipitation(120);
        TimeSeries series = monthlySeries(2000, rain);
        IndexConfig config = IndexConfig.builder(IndexFamily.SPI)
            .window(3)
            .granularity(SeasonalGranularity.MONTH)
            .zeroCorrection(true)
            .build();
        StandardizedIndexPipeline pipeline = new StandardizedIndexPipeline(config, settingsWithMinSampleSize(9));

        StandardizedIndexResult result = pipeline.run(series);

        assertEquals(PipelineState.STANDARDIZED, pipeline.state());
        assertEquals(IndexFamily.SPI, result.getFamily());
        assertEquals(118, result.getIndex().size());
        assertEquals(118, result.getAccumulated().size());
        for (int i = 0; i < 118; i++) {
            assertTrue("index at " + i + " is not finite", Double.isFinite(result.getIndex().getSamples().getValue(i)));
            assertEquals(series.getSamples().getTimestamp(i + 2), result.getIndex().getSamples().getTimestamp(i));
        }
        assertEquals(12, result.getFits().size());
        assertEquals(GammaDistributionFamily.NAME, result.getFits().get(SeasonKey.month(1)).getDistribution().name());

        // December is fit to exactly the ten October to December totals
        double[] decemberTotals = new double[10];
        for (int year = 0; year < 10; year++) {
            int december = year * 12 + 11;
            decemberTotals[year] = rain[december - 2] + rain[december - 1] + rain[december];
        }
        FittedDistribution december = result.getFits().get(SeasonKey.month(12));
        assertEquals(10, december.getSampleSize());
        FittedDistribution expected = new DistributionFitter(new GammaDistributionFamily(), true).fit(SeasonKey.month(12), decemberTotals);
        assertArrayEquals(expected.getParameters(), december.getParameters(), 1e-9);
    }

    public void testWeeklySeriesWithDefaultConfiguration() {
        long week = TimeUnit.DAYS.toMillis(7);
        long start = epochMillis(1990, 1, 1);
        double[] rain = precipitation(30 * 52);
        long[] timestamps = new long[rain.length];
        for (int i = 0; i < rain.length; i++) {
            timestamps[i] = start + i * week;
        }
        TimeSeries series = new TimeSeries(SampleList.of(timestamps, rain), "weekly");
        StandardizedIndexPipeline pipeline = new StandardizedIndexPipeline(IndexConfig.builder(IndexFamily.SPI).build());

        StandardizedIndexResult result = pipeline.run(series);

        assertEquals(PipelineState.STANDARDIZED, pipeline.state());
        assertEquals(SeasonalGranularity.MONTH, result.getStandardization().getGranularity());
        assertEquals(12, result.getFits().size());
        assertEquals(rain.length, result.getIndex().size());
        for (double value : result.getIndex().getSamples().values()) {
            assertTrue(Double.isFinite(value));
        }
    }

    public void testGroupBelowMinimumSampleSize() {
        IndexConfig config = IndexConfig.builder(IndexFamily.SPI).granularity(SeasonalGranularity.NONE).build();
        StandardizedIndexPipeline pipeline = new StandardizedIndexPipeline(config);

        InsufficientDataException e = expectThrows(InsufficientDataException.class, () -> pipeline.run(monthlySeries(2000, 1.0, 2.0, 3.0)));

        assertEquals(SeasonKey.ALL, e.getSeason());
        assertEquals(3, e.getSampleSize());
        assertEquals(10, e.getMinimumSampleSize());
        assertEquals(PipelineState.FAILED, pipeline.state());
    }

    public void testIdenticalValuesFailWithSeason() {
        double[] values = new double[24];
        Arrays.fill(values, 5.0);
        IndexConfig config = IndexConfig.builder(IndexFamily.SGI).granularity(SeasonalGranularity.NONE).build();
        StandardizedIndexPipeline pipeline = new StandardizedIndexPipeline(config);

        FitConvergenceException e = expectThrows(FitConvergenceException.class, () -> pipeline.run(monthlySeries(2000, values)));

        assertEquals(SeasonKey.ALL, e.getSeason());
        assertEquals(PipelineState.FAILED, pipeline.state());
    }

    public void testParallelFailureIsRethrownUnwrapped() {
        double[] values = precipitation(60);
        for (int year = 0; year < 5; year++) {
            values[year * 12 + 6] = 7.0;
        }
        IndexConfig config = IndexConfig.builder(IndexFamily.SPI).granularity(SeasonalGranularity.MONTH).build();
        StandardizedIndexPipeline pipeline = new StandardizedIndexPipeline(
            config,
            settingsWithMinSampleSize(3),
            new DistributionRegistry(),
            ParallelFittingConfig.alwaysParallel()
        );

        FitConvergenceException e = expectThrows(FitConvergenceException.class, () -> pipeline.run(monthlySeries(1990, values)));

        assertEquals(SeasonKey.month(7), e.getSeason());
    }

    public void testParallelAndSequentialAgree() {
        TimeSeries series = monthlySeries(1980, precipitation(240));
        IndexConfig config = IndexConfig.builder(IndexFamily.SPI).window(6).granularity(SeasonalGranularity.MONTH).build();
        PipelineSettings settings = PipelineSettings.defaults();

        StandardizedIndexResult parallel = new StandardizedIndexPipeline(
            config,
            settings,
            new DistributionRegistry(),
            ParallelFittingConfig.alwaysParallel()
        ).run(series);
        StandardizedIndexResult sequential = new StandardizedIndexPipeline(
            config,
            settings,
            new DistributionRegistry(),
            ParallelFittingConfig.sequentialOnly()
        ).run(series);

        assertEquals(sequential.getFits(), parallel.getFits());
        assertEquals(sequential.getIndex(), parallel.getIndex());
    }

    public void testPipelineRunsOnce() {
        TimeSeries series = monthlySeries(2000, precipitation(24));
        StandardizedIndexPipeline pipeline = new StandardizedIndexPipeline(
            IndexConfig.builder(IndexFamily.SPI).granularity(SeasonalGranularity.NONE).build()
        );
        assertEquals(PipelineState.CONFIGURED, pipeline.state());
        pipeline.run(series);
        assertTrue(pipeline.state().isTerminal());
        expectThrows(IllegalStateException.class, () -> pipeline.run(series));
    }

    public void testSpeiAcceptsNegativeBalance() {
        double[] balance = new NormalDistribution(new Well19937c(randomLong()), -10.0, 40.0).sample(36);
        IndexConfig config = IndexConfig.builder(IndexFamily.SPEI).window(1).granularity(SeasonalGranularity.NONE).build();

        StandardizedIndexResult result = new StandardizedIndexPipeline(config).run(monthlySeries(2000, balance));

        assertFalse(result.getFits().get(SeasonKey.ALL).isZeroCorrected());
        for (double value : result.getIndex().getSamples().values()) {
            assertTrue(Double.isFinite(value));
        }
    }

    public void testZeroCorrectionRejectsNegativeValues() {
        double[] balance = new double[24];
        for (int i = 0; i < balance.length; i++) {
            balance[i] = i % 2 == 0 ? -1.0 - i : 1.0 + i;
        }
        StandardizedIndexPipeline pipeline = new StandardizedIndexPipeline(
            IndexConfig.builder(IndexFamily.SPEI).granularity(SeasonalGranularity.NONE).zeroCorrection(true).build()
        );
        InputValidationException e = expectThrows(InputValidationException.class, () -> pipeline.run(monthlySeries(2000, balance)));
        assertEquals(SeasonKey.ALL, e.getSeason());
    }

    public void testDistributionOverrideByName() {
        IndexConfig config = IndexConfig.builder(IndexFamily.SPI)
            .granularity(SeasonalGranularity.NONE)
            .distribution(LogisticDistributionFamily.NAME)
            .zeroCorrection(false)
            .build();

        StandardizedIndexResult result = new StandardizedIndexPipeline(config).run(monthlySeries(2000, precipitation(30)));

        assertEquals(LogisticDistributionFamily.NAME, result.getFits().get(SeasonKey.ALL).getDistribution().name());
    }

    public void testUnknownDistributionName() {
        StandardizedIndexPipeline pipeline = new StandardizedIndexPipeline(IndexConfig.builder(IndexFamily.SPI).distribution("weibull").build());
        expectThrows(ConfigurationException.class, () -> pipeline.run(monthlySeries(2000, precipitation(30))));
        assertEquals(PipelineState.FAILED, pipeline.state());
    }

    public void testMissingValuesStayAligned() {
        double[] rain = precipitation(48);
        rain[20] = Double.NaN;
        IndexConfig config = IndexConfig.builder(IndexFamily.SPI).window(2).granularity(SeasonalGranularity.NONE).build();

        StandardizedIndexResult result = new StandardizedIndexPipeline(config).run(monthlySeries(2000, rain));

        SampleList index = result.getIndex().getSamples();
        assertEquals(47, index.size());
        // raw position 20 feeds the windows ending at 20 and 21, output positions 19 and 20
        for (int i = 0; i < index.size(); i++) {
            assertEquals("position " + i, i == 19 || i == 20, Double.isNaN(index.getValue(i)));
        }
    }

    public void testRequireFinite() {
        double[] rain = precipitation(24);
        rain[3] = Double.NaN;
        StandardizedIndexPipeline pipeline = new StandardizedIndexPipeline(
            IndexConfig.builder(IndexFamily.SPI).granularity(SeasonalGranularity.NONE).requireFinite(true).build()
        );
        expectThrows(InputValidationException.class, () -> pipeline.run(monthlySeries(2000, rain)));
    }

    public void testSeriesShorterThanWindow() {
        StandardizedIndexPipeline pipeline = new StandardizedIndexPipeline(IndexConfig.builder(IndexFamily.SPI).window(12).build());
        InputValidationException e = expectThrows(InputValidationException.class, () -> pipeline.run(monthlySeries(2000, precipitation(6))));
        assertTrue(e.getMessage().contains("too few"));
    }

    public void testMalformedInput() {
        TimeSeries unordered = new TimeSeries(SampleList.of(new long[] { 2L, 1L }, new double[] { 1.0, 2.0 }), null);
        StandardizedIndexPipeline pipeline = new StandardizedIndexPipeline(IndexConfig.builder(IndexFamily.SPI).build());
        expectThrows(InputValidationException.class, () -> pipeline.run(unordered));
        assertEquals(PipelineState.FAILED, pipeline.state());
        expectThrows(NullPointerException.class, () -> new StandardizedIndexPipeline(IndexConfig.builder(IndexFamily.SPI).build()).run(null));
    }

    /**
     * A pipeline's standardization scores later observations against the historical fits.
     */
    public void testScoreNewObservations() {
        double[] history = precipitation(36);
        IndexConfig config = IndexConfig.builder(IndexFamily.SPI)
            .window(3)
            .unit(AccumulationUnit.MONTHS)
            .granularity(SeasonalGranularity.NONE)
            .build();
        StandardizedIndexResult result = new StandardizedIndexPipeline(config).run(monthlySeries(2000, history));

        TimeSeries newTotals = monthlySeries(2010, 0.0, 60.0, 600.0);
        TimeSeries scored = result.getStandardization().process(newTotals);

        FittedDistribution fit = result.getFits().get(SeasonKey.ALL);
        Standardizer standardizer = result.getStandardization().getStandardizer();
        assertEquals(standardizer.toIndex(fit.getZeroProbability()), scored.getSamples().getValue(0), 1e-12);
        assertTrue(scored.getSamples().getValue(1) < scored.getSamples().getValue(2));
    }

    public void testToXContent() throws IOException {
        IndexConfig config = IndexConfig.builder(IndexFamily.SGI).granularity(SeasonalGranularity.NONE).build();
        StandardizedIndexResult result = new StandardizedIndexPipeline(config).run(monthlySeries(2000, precipitation(12)));

        String json = toJson(result);

        assertTrue(json, json.startsWith("{\"family\":\"sgi\",\"index\":{\"alias\":\"monthly\",\"samples\":["));
        assertTrue(json, json.contains("\"standardize\":{\"granularity\":\"none\""));
        assertTrue(json, json.contains("\"distribution\":\"normal\""));
    }
}
