/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.settings;

import org.droughtindex.common.exception.ConfigurationException;
import org.droughtindex.standardize.Standardizer;
import org.opensearch.common.settings.Settings;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.time.ZoneId;
import java.time.ZoneOffset;

public class PipelineSettingsTests extends OpenSearchTestCase {

    public void testDefaults() {
        PipelineSettings settings = PipelineSettings.defaults();

        assertEquals(10, settings.minSampleSize());
        assertEquals(Standardizer.DEFAULT_EPSILON, settings.probabilityEpsilon(), 0.0);
        assertEquals(ZoneId.of("UTC"), settings.timeZone());
        assertTrue(settings.parallelFitEnabled());
        assertEquals(4, settings.parallelFitMinGroups());
        assertEquals(Math.max(1, Runtime.getRuntime().availableProcessors() / 2), settings.parallelFitPoolSize());
        assertEquals(2000, settings.maxEvaluations());
    }

    public void testLoadFromYaml() throws IOException {
        Settings raw = StandardizedIndexSettings.load(getDataPath("sdi-settings.yml"));

        PipelineSettings settings = PipelineSettings.fromSettings(raw);

        assertEquals(8, settings.minSampleSize());
        assertEquals(1e-4, settings.probabilityEpsilon(), 0.0);
        assertEquals(ZoneId.of("Europe/Amsterdam"), settings.timeZone());
        assertFalse(settings.parallelFitEnabled());
        assertEquals(6, settings.parallelFitMinGroups());
        assertEquals(2, settings.parallelFitPoolSize());
        assertEquals(500, settings.maxEvaluations());
        assertEquals(1e-4, settings.standardizer().getEpsilon(), 0.0);
    }

    public void testProgrammaticSettings() {
        Settings raw = Settings.builder()
            .put(StandardizedIndexSettings.MIN_SAMPLE_SIZE.getKey(), 20)
            .put(StandardizedIndexSettings.TIME_ZONE.getKey(), "Z")
            .build();

        PipelineSettings settings = PipelineSettings.fromSettings(raw);

        assertEquals(20, settings.minSampleSize());
        assertEquals(ZoneOffset.UTC, settings.timeZone());
    }

    public void testMinSampleSizeBelowThree() {
        Settings raw = Settings.builder().put(StandardizedIndexSettings.MIN_SAMPLE_SIZE.getKey(), 2).build();
        ConfigurationException e = expectThrows(ConfigurationException.class, () -> PipelineSettings.fromSettings(raw));
        assertTrue(e.getMessage().contains("sdi.fit.min_sample_size"));
    }

    public void testEpsilonOutOfRange() {
        Settings raw = Settings.builder().put(StandardizedIndexSettings.PROBABILITY_EPSILON.getKey(), 0.7).build();
        expectThrows(ConfigurationException.class, () -> PipelineSettings.fromSettings(raw));
    }

    public void testInvalidTimeZone() {
        Settings raw = Settings.builder().put(StandardizedIndexSettings.TIME_ZONE.getKey(), "Mars/Olympus").build();
        ConfigurationException e = expectThrows(ConfigurationException.class, () -> PipelineSettings.fromSettings(raw));
        assertTrue(e.getMessage().contains("Mars/Olympus"));
    }

    public void testAllSettingsListed() {
        assertEquals(7, StandardizedIndexSettings.all().size());
    }
}
