/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.droughtindex.common.exception;

import org.droughtindex.season.SeasonKey;

/**
 * Invalid window, granularity, distribution or policy combination.
 */
public class ConfigurationException extends StandardizedIndexException {

    public ConfigurationException(String msg, Object... args) {
        super(null, msg, args);
    }

    public ConfigurationException(SeasonKey season, String msg, Object... args) {
        super(season, msg, args);
    }
}
