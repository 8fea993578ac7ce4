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
 * Parameter estimation failed: the sample is degenerate (for example zero variance) or neither
 * maximum likelihood nor the moments estimate produced valid parameters.
 */
public class FitConvergenceException extends StandardizedIndexException {

    public FitConvergenceException(String msg, Object... args) {
        super(null, msg, args);
    }

    public FitConvergenceException(SeasonKey season, String msg, Object... args) {
        super(season, msg, args);
    }

    public FitConvergenceException(SeasonKey season, String msg, Throwable cause, Object... args) {
        super(season, msg, cause, args);
    }
}
