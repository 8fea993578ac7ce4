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
 * The input series breaks a structural contract: empty, unordered or duplicate timestamps,
 * non-finite values under a strict no-missing-data contract, or values outside the support
 * required by the requested correction.
 */
public class InputValidationException extends StandardizedIndexException {

    public InputValidationException(String msg, Object... args) {
        super(null, msg, args);
    }

    public InputValidationException(SeasonKey season, String msg, Object... args) {
        super(season, msg, args);
    }
}
