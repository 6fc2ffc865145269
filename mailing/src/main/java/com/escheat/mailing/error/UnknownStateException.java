/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.error;

/**
 * Escheatment State abbreviation with no entry in the state lookup table.
 */
public class UnknownStateException extends RecordDecodingException {

    private final String abbreviation;

    public UnknownStateException(int lineNumber, String abbreviation) {
        super(lineNumber, "Unknown escheatment state abbreviation '" + abbreviation + "'");
        this.abbreviation = abbreviation;
    }

    public String getAbbreviation() {
        return abbreviation;
    }
}
