/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.error;

/**
 * An input line or row could not be decoded into a canonical record.
 */
public class RecordDecodingException extends MailingBatchException {

    private final int lineNumber;

    public RecordDecodingException(int lineNumber, String message) {
        super("Line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    /**
     * 1-based line (flat file) or row (table, header is row 1) that failed.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
