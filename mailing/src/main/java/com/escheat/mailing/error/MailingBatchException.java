/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.error;

/**
 * Fatal batch failure. Any instance aborts the whole run; no output is published.
 */
public class MailingBatchException extends RuntimeException {

    public MailingBatchException(String message) {
        super(message);
    }

    public MailingBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
