/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Prepares escheatment mailing files from a shareholder flat file or spreadsheet export.
 *
 * <p>Usage: {@code java -jar mailing.jar --mailing.letter-code=FA <input file>}
 */
@SpringBootApplication
public class MailingApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailingApplication.class, args);
    }
}
