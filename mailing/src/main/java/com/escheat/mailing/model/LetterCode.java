/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Mailing template code selected for a run. Each code picks one print template.
 */
public enum LetterCode {

    A("DDA"),
    AC("DDAC"),
    FA("DDFA"),
    FC("DDFC"),
    R("DDR"),
    RC("DDRC");

    private final String templateName;

    LetterCode(String templateName) {
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }

    /**
     * Parses a letter code, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException if the value is blank or not one of the known codes
     */
    public static LetterCode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Letter code must not be null or blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(code -> code.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Not a valid letter code: " + value + " (expected one of " + Arrays.toString(values()) + ")"));
    }
}
