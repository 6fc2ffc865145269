/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.classify;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class PostalCodeFormatterTest {

    @ParameterizedTest
    @CsvSource({
            "123456789, 12345-6789",
            "1234567, 12345-67",
            "12345-6789, 12345-6789",
            "12345, 12345",
            "1234, 1234"
    })
    void formatsZip(String input, String expected) {
        assertEquals(expected, PostalCodeFormatter.formatZip(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"123456789", "12345-6789", "12345", "", "98765432"})
    void formattingIsIdempotent(String zip) {
        String once = PostalCodeFormatter.formatZip(zip);

        assertEquals(once, PostalCodeFormatter.formatZip(once));
    }

    @Test
    void nullBecomesEmpty() {
        assertEquals("", PostalCodeFormatter.formatZip(null));
    }
}
