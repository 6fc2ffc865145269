/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.decode;

import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.*;

class StateLookupTableTest {

    private final StateLookupTable table = new StateLookupTable();

    @Test
    void translatesStatesAndTerritories() {
        assertEquals("New York", table.findName("NY").orElseThrow());
        assertEquals("District of Columbia", table.findName("DC").orElseThrow());
        assertEquals("U.S. Virgin Islands", table.findName("VI").orElseThrow());
        assertEquals("Federated States of Micronesia", table.findName("FM").orElseThrow());
    }

    @Test
    void holdsFiftyStatesPlusDcAndTerritories() {
        assertEquals(59, table.size());
    }

    @Test
    void unknownAbbreviationIsEmpty() {
        assertTrue(table.findName("ZZ").isEmpty());
        assertTrue(table.findName("ny").isEmpty());
        assertTrue(table.findName("").isEmpty());
    }

    @Test
    void missingResourceFails() {
        assertThrows(UncheckedIOException.class, () -> new StateLookupTable("no-such-file.properties"));
    }
}
