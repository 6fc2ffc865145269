/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AddressLinesTest {

    @Test
    @DisplayName("Should drop blank and NULL entries while keeping order")
    void shouldCompactBlanksAndNullMarkers() {
        var lines = AddressLines.compact(Arrays.asList("JOHN DOE", "", "null", "  ", "NULL", "123 MAIN ST", null));

        assertEquals(List.of("JOHN DOE", "123 MAIN ST"), lines.asList());
        assertEquals("123 MAIN ST", lines.last());
        assertEquals("JOHN DOE", lines.fromEnd(1));
    }

    @Test
    @DisplayName("Should return empty last line when nothing is meaningful")
    void shouldReturnEmptyLastWhenNoLines() {
        var lines = AddressLines.compact(List.of("", "NULL"));

        assertTrue(lines.isEmpty());
        assertEquals("", lines.last());
    }

    @Test
    @DisplayName("Should pad to the slot count with trailing blanks")
    void shouldPadWithTrailingBlanks() {
        var padded = AddressLines.compact(List.of("A", "B")).padTo(AddressLines.SLOT_COUNT);

        assertEquals(List.of("A", "B", "", "", "", "", "", ""), padded);
    }

    @Test
    @DisplayName("Should fold overflowing lines into the last slot")
    void shouldFoldOverflowIntoLastSlot() {
        var lines = AddressLines.compact(List.of("1", "2", "3", "4", "5", "6", "7", "8")).append("CITY");

        var padded = lines.padTo(AddressLines.SLOT_COUNT);

        assertEquals(8, padded.size());
        assertEquals("8 CITY", padded.get(7));
        assertEquals("7", padded.get(6));
    }

    @Test
    @DisplayName("Should not modify the original when appending or dropping")
    void shouldBeImmutable() {
        var original = AddressLines.compact(List.of("A", "B", "C"));

        var appended = original.append("D");
        var dropped = original.dropLast(2);

        assertEquals(List.of("A", "B", "C"), original.asList());
        assertEquals(List.of("A", "B", "C", "D"), appended.asList());
        assertEquals(List.of("A"), dropped.asList());
        assertThrows(IllegalArgumentException.class, () -> original.dropLast(4));
    }
}
