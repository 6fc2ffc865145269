/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DelimitedTableReaderTest {

    private final DelimitedTableReader reader = new DelimitedTableReader();

    @Test
    @DisplayName("Should keep an empty line as a row of one empty cell")
    void shouldKeepEmptyLines(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("table.csv");
        Files.writeString(file, "\"Account\",\"City\"\r\n\"A1\",\"CHICAGO\"\r\n\r\n\"Total\",\"1\"\r\n",
                StandardCharsets.UTF_8);

        List<List<String>> table = reader.read(file);

        assertEquals(List.of(
                List.of("Account", "City"),
                List.of("A1", "CHICAGO"),
                List.of(""),
                List.of("Total", "1")), table);
    }

    @Test
    void shouldNotAddRowForFinalLineTerminator(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("table.csv");
        Files.writeString(file, "a,b\r\nc,d\r\n", StandardCharsets.UTF_8);

        assertEquals(List.of(List.of("a", "b"), List.of("c", "d")), reader.read(file));
    }
}
