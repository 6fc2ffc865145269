/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.io;

import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MailingOutputWriterTest {

    private final MailingOutputWriter writer = new MailingOutputWriter();

    @Test
    void shouldQuoteEveryDelimitedValue(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("out.csv");

        writer.writeDelimited(file, List.of("Name", "City"),
                List.of(List.of("DOE, JOHN", "SPRINGFIELD"), List.of("", "SAY \"HI\"")));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(List.of(
                "\"Name\",\"City\"",
                "\"DOE, JOHN\",\"SPRINGFIELD\"",
                "\"\",\"SAY \"\"HI\"\"\""), lines);
    }

    @Test
    void shouldWriteDelimitedRowsReadableByTableReader(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("out.csv");
        List<List<String>> rows = List.of(List.of("1", "A"), List.of("2", "B"));

        writer.writeDelimited(file, List.of("Seq", "Code"), rows);

        List<List<String>> table = new DelimitedTableReader().read(file);
        assertEquals(List.of(List.of("Seq", "Code"), List.of("1", "A"), List.of("2", "B")), table);
    }

    @Test
    void shouldWriteWorkbookWithHeaderRow(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("out.xlsx");

        writer.writeWorkbook(file, "Records", List.of("Seq", "City"),
                List.of(List.of("1", "TORONTO"), List.of("2", "")));

        try (Workbook workbook = WorkbookFactory.create(file.toFile())) {
            Sheet sheet = workbook.getSheet("Records");
            assertNotNull(sheet);
            assertEquals(2, sheet.getLastRowNum());
            assertEquals("City", sheet.getRow(0).getCell(1).getStringCellValue());
            assertEquals("TORONTO", sheet.getRow(1).getCell(1).getStringCellValue());
            assertEquals("2", sheet.getRow(2).getCell(0).getStringCellValue());
        }
    }
}
