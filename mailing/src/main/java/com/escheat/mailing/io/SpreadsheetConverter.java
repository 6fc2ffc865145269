/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.io;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Saves the first sheet of an {@code .xls} or {@code .xlsx} workbook as a delimited file,
 * every cell rendered as the text the spreadsheet displays.
 *
 * <p>Every row is written at least as wide as the header row, so a blank separator row
 * comes out as a record of empty cells rather than an empty line.
 */
@Slf4j
@Component
public class SpreadsheetConverter {

    public static boolean isSpreadsheet(Path file) {
        String name = file.getFileName().toString().toUpperCase(Locale.ROOT);
        return name.endsWith(".XLS") || name.endsWith(".XLSX");
    }

    public Path convert(Path workbookFile, Path delimitedFile) throws IOException {
        log.info("Converting spreadsheet {} to {}", workbookFile, delimitedFile);
        DataFormatter formatter = new DataFormatter();
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setQuoteMode(QuoteMode.ALL)
                .build();

        int rowCount = 0;
        try (Workbook workbook = WorkbookFactory.create(workbookFile.toFile(), null, true);
             Writer writer = Files.newBufferedWriter(delimitedFile, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            Sheet sheet = workbook.getSheetAt(0);
            int headerWidth = cellCount(sheet.getRow(0));
            for (int r = 0; r <= sheet.getLastRowNum(); r++) {
                printer.printRecord(cellText(sheet.getRow(r), formatter, headerWidth));
                rowCount++;
            }
        }
        log.info("Converted {} spreadsheet rows", rowCount);
        return delimitedFile;
    }

    private static List<String> cellText(Row row, DataFormatter formatter, int minWidth) {
        int width = Math.max(cellCount(row), Math.max(minWidth, 1));
        List<String> values = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            Cell cell = row == null ? null : row.getCell(c);
            values.add(cell == null ? "" : formatter.formatCellValue(cell));
        }
        return values;
    }

    private static int cellCount(Row row) {
        return row == null ? 0 : Math.max(row.getLastCellNum(), 0);
    }
}
