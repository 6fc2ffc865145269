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
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a comma-delimited file into rows of cells. The first row is the header.
 *
 * <p>Empty lines are kept as rows with a single empty cell, so a blank separator row still
 * reaches the decoder as the end-of-data marker.
 */
@Slf4j
@Component
public class DelimitedTableReader {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(false)
            .build();

    public List<List<String>> read(Path file) throws IOException {
        List<List<String>> table = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord csvRecord : parser) {
                List<String> row = new ArrayList<>(csvRecord.size());
                for (String value : csvRecord) {
                    row.add(value);
                }
                table.add(row);
            }
        }
        log.debug("Read {} rows from {}", table.size(), file);
        return table;
    }
}
