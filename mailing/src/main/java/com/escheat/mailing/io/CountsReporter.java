/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.io;

import com.escheat.mailing.model.DestinationCategory;
import com.escheat.mailing.model.RecordBatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Per-category record counts for the operator.
 */
@Slf4j
@Component
public class CountsReporter {

    static final String LINE_SEPARATOR = "\r\n";

    public String report(String inputFileName, RecordBatch batch) {
        return String.join(LINE_SEPARATOR,
                "Filename: " + inputFileName,
                "Domestic count: " + batch.count(DestinationCategory.DOMESTIC),
                "Foreign count: " + batch.foreignCount(),
                "Total Records: " + batch.totalCount(),
                "",
                "Mexico count: " + batch.count(DestinationCategory.MEXICO),
                "Canada count: " + batch.count(DestinationCategory.CANADA),
                "Other count: " + batch.count(DestinationCategory.OTHER_FOREIGN));
    }

    public void write(Path file, String report) throws IOException {
        Files.writeString(file, report, StandardCharsets.UTF_8);
        log.info("Record counts:{}{}", System.lineSeparator(), report);
    }
}
