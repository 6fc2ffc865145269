/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.runner;

import com.escheat.mailing.TestRecords;
import com.escheat.mailing.classify.CountryInferenceHeuristic;
import com.escheat.mailing.classify.RecordClassifier;
import com.escheat.mailing.config.MailingConfig;
import com.escheat.mailing.decode.FieldMapper;
import com.escheat.mailing.decode.FixedWidthDecoder;
import com.escheat.mailing.decode.FixedWidthLayout;
import com.escheat.mailing.decode.StateLookupTable;
import com.escheat.mailing.decode.TabularDecoder;
import com.escheat.mailing.error.MailingBatchException;
import com.escheat.mailing.format.AddressBlockFormatter;
import com.escheat.mailing.io.CountsReporter;
import com.escheat.mailing.io.DelimitedTableReader;
import com.escheat.mailing.io.MailingOutputWriter;
import com.escheat.mailing.io.SpreadsheetConverter;
import com.escheat.mailing.service.MailingBatchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MailingBatchRunnerTest {

    @TempDir
    Path workDir;

    private MailingConfig config;
    private MailingBatchRunner runner;

    @BeforeEach
    void setUp() {
        config = new MailingConfig();
        config.setLetterCode("fa");
        MailingBatchService service = new MailingBatchService(
                config,
                new FixedWidthDecoder(),
                new TabularDecoder(new FieldMapper(), new StateLookupTable()),
                new SpreadsheetConverter(),
                new DelimitedTableReader(),
                new RecordClassifier(new CountryInferenceHeuristic()),
                new AddressBlockFormatter(),
                new MailingOutputWriter(),
                new CountsReporter());
        runner = new MailingBatchRunner(config, service);
    }

    private Path writeInput() throws Exception {
        String line = FixedWidthLayout.encode(TestRecords.builder()
                .lines("JOHN DOE", "123 MAIN ST")
                .city("SPRINGFIELD")
                .state("IL")
                .zip("62701")
                .build());
        Path input = workDir.resolve("batch.txt");
        Files.writeString(input, line + "\n", StandardCharsets.US_ASCII);
        return input;
    }

    @Test
    @DisplayName("Command-line argument takes priority over the configured input file")
    void shouldPreferArgumentOverConfig() {
        config.setInputFile("configured.txt");

        assertEquals(Optional.of(Path.of("arg.txt")), runner.resolveInput(List.of("arg.txt")));
        assertEquals(Optional.of(Path.of("configured.txt")), runner.resolveInput(List.of()));
    }

    @Test
    void shouldResolveNothingWithoutArgumentOrConfig() {
        config.setInputFile("  ");

        assertEquals(Optional.empty(), runner.resolveInput(List.of()));
    }

    @Test
    @DisplayName("Outputs default to the input file's directory")
    void shouldWriteNextToInput() throws Exception {
        Path input = writeInput();

        runner.run(new DefaultApplicationArguments(input.toString()));

        assertTrue(Files.exists(workDir.resolve("StaticData.dat")));
        assertTrue(Files.exists(workDir.resolve("batch_rev.xlsx")));
        String staticData = Files.readString(workDir.resolve("StaticData.dat"));
        assertTrue(staticData.contains("\"FA\""));
    }

    @Test
    void shouldWriteToConfiguredOutputDirectory() throws Exception {
        Path input = writeInput();
        Path out = workDir.resolve("results");
        config.setOutputDir(out.toString());

        runner.run(new DefaultApplicationArguments("--verbose", input.toString()));

        assertTrue(Files.exists(out.resolve("COUNTS.txt")));
        assertFalse(Files.exists(workDir.resolve("COUNTS.txt")));
    }

    @Test
    void shouldRejectUnknownLetterCode() throws Exception {
        Path input = writeInput();
        config.setLetterCode("ZZ");

        assertThrows(IllegalArgumentException.class,
                () -> runner.run(new DefaultApplicationArguments(input.toString())));
    }

    @Test
    void shouldRethrowBatchFailure() throws Exception {
        Path input = workDir.resolve("broken.txt");
        Files.writeString(input, "SHORT\n");

        assertThrows(MailingBatchException.class,
                () -> runner.run(new DefaultApplicationArguments(input.toString())));
        assertFalse(Files.exists(workDir.resolve("COUNTS.txt")));
    }

    @Test
    void shouldDoNothingWithoutInput() {
        assertDoesNotThrow(() -> runner.run(new DefaultApplicationArguments()));
    }
}
