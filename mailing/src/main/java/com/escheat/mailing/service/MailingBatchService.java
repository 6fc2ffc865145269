/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.service;

import com.escheat.mailing.classify.RecordClassifier;
import com.escheat.mailing.config.MailingConfig;
import com.escheat.mailing.decode.FixedWidthDecoder;
import com.escheat.mailing.decode.TabularDecoder;
import com.escheat.mailing.error.MailingBatchException;
import com.escheat.mailing.format.AddressBlockFormatter;
import com.escheat.mailing.io.CountsReporter;
import com.escheat.mailing.io.DelimitedTableReader;
import com.escheat.mailing.io.MailingOutputWriter;
import com.escheat.mailing.io.SpreadsheetConverter;
import com.escheat.mailing.model.CanonicalField;
import com.escheat.mailing.model.LetterCode;
import com.escheat.mailing.model.MailingRecord;
import com.escheat.mailing.model.RecordBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Runs one input file through decode, classify, sequence, format and write.
 *
 * <p>All four artifacts are written to a staging directory first and only moved into the
 * output directory once every one of them has been written. A failed move restores the
 * output directory to its previous contents.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailingBatchService {

    public static final List<String> ADDRESS_DATA_HEADER = List.of(
            "IM barcode Digits", "OEL", "Sack and Pack Numbers", "Presort Sequence",
            "Full Name", "Name2", "Name3", "Name4", "Name5", "Name6", "Name7", "Name8",
            "Delivery Address", "Alternate 1 Address", "City", "State", "ZIP+4", "LTNo", "SEQ"
    );

    static final String WORKBOOK_SHEET = "Records";

    private static final String PREVIOUS_SUFFIX = ".previous";

    private final MailingConfig config;
    private final FixedWidthDecoder fixedWidthDecoder;
    private final TabularDecoder tabularDecoder;
    private final SpreadsheetConverter spreadsheetConverter;
    private final DelimitedTableReader tableReader;
    private final RecordClassifier classifier;
    private final AddressBlockFormatter blockFormatter;
    private final MailingOutputWriter outputWriter;
    private final CountsReporter countsReporter;

    public record BatchResult(RecordBatch batch, String countsReport, List<Path> outputs) {}

    public BatchResult run(Path inputFile, LetterCode letterCode, Path outputDir) {
        log.info("Processing {} with letter code {} ({})", inputFile, letterCode, letterCode.getTemplateName());
        Path staging = createStagingDirectory(outputDir);
        try {
            List<MailingRecord> records = decode(inputFile, staging);
            RecordBatch batch = classifier.classify(records, letterCode);
            List<MailingRecord> emitted = assignSequence(batch);

            String fileName = inputFile.getFileName().toString();
            String countsReport = countsReporter.report(fileName, batch);
            List<Path> staged = writeOutputs(staging, fileName, emitted, countsReport);
            List<Path> published = publish(staged, outputDir);
            return new BatchResult(batch, countsReport, published);
        } catch (IOException e) {
            throw new MailingBatchException("I/O failure while processing " + inputFile, e);
        } finally {
            deleteQuietly(staging);
        }
    }

    List<MailingRecord> decode(Path inputFile, Path workDir) throws IOException {
        if (SpreadsheetConverter.isSpreadsheet(inputFile)) {
            log.info("Formatting data from spreadsheet");
            Path delimited = workDir.resolve(baseName(inputFile) + ".csv");
            spreadsheetConverter.convert(inputFile, delimited);
            List<MailingRecord> records = tabularDecoder.decode(tableReader.read(delimited));
            Files.delete(delimited);
            return records;
        }
        log.info("Formatting data from flat file");
        return fixedWidthDecoder.decodeAll(Files.readAllBytes(inputFile));
    }

    /**
     * Numbers every record from 1 in emission order and returns them in that order.
     */
    static List<MailingRecord> assignSequence(RecordBatch batch) {
        List<MailingRecord> emitted = batch.inEmissionOrder();
        int sequence = 1;
        for (MailingRecord record : emitted) {
            record.set(CanonicalField.SEQUENCE, String.valueOf(sequence++));
        }
        return emitted;
    }

    List<String> addressDataRow(MailingRecord record) {
        String sequence = record.get(CanonicalField.SEQUENCE);
        List<String> row = new ArrayList<>(ADDRESS_DATA_HEADER.size());
        row.add("");
        row.add("");
        row.add("");
        row.add(sequence);
        row.addAll(blockFormatter.format(record).columns());
        row.add(record.get(CanonicalField.LT));
        row.add(sequence);
        return row;
    }

    private List<Path> writeOutputs(Path staging, String inputFileName, List<MailingRecord> emitted,
                                    String countsReport) throws IOException {
        MailingConfig.Output names = config.getOutput();
        List<List<String>> staticRows = emitted.stream().map(MailingRecord::values).toList();
        List<List<String>> addressRows = emitted.stream().map(this::addressDataRow).toList();

        Path addressData = staging.resolve(names.getAddressDataFile());
        Path staticData = staging.resolve(names.getStaticDataFile());
        Path workbook = staging.resolve(baseName(Path.of(inputFileName)) + names.getWorkbookSuffix());
        Path counts = staging.resolve(names.getCountsFile());

        log.info("Writing records to delimited files");
        outputWriter.writeDelimited(addressData, ADDRESS_DATA_HEADER, addressRows);
        outputWriter.writeDelimited(staticData, CanonicalField.header(), staticRows);
        log.info("Writing records to workbook");
        outputWriter.writeWorkbook(workbook, WORKBOOK_SHEET, CanonicalField.header(), staticRows);
        countsReporter.write(counts, countsReport);
        return List.of(addressData, staticData, workbook, counts);
    }

    /**
     * Moves the staged files into the output directory. A file already at a target is first
     * moved aside into the staging directory. If any move fails, the files published so far are
     * removed and the moved-aside files are put back, so the output directory is left as it was.
     */
    static List<Path> publish(List<Path> staged, Path outputDir) throws IOException {
        List<Path> published = new ArrayList<>(staged.size());
        List<Path> backups = new ArrayList<>(staged.size());
        try {
            for (Path file : staged) {
                Path target = outputDir.resolve(file.getFileName().toString());
                Path backup = file.resolveSibling(file.getFileName() + PREVIOUS_SUFFIX);
                if (Files.exists(target)) {
                    Files.move(target, backup);
                    backups.add(backup);
                } else {
                    backups.add(null);
                }
                Files.move(file, target);
                published.add(target);
            }
        } catch (IOException e) {
            log.error("Publishing to {} failed, restoring previous outputs", outputDir);
            rollBack(published, backups, outputDir);
            throw e;
        }
        log.info("Published {} output files to {}", published.size(), outputDir);
        return published;
    }

    private static void rollBack(List<Path> published, List<Path> backups, Path outputDir) throws IOException {
        for (Path target : published) {
            Files.deleteIfExists(target);
        }
        for (Path backup : backups) {
            if (backup != null) {
                String name = backup.getFileName().toString();
                Path target = outputDir.resolve(name.substring(0, name.length() - PREVIOUS_SUFFIX.length()));
                Files.move(backup, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
    }

    private static Path createStagingDirectory(Path outputDir) {
        try {
            Files.createDirectories(outputDir);
            return Files.createTempDirectory(outputDir, ".mailing-staging-");
        } catch (IOException e) {
            throw new MailingBatchException("Unable to create staging directory in " + outputDir, e);
        }
    }

    private static void deleteQuietly(Path directory) {
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Could not remove staging directory {}: {}", directory, e.getMessage());
        }
    }

    static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
