/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.runner;

import com.escheat.mailing.config.MailingConfig;
import com.escheat.mailing.error.MailingBatchException;
import com.escheat.mailing.model.LetterCode;
import com.escheat.mailing.service.MailingBatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Command-line entry: processes the input file named by the first plain argument,
 * or by {@code mailing.input-file}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MailingBatchRunner implements ApplicationRunner {

    private final MailingConfig config;
    private final MailingBatchService batchService;

    @Override
    public void run(ApplicationArguments args) {
        Optional<Path> input = resolveInput(args.getNonOptionArgs());
        if (input.isEmpty()) {
            log.warn("No input file given, nothing to process");
            return;
        }

        Path inputFile = input.get().toAbsolutePath();
        LetterCode letterCode = config.resolveLetterCode();
        Path outputDir = config.getOutputDir() == null || config.getOutputDir().isBlank()
                ? inputFile.getParent()
                : Path.of(config.getOutputDir()).toAbsolutePath();

        try {
            MailingBatchService.BatchResult result = batchService.run(inputFile, letterCode, outputDir);
            log.info("Finished {}: {} records, outputs {}", inputFile.getFileName(),
                    result.batch().totalCount(), result.outputs());
        } catch (MailingBatchException e) {
            log.error("Batch aborted for {}, no output written: {}", inputFile, e.getMessage());
            throw e;
        }
    }

    Optional<Path> resolveInput(List<String> nonOptionArgs) {
        if (!nonOptionArgs.isEmpty()) {
            return Optional.of(Path.of(nonOptionArgs.get(0)));
        }
        if (config.getInputFile() != null && !config.getInputFile().isBlank()) {
            return Optional.of(Path.of(config.getInputFile()));
        }
        return Optional.empty();
    }
}
