/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.config;

import com.escheat.mailing.model.LetterCode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "mailing")
public class MailingConfig {

    private String letterCode;
    private String inputFile;
    private String outputDir;
    private Output output = new Output();

    @Data
    public static class Output {
        private String staticDataFile = "StaticData.dat";
        private String addressDataFile = "AddressData.csv";
        private String countsFile = "COUNTS.txt";
        private String workbookSuffix = "_rev.xlsx";
    }

    /**
     * Resolves the configured template code.
     *
     * @throws IllegalArgumentException if no code is configured or it is not a known code
     */
    public LetterCode resolveLetterCode() {
        return LetterCode.parse(letterCode);
    }
}
