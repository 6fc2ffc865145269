/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.classify;

import com.escheat.mailing.model.CanonicalField;
import com.escheat.mailing.model.DestinationCategory;
import com.escheat.mailing.model.LetterCode;
import com.escheat.mailing.model.MailingRecord;
import com.escheat.mailing.model.RecordBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Stamps the letter code on every record and partitions the records by destination.
 *
 * <p>A mailing state of {@code FO} marks a foreign record: its ZIP is blanked and the country
 * is inferred by {@link CountryInferenceHeuristic}. Every other record is domestic and gets
 * its ZIP formatted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecordClassifier {

    static final String FOREIGN_STATE_CODE = "FO";

    private final CountryInferenceHeuristic countryInference;

    public RecordBatch classify(List<MailingRecord> records, LetterCode letterCode) {
        RecordBatch batch = new RecordBatch();
        List<MailingRecord> foreign = new ArrayList<>();

        for (MailingRecord record : records) {
            record.set(CanonicalField.LETTER_CODE, letterCode.name());

            if (FOREIGN_STATE_CODE.equals(record.get(CanonicalField.MAILING_STATE))) {
                record.set(CanonicalField.ZIP, "");
                foreign.add(record);
            } else {
                record.set(CanonicalField.ZIP, PostalCodeFormatter.formatZip(record.get(CanonicalField.ZIP)));
                record.setDestination(DestinationCategory.DOMESTIC);
                batch.add(record);
            }
        }

        for (MailingRecord record : countryInference.assignCountries(foreign)) {
            batch.add(record);
        }

        log.info("Classified {} records: {} domestic, {} Canada, {} Mexico, {} other foreign",
                batch.totalCount(),
                batch.count(DestinationCategory.DOMESTIC),
                batch.count(DestinationCategory.CANADA),
                batch.count(DestinationCategory.MEXICO),
                batch.count(DestinationCategory.OTHER_FOREIGN));
        return batch;
    }
}
