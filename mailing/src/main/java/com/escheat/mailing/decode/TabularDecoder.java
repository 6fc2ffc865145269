/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.decode;

import com.escheat.mailing.error.UnknownStateException;
import com.escheat.mailing.model.CanonicalField;
import com.escheat.mailing.model.MailingRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Decodes a delimited table (header row first) into canonical records.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TabularDecoder {

    /**
     * Number of leading cells that must all be empty to mark the end of data.
     */
    static final int END_OF_DATA_CELLS = 5;

    private final FieldMapper fieldMapper;
    private final StateLookupTable stateLookupTable;

    /**
     * Decodes every data row up to the end-of-data sentinel row.
     *
     * @throws UnknownStateException if a row's escheatment state is not a known abbreviation
     */
    public List<MailingRecord> decode(List<List<String>> table) {
        if (table.isEmpty()) {
            log.warn("Table has no header row, nothing to decode");
            return List.of();
        }
        FieldMapping mapping = fieldMapper.map(table.get(0));

        List<MailingRecord> records = new ArrayList<>();
        for (int rowIndex = 1; rowIndex < table.size(); rowIndex++) {
            List<String> row = table.get(rowIndex);
            if (isEndOfData(row)) {
                log.debug("End of data at row {}", rowIndex + 1);
                break;
            }
            records.add(decodeRow(row, mapping, rowIndex + 1));
        }
        log.info("Decoded {} table records", records.size());
        return records;
    }

    MailingRecord decodeRow(List<String> row, FieldMapping mapping, int rowNumber) {
        MailingRecord record = MailingRecord.empty();
        for (CanonicalField field : CanonicalField.values()) {
            OptionalInt index = mapping.indexOf(field);
            if (index.isPresent()) {
                record.set(field, TextSanitizer.clean(cell(row, index.getAsInt())));
            }
        }

        String abbreviation = record.get(CanonicalField.ESCHEATMENT_STATE);
        String stateName = stateLookupTable.findName(abbreviation)
                .orElseThrow(() -> new UnknownStateException(rowNumber, abbreviation));
        record.set(CanonicalField.ESCHEATMENT_STATE, stateName);

        if (record.get(CanonicalField.LT).isEmpty()) {
            record.set(CanonicalField.LT,
                    record.get(CanonicalField.COMPANY_NUMBER) + record.get(CanonicalField.ACCOUNT_NUMBER));
        }
        return record;
    }

    static boolean isEndOfData(List<String> row) {
        for (int i = 0; i < END_OF_DATA_CELLS; i++) {
            String value = cell(row, i);
            if (!value.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static String cell(List<String> row, int index) {
        if (index >= row.size()) {
            return "";
        }
        String value = row.get(index);
        return value == null ? "" : value;
    }
}
