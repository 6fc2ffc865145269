/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.decode;

import com.escheat.mailing.model.CanonicalField;
import com.escheat.mailing.model.MailingRecord;

import java.util.List;

/**
 * Column layout of the flat-file input: 24 fields, 516 characters per record.
 *
 * <p>The flat file carries seven name/address lines and no address type, so
 * {@link CanonicalField#NAME_ADDRESS_8} and {@link CanonicalField#ADDRESS_TYPE} have no slot.
 */
public final class FixedWidthLayout {

    public record Slot(CanonicalField field, int width) {}

    public static final List<Slot> SLOTS = List.of(
            new Slot(CanonicalField.FILE_TRANSMISSION_DATE, 8),
            new Slot(CanonicalField.UPRR_JOB_NUMBER, 6),
            new Slot(CanonicalField.LT, 9),
            new Slot(CanonicalField.COMPANY_NAME, 40),
            new Slot(CanonicalField.COMPANY_NUMBER, 12),
            new Slot(CanonicalField.AST_SOURCE_FILE_DATE, 8),
            new Slot(CanonicalField.ACCOUNT_NUMBER, 19),
            new Slot(CanonicalField.NAME_ADDRESS_1, 40),
            new Slot(CanonicalField.NAME_ADDRESS_2, 40),
            new Slot(CanonicalField.NAME_ADDRESS_3, 40),
            new Slot(CanonicalField.NAME_ADDRESS_4, 40),
            new Slot(CanonicalField.NAME_ADDRESS_5, 40),
            new Slot(CanonicalField.NAME_ADDRESS_6, 40),
            new Slot(CanonicalField.NAME_ADDRESS_7, 40),
            new Slot(CanonicalField.VERIFICATION_CODE, 4),
            new Slot(CanonicalField.FILLER, 36),
            new Slot(CanonicalField.MAILING_CITY, 40),
            new Slot(CanonicalField.ZIP, 9),
            new Slot(CanonicalField.MAILING_STATE, 2),
            new Slot(CanonicalField.SHARES, 14),
            new Slot(CanonicalField.CERTIFIED, 1),
            new Slot(CanonicalField.LETTER_CODE, 2),
            new Slot(CanonicalField.SEQUENCE, 6),
            new Slot(CanonicalField.ESCHEATMENT_STATE, 20)
    );

    public static final int RECORD_LENGTH = SLOTS.stream().mapToInt(Slot::width).sum();

    private FixedWidthLayout() {}

    /**
     * Writes a record back into the flat-file layout. Values are left-justified and
     * space-padded, or cut off at the slot width.
     */
    public static String encode(MailingRecord record) {
        StringBuilder line = new StringBuilder(RECORD_LENGTH);
        for (Slot slot : SLOTS) {
            String value = record.get(slot.field());
            if (value.length() > slot.width()) {
                line.append(value, 0, slot.width());
            } else {
                line.append(value);
                line.append(" ".repeat(slot.width() - value.length()));
            }
        }
        return line.toString();
    }
}
