/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.format;

import com.escheat.mailing.model.AddressLines;
import com.escheat.mailing.model.CanonicalField;
import com.escheat.mailing.model.DestinationCategory;
import com.escheat.mailing.model.MailingBlock;
import com.escheat.mailing.model.MailingRecord;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Builds the print vendor's mailing block from a classified record.
 *
 * <p>Foreign records fold the city into the name lines and leave the delivery, alternate,
 * city, state and ZIP columns empty. Domestic records take the last meaningful line as the
 * delivery address, unless it looks like an apartment or suite qualifier and there is a line
 * before it to serve as the street; then the qualifier becomes the alternate address.
 */
@Component
public class AddressBlockFormatter {

    static final Pattern SECONDARY_UNIT = Pattern.compile(
            "^((#|B(UI)?LD(IN)?G|SUITE|LOT|UNIT|FLOOR|R(OO)?M|AP(ARTMEN)?T).+"
                    + "|(\\d{1,4}\\s?\\w)"
                    + "|(\\d{1,3}(ST|ND|RD|TH)?\\s?FL(OO)?R?))$",
            Pattern.CASE_INSENSITIVE);

    /**
     * Fewer compacted lines than this means there is no street line to pick out.
     */
    private static final int MIN_LINES_FOR_DELIVERY = 2;

    public MailingBlock format(MailingRecord record) {
        DestinationCategory destination = record.getDestination();
        if (destination == null) {
            throw new IllegalStateException("Record must be classified before formatting: " + record);
        }
        AddressLines lines = AddressLines.compact(record.nameAddressLines());
        if (destination.isForeign()) {
            return formatForeign(lines, record.get(CanonicalField.MAILING_CITY));
        }
        return formatDomestic(lines,
                record.get(CanonicalField.MAILING_CITY),
                record.get(CanonicalField.MAILING_STATE),
                record.get(CanonicalField.ZIP));
    }

    MailingBlock formatForeign(AddressLines lines, String city) {
        return new MailingBlock(lines.append(city).padTo(AddressLines.SLOT_COUNT), "", "", "", "", "");
    }

    MailingBlock formatDomestic(AddressLines lines, String city, String state, String zip) {
        if (lines.size() < MIN_LINES_FOR_DELIVERY) {
            return new MailingBlock(lines.padTo(AddressLines.SLOT_COUNT), "", "", city, state, zip);
        }

        if (isSecondaryUnit(lines.last()) && lines.size() > MIN_LINES_FOR_DELIVERY) {
            return new MailingBlock(lines.dropLast(2).padTo(AddressLines.SLOT_COUNT),
                    lines.fromEnd(1), lines.last(), city, state, zip);
        }
        return new MailingBlock(lines.dropLast(1).padTo(AddressLines.SLOT_COUNT),
                lines.last(), "", city, state, zip);
    }

    /**
     * Whether the line reads as an apartment, suite, unit, lot, room, building or floor designator.
     */
    public static boolean isSecondaryUnit(String line) {
        return SECONDARY_UNIT.matcher(line).matches();
    }
}
