/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Print-ready address block: eight name lines, the delivery and alternate address lines,
 * then city, state and ZIP.
 */
public record MailingBlock(
        List<String> nameLines,
        String deliveryAddress,
        String alternateAddress,
        String city,
        String state,
        String zip
) {
    public static final int COLUMN_COUNT = AddressLines.SLOT_COUNT + 5;

    public MailingBlock {
        Objects.requireNonNull(nameLines, "nameLines must not be null");
        if (nameLines.size() != AddressLines.SLOT_COUNT) {
            throw new IllegalArgumentException(
                    "Mailing block needs " + AddressLines.SLOT_COUNT + " name lines, got " + nameLines.size());
        }
        nameLines = List.copyOf(nameLines);
        deliveryAddress = Objects.requireNonNullElse(deliveryAddress, "");
        alternateAddress = Objects.requireNonNullElse(alternateAddress, "");
        city = Objects.requireNonNullElse(city, "");
        state = Objects.requireNonNullElse(state, "");
        zip = Objects.requireNonNullElse(zip, "");
    }

    /**
     * The block as output columns: Name1..Name8, DeliveryAddress, AlternateAddress, City, State, Zip.
     */
    public List<String> columns() {
        List<String> columns = new ArrayList<>(COLUMN_COUNT);
        columns.addAll(nameLines);
        columns.add(deliveryAddress);
        columns.add(alternateAddress);
        columns.add(city);
        columns.add(state);
        columns.add(zip);
        return columns;
    }
}
