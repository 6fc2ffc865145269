/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One mailing record: exactly one string value per {@link CanonicalField}, in canonical order.
 *
 * <p>Absent source values are held as empty strings, never null. Records are mutated in place
 * by classification and sequence assignment and are not read again once written.
 */
public final class MailingRecord {

    private final List<String> values;

    private MailingRecord(List<String> values) {
        this.values = values;
    }

    /**
     * Creates a record with every field empty.
     */
    public static MailingRecord empty() {
        return new MailingRecord(new ArrayList<>(Collections.nCopies(CanonicalField.count(), "")));
    }

    /**
     * Creates a record from values given in canonical order.
     *
     * @throws IllegalArgumentException if the number of values differs from the canonical field count
     */
    public static MailingRecord of(List<String> values) {
        if (values.size() != CanonicalField.count()) {
            throw new IllegalArgumentException(String.format(
                    "Record must have %d values, got %d", CanonicalField.count(), values.size()));
        }
        List<String> copy = new ArrayList<>(values.size());
        for (String value : values) {
            copy.add(value == null ? "" : value);
        }
        return new MailingRecord(copy);
    }

    public String get(CanonicalField field) {
        return values.get(field.ordinal());
    }

    public void set(CanonicalField field, String value) {
        values.set(field.ordinal(), value == null ? "" : value);
    }

    /**
     * The eight name/address lines as stored, blanks included.
     */
    public List<String> nameAddressLines() {
        return CanonicalField.NAME_ADDRESS_LINES.stream()
                .map(this::get)
                .toList();
    }

    public DestinationCategory getDestination() {
        String code = get(CanonicalField.ADDRESS_TYPE);
        return code.isEmpty() ? null : DestinationCategory.fromCode(code);
    }

    public void setDestination(DestinationCategory category) {
        set(CanonicalField.ADDRESS_TYPE, category.getCode());
    }

    /**
     * All values in canonical order, as an unmodifiable snapshot.
     */
    public List<String> values() {
        return List.copyOf(values);
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MailingRecord other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "MailingRecord" + values;
    }
}
