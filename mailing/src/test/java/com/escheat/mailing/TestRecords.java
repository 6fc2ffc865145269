/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing;

import com.escheat.mailing.model.CanonicalField;
import com.escheat.mailing.model.MailingRecord;

/**
 * Fluent builder for records used across tests.
 */
public final class TestRecords {

    private final MailingRecord record = MailingRecord.empty();

    private TestRecords() {}

    public static TestRecords builder() {
        return new TestRecords();
    }

    public TestRecords set(CanonicalField field, String value) {
        record.set(field, value);
        return this;
    }

    /**
     * Fills NameAddress1.. in order with the given lines.
     */
    public TestRecords lines(String... lines) {
        for (int i = 0; i < lines.length; i++) {
            record.set(CanonicalField.NAME_ADDRESS_LINES.get(i), lines[i]);
        }
        return this;
    }

    public TestRecords city(String city) {
        return set(CanonicalField.MAILING_CITY, city);
    }

    public TestRecords state(String state) {
        return set(CanonicalField.MAILING_STATE, state);
    }

    public TestRecords zip(String zip) {
        return set(CanonicalField.ZIP, zip);
    }

    public MailingRecord build() {
        return record;
    }
}
