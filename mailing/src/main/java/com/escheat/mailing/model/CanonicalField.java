/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.model;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The 26 canonical fields every mailing record is normalized into.
 *
 * <p>Declaration order is the output column order everywhere downstream. Each field
 * carries the header pattern used to locate it in a spreadsheet export; patterns are
 * case-sensitive and only need to match at the start of a header column.
 */
public enum CanonicalField {

    FILE_TRANSMISSION_DATE("FileTransmissionDate", "FileTransmissionDate"),
    UPRR_JOB_NUMBER("UPRR Job Number", "UPRR\\s?Job\\s?Number"),
    LT("LT", "XRX\\s?Acct\\s?Seq"),
    COMPANY_NAME("Company Name", "Issue\\s?Name"),
    COMPANY_NUMBER("Company Number", "Company"),
    AST_SOURCE_FILE_DATE("ASTSourceFileDate", "ASTSourceFileDate"),
    ACCOUNT_NUMBER("Account Number", "Account\\s?(Number)?"),
    NAME_ADDRESS_1("NameAddress1", "Name/?\\s?Address\\s?1"),
    NAME_ADDRESS_2("NameAddress2", "Name/?\\s?Address\\s?2"),
    NAME_ADDRESS_3("NameAddress3", "Name/?\\s?Address\\s?3"),
    NAME_ADDRESS_4("NameAddress4", "Name/?\\s?Address\\s?4"),
    NAME_ADDRESS_5("NameAddress5", "Name/?\\s?Address\\s?5"),
    NAME_ADDRESS_6("NameAddress6", "Name/?\\s?Address\\s?6"),
    NAME_ADDRESS_7("NameAddress7", "Name/?\\s?Address\\s?7"),
    NAME_ADDRESS_8("NameAddress8", "Name/?\\s?Address\\s?8"),
    VERIFICATION_CODE("Verification Code", "Verification\\s?Code"),
    FILLER("Filler", "Filler"),
    MAILING_CITY("Mailing City", "City"),
    ZIP("Zip", "Zip"),
    MAILING_STATE("Mailing State", "(Mailing\\s?)?State"),
    SHARES("Shares", "Eligible\\s?Shares"),
    CERTIFIED("Certified", "Certified"),
    LETTER_CODE("LetterCode", "Letter\\s?Code"),
    SEQUENCE("Sequence", "Sequence"),
    ESCHEATMENT_STATE("Escheatment State", "(Escheatment|Eligibility)\\s?State"),
    ADDRESS_TYPE("AddressType", "Address\\s?Type");

    /**
     * The eight name/address line fields, in order.
     */
    public static final List<CanonicalField> NAME_ADDRESS_LINES = List.of(
            NAME_ADDRESS_1, NAME_ADDRESS_2, NAME_ADDRESS_3, NAME_ADDRESS_4,
            NAME_ADDRESS_5, NAME_ADDRESS_6, NAME_ADDRESS_7, NAME_ADDRESS_8
    );

    private static final List<String> HEADER = Arrays.stream(values())
            .map(CanonicalField::getHeaderName)
            .toList();

    private final String headerName;
    private final Pattern headerPattern;

    CanonicalField(String headerName, String headerRegex) {
        this.headerName = headerName;
        this.headerPattern = Pattern.compile(headerRegex);
    }

    public String getHeaderName() {
        return headerName;
    }

    /**
     * Returns true when the header pattern matches at the start of the column name.
     */
    public boolean matchesHeader(String column) {
        return headerPattern.matcher(column).lookingAt();
    }

    /**
     * The canonical header row, in output column order.
     */
    public static List<String> header() {
        return HEADER;
    }

    public static int count() {
        return HEADER.size();
    }
}
