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

/**
 * Destination mailing region of a record. The code is what gets stamped into the
 * {@link CanonicalField#ADDRESS_TYPE} field.
 */
public enum DestinationCategory {

    DOMESTIC("DOM"),
    CANADA("CAN"),
    MEXICO("MEX"),
    OTHER_FOREIGN("FGN");

    /**
     * Order in which partitions are emitted and sequence numbers are assigned.
     */
    public static final List<DestinationCategory> EMISSION_ORDER =
            List.of(MEXICO, CANADA, OTHER_FOREIGN, DOMESTIC);

    private final String code;

    DestinationCategory(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isForeign() {
        return this != DOMESTIC;
    }

    public static DestinationCategory fromCode(String code) {
        return Arrays.stream(values())
                .filter(c -> c.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown destination category code: " + code));
    }
}
