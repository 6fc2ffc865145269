/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.classify;

/**
 * ZIP code formatting for domestic records.
 */
public final class PostalCodeFormatter {

    private static final int ZIP5_LENGTH = 5;

    private PostalCodeFormatter() {}

    /**
     * Inserts the ZIP+4 hyphen after the fifth character when the code is longer than five
     * characters and has no hyphen yet. Anything else is returned unchanged, so applying
     * this twice gives the same result as applying it once.
     */
    public static String formatZip(String zip) {
        if (zip == null) {
            return "";
        }
        if (zip.length() > ZIP5_LENGTH && !zip.contains("-")) {
            return zip.substring(0, ZIP5_LENGTH) + "-" + zip.substring(ZIP5_LENGTH);
        }
        return zip;
    }
}
