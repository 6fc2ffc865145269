/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.decode;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Reduces raw field text to printable 7-bit ASCII with single spaces between words.
 *
 * <p>Every code point becomes exactly one character, so sanitized text keeps the character
 * positions of its source. Substitutions, each to a single space:
 * <ul>
 *   <li>bytes that are not valid UTF-8 (decoded to U+FFFD first)</li>
 *   <li>U+FFFD replacement character, U+00A0 no-break space, U+00A6 broken bar</li>
 *   <li>any other code point above U+007F</li>
 *   <li>ASCII control characters other than whitespace, and DEL</li>
 * </ul>
 */
public final class TextSanitizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextSanitizer() {}

    /**
     * Decodes raw input bytes as UTF-8 and sanitizes them without collapsing whitespace.
     */
    public static String toPrintableAscii(byte[] raw) {
        return toPrintableAscii(new String(raw, StandardCharsets.UTF_8));
    }

    /**
     * Sanitizes and whitespace-collapses one field that is already text.
     */
    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        return collapseWhitespace(toPrintableAscii(raw));
    }

    public static String toPrintableAscii(String text) {
        StringBuilder out = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> out.append(isPrintableAscii(cp) ? (char) cp : ' '));
        return out.toString();
    }

    public static String collapseWhitespace(String text) {
        return WHITESPACE_RUN.matcher(text).replaceAll(" ").trim();
    }

    private static boolean isPrintableAscii(int codePoint) {
        if (codePoint > 0x7E) {
            return false;
        }
        return codePoint >= 0x20 || Character.isWhitespace(codePoint);
    }
}
