/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.decode;

import com.escheat.mailing.error.RecordDecodingException;
import com.escheat.mailing.model.MailingRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Decodes flat-file input, one 516-character record per line.
 *
 * <p>Each line is decoded as UTF-8 and sanitized as a whole before it is sliced. Sanitizing
 * maps every code point to one ASCII character, so a multi-byte character such as a UTF-8
 * no-break space occupies one column, the same as in the source layout.
 */
@Slf4j
@Component
public class FixedWidthDecoder {

    private static final byte LF = '\n';
    private static final byte CR = '\r';

    /**
     * Decodes every line of a flat file. A trailing line terminator at end of file is allowed.
     *
     * @throws RecordDecodingException on the first line whose length is not {@link FixedWidthLayout#RECORD_LENGTH}
     */
    public List<MailingRecord> decodeAll(byte[] content) {
        List<MailingRecord> records = new ArrayList<>();
        int lineNumber = 0;
        int start = 0;
        while (start < content.length) {
            int end = indexOf(content, LF, start);
            int next = end < 0 ? content.length : end + 1;
            int lineEnd = end < 0 ? content.length : end;
            if (lineEnd > start && content[lineEnd - 1] == CR) {
                lineEnd--;
            }
            lineNumber++;
            records.add(decode(Arrays.copyOfRange(content, start, lineEnd), lineNumber));
            start = next;
        }
        log.info("Decoded {} flat-file records", records.size());
        return records;
    }

    /**
     * Decodes one line, terminator already removed.
     *
     * @throws RecordDecodingException if the sanitized line is not {@link FixedWidthLayout#RECORD_LENGTH} characters
     */
    public MailingRecord decode(byte[] line, int lineNumber) {
        String text = TextSanitizer.toPrintableAscii(line);
        if (text.length() != FixedWidthLayout.RECORD_LENGTH) {
            throw new RecordDecodingException(lineNumber, String.format(
                    "expected %d characters, found %d", FixedWidthLayout.RECORD_LENGTH, text.length()));
        }
        MailingRecord record = MailingRecord.empty();
        int offset = 0;
        for (FixedWidthLayout.Slot slot : FixedWidthLayout.SLOTS) {
            String value = text.substring(offset, offset + slot.width());
            record.set(slot.field(), TextSanitizer.collapseWhitespace(value));
            offset += slot.width();
        }
        return record;
    }

    private static int indexOf(byte[] content, byte target, int from) {
        for (int i = from; i < content.length; i++) {
            if (content[i] == target) {
                return i;
            }
        }
        return -1;
    }
}
