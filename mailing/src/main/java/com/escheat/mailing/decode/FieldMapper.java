/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.decode;

import com.escheat.mailing.model.CanonicalField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves each canonical field to a column of an arbitrary header row.
 *
 * <p>Fields are resolved independently, in canonical order: each takes the leftmost column
 * its pattern matches at the start of the name. Two fields may resolve to the same column.
 */
@Slf4j
@Component
public class FieldMapper {

    public FieldMapping map(List<String> header) {
        List<String> columns = header.stream()
                .map(column -> column == null ? "" : TextSanitizer.collapseWhitespace(column))
                .toList();

        Map<CanonicalField, Integer> indices = new EnumMap<>(CanonicalField.class);
        Set<Integer> claimed = new LinkedHashSet<>();
        List<String> matchedColumns = new ArrayList<>();
        List<CanonicalField> unresolved = new ArrayList<>();

        for (CanonicalField field : CanonicalField.values()) {
            int found = -1;
            for (int i = 0; i < columns.size(); i++) {
                if (field.matchesHeader(columns.get(i))) {
                    found = i;
                    break;
                }
            }
            if (found < 0) {
                unresolved.add(field);
                continue;
            }
            indices.put(field, found);
            matchedColumns.add(columns.get(found));
            claimed.add(found);
        }

        List<String> unmatchedColumns = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            if (!claimed.contains(i)) {
                unmatchedColumns.add(columns.get(i));
            }
        }

        log.info("Fields found: {}", matchedColumns);
        if (!unmatchedColumns.isEmpty()) {
            log.warn("Header columns not used: {}", unmatchedColumns);
        }
        if (!unresolved.isEmpty()) {
            log.warn("Fields not found, left empty: {}",
                    unresolved.stream().map(CanonicalField::getHeaderName).toList());
        }

        return new FieldMapping(indices, matchedColumns, unmatchedColumns, unresolved);
    }
}
