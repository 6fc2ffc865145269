/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.decode;

import com.escheat.mailing.model.CanonicalField;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Source column index resolved for each canonical field, plus the header diagnostics
 * collected while resolving. The diagnostics are informational only.
 */
public final class FieldMapping {

    private final Map<CanonicalField, Integer> indices;
    private final List<String> matchedColumns;
    private final List<String> unmatchedColumns;
    private final List<CanonicalField> unresolvedFields;

    FieldMapping(Map<CanonicalField, Integer> indices,
                 List<String> matchedColumns,
                 List<String> unmatchedColumns,
                 List<CanonicalField> unresolvedFields) {
        this.indices = new EnumMap<>(CanonicalField.class);
        this.indices.putAll(indices);
        this.matchedColumns = List.copyOf(matchedColumns);
        this.unmatchedColumns = List.copyOf(unmatchedColumns);
        this.unresolvedFields = List.copyOf(unresolvedFields);
    }

    /**
     * Column index for the field, or empty when no header column matched it.
     */
    public OptionalInt indexOf(CanonicalField field) {
        Integer index = indices.get(field);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    /**
     * Header columns claimed by at least one canonical field, in canonical field order.
     */
    public List<String> getMatchedColumns() {
        return matchedColumns;
    }

    /**
     * Header columns no canonical field claimed, in header order.
     */
    public List<String> getUnmatchedColumns() {
        return unmatchedColumns;
    }

    public List<CanonicalField> getUnresolvedFields() {
        return unresolvedFields;
    }
}
