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

/**
 * Immutable, ordered run of meaningful name/address lines.
 *
 * <p>Operations return new instances; the record the lines came from is never touched.
 */
public final class AddressLines {

    /**
     * Number of name line slots in a mailing block.
     */
    public static final int SLOT_COUNT = 8;

    private static final String NULL_MARKER = "NULL";

    private final List<String> lines;

    private AddressLines(List<String> lines) {
        this.lines = List.copyOf(lines);
    }

    /**
     * Drops blank entries and the literal {@code NULL} marker (any case), keeping the order of the rest.
     */
    public static AddressLines compact(List<String> rawLines) {
        List<String> kept = new ArrayList<>();
        for (String line : rawLines) {
            if (isMeaningful(line)) {
                kept.add(line);
            }
        }
        return new AddressLines(kept);
    }

    public static boolean isMeaningful(String line) {
        return line != null && !line.isBlank() && !NULL_MARKER.equalsIgnoreCase(line.trim());
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public String get(int index) {
        return lines.get(index);
    }

    /**
     * The last line, or an empty string when there are none.
     */
    public String last() {
        return lines.isEmpty() ? "" : lines.get(lines.size() - 1);
    }

    /**
     * The line {@code offset} positions before the last one.
     */
    public String fromEnd(int offset) {
        return lines.get(lines.size() - 1 - offset);
    }

    public AddressLines append(String line) {
        List<String> extended = new ArrayList<>(lines);
        extended.add(line);
        return new AddressLines(extended);
    }

    public AddressLines dropLast(int count) {
        if (count > lines.size()) {
            throw new IllegalArgumentException("Cannot drop " + count + " of " + lines.size() + " lines");
        }
        return new AddressLines(lines.subList(0, lines.size() - count));
    }

    /**
     * Lays the lines into exactly {@code slots} positions, filling the tail with empty strings.
     * Lines beyond the last slot are joined onto it with a single space.
     */
    public List<String> padTo(int slots) {
        List<String> out = new ArrayList<>(slots);
        if (lines.size() <= slots) {
            out.addAll(lines);
            out.addAll(Collections.nCopies(slots - lines.size(), ""));
            return List.copyOf(out);
        }
        out.addAll(lines.subList(0, slots - 1));
        out.add(String.join(" ", lines.subList(slots - 1, lines.size())));
        return List.copyOf(out);
    }

    public List<String> asList() {
        return lines;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AddressLines other && lines.equals(other.lines);
    }

    @Override
    public int hashCode() {
        return lines.hashCode();
    }

    @Override
    public String toString() {
        return lines.toString();
    }
}
