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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * All records from one input file, partitioned by destination category.
 *
 * <p>Each partition keeps insertion order. A record is filed under the category stamped on it.
 */
public class RecordBatch {

    private final Map<DestinationCategory, List<MailingRecord>> partitions = new EnumMap<>(DestinationCategory.class);

    public RecordBatch() {
        for (DestinationCategory category : DestinationCategory.values()) {
            partitions.put(category, new ArrayList<>());
        }
    }

    /**
     * Files the record under its stamped destination.
     *
     * @throws IllegalStateException if the record has not been classified
     */
    public void add(MailingRecord record) {
        DestinationCategory category = record.getDestination();
        if (category == null) {
            throw new IllegalStateException("Record has no destination category: " + record);
        }
        partitions.get(category).add(record);
    }

    public List<MailingRecord> get(DestinationCategory category) {
        return Collections.unmodifiableList(partitions.get(category));
    }

    public int count(DestinationCategory category) {
        return partitions.get(category).size();
    }

    public int foreignCount() {
        return count(DestinationCategory.MEXICO) + count(DestinationCategory.CANADA)
                + count(DestinationCategory.OTHER_FOREIGN);
    }

    public int totalCount() {
        return foreignCount() + count(DestinationCategory.DOMESTIC);
    }

    /**
     * Every record, partition by partition in {@link DestinationCategory#EMISSION_ORDER}.
     */
    public List<MailingRecord> inEmissionOrder() {
        List<MailingRecord> all = new ArrayList<>(totalCount());
        for (DestinationCategory category : DestinationCategory.EMISSION_ORDER) {
            all.addAll(partitions.get(category));
        }
        return all;
    }
}
