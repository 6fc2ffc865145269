/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.classify;

import com.escheat.mailing.model.AddressLines;
import com.escheat.mailing.model.CanonicalField;
import com.escheat.mailing.model.DestinationCategory;
import com.escheat.mailing.model.MailingRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.BiPredicate;
import java.util.regex.Pattern;

/**
 * Splits records already known to be foreign into Canada, Mexico and other-foreign.
 *
 * <p>There is no country field in the source data. Evidence comes from the mailing city and
 * from the last meaningful name/address line. Rules are tried in priority order; a rule whose
 * evidence matches can still be vetoed by an exclusion pattern tested against the city, in
 * which case the next rule is tried. Records no rule claims are other-foreign.
 */
@Slf4j
@Component
public class CountryInferenceHeuristic {

    static final Pattern CANADA_POSTAL_CODE = Pattern.compile(
            "\\b[ABCEGHJ-NPRSTVXY][0-9][ABCEGHJ-NPRSTV-Z](\\s|-)?[0-9][ABCEGHJ-NPRSTV-Z][0-9]\\b",
            Pattern.CASE_INSENSITIVE);

    // Province abbreviation followed by the forward sortation area, e.g. "QC H2X"
    static final Pattern ONTARIO_QUEBEC_POSTAL = Pattern.compile(
            "\\b(ON|QC)\\s[ABCEGHJ-NPRSTVXY][0-9][ABCEGHJ-NPRSTV-Z]",
            Pattern.CASE_INSENSITIVE);

    static final Pattern CANADA_KEYWORDS = Pattern.compile(
            "\\b(CANADA|TORONTO|ONTARIO|QUEBEC|ALBERTA|MONTREAL)\\b",
            Pattern.CASE_INSENSITIVE);

    static final Pattern CANADA_PLACES = PlaceNames.wholeWords(PlaceNames.CANADA);

    static final Pattern CANADA_EXCLUSIONS = Pattern.compile(
            "\\b(LONDON|UK|UNIT|GBR|AUS(TRALIA)?)\\b",
            Pattern.CASE_INSENSITIVE);

    static final Pattern MEXICO_PLACES = PlaceNames.wholeWords(PlaceNames.MEXICO);

    static final Pattern MEXICO_EXCLUSIONS = Pattern.compile(
            "\\b(SPAIN|ESPANA|ITALY)\\b",
            Pattern.CASE_INSENSITIVE);

    /**
     * One country test: evidence over (city, last address line), vetoed by a city pattern.
     */
    record CountryRule(DestinationCategory category,
                       BiPredicate<String, String> evidence,
                       Pattern cityVeto) {

        boolean hasEvidence(String city, String lastAddressLine) {
            return evidence.test(city, lastAddressLine);
        }

        boolean isVetoed(String city) {
            return cityVeto.matcher(city).find();
        }
    }

    private static final List<CountryRule> RULES = List.of(
            new CountryRule(DestinationCategory.CANADA,
                    (city, lastLine) -> CANADA_POSTAL_CODE.matcher(city).find()
                            || ONTARIO_QUEBEC_POSTAL.matcher(city).find()
                            || CANADA_KEYWORDS.matcher(lastLine).find()
                            || CANADA_PLACES.matcher(city).find(),
                    CANADA_EXCLUSIONS),
            new CountryRule(DestinationCategory.MEXICO,
                    (city, lastLine) -> MEXICO_PLACES.matcher(city).find(),
                    MEXICO_EXCLUSIONS)
    );

    /**
     * Sorts the records by mailing city, then stamps each with its inferred country.
     *
     * @return the records in city order
     */
    public List<MailingRecord> assignCountries(Collection<MailingRecord> foreignRecords) {
        List<MailingRecord> sorted = sortByCity(foreignRecords);
        for (MailingRecord record : sorted) {
            record.setDestination(infer(record));
        }
        return sorted;
    }

    /**
     * Stable, case-sensitive lexical sort on the mailing city.
     */
    public List<MailingRecord> sortByCity(Collection<MailingRecord> records) {
        List<MailingRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing((MailingRecord r) -> r.get(CanonicalField.MAILING_CITY)));
        return sorted;
    }

    /**
     * Infers the destination of one foreign record without modifying it.
     */
    public DestinationCategory infer(MailingRecord record) {
        String city = record.get(CanonicalField.MAILING_CITY);
        String lastAddressLine = AddressLines.compact(record.nameAddressLines()).last();
        return infer(city, lastAddressLine);
    }

    DestinationCategory infer(String city, String lastAddressLine) {
        for (CountryRule rule : RULES) {
            if (!rule.hasEvidence(city, lastAddressLine)) {
                continue;
            }
            if (rule.isVetoed(city)) {
                log.debug("{} evidence for city '{}' vetoed by exclusion keyword", rule.category(), city);
                continue;
            }
            return rule.category();
        }
        return DestinationCategory.OTHER_FOREIGN;
    }
}
