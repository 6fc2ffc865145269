/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.decode;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.PropertiesLoaderUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Two-letter US state and territory abbreviations mapped to full names.
 * Loaded once from the classpath and immutable afterwards.
 */
@Slf4j
@Component
public class StateLookupTable {

    static final String RESOURCE = "us-states.properties";

    private final Map<String, String> namesByAbbreviation;

    public StateLookupTable() {
        this(RESOURCE);
    }

    StateLookupTable(String resourcePath) {
        try {
            Properties properties = PropertiesLoaderUtils.loadProperties(new ClassPathResource(resourcePath));
            Map<String, String> names = new HashMap<>();
            for (String abbreviation : properties.stringPropertyNames()) {
                names.put(abbreviation, properties.getProperty(abbreviation));
            }
            this.namesByAbbreviation = Map.copyOf(names);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to load state lookup table from " + resourcePath, e);
        }
        log.info("Loaded {} state and territory names", namesByAbbreviation.size());
    }

    public Optional<String> findName(String abbreviation) {
        return Optional.ofNullable(namesByAbbreviation.get(abbreviation));
    }

    public int size() {
        return namesByAbbreviation.size();
    }
}
