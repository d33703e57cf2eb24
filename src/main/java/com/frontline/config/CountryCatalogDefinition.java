package com.frontline.config;

import java.util.List;

/**
 * Root of a country catalog JSON file.
 *
 * @param id        catalog slug, e.g. "world"
 * @param name      human-readable name
 * @param countries the countries it defines
 */
public record CountryCatalogDefinition(
        String id,
        String name,
        List<CountryDefinition> countries
) {}
