package com.frontline.config;

import com.frontline.model.Country;
import com.frontline.model.TerrainType;
import com.frontline.repository.CountryRepository;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads country definitions at startup and seeds the country store.
 * <p>
 * Catalogs are loaded from two locations (in order):
 * <ol>
 *   <li>Classpath: {@code classpath:countries/*.json} – built-in catalogs shipped with the app</li>
 *   <li>External folder: {@code ./countries/} next to the running jar – custom catalogs</li>
 * </ol>
 * A country defined externally with the same {@code id} as a built-in one wins.
 * Countries already present in the store are left untouched.
 */
@Component
@Slf4j
public class CountryCatalogLoader {

    private final ObjectMapper objectMapper;
    private final CountryRepository countryRepository;

    /** All loaded definitions keyed by country id. */
    private final Map<String, CountryDefinition> definitions = new LinkedHashMap<>();

    @Value("${game.country.max-soldiers:50}")
    private int defaultMaxSoldiers;

    @Value("${game.country.starting-resources:1000}")
    private int startingResources;

    @Value("${game.country.external-dir:countries}")
    private String externalDir;

    public CountryCatalogLoader(ObjectMapper objectMapper, CountryRepository countryRepository) {
        this.objectMapper = objectMapper;
        this.countryRepository = countryRepository;
    }

    @PostConstruct
    public void loadCountries() {
        loadClasspathCatalogs();
        loadExternalCatalogs();

        if (definitions.isEmpty()) {
            log.warn("No country definitions found! Wars need at least two countries.");
            return;
        }
        int seeded = seedCountries();
        log.info("Loaded {} country definition(s), seeded {} new countr{}",
                definitions.size(), seeded, seeded == 1 ? "y" : "ies");
    }

    public List<CountryDefinition> getAvailableCountries() {
        return List.copyOf(definitions.values());
    }

    /**
     * Get a definition by country id.
     *
     * @throws IllegalArgumentException if the id is unknown
     */
    public CountryDefinition getDefinition(String countryId) {
        CountryDefinition definition = definitions.get(countryId);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown country: " + countryId
                    + ". Available countries: " + definitions.keySet());
        }
        return definition;
    }

    /**
     * Create a store entry for every definition not yet present.
     *
     * @return the number of countries created
     */
    public int seedCountries() {
        int seeded = 0;
        for (CountryDefinition definition : definitions.values()) {
            if (!countryRepository.existsById(definition.id())) {
                countryRepository.save(toCountry(definition));
                seeded++;
            }
        }
        return seeded;
    }

    Country toCountry(CountryDefinition definition) {
        TerrainType terrain = definition.terrainType() != null ? definition.terrainType() : TerrainType.PLAINS;
        return Country.builder()
                .id(definition.id())
                .name(definition.name())
                .isoCode(definition.isoCode())
                .terrainType(terrain)
                .terrainModifier(definition.terrainModifier() != null
                        ? definition.terrainModifier()
                        : terrain.getDefaultModifier())
                .resourceGenerationRate(definition.resourceGenerationRate() != null
                        ? definition.resourceGenerationRate()
                        : 1.0)
                .maxSoldiers(definition.maxSoldiers() != null ? definition.maxSoldiers() : defaultMaxSoldiers)
                .resources(startingResources)
                .areaKm2(definition.areaKm2())
                .color(definition.color())
                .build();
    }

    // ── classpath catalogs ──────────────────────────────────────────────

    private void loadClasspathCatalogs() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:countries/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    CountryCatalogDefinition catalog = objectMapper.readValue(is, CountryCatalogDefinition.class);
                    register(catalog);
                    log.info("Loaded built-in catalog '{}' ({} countries) from classpath",
                            catalog.name(), sizeOf(catalog));
                } catch (IOException | JacksonException e) {
                    log.error("Failed to load classpath catalog: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for country catalogs: {}", e.getMessage());
        }
    }

    // ── external catalogs (./countries/ folder) ─────────────────────────

    private void loadExternalCatalogs() {
        Path dir = Paths.get(externalDir);
        if (!Files.isDirectory(dir)) {
            log.debug("No external countries directory found at '{}'", dir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(this::loadExternalCatalogFile);
        } catch (IOException e) {
            log.error("Error reading external countries directory", e);
        }
    }

    private void loadExternalCatalogFile(Path path) {
        try {
            CountryCatalogDefinition catalog = objectMapper.readValue(path.toFile(), CountryCatalogDefinition.class);
            register(catalog);
            log.info("Loaded custom catalog '{}' ({} countries) from {}", catalog.name(), sizeOf(catalog), path);
        } catch (JacksonException e) {
            log.error("Failed to load custom catalog: {}", path, e);
        }
    }

    private void register(CountryCatalogDefinition catalog) {
        if (catalog.countries() == null) {
            return;
        }
        for (CountryDefinition definition : catalog.countries()) {
            if (definition.id() == null || definition.id().isBlank()) {
                log.warn("Skipping country without id in catalog '{}'", catalog.id());
                continue;
            }
            definitions.put(definition.id(), definition);
        }
    }

    private static int sizeOf(CountryCatalogDefinition catalog) {
        return catalog.countries() == null ? 0 : catalog.countries().size();
    }
}
