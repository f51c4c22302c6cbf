package com.behindbars.backend.facility;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads the facility alias and region tables from YAML once at startup.
 */
@Slf4j
@Configuration
public class FacilityCatalogLoader {

    @Bean
    public FacilityCatalog facilityCatalog(@Value("classpath:facilities.yml") Resource configResource) {
        try (InputStream inputStream = configResource.getInputStream()) {
            FacilityCatalog catalog = load(inputStream);
            log.info("🏛️ Loaded {} canonical facilities and {} region keywords",
                    catalog.facilityCount(), catalog.getRegionKeywords().size());
            return catalog;
        } catch (IOException e) {
            log.error("Error loading facility catalog", e);
            throw new IllegalStateException("Failed to load facility catalog", e);
        }
    }

    @SuppressWarnings("unchecked")
    public static FacilityCatalog load(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> data = yaml.load(inputStream);
        if (data == null) {
            throw new IllegalStateException("Facility catalog is empty");
        }

        List<String> prefixes = (List<String>) data.getOrDefault("prefixes", List.of());

        Map<String, List<String>> facilities = new LinkedHashMap<>();
        Map<String, Object> facilityData = (Map<String, Object>) data.getOrDefault("facilities", Map.of());
        for (Map.Entry<String, Object> entry : facilityData.entrySet()) {
            facilities.put(entry.getKey(), (List<String>) entry.getValue());
        }

        Map<String, String> regions = new LinkedHashMap<>();
        Map<String, Object> regionData = (Map<String, Object>) data.getOrDefault("regions", Map.of());
        for (Map.Entry<String, Object> entry : regionData.entrySet()) {
            regions.put(entry.getKey(), String.valueOf(entry.getValue()));
        }

        return new FacilityCatalog(prefixes, facilities, regions);
    }
}
