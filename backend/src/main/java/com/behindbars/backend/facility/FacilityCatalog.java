package com.behindbars.backend.facility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.Getter;

/**
 * Immutable lookup tables used by {@link FacilityNormalizer}.
 * <p>
 * Alias and region maps keep the declaration order of the source YAML, since
 * containment matching returns the first hit. Every canonical name is registered
 * as an alias of itself so that normalized names map back onto themselves.
 */
@Getter
public final class FacilityCatalog {

    private final List<String> prefixes;
    private final Map<String, String> aliasToCanonical;
    private final Map<String, String> regionKeywords;

    public FacilityCatalog(List<String> prefixes,
                           Map<String, List<String>> facilities,
                           Map<String, String> regionKeywords) {
        List<String> cleanedPrefixes = new ArrayList<>();
        for (String prefix : prefixes) {
            if (prefix != null && !prefix.isBlank()) {
                cleanedPrefixes.add(prefix.toLowerCase(Locale.ROOT));
            }
        }

        Map<String, String> aliases = new LinkedHashMap<>();
        facilities.forEach((canonical, aliasList) -> {
            aliases.putIfAbsent(canonical.toLowerCase(Locale.ROOT).trim(), canonical);
            if (aliasList != null) {
                for (String alias : aliasList) {
                    if (alias != null && !alias.isBlank()) {
                        aliases.putIfAbsent(alias.toLowerCase(Locale.ROOT).trim(), canonical);
                    }
                }
            }
        });

        Map<String, String> regions = new LinkedHashMap<>();
        regionKeywords.forEach((keyword, region) ->
                regions.put(keyword.toLowerCase(Locale.ROOT).trim(), region));

        this.prefixes = Collections.unmodifiableList(cleanedPrefixes);
        this.aliasToCanonical = Collections.unmodifiableMap(aliases);
        this.regionKeywords = Collections.unmodifiableMap(regions);
    }

    public int facilityCount() {
        return (int) aliasToCanonical.values().stream().distinct().count();
    }
}
