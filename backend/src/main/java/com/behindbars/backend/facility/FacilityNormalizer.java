package com.behindbars.backend.facility;

import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps free-text facility names onto canonical identities and infers their region.
 * <p>
 * Normalization is total: any non-blank input yields a usable display name, either a
 * canonical identity from the catalog or a title-cased, prefix-stripped version of the
 * input. Applying it to its own output returns the same value.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FacilityNormalizer {

    // Shorter aliases ("asti", "roma") only count on exact match
    private static final int MIN_PARTIAL_ALIAS_LENGTH = 5;

    private final FacilityCatalog catalog;

    public String normalize(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            return null;
        }

        String cleaned = collapseWhitespace(rawName.toLowerCase(Locale.ROOT));
        String stripped = stripPrefixes(collapseWhitespace(cleaned
                .replace("'", "")
                .replace("\"", "")));

        Map<String, String> aliases = catalog.getAliasToCanonical();

        String canonical = aliases.get(cleaned);
        if (canonical != null) {
            return canonical;
        }
        canonical = aliases.get(stripped);
        if (canonical != null) {
            return canonical;
        }

        for (Map.Entry<String, String> entry : aliases.entrySet()) {
            String alias = entry.getKey();
            if (alias.length() < MIN_PARTIAL_ALIAS_LENGTH) {
                continue;
            }
            if (cleaned.contains(alias) || stripped.contains(alias)) {
                return entry.getValue();
            }
        }

        String fallback = stripped.isEmpty() ? cleaned : stripped;
        log.debug("No canonical facility for '{}', using '{}'", rawName, fallback);
        return titleCase(fallback);
    }

    public String regionOf(String facilityName) {
        if (facilityName == null || facilityName.isBlank()) {
            return null;
        }
        String lower = facilityName.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : catalog.getRegionKeywords().entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * Returns the provided region, or infers one from the normalized facility name.
     */
    public String resolveRegion(String providedRegion, String normalizedFacility) {
        if (providedRegion != null && !providedRegion.isBlank()) {
            return providedRegion.trim();
        }
        return regionOf(normalizedFacility);
    }

    private String stripPrefixes(String name) {
        String result = name;
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String prefix : catalog.getPrefixes()) {
                if (result.startsWith(prefix) && !result.substring(prefix.length()).isBlank()) {
                    result = result.substring(prefix.length()).trim();
                    stripped = true;
                    break;
                }
            }
        }
        return result;
    }

    private static String collapseWhitespace(String text) {
        return text.trim().replaceAll("\\s+", " ");
    }

    private static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean capitalizeNext = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(capitalizeNext ? Character.toUpperCase(c) : c);
                capitalizeNext = false;
            } else {
                sb.append(c);
                capitalizeNext = true;
            }
        }
        return sb.toString();
    }
}
