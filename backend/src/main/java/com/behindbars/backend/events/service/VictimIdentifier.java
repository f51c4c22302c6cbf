package com.behindbars.backend.events.service;

import com.behindbars.backend.events.entity.PrisonEvent;
import com.behindbars.backend.facility.FacilityNormalizer;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds a best-effort key for the person a fatality record is about, so that several
 * articles on the same death can be collapsed during cleanup.
 * <p>
 * The key comes from free text and is a heuristic: differently phrased reports of one
 * death get different keys, and two people sharing a name and age get the same one.
 */
@Component
@RequiredArgsConstructor
public class VictimIdentifier {

    public static final Set<String> FATALITY_TYPES = Set.of("suicide", "natural_death", "death");

    // Person reference followed by a capitalized name: "il detenuto Marco Rossi", "la vittima, Ahmed"
    private static final Pattern NAMED_PERSON = Pattern.compile(
            "(?<!\\p{L})(?i:detenut[oai]|reclus[oai]|uomo|donna|ragazz[oai]|giovane|vittima|inmate|prisoner)"
                    + "\\s*,?\\s+(\\p{Lu}\\p{Ll}+(?:\\s+\\p{Lu}\\p{Ll}+)?)");

    private static final List<Pattern> AGE_PATTERNS = List.of(
            Pattern.compile("(?<!\\d)(\\d{1,3})\\s*anni\\b"),
            Pattern.compile("(?<!\\d)(\\d{1,3})\\s*enne\\b"),
            Pattern.compile("\\baged\\s+(\\d{1,3})\\b"),
            Pattern.compile("(?<!\\d)(\\d{1,3})-year-old\\b")
    );

    private static final int MAX_AGE = 110;

    private final FacilityNormalizer facilityNormalizer;

    public static boolean isFatality(String eventType) {
        return eventType != null && FATALITY_TYPES.contains(eventType.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * {@code name:<name>|<age or ?>} when a named person is found, otherwise
     * {@code ctx:<date>|<facility>|<age>} when all three are known. Empty for non-fatality events.
     */
    public Optional<String> identify(PrisonEvent event) {
        if (!isFatality(event.getEventType())) {
            return Optional.empty();
        }

        String description = event.getDescription() == null ? "" : event.getDescription();
        String name = extractName(description);
        Integer age = extractAge(description);

        if (name != null) {
            return Optional.of("name:" + name.toLowerCase(Locale.ROOT) + "|" + (age != null ? age : "?"));
        }

        String facility = facilityNormalizer.normalize(event.getFacility());
        if (event.getEventDate() != null && facility != null && age != null) {
            return Optional.of("ctx:" + event.getEventDate() + "|" + facility + "|" + age);
        }
        return Optional.empty();
    }

    static String extractName(String text) {
        Matcher matcher = NAMED_PERSON.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    static Integer extractAge(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (Pattern pattern : AGE_PATTERNS) {
            Matcher matcher = pattern.matcher(lower);
            if (matcher.find()) {
                int age = Integer.parseInt(matcher.group(1));
                if (age > 0 && age <= MAX_AGE) {
                    return age;
                }
            }
        }
        return null;
    }
}
