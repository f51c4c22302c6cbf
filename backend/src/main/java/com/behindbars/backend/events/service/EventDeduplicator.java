package com.behindbars.backend.events.service;

import com.behindbars.backend.events.entity.FacilitySnapshot;
import com.behindbars.backend.events.entity.PrisonEvent;
import com.behindbars.backend.facility.FacilityNormalizer;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decides whether an extracted event or capacity snapshot describes something already stored.
 * <p>
 * Events match on the exact key (source, type, date, facility) or, across sources, on the
 * same type and date at the same canonical facility. Aggregates never take part in the
 * cross-source check. Facilities are always compared after normalization.
 */
@Component
@RequiredArgsConstructor
public class EventDeduplicator {

    private static final int AGGREGATE_MIN_COUNT_ON_JANUARY_FIRST = 3;

    // Year-to-date totals, cumulative counts and annual tallies
    private static final List<Pattern> AGGREGATE_PATTERNS = List.of(
            Pattern.compile("dall['’ ]\\s*inizio\\s+(dell['’ ]\\s*anno|del\\s+20\\d{2})"),
            Pattern.compile("da\\s+inizio\\s+anno"),
            Pattern.compile("nel\\s+corso\\s+dell['’ ]\\s*anno"),
            Pattern.compile("\\b\\d+\\s+(suicidi|morti|decessi|proteste|detenuti\\s+morti)\\s+(nel|dal|del|in)\\s+20\\d{2}"),
            Pattern.compile("\\b(salgono|sale|arriva|arrivano|saliti|salito)\\s+a\\s+\\d+"),
            Pattern.compile("\\b(in\\s+totale|complessivamente|bilancio\\s+annuale|dati\\s+annuali|rapporto\\s+annuale)\\b"),
            Pattern.compile("\\btotale\\s+(dei|di|delle)\\s+(suicidi|morti|decessi|proteste)"),
            Pattern.compile("\\b(so\\s+far\\s+this\\s+year|year[-\\s]to[-\\s]date|in\\s+total|annual\\s+(total|tally|report))\\b"),
            Pattern.compile("\\bsince\\s+the\\s+(start|beginning)\\s+of\\s+(the\\s+year|20\\d{2})"),
            Pattern.compile("\\b\\d+\\s+(suicides|deaths|protests)\\s+(in|during|since)\\s+20\\d{2}")
    );

    private final FacilityNormalizer facilityNormalizer;

    public boolean isDuplicateEvent(PrisonEvent candidate, Collection<PrisonEvent> existing) {
        String candidateFacility = facilityNormalizer.normalize(candidate.getFacility());

        for (PrisonEvent other : existing) {
            if (!sameType(candidate.getEventType(), other.getEventType())) {
                continue;
            }
            String otherFacility = facilityNormalizer.normalize(other.getFacility());

            boolean exactKey = Objects.equals(candidate.getSourceUrl(), other.getSourceUrl())
                    && Objects.equals(candidate.getEventDate(), other.getEventDate())
                    && Objects.equals(candidateFacility, otherFacility);
            if (exactKey) {
                return true;
            }

            boolean crossSource = candidate.getEventDate() != null
                    && candidateFacility != null
                    && !Boolean.TRUE.equals(candidate.getIsAggregate())
                    && !Boolean.TRUE.equals(other.getIsAggregate())
                    && candidate.getEventDate().equals(other.getEventDate())
                    && candidateFacility.equals(otherFacility);
            if (crossSource) {
                return true;
            }
        }
        return false;
    }

    public boolean isDuplicateSnapshot(FacilitySnapshot candidate, Collection<FacilitySnapshot> existing) {
        String candidateFacility = facilityNormalizer.normalize(candidate.getFacility());
        return existing.stream().anyMatch(other ->
                Objects.equals(candidateFacility, facilityNormalizer.normalize(other.getFacility()))
                        && Objects.equals(candidate.getSnapshotDate(), other.getSnapshotDate())
                        && Objects.equals(candidate.getSourceUrl(), other.getSourceUrl()));
    }

    /**
     * Whether a record reads like a statistical roll-up rather than one incident.
     * Only positive matches count; anything else is treated as an incident.
     */
    public boolean isAggregate(String description, Integer count, LocalDate eventDate) {
        if (count != null && count > AGGREGATE_MIN_COUNT_ON_JANUARY_FIRST
                && eventDate != null && eventDate.getMonthValue() == 1 && eventDate.getDayOfMonth() == 1) {
            return true;
        }
        if (description == null || description.isBlank()) {
            return false;
        }
        String text = description.toLowerCase(Locale.ROOT);
        return AGGREGATE_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }

    private static boolean sameType(String first, String second) {
        if (first == null || second == null) {
            return first == null && second == null;
        }
        return first.trim().equalsIgnoreCase(second.trim());
    }
}
