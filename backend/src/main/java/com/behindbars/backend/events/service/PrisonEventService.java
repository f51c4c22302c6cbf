package com.behindbars.backend.events.service;

import com.behindbars.backend.events.dto.PersistResult;
import com.behindbars.backend.events.dto.RecentEventDto;
import com.behindbars.backend.events.dto.RecentSnapshotDto;
import com.behindbars.backend.events.entity.FacilitySnapshot;
import com.behindbars.backend.events.entity.PrisonEvent;
import com.behindbars.backend.events.repository.FacilitySnapshotRepository;
import com.behindbars.backend.events.repository.PrisonEventRepository;
import com.behindbars.backend.extraction.dto.EventExtractionResult.EventPayload;
import com.behindbars.backend.extraction.dto.SnapshotExtractionResult.SnapshotPayload;
import com.behindbars.backend.facility.FacilityNormalizer;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PrisonEventService {

    private static final int DEDUP_DESCRIPTION_LENGTH = 100;
    private static final int MAX_RECENT_FOR_DEDUP = 500;
    private static final int LOG_VALUE_LENGTH = 60;

    private final PrisonEventRepository eventRepository;
    private final FacilitySnapshotRepository snapshotRepository;
    private final FacilityNormalizer facilityNormalizer;
    private final EventDeduplicator deduplicator;

    @Value("${pipeline.recent-events-days:90}")
    private int recentEventsDays;

    /**
     * Normalize, deduplicate and insert extracted events. Existing rows are fetched once
     * by the incoming dates and source URLs; accepted events of the same batch count as existing too.
     */
    @Transactional
    public PersistResult persistEvents(List<EventPayload> payloads) {
        List<PrisonEvent> candidates = new ArrayList<>();
        int rejected = 0;
        for (EventPayload payload : payloads) {
            PrisonEvent event = toEvent(payload);
            if (!fitsColumns(event)) {
                log.warn("⚠️ Event {} at {} exceeds column limits, rejecting",
                        abbreviate(event.getEventType()), abbreviate(event.getFacility()));
                rejected++;
                continue;
            }
            candidates.add(event);
        }

        Set<LocalDate> dates = candidates.stream()
                .map(PrisonEvent::getEventDate)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Set<String> sourceUrls = candidates.stream()
                .map(PrisonEvent::getSourceUrl)
                .filter(url -> url != null && !url.isBlank())
                .collect(Collectors.toSet());

        Map<Long, PrisonEvent> existingById = new LinkedHashMap<>();
        if (!dates.isEmpty()) {
            eventRepository.findByEventDateIn(dates).forEach(e -> existingById.put(e.getId(), e));
        }
        if (!sourceUrls.isEmpty()) {
            eventRepository.findBySourceUrlIn(sourceUrls).forEach(e -> existingById.put(e.getId(), e));
        }
        List<PrisonEvent> known = new ArrayList<>(existingById.values());

        List<PrisonEvent> accepted = new ArrayList<>();
        int skipped = 0;
        for (PrisonEvent candidate : candidates) {
            if (deduplicator.isDuplicateEvent(candidate, known)) {
                log.debug("Duplicate event skipped: {} {} at {}", candidate.getEventType(),
                        candidate.getEventDate(), candidate.getFacility());
                skipped++;
                continue;
            }
            accepted.add(candidate);
            known.add(candidate);
        }

        eventRepository.saveAll(accepted);
        log.info("✅ Events saved: {}, skipped as duplicates: {}, rejected: {}", accepted.size(), skipped, rejected);
        return new PersistResult(accepted.size(), skipped, rejected);
    }

    /**
     * Insert extracted capacity snapshots. Snapshots without a readable date are rejected.
     */
    @Transactional
    public PersistResult persistSnapshots(List<SnapshotPayload> payloads) {
        List<FacilitySnapshot> candidates = new ArrayList<>();
        int rejected = 0;
        for (SnapshotPayload payload : payloads) {
            LocalDate snapshotDate = payload.getParsedSnapshotDate();
            if (snapshotDate == null) {
                log.warn("⚠️ Snapshot for {} has no valid date '{}', rejecting",
                        payload.getFacility(), payload.getSnapshotDate());
                rejected++;
                continue;
            }
            FacilitySnapshot snapshot = toSnapshot(payload, snapshotDate);
            if (!fitsColumns(snapshot)) {
                log.warn("⚠️ Snapshot for {} exceeds column limits, rejecting", abbreviate(snapshot.getFacility()));
                rejected++;
                continue;
            }
            candidates.add(snapshot);
        }

        Set<LocalDate> dates = candidates.stream()
                .map(FacilitySnapshot::getSnapshotDate)
                .collect(Collectors.toSet());
        List<FacilitySnapshot> known = dates.isEmpty()
                ? new ArrayList<>()
                : new ArrayList<>(snapshotRepository.findBySnapshotDateIn(dates));

        List<FacilitySnapshot> accepted = new ArrayList<>();
        int skipped = 0;
        for (FacilitySnapshot candidate : candidates) {
            if (deduplicator.isDuplicateSnapshot(candidate, known)) {
                skipped++;
                continue;
            }
            accepted.add(candidate);
            known.add(candidate);
        }

        snapshotRepository.saveAll(accepted);
        log.info("✅ Capacity snapshots saved: {}, skipped: {}, rejected: {}", accepted.size(), skipped, rejected);
        return new PersistResult(accepted.size(), skipped, rejected);
    }

    /**
     * Events of the last {@code pipeline.recent-events-days} days in the compact form used
     * by the extraction prompt, facility names normalized.
     */
    @Transactional(readOnly = true)
    public List<RecentEventDto> listRecentForDedup(LocalDate asOf) {
        return eventRepository.findRecentEvents(asOf.minusDays(recentEventsDays)).stream()
                .limit(MAX_RECENT_FOR_DEDUP)
                .map(e -> new RecentEventDto(
                        e.getEventType(),
                        e.getEventDate() != null ? e.getEventDate().toString() : null,
                        facilityNormalizer.normalize(e.getFacility()),
                        truncate(e.getDescription()),
                        e.getIsAggregate()))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<RecentSnapshotDto> listRecentSnapshotsForDedup(LocalDate asOf) {
        LocalDate since = asOf.minusDays(recentEventsDays);
        return snapshotRepository.findLatestPerFacility().stream()
                .filter(s -> !s.getSnapshotDate().isBefore(since))
                .limit(MAX_RECENT_FOR_DEDUP)
                .map(s -> new RecentSnapshotDto(s.getFacility(), s.getSnapshotDate().toString(),
                        s.getInmates(), s.getCapacity(), s.getSourceUrl()))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PrisonEvent> findEvents(String type, String facility, String region) {
        if (type != null && !type.isBlank()) {
            return eventRepository.findByEventTypeOrderByEventDateDesc(type.trim().toLowerCase(Locale.ROOT));
        }
        if (facility != null && !facility.isBlank()) {
            return eventRepository.findByFacilityOrderByEventDateDesc(facilityNormalizer.normalize(facility));
        }
        if (region != null && !region.isBlank()) {
            return eventRepository.findByRegionOrderByEventDateDesc(region.trim());
        }
        return eventRepository.findAll();
    }

    @Transactional(readOnly = true)
    public List<FacilitySnapshot> findSnapshots(String facility, String region) {
        if (facility != null && !facility.isBlank()) {
            return snapshotRepository.findByFacilityOrderBySnapshotDateDesc(facilityNormalizer.normalize(facility));
        }
        if (region != null && !region.isBlank()) {
            return snapshotRepository.findByRegionOrderBySnapshotDateDesc(region.trim());
        }
        return snapshotRepository.findLatestPerFacility();
    }

    @Transactional(readOnly = true)
    public Map<String, Object> getEventStats() {
        Map<String, Long> byType = toCountMap(eventRepository.countByTypeExcludingAggregates());
        Map<String, Long> byRegion = toCountMap(eventRepository.countByRegionExcludingAggregates());
        Long aggregates = eventRepository.countByIsAggregate(true);

        Map<String, Object> stats = new HashMap<>();
        stats.put("totalEvents", eventRepository.count());
        stats.put("aggregateEvents", aggregates != null ? aggregates : 0);
        stats.put("eventsByType", byType);
        stats.put("eventsByRegion", byRegion);
        stats.put("totalSnapshots", snapshotRepository.count());
        return stats;
    }

    private PrisonEvent toEvent(EventPayload payload) {
        String facility = facilityNormalizer.normalize(payload.getFacility());
        LocalDate eventDate = payload.getParsedEventDate();
        if (eventDate == null && payload.getEventDate() != null && !payload.getEventDate().isBlank()) {
            log.warn("⚠️ Unreadable event date '{}', storing event without date", payload.getEventDate());
        }
        boolean aggregate = Boolean.TRUE.equals(payload.getIsAggregate())
                || deduplicator.isAggregate(payload.getDescription(), payload.getCount(), eventDate);

        return PrisonEvent.builder()
                .eventType(payload.getEventType().trim().toLowerCase(Locale.ROOT))
                .eventDate(eventDate)
                .facility(facility)
                .region(facilityNormalizer.resolveRegion(payload.getRegion(), facility))
                .count(payload.getCount())
                .description(payload.getDescription() != null ? payload.getDescription() : "")
                .sourceUrl(payload.getSourceUrl() != null ? payload.getSourceUrl() : "")
                .confidence(payload.getConfidence() != null ? payload.getConfidence() : 1.0)
                .isAggregate(aggregate)
                .build();
    }

    private FacilitySnapshot toSnapshot(SnapshotPayload payload, LocalDate snapshotDate) {
        String facility = facilityNormalizer.normalize(payload.getFacility());
        return FacilitySnapshot.builder()
                .facility(facility)
                .region(facilityNormalizer.resolveRegion(payload.getRegion(), facility))
                .snapshotDate(snapshotDate)
                .inmates(payload.getInmates())
                .capacity(payload.getCapacity())
                .occupancyRate(payload.getOccupancyRate())
                .sourceUrl(payload.getSourceUrl() != null ? payload.getSourceUrl() : "")
                .build();
    }

    private static boolean fitsColumns(PrisonEvent event) {
        return fits(event.getEventType(), PrisonEvent.EVENT_TYPE_LENGTH)
                && fits(event.getFacility(), PrisonEvent.FACILITY_LENGTH)
                && fits(event.getRegion(), PrisonEvent.REGION_LENGTH)
                && fits(event.getSourceUrl(), PrisonEvent.SOURCE_URL_LENGTH);
    }

    private static boolean fitsColumns(FacilitySnapshot snapshot) {
        return fits(snapshot.getFacility(), FacilitySnapshot.FACILITY_LENGTH)
                && fits(snapshot.getRegion(), FacilitySnapshot.REGION_LENGTH)
                && fits(snapshot.getSourceUrl(), FacilitySnapshot.SOURCE_URL_LENGTH);
    }

    private static boolean fits(String value, int maxLength) {
        return value == null || value.length() <= maxLength;
    }

    private static String abbreviate(String value) {
        if (value == null || value.length() <= LOG_VALUE_LENGTH) return value;
        return value.substring(0, LOG_VALUE_LENGTH) + "...";
    }

    private static Map<String, Long> toCountMap(List<Object[]> rows) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object[] row : rows) {
            counts.put((String) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    private static String truncate(String description) {
        if (description == null) return "";
        return description.length() > DEDUP_DESCRIPTION_LENGTH
                ? description.substring(0, DEDUP_DESCRIPTION_LENGTH)
                : description;
    }
}
