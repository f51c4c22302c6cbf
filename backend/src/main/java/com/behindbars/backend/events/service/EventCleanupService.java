package com.behindbars.backend.events.service;

import com.behindbars.backend.events.dto.CleanupReport;
import com.behindbars.backend.events.dto.DuplicateGroup;
import com.behindbars.backend.events.entity.PrisonEvent;
import com.behindbars.backend.events.repository.PrisonEventRepository;
import com.behindbars.backend.facility.FacilityNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Offline data-quality pass over the stored events.
 * <ol>
 *   <li>marks unmarked aggregates (no facility with count above one, or the aggregate heuristic);</li>
 *   <li>collapses events sharing date, canonical facility and type, keeping the longest description;</li>
 *   <li>collapses fatalities about the same victim, keeping the first one stored.</li>
 * </ol>
 * A dry run computes the report without changing anything.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventCleanupService {

    private static final int MAX_SAMPLE_GROUPS = 5;

    private final PrisonEventRepository eventRepository;
    private final FacilityNormalizer facilityNormalizer;
    private final EventDeduplicator deduplicator;
    private final VictimIdentifier victimIdentifier;

    @Transactional
    public CleanupReport cleanup(boolean dryRun) {
        List<PrisonEvent> events = eventRepository.findAllByOrderByIdAsc();
        log.info("🧹 Starting event cleanup over {} events (dry run: {})", events.size(), dryRun);

        CleanupReport report = CleanupReport.builder()
                .dryRun(dryRun)
                .beforeCount(events.size())
                .build();

        // Step 1: aggregates
        List<PrisonEvent> toMark = new ArrayList<>();
        for (PrisonEvent event : events) {
            if (Boolean.TRUE.equals(event.getIsAggregate())) continue;
            boolean unlocatedTotal = event.getFacility() == null && event.getCount() != null && event.getCount() > 1;
            if (unlocatedTotal || deduplicator.isAggregate(event.getDescription(), event.getCount(), event.getEventDate())) {
                toMark.add(event);
            }
        }
        Set<Long> markedIds = new HashSet<>();
        toMark.forEach(e -> markedIds.add(e.getId()));
        report.setAggregatesMarked(toMark.size());

        // Step 2: same date, facility and type
        Map<String, List<PrisonEvent>> groups = new LinkedHashMap<>();
        for (PrisonEvent event : events) {
            if (Boolean.TRUE.equals(event.getIsAggregate()) || markedIds.contains(event.getId())) continue;
            if (event.getEventDate() == null || event.getFacility() == null) continue;

            String facility = facilityNormalizer.normalize(event.getFacility());
            String key = event.getEventDate() + " | " + facility + " | " + event.getEventType();
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(event);
        }

        Set<Long> removeIds = new HashSet<>();
        List<Long> orderedRemoveIds = new ArrayList<>();
        for (Map.Entry<String, List<PrisonEvent>> entry : groups.entrySet()) {
            List<PrisonEvent> group = entry.getValue();
            if (group.size() < 2) continue;

            // Stable sort keeps the lowest id first among equally long descriptions
            List<PrisonEvent> sorted = new ArrayList<>(group);
            sorted.sort(Comparator.comparingInt((PrisonEvent e) -> descriptionLength(e)).reversed());
            PrisonEvent keep = sorted.get(0);
            List<Long> removed = sorted.subList(1, sorted.size()).stream().map(PrisonEvent::getId).toList();

            removed.forEach(id -> {
                if (removeIds.add(id)) orderedRemoveIds.add(id);
            });
            addSample(report, entry.getKey(), keep.getId(), removed);
        }
        report.setDuplicatesRemoved(orderedRemoveIds.size());

        // Step 3: same victim among survivors
        Map<String, Long> firstByVictim = new LinkedHashMap<>();
        int victimDuplicates = 0;
        for (PrisonEvent event : events) {
            if (Boolean.TRUE.equals(event.getIsAggregate()) || markedIds.contains(event.getId())) continue;
            if (removeIds.contains(event.getId())) continue;

            Optional<String> victimKey = victimIdentifier.identify(event);
            if (victimKey.isEmpty()) continue;

            Long firstId = firstByVictim.putIfAbsent(victimKey.get(), event.getId());
            if (firstId != null) {
                removeIds.add(event.getId());
                orderedRemoveIds.add(event.getId());
                victimDuplicates++;
                addSample(report, victimKey.get(), firstId, List.of(event.getId()));
            }
        }
        report.setVictimDuplicatesRemoved(victimDuplicates);
        report.setAfterCount(events.size() - orderedRemoveIds.size());

        if (!dryRun) {
            toMark.forEach(e -> e.setIsAggregate(true));
            eventRepository.saveAll(toMark);
            eventRepository.deleteAllById(orderedRemoveIds);
            log.info("✅ Cleanup applied: {} aggregates marked, {} duplicates removed",
                    toMark.size(), orderedRemoveIds.size());
        } else {
            log.info("🔍 Cleanup dry run: would mark {} aggregates and remove {} duplicates",
                    toMark.size(), orderedRemoveIds.size());
        }
        return report;
    }

    private static void addSample(CleanupReport report, String key, Long keepId, List<Long> removeIds) {
        if (report.getSampleDuplicates().size() < MAX_SAMPLE_GROUPS) {
            report.getSampleDuplicates().add(new DuplicateGroup(key, keepId, removeIds));
        }
    }

    private static int descriptionLength(PrisonEvent event) {
        return event.getDescription() == null ? 0 : event.getDescription().length();
    }
}
