package com.behindbars.backend.events.service;

import com.behindbars.backend.events.dto.FacilityNormalizationReport;
import com.behindbars.backend.events.dto.FacilityRename;
import com.behindbars.backend.events.entity.FacilitySnapshot;
import com.behindbars.backend.events.entity.PrisonEvent;
import com.behindbars.backend.events.repository.FacilitySnapshotRepository;
import com.behindbars.backend.events.repository.PrisonEventRepository;
import com.behindbars.backend.facility.FacilityNormalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Re-applies facility normalization to rows stored before the current alias table.
 * <p>
 * Event rows are renamed in place. A snapshot whose new name collides with a stored
 * snapshot of the same date and source is removed, the lowest id survives.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FacilityNormalizationService {

    private static final int MAX_SAMPLE_CHANGES = 10;

    private final PrisonEventRepository eventRepository;
    private final FacilitySnapshotRepository snapshotRepository;
    private final FacilityNormalizer facilityNormalizer;

    @Transactional
    public FacilityNormalizationReport normalizeStoredFacilities(boolean dryRun) {
        FacilityNormalizationReport report = FacilityNormalizationReport.builder().dryRun(dryRun).build();

        // Events
        Set<String> eventsBefore = new HashSet<>();
        Set<String> eventsAfter = new HashSet<>();
        List<PrisonEvent> renamedEvents = new ArrayList<>();
        List<String> eventTargets = new ArrayList<>();
        for (PrisonEvent event : eventRepository.findAllByOrderByIdAsc()) {
            if (event.getFacility() == null) continue;
            String target = target(event.getFacility(), PrisonEvent.FACILITY_LENGTH);
            eventsBefore.add(event.getFacility());
            eventsAfter.add(target);
            if (!target.equals(event.getFacility())) {
                renamedEvents.add(event);
                eventTargets.add(target);
                addSample(report, "prison_events", event.getId(), event.getFacility(), target);
            }
        }
        report.setEventFacilitiesBefore(eventsBefore.size());
        report.setEventFacilitiesAfter(eventsAfter.size());
        report.setEventsUpdated(renamedEvents.size());

        // Snapshots
        Set<String> snapshotsBefore = new HashSet<>();
        Set<String> snapshotsAfter = new HashSet<>();
        Set<String> storedKeys = new HashSet<>();
        List<FacilitySnapshot> renamedSnapshots = new ArrayList<>();
        List<String> snapshotTargets = new ArrayList<>();
        List<Long> mergedIds = new ArrayList<>();
        for (FacilitySnapshot snapshot : snapshotRepository.findAllByOrderByIdAsc()) {
            if (snapshot.getFacility() == null) continue;
            String target = target(snapshot.getFacility(), FacilitySnapshot.FACILITY_LENGTH);
            snapshotsBefore.add(snapshot.getFacility());

            String key = target + " | " + snapshot.getSnapshotDate() + " | " + snapshot.getSourceUrl();
            if (!storedKeys.add(key)) {
                mergedIds.add(snapshot.getId());
                addSample(report, "facility_snapshots", snapshot.getId(), snapshot.getFacility(), target);
                continue;
            }
            snapshotsAfter.add(target);
            if (!target.equals(snapshot.getFacility())) {
                renamedSnapshots.add(snapshot);
                snapshotTargets.add(target);
                addSample(report, "facility_snapshots", snapshot.getId(), snapshot.getFacility(), target);
            }
        }
        report.setSnapshotFacilitiesBefore(snapshotsBefore.size());
        report.setSnapshotFacilitiesAfter(snapshotsAfter.size());
        report.setSnapshotsUpdated(renamedSnapshots.size());
        report.setSnapshotsMerged(mergedIds.size());

        if (dryRun) {
            log.info("🔍 Facility normalization dry run: would rename {} events and {} snapshots, merge {} snapshots",
                    renamedEvents.size(), renamedSnapshots.size(), mergedIds.size());
            return report;
        }

        // Removed before renaming so the unique constraint never sees both rows
        if (!mergedIds.isEmpty()) {
            snapshotRepository.deleteAllByIdInBatch(mergedIds);
        }
        for (int i = 0; i < renamedEvents.size(); i++) {
            renamedEvents.get(i).setFacility(eventTargets.get(i));
        }
        for (int i = 0; i < renamedSnapshots.size(); i++) {
            renamedSnapshots.get(i).setFacility(snapshotTargets.get(i));
        }
        eventRepository.saveAll(renamedEvents);
        snapshotRepository.saveAll(renamedSnapshots);

        log.info("✅ Facility normalization applied: {} events and {} snapshots renamed, {} snapshots merged",
                renamedEvents.size(), renamedSnapshots.size(), mergedIds.size());
        return report;
    }

    private String target(String stored, int maxLength) {
        String normalized = facilityNormalizer.normalize(stored);
        if (normalized == null || normalized.length() > maxLength) {
            return stored;
        }
        return normalized;
    }

    private static void addSample(FacilityNormalizationReport report, String table, Long id, String from, String to) {
        if (report.getSampleChanges().size() < MAX_SAMPLE_CHANGES) {
            report.getSampleChanges().add(new FacilityRename(table, id, from, to));
        }
    }
}
