package com.behindbars.backend.events.controller;

import com.behindbars.backend.events.dto.CleanupReport;
import com.behindbars.backend.events.dto.FacilityNormalizationReport;
import com.behindbars.backend.events.entity.FacilitySnapshot;
import com.behindbars.backend.events.entity.PrisonEvent;
import com.behindbars.backend.events.service.EventCleanupService;
import com.behindbars.backend.events.service.FacilityNormalizationService;
import com.behindbars.backend.events.service.PrisonEventService;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/prison-events")
@RequiredArgsConstructor
public class PrisonEventController {

    private final PrisonEventService prisonEventService;
    private final EventCleanupService cleanupService;
    private final FacilityNormalizationService normalizationService;

    /**
     * List events, filtered by type, facility or region (first given wins)
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> getEvents(
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String facility,
            @RequestParam(required = false) String region) {

        List<PrisonEvent> events = prisonEventService.findEvents(type, facility, region);
        return ResponseEntity.ok(Map.of(
                "events", events,
                "count", events.size(),
                "timestamp", System.currentTimeMillis()
        ));
    }

    /**
     * Event counts by type and region, aggregates excluded
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(Map.of(
                "stats", prisonEventService.getEventStats(),
                "timestamp", System.currentTimeMillis()
        ));
    }

    /**
     * Capacity snapshots for one facility or region, or the latest one per facility
     */
    @GetMapping("/snapshots")
    public ResponseEntity<Map<String, Object>> getSnapshots(
            @RequestParam(required = false) String facility,
            @RequestParam(required = false) String region) {
        List<FacilitySnapshot> snapshots = prisonEventService.findSnapshots(facility, region);
        return ResponseEntity.ok(Map.of(
                "snapshots", snapshots,
                "count", snapshots.size(),
                "timestamp", System.currentTimeMillis()
        ));
    }

    /**
     * Mark aggregates and remove duplicate events. Dry run unless dryRun=false.
     */
    @PostMapping("/cleanup")
    public ResponseEntity<Map<String, Object>> cleanup(@RequestParam(defaultValue = "true") boolean dryRun) {
        log.info("🚀 Event cleanup requested (dry run: {})", dryRun);

        try {
            CleanupReport report = cleanupService.cleanup(dryRun);
            return ResponseEntity.ok(Map.of(
                    "report", report,
                    "status", dryRun ? "PREVIEW" : "APPLIED",
                    "timestamp", System.currentTimeMillis()
            ));

        } catch (Exception e) {
            log.error("❌ Event cleanup failed: {}", e.getMessage());
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", "Event cleanup failed",
                    "message", String.valueOf(e.getMessage()),
                    "timestamp", System.currentTimeMillis()
            ));
        }
    }

    /**
     * Rename stored facilities to their canonical names. Dry run unless dryRun=false.
     */
    @PostMapping("/normalize-facilities")
    public ResponseEntity<Map<String, Object>> normalizeFacilities(
            @RequestParam(defaultValue = "true") boolean dryRun) {
        log.info("🚀 Facility normalization requested (dry run: {})", dryRun);

        try {
            FacilityNormalizationReport report = normalizationService.normalizeStoredFacilities(dryRun);
            return ResponseEntity.ok(Map.of(
                    "report", report,
                    "status", dryRun ? "PREVIEW" : "APPLIED",
                    "timestamp", System.currentTimeMillis()
            ));

        } catch (Exception e) {
            log.error("❌ Facility normalization failed: {}", e.getMessage());
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", "Facility normalization failed",
                    "message", String.valueOf(e.getMessage()),
                    "timestamp", System.currentTimeMillis()
            ));
        }
    }
}
