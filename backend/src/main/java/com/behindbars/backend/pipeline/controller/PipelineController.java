package com.behindbars.backend.pipeline.controller;

import com.behindbars.backend.article.dto.EnrichedArticle;
import com.behindbars.backend.pipeline.DailyRunService;
import com.behindbars.backend.pipeline.RunReport;
import com.behindbars.backend.pipeline.entity.ReconciliationRunLog;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final DailyRunService dailyRunService;

    /**
     * Store a day's enriched articles, keyed by URL
     */
    @PostMapping("/collections/{date}")
    public ResponseEntity<Map<String, Object>> storeCollection(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestBody Map<String, EnrichedArticle> articles) {

        try {
            Path path = dailyRunService.storeCollection(date, articles);
            return ResponseEntity.ok(Map.of(
                    "message", "Collection stored",
                    "date", date.toString(),
                    "articles", articles.size(),
                    "path", path.toString(),
                    "timestamp", System.currentTimeMillis()
            ));

        } catch (Exception e) {
            log.error("❌ Storing collection for {} failed: {}", date, e.getMessage());
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", "Storing collection failed",
                    "message", String.valueOf(e.getMessage()),
                    "timestamp", System.currentTimeMillis()
            ));
        }
    }

    @GetMapping("/collections")
    public ResponseEntity<Map<String, Object>> getCollections() {
        List<LocalDate> dates = dailyRunService.availableCollections();
        return ResponseEntity.ok(Map.of(
                "dates", dates,
                "count", dates.size(),
                "timestamp", System.currentTimeMillis()
        ));
    }

    /**
     * Run extraction and reconciliation for a collected day (today by default)
     */
    @PostMapping("/runs")
    public ResponseEntity<Map<String, Object>> triggerRun(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate runDate = date != null ? date : LocalDate.now();
        log.info("🚀 Manual run requested for {}", runDate);

        try {
            RunReport report = dailyRunService.runFor(runDate);
            return ResponseEntity.ok(Map.of(
                    "report", report,
                    "status", report.hasFailures() ? "COMPLETED_WITH_FAILURES" : "COMPLETED",
                    "timestamp", System.currentTimeMillis()
            ));

        } catch (Exception e) {
            log.error("❌ Run for {} failed: {}", runDate, e.getMessage());
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", "Run failed",
                    "message", String.valueOf(e.getMessage()),
                    "timestamp", System.currentTimeMillis()
            ));
        }
    }

    /**
     * Per-category run results of one day, or the most recent ones
     */
    @GetMapping("/runs")
    public ResponseEntity<Map<String, Object>> getRunLog(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        List<ReconciliationRunLog> entries = date != null
                ? dailyRunService.runLogFor(date)
                : dailyRunService.recentRunLog();
        return ResponseEntity.ok(Map.of(
                "runs", entries,
                "count", entries.size(),
                "timestamp", System.currentTimeMillis()
        ));
    }
}
