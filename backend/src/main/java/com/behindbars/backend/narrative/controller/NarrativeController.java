package com.behindbars.backend.narrative.controller;

import com.behindbars.backend.narrative.model.FollowUp;
import com.behindbars.backend.narrative.model.StoryThread;
import com.behindbars.backend.narrative.service.NarrativeQueryService;
import com.behindbars.backend.pipeline.DailyRunService;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/narrative")
@RequiredArgsConstructor
public class NarrativeController {

    private final NarrativeQueryService queryService;
    private final DailyRunService dailyRunService;

    @GetMapping("/stories/active")
    public ResponseEntity<Map<String, Object>> getActiveStories() {
        return storyList(queryService.activeStories());
    }

    @GetMapping("/stories/dormant")
    public ResponseEntity<Map<String, Object>> getDormantStories() {
        return storyList(queryService.dormantStories());
    }

    /**
     * Stories whose topic or keywords contain the given keyword
     */
    @GetMapping("/stories")
    public ResponseEntity<Map<String, Object>> getStoriesByKeyword(@RequestParam String keyword) {
        return storyList(queryService.storiesByKeyword(keyword));
    }

    @GetMapping("/stories/{id}")
    public ResponseEntity<Map<String, Object>> getStory(@PathVariable String id) {
        return queryService.story(id)
                .map(story -> ResponseEntity.ok(Map.<String, Object>of(
                        "story", story,
                        "timestamp", System.currentTimeMillis())))
                .orElseGet(() -> notFound("Story not found: " + id));
    }

    @GetMapping("/stories/{id}/keyword-suggestions")
    public ResponseEntity<Map<String, Object>> getKeywordSuggestions(
            @PathVariable String id,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return queryService.keywordSuggestions(id, date)
                .map(keywords -> ResponseEntity.ok(Map.<String, Object>of(
                        "storyId", id,
                        "keywords", keywords,
                        "timestamp", System.currentTimeMillis())))
                .orElseGet(() -> notFound("Story not found: " + id));
    }

    /**
     * Character by name or alias, ignoring case
     */
    @GetMapping("/characters/{name}")
    public ResponseEntity<Map<String, Object>> getCharacter(@PathVariable String name) {
        return queryService.character(name)
                .map(character -> ResponseEntity.ok(Map.<String, Object>of(
                        "character", character,
                        "timestamp", System.currentTimeMillis())))
                .orElseGet(() -> notFound("Character not found: " + name));
    }

    @GetMapping("/followups/pending")
    public ResponseEntity<Map<String, Object>> getPendingFollowUps() {
        return followUpList(queryService.pendingFollowUps());
    }

    @GetMapping("/followups/due")
    public ResponseEntity<Map<String, Object>> getDueFollowUps(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return followUpList(queryService.dueFollowUps(asOf != null ? asOf : LocalDate.now()));
    }

    @PostMapping("/followups/{id}/resolve")
    public ResponseEntity<Map<String, Object>> resolveFollowUp(@PathVariable String id) {
        try {
            return dailyRunService.resolveFollowUp(id)
                    .map(followUp -> ResponseEntity.ok(Map.<String, Object>of(
                            "message", "Follow-up resolved",
                            "followup", followUp,
                            "timestamp", System.currentTimeMillis())))
                    .orElseGet(() -> notFound("Follow-up not found: " + id));

        } catch (Exception e) {
            log.error("❌ Follow-up resolution failed: {}", e.getMessage());
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", "Follow-up resolution failed",
                    "message", String.valueOf(e.getMessage()),
                    "timestamp", System.currentTimeMillis()
            ));
        }
    }

    /**
     * Move stale active stories to dormant
     */
    @PostMapping("/archive")
    public ResponseEntity<Map<String, Object>> archiveStories(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        LocalDate date = asOf != null ? asOf : LocalDate.now();

        try {
            int archived = dailyRunService.archiveStories(date);
            return ResponseEntity.ok(Map.of(
                    "message", "Archived " + archived + " stories",
                    "archived", archived,
                    "asOf", date.toString(),
                    "timestamp", System.currentTimeMillis()
            ));

        } catch (Exception e) {
            log.error("❌ Story archival failed: {}", e.getMessage());
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", "Story archival failed",
                    "message", String.valueOf(e.getMessage()),
                    "timestamp", System.currentTimeMillis()
            ));
        }
    }

    private ResponseEntity<Map<String, Object>> storyList(List<StoryThread> stories) {
        return ResponseEntity.ok(Map.of(
                "stories", stories,
                "count", stories.size(),
                "timestamp", System.currentTimeMillis()
        ));
    }

    private ResponseEntity<Map<String, Object>> followUpList(List<FollowUp> followUps) {
        return ResponseEntity.ok(Map.of(
                "followups", followUps,
                "count", followUps.size(),
                "timestamp", System.currentTimeMillis()
        ));
    }

    private static ResponseEntity<Map<String, Object>> notFound(String message) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                "error", "Not found",
                "message", message,
                "timestamp", System.currentTimeMillis()
        ));
    }
}
