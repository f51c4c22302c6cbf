package com.behindbars.backend.pipeline;

import com.behindbars.backend.article.dto.EnrichedArticle;
import com.behindbars.backend.config.NarrativeProperties;
import com.behindbars.backend.events.dto.PersistResult;
import com.behindbars.backend.events.service.PrisonEventService;
import com.behindbars.backend.extraction.ExtractionBundle;
import com.behindbars.backend.extraction.ExtractionCategory;
import com.behindbars.backend.extraction.ExtractionResultParser;
import com.behindbars.backend.extraction.dto.EventExtractionResult;
import com.behindbars.backend.extraction.dto.SnapshotExtractionResult;
import com.behindbars.backend.extraction.dto.StoryExtractionResult;
import com.behindbars.backend.narrative.matching.StoryMatcher;
import com.behindbars.backend.narrative.model.NarrativeContext;
import com.behindbars.backend.narrative.service.MergeResult;
import com.behindbars.backend.narrative.service.NarrativeMergeService;
import com.behindbars.backend.narrative.storage.NarrativeStore;
import com.behindbars.backend.pipeline.entity.ReconciliationRunLog;
import com.behindbars.backend.pipeline.repository.ReconciliationRunLogRepository;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies one day's extraction output to the narrative memory and the event tables.
 * <p>
 * Each category is attempted on its own: a failure is logged and recorded, and the
 * remaining categories and the final save still happen. If the context cannot be loaded
 * the narrative categories are skipped, events and snapshots are still persisted, and the
 * load error is rethrown. A failed save is rethrown as well.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationOrchestrator {

    private final NarrativeStore narrativeStore;
    private final StoryMatcher storyMatcher;
    private final NarrativeProperties narrativeProperties;
    private final NarrativeMergeService mergeService;
    private final ExtractionResultParser parser;
    private final PrisonEventService prisonEventService;
    private final ReconciliationRunLogRepository runLogRepository;

    public RunReport run(Map<String, EnrichedArticle> articles, ExtractionBundle bundle, LocalDate runDate) {
        log.info("🚀 Starting reconciliation run for {} ({} articles)", runDate, articles.size());
        RunReport report = new RunReport(runDate);

        NarrativeContext context = null;
        RuntimeException loadFailure = null;
        try {
            context = narrativeStore.load();
            report.setStage(RunStage.LOADED);
            report.setArchivedStories(narrativeStore.archiveStale(context, runDate));
        } catch (RuntimeException e) {
            log.error("❌ Narrative context could not be loaded: {}", e.getMessage());
            loadFailure = e;
        }

        if (context != null) {
            NarrativeContext ctx = context;
            report.record(runCategory(bundle, ExtractionCategory.STORIES, raw -> {
                StoryExtractionResult extraction = parser.parseStories(raw);
                attachMatchingArticles(extraction, articles);
                MergeResult result = mergeService.mergeStories(ctx, extraction, runDate);
                return CategoryOutcome.succeeded(ExtractionCategory.STORIES, result.getApplied(), result.getSkipped());
            }));
            report.setStage(RunStage.STORY_MERGE_ATTEMPTED);

            report.record(runCategory(bundle, ExtractionCategory.CHARACTERS, raw -> {
                MergeResult result = mergeService.mergeCharacters(ctx, parser.parseCharacters(raw), runDate);
                return CategoryOutcome.succeeded(ExtractionCategory.CHARACTERS, result.getApplied(), result.getSkipped());
            }));
            report.setStage(RunStage.CHARACTER_MERGE_ATTEMPTED);

            report.record(runCategory(bundle, ExtractionCategory.FOLLOWUPS, raw -> {
                MergeResult result = mergeService.appendFollowUps(ctx, parser.parseFollowUps(raw), runDate);
                return CategoryOutcome.succeeded(ExtractionCategory.FOLLOWUPS, result.getApplied(), result.getSkipped());
            }));
            report.setStage(RunStage.FOLLOWUP_APPEND_ATTEMPTED);
        } else {
            for (ExtractionCategory category : List.of(ExtractionCategory.STORIES,
                    ExtractionCategory.CHARACTERS, ExtractionCategory.FOLLOWUPS)) {
                report.record(CategoryOutcome.skipped(category, "Narrative context not loaded"));
            }
        }

        report.record(runCategory(bundle, ExtractionCategory.EVENTS, raw -> {
            EventExtractionResult extraction = parser.parseEvents(raw);
            PersistResult result = prisonEventService.persistEvents(extraction.getEvents());
            return CategoryOutcome.succeeded(ExtractionCategory.EVENTS, result.getSaved(),
                    result.getSkipped() + result.getRejected() + extraction.getInvalidRecords());
        }));
        report.setStage(RunStage.EVENT_EXTRACT_ATTEMPTED);

        report.record(runCategory(bundle, ExtractionCategory.SNAPSHOTS, raw -> {
            SnapshotExtractionResult extraction = parser.parseSnapshots(raw);
            PersistResult result = prisonEventService.persistSnapshots(extraction.getSnapshots());
            return CategoryOutcome.succeeded(ExtractionCategory.SNAPSHOTS, result.getSaved(),
                    result.getSkipped() + result.getRejected() + extraction.getInvalidRecords());
        }));
        report.setStage(RunStage.SNAPSHOT_EXTRACT_ATTEMPTED);

        try {
            if (loadFailure != null) {
                throw loadFailure;
            }
            narrativeStore.save(context);
            report.setContextSaved(true);
            report.setStage(RunStage.SAVED);
        } finally {
            report.setFinishedAt(LocalDateTime.now());
            writeRunLog(report);
        }

        log.info("✅ Reconciliation run for {} finished{}", runDate,
                report.hasFailures() ? " with failed categories" : "");
        return report;
    }

    /**
     * New stories proposed without source URLs get the batch articles whose keywords overlap enough with them.
     */
    void attachMatchingArticles(StoryExtractionResult extraction, Map<String, EnrichedArticle> articles) {
        if (extraction.getNewStories() == null) return;

        for (StoryExtractionResult.NewStory story : extraction.getNewStories()) {
            if (story.getArticleUrls() != null && !story.getArticleUrls().isEmpty()) continue;

            Set<String> storyKeywords = new HashSet<>(StoryMatcher.extractKeywords(
                    story.getTopic() + " " + (story.getSummary() != null ? story.getSummary() : "")));
            if (story.getKeywords() != null) {
                story.getKeywords().stream()
                        .filter(k -> k != null && !k.isBlank())
                        .forEach(k -> storyKeywords.add(k.trim().toLowerCase(Locale.ROOT)));
            }

            List<String> urls = new ArrayList<>();
            for (Map.Entry<String, EnrichedArticle> entry : articles.entrySet()) {
                double score = StoryMatcher.keywordOverlap(storyMatcher.articleKeywords(entry.getValue()), storyKeywords);
                if (score >= narrativeProperties.getMinMatchScore()) {
                    urls.add(entry.getKey());
                }
            }
            story.setArticleUrls(urls);
        }
    }

    private CategoryOutcome runCategory(ExtractionBundle bundle, ExtractionCategory category, CategoryStep step) {
        Optional<String> failure = bundle.failure(category);
        if (failure.isPresent()) {
            log.error("❌ {} extraction failed upstream: {}", category.getLabel(), failure.get());
            return CategoryOutcome.failed(category, failure.get());
        }

        Optional<String> payload = bundle.payload(category);
        if (payload.isEmpty()) {
            log.info("📭 No {} extraction output for this run", category.getLabel());
            return CategoryOutcome.unavailable(category);
        }

        try {
            return step.apply(payload.get());
        } catch (Exception e) {
            log.error("❌ Failed to process {}: {}", category.getLabel(), e.getMessage(), e);
            return CategoryOutcome.failed(category, e.getMessage());
        }
    }

    private void writeRunLog(RunReport report) {
        List<ReconciliationRunLog> rows = new ArrayList<>();
        for (CategoryOutcome outcome : report.getOutcomes().values()) {
            rows.add(ReconciliationRunLog.builder()
                    .runDate(report.getRunDate())
                    .category(outcome.getCategory().getLabel())
                    .status(outcome.getStatus().name())
                    .appliedCount(outcome.getApplied())
                    .skippedCount(outcome.getSkipped())
                    .contextSaved(report.isContextSaved())
                    .errorMessage(outcome.getErrorMessage())
                    .build());
        }

        try {
            runLogRepository.saveAll(rows);
        } catch (Exception e) {
            log.warn("⚠️ Failed to write reconciliation run log: {}", e.getMessage());
        }
    }

    @FunctionalInterface
    private interface CategoryStep {
        CategoryOutcome apply(String rawJson);
    }
}
