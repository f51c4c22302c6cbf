package com.behindbars.backend.pipeline;

import com.behindbars.backend.article.dto.EnrichedArticle;
import com.behindbars.backend.config.NarrativeProperties;
import com.behindbars.backend.extraction.AiExtractionService;
import com.behindbars.backend.extraction.ExtractionBundle;
import com.behindbars.backend.narrative.model.FollowUp;
import com.behindbars.backend.narrative.model.NarrativeContext;
import com.behindbars.backend.narrative.storage.NarrativeStore;
import com.behindbars.backend.pipeline.entity.ReconciliationRunLog;
import com.behindbars.backend.pipeline.repository.ReconciliationRunLogRepository;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Entry point of the daily cycle, shared by the scheduler and the manual REST trigger.
 * Runs never overlap: the narrative document is read, changed and rewritten as a whole.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailyRunService {

    private final NarrativeStore narrativeStore;
    private final AiExtractionService extractionService;
    private final ReconciliationOrchestrator orchestrator;
    private final ReconciliationRunLogRepository runLogRepository;
    private final NarrativeProperties properties;

    private final ReentrantLock runLock = new ReentrantLock();

    @Value("${pipeline.scheduler-enabled:false}")
    private boolean schedulerEnabled;

    @Scheduled(cron = "${pipeline.daily-cron:0 0 7 * * *}")
    public void scheduledRun() {
        if (!schedulerEnabled) {
            log.debug("Daily run scheduler disabled via configuration");
            return;
        }

        try {
            runFor(LocalDate.now());
        } catch (Exception e) {
            log.error("❌ Scheduled daily run failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Extract from the articles collected on {@code runDate} and reconcile the result.
     */
    public RunReport runFor(LocalDate runDate) {
        if (runLock.isLocked()) {
            log.info("⏳ Another run is in progress, waiting for it to finish");
        }
        runLock.lock();
        try {
            log.info("🌟 ===== DAILY RUN {} STARTED =====", runDate);
            Map<String, EnrichedArticle> articles = narrativeStore.loadCollectedArticles(runDate);

            NarrativeContext promptContext;
            try {
                promptContext = narrativeStore.load();
            } catch (RuntimeException e) {
                log.warn("⚠️ Narrative context unavailable for extraction prompts: {}", e.getMessage());
                promptContext = new NarrativeContext();
            }

            ExtractionBundle bundle = extractionService.extract(articles, promptContext, runDate);
            RunReport report = orchestrator.run(articles, bundle, runDate);

            narrativeStore.cleanupOldCollections(runDate, properties.getCollectedArticlesKeepDays());
            log.info("🎉 ===== DAILY RUN {} COMPLETED =====", runDate);
            return report;
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Archive stale stories outside of a full run, under the same lock.
     */
    public int archiveStories(LocalDate asOf) {
        runLock.lock();
        try {
            NarrativeContext context = narrativeStore.load();
            int archived = narrativeStore.archiveStale(context, asOf);
            narrativeStore.save(context);
            log.info("🗄️ Archived {} stale stories as of {}", archived, asOf);
            return archived;
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Mark a follow-up as resolved and save the context, under the run lock.
     * Resolving an already resolved follow-up leaves the document untouched.
     */
    public Optional<FollowUp> resolveFollowUp(String followUpId) {
        runLock.lock();
        try {
            NarrativeContext context = narrativeStore.load();
            Optional<FollowUp> followUp = context.findFollowUpById(followUpId);
            if (followUp.isEmpty()) {
                log.warn("⚠️ No follow-up with id {}", followUpId);
                return Optional.empty();
            }
            if (!followUp.get().isResolved()) {
                followUp.get().resolve();
                narrativeStore.save(context);
                log.info("✔️ Follow-up resolved: {}", followUp.get().getEvent());
            }
            return followUp;
        } finally {
            runLock.unlock();
        }
    }

    public Path storeCollection(LocalDate collectionDate, Map<String, EnrichedArticle> articles) {
        return narrativeStore.saveCollectedArticles(articles, collectionDate);
    }

    public List<LocalDate> availableCollections() {
        return narrativeStore.availableCollectionDates();
    }

    public List<ReconciliationRunLog> recentRunLog() {
        return runLogRepository.findTop50ByOrderByIdDesc();
    }

    public List<ReconciliationRunLog> runLogFor(LocalDate runDate) {
        return runLogRepository.findByRunDateOrderByIdAsc(runDate);
    }
}
