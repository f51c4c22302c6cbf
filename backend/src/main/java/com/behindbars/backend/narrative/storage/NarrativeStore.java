package com.behindbars.backend.narrative.storage;

import com.behindbars.backend.article.dto.EnrichedArticle;
import com.behindbars.backend.config.NarrativeProperties;
import com.behindbars.backend.narrative.model.NarrativeContext;
import com.behindbars.backend.narrative.model.StoryStatus;
import com.behindbars.backend.narrative.model.StoryThread;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * File-backed persistence of the narrative memory and of the daily article collections.
 * <p>
 * The narrative document is read and rewritten as a whole. Writes go to a temporary
 * sibling file first and are then moved over the previous document, so an interrupted
 * save leaves the last good state in place.
 */
@Slf4j
@Component
public class NarrativeStore {

    private static final String COLLECTED_ARTICLES_DIR = "collected_articles";
    private static final String JSON_SUFFIX = ".json";

    private final NarrativeProperties properties;
    private final ObjectMapper objectMapper;

    public NarrativeStore(NarrativeProperties properties) {
        this.properties = properties;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path contextPath() {
        return Paths.get(properties.getDataDir(), properties.getContextFile());
    }

    public Path collectedArticlesDir() {
        return Paths.get(properties.getDataDir(), COLLECTED_ARTICLES_DIR);
    }

    /**
     * Load the narrative document, or an empty context when none has been saved yet.
     */
    public NarrativeContext load() {
        Path path = contextPath();
        if (!Files.exists(path)) {
            log.info("📭 No narrative context at {}, starting empty", path);
            NarrativeContext empty = new NarrativeContext();
            empty.setEditorialTone(properties.getEditorialTone());
            return empty;
        }

        try {
            NarrativeContext context = objectMapper.readValue(path.toFile(), NarrativeContext.class);
            log.info("📖 Narrative context loaded: {} stories, {} characters, {} follow-ups",
                    context.getOngoingStorylines().size(),
                    context.getKeyCharacters().size(),
                    context.getPendingFollowups().size());
            return context;
        } catch (IOException e) {
            log.error("❌ Failed to read narrative context {}: {}", path, e.getMessage());
            throw new NarrativeStorageException("Failed to read narrative context " + path, e);
        }
    }

    /**
     * Stamp {@code last_updated} and replace the stored document.
     */
    public void save(NarrativeContext context) {
        context.setLastUpdated(LocalDateTime.now());
        Path path = contextPath();
        writeAtomically(path, context);
        log.info("💾 Narrative context saved to {} ({} stories)", path, context.getOngoingStorylines().size());
    }

    /**
     * Move active stories not updated within {@code maxAgeDays} of {@code asOf} to dormant.
     * Already dormant or resolved stories are left alone, so repeated calls are no-ops.
     *
     * @return number of stories archived by this call
     */
    public int archiveStale(NarrativeContext context, LocalDate asOf, int maxAgeDays) {
        LocalDate cutoff = asOf.minusDays(maxAgeDays);
        int archived = 0;

        for (StoryThread story : context.getOngoingStorylines()) {
            if (story.getStatus() == StoryStatus.ACTIVE
                    && story.getLastUpdate() != null
                    && story.getLastUpdate().isBefore(cutoff)) {
                story.setStatus(StoryStatus.DORMANT);
                archived++;
                log.info("🗄️ Story archived: {} ({})", story.getId(), story.getTopic());
            }
        }
        return archived;
    }

    public int archiveStale(NarrativeContext context, LocalDate asOf) {
        return archiveStale(context, asOf, properties.getStoryArchiveDays());
    }

    public Path saveCollectedArticles(Map<String, EnrichedArticle> articles, LocalDate collectionDate) {
        Path path = collectedArticlesDir().resolve(collectionDate + JSON_SUFFIX);
        writeAtomically(path, articles);
        log.info("💾 Saved {} collected articles to {}", articles.size(), path);
        return path;
    }

    /**
     * Articles collected on the given date keyed by URL, or an empty map if that day was not collected.
     */
    public Map<String, EnrichedArticle> loadCollectedArticles(LocalDate collectionDate) {
        Path path = collectedArticlesDir().resolve(collectionDate + JSON_SUFFIX);
        if (!Files.exists(path)) {
            log.warn("⚠️ No collected articles for {}", collectionDate);
            return Collections.emptyMap();
        }

        try {
            Map<String, EnrichedArticle> articles = objectMapper.readValue(path.toFile(),
                    new TypeReference<LinkedHashMap<String, EnrichedArticle>>() {});
            log.info("📖 Loaded {} collected articles for {}", articles.size(), collectionDate);
            return articles;
        } catch (IOException e) {
            throw new NarrativeStorageException("Failed to read collected articles " + path, e);
        }
    }

    /**
     * Dates with a stored collection, oldest first. Files not named after an ISO date are ignored.
     */
    public List<LocalDate> availableCollectionDates() {
        Path dir = collectedArticlesDir();
        List<LocalDate> dates = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return dates;
        }

        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + JSON_SUFFIX)) {
            for (Path file : files) {
                LocalDate date = dateOf(file);
                if (date != null) {
                    dates.add(date);
                }
            }
        } catch (IOException e) {
            throw new NarrativeStorageException("Failed to list collected articles in " + dir, e);
        }

        Collections.sort(dates);
        return dates;
    }

    /**
     * Delete collections older than {@code keepDays} before {@code asOf}.
     *
     * @return number of files removed
     */
    public int cleanupOldCollections(LocalDate asOf, int keepDays) {
        LocalDate cutoff = asOf.minusDays(keepDays);
        int removed = 0;

        for (LocalDate date : availableCollectionDates()) {
            if (!date.isBefore(cutoff)) {
                continue;
            }
            Path file = collectedArticlesDir().resolve(date + JSON_SUFFIX);
            try {
                Files.deleteIfExists(file);
                removed++;
                log.debug("Removed old collection {}", file);
            } catch (IOException e) {
                throw new NarrativeStorageException("Failed to delete " + file, e);
            }
        }

        if (removed > 0) {
            log.info("🧹 Removed {} old article collections", removed);
        }
        return removed;
    }

    private void writeAtomically(Path target, Object value) {
        Path tempFile = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(tempFile.toFile(), value);
            try {
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", target);
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("❌ Failed to write {}: {}", target, e.getMessage());
            throw new NarrativeStorageException("Failed to write " + target, e);
        }
    }

    private static LocalDate dateOf(Path file) {
        String name = file.getFileName().toString();
        String stem = name.substring(0, name.length() - JSON_SUFFIX.length());
        try {
            return LocalDate.parse(stem);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
