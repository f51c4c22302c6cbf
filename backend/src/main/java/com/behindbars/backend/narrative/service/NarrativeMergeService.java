package com.behindbars.backend.narrative.service;

import com.behindbars.backend.config.NarrativeProperties;
import com.behindbars.backend.extraction.dto.CharacterExtractionResult;
import com.behindbars.backend.extraction.dto.CharacterExtractionResult.NewCharacter;
import com.behindbars.backend.extraction.dto.CharacterExtractionResult.PositionPayload;
import com.behindbars.backend.extraction.dto.CharacterExtractionResult.UpdatedCharacter;
import com.behindbars.backend.extraction.dto.FollowUpExtractionResult;
import com.behindbars.backend.extraction.dto.FollowUpExtractionResult.FollowUpPayload;
import com.behindbars.backend.extraction.dto.StoryExtractionResult;
import com.behindbars.backend.extraction.dto.StoryExtractionResult.NewStory;
import com.behindbars.backend.extraction.dto.StoryExtractionResult.UpdatedStory;
import com.behindbars.backend.narrative.matching.StoryMatcher;
import com.behindbars.backend.narrative.model.CharacterPosition;
import com.behindbars.backend.narrative.model.FollowUp;
import com.behindbars.backend.narrative.model.KeyCharacter;
import com.behindbars.backend.narrative.model.NarrativeContext;
import com.behindbars.backend.narrative.model.StoryThread;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies validated extraction results to the in-memory narrative context.
 * <p>
 * Nothing here touches storage; the caller loads and saves the context around a run.
 * Records that cannot be applied are skipped with a warning and counted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NarrativeMergeService {

    static final double DEFAULT_IMPACT_SCORE = 0.5;

    private final NarrativeProperties properties;

    public MergeResult mergeStories(NarrativeContext context, StoryExtractionResult extraction, LocalDate runDate) {
        MergeResult result = new MergeResult(0, extraction.getInvalidRecords());
        Set<String> touched = new HashSet<>();

        for (UpdatedStory update : nullSafe(extraction.getUpdatedStories())) {
            if (applyStoryUpdate(context, update, runDate, touched)) {
                result.recordApplied();
            } else {
                result.recordSkipped();
            }
        }
        for (NewStory proposal : nullSafe(extraction.getNewStories())) {
            createStory(context, proposal, runDate, touched);
            result.recordApplied();
        }

        log.info("📚 Stories merged: {} applied, {} skipped", result.getApplied(), result.getSkipped());
        return result;
    }

    /**
     * Merge an update into the story with the given id.
     *
     * @return false when no story has that id
     */
    public boolean applyStoryUpdate(NarrativeContext context, UpdatedStory update, LocalDate runDate) {
        return applyStoryUpdate(context, update, runDate, new HashSet<>());
    }

    private boolean applyStoryUpdate(NarrativeContext context, UpdatedStory update, LocalDate runDate,
                                     Set<String> touched) {
        Optional<StoryThread> existing = context.findStoryById(update.getId());
        if (existing.isEmpty()) {
            log.warn("⚠️ Story update for unknown id {}, skipping", update.getId());
            return false;
        }

        StoryThread story = existing.get();
        mergeInto(story, update.getNewSummary(), update.getNewKeywords(), update.getImpactScore(),
                update.getArticleUrls(), runDate, touched);
        log.debug("Story updated: {} (mentions: {})", story.getTopic(), story.getMentionCount());
        return true;
    }

    /**
     * Start tracking a new story, or fold the proposal into a non-resolved story with the same topic.
     */
    public StoryThread createStory(NarrativeContext context, NewStory proposal, LocalDate runDate) {
        return createStory(context, proposal, runDate, new HashSet<>());
    }

    private StoryThread createStory(NarrativeContext context, NewStory proposal, LocalDate runDate,
                                    Set<String> touched) {
        Optional<StoryThread> sameTopic = context.getOngoingStorylines().stream()
                .filter(story -> !story.isResolved())
                .filter(story -> story.getTopic() != null && story.getTopic().trim().equalsIgnoreCase(proposal.getTopic().trim()))
                .findFirst();

        if (sameTopic.isPresent()) {
            StoryThread story = sameTopic.get();
            mergeInto(story, proposal.getSummary(), proposal.getKeywords(), proposal.getImpactScore(),
                    proposal.getArticleUrls(), runDate, touched);
            log.info("🔗 New story '{}' matches tracked story {}, merged", proposal.getTopic(), story.getId());
            return story;
        }

        StoryThread story = StoryThread.builder()
                .id(UUID.randomUUID().toString())
                .topic(proposal.getTopic().trim())
                .firstSeen(runDate)
                .lastUpdate(runDate)
                .summary(proposal.getSummary() != null ? proposal.getSummary() : "")
                .impactScore(proposal.getImpactScore() != null ? proposal.getImpactScore() : DEFAULT_IMPACT_SCORE)
                .build();
        story.addKeywords(proposal.getKeywords());
        story.addRelatedArticles(proposal.getArticleUrls());

        context.getOngoingStorylines().add(story);
        touched.add(story.getId());
        log.info("🆕 New story created: {} ({})", story.getTopic(), story.getId());
        return story;
    }

    public MergeResult mergeCharacters(NarrativeContext context, CharacterExtractionResult extraction,
                                       LocalDate runDate) {
        MergeResult result = new MergeResult(0, extraction.getInvalidRecords());

        for (UpdatedCharacter update : nullSafe(extraction.getUpdatedCharacters())) {
            if (applyCharacterUpdate(context, update, runDate)) {
                result.recordApplied();
            } else {
                result.recordSkipped();
            }
        }
        for (NewCharacter proposal : nullSafe(extraction.getNewCharacters())) {
            createCharacter(context, proposal, runDate);
            result.recordApplied();
        }

        log.info("👤 Characters merged: {} applied, {} skipped", result.getApplied(), result.getSkipped());
        return result;
    }

    /**
     * Append today's position to a known character.
     *
     * @return false when the name resolves to no character or no position was supplied
     */
    public boolean applyCharacterUpdate(NarrativeContext context, UpdatedCharacter update, LocalDate runDate) {
        if (update.getNewPosition() == null) {
            log.warn("⚠️ Character update for {} has no position, skipping", update.getName());
            return false;
        }

        Optional<KeyCharacter> existing = context.findCharacterByName(update.getName());
        if (existing.isEmpty()) {
            log.warn("⚠️ Character update for unknown name {}, skipping", update.getName());
            return false;
        }

        existing.get().addPosition(toPosition(update.getNewPosition(), runDate));
        return true;
    }

    /**
     * Register a new character. A name or alias that already resolves to a character
     * appends the position and aliases to that character instead.
     */
    public KeyCharacter createCharacter(NarrativeContext context, NewCharacter proposal, LocalDate runDate) {
        Optional<KeyCharacter> existing = findByNameOrAliases(context, proposal);

        if (existing.isPresent()) {
            KeyCharacter character = existing.get();
            List<String> aliases = new ArrayList<>(nullSafe(proposal.getAliases()));
            aliases.add(proposal.getName());
            character.addAliases(aliases);
            if (character.getRole() == null || character.getRole().isBlank()) {
                character.setRole(proposal.getRole());
            }
            if (proposal.getInitialPosition() != null) {
                character.addPosition(toPosition(proposal.getInitialPosition(), runDate));
            }
            log.info("🔗 New character '{}' already tracked as {}, merged", proposal.getName(), character.getName());
            return character;
        }

        KeyCharacter character = KeyCharacter.builder()
                .name(proposal.getName().trim())
                .role(proposal.getRole() != null ? proposal.getRole() : "")
                .build();
        character.addAliases(proposal.getAliases());
        if (proposal.getInitialPosition() != null) {
            character.addPosition(toPosition(proposal.getInitialPosition(), runDate));
        }

        context.getKeyCharacters().add(character);
        log.info("🆕 New character tracked: {}", character.getName());
        return character;
    }

    public MergeResult appendFollowUps(NarrativeContext context, FollowUpExtractionResult extraction,
                                       LocalDate runDate) {
        MergeResult result = new MergeResult(0, extraction.getInvalidRecords());

        for (FollowUpPayload payload : nullSafe(extraction.getFollowups())) {
            if (appendFollowUp(context, payload, runDate).isPresent()) {
                result.recordApplied();
            } else {
                result.recordSkipped();
            }
        }

        log.info("📅 Follow-ups appended: {} applied, {} skipped", result.getApplied(), result.getSkipped());
        return result;
    }

    /**
     * Append a follow-up unless its date is unreadable or an equivalent unresolved one is
     * already pending for the same date.
     */
    public Optional<FollowUp> appendFollowUp(NarrativeContext context, FollowUpPayload payload, LocalDate runDate) {
        LocalDate expectedDate = payload.getParsedExpectedDate();
        if (expectedDate == null) {
            log.warn("⚠️ Follow-up '{}' has invalid expected date '{}', skipping",
                    payload.getEvent(), payload.getExpectedDate());
            return Optional.empty();
        }

        if (properties.isFollowupDedupEnabled()) {
            Optional<FollowUp> duplicate = findEquivalentFollowUp(context, payload.getEvent(), expectedDate);
            if (duplicate.isPresent()) {
                log.info("🔁 Follow-up '{}' already pending as {}, skipping", payload.getEvent(), duplicate.get().getId());
                return Optional.empty();
            }
        }

        if (payload.getStoryId() != null && context.findStoryById(payload.getStoryId()).isEmpty()) {
            log.debug("Follow-up references unknown story {}", payload.getStoryId());
        }

        FollowUp followUp = FollowUp.builder()
                .id(UUID.randomUUID().toString())
                .event(payload.getEvent().trim())
                .expectedDate(expectedDate)
                .storyId(payload.getStoryId())
                .createdAt(runDate)
                .build();
        context.getPendingFollowups().add(followUp);
        return Optional.of(followUp);
    }

    Optional<FollowUp> findEquivalentFollowUp(NarrativeContext context, String event, LocalDate expectedDate) {
        Set<String> eventKeywords = StoryMatcher.extractKeywords(event);
        String normalizedEvent = StoryMatcher.normalizeText(event);

        return context.unresolvedFollowups().stream()
                .filter(existing -> expectedDate.equals(existing.getExpectedDate()))
                .filter(existing -> {
                    String other = existing.getEvent() == null ? "" : existing.getEvent();
                    if (StoryMatcher.normalizeText(other).equals(normalizedEvent)) {
                        return true;
                    }
                    return StoryMatcher.keywordOverlap(eventKeywords, StoryMatcher.extractKeywords(other))
                            >= properties.getFollowupDedupThreshold();
                })
                .findFirst();
    }

    /**
     * A story touched more than once in the same run still counts a single mention.
     */
    private void mergeInto(StoryThread story, String summary, Collection<String> keywords, Double impactScore,
                           Collection<String> articleUrls, LocalDate runDate, Set<String> touched) {
        if (summary != null && !summary.isBlank()) {
            story.setSummary(summary);
        }
        story.addKeywords(keywords);
        if (impactScore != null) {
            story.setImpactScore(impactScore);
        }
        story.addRelatedArticles(articleUrls);
        if (touched.add(story.getId())) {
            story.recordMention(runDate);
        }
    }

    private Optional<KeyCharacter> findByNameOrAliases(NarrativeContext context, NewCharacter proposal) {
        Optional<KeyCharacter> byName = context.findCharacterByName(proposal.getName());
        if (byName.isPresent()) {
            return byName;
        }
        for (String alias : nullSafe(proposal.getAliases())) {
            Optional<KeyCharacter> byAlias = context.findCharacterByName(alias);
            if (byAlias.isPresent()) {
                return byAlias;
            }
        }
        return Optional.empty();
    }

    private static CharacterPosition toPosition(PositionPayload payload, LocalDate runDate) {
        return new CharacterPosition(runDate, payload.getStance(), payload.getSourceUrl());
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
