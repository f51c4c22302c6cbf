package com.behindbars.backend.narrative.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Root aggregate of the narrative memory: stories, characters and pending follow-ups.
 * <p>
 * The whole document is loaded, mutated in memory and rewritten as a unit on every run.
 * The query methods below are pure reads over the loaded state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class NarrativeContext {

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private List<StoryThread> ongoingStorylines = new ArrayList<>();

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private List<KeyCharacter> keyCharacters = new ArrayList<>();

    @Builder.Default
    private String editorialTone =
            "Riflessivo e professionale, attento ai progressi ma consapevole delle sfide sistemiche";

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private List<FollowUp> pendingFollowups = new ArrayList<>();

    private LocalDateTime lastUpdated;

    public List<StoryThread> activeStories() {
        return ongoingStorylines.stream()
                .filter(story -> story.getStatus() == StoryStatus.ACTIVE)
                .toList();
    }

    public List<StoryThread> dormantStories() {
        return ongoingStorylines.stream()
                .filter(story -> story.getStatus() == StoryStatus.DORMANT)
                .toList();
    }

    public List<FollowUp> unresolvedFollowups() {
        return pendingFollowups.stream()
                .filter(followUp -> !followUp.isResolved())
                .toList();
    }

    /**
     * Unresolved follow-ups expected on or before the given date.
     */
    public List<FollowUp> dueFollowups(LocalDate asOf) {
        return pendingFollowups.stream()
                .filter(followUp -> !followUp.isResolved())
                .filter(followUp -> followUp.getExpectedDate() != null && !followUp.getExpectedDate().isAfter(asOf))
                .toList();
    }

    /**
     * Exact name first, then a case-insensitive match on name or alias.
     */
    public Optional<KeyCharacter> findCharacterByName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        for (KeyCharacter character : keyCharacters) {
            if (name.equals(character.getName())) {
                return Optional.of(character);
            }
        }
        return keyCharacters.stream()
                .filter(character -> character.isKnownAs(name))
                .findFirst();
    }

    public Optional<FollowUp> findFollowUpById(String followUpId) {
        if (followUpId == null) {
            return Optional.empty();
        }
        return pendingFollowups.stream()
                .filter(followUp -> followUpId.equals(followUp.getId()))
                .findFirst();
    }

    public Optional<StoryThread> findStoryById(String storyId) {
        if (storyId == null) {
            return Optional.empty();
        }
        return ongoingStorylines.stream()
                .filter(story -> storyId.equals(story.getId()))
                .findFirst();
    }

    /**
     * Stories whose topic or one of whose keywords contains the given keyword, ignoring case.
     */
    public List<StoryThread> findStoriesByKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return List.of();
        }
        String needle = keyword.trim().toLowerCase(Locale.ROOT);
        return ongoingStorylines.stream()
                .filter(story -> (story.getTopic() != null && story.getTopic().toLowerCase(Locale.ROOT).contains(needle))
                        || story.getKeywords().stream().anyMatch(kw -> kw.toLowerCase(Locale.ROOT).contains(needle)))
                .toList();
    }
}
