package com.behindbars.backend.narrative.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A narrative arc tracked across daily runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoryThread {

    @Setter(AccessLevel.NONE)
    @JsonProperty("id")
    private String id;

    private String topic;

    @Builder.Default
    private StoryStatus status = StoryStatus.ACTIVE;

    @Setter(AccessLevel.NONE)
    @JsonProperty("first_seen")
    private LocalDate firstSeen;

    private LocalDate lastUpdate;

    private String summary;

    // Lowercase tokens, kept free of duplicates
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private List<String> relatedArticles = new ArrayList<>();

    @Builder.Default
    private int mentionCount = 1;

    @Builder.Default
    private double impactScore = 0.0;

    private boolean weeklyHighlight;

    @JsonIgnore
    public boolean isActive() {
        return status == StoryStatus.ACTIVE;
    }

    @JsonIgnore
    public boolean isResolved() {
        return status == StoryStatus.RESOLVED;
    }

    /**
     * Union the given keywords into this story, lowercased. Returns how many were new.
     */
    public int addKeywords(Collection<String> newKeywords) {
        if (newKeywords == null) return 0;
        int added = 0;
        for (String keyword : newKeywords) {
            if (keyword == null || keyword.isBlank()) continue;
            String normalized = keyword.trim().toLowerCase(Locale.ROOT);
            if (!keywords.contains(normalized)) {
                keywords.add(normalized);
                added++;
            }
        }
        return added;
    }

    /**
     * Append article URLs not already related to this story, preserving order.
     */
    public int addRelatedArticles(Collection<String> urls) {
        if (urls == null) return 0;
        int added = 0;
        for (String url : urls) {
            if (url == null || url.isBlank()) continue;
            String trimmed = url.trim();
            if (!relatedArticles.contains(trimmed)) {
                relatedArticles.add(trimmed);
                added++;
            }
        }
        return added;
    }

    /**
     * Count one more mention on the given run date. Never moves last_update before first_seen.
     */
    public void recordMention(LocalDate runDate) {
        mentionCount++;
        lastUpdate = firstSeen != null && runDate.isBefore(firstSeen) ? firstSeen : runDate;
    }
}
