package com.behindbars.backend.narrative.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * An expected future event or deadline worth reminding about.
 * <p>
 * {@code storyId} is a plain identifier resolved through
 * {@link NarrativeContext#findStoryById(String)}; it may point to no story at all.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FollowUp {

    @Setter(AccessLevel.NONE)
    @JsonProperty("id")
    private String id;

    private String event;

    private LocalDate expectedDate;

    private String storyId;

    private LocalDate createdAt;

    @Setter(AccessLevel.NONE)
    @JsonProperty("resolved")
    private boolean resolved;

    public void resolve() {
        this.resolved = true;
    }
}
