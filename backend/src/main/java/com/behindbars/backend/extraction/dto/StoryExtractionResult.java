package com.behindbars.backend.extraction.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoryExtractionResult {

    private List<UpdatedStory> updatedStories = new ArrayList<>();
    private List<NewStory> newStories = new ArrayList<>();

    @JsonIgnore
    private int invalidRecords;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UpdatedStory {
        @NotBlank
        private String id;
        private String newSummary;
        private List<String> newKeywords;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double impactScore;
        private List<String> articleUrls;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NewStory {
        @NotBlank
        private String topic;
        private String summary;
        private List<String> keywords;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double impactScore;
        private List<String> articleUrls;
    }
}
