package com.behindbars.backend.extraction.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import java.time.LocalDate;
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
public class FollowUpExtractionResult {

    private List<FollowUpPayload> followups = new ArrayList<>();

    @JsonIgnore
    private int invalidRecords;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FollowUpPayload {
        @NotBlank
        private String event;
        private String expectedDate;
        private String storyId;
        private String sourceUrl;

        // Helper method to convert expectedDate string to LocalDate
        @JsonIgnore
        public LocalDate getParsedExpectedDate() {
            return ExtractionDates.parse(expectedDate);
        }
    }
}
