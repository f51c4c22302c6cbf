package com.behindbars.backend.extraction.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
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
public class SnapshotExtractionResult {

    private List<SnapshotPayload> snapshots = new ArrayList<>();

    @JsonIgnore
    private int invalidRecords;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SnapshotPayload {
        @NotBlank
        @Size(max = 200)
        private String facility;
        @Size(max = 100)
        private String region;
        private String snapshotDate;
        @PositiveOrZero
        private Integer inmates;
        @PositiveOrZero
        private Integer capacity;
        @PositiveOrZero
        private Double occupancyRate;
        @Size(max = 2000)
        private String sourceUrl;

        @JsonIgnore
        public LocalDate getParsedSnapshotDate() {
            return ExtractionDates.parse(snapshotDate);
        }
    }
}
