package com.behindbars.backend.extraction.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
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
public class EventExtractionResult {

    private List<EventPayload> events = new ArrayList<>();

    @JsonIgnore
    private int invalidRecords;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EventPayload {
        @NotBlank
        @Size(max = 50)
        private String eventType;
        private String eventDate;
        @Size(max = 200)
        private String facility;
        @Size(max = 100)
        private String region;
        @PositiveOrZero
        private Integer count;
        private String description;
        @Size(max = 2000)
        private String sourceUrl;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double confidence;
        private Boolean isAggregate;

        @JsonIgnore
        public LocalDate getParsedEventDate() {
            return ExtractionDates.parse(eventDate);
        }
    }
}
