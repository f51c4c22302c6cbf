package com.behindbars.backend.events.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Compact view of a stored event, handed to the extraction prompt so known events are not extracted again.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RecentEventDto {
    private String eventType;
    private String eventDate;
    private String facility;
    private String description;
    private Boolean isAggregate;
}
