package com.behindbars.backend.events.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "prison_events", indexes = {
        @Index(name = "idx_prison_events_date", columnList = "event_date"),
        @Index(name = "idx_prison_events_source_url", columnList = "source_url")
})
public class PrisonEvent {
    public static final int EVENT_TYPE_LENGTH = 50;
    public static final int FACILITY_LENGTH = 200;
    public static final int REGION_LENGTH = 100;
    public static final int SOURCE_URL_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = EVENT_TYPE_LENGTH)
    private String eventType; // suicide, protest, overcrowding, ...

    @Column(name = "event_date")
    private LocalDate eventDate;

    // Canonical facility name
    @Column(length = FACILITY_LENGTH)
    private String facility;

    @Column(length = REGION_LENGTH)
    private String region;

    @Column(name = "event_count")
    private Integer count;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "source_url", length = SOURCE_URL_LENGTH)
    private String sourceUrl;

    @Column(nullable = false)
    @Builder.Default
    private Double confidence = 1.0;

    // Statistical roll-up rather than one incident
    @Column(nullable = false)
    @Builder.Default
    private Boolean isAggregate = false;

    @CreationTimestamp
    private LocalDateTime extractedAt;
}
