package com.behindbars.backend.events.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
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
@Table(name = "facility_snapshots", uniqueConstraints = {
        @UniqueConstraint(name = "uq_facility_snapshot", columnNames = {"facility", "snapshot_date", "source_url"})
})
public class FacilitySnapshot {
    public static final int FACILITY_LENGTH = 200;
    public static final int REGION_LENGTH = 100;
    public static final int SOURCE_URL_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "facility", nullable = false, length = FACILITY_LENGTH)
    private String facility;

    @Column(length = REGION_LENGTH)
    private String region;

    @Column(name = "snapshot_date", nullable = false)
    private LocalDate snapshotDate;

    private Integer inmates;

    private Integer capacity;

    private Double occupancyRate; // percentage, e.g. 147.0

    @Column(name = "source_url", length = SOURCE_URL_LENGTH)
    private String sourceUrl;

    @CreationTimestamp
    private LocalDateTime extractedAt;
}
