package com.behindbars.backend.events.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.behindbars.backend.events.dto.FacilityNormalizationReport;
import com.behindbars.backend.events.entity.FacilitySnapshot;
import com.behindbars.backend.events.entity.PrisonEvent;
import com.behindbars.backend.events.repository.FacilitySnapshotRepository;
import com.behindbars.backend.events.repository.PrisonEventRepository;
import com.behindbars.backend.facility.FacilityCatalogLoader;
import com.behindbars.backend.facility.FacilityNormalizer;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import({FacilityNormalizationService.class, FacilityNormalizer.class, FacilityCatalogLoader.class})
class FacilityNormalizationServiceTest {

    @Autowired
    private FacilityNormalizationService normalizationService;

    @Autowired
    private PrisonEventRepository eventRepository;

    @Autowired
    private FacilitySnapshotRepository snapshotRepository;

    @BeforeEach
    void setUp() {
        eventRepository.saveAll(List.of(
                event("Brescia Canton Mombello"),
                event("Canton Mombello (Brescia)"),
                event("carcere di san vittore"),
                event("Lecce"),
                event(null)));
        snapshotRepository.saveAll(List.of(
                snapshot("San Vittore (Milano)", LocalDate.of(2026, 1, 5), "https://giornale-a.it/1"),
                snapshot("Carcere di San Vittore", LocalDate.of(2026, 1, 5), "https://giornale-a.it/1"),
                snapshot("Poggioreale", LocalDate.of(2026, 1, 3), "https://giornale-b.it/2")));
    }

    @Test
    @DisplayName("A dry run reports the renames without touching stored rows")
    void dryRunReportsOnly() {
        FacilityNormalizationReport report = normalizationService.normalizeStoredFacilities(true);

        assertThat(report.isDryRun()).isTrue();
        assertThat(report.getEventFacilitiesBefore()).isEqualTo(4);
        assertThat(report.getEventFacilitiesAfter()).isEqualTo(3);
        assertThat(report.getEventsUpdated()).isEqualTo(2);
        assertThat(report.getSnapshotFacilitiesBefore()).isEqualTo(3);
        assertThat(report.getSnapshotFacilitiesAfter()).isEqualTo(2);
        assertThat(report.getSnapshotsUpdated()).isEqualTo(1);
        assertThat(report.getSnapshotsMerged()).isEqualTo(1);
        assertThat(report.getSampleChanges()).hasSize(4);

        assertThat(eventRepository.findByFacilityOrderByEventDateDesc("Brescia Canton Mombello")).hasSize(1);
        assertThat(snapshotRepository.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("Applied normalization renames rows, merges colliding snapshots and is then a no-op")
    void appliesAndSettles() {
        normalizationService.normalizeStoredFacilities(false);

        assertThat(eventRepository.findAllByOrderByIdAsc()).extracting(PrisonEvent::getFacility)
                .containsExactly("Canton Mombello (Brescia)", "Canton Mombello (Brescia)",
                        "San Vittore (Milano)", "Lecce", null);
        assertThat(snapshotRepository.findAllByOrderByIdAsc()).extracting(FacilitySnapshot::getFacility)
                .containsExactly("San Vittore (Milano)", "Poggioreale (Napoli)");

        FacilityNormalizationReport again = normalizationService.normalizeStoredFacilities(false);
        assertThat(again.getEventsUpdated()).isZero();
        assertThat(again.getSnapshotsUpdated()).isZero();
        assertThat(again.getSnapshotsMerged()).isZero();
        assertThat(again.getSampleChanges()).isEmpty();
    }

    private static PrisonEvent event(String facility) {
        return PrisonEvent.builder()
                .eventType("suicide")
                .eventDate(LocalDate.of(2026, 1, 10))
                .facility(facility)
                .description("Un detenuto si è tolto la vita")
                .sourceUrl("https://giornale-a.it/" + facility)
                .build();
    }

    private static FacilitySnapshot snapshot(String facility, LocalDate date, String url) {
        return FacilitySnapshot.builder()
                .facility(facility)
                .snapshotDate(date)
                .inmates(1000)
                .capacity(700)
                .sourceUrl(url)
                .build();
    }
}
