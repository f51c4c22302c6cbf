package com.behindbars.backend.events.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.behindbars.backend.events.dto.PersistResult;
import com.behindbars.backend.events.dto.RecentEventDto;
import com.behindbars.backend.events.entity.FacilitySnapshot;
import com.behindbars.backend.events.entity.PrisonEvent;
import com.behindbars.backend.events.repository.FacilitySnapshotRepository;
import com.behindbars.backend.events.repository.PrisonEventRepository;
import com.behindbars.backend.extraction.dto.EventExtractionResult.EventPayload;
import com.behindbars.backend.extraction.dto.SnapshotExtractionResult.SnapshotPayload;
import com.behindbars.backend.facility.FacilityCatalogLoader;
import com.behindbars.backend.facility.FacilityNormalizer;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import({PrisonEventService.class, EventDeduplicator.class, FacilityNormalizer.class, FacilityCatalogLoader.class})
class PrisonEventServiceTest {

    @Autowired
    private PrisonEventService prisonEventService;

    @Autowired
    private PrisonEventRepository eventRepository;

    @Autowired
    private FacilitySnapshotRepository snapshotRepository;

    @Test
    @DisplayName("A second report of the same suicide under another facility spelling is rejected")
    void rejectsCrossSourceDuplicate() {
        PersistResult first = prisonEventService.persistEvents(List.of(
                suicide("Brescia Canton Mombello", "https://giornale-a.it/1")));
        PersistResult second = prisonEventService.persistEvents(List.of(
                suicide("Canton Mombello", "https://giornale-b.it/2")));

        assertThat(first.getSaved()).isEqualTo(1);
        assertThat(second.getSaved()).isZero();
        assertThat(second.getSkipped()).isEqualTo(1);

        List<PrisonEvent> stored = eventRepository.findAll();
        assertThat(stored).singleElement().satisfies(event -> {
            assertThat(event.getFacility()).isEqualTo("Canton Mombello (Brescia)");
            assertThat(event.getRegion()).isEqualTo("Lombardia");
            assertThat(event.getEventType()).isEqualTo("suicide");
            assertThat(event.getIsAggregate()).isFalse();
        });
    }

    @Test
    @DisplayName("Duplicates inside one batch are caught as well")
    void rejectsSameBatchDuplicate() {
        PersistResult result = prisonEventService.persistEvents(List.of(
                suicide("Canton Mombello", "https://giornale-a.it/1"),
                suicide("Casa Circondariale di Brescia", "https://giornale-b.it/2"),
                EventPayload.builder().eventType("Protest").eventDate("2026-01-10").facility("Canton Mombello")
                        .description("Battitura delle sbarre").sourceUrl("https://giornale-b.it/2").build()));

        assertThat(result.getSaved()).isEqualTo(2);
        assertThat(result.getSkipped()).isEqualTo(1);
        assertThat(eventRepository.findByEventTypeOrderByEventDateDesc("protest")).hasSize(1);
    }

    @Test
    @DisplayName("Year-to-date totals are stored flagged as aggregates and left out of statistics")
    void flagsAggregates() {
        prisonEventService.persistEvents(List.of(
                suicide("Canton Mombello", "https://giornale-a.it/1"),
                EventPayload.builder().eventType("suicide").eventDate("2026-01-10").count(3)
                        .description("Salgono a 3 i suicidi dall'inizio dell'anno")
                        .sourceUrl("https://giornale-c.it/3").build()));

        Map<String, Object> stats = prisonEventService.getEventStats();

        assertThat(stats.get("totalEvents")).isEqualTo(2L);
        assertThat(stats.get("aggregateEvents")).isEqualTo(1L);
        assertThat(stats.get("eventsByType")).isEqualTo(Map.of("suicide", 1L));
        assertThat(stats.get("eventsByRegion")).isEqualTo(Map.of("Lombardia", 1L));
    }

    @Test
    @DisplayName("Recent events for the prompt have normalized facilities and short descriptions")
    void listsRecentEvents() {
        String longDescription = "Un detenuto si è tolto la vita. ".repeat(10);
        prisonEventService.persistEvents(List.of(
                EventPayload.builder().eventType("suicide").eventDate("2026-01-10").facility("Brescia")
                        .description(longDescription).sourceUrl("https://giornale-a.it/1").build(),
                EventPayload.builder().eventType("suicide").eventDate("2025-06-01").facility("Sollicciano")
                        .description("Vecchio caso").sourceUrl("https://giornale-a.it/2").build()));

        List<RecentEventDto> recent = prisonEventService.listRecentForDedup(LocalDate.of(2026, 1, 20));

        assertThat(recent).singleElement().satisfies(dto -> {
            assertThat(dto.getFacility()).isEqualTo("Canton Mombello (Brescia)");
            assertThat(dto.getEventDate()).isEqualTo("2026-01-10");
            assertThat(dto.getDescription()).hasSize(100);
        });
    }

    @Test
    @DisplayName("An over-long value rejects only its own record, the rest of the batch is stored")
    void rejectsOverLongRecordsOnly() {
        PersistResult events = prisonEventService.persistEvents(List.of(
                suicide("San Vittore", "https://giornale-a.it/1"),
                EventPayload.builder().eventType("x".repeat(68)).eventDate("2026-01-10").facility("Poggioreale")
                        .description("Tipo evento non valido").sourceUrl("https://giornale-a.it/2").build(),
                suicide("Istituto " + "penitenziario ".repeat(20), "https://giornale-a.it/3")));

        assertThat(events.getSaved()).isEqualTo(1);
        assertThat(events.getRejected()).isEqualTo(2);
        assertThat(eventRepository.findAll()).singleElement()
                .extracting(PrisonEvent::getFacility).isEqualTo("San Vittore (Milano)");

        PersistResult snapshots = prisonEventService.persistSnapshots(List.of(
                snapshot("Poggioreale", "2026-01-03", 2100, 1600, 131.0, "https://giornale-b.it/" + "p".repeat(2000)),
                snapshot("San Vittore", "2026-01-05", 1100, 750, 146.7, "https://giornale-a.it/1")));

        assertThat(snapshots.getSaved()).isEqualTo(1);
        assertThat(snapshots.getRejected()).isEqualTo(1);
        assertThat(snapshotRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Snapshots without a date are rejected and repeated ones skipped")
    void persistsSnapshots() {
        PersistResult result = prisonEventService.persistSnapshots(List.of(
                snapshot("San Vittore", "2026-01-05", 1100, 750, 146.7, "https://giornale-a.it/1"),
                snapshot("Carcere di San Vittore", "2026-01-05", 1100, 750, 146.7, "https://giornale-a.it/1"),
                snapshot("Poggioreale", null, 2100, 1600, 131.0, "https://giornale-a.it/1"),
                snapshot("Poggioreale", "2026-01-03", 2100, 1600, 131.0, "https://giornale-b.it/2")));

        assertThat(result.getSaved()).isEqualTo(2);
        assertThat(result.getSkipped()).isEqualTo(1);
        assertThat(result.getRejected()).isEqualTo(1);

        PersistResult again = prisonEventService.persistSnapshots(List.of(
                snapshot("San Vittore (Milano)", "2026-01-05", 1100, 750, 146.7, "https://giornale-a.it/1")));
        assertThat(again.getSkipped()).isEqualTo(1);
        assertThat(snapshotRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("The latest snapshot per facility is listed, most crowded first")
    void latestSnapshotPerFacility() {
        prisonEventService.persistSnapshots(List.of(
                snapshot("San Vittore", "2025-12-01", 1050, 750, 140.0, "https://giornale-a.it/1"),
                snapshot("San Vittore", "2026-01-05", 1100, 750, 146.7, "https://giornale-a.it/2"),
                snapshot("Poggioreale", "2026-01-03", 2100, 1400, 150.0, "https://giornale-b.it/3")));

        List<FacilitySnapshot> latest = prisonEventService.findSnapshots(null, null);

        assertThat(latest).extracting(FacilitySnapshot::getFacility)
                .containsExactly("Poggioreale (Napoli)", "San Vittore (Milano)");
        assertThat(latest.get(1).getSnapshotDate()).isEqualTo(LocalDate.of(2026, 1, 5));
        assertThat(prisonEventService.findSnapshots("San Vittore", null)).hasSize(2);
        assertThat(prisonEventService.findSnapshots(null, "Campania")).hasSize(1);
        assertThat(prisonEventService.listRecentSnapshotsForDedup(LocalDate.of(2026, 1, 10))).hasSize(2);
    }

    private static EventPayload suicide(String facility, String url) {
        return EventPayload.builder()
                .eventType("suicide")
                .eventDate("2026-01-10")
                .facility(facility)
                .count(1)
                .description("Un detenuto si è tolto la vita")
                .sourceUrl(url)
                .build();
    }

    private static SnapshotPayload snapshot(String facility, String date, int inmates, int capacity,
                                            double rate, String url) {
        return SnapshotPayload.builder()
                .facility(facility)
                .snapshotDate(date)
                .inmates(inmates)
                .capacity(capacity)
                .occupancyRate(rate)
                .sourceUrl(url)
                .build();
    }
}
