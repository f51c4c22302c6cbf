package com.behindbars.backend.events.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.behindbars.backend.events.entity.FacilitySnapshot;
import com.behindbars.backend.events.entity.PrisonEvent;
import com.behindbars.backend.facility.FacilityCatalogLoader;
import com.behindbars.backend.facility.FacilityNormalizer;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EventDeduplicatorTest {

    private static final LocalDate DATE = LocalDate.of(2026, 1, 10);

    private EventDeduplicator deduplicator;

    @BeforeEach
    void setUp() {
        FacilityNormalizer normalizer = new FacilityNormalizer(
                FacilityCatalogLoader.load(getClass().getResourceAsStream("/facilities.yml")));
        deduplicator = new EventDeduplicator(normalizer);
    }

    @Test
    @DisplayName("Same suicide reported by two sources with different facility spellings is a duplicate")
    void crossSourceDuplicate() {
        PrisonEvent stored = event("suicide", DATE, "Brescia Canton Mombello", "https://giornale-a.it/1", false);
        PrisonEvent candidate = event("suicide", DATE, "Canton Mombello", "https://giornale-b.it/2", false);

        assertThat(deduplicator.isDuplicateEvent(candidate, List.of(stored))).isTrue();
    }

    @Test
    @DisplayName("Different type, date or facility is not a duplicate")
    void distinctEvents() {
        PrisonEvent stored = event("suicide", DATE, "Canton Mombello", "https://giornale-a.it/1", false);

        assertThat(deduplicator.isDuplicateEvent(
                event("protest", DATE, "Canton Mombello", "https://giornale-a.it/1", false), List.of(stored))).isFalse();
        assertThat(deduplicator.isDuplicateEvent(
                event("suicide", DATE.plusDays(1), "Canton Mombello", "https://giornale-b.it/2", false), List.of(stored))).isFalse();
        assertThat(deduplicator.isDuplicateEvent(
                event("suicide", DATE, "Sollicciano", "https://giornale-b.it/2", false), List.of(stored))).isFalse();
    }

    @Test
    @DisplayName("Event type comparison ignores case")
    void typeIgnoresCase() {
        PrisonEvent stored = event("Suicide", DATE, "Canton Mombello", "https://giornale-a.it/1", false);

        assertThat(deduplicator.isDuplicateEvent(
                event("suicide", DATE, "Casa Circondariale di Brescia", "https://giornale-b.it/2", false), List.of(stored)))
                .isTrue();
    }

    @Test
    @DisplayName("Aggregates are excluded from cross-source matching but not from the exact key")
    void aggregatesOnlyMatchExactly() {
        PrisonEvent storedAggregate = event("suicide", DATE, "Canton Mombello", "https://giornale-a.it/1", true);

        assertThat(deduplicator.isDuplicateEvent(
                event("suicide", DATE, "Canton Mombello", "https://giornale-b.it/2", false), List.of(storedAggregate)))
                .isFalse();
        assertThat(deduplicator.isDuplicateEvent(
                event("suicide", DATE, "Brescia", "https://giornale-a.it/1", true), List.of(storedAggregate)))
                .isTrue();
    }

    @Test
    @DisplayName("Undated events only match on the exact key")
    void undatedEvents() {
        PrisonEvent stored = event("overcrowding", null, "Poggioreale", "https://giornale-a.it/1", false);

        assertThat(deduplicator.isDuplicateEvent(
                event("overcrowding", null, "Poggioreale", "https://giornale-b.it/2", false), List.of(stored))).isFalse();
        assertThat(deduplicator.isDuplicateEvent(
                event("overcrowding", null, "Napoli Poggioreale", "https://giornale-a.it/1", false), List.of(stored))).isTrue();
    }

    @Test
    @DisplayName("Snapshots match on canonical facility, date and source")
    void duplicateSnapshots() {
        FacilitySnapshot stored = FacilitySnapshot.builder()
                .facility("San Vittore (Milano)").snapshotDate(DATE).sourceUrl("https://giornale-a.it/1").build();

        FacilitySnapshot sameFromAlias = FacilitySnapshot.builder()
                .facility("Carcere di San Vittore").snapshotDate(DATE).sourceUrl("https://giornale-a.it/1").build();
        FacilitySnapshot otherSource = FacilitySnapshot.builder()
                .facility("San Vittore").snapshotDate(DATE).sourceUrl("https://giornale-b.it/2").build();

        assertThat(deduplicator.isDuplicateSnapshot(sameFromAlias, List.of(stored))).isTrue();
        assertThat(deduplicator.isDuplicateSnapshot(otherSource, List.of(stored))).isFalse();
    }

    @Test
    @DisplayName("Year-to-date totals are recognized as aggregates")
    void recognizesAggregates() {
        assertThat(deduplicator.isAggregate("Salgono a 80 i suicidi dall'inizio dell'anno", 80, DATE)).isTrue();
        assertThat(deduplicator.isAggregate("Nel 2025 in totale 91 suicidi", null, null)).isTrue();
        assertThat(deduplicator.isAggregate("45 suicides in 2025 across Italian prisons", null, null)).isTrue();
        assertThat(deduplicator.isAggregate("Bilancio", 12, LocalDate.of(2026, 1, 1))).isTrue();

        assertThat(deduplicator.isAggregate("Un detenuto di 34 anni si è tolto la vita", 1, DATE)).isFalse();
        assertThat(deduplicator.isAggregate("Rissa nel reparto", 5, LocalDate.of(2026, 1, 2))).isFalse();
        assertThat(deduplicator.isAggregate(null, null, null)).isFalse();
    }

    private static PrisonEvent event(String type, LocalDate date, String facility, String url, boolean aggregate) {
        return PrisonEvent.builder()
                .eventType(type)
                .eventDate(date)
                .facility(facility)
                .sourceUrl(url)
                .description("")
                .isAggregate(aggregate)
                .build();
    }
}
