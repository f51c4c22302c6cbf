package com.behindbars.backend.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.behindbars.backend.extraction.dto.CharacterExtractionResult;
import com.behindbars.backend.extraction.dto.EventExtractionResult;
import com.behindbars.backend.extraction.dto.FollowUpExtractionResult;
import com.behindbars.backend.extraction.dto.SnapshotExtractionResult;
import com.behindbars.backend.extraction.dto.StoryExtractionResult;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import java.time.LocalDate;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExtractionResultParserTest {

    private static ValidatorFactory validatorFactory;
    private static ExtractionResultParser parser;

    @BeforeAll
    static void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        parser = new ExtractionResultParser(validatorFactory.getValidator());
    }

    @AfterAll
    static void tearDown() {
        validatorFactory.close();
    }

    @Test
    @DisplayName("Markdown fences around the JSON are removed")
    void stripsFences() {
        assertThat(ExtractionResultParser.stripMarkdownFences("```json\n{\"a\": 1}\n```")).isEqualTo("{\"a\": 1}");
        assertThat(ExtractionResultParser.stripMarkdownFences("  {\"a\": 1}  ")).isEqualTo("{\"a\": 1}");
    }

    @Test
    @DisplayName("Story extraction maps snake_case fields")
    void parsesStories() {
        String raw = """
                ```json
                {
                  "updated_stories": [
                    {"id": "s-1", "new_summary": "Il Senato calendarizza il voto", "new_keywords": ["senato"],
                     "impact_score": 0.8, "article_urls": ["https://example.org/1"]}
                  ],
                  "new_stories": [
                    {"topic": "Decreto Carceri", "summary": "Nuovo decreto", "keywords": ["decreto", "carceri"],
                     "impact_score": 0.5, "article_urls": [], "unexpected": true}
                  ]
                }
                ```
                """;

        StoryExtractionResult result = parser.parseStories(raw);

        assertThat(result.getUpdatedStories()).singleElement().satisfies(update -> {
            assertThat(update.getId()).isEqualTo("s-1");
            assertThat(update.getNewKeywords()).containsExactly("senato");
            assertThat(update.getImpactScore()).isEqualTo(0.8);
        });
        assertThat(result.getNewStories()).singleElement()
                .extracting(StoryExtractionResult.NewStory::getTopic).isEqualTo("Decreto Carceri");
        assertThat(result.getInvalidRecords()).isZero();
    }

    @Test
    @DisplayName("Invalid records are dropped and counted, valid ones go through")
    void dropsInvalidRecords() {
        String raw = """
                {
                  "updated_stories": [
                    {"new_summary": "manca l'id"},
                    {"id": "s-2", "impact_score": 3.5},
                    {"id": "s-3", "new_keywords": "non una lista di stringhe", "impact_score": "alto"},
                    {"id": "s-4"}
                  ],
                  "new_stories": {"topic": "non una lista"}
                }
                """;

        StoryExtractionResult result = parser.parseStories(raw);

        assertThat(result.getUpdatedStories()).extracting(StoryExtractionResult.UpdatedStory::getId)
                .containsExactly("s-4");
        assertThat(result.getNewStories()).isEmpty();
        assertThat(result.getInvalidRecords()).isEqualTo(4);
    }

    @Test
    @DisplayName("Unreadable payloads fail the whole category")
    void malformedPayloadThrows() {
        assertThatThrownBy(() -> parser.parseStories("{\"updated_stories\": [ {\"id\": "))
                .isInstanceOf(ExtractionParseException.class)
                .extracting("category").isEqualTo(ExtractionCategory.STORIES);
        assertThatThrownBy(() -> parser.parseEvents("[]"))
                .isInstanceOf(ExtractionParseException.class)
                .hasMessageContaining("not a JSON object");
        assertThatThrownBy(() -> parser.parseFollowUps("   "))
                .isInstanceOf(ExtractionParseException.class);
    }

    @Test
    @DisplayName("Character updates need a name and a position")
    void parsesCharacters() {
        String raw = """
                {
                  "updated_characters": [
                    {"name": "Carlo Nordio", "new_position": {"stance": "Difende il decreto", "source_url": "https://example.org/1"}},
                    {"name": "Andrea Ostellari"},
                    {"name": "Giovanni Russo", "new_position": {"stance": ""}}
                  ],
                  "new_characters": [
                    {"name": "Rita Bernardini", "role": "Presidente di Nessuno Tocchi Caino", "aliases": ["Bernardini"]}
                  ]
                }
                """;

        CharacterExtractionResult result = parser.parseCharacters(raw);

        assertThat(result.getUpdatedCharacters()).singleElement().satisfies(update ->
                assertThat(update.getNewPosition().getSourceUrl()).isEqualTo("https://example.org/1"));
        assertThat(result.getNewCharacters()).singleElement().satisfies(character -> {
            assertThat(character.getAliases()).containsExactly("Bernardini");
            assertThat(character.getInitialPosition()).isNull();
        });
        assertThat(result.getInvalidRecords()).isEqualTo(2);
    }

    @Test
    @DisplayName("Follow-up dates are read leniently")
    void parsesFollowUps() {
        FollowUpExtractionResult result = parser.parseFollowUps("""
                {"followups": [
                  {"event": "Voto al Senato", "expected_date": "2026-02-03T09:30:00Z", "story_id": "s-1"},
                  {"event": "Sentenza", "expected_date": "a breve"},
                  {"expected_date": "2026-02-03"}
                ]}
                """);

        assertThat(result.getFollowups()).hasSize(2);
        assertThat(result.getFollowups().get(0).getParsedExpectedDate()).isEqualTo(LocalDate.of(2026, 2, 3));
        assertThat(result.getFollowups().get(1).getParsedExpectedDate()).isNull();
        assertThat(result.getInvalidRecords()).isEqualTo(1);
    }

    @Test
    @DisplayName("Events and snapshots are validated per record")
    void parsesEventsAndSnapshots() {
        EventExtractionResult events = parser.parseEvents("""
                {"events": [
                  {"event_type": "suicide", "event_date": "2026-01-10", "facility": "Canton Mombello",
                   "count": 1, "confidence": 0.9, "is_aggregate": false, "source_url": "https://example.org/1"},
                  {"event_type": "protest", "count": -2},
                  {"event_type": "", "event_date": "2026-01-10"}
                ]}
                """);
        SnapshotExtractionResult snapshots = parser.parseSnapshots("""
                {"snapshots": [
                  {"facility": "San Vittore", "snapshot_date": "2026-01-05", "inmates": 1100, "capacity": 750,
                   "occupancy_rate": 146.7},
                  {"inmates": 300}
                ]}
                """);

        assertThat(events.getEvents()).singleElement().satisfies(event -> {
            assertThat(event.getParsedEventDate()).isEqualTo(LocalDate.of(2026, 1, 10));
            assertThat(event.getIsAggregate()).isFalse();
        });
        assertThat(events.getInvalidRecords()).isEqualTo(2);
        assertThat(snapshots.getSnapshots()).singleElement()
                .extracting(SnapshotExtractionResult.SnapshotPayload::getOccupancyRate).isEqualTo(146.7);
        assertThat(snapshots.getInvalidRecords()).isEqualTo(1);
    }

    @Test
    @DisplayName("Values longer than their stored column are dropped with their record")
    void dropsOverLongValues() {
        String longType = "suicidio_" + "x".repeat(60);
        String longUrl = "https://example.org/" + "a".repeat(2000);
        EventExtractionResult events = parser.parseEvents("""
                {"events": [
                  {"event_type": "suicide", "event_date": "2026-01-10", "facility": "San Vittore"},
                  {"event_type": "%s", "event_date": "2026-01-10"},
                  {"event_type": "protest", "source_url": "%s"}
                ]}
                """.formatted(longType, longUrl));
        SnapshotExtractionResult snapshots = parser.parseSnapshots("""
                {"snapshots": [
                  {"facility": "%s", "snapshot_date": "2026-01-05"},
                  {"facility": "Poggioreale", "region": "%s", "snapshot_date": "2026-01-05"}
                ]}
                """.formatted("f".repeat(201), "r".repeat(101)));

        assertThat(events.getEvents()).singleElement()
                .extracting(EventExtractionResult.EventPayload::getEventType).isEqualTo("suicide");
        assertThat(events.getInvalidRecords()).isEqualTo(2);
        assertThat(snapshots.getSnapshots()).isEmpty();
        assertThat(snapshots.getInvalidRecords()).isEqualTo(2);
    }

    @Test
    @DisplayName("Missing lists are treated as empty")
    void missingListsAreEmpty() {
        StoryExtractionResult result = parser.parseStories("{}");

        assertThat(result.getUpdatedStories()).isEmpty();
        assertThat(result.getNewStories()).isEmpty();
        assertThat(result.getInvalidRecords()).isZero();
    }
}
