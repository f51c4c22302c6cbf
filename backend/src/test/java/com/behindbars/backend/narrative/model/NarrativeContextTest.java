package com.behindbars.backend.narrative.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NarrativeContextTest {

    private NarrativeContext context;

    @BeforeEach
    void setUp() {
        context = new NarrativeContext();
        context.getKeyCharacters().add(KeyCharacter.builder()
                .name("Carlo Nordio")
                .role("Ministro della Giustizia")
                .aliases(new ArrayList<>(List.of("Ministro Nordio")))
                .build());

        context.getOngoingStorylines().add(story("s-1", "Decreto Carceri", StoryStatus.ACTIVE, "decreto", "carceri"));
        context.getOngoingStorylines().add(story("s-2", "Suicidi nelle carceri", StoryStatus.DORMANT, "suicidi"));
        context.getOngoingStorylines().add(story("s-3", "Riforma Cartabia", StoryStatus.RESOLVED, "riforma"));

        context.getPendingFollowups().add(followUp("f-1", LocalDate.of(2026, 2, 1), false));
        context.getPendingFollowups().add(followUp("f-2", LocalDate.of(2026, 3, 1), false));
        context.getPendingFollowups().add(followUp("f-3", LocalDate.of(2026, 1, 15), true));
    }

    @Test
    @DisplayName("Character lookup ignores case and resolves aliases")
    void characterLookupByNameOrAlias() {
        assertThat(context.findCharacterByName("CARLO NORDIO")).get()
                .extracting(KeyCharacter::getName).isEqualTo("Carlo Nordio");
        assertThat(context.findCharacterByName("Ministro Nordio")).get()
                .extracting(KeyCharacter::getName).isEqualTo("Carlo Nordio");
        assertThat(context.findCharacterByName("Andrea Ostellari")).isEmpty();
        assertThat(context.findCharacterByName(" ")).isEmpty();
    }

    @Test
    @DisplayName("Stories are filtered by status")
    void storiesByStatus() {
        assertThat(context.activeStories()).extracting(StoryThread::getId).containsExactly("s-1");
        assertThat(context.dormantStories()).extracting(StoryThread::getId).containsExactly("s-2");
    }

    @Test
    @DisplayName("Keyword lookup searches topics and keywords")
    void storiesByKeyword() {
        assertThat(context.findStoriesByKeyword("CARCERI")).extracting(StoryThread::getId)
                .containsExactly("s-1", "s-2");
        assertThat(context.findStoriesByKeyword("riforma")).extracting(StoryThread::getId).containsExactly("s-3");
        assertThat(context.findStoriesByKeyword("")).isEmpty();
    }

    @Test
    @DisplayName("A dangling story id resolves to nothing")
    void danglingStoryId() {
        assertThat(context.findStoryById("missing")).isEmpty();
        assertThat(context.findStoryById(null)).isEmpty();
        assertThat(context.findStoryById("s-2")).isPresent();
    }

    @Test
    @DisplayName("Due follow-ups are unresolved and expected on or before the date")
    void dueFollowUps() {
        assertThat(context.unresolvedFollowups()).extracting(FollowUp::getId).containsExactly("f-1", "f-2");
        assertThat(context.dueFollowups(LocalDate.of(2026, 2, 1))).extracting(FollowUp::getId).containsExactly("f-1");
        assertThat(context.dueFollowups(LocalDate.of(2026, 1, 20))).isEmpty();
    }

    @Test
    @DisplayName("last_update never moves before first_seen")
    void mentionKeepsDatesOrdered() {
        StoryThread story = context.findStoryById("s-1").orElseThrow();
        story.recordMention(LocalDate.of(2025, 12, 1));

        assertThat(story.getMentionCount()).isEqualTo(2);
        assertThat(story.getLastUpdate()).isEqualTo(story.getFirstSeen());
    }

    private static StoryThread story(String id, String topic, StoryStatus status, String... keywords) {
        return StoryThread.builder()
                .id(id)
                .topic(topic)
                .status(status)
                .firstSeen(LocalDate.of(2026, 1, 1))
                .lastUpdate(LocalDate.of(2026, 1, 5))
                .summary("")
                .keywords(new ArrayList<>(List.of(keywords)))
                .build();
    }

    private static FollowUp followUp(String id, LocalDate expected, boolean resolved) {
        return FollowUp.builder()
                .id(id)
                .event("Udienza " + id)
                .expectedDate(expected)
                .createdAt(LocalDate.of(2026, 1, 1))
                .resolved(resolved)
                .build();
    }
}
