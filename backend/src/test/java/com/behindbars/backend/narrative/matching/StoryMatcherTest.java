package com.behindbars.backend.narrative.matching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.behindbars.backend.article.dto.EnrichedArticle;
import com.behindbars.backend.config.NarrativeProperties;
import com.behindbars.backend.narrative.model.KeyCharacter;
import com.behindbars.backend.narrative.model.NarrativeContext;
import com.behindbars.backend.narrative.model.StoryStatus;
import com.behindbars.backend.narrative.model.StoryThread;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StoryMatcherTest {

    private StoryMatcher matcher;
    private NarrativeContext context;

    @BeforeEach
    void setUp() {
        matcher = new StoryMatcher(new NarrativeProperties());
        context = new NarrativeContext();
    }

    @Test
    @DisplayName("Keyword overlap is a Jaccard score between zero and one")
    void keywordOverlapBounds() {
        assertThat(StoryMatcher.keywordOverlap(Set.of("decreto", "carceri"), Set.of("DECRETO", "Carceri"))).isEqualTo(1.0);
        assertThat(StoryMatcher.keywordOverlap(Set.of("decreto"), Set.of("calcio"))).isEqualTo(0.0);
        assertThat(StoryMatcher.keywordOverlap(Set.of("decreto", "carceri"), Set.of("carceri", "senato")))
                .isCloseTo(1.0 / 3.0, within(1e-9));
        assertThat(StoryMatcher.keywordOverlap(Set.of(), Set.of("carceri"))).isEqualTo(0.0);
        assertThat(StoryMatcher.keywordOverlap(Set.of(), Set.of())).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Keywords are lowercase letter runs of at least four characters")
    void extractsKeywords() {
        assertThat(StoryMatcher.extractKeywords("Il Decreto Carceri 2024: più celle, più agenti"))
                .containsExactly("decreto", "carceri", "celle", "agenti");
        assertThat(StoryMatcher.extractKeywords(null)).isEmpty();
    }

    @Test
    @DisplayName("Articles match non-resolved stories above the threshold, best first")
    void findsMatchingStories() {
        StoryThread decreto = story("s-1", "Decreto Carceri", StoryStatus.ACTIVE,
                "Il governo approva il decreto carceri", "decreto", "carceri", "sovraffollamento");
        StoryThread resolved = story("s-2", "Decreto Carceri", StoryStatus.RESOLVED, "", "decreto", "carceri");
        StoryThread unrelated = story("s-3", "Calcio", StoryStatus.ACTIVE, "", "calcio");
        StoryThread dormant = story("s-4", "Sovraffollamento", StoryStatus.DORMANT, "", "sovraffollamento", "misure");
        context.getOngoingStorylines().addAll(List.of(decreto, resolved, unrelated, dormant));

        EnrichedArticle article = EnrichedArticle.builder()
                .title("Decreto carceri, nuove misure contro il sovraffollamento")
                .content("")
                .build();

        List<StoryMatch> matches = matcher.findMatchingStories(article, context);

        assertThat(matches).extracting(m -> m.getStory().getId()).containsExactly("s-1", "s-4");
        assertThat(matches.get(0).getScore()).isCloseTo(3.0 / 8.0, within(1e-9));
        assertThat(matcher.findMatchingStories(article, context, 0.9)).isEmpty();
    }

    @Test
    @DisplayName("Only the configured content prefix is used for matching")
    void usesContentPrefix() {
        NarrativeProperties properties = new NarrativeProperties();
        properties.setContentPrefixLength(10);
        StoryMatcher shortPrefix = new StoryMatcher(properties);

        EnrichedArticle article = EnrichedArticle.builder()
                .title("")
                .content("Cronaca locale: sovraffollamento")
                .build();

        assertThat(shortPrefix.articleKeywords(article)).containsExactly("cronaca");
        assertThat(matcher.articleKeywords(article)).containsExactlyInAnyOrder("cronaca", "locale", "sovraffollamento");
    }

    @Test
    @DisplayName("Characters are found by name or alias in title and content")
    void findsMentionedCharacters() {
        context.getKeyCharacters().add(KeyCharacter.builder()
                .name("Carlo Nordio")
                .aliases(new ArrayList<>(List.of("Ministro Nordio")))
                .build());
        context.getKeyCharacters().add(KeyCharacter.builder()
                .name("Andrea Ostellari")
                .build());

        EnrichedArticle article = EnrichedArticle.builder()
                .title("Carceri, le nuove misure")
                .content("Il  ministro   Nordio ha dichiarato che il piano partirà a marzo.")
                .build();

        assertThat(matcher.findMentionedCharacters(article, context))
                .extracting(KeyCharacter::getName)
                .containsExactly("Carlo Nordio");
    }

    @Test
    @DisplayName("Suggested keywords recur across articles and are not already tracked")
    void suggestsKeywords() {
        List<EnrichedArticle> articles = List.of(
                EnrichedArticle.builder().title("Nordio annuncia braccialetti elettronici").build(),
                EnrichedArticle.builder().title("Braccialetti elettronici, Nordio insiste")
                        .summary("Scarsi i braccialetti disponibili").build());

        assertThat(matcher.suggestKeywords(articles, List.of("Nordio")))
                .containsExactly("braccialetti", "elettronici");
    }

    private static StoryThread story(String id, String topic, StoryStatus status, String summary, String... keywords) {
        return StoryThread.builder()
                .id(id)
                .topic(topic)
                .status(status)
                .firstSeen(LocalDate.of(2026, 1, 1))
                .lastUpdate(LocalDate.of(2026, 1, 1))
                .summary(summary)
                .keywords(new ArrayList<>(List.of(keywords)))
                .build();
    }
}
