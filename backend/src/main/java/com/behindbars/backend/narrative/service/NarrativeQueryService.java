package com.behindbars.backend.narrative.service;

import com.behindbars.backend.article.dto.EnrichedArticle;
import com.behindbars.backend.narrative.matching.StoryMatcher;
import com.behindbars.backend.narrative.model.FollowUp;
import com.behindbars.backend.narrative.model.KeyCharacter;
import com.behindbars.backend.narrative.model.NarrativeContext;
import com.behindbars.backend.narrative.model.StoryThread;
import com.behindbars.backend.narrative.storage.NarrativeStore;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Read-only views over the stored narrative context for dashboards and status reporting.
 */
@Service
@RequiredArgsConstructor
public class NarrativeQueryService {

    private final NarrativeStore narrativeStore;
    private final StoryMatcher storyMatcher;

    public List<StoryThread> activeStories() {
        return narrativeStore.load().activeStories();
    }

    public List<StoryThread> dormantStories() {
        return narrativeStore.load().dormantStories();
    }

    public Optional<StoryThread> story(String id) {
        return narrativeStore.load().findStoryById(id);
    }

    public List<StoryThread> storiesByKeyword(String keyword) {
        return narrativeStore.load().findStoriesByKeyword(keyword);
    }

    public Optional<KeyCharacter> character(String name) {
        return narrativeStore.load().findCharacterByName(name);
    }

    public List<FollowUp> pendingFollowUps() {
        return narrativeStore.load().unresolvedFollowups();
    }

    public List<FollowUp> dueFollowUps(LocalDate asOf) {
        return narrativeStore.load().dueFollowups(asOf);
    }

    /**
     * Keywords recurring in the day's articles about a story that the story does not track yet.
     * An article counts when it is already related to the story or matches it by keywords.
     */
    public Optional<List<String>> keywordSuggestions(String storyId, LocalDate collectionDate) {
        NarrativeContext context = narrativeStore.load();
        Optional<StoryThread> story = context.findStoryById(storyId);
        if (story.isEmpty()) {
            return Optional.empty();
        }

        List<EnrichedArticle> related = new ArrayList<>();
        for (Map.Entry<String, EnrichedArticle> entry : narrativeStore.loadCollectedArticles(collectionDate).entrySet()) {
            boolean linked = story.get().getRelatedArticles().contains(entry.getKey());
            boolean matching = storyMatcher.findMatchingStories(entry.getValue(), context).stream()
                    .anyMatch(match -> storyId.equals(match.getStory().getId()));
            if (linked || matching) {
                related.add(entry.getValue());
            }
        }
        return Optional.of(storyMatcher.suggestKeywords(related, story.get().getKeywords()));
    }
}
