package com.behindbars.backend.narrative.matching;

import com.behindbars.backend.article.dto.EnrichedArticle;
import com.behindbars.backend.config.NarrativeProperties;
import com.behindbars.backend.narrative.model.KeyCharacter;
import com.behindbars.backend.narrative.model.NarrativeContext;
import com.behindbars.backend.narrative.model.StoryStatus;
import com.behindbars.backend.narrative.model.StoryThread;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Lightweight keyword matching between articles and the tracked narrative.
 * <p>
 * Used before AI extraction to pick the stories and characters an article is most
 * likely about. All methods are pure functions of their inputs.
 */
@Component
@RequiredArgsConstructor
public class StoryMatcher {

    // Letter runs of 4+ characters not glued to digits or other letters
    private static final Pattern KEYWORD_PATTERN =
            Pattern.compile("(?<![\\p{L}\\p{N}_])\\p{L}{4,}(?![\\p{L}\\p{N}_])");
    private static final Pattern TOPIC_TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final int MAX_SUGGESTED_KEYWORDS = 10;
    private static final int MIN_SUGGESTION_OCCURRENCES = 2;

    private final NarrativeProperties properties;

    public List<StoryMatch> findMatchingStories(EnrichedArticle article, NarrativeContext context) {
        return findMatchingStories(article, context, properties.getMinMatchScore());
    }

    /**
     * Non-resolved stories whose keyword overlap with the article reaches {@code minScore},
     * best match first.
     */
    public List<StoryMatch> findMatchingStories(EnrichedArticle article, NarrativeContext context, double minScore) {
        Set<String> articleKeywords = articleKeywords(article);

        List<StoryMatch> matches = new ArrayList<>();
        for (StoryThread story : context.getOngoingStorylines()) {
            if (story.getStatus() == StoryStatus.RESOLVED) {
                continue;
            }
            double score = keywordOverlap(articleKeywords, storyKeywords(story));
            if (score >= minScore) {
                matches.add(new StoryMatch(story, score));
            }
        }

        matches.sort(Comparator.comparingDouble(StoryMatch::getScore).reversed());
        return matches;
    }

    /**
     * Characters whose name or any alias appears in the article title or content.
     */
    public List<KeyCharacter> findMentionedCharacters(EnrichedArticle article, NarrativeContext context) {
        String text = normalizeText(nullToEmpty(article.getTitle()) + " " + nullToEmpty(article.getContent()));

        List<KeyCharacter> mentioned = new ArrayList<>();
        for (KeyCharacter character : context.getKeyCharacters()) {
            List<String> names = new ArrayList<>();
            names.add(character.getName());
            names.addAll(character.getAliases());

            for (String name : names) {
                if (name == null || name.isBlank()) continue;
                if (text.contains(normalizeText(name))) {
                    mentioned.add(character);
                    break;
                }
            }
        }
        return mentioned;
    }

    /**
     * Tokens recurring across the given articles that the story does not track yet,
     * most frequent first.
     */
    public List<String> suggestKeywords(Collection<EnrichedArticle> articles, Collection<String> existingKeywords) {
        Set<String> existing = new HashSet<>();
        for (String keyword : existingKeywords) {
            existing.add(keyword.toLowerCase(Locale.ROOT));
        }

        Map<String, Integer> counts = new HashMap<>();
        for (EnrichedArticle article : articles) {
            String text = nullToEmpty(article.getTitle()) + " " + nullToEmpty(article.getSummary());
            for (String keyword : extractKeywords(text)) {
                if (!existing.contains(keyword)) {
                    counts.merge(keyword, 1, Integer::sum);
                }
            }
        }

        return counts.entrySet().stream()
                .filter(entry -> entry.getValue() >= MIN_SUGGESTION_OCCURRENCES)
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(MAX_SUGGESTED_KEYWORDS)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Keywords of the title, summary and the first {@code content-prefix-length} characters of content.
     */
    public Set<String> articleKeywords(EnrichedArticle article) {
        return extractKeywords(articleText(article));
    }

    /**
     * Distinct lowercase alphabetic tokens of at least four letters.
     */
    public static Set<String> extractKeywords(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return keywords;
        }
        Matcher matcher = KEYWORD_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            keywords.add(matcher.group());
        }
        return keywords;
    }

    /**
     * Jaccard similarity of two keyword sets, compared case-insensitively. Zero when either is empty.
     */
    public static double keywordOverlap(Collection<String> first, Collection<String> second) {
        Set<String> a = lowercase(first);
        Set<String> b = lowercase(second);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }

        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);

        return (double) intersection.size() / union.size();
    }

    public static String normalizeText(String text) {
        return String.join(" ", text.toLowerCase(Locale.ROOT).trim().split("\\s+"));
    }

    private String articleText(EnrichedArticle article) {
        String content = nullToEmpty(article.getContent());
        int prefixLength = Math.min(content.length(), properties.getContentPrefixLength());
        return nullToEmpty(article.getTitle()) + " " + nullToEmpty(article.getSummary()) + " "
                + content.substring(0, prefixLength);
    }

    private static Set<String> storyKeywords(StoryThread story) {
        Set<String> keywords = lowercase(story.getKeywords());
        if (story.getTopic() != null) {
            for (String token : TOPIC_TOKEN_SPLIT.split(story.getTopic().toLowerCase(Locale.ROOT))) {
                if (!token.isEmpty()) {
                    keywords.add(token);
                }
            }
        }
        keywords.addAll(extractKeywords(story.getSummary()));
        return keywords;
    }

    private static Set<String> lowercase(Collection<String> values) {
        Set<String> result = new HashSet<>();
        if (values == null) return result;
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                result.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
