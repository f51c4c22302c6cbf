package com.behindbars.backend.extraction;

import com.behindbars.backend.article.dto.EnrichedArticle;
import com.behindbars.backend.config.NarrativeProperties;
import com.behindbars.backend.events.service.PrisonEventService;
import com.behindbars.backend.narrative.matching.StoryMatch;
import com.behindbars.backend.narrative.matching.StoryMatcher;
import com.behindbars.backend.narrative.model.KeyCharacter;
import com.behindbars.backend.narrative.model.NarrativeContext;
import com.behindbars.backend.narrative.model.StoryThread;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Runs the five extraction calls for a day's articles and collects the raw answers.
 * <p>
 * Model output is not interpreted here; it goes into an {@link ExtractionBundle} as is.
 * A failing call is recorded against its category and the remaining calls still run.
 */
@Slf4j
@Service
public class AiExtractionService {

    private static final int STORY_CONTENT_LENGTH = 1000;
    private static final int ENTITY_CONTENT_LENGTH = 1500;
    private static final int EVENT_CONTENT_LENGTH = 2000;

    private final ChatModel chatModel;
    private final StoryMatcher storyMatcher;
    private final PrisonEventService prisonEventService;
    private final NarrativeProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public AiExtractionService(@Nullable ChatModel chatModel, StoryMatcher storyMatcher,
                               PrisonEventService prisonEventService, NarrativeProperties properties) {
        this.chatModel = chatModel;
        this.storyMatcher = storyMatcher;
        this.prisonEventService = prisonEventService;
        this.properties = properties;
    }

    public ExtractionBundle extract(Map<String, EnrichedArticle> articles, NarrativeContext context, LocalDate runDate) {
        ExtractionBundle bundle = ExtractionBundle.empty();
        if (articles.isEmpty()) {
            log.info("📭 No articles to extract from");
            return bundle;
        }

        if (chatModel == null) {
            log.warn("⚠️ No chat model configured, skipping AI extraction");
            return bundle;
        }

        log.info("🤖 Extracting narrative updates from {} articles", articles.size());

        call(chatModel, bundle, ExtractionCategory.STORIES, ExtractionPrompts.STORY_EXTRACTION_PROMPT,
                () -> Map.of(
                        "articles", articlesPayload(articles, STORY_CONTENT_LENGTH, true),
                        "existing_stories", storiesForPrompt(articles, context)));

        call(chatModel, bundle, ExtractionCategory.CHARACTERS, ExtractionPrompts.ENTITY_EXTRACTION_PROMPT,
                () -> Map.of(
                        "articles", articlesPayload(articles, ENTITY_CONTENT_LENGTH, false),
                        "existing_characters", charactersForPrompt(context),
                        "mentioned_characters", mentionedCharacters(articles, context)));

        call(chatModel, bundle, ExtractionCategory.FOLLOWUPS, ExtractionPrompts.FOLLOWUP_DETECTION_PROMPT,
                () -> Map.of(
                        "articles", articlesPayload(articles, ENTITY_CONTENT_LENGTH, false),
                        "existing_story_ids", context.activeStories().stream().map(StoryThread::getId).toList()));

        call(chatModel, bundle, ExtractionCategory.EVENTS, ExtractionPrompts.EVENT_EXTRACTION_PROMPT,
                () -> Map.of(
                        "articles", articlesPayload(articles, EVENT_CONTENT_LENGTH, false),
                        "existing_events", prisonEventService.listRecentForDedup(runDate)));

        call(chatModel, bundle, ExtractionCategory.SNAPSHOTS, ExtractionPrompts.CAPACITY_EXTRACTION_PROMPT,
                () -> Map.of(
                        "articles", articlesPayload(articles, EVENT_CONTENT_LENGTH, false),
                        "existing_snapshots", prisonEventService.listRecentSnapshotsForDedup(runDate)));

        log.info("✅ AI extraction finished, {} categories failed", bundle.failures().size());
        return bundle;
    }

    /**
     * Stories most likely concerned by today's articles, best matches first, capped for the prompt.
     * Falls back to the most recently updated active stories when nothing matches.
     */
    List<Map<String, Object>> storiesForPrompt(Map<String, EnrichedArticle> articles, NarrativeContext context) {
        Map<String, StoryMatch> best = new LinkedHashMap<>();
        for (EnrichedArticle article : articles.values()) {
            for (StoryMatch match : storyMatcher.findMatchingStories(article, context)) {
                best.merge(match.getStory().getId(), match,
                        (a, b) -> a.getScore() >= b.getScore() ? a : b);
            }
        }

        List<StoryThread> selected = new ArrayList<>();
        best.values().stream()
                .sorted(Comparator.comparingDouble(StoryMatch::getScore).reversed())
                .limit(properties.getMaxStoriesInPrompt())
                .forEach(match -> selected.add(match.getStory()));

        if (selected.isEmpty()) {
            context.activeStories().stream()
                    .sorted(Comparator.comparing(StoryThread::getLastUpdate,
                            Comparator.nullsLast(Comparator.reverseOrder())))
                    .limit(properties.getMaxStoriesInPrompt())
                    .forEach(selected::add);
        }

        List<Map<String, Object>> payload = new ArrayList<>();
        for (StoryThread story : selected) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", story.getId());
            entry.put("topic", story.getTopic());
            entry.put("summary", story.getSummary());
            entry.put("keywords", story.getKeywords());
            payload.add(entry);
        }
        return payload;
    }

    private void call(ChatModel chatModel, ExtractionBundle bundle, ExtractionCategory category,
                      String template, Supplier<Map<String, Object>> input) {
        try {
            String inputJson = objectMapper.writeValueAsString(input.get());
            log.debug("📝 {} extraction input created, estimated tokens: {}",
                    category.getLabel(), estimateTokenCount(inputJson));

            PromptTemplate promptTemplate = new PromptTemplate(template);
            Prompt prompt = promptTemplate.create(Map.of("inputJson", inputJson));

            ChatResponse response = chatModel.call(prompt);
            String aiResponse = response.getResult().getOutput().getText();
            if (aiResponse == null) {
                throw new IllegalStateException("Empty response from model");
            }

            log.debug("🤖 AI {} response received: {}", category.getLabel(),
                    aiResponse.substring(0, Math.min(200, aiResponse.length())));
            bundle.withPayload(category, aiResponse.trim());

        } catch (Exception e) {
            log.error("❌ Error in {} extraction: {}", category.getLabel(), e.getMessage());
            bundle.withFailure(category, e.getMessage());
        }
    }

    private Map<String, Object> articlesPayload(Map<String, EnrichedArticle> articles, int contentLength,
                                                boolean withSummary) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (Map.Entry<String, EnrichedArticle> entry : articles.entrySet()) {
            EnrichedArticle article = entry.getValue();
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("title", article.getTitle());
            item.put("link", article.getLink() != null ? article.getLink() : entry.getKey());
            if (withSummary) {
                item.put("summary", article.getSummary() != null ? article.getSummary() : "");
            }
            String content = article.getContent() != null ? article.getContent() : "";
            item.put("content", content.substring(0, Math.min(contentLength, content.length())));
            payload.put(entry.getKey(), item);
        }
        return payload;
    }

    private List<Map<String, Object>> charactersForPrompt(NarrativeContext context) {
        List<Map<String, Object>> payload = new ArrayList<>();
        for (KeyCharacter character : context.getKeyCharacters()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", character.getName());
            entry.put("role", character.getRole());
            entry.put("aliases", character.getAliases());
            payload.add(entry);
        }
        return payload;
    }

    private List<String> mentionedCharacters(Map<String, EnrichedArticle> articles, NarrativeContext context) {
        Set<String> names = new LinkedHashSet<>();
        for (EnrichedArticle article : articles.values()) {
            storyMatcher.findMentionedCharacters(article, context).forEach(c -> names.add(c.getName()));
        }
        return new ArrayList<>(names);
    }

    private int estimateTokenCount(String text) {
        // Rough estimation: 1 token ≈ 4 characters
        return Math.max(1, text.length() / 4);
    }
}
