package com.behindbars.backend.extraction;

import com.behindbars.backend.extraction.dto.CharacterExtractionResult;
import com.behindbars.backend.extraction.dto.EventExtractionResult;
import com.behindbars.backend.extraction.dto.FollowUpExtractionResult;
import com.behindbars.backend.extraction.dto.SnapshotExtractionResult;
import com.behindbars.backend.extraction.dto.StoryExtractionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns raw model output into typed extraction results.
 * <p>
 * A payload that is not a JSON object fails the whole category with an
 * {@link ExtractionParseException}. Inside a readable payload every record is mapped and
 * validated on its own; a record that does not fit is dropped with a warning and counted
 * in {@code invalidRecords}, the rest of the category goes through.
 */
@Slf4j
@Component
public class ExtractionResultParser {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final Validator validator;

    public ExtractionResultParser(Validator validator) {
        this.validator = validator;
    }

    public StoryExtractionResult parseStories(String rawResponse) {
        JsonNode root = readRoot(ExtractionCategory.STORIES, rawResponse);
        StoryExtractionResult result = new StoryExtractionResult();
        RecordCounter counter = new RecordCounter();
        result.setUpdatedStories(readRecords(root, "updated_stories", StoryExtractionResult.UpdatedStory.class, counter));
        result.setNewStories(readRecords(root, "new_stories", StoryExtractionResult.NewStory.class, counter));
        result.setInvalidRecords(counter.invalid);
        return result;
    }

    public CharacterExtractionResult parseCharacters(String rawResponse) {
        JsonNode root = readRoot(ExtractionCategory.CHARACTERS, rawResponse);
        CharacterExtractionResult result = new CharacterExtractionResult();
        RecordCounter counter = new RecordCounter();
        result.setUpdatedCharacters(readRecords(root, "updated_characters",
                CharacterExtractionResult.UpdatedCharacter.class, counter));
        result.setNewCharacters(readRecords(root, "new_characters",
                CharacterExtractionResult.NewCharacter.class, counter));
        result.setInvalidRecords(counter.invalid);
        return result;
    }

    public FollowUpExtractionResult parseFollowUps(String rawResponse) {
        JsonNode root = readRoot(ExtractionCategory.FOLLOWUPS, rawResponse);
        FollowUpExtractionResult result = new FollowUpExtractionResult();
        RecordCounter counter = new RecordCounter();
        result.setFollowups(readRecords(root, "followups", FollowUpExtractionResult.FollowUpPayload.class, counter));
        result.setInvalidRecords(counter.invalid);
        return result;
    }

    public EventExtractionResult parseEvents(String rawResponse) {
        JsonNode root = readRoot(ExtractionCategory.EVENTS, rawResponse);
        EventExtractionResult result = new EventExtractionResult();
        RecordCounter counter = new RecordCounter();
        result.setEvents(readRecords(root, "events", EventExtractionResult.EventPayload.class, counter));
        result.setInvalidRecords(counter.invalid);
        return result;
    }

    public SnapshotExtractionResult parseSnapshots(String rawResponse) {
        JsonNode root = readRoot(ExtractionCategory.SNAPSHOTS, rawResponse);
        SnapshotExtractionResult result = new SnapshotExtractionResult();
        RecordCounter counter = new RecordCounter();
        result.setSnapshots(readRecords(root, "snapshots", SnapshotExtractionResult.SnapshotPayload.class, counter));
        result.setInvalidRecords(counter.invalid);
        return result;
    }

    /**
     * Remove a surrounding markdown code fence (```json ... ```) if the model added one.
     */
    public static String stripMarkdownFences(String response) {
        String cleanedResponse = response.trim();
        if (cleanedResponse.startsWith("```")) {
            int firstNewline = cleanedResponse.indexOf('\n');
            cleanedResponse = firstNewline >= 0 ? cleanedResponse.substring(firstNewline + 1) : "";
            if (cleanedResponse.trim().endsWith("```")) {
                cleanedResponse = cleanedResponse.substring(0, cleanedResponse.lastIndexOf("```"));
            }
        }
        return cleanedResponse.trim();
    }

    private JsonNode readRoot(ExtractionCategory category, String rawResponse) {
        if (rawResponse == null || rawResponse.isBlank()) {
            throw new ExtractionParseException(category, "Empty " + category.getLabel() + " extraction response");
        }

        String cleanedResponse = stripMarkdownFences(rawResponse);
        JsonNode root;
        try {
            root = objectMapper.readTree(cleanedResponse);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse {} extraction response: {}", category.getLabel(),
                    cleanedResponse.substring(0, Math.min(200, cleanedResponse.length())));
            throw new ExtractionParseException(category,
                    "AI " + category.getLabel() + " response parsing failed: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new ExtractionParseException(category,
                    "AI " + category.getLabel() + " response is not a JSON object");
        }
        return root;
    }

    private <T> List<T> readRecords(JsonNode root, String field, Class<T> type, RecordCounter counter) {
        List<T> records = new ArrayList<>();
        JsonNode array = root.get(field);
        if (array == null || array.isNull()) {
            return records;
        }
        if (!array.isArray()) {
            log.warn("⚠️ Field '{}' is not a list, ignoring it", field);
            counter.invalid++;
            return records;
        }

        int index = 0;
        for (JsonNode node : array) {
            T record;
            try {
                record = objectMapper.treeToValue(node, type);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("⚠️ Skipping malformed {}[{}]: {}", field, index, e.getMessage());
                counter.invalid++;
                index++;
                continue;
            }

            Set<ConstraintViolation<T>> violations = record == null ? Set.of() : validator.validate(record);
            if (record == null) {
                log.warn("⚠️ Skipping empty {}[{}]", field, index);
                counter.invalid++;
            } else if (!violations.isEmpty()) {
                log.warn("⚠️ Skipping invalid {}[{}]: {}", field, index, describe(violations));
                counter.invalid++;
            } else {
                records.add(record);
            }
            index++;
        }
        return records;
    }

    private static <T> String describe(Set<ConstraintViolation<T>> violations) {
        return violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
    }

    private static class RecordCounter {
        private int invalid;
    }
}
