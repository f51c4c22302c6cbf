package com.behindbars.backend.extraction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import lombok.ToString;

/**
 * Raw model output per extraction category, together with the categories whose
 * extraction call failed. A category present in neither map has no input this run.
 */
@ToString
public class ExtractionBundle {

    private final Map<ExtractionCategory, String> payloads = new EnumMap<>(ExtractionCategory.class);
    private final Map<ExtractionCategory, String> failures = new EnumMap<>(ExtractionCategory.class);

    public static ExtractionBundle empty() {
        return new ExtractionBundle();
    }

    public ExtractionBundle withPayload(ExtractionCategory category, String rawJson) {
        payloads.put(category, rawJson);
        failures.remove(category);
        return this;
    }

    public ExtractionBundle withFailure(ExtractionCategory category, String errorMessage) {
        failures.put(category, errorMessage == null ? "unknown error" : errorMessage);
        payloads.remove(category);
        return this;
    }

    public Optional<String> payload(ExtractionCategory category) {
        return Optional.ofNullable(payloads.get(category));
    }

    public Optional<String> failure(ExtractionCategory category) {
        return Optional.ofNullable(failures.get(category));
    }

    public Map<ExtractionCategory, String> failures() {
        return Collections.unmodifiableMap(failures);
    }

    public boolean isEmpty() {
        return payloads.isEmpty() && failures.isEmpty();
    }
}
