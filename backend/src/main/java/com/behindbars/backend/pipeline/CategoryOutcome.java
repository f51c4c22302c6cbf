package com.behindbars.backend.pipeline;

import com.behindbars.backend.extraction.ExtractionCategory;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CategoryOutcome {

    public enum Status {
        SUCCEEDED,
        FAILED,
        // No extraction output for this category
        UNAVAILABLE,
        // Not attempted because the narrative context could not be loaded
        SKIPPED
    }

    private ExtractionCategory category;
    private Status status;
    private int applied;
    private int skipped;
    private String errorMessage;

    public static CategoryOutcome succeeded(ExtractionCategory category, int applied, int skipped) {
        return new CategoryOutcome(category, Status.SUCCEEDED, applied, skipped, null);
    }

    public static CategoryOutcome failed(ExtractionCategory category, String errorMessage) {
        return new CategoryOutcome(category, Status.FAILED, 0, 0, errorMessage);
    }

    public static CategoryOutcome unavailable(ExtractionCategory category) {
        return new CategoryOutcome(category, Status.UNAVAILABLE, 0, 0, null);
    }

    public static CategoryOutcome skipped(ExtractionCategory category, String reason) {
        return new CategoryOutcome(category, Status.SKIPPED, 0, 0, reason);
    }
}
