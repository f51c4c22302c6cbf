package com.behindbars.backend.pipeline;

import com.behindbars.backend.extraction.ExtractionCategory;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class RunReport {
    private LocalDate runDate;
    private RunStage stage = RunStage.STARTED;
    private int archivedStories;
    private boolean contextSaved;
    private Map<ExtractionCategory, CategoryOutcome> outcomes = new EnumMap<>(ExtractionCategory.class);
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;

    public RunReport(LocalDate runDate) {
        this.runDate = runDate;
        this.startedAt = LocalDateTime.now();
    }

    public void record(CategoryOutcome outcome) {
        outcomes.put(outcome.getCategory(), outcome);
    }

    public CategoryOutcome outcome(ExtractionCategory category) {
        return outcomes.get(category);
    }

    public boolean hasFailures() {
        return outcomes.values().stream().anyMatch(o -> o.getStatus() == CategoryOutcome.Status.FAILED);
    }
}
