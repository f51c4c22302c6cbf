package com.behindbars.backend.extraction;

/**
 * The independent extraction categories of a run, in processing order.
 */
public enum ExtractionCategory {
    STORIES("stories"),
    CHARACTERS("characters"),
    FOLLOWUPS("followups"),
    EVENTS("events"),
    SNAPSHOTS("snapshots");

    private final String label;

    ExtractionCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isNarrative() {
        return this == STORIES || this == CHARACTERS || this == FOLLOWUPS;
    }
}
