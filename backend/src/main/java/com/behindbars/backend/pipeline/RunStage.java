package com.behindbars.backend.pipeline;

/**
 * Progress of a reconciliation run. Stages are reached in declaration order.
 */
public enum RunStage {
    STARTED,
    LOADED,
    STORY_MERGE_ATTEMPTED,
    CHARACTER_MERGE_ATTEMPTED,
    FOLLOWUP_APPEND_ATTEMPTED,
    EVENT_EXTRACT_ATTEMPTED,
    SNAPSHOT_EXTRACT_ATTEMPTED,
    SAVED
}
