package com.behindbars.backend.narrative.service;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MergeResult {
    private int applied;
    private int skipped;

    public void recordApplied() {
        applied++;
    }

    public void recordSkipped() {
        skipped++;
    }
}
