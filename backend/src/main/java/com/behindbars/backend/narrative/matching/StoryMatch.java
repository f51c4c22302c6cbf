package com.behindbars.backend.narrative.matching;

import com.behindbars.backend.narrative.model.StoryThread;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class StoryMatch {
    private StoryThread story;
    private double score; // Jaccard overlap, 0.0 to 1.0
}
