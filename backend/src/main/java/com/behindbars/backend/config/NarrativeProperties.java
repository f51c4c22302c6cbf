package com.behindbars.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "narrative")
@Data
public class NarrativeProperties {

    // Storage
    private String dataDir = "data";
    private String contextFile = "narrative_context.json";
    private int collectedArticlesKeepDays = 90;

    // Story lifecycle
    private int storyArchiveDays = 90;

    // Keyword matching
    private double minMatchScore = 0.15;
    private int contentPrefixLength = 500;
    private int maxStoriesInPrompt = 20;

    // Follow-up suppression: same expected date and event text overlap at or above the threshold
    private boolean followupDedupEnabled = true;
    private double followupDedupThreshold = 0.5;

    private String editorialTone =
            "Riflessivo e professionale, attento ai progressi ma consapevole delle sfide sistemiche";
}
