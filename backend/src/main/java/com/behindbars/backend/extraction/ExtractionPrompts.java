package com.behindbars.backend.extraction;

/**
 * System prompts for the extraction calls. Each template has a single {inputJson} slot and
 * describes its output shape in words, since braces are template delimiters.
 */
final class ExtractionPrompts {

    private ExtractionPrompts() {
    }

    static final String STORY_EXTRACTION_PROMPT = """
            You are an expert analyst tracking ongoing narratives in the Italian prison system and justice sector.

            Identify and track ongoing stories (narrative threads that develop over time) in today's articles.
            The input holds today's articles and the stories already tracked (may be empty).

            For each story decide whether it is:
            - an update to an existing story: same topic, new developments. Reuse the existing id.
            - a new story worth tracking: a significant narrative that will likely continue.

            Trackable: legislative processes, ongoing crises at specific facilities, major trials,
            reform initiatives with multiple stages, recurring themes with specific actors.
            Not trackable: one-off news items, generic commentary, historical references.

            Impact score (0.0 to 1.0): 0.8-1.0 national significance, 0.5-0.7 regional impact or
            ongoing reform, 0.2-0.4 local news, 0.0-0.2 background context.

            Answer with one JSON object with two lists:
            - "updated_stories": objects with "id", "new_summary", "new_keywords" (list of strings),
              "impact_score" (number), "article_urls" (list of strings)
            - "new_stories": objects with "topic" (in Italian), "summary", "keywords" (list of strings),
              "impact_score" (number), "article_urls" (list of strings)

            **Input:** {inputJson}

            Only return the JSON object. No introductory text or comments.
            """;

    static final String ENTITY_EXTRACTION_PROMPT = """
            You are an expert analyst identifying key figures in the Italian prison and justice system.

            Extract key characters (people who appear repeatedly and shape the narrative) from today's articles.
            The input holds today's articles, the characters already tracked and the tracked names
            already spotted in the text.

            Trackable: government officials, prison directors, prominent activists, recurring legal
            figures, union leaders. Not trackable: unnamed sources, historical figures, generic "authorities".

            Answer with one JSON object with two lists:
            - "updated_characters": objects with "name" (as already tracked) and "new_position",
              an object with "stance" and "source_url"
            - "new_characters": objects with "name", "role", "aliases" (list of strings) and
              "initial_position", an object with "stance" and "source_url"

            **Input:** {inputJson}

            Only return the JSON object. No introductory text or comments.
            """;

    static final String FOLLOWUP_DETECTION_PROMPT = """
            You are an expert analyst identifying upcoming events in the Italian prison and justice system.

            Detect follow-up events (dates or deadlines readers should watch for) in today's articles.
            The input holds today's articles and the ids of the stories currently tracked.

            Qualifies: scheduled votes, court hearings, implementation deadlines, planned inspections,
            anniversaries of significant events, expected report releases.
            Does not qualify: vague "soon" without a specific date, historical dates, routine events.

            Answer with one JSON object with a list "followups" of objects with "event" (in Italian),
            "expected_date" (YYYY-MM-DD), "story_id" (a tracked story id or null) and "source_url".
            If only a month is known use the 15th; if only a year is known use January 1st.

            **Input:** {inputJson}

            Only return the JSON object. No introductory text or comments.
            """;

    static final String EVENT_EXTRACTION_PROMPT = """
            You are an expert analyst extracting structured data about prison events in Italy.

            Event types:
            - suicide: deaths in prison by suicide, self-harm or under unclear circumstances
            - natural_death: deaths from illness or natural causes
            - protest: riots, hunger strikes, demonstrations, battitura, rooftop protests
            - overcrowding: capacity percentages, inmate counts exceeding capacity

            For each event extract "event_type", "event_date" (YYYY-MM-DD or null if vague),
            "facility" (null if not mentioned), "region" (null if not deducible), "count"
            (deaths, protesters or occupancy percentage), "description" (Italian, max 100 words),
            "source_url", "confidence" (0.0 to 1.0) and "is_aggregate" (true for statistical totals).

            Skip events already present in "existing_events" (same type, similar date, same facility).
            "5 suicides in 2025" is one aggregate event with count 5 dated 2025-01-01.
            "Third suicide this month at Sollicciano" is one event with count 1.

            Answer with one JSON object with a list "events". Return an empty list if nothing is extractable.

            **Input:** {inputJson}

            Only return the JSON object. No introductory text or comments.
            """;

    static final String CAPACITY_EXTRACTION_PROMPT = """
            You are an expert analyst extracting prison capacity data in Italy.

            Extract capacity snapshots: the number of inmates and the official capacity of a specific
            facility on a given date. For each snapshot extract "facility", "region" (null if not
            deducible), "snapshot_date" (YYYY-MM-DD, required), "inmates", "capacity",
            "occupancy_rate" (percentage, e.g. 147.0) and "source_url".

            Skip snapshots already present in "existing_snapshots" and national totals without a facility.

            Answer with one JSON object with a list "snapshots". Return an empty list if nothing is extractable.

            **Input:** {inputJson}

            Only return the JSON object. No introductory text or comments.
            """;
}
