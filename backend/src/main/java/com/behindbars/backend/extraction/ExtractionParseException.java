package com.behindbars.backend.extraction;

import lombok.Getter;

/**
 * A whole extraction payload could not be read, for example truncated or non-JSON model output.
 */
@Getter
public class ExtractionParseException extends RuntimeException {

    private final ExtractionCategory category;

    public ExtractionParseException(ExtractionCategory category, String message) {
        super(message);
        this.category = category;
    }

    public ExtractionParseException(ExtractionCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }
}
