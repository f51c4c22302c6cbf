package com.behindbars.backend.narrative.storage;

/**
 * Raised when the narrative document or a collected-articles file cannot be read or written.
 */
public class NarrativeStorageException extends RuntimeException {

    public NarrativeStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
