package com.example.docredact.engine;

/**
 * A redaction backend could not process the document. No artifact survives this failure.
 */
public class EngineFailureException extends Exception {

    public EngineFailureException(String message) {
        super(message);
    }

    public EngineFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
