package com.datachain.exception;

/**
 * Exception thrown when a query or semantic model document cannot be parsed.
 */
public class DefinitionParseException extends RuntimeException {

    private final String documentKind;

    public DefinitionParseException(String documentKind, String message, Throwable cause) {
        super("Failed to parse " + documentKind + ": " + message, cause);
        this.documentKind = documentKind;
    }

    /**
     * Returns what was being parsed ("query" or "semantic model").
     */
    public String getDocumentKind() {
        return documentKind;
    }
}
