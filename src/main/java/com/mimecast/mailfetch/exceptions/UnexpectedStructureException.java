package com.mimecast.mailfetch.exceptions;

/**
 * Thrown when a message structure or header block reported by the server is missing a field
 * the assembler relies on, or carries it in an unusable shape.
 *
 * <p>These are never defaulted silently since guessing here would misclassify body content.
 */
public class UnexpectedStructureException extends RuntimeException {

    /**
     * Constructs a new UnexpectedStructureException instance.
     *
     * @param message Error message.
     */
    public UnexpectedStructureException(String message) {
        super(message);
    }

    /**
     * Constructs a new UnexpectedStructureException instance naming the offending part.
     *
     * @param section Part section.
     * @param message Error message.
     */
    public UnexpectedStructureException(String section, String message) {
        super("Part " + section + ": " + message);
    }
}
