package com.mimecast.mailfetch.exceptions;

/**
 * Thrown for invalid configuration or call arguments.
 */
public class InvalidParameterException extends IllegalArgumentException {

    /**
     * Constructs a new InvalidParameterException instance.
     *
     * @param message Error message.
     */
    public InvalidParameterException(String message) {
        super(message);
    }

    /**
     * Constructs a new InvalidParameterException instance with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public InvalidParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
