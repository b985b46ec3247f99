package com.mimecast.mailfetch.exceptions;

import jakarta.mail.MessagingException;

/**
 * Thrown when the mail store cannot be connected or the mailbox cannot be opened.
 */
public class ConnectionException extends MessagingException {

    /**
     * Constructs a new ConnectionException instance.
     *
     * @param message Error message.
     */
    public ConnectionException(String message) {
        super(message);
    }

    /**
     * Constructs a new ConnectionException instance with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public ConnectionException(String message, Exception cause) {
        super(message, cause);
    }
}
