package com.guildauction.exception;

/**
 * Transient failure of the display transport. Callers may retry.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
