package com.guildauction.exception;

/**
 * Malformed or out-of-range input. Never mutates state.
 */
public class ValidationException extends AuctionException {

    public ValidationException(String message) {
        super("VALIDATION", message);
    }

    protected ValidationException(String code, String message) {
        super(code, message);
    }
}
