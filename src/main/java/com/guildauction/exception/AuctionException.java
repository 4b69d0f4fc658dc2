package com.guildauction.exception;

/**
 * Base type for every recoverable failure surfaced to a command caller.
 * The code is stable and machine readable; the message is meant for display.
 */
public abstract class AuctionException extends RuntimeException {

    private final String code;

    protected AuctionException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
