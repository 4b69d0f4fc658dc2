package com.guildauction.exception;

public class BidValidationException extends ValidationException {

    public BidValidationException(String message) {
        super("BID_INVALID", message);
    }
}
