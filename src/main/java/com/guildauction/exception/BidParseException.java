package com.guildauction.exception;

public class BidParseException extends ValidationException {

    public BidParseException(String message) {
        super("BID_PARSE", message);
    }
}
