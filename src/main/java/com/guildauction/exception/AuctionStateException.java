package com.guildauction.exception;

/**
 * Operation is not valid for the auction's current phase, e.g. bidding on an
 * ended auction or undoing when there are no bids.
 */
public class AuctionStateException extends AuctionException {

    public AuctionStateException(String message) {
        super("INVALID_STATE", message);
    }
}
