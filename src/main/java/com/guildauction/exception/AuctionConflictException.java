package com.guildauction.exception;

public class AuctionConflictException extends AuctionException {

    public AuctionConflictException(long guildId) {
        super("AUCTION_ACTIVE", "An auction is already active in guild " + guildId);
    }
}
