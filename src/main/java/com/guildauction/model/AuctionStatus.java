package com.guildauction.model;

public enum AuctionStatus {
    OPEN,
    COUNTDOWN,
    ENDED;

    public boolean isLive() {
        return this != ENDED;
    }
}
