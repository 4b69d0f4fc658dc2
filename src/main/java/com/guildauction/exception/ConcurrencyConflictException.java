package com.guildauction.exception;

/**
 * A bid lost the race for the same auction. Carries the bid that won so the
 * caller can retry with an adjusted amount.
 */
public class ConcurrencyConflictException extends AuctionException {

    private final long leadingBid;
    private final Long leadingBidderId;
    private final long minimumNextBid;

    public ConcurrencyConflictException(long leadingBid, Long leadingBidderId, long minimumNextBid) {
        super("CONCURRENCY_CONFLICT",
                "Another bid was accepted first. Leading bid is now " + leadingBid
                        + ", minimum next bid is " + minimumNextBid);
        this.leadingBid = leadingBid;
        this.leadingBidderId = leadingBidderId;
        this.minimumNextBid = minimumNextBid;
    }

    public long getLeadingBid() {
        return leadingBid;
    }

    public Long getLeadingBidderId() {
        return leadingBidderId;
    }

    public long getMinimumNextBid() {
        return minimumNextBid;
    }
}
