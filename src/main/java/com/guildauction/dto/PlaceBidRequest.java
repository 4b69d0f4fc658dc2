package com.guildauction.dto;

/**
 * Either {@code amount} (free text such as "250k") or {@code increment} (a quick-bid button)
 * is set. {@code expectedRevision} is the panel revision the bidder was looking at.
 */
public class PlaceBidRequest {

    private String amount;
    private Long increment;
    private Long expectedRevision;

    public PlaceBidRequest() {
    }

    public PlaceBidRequest(String amount, Long increment, Long expectedRevision) {
        this.amount = amount;
        this.increment = increment;
        this.expectedRevision = expectedRevision;
    }

    public static PlaceBidRequest ofAmount(String amount) {
        return new PlaceBidRequest(amount, null, null);
    }

    public static PlaceBidRequest ofIncrement(long increment, long expectedRevision) {
        return new PlaceBidRequest(null, increment, expectedRevision);
    }

    public String getAmount() {
        return amount;
    }

    public void setAmount(String amount) {
        this.amount = amount;
    }

    public Long getIncrement() {
        return increment;
    }

    public void setIncrement(Long increment) {
        this.increment = increment;
    }

    public Long getExpectedRevision() {
        return expectedRevision;
    }

    public void setExpectedRevision(Long expectedRevision) {
        this.expectedRevision = expectedRevision;
    }
}
