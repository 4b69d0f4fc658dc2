package com.guildauction.dto;

public class OpenAuctionRequest {

    private Long channelId;
    private String startBid;
    private String minIncrement;
    private Integer durationMinutes;
    private String secretCode;

    public Long getChannelId() {
        return channelId;
    }

    public void setChannelId(Long channelId) {
        this.channelId = channelId;
    }

    public String getStartBid() {
        return startBid;
    }

    public void setStartBid(String startBid) {
        this.startBid = startBid;
    }

    public String getMinIncrement() {
        return minIncrement;
    }

    public void setMinIncrement(String minIncrement) {
        this.minIncrement = minIncrement;
    }

    public Integer getDurationMinutes() {
        return durationMinutes;
    }

    public void setDurationMinutes(Integer durationMinutes) {
        this.durationMinutes = durationMinutes;
    }

    public String getSecretCode() {
        return secretCode;
    }

    public void setSecretCode(String secretCode) {
        this.secretCode = secretCode;
    }
}
