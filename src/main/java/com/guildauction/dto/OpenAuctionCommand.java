package com.guildauction.dto;

/**
 * Validated-shape input for opening an auction. Amounts are already parsed.
 */
public record OpenAuctionCommand(long guildId,
                                 long channelId,
                                 long startedBy,
                                 long startBid,
                                 long minIncrement,
                                 int durationMinutes) {
}
