package com.guildauction.dto;

import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.BidEntry;

/**
 * @param delta display difference to the previous leading amount, e.g. "+50K"
 */
public record BidReceipt(BidEntry bid, AuctionSnapshot auction, String delta) {
}
