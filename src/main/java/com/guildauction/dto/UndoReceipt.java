package com.guildauction.dto;

import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.BidEntry;

public record UndoReceipt(BidEntry removed, AuctionSnapshot auction) {
}
