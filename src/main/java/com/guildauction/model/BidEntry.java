package com.guildauction.model;

import java.time.Instant;
import java.util.UUID;

/**
 * An accepted bid. Immutable; only the latest entry of an auction can be removed (undo).
 */
public record BidEntry(UUID id, UUID auctionId, long bidderId, long amount, long sequenceNo, Instant createdAt) {
}
