package com.guildauction.model;

import com.guildauction.transport.MessageRef;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable copy of an auction taken under its lock. Renderers, storage and
 * diagnostics only ever see snapshots, never the live object.
 *
 * @param currentBid      leading amount, {@code null} until the first bid is accepted
 * @param lastSequenceNo  highest sequence number ever handed out, survives undo
 * @param revision        bumped on every bid and undo; callers echo it back to detect races
 * @param bids            accepted bids in acceptance order, empty when loaded from storage without bids
 */
public record AuctionSnapshot(UUID id,
                              long guildId,
                              long channelId,
                              long startedBy,
                              AuctionStatus status,
                              long startBid,
                              long minIncrement,
                              Long currentBid,
                              Long currentBidderId,
                              int commissionPct,
                              String currencyName,
                              Instant startedAt,
                              Instant endsAt,
                              Instant countdownDeadline,
                              Instant lastActivityAt,
                              Instant endedAt,
                              MessageRef panelRef,
                              long lastSequenceNo,
                              long revision,
                              List<BidEntry> bids) {

    public AuctionSnapshot {
        bids = bids == null ? List.of() : List.copyOf(bids);
    }

    public boolean hasBids() {
        return currentBid != null;
    }

    /** Amount shown as "highest": the leading bid, or the start bid while there is none. */
    public long leadingAmount() {
        return currentBid != null ? currentBid : startBid;
    }

    public long minimumNextBid() {
        return currentBid != null ? currentBid + minIncrement : startBid;
    }

    public int bidCount() {
        return bids.size();
    }

    public Optional<BidEntry> latestBid() {
        return bids.isEmpty() ? Optional.empty() : Optional.of(bids.get(bids.size() - 1));
    }

    public Duration timeLeft(Instant now) {
        if (endsAt == null || !now.isBefore(endsAt)) {
            return Duration.ZERO;
        }
        return Duration.between(now, endsAt);
    }

    public AuctionSnapshot withBids(List<BidEntry> loadedBids) {
        return new AuctionSnapshot(id, guildId, channelId, startedBy, status, startBid, minIncrement,
                currentBid, currentBidderId, commissionPct, currencyName, startedAt, endsAt,
                countdownDeadline, lastActivityAt, endedAt, panelRef, lastSequenceNo, revision, loadedBids);
    }

    public AuctionSnapshot withStatus(AuctionStatus newStatus, Instant newEndedAt) {
        return new AuctionSnapshot(id, guildId, channelId, startedBy, newStatus, startBid, minIncrement,
                currentBid, currentBidderId, commissionPct, currencyName, startedAt, endsAt,
                null, lastActivityAt, newEndedAt, panelRef, lastSequenceNo, revision, bids);
    }
}
