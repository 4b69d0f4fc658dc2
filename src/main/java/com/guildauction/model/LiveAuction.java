package com.guildauction.model;

import com.guildauction.transport.MessageRef;
import com.guildauction.util.SerialTaskQueue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutable state of one running auction. Every read and write of the mutable fields
 * happens while holding {@link #locked(Supplier)}; mutators refuse to run otherwise.
 */
public class LiveAuction {

    private final ReentrantLock lock = new ReentrantLock();

    private final UUID id;
    private final long guildId;
    private final long channelId;
    private final long startedBy;
    private final long startBid;
    private final long minIncrement;
    private final int commissionPct;
    private final String currencyName;
    private final Instant startedAt;
    private final Instant endsAt;
    private final SerialTaskQueue writeQueue;

    private AuctionStatus status;
    private Long currentBid;
    private Long currentBidderId;
    private Instant countdownDeadline;
    private Instant lastActivityAt;
    private Instant endedAt;
    private MessageRef panelRef;
    private long lastSequenceNo;
    private long revision;
    private final List<BidEntry> bids = new ArrayList<>();
    private final Map<Long, Instant> lastBidAtByBidder = new HashMap<>();

    private LiveAuction(UUID id, long guildId, long channelId, long startedBy, long startBid, long minIncrement,
                        int commissionPct, String currencyName, Instant startedAt, Instant endsAt,
                        SerialTaskQueue writeQueue) {
        this.id = id;
        this.guildId = guildId;
        this.channelId = channelId;
        this.startedBy = startedBy;
        this.startBid = startBid;
        this.minIncrement = minIncrement;
        this.commissionPct = commissionPct;
        this.currencyName = currencyName;
        this.startedAt = startedAt;
        this.endsAt = endsAt;
        this.writeQueue = writeQueue;
    }

    public static LiveAuction open(long guildId, long channelId, long startedBy, long startBid, long minIncrement,
                                   int commissionPct, String currencyName, Instant now, Instant endsAt,
                                   SerialTaskQueue writeQueue) {
        LiveAuction auction = new LiveAuction(UUID.randomUUID(), guildId, channelId, startedBy, startBid,
                minIncrement, commissionPct, currencyName, now, endsAt, writeQueue);
        auction.status = AuctionStatus.OPEN;
        auction.lastActivityAt = now;
        return auction;
    }

    /**
     * Rebuilds a live auction from its persisted record and bids (startup recovery).
     */
    public static LiveAuction restore(AuctionSnapshot stored, List<BidEntry> storedBids, SerialTaskQueue writeQueue) {
        LiveAuction auction = new LiveAuction(stored.id(), stored.guildId(), stored.channelId(), stored.startedBy(),
                stored.startBid(), stored.minIncrement(), stored.commissionPct(), stored.currencyName(),
                stored.startedAt(), stored.endsAt(), writeQueue);
        auction.status = stored.status();
        auction.countdownDeadline = stored.countdownDeadline();
        auction.lastActivityAt = stored.lastActivityAt() != null ? stored.lastActivityAt() : stored.startedAt();
        auction.panelRef = stored.panelRef();
        auction.lastSequenceNo = stored.lastSequenceNo();
        for (BidEntry bid : storedBids) {
            auction.bids.add(bid);
            auction.lastBidAtByBidder.put(bid.bidderId(), bid.createdAt());
            auction.lastSequenceNo = Math.max(auction.lastSequenceNo, bid.sequenceNo());
        }
        auction.recomputeLeader();
        return auction;
    }

    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public AuctionSnapshot snapshot() {
        return locked(this::snapshotHeld);
    }

    public AuctionSnapshot snapshotHeld() {
        requireLock();
        return new AuctionSnapshot(id, guildId, channelId, startedBy, status, startBid, minIncrement,
                currentBid, currentBidderId, commissionPct, currencyName, startedAt, endsAt,
                countdownDeadline, lastActivityAt, endedAt, panelRef, lastSequenceNo, revision, bids);
    }

    // ---- mutators, lock must be held ----

    public BidEntry appendBid(long bidderId, long amount, Instant now) {
        requireLock();
        BidEntry entry = new BidEntry(UUID.randomUUID(), id, bidderId, amount, ++lastSequenceNo, now);
        bids.add(entry);
        currentBid = amount;
        currentBidderId = bidderId;
        lastBidAtByBidder.put(bidderId, now);
        revision++;
        return entry;
    }

    public BidEntry removeLatestBid() {
        requireLock();
        BidEntry removed = bids.remove(bids.size() - 1);
        // the bidder's cooldown falls back to their previous bid, if any is left
        Instant previous = null;
        for (BidEntry bid : bids) {
            if (bid.bidderId() == removed.bidderId()) {
                previous = bid.createdAt();
            }
        }
        if (previous != null) {
            lastBidAtByBidder.put(removed.bidderId(), previous);
        } else {
            lastBidAtByBidder.remove(removed.bidderId());
        }
        recomputeLeader();
        revision++;
        return removed;
    }

    /** Lowest acceptable bid right now. */
    public long minimumNextBid() {
        requireLock();
        return currentBid != null ? currentBid + minIncrement : startBid;
    }

    /** Lowest acceptable bid before the latest bid was placed. */
    public long minimumBeforeLatestBid() {
        requireLock();
        if (bids.size() < 2) {
            return startBid;
        }
        return bids.get(bids.size() - 2).amount() + minIncrement;
    }

    public void markActivity(Instant now) {
        requireLock();
        lastActivityAt = now;
    }

    public void startCountdown(Instant deadline) {
        requireLock();
        status = AuctionStatus.COUNTDOWN;
        countdownDeadline = deadline;
    }

    public void reopen() {
        requireLock();
        status = AuctionStatus.OPEN;
        countdownDeadline = null;
    }

    public void end(Instant now) {
        requireLock();
        status = AuctionStatus.ENDED;
        countdownDeadline = null;
        endedAt = now;
    }

    public void setPanelRef(MessageRef panelRef) {
        requireLock();
        this.panelRef = panelRef;
    }

    private void recomputeLeader() {
        if (bids.isEmpty()) {
            currentBid = null;
            currentBidderId = null;
        } else {
            BidEntry latest = bids.get(bids.size() - 1);
            currentBid = latest.amount();
            currentBidderId = latest.bidderId();
        }
    }

    private void requireLock() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Auction " + id + " accessed without holding its lock");
        }
    }

    // ---- accessors; mutable fields are only meaningful under the lock ----

    public UUID getId() { return id; }
    public long getGuildId() { return guildId; }
    public long getChannelId() { return channelId; }
    public long getStartBid() { return startBid; }
    public long getMinIncrement() { return minIncrement; }
    public SerialTaskQueue getWriteQueue() { return writeQueue; }

    public AuctionStatus getStatus() { return status; }
    public Long getCurrentBid() { return currentBid; }
    public Long getCurrentBidderId() { return currentBidderId; }
    public Instant getCountdownDeadline() { return countdownDeadline; }
    public Instant getLastActivityAt() { return lastActivityAt; }
    public long getRevision() { return revision; }
    public boolean hasBids() { return !bids.isEmpty(); }

    public Instant getLastBidAt(long bidderId) {
        requireLock();
        return lastBidAtByBidder.get(bidderId);
    }
}
