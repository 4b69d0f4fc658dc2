package com.guildauction.model.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "bids",
        uniqueConstraints = @UniqueConstraint(name = "uq_bids_sequence", columnNames = {"auction_id", "sequence_no"}),
        indexes = @Index(name = "idx_bids_auction", columnList = "auction_id"))
public class Bid {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "auction_id", nullable = false)
    private UUID auctionId;

    @Column(name = "bidder_id", nullable = false)
    private long bidderId;

    @Column(name = "amount", nullable = false)
    private long amount;

    @Column(name = "sequence_no", nullable = false)
    private long sequenceNo;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public Bid() {}

    public Bid(UUID id, UUID auctionId, long bidderId, long amount, long sequenceNo, Instant createdAt) {
        this.id = id;
        this.auctionId = auctionId;
        this.bidderId = bidderId;
        this.amount = amount;
        this.sequenceNo = sequenceNo;
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getAuctionId() {
        return auctionId;
    }

    public long getBidderId() {
        return bidderId;
    }

    public long getAmount() {
        return amount;
    }

    public long getSequenceNo() {
        return sequenceNo;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
