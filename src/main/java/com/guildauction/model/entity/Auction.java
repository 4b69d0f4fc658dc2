package com.guildauction.model.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "auctions", indexes = {
        @Index(name = "idx_auctions_status", columnList = "status"),
        @Index(name = "idx_auctions_guild", columnList = "guild_id, started_at")
})
@Getter
@Setter
@NoArgsConstructor
public class Auction {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "guild_id", nullable = false)
    private long guildId;

    @Column(name = "channel_id", nullable = false)
    private long channelId;

    @Column(name = "started_by", nullable = false)
    private long startedBy;

    @Column(name = "status", nullable = false, length = 16)
    private String status;

    @Column(name = "start_bid", nullable = false)
    private long startBid;

    @Column(name = "min_increment", nullable = false)
    private long minIncrement;

    @Column(name = "current_bid")
    private Long currentBid;

    @Column(name = "current_bidder_id")
    private Long currentBidderId;

    @Column(name = "commission_pct", nullable = false)
    private int commissionPct;

    @Column(name = "currency_name", nullable = false, length = 64)
    private String currencyName;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ends_at")
    private Instant endsAt;

    @Column(name = "countdown_deadline")
    private Instant countdownDeadline;

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "panel_channel_id")
    private Long panelChannelId;

    @Column(name = "panel_message_id", length = 64)
    private String panelMessageId;

    @Column(name = "last_sequence_no", nullable = false)
    private long lastSequenceNo;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }
}
