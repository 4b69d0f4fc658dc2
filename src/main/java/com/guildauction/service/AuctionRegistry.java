package com.guildauction.service;

import com.guildauction.exception.AuctionConflictException;
import com.guildauction.exception.AuctionStateException;
import com.guildauction.model.LiveAuction;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of live auctions, one per guild. Authoritative for running auctions;
 * storage only mirrors it.
 */
@Component
public class AuctionRegistry {

    private final ConcurrentHashMap<Long, LiveAuction> liveByGuild = new ConcurrentHashMap<>();

    public void register(LiveAuction auction) {
        LiveAuction existing = liveByGuild.putIfAbsent(auction.getGuildId(), auction);
        if (existing != null && existing != auction) {
            throw new AuctionConflictException(auction.getGuildId());
        }
    }

    public Optional<LiveAuction> find(long guildId) {
        return Optional.ofNullable(liveByGuild.get(guildId));
    }

    public LiveAuction require(long guildId) {
        return find(guildId).orElseThrow(() -> new AuctionStateException("There is no active auction in this guild"));
    }

    /** Removes the entry only if it still points at this instance. */
    public boolean deregister(LiveAuction auction) {
        return liveByGuild.remove(auction.getGuildId(), auction);
    }

    public Collection<LiveAuction> liveAuctions() {
        return List.copyOf(liveByGuild.values());
    }
}
