package com.guildauction.persistence;

import com.guildauction.exception.StorageException;
import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.BidEntry;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * One storage engine holding the auctions, bids and settings tables.
 * Every operation throws {@link StorageException} when the store cannot serve it.
 */
public interface PersistenceBackend {

    String name();

    /** Cheap round trip used for health checks and reconnect probes. */
    void ping();

    /** Insert or update the auction row. Bids in the snapshot are ignored. */
    void saveAuction(AuctionSnapshot auction);

    void addBid(BidEntry bid);

    void removeBid(UUID auctionId, long sequenceNo);

    Optional<AuctionSnapshot> findAuction(UUID auctionId);

    /** Every auction not yet ENDED, newest first. */
    List<AuctionSnapshot> findActiveAuctions();

    Optional<AuctionSnapshot> findActiveAuction(long guildId);

    List<AuctionSnapshot> findRecentAuctions(long guildId, int limit);

    /** Bids of an auction ordered by sequence number. */
    List<BidEntry> findBids(UUID auctionId);

    Optional<String> getSetting(long guildId, String key);

    void setSetting(long guildId, String key, String value);

    Map<String, String> getSettings(long guildId);
}
