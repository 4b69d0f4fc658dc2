package com.guildauction.persistence;

import java.util.UUID;

/**
 * Durable note that the primary store missed a write. Markers name the row to copy from the
 * embedded store, never the data itself, so one marker covers any number of writes to that row.
 *
 * @param ref auction id, {@code auctionId#sequenceNo} for bids, {@code guildId/key} for settings
 */
public record ReplayMarker(Kind kind, String ref) {

    public enum Kind {
        AUCTION,
        BID,
        SETTING
    }

    public static ReplayMarker auction(UUID auctionId) {
        return new ReplayMarker(Kind.AUCTION, auctionId.toString());
    }

    /** One marker per bid slot: it covers both placing and undoing the bid at that sequence number. */
    public static ReplayMarker bid(UUID auctionId, long sequenceNo) {
        return new ReplayMarker(Kind.BID, auctionId + "#" + sequenceNo);
    }

    public static ReplayMarker setting(long guildId, String key) {
        return new ReplayMarker(Kind.SETTING, guildId + "/" + key);
    }

    public UUID auctionId() {
        int hash = ref.indexOf('#');
        return UUID.fromString(hash < 0 ? ref : ref.substring(0, hash));
    }

    public long sequenceNo() {
        return Long.parseLong(ref.substring(ref.indexOf('#') + 1));
    }

    public long guildId() {
        return Long.parseLong(ref.substring(0, ref.indexOf('/')));
    }

    public String settingKey() {
        return ref.substring(ref.indexOf('/') + 1);
    }

    @Override
    public String toString() {
        return kind + " " + ref;
    }
}
