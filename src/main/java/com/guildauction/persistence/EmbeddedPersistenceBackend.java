package com.guildauction.persistence;

import com.guildauction.exception.StorageException;
import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.AuctionStatus;
import com.guildauction.model.BidEntry;
import com.guildauction.transport.MessageRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Secondary backend: an embedded H2 file database reached through plain JDBC.
 * Creates its own tables on first use; the schema mirrors the primary one.
 */
public class EmbeddedPersistenceBackend implements FallbackBackend {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedPersistenceBackend.class);

    private static final String AUCTION_COLUMNS = "id, guild_id, channel_id, started_by, status, start_bid, "
            + "min_increment, current_bid, current_bidder_id, commission_pct, currency_name, started_at, ends_at, "
            + "countdown_deadline, last_activity_at, ended_at, panel_channel_id, panel_message_id, last_sequence_no";

    private static final List<String> SCHEMA = List.of(
            "CREATE TABLE IF NOT EXISTS auctions ("
                    + "id VARCHAR(36) PRIMARY KEY, guild_id BIGINT NOT NULL, channel_id BIGINT NOT NULL, "
                    + "started_by BIGINT NOT NULL, status VARCHAR(16) NOT NULL, start_bid BIGINT NOT NULL, "
                    + "min_increment BIGINT NOT NULL, current_bid BIGINT, current_bidder_id BIGINT, "
                    + "commission_pct INT NOT NULL, currency_name VARCHAR(64) NOT NULL, "
                    + "started_at TIMESTAMP NOT NULL, ends_at TIMESTAMP, countdown_deadline TIMESTAMP, "
                    + "last_activity_at TIMESTAMP NOT NULL, ended_at TIMESTAMP, panel_channel_id BIGINT, "
                    + "panel_message_id VARCHAR(64), last_sequence_no BIGINT NOT NULL, "
                    + "updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",
            "CREATE INDEX IF NOT EXISTS idx_auctions_status ON auctions (status)",
            "CREATE TABLE IF NOT EXISTS bids ("
                    + "id VARCHAR(36) PRIMARY KEY, auction_id VARCHAR(36) NOT NULL, bidder_id BIGINT NOT NULL, "
                    + "amount BIGINT NOT NULL, sequence_no BIGINT NOT NULL, created_at TIMESTAMP NOT NULL, "
                    + "CONSTRAINT uq_bids_sequence UNIQUE (auction_id, sequence_no))",
            "CREATE TABLE IF NOT EXISTS settings ("
                    + "guild_id BIGINT NOT NULL, setting_key VARCHAR(128) NOT NULL, setting_value VARCHAR(1024), "
                    + "updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, PRIMARY KEY (guild_id, setting_key))",
            "CREATE TABLE IF NOT EXISTS replay_markers ("
                    + "kind VARCHAR(16) NOT NULL, ref VARCHAR(128) NOT NULL, "
                    + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, PRIMARY KEY (kind, ref))"
    );

    private final JdbcTemplate jdbc;
    private volatile boolean schemaReady;

    private final RowMapper<AuctionSnapshot> auctionMapper = this::mapAuction;

    public EmbeddedPersistenceBackend(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public String name() {
        return "embedded";
    }

    @Override
    public void ping() {
        run("ping", () -> jdbc.queryForObject("SELECT 1", Integer.class));
    }

    @Override
    public void saveAuction(AuctionSnapshot s) {
        MessageRef panel = s.panelRef();
        run("saveAuction", () -> jdbc.update("MERGE INTO auctions (" + AUCTION_COLUMNS + ", updated_at) KEY (id) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
                s.id().toString(), s.guildId(), s.channelId(), s.startedBy(), s.status().name(), s.startBid(),
                s.minIncrement(), s.currentBid(), s.currentBidderId(), s.commissionPct(), s.currencyName(),
                timestamp(s.startedAt()), timestamp(s.endsAt()), timestamp(s.countdownDeadline()),
                timestamp(s.lastActivityAt()), timestamp(s.endedAt()),
                panel != null ? panel.channelId() : null, panel != null ? panel.messageId() : null,
                s.lastSequenceNo()));
    }

    @Override
    public void addBid(BidEntry bid) {
        run("addBid", () -> jdbc.update("MERGE INTO bids (id, auction_id, bidder_id, amount, sequence_no, created_at) "
                        + "KEY (id) VALUES (?, ?, ?, ?, ?, ?)",
                bid.id().toString(), bid.auctionId().toString(), bid.bidderId(), bid.amount(), bid.sequenceNo(),
                timestamp(bid.createdAt())));
    }

    @Override
    public void removeBid(UUID auctionId, long sequenceNo) {
        run("removeBid", () -> jdbc.update("DELETE FROM bids WHERE auction_id = ? AND sequence_no = ?",
                auctionId.toString(), sequenceNo));
    }

    @Override
    public Optional<AuctionSnapshot> findAuction(UUID auctionId) {
        return run("findAuction", () -> jdbc.query("SELECT " + AUCTION_COLUMNS + " FROM auctions WHERE id = ?",
                auctionMapper, auctionId.toString()).stream().findFirst());
    }

    @Override
    public List<AuctionSnapshot> findActiveAuctions() {
        return run("findActiveAuctions", () -> jdbc.query("SELECT " + AUCTION_COLUMNS
                + " FROM auctions WHERE status <> 'ENDED' ORDER BY started_at DESC", auctionMapper));
    }

    @Override
    public Optional<AuctionSnapshot> findActiveAuction(long guildId) {
        return run("findActiveAuction", () -> jdbc.query("SELECT " + AUCTION_COLUMNS
                        + " FROM auctions WHERE guild_id = ? AND status <> 'ENDED' ORDER BY started_at DESC LIMIT 1",
                auctionMapper, guildId).stream().findFirst());
    }

    @Override
    public List<AuctionSnapshot> findRecentAuctions(long guildId, int limit) {
        return run("findRecentAuctions", () -> jdbc.query("SELECT " + AUCTION_COLUMNS
                        + " FROM auctions WHERE guild_id = ? ORDER BY started_at DESC LIMIT ?",
                auctionMapper, guildId, Math.max(1, limit)));
    }

    @Override
    public List<BidEntry> findBids(UUID auctionId) {
        return run("findBids", () -> jdbc.query("SELECT id, auction_id, bidder_id, amount, sequence_no, created_at "
                        + "FROM bids WHERE auction_id = ? ORDER BY sequence_no",
                (rs, row) -> new BidEntry(UUID.fromString(rs.getString("id")),
                        UUID.fromString(rs.getString("auction_id")), rs.getLong("bidder_id"), rs.getLong("amount"),
                        rs.getLong("sequence_no"), instant(rs, "created_at")),
                auctionId.toString()));
    }

    @Override
    public Optional<String> getSetting(long guildId, String key) {
        return run("getSetting", () -> jdbc.queryForList(
                "SELECT setting_value FROM settings WHERE guild_id = ? AND setting_key = ?",
                String.class, guildId, key).stream().findFirst());
    }

    @Override
    public void setSetting(long guildId, String key, String value) {
        run("setSetting", () -> jdbc.update("MERGE INTO settings (guild_id, setting_key, setting_value, updated_at) "
                + "KEY (guild_id, setting_key) VALUES (?, ?, ?, CURRENT_TIMESTAMP)", guildId, key, value));
    }

    @Override
    public Map<String, String> getSettings(long guildId) {
        return run("getSettings", () -> {
            Map<String, String> values = new LinkedHashMap<>();
            jdbc.query("SELECT setting_key, setting_value FROM settings WHERE guild_id = ? ORDER BY setting_key",
                    (RowCallbackHandler) rs -> values.put(rs.getString("setting_key"), rs.getString("setting_value")),
                    guildId);
            return values;
        });
    }

    @Override
    public void addReplayMarker(ReplayMarker marker) {
        // the first write keeps its place in the replay order
        run("addReplayMarker", () -> jdbc.update("INSERT INTO replay_markers (kind, ref) "
                        + "SELECT ?, ? WHERE NOT EXISTS (SELECT 1 FROM replay_markers WHERE kind = ? AND ref = ?)",
                marker.kind().name(), marker.ref(), marker.kind().name(), marker.ref()));
    }

    @Override
    public List<ReplayMarker> findReplayMarkers() {
        return run("findReplayMarkers", () -> jdbc.query("SELECT kind, ref FROM replay_markers ORDER BY created_at, ref",
                (rs, row) -> new ReplayMarker(ReplayMarker.Kind.valueOf(rs.getString("kind")), rs.getString("ref"))));
    }

    @Override
    public void clearReplayMarkers() {
        run("clearReplayMarkers", () -> jdbc.update("DELETE FROM replay_markers"));
    }

    private <T> T run(String operation, Supplier<T> work) {
        try {
            ensureSchema();
            return work.get();
        } catch (StorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageException("Embedded store failed during " + operation + ": " + e.getMessage(), e);
        }
    }

    private void ensureSchema() {
        if (schemaReady) {
            return;
        }
        synchronized (this) {
            if (!schemaReady) {
                SCHEMA.forEach(jdbc::execute);
                schemaReady = true;
                log.info("Embedded store schema ready");
            }
        }
    }

    private AuctionSnapshot mapAuction(ResultSet rs, int row) throws SQLException {
        long panelChannel = rs.getLong("panel_channel_id");
        boolean hasPanelChannel = !rs.wasNull();
        String panelMessage = rs.getString("panel_message_id");
        MessageRef panel = hasPanelChannel && panelMessage != null ? new MessageRef(panelChannel, panelMessage) : null;
        return new AuctionSnapshot(UUID.fromString(rs.getString("id")), rs.getLong("guild_id"),
                rs.getLong("channel_id"), rs.getLong("started_by"), AuctionStatus.valueOf(rs.getString("status")),
                rs.getLong("start_bid"), rs.getLong("min_increment"), nullableLong(rs, "current_bid"),
                nullableLong(rs, "current_bidder_id"), rs.getInt("commission_pct"), rs.getString("currency_name"),
                instant(rs, "started_at"), instant(rs, "ends_at"), instant(rs, "countdown_deadline"),
                instant(rs, "last_activity_at"), instant(rs, "ended_at"), panel, rs.getLong("last_sequence_no"),
                0L, List.of());
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
