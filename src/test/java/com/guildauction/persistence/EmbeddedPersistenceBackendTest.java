package com.guildauction.persistence;

import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.AuctionStatus;
import com.guildauction.model.BidEntry;
import com.guildauction.transport.MessageRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class EmbeddedPersistenceBackendTest {

    private static final Instant T0 = Instant.parse("2026-01-01T12:00:00Z");

    private EmbeddedPersistenceBackend backend;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:embedded-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        dataSource.setDriverClassName("org.h2.Driver");
        backend = new EmbeddedPersistenceBackend(new JdbcTemplate(dataSource));
    }

    private static AuctionSnapshot auction(UUID id, long guildId, AuctionStatus status, Instant startedAt) {
        return new AuctionSnapshot(id, guildId, 3L, 4L, status, 100_000L, 50_000L, null, null, 20, "Credits",
                startedAt, startedAt.plusSeconds(300), null, startedAt, null, null, 0L, 0L, List.of());
    }

    @Test
    void savesAndUpdatesAuctions() {
        UUID id = UUID.randomUUID();
        backend.saveAuction(auction(id, 1L, AuctionStatus.OPEN, T0));
        AuctionSnapshot updated = new AuctionSnapshot(id, 1L, 3L, 4L, AuctionStatus.COUNTDOWN, 100_000L, 50_000L,
                150_000L, 10L, 20, "Credits", T0, T0.plusSeconds(300), T0.plusSeconds(33), T0.plusSeconds(30),
                null, new MessageRef(3L, "panel-1"), 2L, 2L, List.of());
        backend.saveAuction(updated);

        AuctionSnapshot loaded = backend.findAuction(id).orElseThrow();
        assertThat(loaded.status()).isEqualTo(AuctionStatus.COUNTDOWN);
        assertThat(loaded.currentBid()).isEqualTo(150_000L);
        assertThat(loaded.currentBidderId()).isEqualTo(10L);
        assertThat(loaded.countdownDeadline()).isEqualTo(T0.plusSeconds(33));
        assertThat(loaded.panelRef()).isEqualTo(new MessageRef(3L, "panel-1"));
        assertThat(loaded.lastSequenceNo()).isEqualTo(2L);
        assertThat(loaded.endedAt()).isNull();
    }

    @Test
    void activeQueriesSkipEndedAuctionsNewestFirst() {
        UUID older = UUID.randomUUID();
        UUID newer = UUID.randomUUID();
        UUID ended = UUID.randomUUID();
        backend.saveAuction(auction(older, 1L, AuctionStatus.OPEN, T0));
        backend.saveAuction(auction(newer, 1L, AuctionStatus.OPEN, T0.plusSeconds(60)));
        backend.saveAuction(auction(ended, 2L, AuctionStatus.ENDED, T0.plusSeconds(120)));

        assertThat(backend.findActiveAuctions()).extracting(AuctionSnapshot::id).containsExactly(newer, older);
        assertThat(backend.findActiveAuction(1L)).get().extracting(AuctionSnapshot::id).isEqualTo(newer);
        assertThat(backend.findActiveAuction(2L)).isEmpty();
        assertThat(backend.findRecentAuctions(1L, 1)).extracting(AuctionSnapshot::id).containsExactly(newer);
    }

    @Test
    void bidsComeBackInSequenceOrderAndCanBeRemoved() {
        UUID id = UUID.randomUUID();
        BidEntry second = new BidEntry(UUID.randomUUID(), id, 11L, 150_000L, 2L, T0.plusSeconds(2));
        BidEntry first = new BidEntry(UUID.randomUUID(), id, 10L, 100_000L, 1L, T0.plusSeconds(1));
        backend.addBid(second);
        backend.addBid(first);

        assertThat(backend.findBids(id)).containsExactly(first, second);

        backend.removeBid(id, 2L);
        assertThat(backend.findBids(id)).containsExactly(first);
    }

    @Test
    void settingsAreUpsertedPerGuild() {
        backend.setSetting(1L, "currency_name", "Gold");
        backend.setSetting(1L, "currency_name", "Silver");
        backend.setSetting(1L, "commission", "10");
        backend.setSetting(2L, "commission", "30");

        assertThat(backend.getSetting(1L, "currency_name")).contains("Silver");
        assertThat(backend.getSetting(1L, "missing")).isEmpty();
        assertThat(backend.getSettings(1L))
                .hasSize(2)
                .containsEntry("commission", "10")
                .containsEntry("currency_name", "Silver");
    }

    @Test
    void pingCreatesTheSchema() {
        backend.ping();

        assertThat(backend.findActiveAuctions()).isEmpty();
    }

    @Test
    void replayMarkersAreKeptOncePerRowUntilCleared() {
        UUID id = UUID.randomUUID();
        backend.addReplayMarker(ReplayMarker.auction(id));
        backend.addReplayMarker(ReplayMarker.bid(id, 1L));
        backend.addReplayMarker(ReplayMarker.auction(id));
        backend.addReplayMarker(ReplayMarker.setting(1L, "currency_name"));

        List<ReplayMarker> markers = backend.findReplayMarkers();
        assertThat(markers).containsExactlyInAnyOrder(ReplayMarker.auction(id), ReplayMarker.bid(id, 1L),
                ReplayMarker.setting(1L, "currency_name"));
        ReplayMarker bid = ReplayMarker.bid(id, 1L);
        assertThat(bid.auctionId()).isEqualTo(id);
        assertThat(bid.sequenceNo()).isEqualTo(1L);
        assertThat(ReplayMarker.setting(1L, "currency_name").settingKey()).isEqualTo("currency_name");

        backend.clearReplayMarkers();
        assertThat(backend.findReplayMarkers()).isEmpty();
    }
}
