package com.guildauction.persistence;

import com.guildauction.config.AuctionProperties;
import com.guildauction.exception.StorageException;
import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.AuctionStatus;
import com.guildauction.model.BidEntry;
import com.guildauction.support.InMemoryBackend;
import com.guildauction.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PersistenceGatewayTest {

    private static final Instant T0 = Instant.parse("2026-01-01T12:00:00Z");

    private InMemoryBackend primary;
    private InMemoryBackend secondary;
    private AuctionProperties.Persistence settings;
    private PersistenceGateway gateway;

    @BeforeEach
    void setUp() {
        primary = new InMemoryBackend("primary");
        secondary = new InMemoryBackend("embedded");
        settings = new AuctionProperties.Persistence();
        settings.setRetryAttempts(3);
        settings.setRetryBackoff(Duration.ZERO);
        gateway = new PersistenceGateway(primary, secondary, settings, new MutableClock(T0));
    }

    private PersistenceGateway restartedGateway() {
        return new PersistenceGateway(primary, secondary, settings, new MutableClock(T0.plusSeconds(600)));
    }

    private static AuctionSnapshot auction(UUID id, long guildId, AuctionStatus status, Long currentBid) {
        return new AuctionSnapshot(id, guildId, 3L, 4L, status, 100_000L, 50_000L, currentBid,
                currentBid != null ? 10L : null, 20, "Credits", T0, T0.plusSeconds(300), null, T0, null,
                null, currentBid != null ? 1L : 0L, 0L, List.of());
    }

    @Test
    void healthyPrimaryServesEverything() {
        gateway.initialize();
        UUID id = UUID.randomUUID();

        assertThat(gateway.saveAuction(auction(id, 1L, AuctionStatus.OPEN, null))).isTrue();

        assertThat(primary.auctions).containsKey(id);
        assertThat(secondary.auctions).isEmpty();
        assertThat(gateway.getActiveAuction(1L)).isPresent();
        assertThat(gateway.getConnectionStatus().status()).isEqualTo(BackendStatus.ACTIVE);
        assertThat(gateway.getConnectionStatus().activeBackend()).isEqualTo("primary");
    }

    @Test
    void exhaustedRetriesFailOverToTheEmbeddedStore() {
        gateway.initialize();
        primary.setDown(true);
        int before = primary.calls.get();
        UUID id = UUID.randomUUID();

        assertThat(gateway.saveAuction(auction(id, 1L, AuctionStatus.OPEN, null))).isTrue();

        assertThat(primary.calls.get() - before).isEqualTo(3);
        assertThat(secondary.auctions).containsKey(id);
        ConnectionStatus status = gateway.getConnectionStatus();
        assertThat(status.status()).isEqualTo(BackendStatus.DEGRADED);
        assertThat(status.activeBackend()).isEqualTo("embedded");
        assertThat(status.failovers()).isEqualTo(1);
        assertThat(status.primaryFailures()).isEqualTo(3);
        assertThat(status.pendingReplay()).isEqualTo(1);
        assertThat(status.degradedSince()).isEqualTo(T0);
        assertThat(status.lastError()).contains("primary is down");

        // later calls skip the primary entirely
        int afterFailover = primary.calls.get();
        gateway.getActiveAuctions();
        assertThat(primary.calls.get()).isEqualTo(afterFailover);
    }

    @Test
    void reconnectReplaysWritesMadeWhileDegraded() {
        gateway.initialize();
        UUID id = UUID.randomUUID();
        AuctionSnapshot opened = auction(id, 1L, AuctionStatus.OPEN, null);
        gateway.saveAuction(opened);
        gateway.setSetting(1L, "currency_name", "Gold");

        primary.setDown(true);
        BidEntry bid = new BidEntry(UUID.randomUUID(), id, 10L, 150_000L, 1L, T0);
        gateway.addBid(bid);
        gateway.saveAuction(auction(id, 1L, AuctionStatus.OPEN, 150_000L));
        gateway.setSetting(1L, "commission", "15");
        assertThat(primary.bids).doesNotContainKey(id);

        primary.setDown(false);
        assertThat(gateway.reconnect()).isTrue();

        assertThat(gateway.getStatus()).isEqualTo(BackendStatus.ACTIVE);
        assertThat(primary.bids.get(id)).containsExactly(bid);
        assertThat(primary.auctions.get(id).currentBid()).isEqualTo(150_000L);
        assertThat(gateway.getSettings(1L))
                .containsEntry("currency_name", "Gold")
                .containsEntry("commission", "15");
        assertThat(gateway.getConnectionStatus().pendingReplay()).isZero();
        assertThat(gateway.getConnectionStatus().degradedSince()).isNull();
    }

    @Test
    void recentAuctionsAndSingleSettingsComeFromTheActiveStore() {
        gateway.initialize();
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        gateway.saveAuction(auction(first, 1L, AuctionStatus.ENDED, 150_000L));
        gateway.saveAuction(auction(second, 1L, AuctionStatus.OPEN, null));
        gateway.setSetting(1L, "currency_name", "Gold");

        assertThat(gateway.getRecentAuctions(1L, 10)).extracting(AuctionSnapshot::id)
                .containsExactlyInAnyOrder(first, second);
        assertThat(gateway.getRecentAuctions(2L, 10)).isEmpty();
        assertThat(gateway.getSetting(1L, "currency_name")).contains("Gold");
        assertThat(gateway.getSetting(1L, "role_id")).isEmpty();

        primary.setDown(true);
        assertThat(gateway.getSetting(1L, "currency_name")).isEmpty();
    }

    @Test
    void replayKeepsUndoAfterTheInsertItRemoves() {
        gateway.initialize();
        UUID id = UUID.randomUUID();
        primary.setDown(true);
        BidEntry bid = new BidEntry(UUID.randomUUID(), id, 10L, 150_000L, 1L, T0);
        gateway.addBid(bid);
        gateway.removeBid(id, 1L);

        primary.setDown(false);
        gateway.reconnect();

        assertThat(primary.bids.get(id)).isEmpty();
    }

    @Test
    void reconnectFailsWhilePrimaryIsStillDown() {
        gateway.initialize();
        primary.setDown(true);
        gateway.saveAuction(auction(UUID.randomUUID(), 1L, AuctionStatus.OPEN, null));

        assertThat(gateway.reconnect()).isFalse();

        ConnectionStatus status = gateway.getConnectionStatus();
        assertThat(status.status()).isEqualTo(BackendStatus.DEGRADED);
        assertThat(status.reconnectAttempts()).isEqualTo(1);
        assertThat(status.pendingReplay()).isEqualTo(1);
    }

    @Test
    void probeOnlyActsWhenDegraded() {
        gateway.initialize();
        gateway.probePrimary();
        assertThat(gateway.getConnectionStatus().reconnectAttempts()).isZero();

        primary.setDown(true);
        gateway.getActiveAuctions();
        primary.setDown(false);
        gateway.probePrimary();

        assertThat(gateway.getStatus()).isEqualTo(BackendStatus.ACTIVE);
        assertThat(gateway.getConnectionStatus().reconnectAttempts()).isEqualTo(1);
    }

    @Test
    void bothDownMeansEmptyReadsAndKeptWrites() {
        gateway.initialize();
        primary.setDown(true);
        secondary.setDown(true);
        UUID id = UUID.randomUUID();

        assertThat(gateway.getActiveAuctions()).isEmpty();
        assertThat(gateway.findAuction(id)).isEmpty();
        assertThat(gateway.saveAuction(auction(id, 1L, AuctionStatus.OPEN, null))).isFalse();
        // two reads, the write itself and its replay marker
        assertThat(gateway.getConnectionStatus().secondaryFailures()).isEqualTo(4);

        primary.setDown(false);
        gateway.reconnect();
        assertThat(primary.auctions).containsKey(id);
    }

    @Test
    void startsDegradedWhenOnlyTheEmbeddedStoreAnswers() {
        primary.setDown(true);

        gateway.initialize();

        assertThat(gateway.getStatus()).isEqualTo(BackendStatus.DEGRADED);
    }

    @Test
    void refusesToStartWithoutAnyStore() {
        primary.setDown(true);
        secondary.setDown(true);

        assertThatThrownBy(() -> gateway.initialize()).isInstanceOf(StorageException.class);
    }

    @Test
    void repeatedRowWritesShareOneJournalEntry() {
        gateway.initialize();
        UUID id = UUID.randomUUID();
        primary.setDown(true);
        gateway.saveAuction(auction(id, 1L, AuctionStatus.OPEN, null));
        gateway.addBid(new BidEntry(UUID.randomUUID(), id, 10L, 150_000L, 1L, T0));
        for (long bid = 1; bid <= 50_000; bid++) {
            gateway.saveAuction(auction(id, 1L, AuctionStatus.OPEN, 100_000L + bid));
            gateway.setSetting(1L, "currency_name", "Gold" + bid);
        }

        assertThat(gateway.getConnectionStatus().pendingReplay()).isEqualTo(3);

        primary.setDown(false);
        assertThat(gateway.reconnect()).isTrue();
        assertThat(primary.auctions.get(id).currentBid()).isEqualTo(150_000L);
        assertThat(primary.bids.get(id)).hasSize(1);
        assertThat(primary.settings).containsEntry("1/currency_name", "Gold50000");
    }

    @Test
    void fullJournalFallsBackToCopyingMarkedRows() {
        settings.setMaxPendingReplay(3);
        gateway = new PersistenceGateway(primary, secondary, settings, new MutableClock(T0));
        gateway.initialize();
        UUID id = UUID.randomUUID();
        primary.setDown(true);
        gateway.saveAuction(auction(id, 1L, AuctionStatus.OPEN, null));
        for (long seq = 1; seq <= 5; seq++) {
            gateway.addBid(new BidEntry(UUID.randomUUID(), id, 10L, 100_000L + seq * 50_000L, seq, T0));
        }

        ConnectionStatus status = gateway.getConnectionStatus();
        assertThat(status.pendingReplay()).isEqualTo(3);
        assertThat(status.replayOverflow()).isEqualTo(3);
        assertThat(secondary.markers).hasSize(6);

        primary.setDown(false);
        assertThat(gateway.reconnect()).isTrue();

        assertThat(primary.auctions).containsKey(id);
        assertThat(primary.bids.get(id)).extracting(BidEntry::sequenceNo)
                .containsExactlyInAnyOrder(1L, 2L, 3L, 4L, 5L);
        assertThat(secondary.markers).isEmpty();
        assertThat(gateway.getConnectionStatus().pendingReplay()).isZero();
    }

    @Test
    void writesMadeWhileDegradedSurviveARestart() {
        gateway.initialize();
        UUID id = UUID.randomUUID();
        primary.setDown(true);
        gateway.saveAuction(auction(id, 1L, AuctionStatus.OPEN, null));
        BidEntry kept = new BidEntry(UUID.randomUUID(), id, 10L, 150_000L, 1L, T0);
        BidEntry undone = new BidEntry(UUID.randomUUID(), id, 11L, 200_000L, 2L, T0);
        gateway.addBid(kept);
        gateway.addBid(undone);
        gateway.removeBid(id, 2L);
        gateway.saveAuction(auction(id, 1L, AuctionStatus.OPEN, 150_000L));
        gateway.setSetting(1L, "commission", "15");

        // the process dies here; the new gateway starts with an empty journal
        primary.setDown(false);
        PersistenceGateway restarted = restartedGateway();
        restarted.initialize();

        assertThat(restarted.getStatus()).isEqualTo(BackendStatus.ACTIVE);
        assertThat(primary.auctions.get(id).currentBid()).isEqualTo(150_000L);
        assertThat(primary.bids.get(id)).containsExactly(kept);
        assertThat(primary.settings).containsEntry("1/commission", "15");
        assertThat(secondary.markers).isEmpty();
    }

    @Test
    void restartWhilePrimaryIsDownCopiesMarkedRowsOnReconnect() {
        gateway.initialize();
        UUID id = UUID.randomUUID();
        primary.setDown(true);
        gateway.saveAuction(auction(id, 1L, AuctionStatus.OPEN, null));

        PersistenceGateway restarted = restartedGateway();
        restarted.initialize();
        assertThat(restarted.getStatus()).isEqualTo(BackendStatus.DEGRADED);

        primary.setDown(false);
        restarted.probePrimary();

        assertThat(restarted.getStatus()).isEqualTo(BackendStatus.ACTIVE);
        assertThat(primary.auctions).containsKey(id);
        assertThat(secondary.markers).isEmpty();
    }

    @Test
    void startsActiveWhenNoMarkersAreLeft() {
        gateway.initialize();
        gateway.saveAuction(auction(UUID.randomUUID(), 1L, AuctionStatus.OPEN, null));

        PersistenceGateway restarted = restartedGateway();
        restarted.initialize();

        assertThat(restarted.getStatus()).isEqualTo(BackendStatus.ACTIVE);
        assertThat(restarted.getConnectionStatus().reconnectAttempts()).isZero();
    }

    @Test
    void markersThatCannotBeClearedAreRetriedWhileActive() {
        gateway.initialize();
        UUID id = UUID.randomUUID();
        primary.setDown(true);
        gateway.saveAuction(auction(id, 1L, AuctionStatus.OPEN, null));

        primary.setDown(false);
        secondary.setDown(true);
        assertThat(gateway.reconnect()).isTrue();
        assertThat(gateway.getStatus()).isEqualTo(BackendStatus.ACTIVE);
        assertThat(secondary.markers).hasSize(1);

        secondary.setDown(false);
        gateway.probePrimary();
        assertThat(secondary.markers).isEmpty();
    }

    @Test
    void callerStopsRetryingOnceAnotherCallerFailedOver() throws Exception {
        settings.setRetryBackoff(Duration.ofHours(1));
        UUID slow = UUID.randomUUID();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        InMemoryBackend blockingPrimary = new InMemoryBackend("primary") {
            @Override
            public void saveAuction(AuctionSnapshot auction) {
                if (auction.id().equals(slow)) {
                    entered.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                throw new StorageException("primary is down");
            }
        };
        gateway = new PersistenceGateway(blockingPrimary, secondary, settings, new MutableClock(T0));
        gateway.initialize();

        CompletableFuture<Boolean> slowWrite = CompletableFuture.supplyAsync(
                () -> gateway.saveAuction(auction(slow, 1L, AuctionStatus.OPEN, null)));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        // an interrupted caller gives up on its first backoff and fails over
        Thread.currentThread().interrupt();
        gateway.saveAuction(auction(UUID.randomUUID(), 2L, AuctionStatus.OPEN, null));
        assertThat(Thread.interrupted()).isTrue();
        assertThat(gateway.getStatus()).isEqualTo(BackendStatus.DEGRADED);

        release.countDown();
        assertThat(slowWrite.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(secondary.auctions).containsKey(slow);
    }
}
