package com.guildauction.persistence;

import com.guildauction.config.AuctionProperties;
import com.guildauction.exception.StorageException;
import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.BidEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Single entry point to storage. Calls go to the primary backend with bounded retries;
 * once the retries are exhausted the gateway turns DEGRADED and serves everything from
 * the embedded backend until a reconnect succeeds.
 * <p>
 * Every write the primary did not receive is kept in an in-memory journal and replayed,
 * in order, before the gateway returns to ACTIVE. Auction and setting writes coalesce into
 * the journal entry already queued for the same row, and the journal is capped. Each missed
 * row is also recorded as a {@link ReplayMarker} in the embedded store, so rows the journal
 * could not hold, or lost in a restart, are copied from the embedded store on reconnect.
 * Reads never throw: when no backend can answer they return an empty result and the failure
 * is logged.
 */
public class PersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(PersistenceGateway.class);

    private final PersistenceBackend primary;
    private final FallbackBackend secondary;
    private final int maxAttempts;
    private final int maxPendingReplay;
    private final Duration retryBackoff;
    private final Clock clock;

    private final AtomicReference<BackendStatus> status = new AtomicReference<>(BackendStatus.ACTIVE);
    private final AtomicLong primaryAttempts = new AtomicLong();
    private final AtomicLong primaryFailures = new AtomicLong();
    private final AtomicLong secondaryFailures = new AtomicLong();
    private final AtomicLong failovers = new AtomicLong();
    private final AtomicLong reconnectAttempts = new AtomicLong();
    private final AtomicLong replayOverflow = new AtomicLong();
    private volatile String lastError;
    private volatile Instant degradedSince;

    private final Deque<PendingWrite> journal = new ArrayDeque<>();
    private final Map<ReplayMarker, PendingWrite> coalescable = new HashMap<>();
    // rows were missed that only the markers in the embedded store know about
    private boolean resyncFromMarkers;
    // everything is replayed but the markers could not be removed yet
    private boolean staleMarkers;
    private final ReentrantLock reconnectLock = new ReentrantLock();

    public PersistenceGateway(PersistenceBackend primary,
                              FallbackBackend secondary,
                              AuctionProperties.Persistence settings,
                              Clock clock) {
        this.primary = primary;
        this.secondary = secondary;
        this.maxAttempts = Math.max(1, settings.getRetryAttempts());
        this.retryBackoff = settings.getRetryBackoff();
        this.maxPendingReplay = Math.max(1, settings.getMaxPendingReplay());
        this.clock = clock;
    }

    /**
     * Probes both backends. Starts DEGRADED when only the embedded one answers, or when the
     * embedded store still holds replay markers from an earlier run; in the latter case the
     * marked rows are replayed right away if the primary is up.
     *
     * @throws StorageException when neither backend is reachable
     */
    public void initialize() {
        boolean primaryUp = tryPrimary("startup", backend -> {
            backend.ping();
            return Boolean.TRUE;
        }).succeeded();

        boolean secondaryUp = true;
        try {
            secondary.ping();
        } catch (RuntimeException e) {
            secondaryUp = false;
            secondaryFailures.incrementAndGet();
            lastError = e.getMessage();
            log.warn("Embedded store unavailable at startup, no failover target: {}", e.getMessage());
        }

        if (!primaryUp && !secondaryUp) {
            throw new StorageException("Neither the primary nor the embedded store is reachable");
        }
        if (secondaryUp && hasLeftoverMarkers()) {
            synchronized (journal) {
                resyncFromMarkers = true;
            }
            if (status.compareAndSet(BackendStatus.ACTIVE, BackendStatus.DEGRADED)) {
                degradedSince = clock.instant();
            }
            if (primaryUp) {
                reconnect();
            }
        }
        log.info("Persistence ready: status={}, active backend={}", status.get(), activeBackend().name());
    }

    // ---- writes ----

    public boolean saveAuction(AuctionSnapshot auction) {
        return write(new PendingWrite("saveAuction " + auction.id(), ReplayMarker.auction(auction.id()), true,
                backend -> backend.saveAuction(auction)));
    }

    public boolean addBid(BidEntry bid) {
        return write(new PendingWrite("addBid " + bid.auctionId() + "#" + bid.sequenceNo(),
                ReplayMarker.bid(bid.auctionId(), bid.sequenceNo()), false, backend -> backend.addBid(bid)));
    }

    public boolean removeBid(UUID auctionId, long sequenceNo) {
        return write(new PendingWrite("removeBid " + auctionId + "#" + sequenceNo,
                ReplayMarker.bid(auctionId, sequenceNo), false, backend -> backend.removeBid(auctionId, sequenceNo)));
    }

    public boolean setSetting(long guildId, String key, String value) {
        return write(new PendingWrite("setSetting " + guildId + "/" + key, ReplayMarker.setting(guildId, key), true,
                backend -> backend.setSetting(guildId, key, value)));
    }

    // ---- reads ----

    public Optional<AuctionSnapshot> findAuction(UUID auctionId) {
        return read("findAuction", backend -> backend.findAuction(auctionId), Optional.empty());
    }

    public List<AuctionSnapshot> getActiveAuctions() {
        return read("findActiveAuctions", PersistenceBackend::findActiveAuctions, List.of());
    }

    public Optional<AuctionSnapshot> getActiveAuction(long guildId) {
        return read("findActiveAuction", backend -> backend.findActiveAuction(guildId), Optional.empty());
    }

    public List<AuctionSnapshot> getRecentAuctions(long guildId, int limit) {
        return read("findRecentAuctions", backend -> backend.findRecentAuctions(guildId, limit), List.of());
    }

    public List<BidEntry> getBids(UUID auctionId) {
        return read("findBids", backend -> backend.findBids(auctionId), List.of());
    }

    public Optional<String> getSetting(long guildId, String key) {
        return read("getSetting", backend -> backend.getSetting(guildId, key), Optional.empty());
    }

    public Map<String, String> getSettings(long guildId) {
        return read("getSettings", backend -> backend.getSettings(guildId), Map.of());
    }

    // ---- status and recovery ----

    public BackendStatus getStatus() {
        return status.get();
    }

    public ConnectionStatus getConnectionStatus() {
        int pending;
        synchronized (journal) {
            pending = journal.size();
        }
        return new ConnectionStatus(status.get(), activeBackend().name(), primaryAttempts.get(),
                primaryFailures.get(), secondaryFailures.get(), failovers.get(), reconnectAttempts.get(),
                pending, replayOverflow.get(), lastError, degradedSince);
    }

    @Scheduled(fixedDelayString = "${auction.persistence.reconnect-probe-interval:PT60S}",
            initialDelayString = "${auction.persistence.reconnect-probe-interval:PT60S}")
    public void probePrimary() {
        if (status.get() == BackendStatus.DEGRADED) {
            reconnect();
            return;
        }
        synchronized (journal) {
            if (staleMarkers && status.get() == BackendStatus.ACTIVE) {
                staleMarkers = !clearMarkers();
            }
        }
    }

    /**
     * Pings the primary and replays the journal into it, followed by the rows named by the
     * replay markers when the journal overflowed or the process restarted while degraded.
     * Returns to ACTIVE only once everything is replayed; a failed replay leaves the gateway
     * DEGRADED. Markers that cannot be cleared afterwards are retried by {@link #probePrimary()}.
     *
     * @return true when the primary is active afterwards
     */
    public boolean reconnect() {
        if (!reconnectLock.tryLock()) {
            log.debug("Reconnect already in progress");
            return false;
        }
        try {
            reconnectAttempts.incrementAndGet();
            try {
                primary.ping();
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                log.warn("Primary store still unreachable: {}", e.getMessage());
                return false;
            }

            int replayed = 0;
            int discarded = 0;
            while (true) {
                PendingWrite next;
                Consumer<PersistenceBackend> write;
                synchronized (journal) {
                    next = journal.peekFirst();
                    if (next == null) {
                        if (resyncFromMarkers) {
                            if (!queueMarkedRows()) {
                                return false;
                            }
                            continue;
                        }
                        staleMarkers = !clearMarkers();
                        status.set(BackendStatus.ACTIVE);
                        degradedSince = null;
                        break;
                    }
                    write = next.write;
                }
                try {
                    write.accept(primary);
                    replayed++;
                } catch (RuntimeException e) {
                    if (!primaryAnswers()) {
                        lastError = e.getMessage();
                        log.warn("Replay stopped at '{}', primary went away again: {}", next.operation, e.getMessage());
                        return false;
                    }
                    // primary is up but rejects this write, e.g. it had already been committed
                    discarded++;
                    log.error("Primary rejected replayed write '{}', dropping it: {}", next.operation, e.getMessage());
                }
                synchronized (journal) {
                    // a coalesced write may have replaced the payload while it was being replayed
                    if (next.write == write) {
                        journal.pollFirst();
                        if (next.coalesce) {
                            coalescable.remove(next.marker);
                        }
                    }
                }
            }
            log.info("Primary store reconnected: replayed {} writes, dropped {}", replayed, discarded);
            return true;
        } finally {
            reconnectLock.unlock();
        }
    }

    // ---- internals ----

    private boolean write(PendingWrite pending) {
        Function<PersistenceBackend, Boolean> call = backend -> {
            pending.write.accept(backend);
            return Boolean.TRUE;
        };
        if (status.get() == BackendStatus.ACTIVE && tryPrimary(pending.operation, call).succeeded()) {
            return true;
        }

        boolean stored;
        try {
            pending.write.accept(secondary);
            stored = true;
        } catch (RuntimeException e) {
            stored = false;
            secondaryFailures.incrementAndGet();
            lastError = e.getMessage();
            log.error("Write '{}' failed on both stores, kept for replay: {}", pending.operation, e.getMessage());
        }
        journal(pending, call);
        return stored;
    }

    private void journal(PendingWrite pending, Function<PersistenceBackend, Boolean> call) {
        synchronized (journal) {
            if (status.get() == BackendStatus.DEGRADED) {
                enqueue(pending);
                return;
            }
        }
        // a reconnect finished while this write was in flight
        if (!tryPrimary(pending.operation, call).succeeded()) {
            synchronized (journal) {
                enqueue(pending);
            }
        }
    }

    /** Caller holds the journal lock. */
    private void enqueue(PendingWrite pending) {
        if (pending.coalesce) {
            PendingWrite queued = coalescable.get(pending.marker);
            if (queued != null) {
                // keeps its position so the auction row still precedes its bids
                queued.write = pending.write;
                return;
            }
        }
        try {
            secondary.addReplayMarker(pending.marker);
        } catch (RuntimeException e) {
            secondaryFailures.incrementAndGet();
            lastError = e.getMessage();
            log.error("Could not record replay marker {}, '{}' survives only in memory: {}",
                    pending.marker, pending.operation, e.getMessage());
        }
        if (journal.size() >= maxPendingReplay) {
            resyncFromMarkers = true;
            if (replayOverflow.incrementAndGet() % 1_000 == 1) {
                log.warn("Replay journal full at {} writes, '{}' will be copied from {} on reconnect",
                        maxPendingReplay, pending.operation, secondary.name());
            }
            return;
        }
        journal.addLast(pending);
        if (pending.coalesce) {
            coalescable.put(pending.marker, pending);
        }
    }

    /**
     * Turns the markers in the embedded store into journal entries that copy each marked row
     * from the embedded store into the primary. Caller holds the journal lock.
     */
    private boolean queueMarkedRows() {
        List<ReplayMarker> markers;
        try {
            markers = secondary.findReplayMarkers();
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            log.warn("Could not read replay markers from {}: {}", secondary.name(), e.getMessage());
            return false;
        }
        markers.stream()
                .sorted(Comparator.comparing(ReplayMarker::kind))
                .forEach(marker -> journal.addLast(new PendingWrite("resync " + marker, marker, false,
                        target -> copyRow(marker, target))));
        resyncFromMarkers = false;
        log.info("Copying {} marked rows from {} to the primary store", markers.size(), secondary.name());
        return true;
    }

    private void copyRow(ReplayMarker marker, PersistenceBackend target) {
        switch (marker.kind()) {
            case AUCTION -> secondary.findAuction(marker.auctionId()).ifPresent(target::saveAuction);
            case BID -> {
                target.removeBid(marker.auctionId(), marker.sequenceNo());
                secondary.findBids(marker.auctionId()).stream()
                        .filter(bid -> bid.sequenceNo() == marker.sequenceNo())
                        .findFirst()
                        .ifPresent(target::addBid);
            }
            case SETTING -> secondary.getSetting(marker.guildId(), marker.settingKey())
                    .ifPresent(value -> target.setSetting(marker.guildId(), marker.settingKey(), value));
        }
    }

    /** Caller holds the journal lock. */
    private boolean clearMarkers() {
        try {
            secondary.clearReplayMarkers();
            return true;
        } catch (RuntimeException e) {
            secondaryFailures.incrementAndGet();
            lastError = e.getMessage();
            log.error("Replay markers in {} could not be cleared, retrying on the next probe: {}",
                    secondary.name(), e.getMessage());
            return false;
        }
    }

    private boolean hasLeftoverMarkers() {
        try {
            return !secondary.findReplayMarkers().isEmpty();
        } catch (RuntimeException e) {
            secondaryFailures.incrementAndGet();
            lastError = e.getMessage();
            log.warn("Could not read replay markers at startup: {}", e.getMessage());
            return false;
        }
    }

    private <T> T read(String operation, Function<PersistenceBackend, T> call, T fallback) {
        if (status.get() == BackendStatus.ACTIVE) {
            Attempt<T> attempt = tryPrimary(operation, call);
            if (attempt.succeeded()) {
                return attempt.value();
            }
        }
        try {
            return call.apply(secondary);
        } catch (RuntimeException e) {
            secondaryFailures.incrementAndGet();
            lastError = e.getMessage();
            log.error("Read '{}' failed on both stores: {}", operation, e.getMessage());
            return fallback;
        }
    }

    private <T> Attempt<T> tryPrimary(String operation, Function<PersistenceBackend, T> call) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            primaryAttempts.incrementAndGet();
            try {
                return new Attempt<>(true, call.apply(primary));
            } catch (RuntimeException e) {
                last = e;
                primaryFailures.incrementAndGet();
                if (attempt < maxAttempts) {
                    if (status.get() == BackendStatus.DEGRADED) {
                        // another caller already failed over
                        break;
                    }
                    Duration wait = retryBackoff.multipliedBy(1L << (attempt - 1));
                    log.warn("Primary store failed on '{}' (attempt {}/{}), retrying in {}ms: {}",
                            operation, attempt, maxAttempts, wait.toMillis(), e.getMessage());
                    if (!pause(wait)) {
                        break;
                    }
                }
            }
        }
        markDegraded(operation, last);
        return new Attempt<>(false, null);
    }

    private void markDegraded(String operation, RuntimeException cause) {
        lastError = cause != null ? cause.getMessage() : "interrupted";
        if (status.compareAndSet(BackendStatus.ACTIVE, BackendStatus.DEGRADED)) {
            failovers.incrementAndGet();
            degradedSince = clock.instant();
            log.error("Primary store unavailable after {} attempts on '{}', switching to {}: {}",
                    maxAttempts, operation, secondary.name(), lastError);
        }
    }

    private boolean primaryAnswers() {
        try {
            primary.ping();
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }

    private PersistenceBackend activeBackend() {
        return status.get() == BackendStatus.ACTIVE ? primary : secondary;
    }

    private static boolean pause(Duration wait) {
        if (wait.isZero() || wait.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(wait.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class PendingWrite {
        private final String operation;
        private final ReplayMarker marker;
        private final boolean coalesce;
        private Consumer<PersistenceBackend> write;

        private PendingWrite(String operation, ReplayMarker marker, boolean coalesce,
                             Consumer<PersistenceBackend> write) {
            this.operation = operation;
            this.marker = marker;
            this.coalesce = coalesce;
            this.write = write;
        }
    }

    private record Attempt<T>(boolean succeeded, T value) {
    }
}
