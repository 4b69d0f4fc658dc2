package com.guildauction.service;

import com.guildauction.config.AuctionProperties;
import com.guildauction.exception.TransportException;
import com.guildauction.exception.TransportPermissionException;
import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.AuctionStatus;
import com.guildauction.model.BidEntry;
import com.guildauction.transport.DisplayPayload;
import com.guildauction.transport.MessageRef;
import com.guildauction.transport.MessagingTransport;
import com.guildauction.util.AmountFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Keeps each auction's panel message in sync with its latest snapshot.
 * <p>
 * At most one render per {@code auction.panel-update-delay} window per panel; requests that
 * arrive inside a window replace the pending snapshot, so only the newest state is drawn.
 * Transport work runs on the side-effect executor, never on the caller's thread.
 */
@Service
public class PanelRenderService {

    private static final Logger log = LoggerFactory.getLogger(PanelRenderService.class);

    static final int MAX_RENDER_ATTEMPTS = 3;
    private static final Duration CLOSED_RETENTION = Duration.ofMinutes(10);

    private final MessagingTransport transport;
    private final TaskScheduler scheduler;
    private final Executor executor;
    private final AuctionProperties properties;
    private final Clock clock;

    private final Map<UUID, PanelState> panels = new ConcurrentHashMap<>();
    private final Set<UUID> closedPanels = ConcurrentHashMap.newKeySet();

    public PanelRenderService(MessagingTransport transport,
                              @Qualifier("auctionTaskScheduler") TaskScheduler scheduler,
                              @Qualifier("auctionSideEffectExecutor") Executor executor,
                              AuctionProperties properties,
                              Clock clock) {
        this.transport = transport;
        this.scheduler = scheduler;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    public record PanelStatus(UUID auctionId, MessageRef ref, boolean degraded, Instant lastRenderAt) {
    }

    /**
     * Registers a panel before its first render.
     *
     * @param existing panel message restored from storage, or null
     * @param onMoved  called whenever the panel is (re)sent as a new message
     */
    public void attach(UUID auctionId, long channelId, MessageRef existing, Consumer<MessageRef> onMoved) {
        PanelState state = panels.computeIfAbsent(auctionId, id -> new PanelState(id, channelId));
        synchronized (state) {
            if (existing != null && state.ref == null) {
                state.ref = existing;
            }
            state.onMoved = onMoved;
        }
    }

    /**
     * Queues a render of the given snapshot.
     *
     * @return false when the panel is already closed
     */
    public boolean requestRender(AuctionSnapshot snapshot) {
        if (closedPanels.contains(snapshot.id()) || snapshot.status() == AuctionStatus.ENDED) {
            return false;
        }
        PanelState state = panels.computeIfAbsent(snapshot.id(), id -> new PanelState(id, snapshot.channelId()));
        synchronized (state) {
            if (state.closed) {
                return false;
            }
            if (state.pending == null || snapshot.revision() >= state.pending.revision()) {
                state.pending = snapshot;
            }
            scheduleFlush(state);
        }
        return true;
    }

    /**
     * Closes the panel: pending renders are dropped, the message is edited to the final
     * summary and then deleted. Later render requests are rejected.
     */
    public void finalizePanel(AuctionSnapshot finalSnapshot) {
        UUID auctionId = finalSnapshot.id();
        closedPanels.add(auctionId);
        scheduler.schedule(() -> closedPanels.remove(auctionId), clock.instant().plus(CLOSED_RETENTION));

        PanelState state = panels.computeIfAbsent(auctionId, id -> new PanelState(id, finalSnapshot.channelId()));
        synchronized (state) {
            state.closed = true;
            state.pending = null;
        }
        state.renderLock.lock();
        try {
            MessageRef ref = state.ref != null ? state.ref : finalSnapshot.panelRef();
            if (ref == null) {
                return;
            }
            try {
                transport.edit(ref, buildSummary(finalSnapshot));
            } catch (TransportException e) {
                log.warn("Could not switch panel of auction {} to its summary: {}", auctionId, e.getMessage());
            }
            try {
                transport.delete(ref);
            } catch (TransportException e) {
                log.warn("Could not delete panel of auction {}: {}", auctionId, e.getMessage());
            }
        } finally {
            state.renderLock.unlock();
            panels.remove(auctionId, state);
        }
    }

    public Optional<PanelStatus> status(UUID auctionId) {
        PanelState state = panels.get(auctionId);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return Optional.of(new PanelStatus(auctionId, state.ref, state.degraded, state.lastRenderAt));
        }
    }

    // ---- payloads ----

    public DisplayPayload buildPanel(AuctionSnapshot s) {
        Instant now = clock.instant();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("auctionId", s.id().toString());
        fields.put("status", s.status().name());
        fields.put("currency", s.currencyName());
        fields.put("startBid", s.startBid());
        fields.put("minIncrement", s.minIncrement());
        fields.put("currentBid", s.currentBid());
        fields.put("currentBidderId", s.currentBidderId());
        fields.put("leadingAmount", AmountFormat.format(s.leadingAmount()));
        fields.put("minimumNextBid", s.minimumNextBid());
        fields.put("bidCount", s.bidCount());
        fields.put("endsAt", s.endsAt() != null ? s.endsAt().toString() : null);
        fields.put("timeLeftSeconds", s.timeLeft(now).toSeconds());
        fields.put("countdownDeadline", s.countdownDeadline() != null ? s.countdownDeadline().toString() : null);
        fields.put("revision", s.revision());
        fields.put("quickIncrements", BidService.QUICK_INCREMENTS);
        fields.put("recentBids", recentBids(s));
        return new DisplayPayload(DisplayPayload.AUCTION_PANEL, fields);
    }

    public DisplayPayload buildSummary(AuctionSnapshot s) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("auctionId", s.id().toString());
        fields.put("currency", s.currencyName());
        fields.put("finalPrice", s.currentBid());
        fields.put("finalPriceDisplay", s.hasBids() ? AmountFormat.format(s.currentBid()) : null);
        fields.put("winnerId", s.currentBidderId());
        fields.put("bidCount", s.bidCount());
        fields.put("endedAt", s.endedAt() != null ? s.endedAt().toString() : null);
        return new DisplayPayload(DisplayPayload.AUCTION_SUMMARY, fields);
    }

    private List<Map<String, Object>> recentBids(AuctionSnapshot s) {
        List<BidEntry> bids = s.bids();
        int from = Math.max(0, bids.size() - properties.getMaxBidHistoryDisplay());
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = bids.size() - 1; i >= from; i--) {
            BidEntry bid = bids.get(i);
            long previous = i > 0 ? bids.get(i - 1).amount() : s.startBid();
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("sequenceNo", bid.sequenceNo());
            row.put("bidderId", bid.bidderId());
            row.put("amount", bid.amount());
            row.put("amountDisplay", AmountFormat.format(bid.amount()));
            row.put("delta", AmountFormat.formatDelta(bid.amount() - previous));
            rows.add(row);
        }
        return rows;
    }

    // ---- scheduling ----

    private void scheduleFlush(PanelState state) {
        if (state.flushScheduled) {
            return;
        }
        state.flushScheduled = true;
        Instant now = clock.instant();
        Instant due = state.lastRenderAt == null ? now : state.lastRenderAt.plus(properties.getPanelUpdateDelay());
        if (!due.isAfter(now)) {
            executor.execute(() -> flush(state));
        } else {
            scheduler.schedule(() -> executor.execute(() -> flush(state)), due);
        }
    }

    private void flush(PanelState state) {
        AuctionSnapshot snapshot;
        synchronized (state) {
            snapshot = state.pending;
            state.pending = null;
            state.flushScheduled = false;
            if (state.closed || snapshot == null) {
                return;
            }
            state.lastRenderAt = clock.instant();
        }
        state.renderLock.lock();
        try {
            if (!state.closed) {
                render(state, snapshot);
            }
        } finally {
            state.renderLock.unlock();
        }
    }

    private void render(PanelState state, AuctionSnapshot snapshot) {
        DisplayPayload payload = buildPanel(snapshot);
        try {
            MessageRef current = state.ref;
            if (current != null) {
                try {
                    transport.edit(current, payload);
                    markRendered(state);
                    return;
                } catch (TransportPermissionException e) {
                    throw e;
                } catch (TransportException e) {
                    log.debug("Edit of panel {} failed, sending a new one: {}", current.messageId(), e.getMessage());
                }
            }
            MessageRef sent = transport.send(state.channelId, payload);
            Consumer<MessageRef> onMoved;
            synchronized (state) {
                state.ref = sent;
                onMoved = state.onMoved;
            }
            markRendered(state);
            if (current != null) {
                deleteQuietly(current);
            }
            if (onMoved != null) {
                onMoved.accept(sent);
            }
        } catch (TransportPermissionException e) {
            synchronized (state) {
                state.degraded = true;
            }
            log.warn("Panel of auction {} is degraded, channel {} refused the update: {}",
                    state.auctionId, state.channelId, e.getMessage());
        } catch (TransportException e) {
            retryLater(state, snapshot, e);
        }
    }

    private void retryLater(PanelState state, AuctionSnapshot snapshot, TransportException cause) {
        synchronized (state) {
            state.failedAttempts++;
            if (state.failedAttempts >= MAX_RENDER_ATTEMPTS) {
                log.error("Giving up on panel render for auction {} after {} attempts: {}",
                        state.auctionId, state.failedAttempts, cause.getMessage());
                state.failedAttempts = 0;
                return;
            }
            log.warn("Panel render for auction {} failed (attempt {}/{}), retrying: {}",
                    state.auctionId, state.failedAttempts, MAX_RENDER_ATTEMPTS, cause.getMessage());
            if (state.pending == null) {
                state.pending = snapshot;
            }
            scheduleFlush(state);
        }
    }

    private void markRendered(PanelState state) {
        synchronized (state) {
            state.failedAttempts = 0;
            state.degraded = false;
        }
    }

    private void deleteQuietly(MessageRef ref) {
        try {
            transport.delete(ref);
        } catch (TransportException e) {
            log.debug("Could not delete stale panel {}: {}", ref.messageId(), e.getMessage());
        }
    }

    private static final class PanelState {
        private final UUID auctionId;
        private final long channelId;
        private final ReentrantLock renderLock = new ReentrantLock();

        private volatile MessageRef ref;
        private AuctionSnapshot pending;
        private boolean flushScheduled;
        private Instant lastRenderAt;
        private volatile boolean closed;
        private boolean degraded;
        private int failedAttempts;
        private Consumer<MessageRef> onMoved;

        private PanelState(UUID auctionId, long channelId) {
            this.auctionId = auctionId;
            this.channelId = channelId;
        }
    }
}
