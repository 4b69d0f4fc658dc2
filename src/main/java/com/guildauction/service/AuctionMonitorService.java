package com.guildauction.service;

import com.guildauction.config.AuctionProperties;
import com.guildauction.exception.TransportException;
import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.AuctionStatus;
import com.guildauction.model.LiveAuction;
import com.guildauction.transport.DisplayPayload;
import com.guildauction.transport.MessagingTransport;
import com.guildauction.util.AmountFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Lazy;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * One periodic check per live auction:
 * - OPEN and idle for the inactivity threshold: start the countdown and post a promo
 * - COUNTDOWN past its deadline: finalize
 * A bid in between moves the auction back to OPEN, so the next tick sees nothing to do.
 */
@Service
public class AuctionMonitorService {

    private static final Logger log = LoggerFactory.getLogger(AuctionMonitorService.class);

    public enum Outcome {
        NONE,
        COUNTDOWN_STARTED,
        FINALIZED
    }

    private final AuctionService auctionService;
    private final TaskScheduler scheduler;
    private final Executor sideEffectExecutor;
    private final MessagingTransport transport;
    private final PanelRenderService panelRenderService;
    private final PromoMessageSelector promoSelector;
    private final AuctionProperties properties;
    private final Clock clock;

    private final Map<UUID, ScheduledFuture<?>> monitors = new ConcurrentHashMap<>();

    public AuctionMonitorService(@Lazy AuctionService auctionService,
                                 @Qualifier("auctionTaskScheduler") TaskScheduler scheduler,
                                 @Qualifier("auctionSideEffectExecutor") Executor sideEffectExecutor,
                                 MessagingTransport transport,
                                 PanelRenderService panelRenderService,
                                 PromoMessageSelector promoSelector,
                                 AuctionProperties properties,
                                 Clock clock) {
        this.auctionService = auctionService;
        this.scheduler = scheduler;
        this.sideEffectExecutor = sideEffectExecutor;
        this.transport = transport;
        this.panelRenderService = panelRenderService;
        this.promoSelector = promoSelector;
        this.properties = properties;
        this.clock = clock;
    }

    /** Starts monitoring unless a monitor for this auction already runs. */
    public void start(LiveAuction auction) {
        monitors.computeIfAbsent(auction.getId(), id -> {
            log.debug("Starting monitor for auction {}", id);
            return scheduler.scheduleAtFixedRate(() -> tick(auction), properties.getMonitorTick());
        });
    }

    public void stop(UUID auctionId) {
        ScheduledFuture<?> future = monitors.remove(auctionId);
        if (future != null) {
            future.cancel(false);
            log.debug("Stopped monitor for auction {}", auctionId);
        }
    }

    public boolean isRunning(UUID auctionId) {
        return monitors.containsKey(auctionId);
    }

    public int runningCount() {
        return monitors.size();
    }

    private void tick(LiveAuction auction) {
        try {
            evaluate(auction);
            if (auction.locked(auction::getStatus) == AuctionStatus.ENDED) {
                // ended by a command while this monitor was being (re)started
                stop(auction.getId());
            }
        } catch (RuntimeException e) {
            log.error("Monitor tick failed for auction {}: {}", auction.getId(), e.getMessage(), e);
        }
    }

    /**
     * Runs one check against the auction's current state.
     */
    public Outcome evaluate(LiveAuction auction) {
        Instant now = clock.instant();
        Decision decision = auction.locked(() -> {
            AuctionStatus status = auction.getStatus();
            if (status == AuctionStatus.OPEN) {
                Duration idle = Duration.between(auction.getLastActivityAt(), now);
                if (idle.compareTo(properties.getInactivityThreshold()) < 0) {
                    return Decision.NOTHING;
                }
                auction.startCountdown(now.plus(properties.getCountdown()));
                return new Decision(Outcome.COUNTDOWN_STARTED, auction.snapshotHeld());
            }
            if (status == AuctionStatus.COUNTDOWN && !now.isBefore(auction.getCountdownDeadline())) {
                AuctionSnapshot closed = auctionService.closeHeld(auction, now);
                return closed != null ? new Decision(Outcome.FINALIZED, closed) : Decision.NOTHING;
            }
            return Decision.NOTHING;
        });

        if (decision.outcome() == Outcome.COUNTDOWN_STARTED) {
            log.info("Auction {} idle for {}s, countdown started", auction.getId(),
                    properties.getInactivityThreshold().toSeconds());
            panelRenderService.requestRender(decision.snapshot());
            sendPromo(decision.snapshot());
        } else if (decision.outcome() == Outcome.FINALIZED) {
            auctionService.publishFinal(auction, decision.snapshot());
        }
        return decision.outcome();
    }

    private void sendPromo(AuctionSnapshot snapshot) {
        if (!promoSelector.isEnabled()) {
            return;
        }
        String mention = snapshot.currentBidderId() != null ? "@" + snapshot.currentBidderId() : "nobody yet";
        String text = promoSelector.next(mention, AmountFormat.format(snapshot.leadingAmount()));
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("auctionId", snapshot.id().toString());
        fields.put("text", text);
        fields.put("leaderId", snapshot.currentBidderId());
        fields.put("amount", snapshot.leadingAmount());
        fields.put("countdownDeadline", snapshot.countdownDeadline() != null ? snapshot.countdownDeadline().toString() : null);
        sideEffectExecutor.execute(() -> {
            try {
                transport.send(snapshot.channelId(), new DisplayPayload(DisplayPayload.PROMO, fields));
            } catch (TransportException e) {
                log.warn("Promo for auction {} not sent: {}", snapshot.id(), e.getMessage());
            }
        });
    }

    private record Decision(Outcome outcome, AuctionSnapshot snapshot) {
        static final Decision NOTHING = new Decision(Outcome.NONE, null);
    }
}
