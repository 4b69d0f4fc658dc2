package com.guildauction.service;

import com.guildauction.config.AuctionProperties;
import com.guildauction.dto.BidReceipt;
import com.guildauction.dto.OpenAuctionCommand;
import com.guildauction.dto.PlaceBidRequest;
import com.guildauction.dto.UndoReceipt;
import com.guildauction.exception.AuctionConflictException;
import com.guildauction.exception.AuctionStateException;
import com.guildauction.exception.BidValidationException;
import com.guildauction.exception.ConcurrencyConflictException;
import com.guildauction.exception.TransportException;
import com.guildauction.exception.ValidationException;
import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.AuctionStatus;
import com.guildauction.model.BidEntry;
import com.guildauction.model.GuildConfig;
import com.guildauction.model.LiveAuction;
import com.guildauction.persistence.PersistenceGateway;
import com.guildauction.transport.DisplayPayload;
import com.guildauction.transport.MessageRef;
import com.guildauction.transport.MessagingTransport;
import com.guildauction.util.AmountFormat;
import com.guildauction.util.SerialTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Auction lifecycle: open, bid, undo, end and finalize.
 * <p>
 * State decisions happen under the auction's own lock; storage writes, panel renders and
 * announcements are issued afterwards from snapshots. Storage writes of one auction go
 * through its serial queue so they land in the order they were committed in memory.
 */
@Service
public class AuctionService {

    private static final Logger log = LoggerFactory.getLogger(AuctionService.class);

    private final AuctionRegistry registry;
    private final BidService bidService;
    private final PersistenceGateway persistence;
    private final PanelRenderService panelRenderService;
    private final AuctionMonitorService monitorService;
    private final AuctionLogService logService;
    private final ConfigProvider configProvider;
    private final MessagingTransport transport;
    private final AuctionProperties properties;
    private final Clock clock;
    private final Executor sideEffectExecutor;
    private final Executor storageExecutor;

    public AuctionService(AuctionRegistry registry,
                          BidService bidService,
                          PersistenceGateway persistence,
                          PanelRenderService panelRenderService,
                          @Lazy AuctionMonitorService monitorService,
                          AuctionLogService logService,
                          ConfigProvider configProvider,
                          MessagingTransport transport,
                          AuctionProperties properties,
                          Clock clock,
                          @Qualifier("auctionSideEffectExecutor") Executor sideEffectExecutor,
                          @Qualifier("auctionStorageExecutor") Executor storageExecutor) {
        this.registry = registry;
        this.bidService = bidService;
        this.persistence = persistence;
        this.panelRenderService = panelRenderService;
        this.monitorService = monitorService;
        this.logService = logService;
        this.configProvider = configProvider;
        this.transport = transport;
        this.properties = properties;
        this.clock = clock;
        this.sideEffectExecutor = sideEffectExecutor;
        this.storageExecutor = storageExecutor;
    }

    /**
     * Opens a new auction for the guild.
     *
     * @throws ValidationException       bad start bid, increment or duration
     * @throws AuctionConflictException the guild already runs an auction
     */
    public AuctionSnapshot open(OpenAuctionCommand command) {
        if (command.startBid() <= 0) {
            throw new ValidationException("Starting bid must be greater than zero");
        }
        if (command.startBid() > properties.getMaxBidAmount()) {
            throw new ValidationException("Starting bid cannot exceed " + AmountFormat.format(properties.getMaxBidAmount()));
        }
        if (command.minIncrement() <= 0) {
            throw new ValidationException("Minimum increment must be greater than zero");
        }
        if (command.durationMinutes() < properties.getMinDurationMinutes()
                || command.durationMinutes() > properties.getMaxDurationMinutes()) {
            throw new ValidationException("Duration must be between " + properties.getMinDurationMinutes()
                    + " and " + properties.getMaxDurationMinutes() + " minutes");
        }
        registry.find(command.guildId()).ifPresent(existing -> {
            throw new AuctionConflictException(command.guildId());
        });

        GuildConfig config = configProvider.getConfig(command.guildId());
        Instant now = clock.instant();
        LiveAuction auction = LiveAuction.open(command.guildId(), command.channelId(), command.startedBy(),
                command.startBid(), command.minIncrement(), config.commissionPct(), config.currencyName(),
                now, now.plus(Duration.ofMinutes(command.durationMinutes())), newWriteQueue(command.guildId()));
        registry.register(auction);

        AuctionSnapshot snapshot = auction.snapshot();
        auction.getWriteQueue().submit("save opened auction", () -> persistence.saveAuction(snapshot));
        panelRenderService.attach(snapshot.id(), snapshot.channelId(), null, ref -> onPanelMoved(auction, ref));
        panelRenderService.requestRender(snapshot);
        monitorService.start(auction);
        sideEffectExecutor.execute(() -> logService.auctionStarted(snapshot, config));

        log.info("Auction {} opened in guild {} by {}: start {} increment {} for {} min",
                snapshot.id(), snapshot.guildId(), snapshot.startedBy(), snapshot.startBid(),
                snapshot.minIncrement(), command.durationMinutes());
        return snapshot;
    }

    /**
     * Places a bid on the guild's live auction. Nothing changes when the bid is rejected.
     *
     * @throws AuctionStateException        no live auction, or it ended
     * @throws ValidationException          unparseable or too low
     * @throws ConcurrencyConflictException outbid while deciding
     */
    public BidReceipt placeBid(long guildId, long bidderId, PlaceBidRequest request) {
        LiveAuction auction = registry.require(guildId);
        long amount;
        Long observedRevision;
        if (request.getIncrement() != null) {
            AuctionSnapshot observed = auction.snapshot();
            amount = resolveIncrement(request.getIncrement(), observed);
            observedRevision = request.getExpectedRevision() != null
                    ? request.getExpectedRevision()
                    : Long.valueOf(observed.revision());
        } else {
            amount = bidService.parseAmount(request.getAmount());
            observedRevision = request.getExpectedRevision();
        }
        Instant now = clock.instant();

        BidReceipt receipt = auction.locked(() -> {
            if (auction.getStatus() == AuctionStatus.ENDED) {
                throw new AuctionStateException("This auction has already ended");
            }
            long previous = auction.getCurrentBid() != null ? auction.getCurrentBid() : auction.getStartBid();
            BidEntry entry = bidService.accept(auction, bidderId, amount, observedRevision, now);
            auction.markActivity(now);
            if (auction.getStatus() == AuctionStatus.COUNTDOWN) {
                auction.reopen();
            }
            return new BidReceipt(entry, auction.snapshotHeld(), bidService.compareAmounts(amount, previous));
        });

        AuctionSnapshot snapshot = receipt.auction();
        auction.getWriteQueue().submit("insert bid #" + receipt.bid().sequenceNo(),
                () -> persistence.addBid(receipt.bid()));
        auction.getWriteQueue().submit("save auction after bid", () -> persistence.saveAuction(snapshot));
        panelRenderService.requestRender(snapshot);
        monitorService.start(auction);

        log.info("Bid #{} of {} by {} accepted on auction {} ({})", receipt.bid().sequenceNo(), amount, bidderId,
                snapshot.id(), receipt.delta());
        return receipt;
    }

    /**
     * Removes the most recent bid and restores the previous leader.
     *
     * @throws AuctionStateException no live auction or no bids
     */
    public UndoReceipt undoLast(long guildId) {
        LiveAuction auction = registry.require(guildId);
        UndoReceipt receipt = auction.locked(() -> {
            if (auction.getStatus() == AuctionStatus.ENDED) {
                throw new AuctionStateException("This auction has already ended");
            }
            if (!auction.hasBids()) {
                throw new AuctionStateException("There are no bids to undo");
            }
            BidEntry removed = auction.removeLatestBid();
            return new UndoReceipt(removed, auction.snapshotHeld());
        });

        AuctionSnapshot snapshot = receipt.auction();
        BidEntry removed = receipt.removed();
        auction.getWriteQueue().submit("remove bid #" + removed.sequenceNo(),
                () -> persistence.removeBid(removed.auctionId(), removed.sequenceNo()));
        auction.getWriteQueue().submit("save auction after undo", () -> persistence.saveAuction(snapshot));
        panelRenderService.requestRender(snapshot);

        log.info("Undid bid #{} ({} by {}) on auction {}", removed.sequenceNo(), removed.amount(),
                removed.bidderId(), snapshot.id());
        return receipt;
    }

    /**
     * Ends the guild's auction now, whatever its state.
     *
     * @throws AuctionStateException when there is nothing to end
     */
    public AuctionSnapshot end(long guildId) {
        LiveAuction auction = registry.find(guildId)
                .orElseThrow(() -> new AuctionStateException("There is no active auction to end"));
        return finalizeAuction(auction)
                .orElseThrow(() -> new AuctionStateException("There is no active auction to end"));
    }

    /**
     * Ends the auction if it is still running. Safe to call repeatedly and from several threads;
     * only the first call has any effect.
     *
     * @return the final snapshot, or empty if the auction had already ended
     */
    public Optional<AuctionSnapshot> finalizeAuction(LiveAuction auction) {
        AuctionSnapshot closed = auction.locked(() -> closeHeld(auction, clock.instant()));
        if (closed == null) {
            return Optional.empty();
        }
        publishFinal(auction, closed);
        return Optional.of(closed);
    }

    /**
     * State half of finalization. Lock must be held.
     *
     * @return the final snapshot, or null when already ended
     */
    AuctionSnapshot closeHeld(LiveAuction auction, Instant now) {
        if (auction.getStatus() == AuctionStatus.ENDED) {
            return null;
        }
        auction.end(now);
        registry.deregister(auction);
        monitorService.stop(auction.getId());
        return auction.snapshotHeld();
    }

    /**
     * Side-effect half of finalization: persist, close the panel, announce the winner and
     * write the log entry.
     */
    void publishFinal(LiveAuction auction, AuctionSnapshot finalSnapshot) {
        auction.getWriteQueue().submit("save final state", () -> persistence.saveAuction(finalSnapshot));
        sideEffectExecutor.execute(() -> {
            panelRenderService.finalizePanel(finalSnapshot);
            announceWinner(finalSnapshot);
            logService.auctionEnded(finalSnapshot, configProvider.getConfig(finalSnapshot.guildId()));
        });
        if (finalSnapshot.hasBids()) {
            log.info("Auction {} in guild {} ended: {} won with {}", finalSnapshot.id(), finalSnapshot.guildId(),
                    finalSnapshot.currentBidderId(), finalSnapshot.currentBid());
        } else {
            log.info("Auction {} in guild {} ended without bids", finalSnapshot.id(), finalSnapshot.guildId());
        }
    }

    /**
     * Brings a persisted, unfinished auction back to life after a restart.
     */
    public LiveAuction restore(AuctionSnapshot stored, List<BidEntry> bids) {
        LiveAuction auction = LiveAuction.restore(stored, bids, newWriteQueue(stored.guildId()));
        registry.register(auction);
        AuctionSnapshot snapshot = auction.snapshot();
        panelRenderService.attach(snapshot.id(), snapshot.channelId(), snapshot.panelRef(),
                ref -> onPanelMoved(auction, ref));
        panelRenderService.requestRender(snapshot);
        monitorService.start(auction);
        return auction;
    }

    public Optional<AuctionSnapshot> getLiveSnapshot(long guildId) {
        return registry.find(guildId).map(LiveAuction::snapshot);
    }

    private static long resolveIncrement(long increment, AuctionSnapshot observed) {
        if (!BidService.QUICK_INCREMENTS.contains(increment)) {
            throw new BidValidationException("Unsupported quick increment " + increment);
        }
        return observed.leadingAmount() + increment;
    }

    private void onPanelMoved(LiveAuction auction, MessageRef ref) {
        AuctionSnapshot snapshot = auction.locked(() -> {
            auction.setPanelRef(ref);
            return auction.snapshotHeld();
        });
        auction.getWriteQueue().submit("save panel reference", () -> persistence.saveAuction(snapshot));
    }

    private void announceWinner(AuctionSnapshot s) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("auctionId", s.id().toString());
        fields.put("winnerId", s.currentBidderId());
        fields.put("finalPrice", s.currentBid());
        fields.put("finalPriceDisplay", s.hasBids() ? AmountFormat.format(s.currentBid()) : null);
        fields.put("currency", s.currencyName());
        fields.put("bidCount", s.bidCount());
        try {
            transport.send(s.channelId(), new DisplayPayload(DisplayPayload.WINNER_ANNOUNCEMENT, fields));
        } catch (TransportException e) {
            log.warn("Could not announce the result of auction {}: {}", s.id(), e.getMessage());
        }
    }

    private SerialTaskQueue newWriteQueue(long guildId) {
        return new SerialTaskQueue("auction-writes-" + guildId, storageExecutor);
    }
}
