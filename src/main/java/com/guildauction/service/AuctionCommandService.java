package com.guildauction.service;

import com.guildauction.config.AuctionProperties;
import com.guildauction.dto.BidReceipt;
import com.guildauction.dto.CommandResult;
import com.guildauction.dto.OpenAuctionCommand;
import com.guildauction.dto.OpenAuctionRequest;
import com.guildauction.dto.PlaceBidRequest;
import com.guildauction.dto.UndoReceipt;
import com.guildauction.exception.AuctionException;
import com.guildauction.exception.ConcurrencyConflictException;
import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.GuildConfig;
import com.guildauction.model.LiveAuction;
import com.guildauction.persistence.ConnectionStatus;
import com.guildauction.persistence.PersistenceGateway;
import com.guildauction.service.AuctionChecks.Caller;
import com.guildauction.service.AuctionChecks.Check;
import com.guildauction.util.AmountFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Command entry points used by the platform adapter. Runs the permission checks, calls the
 * engine and turns every outcome, including failures, into a {@link CommandResult}.
 */
@Service
public class AuctionCommandService {

    private static final Logger log = LoggerFactory.getLogger(AuctionCommandService.class);

    public static final String FORBIDDEN = "FORBIDDEN";
    public static final String NO_AUCTION = "NO_AUCTION";

    private final AuctionService auctionService;
    private final BidService bidService;
    private final ConfigProvider configProvider;
    private final AuctionRegistry registry;
    private final AuctionMonitorService monitorService;
    private final PanelRenderService panelRenderService;
    private final PersistenceGateway persistence;
    private final AuctionProperties properties;

    public AuctionCommandService(AuctionService auctionService,
                                 BidService bidService,
                                 ConfigProvider configProvider,
                                 AuctionRegistry registry,
                                 AuctionMonitorService monitorService,
                                 PanelRenderService panelRenderService,
                                 PersistenceGateway persistence,
                                 AuctionProperties properties) {
        this.auctionService = auctionService;
        this.bidService = bidService;
        this.configProvider = configProvider;
        this.registry = registry;
        this.monitorService = monitorService;
        this.panelRenderService = panelRenderService;
        this.persistence = persistence;
        this.properties = properties;
    }

    public CommandResult open(Long guildId, Caller caller, OpenAuctionRequest request) {
        Check guild = AuctionChecks.inGuild(guildId);
        if (!guild.ok()) {
            return CommandResult.failed(FORBIDDEN, guild.reason());
        }
        if (request.getChannelId() == null) {
            return CommandResult.failed("VALIDATION", "A channel is required");
        }
        GuildConfig config = configProvider.getConfig(guildId);
        Check allowed = AuctionChecks.all(
                AuctionChecks.channelAllowed(config, request.getChannelId()),
                AuctionChecks.canOpen(config, caller, request.getSecretCode()));
        if (!allowed.ok()) {
            return CommandResult.failed(FORBIDDEN, allowed.reason());
        }
        return run("open", () -> {
            long startBid = bidService.parseAmount(request.getStartBid());
            long minIncrement = request.getMinIncrement() == null || request.getMinIncrement().isBlank()
                    ? properties.getDefaultMinIncrement()
                    : bidService.parseAmount(request.getMinIncrement());
            int duration = request.getDurationMinutes() != null
                    ? request.getDurationMinutes()
                    : properties.getDefaultDurationMinutes();
            AuctionSnapshot opened = auctionService.open(new OpenAuctionCommand(guildId, request.getChannelId(),
                    caller.userId(), startBid, minIncrement, duration));
            return CommandResult.ok("Auction started at " + AmountFormat.format(startBid) + " "
                    + opened.currencyName(), describe(opened));
        });
    }

    public CommandResult placeBid(Long guildId, Caller caller, PlaceBidRequest request) {
        Check guild = AuctionChecks.inGuild(guildId);
        if (!guild.ok()) {
            return CommandResult.failed(FORBIDDEN, guild.reason());
        }
        Check role = AuctionChecks.canBid(configProvider.getConfig(guildId), caller);
        if (!role.ok()) {
            return CommandResult.failed(FORBIDDEN, role.reason());
        }
        return run("placeBid", () -> {
            BidReceipt receipt = auctionService.placeBid(guildId, caller.userId(), request);
            Map<String, Object> data = describe(receipt.auction());
            data.put("sequenceNo", receipt.bid().sequenceNo());
            data.put("delta", receipt.delta());
            return CommandResult.ok("Bid of " + AmountFormat.format(receipt.bid().amount()) + " accepted ("
                    + receipt.delta() + ")", data);
        });
    }

    public CommandResult undoLast(Long guildId, Caller caller) {
        Check check = manageCheck(guildId, caller);
        if (!check.ok()) {
            return CommandResult.failed(FORBIDDEN, check.reason());
        }
        return run("undoLast", () -> {
            UndoReceipt receipt = auctionService.undoLast(guildId);
            Map<String, Object> data = describe(receipt.auction());
            data.put("removedSequenceNo", receipt.removed().sequenceNo());
            data.put("removedAmount", receipt.removed().amount());
            data.put("removedBidderId", receipt.removed().bidderId());
            return CommandResult.ok("Removed the bid of " + AmountFormat.format(receipt.removed().amount()), data);
        });
    }

    public CommandResult end(Long guildId, Caller caller) {
        Check check = manageCheck(guildId, caller);
        if (!check.ok()) {
            return CommandResult.failed(FORBIDDEN, check.reason());
        }
        return run("end", () -> {
            AuctionSnapshot ended = auctionService.end(guildId);
            String message = ended.hasBids()
                    ? "Auction ended, final price " + AmountFormat.format(ended.currentBid())
                    : "Auction ended without bids";
            return CommandResult.ok(message, describe(ended));
        });
    }

    public CommandResult debugAuction(Long guildId) {
        return auctionService.getLiveSnapshot(guildId)
                .map(snapshot -> {
                    Map<String, Object> data = describe(snapshot);
                    data.put("monitorRunning", monitorService.isRunning(snapshot.id()));
                    panelRenderService.status(snapshot.id()).ifPresent(panel -> {
                        data.put("panelMessageId", panel.ref() != null ? panel.ref().messageId() : null);
                        data.put("panelDegraded", panel.degraded());
                    });
                    return CommandResult.ok("Auction is " + snapshot.status(), data);
                })
                .orElseGet(() -> CommandResult.failed(NO_AUCTION, "There is no active auction in this guild"));
    }

    public CommandResult debugStatus() {
        ConnectionStatus connection = persistence.getConnectionStatus();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("persistence", connection);
        data.put("monitorsRunning", monitorService.runningCount());
        List<Map<String, Object>> live = new ArrayList<>();
        for (LiveAuction auction : registry.liveAuctions()) {
            live.add(describe(auction.snapshot()));
        }
        data.put("liveAuctions", live);
        return CommandResult.ok("Storage is " + connection.status() + " on " + connection.activeBackend(), data);
    }

    public CommandResult reconnect(Caller caller) {
        Check admin = AuctionChecks.isAdmin(caller);
        if (!admin.ok()) {
            return CommandResult.failed(FORBIDDEN, admin.reason());
        }
        boolean active = persistence.reconnect();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("persistence", persistence.getConnectionStatus());
        return active
                ? CommandResult.ok("Primary store is active", data)
                : CommandResult.failed("STORAGE_UNAVAILABLE", "Primary store is still unreachable", data);
    }

    private Check manageCheck(Long guildId, Caller caller) {
        Check guild = AuctionChecks.inGuild(guildId);
        if (!guild.ok()) {
            return guild;
        }
        return AuctionChecks.canManage(configProvider.getConfig(guildId), caller);
    }

    private CommandResult run(String command, Supplier<CommandResult> action) {
        try {
            return action.get();
        } catch (ConcurrencyConflictException e) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("leadingBid", e.getLeadingBid());
            data.put("leadingBidderId", e.getLeadingBidderId());
            data.put("minimumNextBid", e.getMinimumNextBid());
            return CommandResult.failed(e.getCode(), e.getMessage(), data);
        } catch (AuctionException e) {
            log.debug("Command {} rejected: {} {}", command, e.getCode(), e.getMessage());
            return CommandResult.failed(e.getCode(), e.getMessage());
        }
    }

    private static Map<String, Object> describe(AuctionSnapshot s) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("auctionId", s.id().toString());
        data.put("guildId", s.guildId());
        data.put("channelId", s.channelId());
        data.put("status", s.status().name());
        data.put("startBid", s.startBid());
        data.put("minIncrement", s.minIncrement());
        data.put("currentBid", s.currentBid());
        data.put("currentBidderId", s.currentBidderId());
        data.put("minimumNextBid", s.minimumNextBid());
        data.put("bidCount", s.bidCount());
        data.put("revision", s.revision());
        data.put("currency", s.currencyName());
        data.put("endsAt", s.endsAt() != null ? s.endsAt().toString() : null);
        data.put("countdownDeadline", s.countdownDeadline() != null ? s.countdownDeadline().toString() : null);
        return data;
    }
}
