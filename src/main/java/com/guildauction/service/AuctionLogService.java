package com.guildauction.service;

import com.guildauction.config.AuctionProperties;
import com.guildauction.exception.TransportException;
import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.BidEntry;
import com.guildauction.model.GuildConfig;
import com.guildauction.transport.DisplayPayload;
import com.guildauction.transport.MessagingTransport;
import com.guildauction.util.AmountFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts start and end records to the guild's log channel, if one is configured.
 * Failures are logged and never reach the caller.
 */
@Service
public class AuctionLogService {

    private static final Logger log = LoggerFactory.getLogger(AuctionLogService.class);

    private final MessagingTransport transport;
    private final BidService bidService;
    private final AuctionProperties properties;

    public AuctionLogService(MessagingTransport transport, BidService bidService, AuctionProperties properties) {
        this.transport = transport;
        this.bidService = bidService;
        this.properties = properties;
    }

    public void auctionStarted(AuctionSnapshot auction, GuildConfig config) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("auctionId", auction.id().toString());
        fields.put("channelId", auction.channelId());
        fields.put("startedBy", auction.startedBy());
        fields.put("startBid", auction.startBid());
        fields.put("minIncrement", auction.minIncrement());
        fields.put("currency", auction.currencyName());
        fields.put("endsAt", auction.endsAt() != null ? auction.endsAt().toString() : null);
        post(config, new DisplayPayload(DisplayPayload.LOG_AUCTION_STARTED, fields), auction);
    }

    public void auctionEnded(AuctionSnapshot auction, GuildConfig config) {
        post(config, new DisplayPayload(DisplayPayload.LOG_AUCTION_ENDED, summarize(auction)), auction);
    }

    /**
     * Statistics of a finished auction as shown in the log channel.
     */
    public Map<String, Object> summarize(AuctionSnapshot auction) {
        List<BidEntry> bids = auction.bids();
        long volume = bids.stream().mapToLong(BidEntry::amount).sum();
        long uniqueBidders = bids.stream().map(BidEntry::bidderId).distinct().count();
        long finalPrice = auction.currentBid() != null ? auction.currentBid() : 0L;
        Duration duration = auction.endedAt() != null
                ? Duration.between(auction.startedAt(), auction.endedAt())
                : Duration.ZERO;

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("auctionId", auction.id().toString());
        fields.put("currency", auction.currencyName());
        fields.put("finalPrice", auction.currentBid());
        fields.put("finalPriceDisplay", AmountFormat.format(finalPrice));
        fields.put("winnerId", auction.currentBidderId());
        fields.put("startBid", auction.startBid());
        fields.put("minIncrement", auction.minIncrement());
        fields.put("totalBids", bids.size());
        fields.put("uniqueBidders", uniqueBidders);
        fields.put("bidVolume", volume);
        fields.put("commissionPct", auction.commissionPct());
        fields.put("commission", bidService.calculateCommission(finalPrice, auction.commissionPct()));
        fields.put("durationSeconds", duration.toSeconds());
        fields.put("topBids", topBids(bids));
        return fields;
    }

    private List<Map<String, Object>> topBids(List<BidEntry> bids) {
        List<Map<String, Object>> rows = new ArrayList<>();
        bids.stream()
                .sorted(Comparator.comparingLong(BidEntry::amount).reversed())
                .limit(properties.getMaxBidHistoryDisplay())
                .forEach(bid -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("bidderId", bid.bidderId());
                    row.put("amount", bid.amount());
                    row.put("amountDisplay", AmountFormat.format(bid.amount()));
                    rows.add(row);
                });
        return rows;
    }

    private void post(GuildConfig config, DisplayPayload payload, AuctionSnapshot auction) {
        if (config == null || config.logChannelId() == null) {
            return;
        }
        try {
            transport.send(config.logChannelId(), payload);
        } catch (TransportException e) {
            log.warn("Log entry {} for auction {} not posted: {}", payload.type(), auction.id(), e.getMessage());
        }
    }
}
