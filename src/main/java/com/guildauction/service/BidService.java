package com.guildauction.service;

import com.guildauction.config.AuctionProperties;
import com.guildauction.exception.BidParseException;
import com.guildauction.exception.BidValidationException;
import com.guildauction.exception.ConcurrencyConflictException;
import com.guildauction.model.BidEntry;
import com.guildauction.model.LiveAuction;
import com.guildauction.util.AmountFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bid arithmetic and the acceptance protocol. Stateless; the auction lock is owned by the caller.
 */
@Service
public class BidService {

    private static final Logger log = LoggerFactory.getLogger(BidService.class);

    private static final Pattern PLAIN = Pattern.compile("^[0-9]+$");
    private static final Pattern SUFFIXED = Pattern.compile("^([0-9]*\\.?[0-9]+)([a-z]+)$");
    private static final Map<String, Long> SUFFIXES = Map.of(
            "k", 1_000L,
            "m", 1_000_000L,
            "b", 1_000_000_000L,
            "t", 1_000_000_000_000L
    );
    /** Increments offered as one-click buttons on the panel. */
    public static final List<Long> QUICK_INCREMENTS = List.of(1_000L, 100_000L, 500_000L);

    private static final BigDecimal MAX_LONG = BigDecimal.valueOf(Long.MAX_VALUE);

    private final AuctionProperties properties;

    public BidService(AuctionProperties properties) {
        this.properties = properties;
    }

    /**
     * Parses user input such as "250000", "250k", "2.5m", "1,000,000" or "1_000_000".
     * Fractions left over after applying a suffix are truncated.
     */
    public long parseAmount(String text) {
        if (text == null) {
            throw new BidParseException("Please enter an amount");
        }
        String cleaned = text.trim().toLowerCase(Locale.ROOT)
                .replace(" ", "")
                .replace(",", "")
                .replace("_", "");
        if (cleaned.isEmpty()) {
            throw new BidParseException("Please enter an amount");
        }
        if (cleaned.startsWith("-")) {
            throw new BidParseException("Amount cannot be negative");
        }
        if (cleaned.chars().filter(c -> c == '.').count() > 1) {
            throw new BidParseException("Amount has more than one decimal point: " + text.trim());
        }

        if (PLAIN.matcher(cleaned).matches()) {
            return toLong(new BigDecimal(cleaned), text);
        }

        Matcher matcher = SUFFIXED.matcher(cleaned);
        if (!matcher.matches()) {
            throw new BidParseException("Invalid amount format: " + text.trim() + ". Use e.g. 250000, 250k or 2.5m");
        }
        Long multiplier = SUFFIXES.get(matcher.group(2));
        if (multiplier == null) {
            throw new BidParseException("Unsupported suffix '" + matcher.group(2) + "'. Use k, m, b or t");
        }
        BigDecimal value = new BigDecimal(matcher.group(1))
                .multiply(BigDecimal.valueOf(multiplier))
                .setScale(0, RoundingMode.DOWN);
        return toLong(value, text);
    }

    /**
     * Checks an amount against the auction's current leader and the global limits.
     * Reads live fields, so the auction lock must be held.
     */
    public void validateAmount(long amount, LiveAuction auction) {
        if (amount < properties.getMinBidAmount()) {
            throw new BidValidationException("Minimum bid is " + AmountFormat.format(properties.getMinBidAmount()));
        }
        if (amount > properties.getMaxBidAmount()) {
            throw new BidValidationException("Maximum bid is " + AmountFormat.format(properties.getMaxBidAmount()));
        }
        Long current = auction.getCurrentBid();
        if (current == null) {
            if (amount < auction.getStartBid()) {
                throw new BidValidationException("The first bid must be at least the starting bid of "
                        + AmountFormat.format(auction.getStartBid()));
            }
            return;
        }
        long minimum = current + auction.getMinIncrement();
        if (amount < minimum) {
            throw new BidValidationException("Bid must be at least " + AmountFormat.format(minimum)
                    + " (current " + AmountFormat.format(current) + " + increment "
                    + AmountFormat.format(auction.getMinIncrement()) + ")");
        }
    }

    /** Commission in whole units, rounded half up. Zero for non-positive inputs. */
    public long calculateCommission(long amount, int commissionPct) {
        if (amount <= 0 || commissionPct <= 0) {
            return 0L;
        }
        return BigDecimal.valueOf(amount)
                .multiply(BigDecimal.valueOf(commissionPct))
                .divide(BigDecimal.valueOf(100), 0, RoundingMode.HALF_UP)
                .longValue();
    }

    public String compareAmounts(long newAmount, long previousAmount) {
        return AmountFormat.formatDelta(newAmount - previousAmount);
    }

    /**
     * Accepts a bid against the auction's current state. Must run while holding the auction lock.
     *
     * @param observedRevision revision the bidder saw when choosing the amount, or {@code null} when
     *                         the amount was typed without a panel revision; in that case a bid that
     *                         would have beaten the state before the latest bid counts as a lost race
     * @throws ConcurrencyConflictException the auction moved on since the bidder looked and the amount
     *                                      is no longer high enough
     * @throws BidValidationException       the amount or bidder is rejected on current state
     */
    public BidEntry accept(LiveAuction auction, long bidderId, long amount, Long observedRevision, Instant now) {
        checkBidder(auction, bidderId, now);
        try {
            validateAmount(amount, auction);
        } catch (BidValidationException e) {
            if (lostRace(auction, amount, observedRevision)) {
                long leading = auction.getCurrentBid() != null ? auction.getCurrentBid() : auction.getStartBid();
                log.info("Bid of {} by {} on auction {} lost the race (seen revision {}, now {})",
                        amount, bidderId, auction.getId(), observedRevision, auction.getRevision());
                throw new ConcurrencyConflictException(leading, auction.getCurrentBidderId(),
                        auction.minimumNextBid());
            }
            throw e;
        }
        BidEntry entry = auction.appendBid(bidderId, amount, now);
        log.debug("Accepted bid #{} of {} by {} on auction {}", entry.sequenceNo(), amount, bidderId, auction.getId());
        return entry;
    }

    private static boolean lostRace(LiveAuction auction, long amount, Long observedRevision) {
        if (amount >= auction.minimumNextBid()) {
            return false;
        }
        if (observedRevision != null) {
            return observedRevision != auction.getRevision();
        }
        return auction.hasBids() && amount >= auction.minimumBeforeLatestBid();
    }

    private void checkBidder(LiveAuction auction, long bidderId, Instant now) {
        Long leader = auction.getCurrentBidderId();
        if (leader != null && leader == bidderId) {
            throw new BidValidationException("You are already the highest bidder");
        }
        Instant lastBid = auction.getLastBidAt(bidderId);
        Duration cooldown = properties.getBidCooldown();
        if (lastBid != null && Duration.between(lastBid, now).compareTo(cooldown) < 0) {
            Duration wait = cooldown.minus(Duration.between(lastBid, now));
            throw new BidValidationException("Please wait " + Math.max(1, wait.toSeconds())
                    + "s before bidding again");
        }
    }

    private static long toLong(BigDecimal value, String original) {
        if (value.compareTo(MAX_LONG) > 0) {
            throw new BidParseException("Amount is too large: " + original.trim());
        }
        return value.longValueExact();
    }
}
