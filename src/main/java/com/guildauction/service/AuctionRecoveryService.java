package com.guildauction.service;

import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.AuctionStatus;
import com.guildauction.model.BidEntry;
import com.guildauction.persistence.PersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reloads unfinished auctions from storage once the application is up.
 */
@Service
public class AuctionRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(AuctionRecoveryService.class);

    private final PersistenceGateway persistence;
    private final AuctionService auctionService;
    private final Clock clock;

    public AuctionRecoveryService(PersistenceGateway persistence, AuctionService auctionService, Clock clock) {
        this.persistence = persistence;
        this.auctionService = auctionService;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int restored = recover();
        log.info("Startup recovery finished, {} auction(s) restored", restored);
    }

    /**
     * Restores every stored auction that has not ended. When a guild has more than one,
     * the most recently started is kept and the others are closed.
     *
     * @return number of auctions now live
     */
    public int recover() {
        List<AuctionSnapshot> stored = persistence.getActiveAuctions();
        Set<Long> seenGuilds = new HashSet<>();
        int restored = 0;
        for (AuctionSnapshot auction : stored) {
            if (!seenGuilds.add(auction.guildId())) {
                log.warn("Closing stale auction {} in guild {}, a newer one exists", auction.id(), auction.guildId());
                persistence.saveAuction(auction.withStatus(AuctionStatus.ENDED, clock.instant()));
                continue;
            }
            try {
                List<BidEntry> bids = persistence.getBids(auction.id());
                auctionService.restore(auction, bids);
                restored++;
                log.info("Restored auction {} in guild {} with {} bid(s), status {}",
                        auction.id(), auction.guildId(), bids.size(), auction.status());
            } catch (RuntimeException e) {
                log.error("Could not restore auction {}: {}", auction.id(), e.getMessage(), e);
            }
        }
        return restored;
    }
}
