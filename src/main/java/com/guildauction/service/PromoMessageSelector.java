package com.guildauction.service;

import com.guildauction.config.AuctionProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Picks the promo line posted when an auction goes quiet.
 */
@Component
public class PromoMessageSelector {

    private final AuctionProperties.Promo promo;
    private final AtomicInteger cursor = new AtomicInteger();

    public PromoMessageSelector(AuctionProperties properties) {
        this.promo = properties.getPromo();
    }

    public boolean isEnabled() {
        return promo.isEnabled() && !promo.getTemplates().isEmpty();
    }

    /**
     * @param mention display reference of the leading bidder, or a fallback when nobody has bid
     */
    public String next(String mention, String amount) {
        List<String> templates = promo.getTemplates();
        int index = promo.getPolicy() == AuctionProperties.PromoPolicy.ROUND_ROBIN
                ? Math.floorMod(cursor.getAndIncrement(), templates.size())
                : ThreadLocalRandom.current().nextInt(templates.size());
        return templates.get(index)
                .replace("{mention}", mention)
                .replace("{amount}", amount);
    }
}
