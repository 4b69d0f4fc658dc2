package com.guildauction.model;

import java.util.List;

/**
 * Read-only view of a guild's auction settings. Nullable ids mean "not configured".
 */
public record GuildConfig(long guildId,
                          Long roleId,
                          List<Long> auctionChannelIds,
                          Long logChannelId,
                          int commissionPct,
                          String currencyName,
                          String secretCode) {

    public GuildConfig {
        auctionChannelIds = auctionChannelIds == null ? List.of() : List.copyOf(auctionChannelIds);
    }
}
