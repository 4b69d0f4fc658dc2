package com.guildauction.service;

import com.guildauction.config.AuctionProperties;
import com.guildauction.model.GuildConfig;
import com.guildauction.persistence.BackendStatus;
import com.guildauction.persistence.PersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds {@link GuildConfig} from the guild's rows in the settings table, falling back to
 * {@link AuctionProperties} defaults for anything unset or unreadable.
 */
@Service
public class GuildConfigService implements ConfigProvider {

    private static final Logger log = LoggerFactory.getLogger(GuildConfigService.class);

    public static final String ROLE_ID = "role_id";
    public static final String AUCTION_CHANNEL_IDS = "auction_channel_ids";
    public static final String LOG_CHANNEL_ID = "log_channel_id";
    public static final String COMMISSION = "commission";
    public static final String CURRENCY_NAME = "currency_name";
    public static final String SECRET_CODE = "secret_code";

    private final PersistenceGateway persistence;
    private final AuctionProperties properties;
    private final Map<Long, GuildConfig> lastKnown = new ConcurrentHashMap<>();

    public GuildConfigService(PersistenceGateway persistence, AuctionProperties properties) {
        this.persistence = persistence;
        this.properties = properties;
    }

    @Override
    public GuildConfig getConfig(long guildId) {
        Map<String, String> values = persistence.getSettings(guildId);
        // the embedded store may not hold settings written before a failover
        if (values.isEmpty() && persistence.getStatus() == BackendStatus.DEGRADED && lastKnown.containsKey(guildId)) {
            return lastKnown.get(guildId);
        }
        GuildConfig config = new GuildConfig(
                guildId,
                parseLong(guildId, ROLE_ID, values.get(ROLE_ID)),
                parseIds(guildId, values.get(AUCTION_CHANNEL_IDS)),
                parseLong(guildId, LOG_CHANNEL_ID, values.get(LOG_CHANNEL_ID)),
                parseCommission(guildId, values.get(COMMISSION)),
                blankToDefault(values.get(CURRENCY_NAME), properties.getDefaultCurrency()),
                blankToDefault(values.get(SECRET_CODE), null));
        if (!values.isEmpty()) {
            lastKnown.put(guildId, config);
        }
        return config;
    }

    private int parseCommission(long guildId, String raw) {
        Long value = parseLong(guildId, COMMISSION, raw);
        if (value == null || value < 0 || value > 100) {
            return properties.getDefaultCommissionPct();
        }
        return value.intValue();
    }

    private List<Long> parseIds(long guildId, String raw) {
        List<Long> ids = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return ids;
        }
        for (String part : raw.split(",")) {
            Long id = parseLong(guildId, AUCTION_CHANNEL_IDS, part);
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static Long parseLong(long guildId, String key, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed setting {}='{}' for guild {}", key, raw, guildId);
            return null;
        }
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
