package com.guildauction.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Platform-neutral content handed to the transport. The type tells the platform adapter
 * which layout to use; the fields carry raw values, never markup.
 */
public record DisplayPayload(String type, Map<String, Object> fields) {

    public static final String AUCTION_PANEL = "AUCTION_PANEL";
    public static final String AUCTION_SUMMARY = "AUCTION_SUMMARY";
    public static final String WINNER_ANNOUNCEMENT = "WINNER_ANNOUNCEMENT";
    public static final String PROMO = "PROMO";
    public static final String LOG_AUCTION_STARTED = "LOG_AUCTION_STARTED";
    public static final String LOG_AUCTION_ENDED = "LOG_AUCTION_ENDED";

    public DisplayPayload {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
