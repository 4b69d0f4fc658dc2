package com.guildauction.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for the auction engine, bound from the {@code auction.*} keys in application.yml.
 * Defaults match the values the engine was designed around (30s idle, 3s countdown, 500ms panel window).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "auction")
public class AuctionProperties {

    private Duration inactivityThreshold = Duration.ofSeconds(30);
    private Duration countdown = Duration.ofSeconds(3);
    private Duration monitorTick = Duration.ofSeconds(1);
    private Duration panelUpdateDelay = Duration.ofMillis(500);
    private Duration bidCooldown = Duration.ofSeconds(2);

    private long minBidAmount = 1_000L;
    private long maxBidAmount = 1_000_000_000_000L;

    private int minDurationMinutes = 1;
    private int maxDurationMinutes = 1440;
    private int defaultDurationMinutes = 5;
    private long defaultMinIncrement = 50_000L;

    private int defaultCommissionPct = 20;
    private String defaultCurrency = "Credits";
    private int maxBidHistoryDisplay = 10;

    private int schedulerPoolSize = 4;
    private int sideEffectPoolSize = 4;
    private int storagePoolSize = 2;

    private Promo promo = new Promo();
    private Persistence persistence = new Persistence();

    public enum PromoPolicy {
        RANDOM,
        ROUND_ROBIN
    }

    @Getter
    @Setter
    public static class Promo {
        private boolean enabled = true;
        private PromoPolicy policy = PromoPolicy.RANDOM;
        /** Placeholders: {mention} and {amount}. */
        private List<String> templates = new ArrayList<>(List.of(
                "{mention} is leading with {amount}! Who breaks the record?",
                "The auction is still running. {mention} bid {amount}, show us your courage!",
                "Challenge update: {mention} is on {amount}. Can you beat it?",
                "{mention} leads with {amount}! Last call before the hammer falls."
        ));
    }

    @Getter
    @Setter
    public static class Persistence {
        private int retryAttempts = 3;
        private Duration retryBackoff = Duration.ofSeconds(2);
        private Duration reconnectProbeInterval = Duration.ofSeconds(60);
        private int maxPendingReplay = 10_000;
        private String embeddedUrl = "jdbc:h2:file:./data/guild-auction";
        private String embeddedUsername = "sa";
        private String embeddedPassword = "";
    }
}
