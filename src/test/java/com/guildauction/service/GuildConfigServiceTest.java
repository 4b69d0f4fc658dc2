package com.guildauction.service;

import com.guildauction.config.AuctionProperties;
import com.guildauction.model.GuildConfig;
import com.guildauction.persistence.BackendStatus;
import com.guildauction.persistence.PersistenceGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GuildConfigServiceTest {

    private PersistenceGateway persistence;
    private GuildConfigService service;

    @BeforeEach
    void setUp() {
        persistence = mock(PersistenceGateway.class);
        when(persistence.getStatus()).thenReturn(BackendStatus.ACTIVE);
        service = new GuildConfigService(persistence, new AuctionProperties());
    }

    @Test
    void readsEverySetting() {
        when(persistence.getSettings(1L)).thenReturn(Map.of(
                "role_id", "100",
                "auction_channel_ids", "10, 11,12",
                "log_channel_id", "20",
                "commission", "15",
                "currency_name", "Gold",
                "secret_code", "open-sesame"));

        GuildConfig config = service.getConfig(1L);

        assertThat(config.roleId()).isEqualTo(100L);
        assertThat(config.auctionChannelIds()).containsExactly(10L, 11L, 12L);
        assertThat(config.logChannelId()).isEqualTo(20L);
        assertThat(config.commissionPct()).isEqualTo(15);
        assertThat(config.currencyName()).isEqualTo("Gold");
        assertThat(config.secretCode()).isEqualTo("open-sesame");
    }

    @Test
    void fallsBackToDefaults() {
        when(persistence.getSettings(2L)).thenReturn(Map.of("role_id", "oops", "commission", "250"));

        GuildConfig config = service.getConfig(2L);

        assertThat(config.roleId()).isNull();
        assertThat(config.auctionChannelIds()).isEmpty();
        assertThat(config.logChannelId()).isNull();
        assertThat(config.commissionPct()).isEqualTo(20);
        assertThat(config.currencyName()).isEqualTo("Credits");
        assertThat(config.secretCode()).isNull();
    }

    @Test
    void keepsLastKnownConfigWhileStorageIsDegraded() {
        when(persistence.getSettings(3L)).thenReturn(Map.of("role_id", "100"));
        service.getConfig(3L);

        when(persistence.getStatus()).thenReturn(BackendStatus.DEGRADED);
        when(persistence.getSettings(3L)).thenReturn(Map.of());

        assertThat(service.getConfig(3L).roleId()).isEqualTo(100L);
    }
}
