package com.guildauction.service;

import com.guildauction.config.AuctionProperties;
import com.guildauction.exception.TransportException;
import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.AuctionStatus;
import com.guildauction.model.BidEntry;
import com.guildauction.model.GuildConfig;
import com.guildauction.transport.DisplayPayload;
import com.guildauction.transport.MessagingTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuctionLogServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-01T12:00:00Z");

    private MessagingTransport transport;
    private AuctionLogService logService;
    private AuctionSnapshot ended;

    @BeforeEach
    void setUp() {
        transport = mock(MessagingTransport.class);
        logService = new AuctionLogService(transport, new BidService(new AuctionProperties()), new AuctionProperties());
        UUID id = UUID.randomUUID();
        List<BidEntry> bids = List.of(
                new BidEntry(UUID.randomUUID(), id, 10L, 100_000L, 1L, T0.plusSeconds(5)),
                new BidEntry(UUID.randomUUID(), id, 11L, 150_000L, 2L, T0.plusSeconds(10)),
                new BidEntry(UUID.randomUUID(), id, 10L, 250_000L, 3L, T0.plusSeconds(20)));
        ended = new AuctionSnapshot(id, 1L, 2L, 3L, AuctionStatus.ENDED, 100_000L, 50_000L, 250_000L, 10L, 20,
                "Credits", T0, T0.plusSeconds(300), null, T0.plusSeconds(20), T0.plusSeconds(53), null, 3L, 3L, bids);
    }

    @Test
    void summaryCarriesStatisticsAndCommission() {
        Map<String, Object> summary = logService.summarize(ended);

        assertThat(summary)
                .containsEntry("finalPrice", 250_000L)
                .containsEntry("winnerId", 10L)
                .containsEntry("totalBids", 3)
                .containsEntry("uniqueBidders", 2L)
                .containsEntry("bidVolume", 500_000L)
                .containsEntry("commission", 50_000L)
                .containsEntry("durationSeconds", 53L);
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> top = (List<Map<String, Object>>) summary.get("topBids");
        assertThat(top).extracting(row -> row.get("amount")).containsExactly(250_000L, 150_000L, 100_000L);
    }

    @Test
    void postsToTheLogChannelOnlyWhenConfigured() {
        GuildConfig withLog = new GuildConfig(1L, null, List.of(), 77L, 20, "Credits", null);
        GuildConfig withoutLog = new GuildConfig(1L, null, List.of(), null, 20, "Credits", null);

        logService.auctionEnded(ended, withoutLog);
        verify(transport, never()).send(anyLong(), any());

        logService.auctionEnded(ended, withLog);
        ArgumentCaptor<DisplayPayload> payload = ArgumentCaptor.forClass(DisplayPayload.class);
        verify(transport).send(eq(77L), payload.capture());
        assertThat(payload.getValue().type()).isEqualTo(DisplayPayload.LOG_AUCTION_ENDED);
    }

    @Test
    void transportFailuresAreNotPropagated() {
        when(transport.send(anyLong(), any())).thenThrow(new TransportException("down"));
        GuildConfig withLog = new GuildConfig(1L, null, List.of(), 77L, 20, "Credits", null);

        assertThatCode(() -> logService.auctionStarted(ended, withLog)).doesNotThrowAnyException();
    }
}
