package com.guildauction.service;

import com.guildauction.config.AuctionProperties;
import com.guildauction.dto.BidReceipt;
import com.guildauction.dto.CommandResult;
import com.guildauction.dto.OpenAuctionCommand;
import com.guildauction.dto.OpenAuctionRequest;
import com.guildauction.dto.PlaceBidRequest;
import com.guildauction.exception.AuctionStateException;
import com.guildauction.exception.ConcurrencyConflictException;
import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.AuctionStatus;
import com.guildauction.model.BidEntry;
import com.guildauction.model.GuildConfig;
import com.guildauction.persistence.PersistenceGateway;
import com.guildauction.service.AuctionChecks.Caller;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AuctionCommandServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-01T12:00:00Z");
    private static final long GUILD = 1L;
    private static final long ROLE = 500L;

    private AuctionService auctionService;
    private PersistenceGateway persistence;
    private AuctionCommandService commands;

    private final Caller member = new Caller(10L, Set.of(), false);
    private final Caller bidder = new Caller(10L, Set.of(ROLE), false);
    private final Caller auctioneer = new Caller(11L, Set.of(ROLE), false);
    private final Caller admin = new Caller(12L, Set.of(), true);

    @BeforeEach
    void setUp() {
        auctionService = mock(AuctionService.class);
        persistence = mock(PersistenceGateway.class);
        ConfigProvider configProvider = guildId ->
                new GuildConfig(guildId, ROLE, List.of(5L), null, 20, "Credits", "s3cret");
        AuctionProperties properties = new AuctionProperties();
        commands = new AuctionCommandService(auctionService, new BidService(properties), configProvider,
                new AuctionRegistry(), mock(AuctionMonitorService.class), mock(PanelRenderService.class),
                persistence, properties);
    }

    @Test
    void openAppliesDefaultsForMissingParameters() {
        when(auctionService.open(any())).thenReturn(snapshot(null, null, 0L));

        CommandResult result = commands.open(GUILD, auctioneer, request(5L, "100k", null, null));

        assertThat(result.success()).isTrue();
        ArgumentCaptor<OpenAuctionCommand> command = ArgumentCaptor.forClass(OpenAuctionCommand.class);
        verify(auctionService).open(command.capture());
        assertThat(command.getValue().startBid()).isEqualTo(100_000L);
        assertThat(command.getValue().minIncrement()).isEqualTo(50_000L);
        assertThat(command.getValue().durationMinutes()).isEqualTo(5);
        assertThat(command.getValue().startedBy()).isEqualTo(11L);
    }

    @Test
    void openIsRefusedOutsideAllowedChannelsAndWithoutRights() {
        assertThat(commands.open(GUILD, auctioneer, request(99L, "100k", null, null)).code())
                .isEqualTo(AuctionCommandService.FORBIDDEN);
        assertThat(commands.open(GUILD, member, request(5L, "100k", null, null)).code())
                .isEqualTo(AuctionCommandService.FORBIDDEN);
        assertThat(commands.open(null, admin, request(5L, "100k", null, null)).code())
                .isEqualTo(AuctionCommandService.FORBIDDEN);
        verifyNoInteractions(auctionService);
    }

    @Test
    void secretCodeLetsAnyMemberOpen() {
        when(auctionService.open(any())).thenReturn(snapshot(null, null, 0L));
        OpenAuctionRequest request = request(5L, "1m", "100k", 10);
        request.setSecretCode("s3cret");

        assertThat(commands.open(GUILD, member, request).success()).isTrue();
    }

    @Test
    void malformedStartBidIsReportedAsParseFailure() {
        CommandResult result = commands.open(GUILD, admin, request(5L, "12x", null, null));

        assertThat(result.success()).isFalse();
        assertThat(result.message()).contains("Unsupported suffix");
        verify(auctionService, never()).open(any());
    }

    @Test
    void acceptedBidReportsDeltaAndSequence() {
        AuctionSnapshot after = snapshot(150_000L, 10L, 1L);
        BidEntry bid = new BidEntry(UUID.randomUUID(), after.id(), 10L, 150_000L, 1L, T0);
        when(auctionService.placeBid(eq(GUILD), eq(10L), any())).thenReturn(new BidReceipt(bid, after, "+150K"));

        CommandResult result = commands.placeBid(GUILD, bidder, PlaceBidRequest.ofAmount("150k"));

        assertThat(result.success()).isTrue();
        assertThat(result.data()).containsEntry("sequenceNo", 1L).containsEntry("delta", "+150K");
    }

    @Test
    void biddingWithoutTheAuctionRoleIsForbidden() {
        CommandResult result = commands.placeBid(GUILD, member, PlaceBidRequest.ofAmount("150k"));

        assertThat(result.success()).isFalse();
        assertThat(result.code()).isEqualTo(AuctionCommandService.FORBIDDEN);
        assertThat(result.message()).contains("auction role");
        assertThat(commands.placeBid(GUILD, admin, PlaceBidRequest.ofAmount("150k")).code())
                .isEqualTo(AuctionCommandService.FORBIDDEN);
        verify(auctionService, never()).placeBid(anyLong(), anyLong(), any());
    }

    @Test
    void lostRaceCarriesTheWinningBid() {
        when(auctionService.placeBid(anyLong(), anyLong(), any()))
                .thenThrow(new ConcurrencyConflictException(150_000L, 20L, 200_000L));

        CommandResult result = commands.placeBid(GUILD, bidder, PlaceBidRequest.ofIncrement(100_000L, 0L));

        assertThat(result.success()).isFalse();
        assertThat(result.code()).isEqualTo("CONCURRENCY_CONFLICT");
        assertThat(result.data())
                .containsEntry("leadingBid", 150_000L)
                .containsEntry("leadingBidderId", 20L)
                .containsEntry("minimumNextBid", 200_000L);
    }

    @Test
    void undoAndEndNeedRoleOrAdmin() {
        assertThat(commands.undoLast(GUILD, member).code()).isEqualTo(AuctionCommandService.FORBIDDEN);
        assertThat(commands.end(GUILD, member).code()).isEqualTo(AuctionCommandService.FORBIDDEN);
        verifyNoInteractions(auctionService);

        when(auctionService.end(GUILD)).thenThrow(new AuctionStateException("There is no active auction to end"));
        CommandResult result = commands.end(GUILD, admin);
        assertThat(result.code()).isEqualTo("INVALID_STATE");
        assertThat(result.message()).isEqualTo("There is no active auction to end");
    }

    @Test
    void reconnectIsAdminOnly() {
        assertThat(commands.reconnect(auctioneer).code()).isEqualTo(AuctionCommandService.FORBIDDEN);
        verify(persistence, never()).reconnect();

        when(persistence.reconnect()).thenReturn(false);
        assertThat(commands.reconnect(admin).code()).isEqualTo("STORAGE_UNAVAILABLE");
    }

    @Test
    void debugWithoutAuctionReportsNoAuction() {
        when(auctionService.getLiveSnapshot(GUILD)).thenReturn(Optional.empty());

        assertThat(commands.debugAuction(GUILD).code()).isEqualTo(AuctionCommandService.NO_AUCTION);
    }

    private static OpenAuctionRequest request(Long channelId, String startBid, String minIncrement, Integer duration) {
        OpenAuctionRequest request = new OpenAuctionRequest();
        request.setChannelId(channelId);
        request.setStartBid(startBid);
        request.setMinIncrement(minIncrement);
        request.setDurationMinutes(duration);
        return request;
    }

    private static AuctionSnapshot snapshot(Long currentBid, Long bidderId, long revision) {
        return new AuctionSnapshot(UUID.randomUUID(), GUILD, 5L, 11L, AuctionStatus.OPEN, 100_000L, 50_000L,
                currentBid, bidderId, 20, "Credits", T0, T0.plusSeconds(300), null, T0, null, null,
                revision, revision, List.of());
    }
}
