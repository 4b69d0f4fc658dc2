package com.guildauction.persistence;

import com.guildauction.exception.StorageException;
import com.guildauction.model.AuctionSnapshot;
import com.guildauction.model.AuctionStatus;
import com.guildauction.model.BidEntry;
import com.guildauction.model.entity.Auction;
import com.guildauction.model.entity.Bid;
import com.guildauction.model.entity.Setting;
import com.guildauction.repository.AuctionRepository;
import com.guildauction.repository.BidRepository;
import com.guildauction.repository.SettingRepository;
import com.guildauction.transport.MessageRef;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Primary backend: the configured relational database through Spring Data JPA.
 * Each call runs in its own transaction so commit failures surface as {@link StorageException}.
 */
@Component
public class JpaPersistenceBackend implements PersistenceBackend {

    private static final String ENDED = AuctionStatus.ENDED.name();

    private final AuctionRepository auctionRepository;
    private final BidRepository bidRepository;
    private final SettingRepository settingRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaPersistenceBackend(AuctionRepository auctionRepository,
                                 BidRepository bidRepository,
                                 SettingRepository settingRepository,
                                 PlatformTransactionManager transactionManager) {
        this.auctionRepository = auctionRepository;
        this.bidRepository = bidRepository;
        this.settingRepository = settingRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public String name() {
        return "primary";
    }

    @Override
    public void ping() {
        inTransaction("ping", auctionRepository::count);
    }

    @Override
    public void saveAuction(AuctionSnapshot snapshot) {
        inTransaction("saveAuction", () -> {
            Auction auction = auctionRepository.findById(snapshot.id()).orElseGet(Auction::new);
            copyInto(snapshot, auction);
            return auctionRepository.save(auction);
        });
    }

    @Override
    public void addBid(BidEntry bid) {
        inTransaction("addBid", () -> bidRepository.save(new Bid(bid.id(), bid.auctionId(), bid.bidderId(),
                bid.amount(), bid.sequenceNo(), bid.createdAt())));
    }

    @Override
    public void removeBid(UUID auctionId, long sequenceNo) {
        inTransaction("removeBid", () -> bidRepository.deleteByAuctionIdAndSequenceNo(auctionId, sequenceNo));
    }

    @Override
    public Optional<AuctionSnapshot> findAuction(UUID auctionId) {
        return inTransaction("findAuction", () -> auctionRepository.findById(auctionId).map(this::toSnapshot));
    }

    @Override
    public List<AuctionSnapshot> findActiveAuctions() {
        return inTransaction("findActiveAuctions", () -> auctionRepository.findByStatusNotOrderByStartedAtDesc(ENDED)
                .stream().map(this::toSnapshot).toList());
    }

    @Override
    public Optional<AuctionSnapshot> findActiveAuction(long guildId) {
        return inTransaction("findActiveAuction", () -> auctionRepository
                .findFirstByGuildIdAndStatusNotOrderByStartedAtDesc(guildId, ENDED).map(this::toSnapshot));
    }

    @Override
    public List<AuctionSnapshot> findRecentAuctions(long guildId, int limit) {
        return inTransaction("findRecentAuctions", () -> auctionRepository
                .findByGuildIdOrderByStartedAtDesc(guildId, PageRequest.of(0, Math.max(1, limit)))
                .stream().map(this::toSnapshot).toList());
    }

    @Override
    public List<BidEntry> findBids(UUID auctionId) {
        return inTransaction("findBids", () -> bidRepository.findByAuctionIdOrderBySequenceNoAsc(auctionId).stream()
                .map(b -> new BidEntry(b.getId(), b.getAuctionId(), b.getBidderId(), b.getAmount(),
                        b.getSequenceNo(), b.getCreatedAt()))
                .toList());
    }

    @Override
    public Optional<String> getSetting(long guildId, String key) {
        return inTransaction("getSetting", () -> settingRepository.findById(new Setting.Key(guildId, key))
                .map(Setting::getValue));
    }

    @Override
    public void setSetting(long guildId, String key, String value) {
        inTransaction("setSetting", () -> settingRepository.save(Setting.builder()
                .key(new Setting.Key(guildId, key))
                .value(value)
                .updatedAt(Instant.now())
                .build()));
    }

    @Override
    public Map<String, String> getSettings(long guildId) {
        return inTransaction("getSettings", () -> {
            Map<String, String> values = new LinkedHashMap<>();
            for (Setting setting : settingRepository.findByKeyGuildId(guildId)) {
                values.put(setting.getKey().getName(), setting.getValue());
            }
            return values;
        });
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (RuntimeException e) {
            throw new StorageException("Primary store failed during " + operation + ": " + e.getMessage(), e);
        }
    }

    private void copyInto(AuctionSnapshot s, Auction a) {
        a.setId(s.id());
        a.setGuildId(s.guildId());
        a.setChannelId(s.channelId());
        a.setStartedBy(s.startedBy());
        a.setStatus(s.status().name());
        a.setStartBid(s.startBid());
        a.setMinIncrement(s.minIncrement());
        a.setCurrentBid(s.currentBid());
        a.setCurrentBidderId(s.currentBidderId());
        a.setCommissionPct(s.commissionPct());
        a.setCurrencyName(s.currencyName());
        a.setStartedAt(s.startedAt());
        a.setEndsAt(s.endsAt());
        a.setCountdownDeadline(s.countdownDeadline());
        a.setLastActivityAt(s.lastActivityAt());
        a.setEndedAt(s.endedAt());
        a.setPanelChannelId(s.panelRef() != null ? s.panelRef().channelId() : null);
        a.setPanelMessageId(s.panelRef() != null ? s.panelRef().messageId() : null);
        a.setLastSequenceNo(s.lastSequenceNo());
    }

    private AuctionSnapshot toSnapshot(Auction a) {
        MessageRef panel = a.getPanelChannelId() != null && a.getPanelMessageId() != null
                ? new MessageRef(a.getPanelChannelId(), a.getPanelMessageId())
                : null;
        return new AuctionSnapshot(a.getId(), a.getGuildId(), a.getChannelId(), a.getStartedBy(),
                AuctionStatus.valueOf(a.getStatus()), a.getStartBid(), a.getMinIncrement(),
                a.getCurrentBid(), a.getCurrentBidderId(), a.getCommissionPct(), a.getCurrencyName(),
                a.getStartedAt(), a.getEndsAt(), a.getCountdownDeadline(), a.getLastActivityAt(), a.getEndedAt(),
                panel, a.getLastSequenceNo(), 0L, List.of());
    }
}
