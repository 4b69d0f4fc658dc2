package com.guildauction.repository;

import com.guildauction.model.entity.Auction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AuctionRepository extends JpaRepository<Auction, UUID> {

    List<Auction> findByStatusNotOrderByStartedAtDesc(String status);

    Optional<Auction> findFirstByGuildIdAndStatusNotOrderByStartedAtDesc(long guildId, String status);

    List<Auction> findByGuildIdOrderByStartedAtDesc(long guildId, Pageable pageable);
}
