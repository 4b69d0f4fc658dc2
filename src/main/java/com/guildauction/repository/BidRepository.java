package com.guildauction.repository;

import com.guildauction.model.entity.Bid;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface BidRepository extends JpaRepository<Bid, UUID> {

    List<Bid> findByAuctionIdOrderBySequenceNoAsc(UUID auctionId);

    @Modifying
    @Query("DELETE FROM Bid b WHERE b.auctionId = :auctionId AND b.sequenceNo = :sequenceNo")
    int deleteByAuctionIdAndSequenceNo(@Param("auctionId") UUID auctionId, @Param("sequenceNo") long sequenceNo);
}
