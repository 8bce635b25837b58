package com.saltbet.repository;

import com.saltbet.model.Side;
import com.saltbet.model.Stake;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StakeRepository extends JpaRepository<Stake, UUID> {
    List<Stake> findByMatchIdOrderByCreatedAtAsc(String matchId);

    Optional<Stake> findFirstByUserIdAndMatchId(UUID userId, String matchId);

    List<Stake> findByUserIdOrderByCreatedAtDesc(UUID userId);

    long countByMatchId(String matchId);

    @Query("SELECT COALESCE(SUM(s.amount), 0) FROM Stake s WHERE s.match.id = :matchId AND s.side = :side")
    BigDecimal sumAmountByMatchIdAndSide(@Param("matchId") String matchId, @Param("side") Side side);
}
