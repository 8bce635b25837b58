package com.saltbet.dto;

import com.saltbet.model.MatchStatus;
import com.saltbet.model.Side;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

public final class MatchResponses {

    private MatchResponses() {
    }

    public record MatchSummary(
            String matchId,
            Long fighterBlueId,
            Long fighterRedId,
            MatchStatus status,
            Side winningSide,
            Long externalId,
            OffsetDateTime createdAt
    ) {
    }

    public record MatchDetail(
            String matchId,
            Long fighterBlueId,
            Long fighterRedId,
            MatchStatus status,
            Side winningSide,
            Long externalId,
            BigDecimal totalRed,
            BigDecimal totalBlue,
            long participants,
            OffsetDateTime lockedAt,
            OffsetDateTime settledAt,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record FighterSummary(
            long fighterId,
            String name,
            String tier,
            Integer elo,
            Integer tierElo,
            Integer bestStreak
    ) {
    }

    public record MatchFighters(
            String matchId,
            FighterSummary blue,
            FighterSummary red
    ) {
    }

    public record SettlementSummary(
            String matchId,
            Side winningSide,
            int stakeCount,
            BigDecimal totalStaked,
            boolean refunded,
            boolean alreadySettled
    ) {
    }
}
