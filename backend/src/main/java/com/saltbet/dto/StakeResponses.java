package com.saltbet.dto;

import com.saltbet.model.Side;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

public final class StakeResponses {

    private StakeResponses() {
    }

    public record StakeAccepted(
            boolean success
    ) {
    }

    public record OpenStake(
            BigDecimal amount,
            Side side
    ) {
    }

    public record StakeSummary(
            UUID stakeId,
            String matchId,
            BigDecimal amount,
            Side side,
            Side winningSide,
            OffsetDateTime createdAt
    ) {
    }

    /**
     * The caller's position on the current match: the reservation still held in the
     * ledger, and the durable stake once the match has settled.
     */
    public record MyStake(
            StakeSummary durable,
            OpenStake open
    ) {
    }
}
