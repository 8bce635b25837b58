package com.saltbet.service;

import com.saltbet.model.Side;

import java.math.BigDecimal;

public record SettlementResult(
        String matchId,
        Side winningSide,
        int stakeCount,
        BigDecimal totalStaked,
        boolean refunded,
        boolean alreadySettled
) {
}
