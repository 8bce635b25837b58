package com.saltbet.model;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Amount a user currently has reserved in the open ledger, and the side it backs.
 */
public record ActiveStake(
        UUID userId,
        BigDecimal amount,
        Side side
) {
}
