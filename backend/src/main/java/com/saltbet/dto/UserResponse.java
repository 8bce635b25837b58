package com.saltbet.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

public record UserResponse(
        UUID userId,
        String username,
        BigDecimal balance,
        int totalWins,
        int totalLosses,
        BigDecimal winPercentage,
        BigDecimal totalRevenueGained,
        BigDecimal totalRevenueLost,
        BigDecimal grossRevenue,
        OffsetDateTime createdAt
) {
}
