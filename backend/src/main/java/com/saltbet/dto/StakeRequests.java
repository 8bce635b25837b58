package com.saltbet.dto;

import com.saltbet.model.Side;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public final class StakeRequests {

    private StakeRequests() {
    }

    public record PlaceStakeRequest(
            @NotNull(message = "amount is required")
            BigDecimal amount,

            @NotNull(message = "side is required")
            Side side
    ) {
    }

    public record CancelStakeRequest(
            @NotNull(message = "amount is required")
            BigDecimal amount
    ) {
    }
}
