package com.saltbet.dto;

import com.saltbet.model.Side;

public final class MatchRequests {

    private MatchRequests() {
    }

    /**
     * Optional operator fallback used when the winner cannot be read from the bout history.
     */
    public record WinnerRequest(
            Side winner
    ) {
    }
}
