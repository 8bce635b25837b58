package com.saltbet.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Business outcome of a ledger or match operation that the caller has to act on.
 * Infrastructure failures are reported with {@link LedgerStoreUnavailableException}
 * and {@link MatchDataUnavailableException} instead.
 */
@Getter
public class BettingException extends RuntimeException {

    private final BettingError error;

    public BettingException(BettingError error, String message) {
        super(message);
        this.error = error;
    }

    public HttpStatus getStatus() {
        return error.getStatus();
    }

    public String getCode() {
        return error.getCode();
    }

    public static BettingException invalidAmount(String detail) {
        return new BettingException(BettingError.INVALID_AMOUNT, detail);
    }

    public static BettingException noOpenMatch() {
        return new BettingException(BettingError.NO_OPEN_MATCH, "There is no match open for staking");
    }

    public static BettingException matchLocked(String matchId) {
        return new BettingException(BettingError.MATCH_LOCKED, "Match is locked for staking: " + matchId);
    }

    public static BettingException insufficientFunds(String detail) {
        return new BettingException(BettingError.INSUFFICIENT_FUNDS, detail);
    }

    public static BettingException duplicateMatch(String matchId) {
        return new BettingException(
                BettingError.DUPLICATE_MATCH,
                "The match data source has not advanced past " + matchId + " yet. Please try again later."
        );
    }

    public static BettingException matchNotFound(String matchId) {
        return new BettingException(BettingError.MATCH_NOT_FOUND, "Match not found: " + matchId);
    }

    public static BettingException alreadyConcluded(String matchId) {
        return new BettingException(BettingError.ALREADY_CONCLUDED, "Match has already been concluded: " + matchId);
    }

    public static BettingException noActiveStake() {
        return new BettingException(BettingError.NO_ACTIVE_STAKE, "No active stake found to cancel");
    }

    public static BettingException stakeExceedsActive() {
        return new BettingException(
                BettingError.STAKE_EXCEEDS_ACTIVE,
                "Cannot cancel more than the current stake amount"
        );
    }

    public static BettingException matchNotLocked(String matchId) {
        return new BettingException(
                BettingError.MATCH_NOT_LOCKED,
                "Match is still open and has to be ended before it can be settled: " + matchId
        );
    }

    public static BettingException unresolvedWinner(String matchId) {
        return new BettingException(
                BettingError.UNRESOLVED_WINNER,
                "Latest bout does not match " + matchId + ". Provide a winner to end this match manually"
        );
    }

    public static BettingException userNotFound(Object userId) {
        return new BettingException(BettingError.USER_NOT_FOUND, "User not found: " + userId);
    }

    public static BettingException corruptWinnerMapping(String matchId, long winnerId) {
        return new BettingException(
                BettingError.CORRUPT_WINNER_MAPPING,
                "Winner id " + winnerId + " does not match either fighter of match " + matchId
        );
    }
}
