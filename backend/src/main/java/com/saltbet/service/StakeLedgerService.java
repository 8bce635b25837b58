package com.saltbet.service;

import com.saltbet.config.SaltbetProperties;
import com.saltbet.model.ActiveStake;
import com.saltbet.model.Match;
import com.saltbet.model.MatchStatus;
import com.saltbet.model.Side;
import com.saltbet.model.SideTotals;
import com.saltbet.model.Stake;
import com.saltbet.model.User;
import com.saltbet.repository.MatchRepository;
import com.saltbet.repository.StakeRepository;
import com.saltbet.web.BettingException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for placing and cancelling stakes on the current match.
 * Reservations live in the ledger store until the match settles; balances are
 * only read here, never written.
 */
@Service
@RequiredArgsConstructor
public class StakeLedgerService {

    private static final Logger log = LoggerFactory.getLogger(StakeLedgerService.class);
    // largest value the numeric(12,2) money columns hold
    static final BigDecimal MAXIMUM_AMOUNT = new BigDecimal("9999999999.99");

    private final RedisStakeLedgerStore ledgerStore;
    private final MatchRepository matchRepository;
    private final StakeRepository stakeRepository;
    private final TotalsBroadcastThrottle broadcastThrottle;
    private final SaltbetProperties saltbetProperties;

    /**
     * Reserve {@code amount} on {@code side} for the current match. A user holds one
     * reservation per match; placing again adds to it and moves it to {@code side}.
     */
    public boolean placeStake(User user, BigDecimal amount, Side side) {
        requireValidAmount(amount);
        if (side == null) {
            throw BettingException.invalidAmount("A side is required");
        }
        Match match = requireOpenMatch();

        RedisStakeLedgerStore.LedgerOutcome outcome =
                ledgerStore.atomicPlace(match.getId(), user.getId(), amount, side, user.getBalance());
        switch (outcome) {
            case OK -> log.debug("User {} staked {} on {} in match {}", user.getId(), amount, side, match.getId());
            case MATCH_CLOSED -> throw BettingException.matchLocked(match.getId());
            case INSUFFICIENT_FUNDS -> throw BettingException.insufficientFunds(
                    "Insufficient balance to stake " + amount + " on top of the current reservation");
            default -> throw new IllegalStateException("Unexpected ledger outcome for placement: " + outcome);
        }

        broadcastThrottle.requestBroadcast();
        return true;
    }

    /**
     * Release part or all of the caller's reservation on the current match.
     */
    public boolean cancelStake(User user, BigDecimal amount) {
        requireValidAmount(amount);
        Match match = requireOpenMatch();

        RedisStakeLedgerStore.LedgerOutcome outcome =
                ledgerStore.atomicCancel(match.getId(), user.getId(), amount);
        switch (outcome) {
            case OK -> log.debug("User {} released {} in match {}", user.getId(), amount, match.getId());
            case MATCH_CLOSED -> throw BettingException.matchLocked(match.getId());
            case NO_BET -> throw BettingException.noActiveStake();
            case INSUFFICIENT_BET -> throw BettingException.stakeExceedsActive();
            default -> throw new IllegalStateException("Unexpected ledger outcome for cancellation: " + outcome);
        }

        broadcastThrottle.requestBroadcast();
        return true;
    }

    public SideTotals currentTotals() {
        return ledgerStore.readSideTotals();
    }

    /**
     * Durable stake the user holds on the current match. Present only once that match has settled.
     */
    public Optional<Stake> activeStakeOf(UUID userId) {
        return matchRepository.findTopByOrderByCreatedAtDesc()
                .flatMap(match -> stakeRepository.findFirstByUserIdAndMatchId(userId, match.getId()));
    }

    public Optional<ActiveStake> openStakeOf(UUID userId) {
        return ledgerStore.readActiveStake(userId);
    }

    private Match requireOpenMatch() {
        Match match = matchRepository.findTopByOrderByCreatedAtDesc()
                .orElseThrow(BettingException::noOpenMatch);
        if (match.getStatus() != MatchStatus.OPEN) {
            throw BettingException.matchLocked(match.getId());
        }
        return match;
    }

    private void requireValidAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw BettingException.invalidAmount("Amount must be greater than zero");
        }
        if (amount.compareTo(MAXIMUM_AMOUNT) > 0) {
            throw BettingException.invalidAmount("Amount must not exceed " + MAXIMUM_AMOUNT.toPlainString());
        }
        BigDecimal increment = saltbetProperties.getLedger().getMinimumIncrement();
        if (increment == null || increment.signum() <= 0) {
            throw new IllegalStateException("saltbet.ledger.minimum-increment must be greater than zero");
        }
        if (amount.remainder(increment).signum() != 0) {
            throw BettingException.invalidAmount("Amount must be a multiple of " + increment.toPlainString());
        }
    }
}
