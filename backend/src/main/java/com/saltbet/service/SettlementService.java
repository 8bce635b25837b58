package com.saltbet.service;

import com.saltbet.model.ActiveStake;
import com.saltbet.model.Match;
import com.saltbet.model.MatchStatus;
import com.saltbet.model.Stake;
import com.saltbet.model.User;
import com.saltbet.repository.MatchRepository;
import com.saltbet.repository.StakeRepository;
import com.saltbet.repository.UserRepository;
import com.saltbet.web.BettingException;
import com.saltbet.web.LedgerStoreUnavailableException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Converts the open ledger of a locked match into durable stakes and pays them out.
 * <ul>
 *   <li>Every reserved amount is debited from the owner's balance and recorded as a {@link Stake}.</li>
 *   <li>The stakes are handed to the {@link PayoutEngine} in the same transaction.</li>
 *   <li>The ledger is cleared only once the transaction has committed.</li>
 * </ul>
 * Idempotent: settling an already settled match is a no-op.
 */
@Service
@RequiredArgsConstructor
public class SettlementService {

    private static final Logger log = LoggerFactory.getLogger(SettlementService.class);

    private final MatchRepository matchRepository;
    private final UserRepository userRepository;
    private final StakeRepository stakeRepository;
    private final RedisStakeLedgerStore ledgerStore;
    private final PayoutEngine payoutEngine;
    private final TotalsBroadcastThrottle broadcastThrottle;

    /**
     * Settle a locked match. Any failure rolls back every debit, stake row and payout.
     *
     * @param matchId id of the match to settle
     * @return summary of the settled stakes
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SettlementResult settle(String matchId) {
        Match match = matchRepository.findById(matchId)
                .orElseThrow(() -> BettingException.matchNotFound(matchId));

        if (match.getStatus() == MatchStatus.SETTLED) {
            log.info("Match {} already settled", matchId);
            return alreadySettled(match);
        }
        if (match.getStatus() != MatchStatus.LOCKED || match.getWinningSide() == null) {
            throw new IllegalStateException(
                    "Match must be LOCKED with a winning side before settlement, current: " + match.getStatus());
        }

        ledgerStore.closeLedger(matchId);
        List<ActiveStake> entries = ledgerStore.snapshotEntries();
        log.info("Settling match {} with {} ledger entries, winner {}", matchId, entries.size(), match.getWinningSide());

        OffsetDateTime now = OffsetDateTime.now();
        Map<UUID, User> users = new LinkedHashMap<>();
        List<Stake> stakes = new ArrayList<>(entries.size());
        BigDecimal totalStaked = BigDecimal.ZERO;

        for (ActiveStake entry : entries) {
            User user = users.computeIfAbsent(entry.userId(), this::loadUser);
            user.setBalance(user.getBalance().subtract(entry.amount()));
            user.setUpdatedAt(now);

            Stake stake = new Stake();
            stake.setId(UUID.randomUUID());
            stake.setAmount(entry.amount());
            stake.setSide(entry.side());
            stake.setUser(user);
            stake.setMatch(match);
            stake.setCreatedAt(now);
            stakes.add(stake);
            totalStaked = totalStaked.add(entry.amount());
        }
        stakeRepository.saveAll(stakes);

        PayoutEngine.PayoutSummary payout = payoutEngine.distribute(stakes, match.getWinningSide());
        userRepository.saveAll(users.values());

        match.setStatus(MatchStatus.SETTLED);
        match.setSettledAt(now);
        match.setUpdatedAt(now);
        matchRepository.save(match);

        clearLedgerAfterCommit(entries);

        log.info("Settlement complete for match {}. Stakes: {}, staked: {}, paid out: {}, refunded: {}",
                matchId, stakes.size(), totalStaked, payout.totalPaidOut(), payout.refunded());

        return new SettlementResult(
                matchId,
                match.getWinningSide(),
                stakes.size(),
                totalStaked,
                payout.refunded(),
                false
        );
    }

    private User loadUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> BettingException.userNotFound(userId));
    }

    private SettlementResult alreadySettled(Match match) {
        List<Stake> stakes = stakeRepository.findByMatchIdOrderByCreatedAtAsc(match.getId());
        BigDecimal totalStaked = stakes.stream()
                .map(Stake::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        boolean refunded = stakes.stream().noneMatch(stake -> stake.getSide() == match.getWinningSide());
        return new SettlementResult(
                match.getId(),
                match.getWinningSide(),
                stakes.size(),
                totalStaked,
                refunded,
                true
        );
    }

    private void clearLedgerAfterCommit(List<ActiveStake> entries) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    clearLedger(entries);
                }
            });
            return;
        }

        clearLedger(entries);
    }

    private void clearLedger(List<ActiveStake> entries) {
        try {
            ledgerStore.clear(entries);
            broadcastThrottle.requestBroadcast();
        } catch (LedgerStoreUnavailableException ex) {
            // Leftovers are dropped by the next openLedger call.
            log.error("Failed to clear {} settled ledger entries", entries.size(), ex);
        }
    }
}
