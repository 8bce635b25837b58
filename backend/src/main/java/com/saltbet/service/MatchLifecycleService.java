package com.saltbet.service;

import com.saltbet.model.Match;
import com.saltbet.model.MatchStatus;
import com.saltbet.model.Side;
import com.saltbet.repository.MatchRepository;
import com.saltbet.web.BettingError;
import com.saltbet.web.BettingException;
import com.saltbet.web.MatchDataUnavailableException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Drives matches through {@code OPEN -> LOCKED -> SETTLED}.
 * <p>
 * The winner of a match is taken from the external bout history when the bout
 * following the cursor (or, failing that, the most recent bout) has the same
 * fighter pairing. An operator-supplied winner is used only when neither does.
 */
@Service
@RequiredArgsConstructor
public class MatchLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(MatchLifecycleService.class);

    private final MatchRepository matchRepository;
    private final MatchDataClient matchDataClient;
    private final ExternalBoutTracker boutTracker;
    private final SettlementService settlementService;
    private final RedisStakeLedgerStore ledgerStore;
    private final AutoFinalizationScheduler autoFinalizationScheduler;
    private final TransactionTemplate transactionTemplate;
    private final TotalsBroadcastThrottle broadcastThrottle;

    /**
     * Open a match for the bout currently running at the source. The previous match,
     * if still open, is ended first with {@code manualWinner} as its fallback winner.
     */
    public Match createNextMatch(Side manualWinner) {
        MatchDataClient.CurrentBout bout = matchDataClient.getCurrentBout();
        String matchId = BoutToken.of(bout.fighterBlueId(), bout.fighterRedId(), bout.freshnessToken());
        if (matchRepository.existsById(matchId)) {
            log.warn("Match {} already exists, the source has not moved on yet", matchId);
            throw BettingException.duplicateMatch(matchId);
        }

        Optional<Match> current = matchRepository.findTopByOrderByCreatedAtDesc();
        if (current.isPresent()) {
            Match previous = current.get();
            if (previous.getStatus() == MatchStatus.OPEN) {
                log.info("Ending match {} before opening {}", previous.getId(), matchId);
                endMatch(previous.getId(), manualWinner);
            } else if (previous.getStatus() == MatchStatus.LOCKED) {
                log.warn("Match {} is locked but unsettled, retrying settlement before opening {}",
                        previous.getId(), matchId);
                settlementService.settle(previous.getId());
            }
        }

        OffsetDateTime now = OffsetDateTime.now();
        Match match = new Match();
        match.setId(matchId);
        match.setFighterBlueId(bout.fighterBlueId());
        match.setFighterRedId(bout.fighterRedId());
        match.setStatus(MatchStatus.OPEN);
        match.setCreatedAt(now);
        match.setUpdatedAt(now);
        Match saved = matchRepository.save(match);

        long stale = ledgerStore.openLedger(saved.getId());
        if (stale > 0) {
            log.warn("Dropped {} leftover ledger entries while opening match {}", stale, saved.getId());
        }
        broadcastThrottle.requestBroadcast();
        autoFinalizationScheduler.arm(saved.getId(), () -> finalizeAutomatically(saved.getId()));

        log.info("Opened match {} (blue {} vs red {})", saved.getId(), saved.getFighterBlueId(), saved.getFighterRedId());
        return saved;
    }

    /**
     * Resolve the winner of an open match, lock it and settle it.
     *
     * @param manualWinner fallback winner, or {@code null} to require an automatic result
     * @return the settled match
     */
    public Match endMatch(String matchId, Side manualWinner) {
        Match match = findMatch(matchId);
        if (match.getStatus() != MatchStatus.OPEN) {
            throw BettingException.alreadyConcluded(matchId);
        }

        Resolution resolution = resolveWinner(match, manualWinner);
        lockMatch(matchId, resolution);
        log.info("Locked match {} with winner {} (external bout {})",
                matchId, resolution.side(), resolution.externalId());

        ledgerStore.closeLedger(matchId);
        autoFinalizationScheduler.cancel(matchId);

        SettlementResult result = settlementService.settle(matchId);
        log.info("Ended match {}: {} stakes settled, {} staked", matchId, result.stakeCount(), result.totalStaked());
        return findMatch(matchId);
    }

    /**
     * Retry settlement of a match left locked by an earlier failure. Settled matches are returned as is.
     */
    public SettlementResult settleMatch(String matchId) {
        Match match = findMatch(matchId);
        if (match.getStatus() == MatchStatus.OPEN) {
            throw BettingException.matchNotLocked(matchId);
        }
        return settlementService.settle(matchId);
    }

    public Optional<Match> currentMatch() {
        return matchRepository.findTopByOrderByCreatedAtDesc();
    }

    public Match findMatch(String matchId) {
        return matchRepository.findById(matchId)
                .orElseThrow(() -> BettingException.matchNotFound(matchId));
    }

    void finalizeAutomatically(String matchId) {
        log.info("Auto-finalization timer fired for match {}", matchId);
        try {
            endMatch(matchId, null);
        } catch (BettingException ex) {
            if (ex.getError() == BettingError.ALREADY_CONCLUDED) {
                log.info("Match {} was concluded before its timer fired", matchId);
                return;
            }
            log.warn("Auto-finalization of match {} stopped: {} ({})", matchId, ex.getCode(), ex.getMessage());
        }
    }

    private Resolution resolveWinner(Match match, Side manualWinner) {
        Optional<Long> previousCursor = boutTracker.latestBoutId();

        Optional<MatchDataClient.ExternalBout> next = boutTracker.nextBoutAfterCursor();
        if (next.isPresent() && pairsWith(match, next.get())) {
            Side winner = sideOf(match, next.get().winnerId());
            boutTracker.moveCursorTo(next.get().id());
            return Resolution.external(next.get(), winner);
        }

        log.warn("Bout after the cursor does not belong to match {}, crawling most recent bout", match.getId());
        Optional<MatchDataClient.ExternalBout> mostRecent;
        try {
            mostRecent = boutTracker.crawlMostRecent();
        } catch (MatchDataUnavailableException ex) {
            if (manualWinner == null) {
                boutTracker.restoreCursor(previousCursor);
                throw ex;
            }
            log.warn("Bout history unavailable for match {}: {}", match.getId(), ex.getMessage());
            mostRecent = Optional.empty();
        }
        if (mostRecent.isPresent() && pairsWith(match, mostRecent.get())) {
            return Resolution.external(mostRecent.get(), sideOf(match, mostRecent.get().winnerId()));
        }

        if (manualWinner == null) {
            log.error("No recorded bout matches {} and no manual winner was given", match.getId());
            boutTracker.restoreCursor(previousCursor);
            throw BettingException.unresolvedWinner(match.getId());
        }
        log.warn("Using manually specified winner {} for match {}", manualWinner, match.getId());
        return Resolution.manual(manualWinner);
    }

    private boolean pairsWith(Match match, MatchDataClient.ExternalBout bout) {
        return BoutToken.samePairing(
                match.getId(),
                BoutToken.of(bout.fighterBlueId(), bout.fighterRedId(), bout.date())
        );
    }

    private Side sideOf(Match match, long winnerId) {
        if (match.getFighterRedId() != null && match.getFighterRedId() == winnerId) {
            return Side.RED;
        }
        if (match.getFighterBlueId() != null && match.getFighterBlueId() == winnerId) {
            return Side.BLUE;
        }
        log.error("Winner {} is neither fighter of match {}", winnerId, match.getId());
        throw BettingException.corruptWinnerMapping(match.getId(), winnerId);
    }

    private void lockMatch(String matchId, Resolution resolution) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                Match match = findMatch(matchId);
                if (match.getStatus() != MatchStatus.OPEN) {
                    throw BettingException.alreadyConcluded(matchId);
                }
                OffsetDateTime now = OffsetDateTime.now();
                match.setWinningSide(resolution.side());
                match.setExternalId(resolution.externalId());
                match.setStatus(MatchStatus.LOCKED);
                match.setLockedAt(now);
                match.setUpdatedAt(now);
                matchRepository.save(match);
            });
        } catch (OptimisticLockingFailureException ex) {
            log.warn("Match {} was locked concurrently", matchId);
            throw BettingException.alreadyConcluded(matchId);
        }
    }

    private record Resolution(Side side, Long externalId) {

        static Resolution external(MatchDataClient.ExternalBout bout, Side side) {
            return new Resolution(side, bout.id());
        }

        static Resolution manual(Side side) {
            return new Resolution(side, null);
        }
    }
}
