package com.saltbet.service;

import com.saltbet.model.Side;
import com.saltbet.model.Stake;
import com.saltbet.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Pari-mutuel payout over the stakes of one settled match.
 * Winners get their principal back plus a share of the losing pool proportional
 * to their own stake. When nobody backed the winning side every stake is
 * refunded and no statistics change.
 * <p>
 * Operates on the stake owners in place; persisting them is the caller's job.
 */
@Component
public class PayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(PayoutEngine.class);
    private static final int MONEY_SCALE = 2;

    public PayoutSummary distribute(List<Stake> stakes, Side winningSide) {
        List<Stake> winning = stakes.stream()
                .filter(stake -> stake.getSide() == winningSide)
                .toList();
        List<Stake> losing = stakes.stream()
                .filter(stake -> stake.getSide() != winningSide)
                .toList();

        BigDecimal winningPool = sum(winning);
        BigDecimal losingPool = sum(losing);
        OffsetDateTime now = OffsetDateTime.now();

        if (winning.isEmpty()) {
            log.info("No stakes on winning side {}, refunding {} stake(s)", winningSide, stakes.size());
            for (Stake stake : stakes) {
                User user = stake.getUser();
                user.setBalance(user.getBalance().add(stake.getAmount()));
                user.setUpdatedAt(now);
            }
            return new PayoutSummary(true, winningPool, losingPool, losingPool, 0, 0);
        }

        BigDecimal paidOut = BigDecimal.ZERO;
        for (Stake stake : winning) {
            BigDecimal share = shareOfLosingPool(stake.getAmount(), winningPool, losingPool);
            BigDecimal payout = stake.getAmount().add(share);

            User user = stake.getUser();
            user.setBalance(user.getBalance().add(payout));
            user.setTotalWins(user.getTotalWins() + 1);
            user.setTotalRevenueGained(user.getTotalRevenueGained().add(share));
            user.setUpdatedAt(now);
            paidOut = paidOut.add(payout);
            log.debug("Paid {} to winner {} (stake {})", payout, user.getId(), stake.getAmount());
        }

        for (Stake stake : losing) {
            User user = stake.getUser();
            user.setTotalLosses(user.getTotalLosses() + 1);
            user.setTotalRevenueLost(user.getTotalRevenueLost().add(stake.getAmount()));
            user.setUpdatedAt(now);
            log.debug("Recorded loss of {} for user {}", stake.getAmount(), user.getId());
        }

        return new PayoutSummary(false, winningPool, losingPool, paidOut, winning.size(), losing.size());
    }

    /**
     * {@code amount / winningPool * losingPool}, truncated to whole cents. Residual cents stay undistributed.
     */
    static BigDecimal shareOfLosingPool(BigDecimal amount, BigDecimal winningPool, BigDecimal losingPool) {
        if (winningPool.signum() == 0) {
            return BigDecimal.ZERO.setScale(MONEY_SCALE);
        }
        return amount.multiply(losingPool).divide(winningPool, MONEY_SCALE, RoundingMode.DOWN);
    }

    private BigDecimal sum(List<Stake> stakes) {
        return stakes.stream()
                .map(Stake::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public record PayoutSummary(
            boolean refunded,
            BigDecimal winningPool,
            BigDecimal losingPool,
            BigDecimal totalPaidOut,
            int winners,
            int losers
    ) {
    }
}
