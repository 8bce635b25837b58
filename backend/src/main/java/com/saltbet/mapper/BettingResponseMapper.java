package com.saltbet.mapper;

import com.saltbet.dto.MatchResponses;
import com.saltbet.dto.StakeResponses;
import com.saltbet.dto.UserResponse;
import com.saltbet.model.ActiveStake;
import com.saltbet.model.Match;
import com.saltbet.model.SideTotals;
import com.saltbet.model.Stake;
import com.saltbet.model.User;
import com.saltbet.service.MatchDataClient;
import com.saltbet.service.SettlementResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Component
public class BettingResponseMapper {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    public MatchResponses.MatchSummary toMatchSummary(Match match) {
        return new MatchResponses.MatchSummary(
                match.getId(),
                match.getFighterBlueId(),
                match.getFighterRedId(),
                match.getStatus(),
                match.getWinningSide(),
                match.getExternalId(),
                match.getCreatedAt()
        );
    }

    public MatchResponses.MatchDetail toMatchDetail(Match match, SideTotals durableTotals, long participants) {
        return new MatchResponses.MatchDetail(
                match.getId(),
                match.getFighterBlueId(),
                match.getFighterRedId(),
                match.getStatus(),
                match.getWinningSide(),
                match.getExternalId(),
                durableTotals.red(),
                durableTotals.blue(),
                participants,
                match.getLockedAt(),
                match.getSettledAt(),
                match.getCreatedAt(),
                match.getUpdatedAt()
        );
    }

    public MatchResponses.MatchFighters toMatchFighters(
            Match match,
            MatchDataClient.Fighter blue,
            MatchDataClient.Fighter red
    ) {
        return new MatchResponses.MatchFighters(match.getId(), toFighterSummary(blue), toFighterSummary(red));
    }

    public MatchResponses.SettlementSummary toSettlementSummary(SettlementResult result) {
        return new MatchResponses.SettlementSummary(
                result.matchId(),
                result.winningSide(),
                result.stakeCount(),
                result.totalStaked(),
                result.refunded(),
                result.alreadySettled()
        );
    }

    public StakeResponses.StakeSummary toStakeSummary(Stake stake) {
        if (stake == null) {
            return null;
        }
        Match match = stake.getMatch();
        return new StakeResponses.StakeSummary(
                stake.getId(),
                match != null ? match.getId() : null,
                stake.getAmount(),
                stake.getSide(),
                match != null ? match.getWinningSide() : null,
                stake.getCreatedAt()
        );
    }

    public StakeResponses.OpenStake toOpenStake(ActiveStake activeStake) {
        if (activeStake == null) {
            return null;
        }
        return new StakeResponses.OpenStake(activeStake.amount(), activeStake.side());
    }

    /**
     * Win percentage is wins over settled stakes, as a percentage with two decimals.
     * Gross revenue is revenue gained minus revenue lost.
     */
    public UserResponse toUserResponse(User user) {
        int wins = user.getTotalWins() != null ? user.getTotalWins() : 0;
        int losses = user.getTotalLosses() != null ? user.getTotalLosses() : 0;
        BigDecimal winPercentage = wins + losses == 0
                ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(wins)
                        .multiply(ONE_HUNDRED)
                        .divide(BigDecimal.valueOf(wins + losses), 2, RoundingMode.HALF_UP);
        return new UserResponse(
                user.getId(),
                user.getUsername(),
                user.getBalance(),
                wins,
                losses,
                winPercentage,
                user.getTotalRevenueGained(),
                user.getTotalRevenueLost(),
                user.getTotalRevenueGained().subtract(user.getTotalRevenueLost()),
                user.getCreatedAt()
        );
    }

    private MatchResponses.FighterSummary toFighterSummary(MatchDataClient.Fighter fighter) {
        return new MatchResponses.FighterSummary(
                fighter.id(),
                fighter.name(),
                fighter.tier(),
                fighter.elo(),
                fighter.tierElo(),
                fighter.bestStreak()
        );
    }
}
