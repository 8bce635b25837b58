package com.saltbet.service;

import java.util.Optional;

/**
 * Read access to the external source of live bouts and their results.
 * Failures surface as {@link com.saltbet.web.MatchDataUnavailableException}; callers decide whether to retry.
 */
public interface MatchDataClient {

    /**
     * The bout currently being fought.
     *
     * @return fighter ids and the freshness marker of the live bout
     */
    CurrentBout getCurrentBout();

    /**
     * A concluded bout by its external sequence id.
     *
     * @param boutId external bout id
     * @return the bout, or empty if the source does not know it yet
     */
    Optional<ExternalBout> getBout(long boutId);

    /**
     * The most recently recorded bout in the source's full history.
     */
    Optional<ExternalBout> getMostRecentBout();

    Fighter getFighter(long fighterId);

    record CurrentBout(
            long fighterBlueId,
            long fighterRedId,
            String freshnessToken
    ) {}

    record ExternalBout(
            long id,
            long fighterBlueId,
            long fighterRedId,
            long winnerId,
            String date
    ) {}

    record Fighter(
            long id,
            String name,
            String tier,
            Integer elo,
            Integer tierElo,
            Integer bestStreak
    ) {}
}
