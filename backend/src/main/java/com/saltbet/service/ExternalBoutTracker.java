package com.saltbet.service;

import com.saltbet.config.SaltbetProperties;
import com.saltbet.web.LedgerStoreUnavailableException;
import com.saltbet.web.MatchDataUnavailableException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Follows the external bout sequence with a cursor holding the id of the last
 * bout used to resolve a match.
 */
@Service
@RequiredArgsConstructor
public class ExternalBoutTracker {

    private static final Logger log = LoggerFactory.getLogger(ExternalBoutTracker.class);

    private final MatchDataClient matchDataClient;
    private final StringRedisTemplate stringRedisTemplate;
    private final SaltbetProperties saltbetProperties;

    public Optional<Long> latestBoutId() {
        String value;
        try {
            value = stringRedisTemplate.opsForValue().get(resolveCursorKey());
        } catch (DataAccessException ex) {
            throw new LedgerStoreUnavailableException("Failed to read latest bout cursor", ex);
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException ex) {
            log.warn("Ignoring malformed latest bout cursor '{}'", value);
            return Optional.empty();
        }
    }

    public void moveCursorTo(long boutId) {
        log.debug("Setting latest bout cursor to {}", boutId);
        try {
            stringRedisTemplate.opsForValue().set(resolveCursorKey(), Long.toString(boutId));
        } catch (DataAccessException ex) {
            throw new LedgerStoreUnavailableException("Failed to write latest bout cursor", ex);
        }
    }

    /**
     * Puts the cursor back to a value read earlier. An absent value clears it.
     */
    public void restoreCursor(Optional<Long> previous) {
        if (previous.isPresent()) {
            moveCursorTo(previous.get());
            return;
        }
        try {
            stringRedisTemplate.delete(resolveCursorKey());
        } catch (DataAccessException ex) {
            throw new LedgerStoreUnavailableException("Failed to clear latest bout cursor", ex);
        }
    }

    /**
     * The bout following the cursor. When no cursor exists yet the most recent
     * bout is crawled first to seed it.
     *
     * @return the next bout, or empty if the source has not recorded it or could not be reached
     */
    public Optional<MatchDataClient.ExternalBout> nextBoutAfterCursor() {
        try {
            Optional<Long> latest = latestBoutId();
            if (latest.isEmpty()) {
                log.warn("No latest bout cursor found, crawling most recent bout");
                latest = crawlMostRecent().map(MatchDataClient.ExternalBout::id);
            }
            if (latest.isEmpty()) {
                return Optional.empty();
            }
            long nextId = latest.get() + 1;
            log.debug("Fetching bout {}", nextId);
            return matchDataClient.getBout(nextId);
        } catch (MatchDataUnavailableException ex) {
            log.warn("Next bout could not be fetched: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Re-polls the full bout history and moves the cursor to the newest entry.
     */
    public Optional<MatchDataClient.ExternalBout> crawlMostRecent() {
        Optional<MatchDataClient.ExternalBout> mostRecent = matchDataClient.getMostRecentBout();
        mostRecent.ifPresent(bout -> {
            log.debug("Most recent bout is {} ({}-{})", bout.id(), bout.fighterBlueId(), bout.fighterRedId());
            moveCursorTo(bout.id());
        });
        return mostRecent;
    }

    private String resolveCursorKey() {
        String key = saltbetProperties.getLedger().getLatestBoutKey();
        if (key == null || key.isBlank()) {
            throw new IllegalStateException("saltbet.ledger.latest-bout-key must not be blank");
        }
        return key.trim();
    }
}
