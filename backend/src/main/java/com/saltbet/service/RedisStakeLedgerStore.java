package com.saltbet.service;

import com.saltbet.config.SaltbetProperties;
import com.saltbet.model.ActiveStake;
import com.saltbet.model.Side;
import com.saltbet.model.SideTotals;
import com.saltbet.web.LedgerStoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Ephemeral ledger of open stakes for the current match, kept in Redis.
 * <p>
 * Every mutation runs as a single Lua script so that reading the previous
 * reservation, writing the new one and adjusting the side totals are one
 * indivisible step. Amounts are stored as integer cents.
 */
@Service
public class RedisStakeLedgerStore {

    private static final Logger log = LoggerFactory.getLogger(RedisStakeLedgerStore.class);
    private static final String FIELD_AMOUNT = "amount";
    private static final String FIELD_SIDE = "color";

    private final StringRedisTemplate stringRedisTemplate;
    private final SaltbetProperties saltbetProperties;
    private final RedisScript<String> placeStakeScript;
    private final RedisScript<String> cancelStakeScript;
    private final RedisScript<Long> openLedgerScript;
    private final RedisScript<Long> closeLedgerScript;
    private final RedisScript<Long> clearLedgerScript;

    public RedisStakeLedgerStore(
            StringRedisTemplate stringRedisTemplate,
            SaltbetProperties saltbetProperties,
            @Qualifier("placeStakeScript") RedisScript<String> placeStakeScript,
            @Qualifier("cancelStakeScript") RedisScript<String> cancelStakeScript,
            @Qualifier("openLedgerScript") RedisScript<Long> openLedgerScript,
            @Qualifier("closeLedgerScript") RedisScript<Long> closeLedgerScript,
            @Qualifier("clearLedgerScript") RedisScript<Long> clearLedgerScript
    ) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.saltbetProperties = saltbetProperties;
        this.placeStakeScript = placeStakeScript;
        this.cancelStakeScript = cancelStakeScript;
        this.openLedgerScript = openLedgerScript;
        this.closeLedgerScript = closeLedgerScript;
        this.clearLedgerScript = clearLedgerScript;
    }

    public LedgerOutcome atomicPlace(String matchId, UUID userId, BigDecimal amount, Side side, BigDecimal balance) {
        String result = call("place stake", () -> stringRedisTemplate.execute(
                placeStakeScript,
                mutationKeys(userId),
                matchId,
                userId.toString(),
                Long.toString(toCents(amount)),
                side.name(),
                Long.toString(toCents(balance.setScale(2, RoundingMode.DOWN)))
        ));
        return LedgerOutcome.fromToken(result);
    }

    public LedgerOutcome atomicCancel(String matchId, UUID userId, BigDecimal amount) {
        String result = call("cancel stake", () -> stringRedisTemplate.execute(
                cancelStakeScript,
                mutationKeys(userId),
                matchId,
                userId.toString(),
                Long.toString(toCents(amount))
        ));
        return LedgerOutcome.fromToken(result);
    }

    /**
     * Reads both side totals. The two values are read separately; each is exact on its own.
     */
    public SideTotals readSideTotals() {
        String red = call("read totals", () -> stringRedisTemplate.opsForValue().get(totalKey(Side.RED)));
        String blue = call("read totals", () -> stringRedisTemplate.opsForValue().get(totalKey(Side.BLUE)));
        return new SideTotals(fromCents(red), fromCents(blue));
    }

    public Optional<ActiveStake> readActiveStake(UUID userId) {
        Map<Object, Object> fields = call(
                "read stake",
                () -> stringRedisTemplate.opsForHash().entries(userKey(userId.toString()))
        );
        return toActiveStake(userId, fields);
    }

    /**
     * Arms the ledger for {@code matchId}. Entries left over from an earlier match are dropped.
     *
     * @return number of stale entries removed
     */
    public long openLedger(String matchId) {
        SaltbetProperties.Ledger ledger = saltbetProperties.getLedger();
        Long stale = call("open ledger", () -> stringRedisTemplate.execute(
                openLedgerScript,
                List.of(ledger.getGuardKey(), ledger.getIndexKey(), totalKey(Side.RED), totalKey(Side.BLUE)),
                matchId,
                ledger.getUserKeyPrefix()
        ));
        return stale == null ? 0L : stale;
    }

    /**
     * Stops accepting placements and cancellations for {@code matchId}.
     *
     * @return true if the ledger was open for that match
     */
    public boolean closeLedger(String matchId) {
        Long closed = call("close ledger", () -> stringRedisTemplate.execute(
                closeLedgerScript,
                List.of(saltbetProperties.getLedger().getGuardKey()),
                matchId
        ));
        return closed != null && closed == 1L;
    }

    public Optional<String> openMatchId() {
        return Optional.ofNullable(call(
                "read guard",
                () -> stringRedisTemplate.opsForValue().get(saltbetProperties.getLedger().getGuardKey())
        ));
    }

    /**
     * Lists every entry currently held in the ledger.
     */
    public List<ActiveStake> snapshotEntries() {
        Set<String> userIds = call(
                "snapshot ledger",
                () -> stringRedisTemplate.opsForSet().members(saltbetProperties.getLedger().getIndexKey())
        );
        if (userIds == null || userIds.isEmpty()) {
            return List.of();
        }
        List<ActiveStake> entries = new ArrayList<>(userIds.size());
        for (String userId : userIds) {
            UUID id = UUID.fromString(userId);
            Map<Object, Object> fields = call(
                    "snapshot ledger",
                    () -> stringRedisTemplate.opsForHash().entries(userKey(userId))
            );
            Optional<ActiveStake> entry = toActiveStake(id, fields);
            if (entry.isPresent()) {
                entries.add(entry.get());
            } else {
                log.warn("Ledger index references user {} without an entry", userId);
            }
        }
        return entries;
    }

    /**
     * Deletes the given entries and resets both side totals to zero.
     */
    public void clear(Collection<ActiveStake> entries) {
        SaltbetProperties.Ledger ledger = saltbetProperties.getLedger();
        List<String> args = new ArrayList<>(entries.size() + 1);
        args.add(ledger.getUserKeyPrefix());
        entries.forEach(entry -> args.add(entry.userId().toString()));
        call("clear ledger", () -> stringRedisTemplate.execute(
                clearLedgerScript,
                List.of(ledger.getIndexKey(), totalKey(Side.RED), totalKey(Side.BLUE)),
                args.toArray()
        ));
    }

    static long toCents(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.UNNECESSARY).unscaledValue().longValueExact();
    }

    static BigDecimal fromCents(String cents) {
        if (cents == null || cents.isBlank()) {
            return BigDecimal.ZERO.setScale(2);
        }
        return BigDecimal.valueOf(Long.parseLong(cents.trim()), 2);
    }

    private Optional<ActiveStake> toActiveStake(UUID userId, Map<Object, Object> fields) {
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        Object amount = fields.get(FIELD_AMOUNT);
        Object side = fields.get(FIELD_SIDE);
        if (amount == null || side == null) {
            return Optional.empty();
        }
        return Optional.of(new ActiveStake(userId, fromCents(amount.toString()), Side.valueOf(side.toString())));
    }

    private List<String> mutationKeys(UUID userId) {
        SaltbetProperties.Ledger ledger = saltbetProperties.getLedger();
        return List.of(
                ledger.getGuardKey(),
                userKey(userId.toString()),
                ledger.getIndexKey(),
                totalKey(Side.RED),
                totalKey(Side.BLUE)
        );
    }

    private String userKey(String userId) {
        return saltbetProperties.getLedger().getUserKeyPrefix() + userId;
    }

    private String totalKey(Side side) {
        return saltbetProperties.getLedger().getTotalKeyPrefix() + side.name();
    }

    private <T> T call(String operation, Supplier<T> command) {
        try {
            return command.get();
        } catch (DataAccessException ex) {
            throw new LedgerStoreUnavailableException("Ledger store failed to " + operation, ex);
        }
    }

    /**
     * Result tokens returned by the ledger scripts.
     */
    public enum LedgerOutcome {
        OK,
        MATCH_CLOSED,
        INSUFFICIENT_FUNDS,
        NO_BET,
        INSUFFICIENT_BET;

        static LedgerOutcome fromToken(String token) {
            if (token == null) {
                throw new LedgerStoreUnavailableException("Ledger script returned no result", null);
            }
            try {
                return LedgerOutcome.valueOf(token);
            } catch (IllegalArgumentException ex) {
                throw new IllegalStateException("Unexpected ledger script result: " + token, ex);
            }
        }
    }
}
