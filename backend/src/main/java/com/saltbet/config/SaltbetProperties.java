package com.saltbet.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Runtime settings for the betting ledger, the totals broadcast, the match
 * auto-finalization timer and the external match-data source.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "saltbet")
public class SaltbetProperties {

    private Ledger ledger = new Ledger();
    private Broadcast broadcast = new Broadcast();
    private Finalization finalization = new Finalization();
    private MatchData matchData = new MatchData();

    @Getter
    @Setter
    public static class Ledger {
        /**
         * Smallest stake step; every placed or cancelled amount must be a multiple of it.
         */
        private BigDecimal minimumIncrement = new BigDecimal("0.05");
        private String userKeyPrefix = "bet:active:user:";
        private String totalKeyPrefix = "bet:active:total:";
        private String indexKey = "bet:active:users";
        private String guardKey = "bet:active:match";
        private String latestBoutKey = "match:latest:id";
    }

    @Getter
    @Setter
    public static class Broadcast {
        private long windowMs = 100;
    }

    @Getter
    @Setter
    public static class Finalization {
        private boolean enabled = true;
        private long delaySeconds = 45;
    }

    @Getter
    @Setter
    public static class MatchData {
        /**
         * {@code http} talks to the external match API, {@code mock} serves a fixed bout sequence.
         */
        private String mode = "http";
        private String baseUrl = "https://salty-boy.com/api";
        private int pageSize = 100;
        private int connectTimeoutMs = 3_000;
        private int readTimeoutMs = 5_000;
    }
}
