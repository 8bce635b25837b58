package com.saltbet.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Lua scripts backing the atomic ledger operations.
 */
@Configuration
public class LedgerScriptConfig {

    private static final String SCRIPT_LOCATION = "scripts/redis/";

    @Bean
    public RedisScript<String> placeStakeScript() {
        return RedisScript.of(new ClassPathResource(SCRIPT_LOCATION + "place_stake.lua"), String.class);
    }

    @Bean
    public RedisScript<String> cancelStakeScript() {
        return RedisScript.of(new ClassPathResource(SCRIPT_LOCATION + "cancel_stake.lua"), String.class);
    }

    @Bean
    public RedisScript<Long> openLedgerScript() {
        return RedisScript.of(new ClassPathResource(SCRIPT_LOCATION + "open_ledger.lua"), Long.class);
    }

    @Bean
    public RedisScript<Long> closeLedgerScript() {
        return RedisScript.of(new ClassPathResource(SCRIPT_LOCATION + "close_ledger.lua"), Long.class);
    }

    @Bean
    public RedisScript<Long> clearLedgerScript() {
        return RedisScript.of(new ClassPathResource(SCRIPT_LOCATION + "clear_ledger.lua"), Long.class);
    }
}
