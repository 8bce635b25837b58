package com.saltbet.config;

import com.saltbet.model.SideTotals;
import com.saltbet.service.RedisStakeLedgerStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class LedgerStoreHealthIndicator implements HealthIndicator {

    private final RedisStakeLedgerStore ledgerStore;

    public LedgerStoreHealthIndicator(RedisStakeLedgerStore ledgerStore) {
        this.ledgerStore = ledgerStore;
    }

    @Override
    public Health health() {
        try {
            SideTotals totals = ledgerStore.readSideTotals();
            return Health.up()
                    .withDetail("openMatch", ledgerStore.openMatchId().orElse("none"))
                    .withDetail("totalRed", totals.red())
                    .withDetail("totalBlue", totals.blue())
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withException(e)
                    .build();
        }
    }
}
