package com.saltbet.service;

import com.saltbet.config.SaltbetProperties;
import com.saltbet.model.SideTotals;
import com.saltbet.web.LedgerStoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

/**
 * Coalesces bursts of ledger mutations into at most one totals broadcast per window.
 * <p>
 * A request made while a firing is pending is absorbed by it. Otherwise a firing is
 * scheduled immediately, or at the end of the current window if the last broadcast
 * was less than a window ago. The totals are read when the firing runs, so a burst
 * always ends with the latest values. A firing whose totals equal the last ones sent
 * is skipped.
 */
@Service
public class TotalsBroadcastThrottle {

    private static final Logger log = LoggerFactory.getLogger(TotalsBroadcastThrottle.class);

    private final RedisStakeLedgerStore ledgerStore;
    private final TaskScheduler taskScheduler;
    private final SaltbetProperties saltbetProperties;
    private final List<TotalsListener> listeners = new CopyOnWriteArrayList<>();
    private final Object monitor = new Object();

    private ScheduledFuture<?> pendingFiring;
    private Instant lastBroadcastAt;
    private SideTotals lastBroadcastTotals;

    public TotalsBroadcastThrottle(
            RedisStakeLedgerStore ledgerStore,
            TaskScheduler taskScheduler,
            SaltbetProperties saltbetProperties,
            List<TotalsListener> listeners
    ) {
        this.ledgerStore = ledgerStore;
        this.taskScheduler = taskScheduler;
        this.saltbetProperties = saltbetProperties;
        this.listeners.addAll(listeners);
    }

    public void addListener(TotalsListener listener) {
        listeners.add(listener);
    }

    /**
     * Asks for the current totals to be broadcast. Never blocks and never throws.
     */
    public void requestBroadcast() {
        synchronized (monitor) {
            if (pendingFiring != null) {
                return;
            }
            Instant now = taskScheduler.getClock().instant();
            Instant fireAt = now;
            if (lastBroadcastAt != null) {
                Instant windowEnd = lastBroadcastAt.plusMillis(resolveWindowMs());
                if (windowEnd.isAfter(now)) {
                    fireAt = windowEnd;
                }
            }
            try {
                pendingFiring = taskScheduler.schedule(this::fire, fireAt);
            } catch (TaskRejectedException ex) {
                log.warn("Totals broadcast could not be scheduled: {}", ex.getMessage());
            }
        }
    }

    void fire() {
        synchronized (monitor) {
            pendingFiring = null;
            lastBroadcastAt = taskScheduler.getClock().instant();
        }

        SideTotals totals;
        try {
            totals = ledgerStore.readSideTotals();
        } catch (LedgerStoreUnavailableException ex) {
            log.warn("Skipping totals broadcast, ledger unavailable: {}", ex.getMessage());
            return;
        }

        synchronized (monitor) {
            if (totals.equals(lastBroadcastTotals)) {
                log.debug("Totals unchanged since last broadcast, skipping");
                return;
            }
            lastBroadcastTotals = totals;
        }

        log.debug("Broadcasting totals red={} blue={} to {} listener(s)", totals.red(), totals.blue(), listeners.size());
        for (TotalsListener listener : listeners) {
            try {
                listener.onTotals(totals);
            } catch (RuntimeException ex) {
                log.warn("Totals listener {} failed", listener.getClass().getSimpleName(), ex);
            }
        }
    }

    private long resolveWindowMs() {
        return Math.max(0L, saltbetProperties.getBroadcast().getWindowMs());
    }
}
