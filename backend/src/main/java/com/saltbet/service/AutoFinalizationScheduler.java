package com.saltbet.service;

import com.saltbet.config.SaltbetProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * One-shot timers that end a match automatically when no operator has done so in time.
 * At most one timer is pending per match; arming again replaces it.
 */
@Service
@RequiredArgsConstructor
public class AutoFinalizationScheduler {

    private static final Logger log = LoggerFactory.getLogger(AutoFinalizationScheduler.class);

    private final TaskScheduler taskScheduler;
    private final SaltbetProperties saltbetProperties;
    private final Map<String, ScheduledFuture<?>> pendingTimers = new ConcurrentHashMap<>();

    /**
     * @return true if a timer was scheduled, false when auto-finalization is disabled
     */
    public boolean arm(String matchId, Runnable finalization) {
        SaltbetProperties.Finalization config = saltbetProperties.getFinalization();
        if (!config.isEnabled()) {
            log.debug("Auto-finalization disabled, not arming timer for match {}", matchId);
            return false;
        }

        Instant fireAt = taskScheduler.getClock().instant().plusSeconds(Math.max(0L, config.getDelaySeconds()));
        pendingTimers.compute(matchId, (id, existing) -> {
            if (existing != null) {
                existing.cancel(false);
                log.debug("Replacing pending auto-finalization timer for match {}", id);
            }
            FinalizationTask task = new FinalizationTask(id, finalization);
            ScheduledFuture<?> future = taskScheduler.schedule(task, fireAt);
            task.future = future;
            return future;
        });
        log.info("Armed auto-finalization for match {} at {}", matchId, fireAt);
        return true;
    }

    public boolean cancel(String matchId) {
        ScheduledFuture<?> future = pendingTimers.remove(matchId);
        if (future == null) {
            return false;
        }
        future.cancel(false);
        log.debug("Cancelled auto-finalization timer for match {}", matchId);
        return true;
    }

    public boolean isArmed(String matchId) {
        return pendingTimers.containsKey(matchId);
    }

    public int pendingCount() {
        return pendingTimers.size();
    }

    @PreDestroy
    void cancelAll() {
        pendingTimers.forEach((matchId, future) -> future.cancel(false));
        pendingTimers.clear();
    }

    private final class FinalizationTask implements Runnable {

        private final String matchId;
        private final Runnable finalization;
        private volatile ScheduledFuture<?> future;

        private FinalizationTask(String matchId, Runnable finalization) {
            this.matchId = matchId;
            this.finalization = finalization;
        }

        @Override
        public void run() {
            pendingTimers.computeIfPresent(matchId, (id, current) -> current == future ? null : current);
            try {
                finalization.run();
            } catch (RuntimeException ex) {
                log.error("Auto-finalization of match {} failed", matchId, ex);
            }
        }
    }
}
