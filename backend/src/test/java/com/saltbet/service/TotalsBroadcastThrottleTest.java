package com.saltbet.service;

import com.saltbet.config.SaltbetProperties;
import com.saltbet.model.SideTotals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.scheduling.TaskScheduler;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TotalsBroadcastThrottleTest {

    private static final Instant START = Instant.parse("2026-10-19T20:00:00Z");

    private TaskScheduler taskScheduler;
    private RedisStakeLedgerStore ledgerStore;
    private MutableClock clock;
    private List<SideTotals> received;
    private TotalsBroadcastThrottle throttle;

    @BeforeEach
    void setUp() {
        taskScheduler = Mockito.mock(TaskScheduler.class);
        ledgerStore = Mockito.mock(RedisStakeLedgerStore.class);
        clock = new MutableClock(START);
        when(taskScheduler.getClock()).thenReturn(clock);
        doReturn(Mockito.mock(ScheduledFuture.class))
                .when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        received = new ArrayList<>();
        throttle = new TotalsBroadcastThrottle(
                ledgerStore,
                taskScheduler,
                new SaltbetProperties(),
                List.of(received::add)
        );
    }

    @Test
    void burstOfRequestsCollapsesIntoOneBroadcastOfTheFinalTotals() {
        for (int i = 0; i < 10; i++) {
            throttle.requestBroadcast();
        }
        when(ledgerStore.readSideTotals()).thenReturn(totals("10.00", "4.50"));

        ArgumentCaptor<Runnable> firing = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler, times(1)).schedule(firing.capture(), any(Instant.class));
        firing.getValue().run();

        assertEquals(List.of(totals("10.00", "4.50")), received);
    }

    @Test
    void firstRequestFiresImmediately() {
        throttle.requestBroadcast();

        verify(taskScheduler).schedule(any(Runnable.class), Mockito.eq(START));
    }

    @Test
    void requestInsideTheWindowIsDeferredToTheWindowBoundary() {
        when(ledgerStore.readSideTotals()).thenReturn(totals("1.00", "0.00"));
        throttle.requestBroadcast();
        throttle.fire();

        clock.advanceMillis(30);
        throttle.requestBroadcast();

        verify(taskScheduler).schedule(any(Runnable.class), Mockito.eq(START.plusMillis(100)));
    }

    @Test
    void requestAfterTheWindowFiresImmediately() {
        when(ledgerStore.readSideTotals()).thenReturn(totals("1.00", "0.00"));
        throttle.requestBroadcast();
        throttle.fire();

        clock.advanceMillis(250);
        throttle.requestBroadcast();

        verify(taskScheduler).schedule(any(Runnable.class), Mockito.eq(START.plusMillis(250)));
    }

    @Test
    void firingWithUnchangedTotalsIsSkipped() {
        when(ledgerStore.readSideTotals()).thenReturn(totals("2.00", "3.00"));

        throttle.fire();
        throttle.fire();

        assertEquals(1, received.size());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        List<SideTotals> second = new ArrayList<>();
        throttle = new TotalsBroadcastThrottle(
                ledgerStore,
                taskScheduler,
                new SaltbetProperties(),
                List.of(
                        totals -> {
                            throw new IllegalStateException("subscriber gone");
                        },
                        second::add
                )
        );
        when(ledgerStore.readSideTotals()).thenReturn(totals("0.05", "0.00"));

        throttle.fire();

        assertEquals(1, second.size());
    }

    private SideTotals totals(String red, String blue) {
        return new SideTotals(new BigDecimal(red), new BigDecimal(blue));
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advanceMillis(long millis) {
            now = now.plusMillis(millis);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
