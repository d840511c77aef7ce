package com.ciro.livepatch;

import com.ciro.livepatch.json.ObjectMapperFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TimersTest {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final Timers timers = new Timers(scheduler);

    @AfterEach
    void shutdown() {
        scheduler.shutdownNow();
    }

    @Test
    void intervalKeepsTickingUntilTheClientReportsTheTargetGone() throws Exception {
        PatchDispatcher dispatcher = new PatchDispatcher(new SessionRegistry(ObjectMapperFactory.create()));
        PatchContext ctx = new PatchContext("s1", dispatcher);
        PatchTarget clock = PatchTarget.generate().replace();

        AtomicInteger ticks = new AtomicInteger();
        CountDownLatch three = new CountDownLatch(3);
        TimerHandle[] handle = new TimerHandle[1];
        handle[0] = timers.interval(20, () -> {
            ctx.patch(clock, "tick " + ticks.incrementAndGet(), handle[0]);
            three.countDown();
        });
        assertTrue(three.await(2, TimeUnit.SECONDS));

        assertTrue(dispatcher.notifyInvalid("s1", clock.id()));
        assertTrue(handle[0].isStopped());
        assertFalse(handle[0].stop(), "second stop is a no-op");

        int after = ticks.get();
        Thread.sleep(100);
        assertTrue(ticks.get() <= after + 1, "at most one tick already in flight");
    }

    @Test
    void intervalSurvivesAFailingTask() throws Exception {
        CountDownLatch twice = new CountDownLatch(2);
        TimerHandle h = timers.interval(10, () -> {
            twice.countDown();
            throw new IllegalStateException("boom");
        });
        assertTrue(twice.await(2, TimeUnit.SECONDS));
        h.stop();
    }

    @Test
    void timeoutRunsOnce() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        TimerHandle h = timers.timeout(10, ran::countDown);
        assertTrue(ran.await(2, TimeUnit.SECONDS));
        assertTrue(h.isStopped());
        assertFalse(h.stop());
    }

    @Test
    void stoppedTimeoutNeverRuns() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        TimerHandle h = timers.timeout(50, runs::incrementAndGet);
        assertTrue(h.stop());
        Thread.sleep(120);
        assertEquals(0, runs.get());
    }
}
