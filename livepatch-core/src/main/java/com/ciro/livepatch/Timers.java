package com.ciro.livepatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Intervalos y timeouts para el trabajo en background que produce patches.
 */
public class Timers {

    private static final Logger log = LoggerFactory.getLogger(Timers.class);

    private final ScheduledExecutorService scheduler;

    public Timers(ScheduledExecutorService scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Ejecuta {@code task} cada {@code periodMs} (primera vez tras un periodo) hasta que
     * se pare el handle. Una excepción de la tarea se loguea y no corta el intervalo.
     */
    public TimerHandle interval(long periodMs, Runnable task) {
        TimerHandle handle = new TimerHandle();
        handle.bind(scheduler.scheduleAtFixedRate(() -> {
            if (handle.isStopped()) return;
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("Interval task failed", e);
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS));
        return handle;
    }

    /** Ejecuta {@code task} una vez tras {@code delayMs}, salvo que se pare antes. */
    public TimerHandle timeout(long delayMs, Runnable task) {
        TimerHandle handle = new TimerHandle();
        handle.bind(scheduler.schedule(() -> {
            if (!handle.stop()) return;
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("Timeout task failed", e);
            }
        }, delayMs, TimeUnit.MILLISECONDS));
        return handle;
    }
}
