package com.ciro.livepatch;

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle de un timer de {@link Timers}. Es un {@link Runnable} para poder pasarlo tal cual
 * como cleanup de un patch: quien llegue primero (el código o el cliente) lo para, y la
 * segunda llamada no hace nada.
 */
public final class TimerHandle implements Runnable {

    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile Future<?> future;

    TimerHandle() {}

    void bind(Future<?> f) {
        this.future = f;
        if (stopped.get()) f.cancel(false);
    }

    /** @return true si esta llamada fue la que paró el timer */
    public boolean stop() {
        if (!stopped.compareAndSet(false, true)) return false;
        Future<?> f = future;
        if (f != null) f.cancel(false);
        return true;
    }

    public boolean isStopped() {
        return stopped.get();
    }

    @Override
    public void run() {
        stop();
    }
}
