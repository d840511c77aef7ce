package com.ciro.livepatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Acción de limpieza de un solo uso (p. ej. parar un timer cuyo nodo ya no existe).
 *
 * <p>{@link #run()} ejecuta la acción como mucho una vez, aunque la llamen varios hilos.
 */
public final class CleanupAction {

    private static final Logger log = LoggerFactory.getLogger(CleanupAction.class);

    private final AtomicReference<Runnable> action;

    private CleanupAction(Runnable action) {
        this.action = new AtomicReference<>(Objects.requireNonNull(action, "action"));
    }

    public static CleanupAction of(Runnable action) {
        return new CleanupAction(action);
    }

    /**
     * @return true si esta llamada fue la que ejecutó la acción
     */
    public boolean run() {
        Runnable r = action.getAndSet(null);
        if (r == null) return false;
        try {
            r.run();
        } catch (RuntimeException e) {
            log.warn("Cleanup action failed", e);
        }
        return true;
    }

    /** Descarta la acción sin ejecutarla (fue reemplazada por otra). */
    boolean discard() {
        return action.getAndSet(null) != null;
    }

    public boolean isSpent() {
        return action.get() == null;
    }
}
