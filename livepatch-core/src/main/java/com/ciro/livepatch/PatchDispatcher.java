package com.ciro.livepatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Punto de entrada para el código de aplicación: "aplica este patch en esta sesión".
 *
 * <p>Intenta entregar en caliente por las conexiones abiertas; si no hay ninguna, el
 * patch espera en la cola hasta el próximo poll (o hasta que se abra un socket).
 * Nada de lo que pasa aquí debe hacer fallar la petición que produjo el patch.
 *
 * <p>Thread-safe. Los push de una misma sesión se serializan con un lock propio de la
 * sesión para que un snapshot viejo no llegue después de uno nuevo. Quien no consigue el
 * lock no espera: su patch queda en la cola y lo entrega el que lo tiene. Un socket trabado
 * sólo demora a su propia sesión.
 */
public class PatchDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PatchDispatcher.class);

    private final SessionRegistry registry;
    private final PatchQueue queue;
    private final Map<String, ReentrantLock> pushLocks = new ConcurrentHashMap<>();

    public PatchDispatcher(SessionRegistry registry) {
        this(registry, new PatchQueue());
    }

    public PatchDispatcher(SessionRegistry registry, PatchQueue queue) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.queue = Objects.requireNonNull(queue, "queue");
    }

    public SessionRegistry registry() {
        return registry;
    }

    public PatchQueue queue() {
        return queue;
    }

    public void queuePatch(String sessionId, Patch patch) {
        queuePatch(sessionId, patch, null);
    }

    /**
     * Encola y, si se puede, entrega inmediatamente.
     *
     * <p>Sin sesión o sin target no hay adónde entregar: el cleanup (si hay) se ejecuta
     * ya mismo y el patch se descarta.
     */
    public void queuePatch(String sessionId, Patch patch, Runnable cleanup) {
        CleanupAction action = cleanup == null ? null : CleanupAction.of(cleanup);

        if (sessionId == null || sessionId.isEmpty() || patch == null || !patch.hasTarget()) {
            log.trace("Patch without session/target discarded (session={})", sessionId);
            if (action != null) action.run();
            return;
        }

        queue.enqueue(sessionId, patch, action);
        pushPending(sessionId);
    }

    /**
     * Vacía la cola por las conexiones abiertas de la sesión.
     *
     * <p>Si otro hilo ya está empujando para esta sesión, vuelve enseguida: ese hilo
     * vuelve a mirar la cola antes de soltar el lock y después de soltarlo.
     *
     * @return true si este hilo entregó algo a al menos una conexión
     */
    public boolean pushPending(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) return false;

        boolean delivered = false;
        boolean retried = false;
        while (true) {
            ReentrantLock lock = pushLocks.computeIfAbsent(sessionId, k -> new ReentrantLock());
            if (!lock.tryLock()) return delivered;

            boolean stuck = false;
            try {
                while (true) {
                    List<Patch> batch = queue.snapshot(sessionId);
                    if (batch.isEmpty()) break;

                    if (!registry.sendPatches(sessionId, batch)) {
                        log.trace("No open connection for session {}, {} patch(es) stay queued", sessionId, batch.size());
                        stuck = true;
                        break;
                    }
                    queue.removeDelivered(sessionId, batch);
                    delivered = true;
                }
            } finally {
                lock.unlock();
            }

            // alguien pudo encolar (o conectarse) mientras teníamos el lock y rendirse
            if (queue.pendingCount(sessionId) == 0) return delivered;
            if (stuck) {
                // un reintento alcanza para una conexión que se registró durante el intento
                if (retried || !registry.hasConnections(sessionId)) return delivered;
                retried = true;
            }
        }
    }

    /** Ruta de polling: todo lo pendiente desde el último drain, en orden. */
    public List<Patch> drainPatches(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) return List.of();
        return queue.drain(sessionId);
    }

    /**
     * El cliente avisa que el target ya no está en el DOM: se ejecuta (una sola vez) el
     * cleanup registrado para ese target. No es un error.
     *
     * @return true si había un cleanup y se ejecutó
     */
    public boolean notifyInvalid(String sessionId, String targetId) {
        if (sessionId == null || sessionId.isEmpty() || targetId == null || targetId.isEmpty()) {
            return false;
        }
        CleanupAction action = queue.takeCleanup(sessionId, targetId);
        if (action == null) return false;
        log.debug("Target {} gone for session {}, running cleanup", targetId, sessionId);
        return action.run();
    }

    /**
     * Sesión abandonada: se descarta la cola y se ejecutan todos sus cleanups.
     */
    public void forgetSession(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) return;
        List<CleanupAction> actions = queue.forget(sessionId);
        pushLocks.remove(sessionId);
        actions.forEach(CleanupAction::run);
        log.debug("Forgot session {} ({} cleanup(s) run)", sessionId, actions.size());
    }

    public int broadcastReload() {
        return registry.broadcastReload();
    }
}
