package com.ciro.livepatch;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Cola FIFO de patches pendientes por sesión + tabla de cleanups por (sesión, target).
 *
 * <p>Un único lock grueso protege ambas estructuras; ninguna operación hace I/O con el
 * lock tomado. Sin límite de tamaño (ver DESIGN.md).
 */
public class PatchQueue {

    private record CleanupKey(String sessionId, String targetId) {}

    private final Object lock = new Object();
    private final Map<String, List<Patch>> pending = new HashMap<>();
    private final Map<CleanupKey, CleanupAction> cleanups = new HashMap<>();

    /**
     * Encola el patch; si trae cleanup reemplaza (sin ejecutarlo) al anterior del mismo target.
     */
    public void enqueue(String sessionId, Patch patch, CleanupAction cleanup) {
        CleanupAction superseded = null;
        synchronized (lock) {
            pending.computeIfAbsent(sessionId, k -> new ArrayList<>()).add(patch);
            if (cleanup != null) {
                superseded = cleanups.put(new CleanupKey(sessionId, patch.targetId()), cleanup);
            }
        }
        if (superseded != null && superseded != cleanup) {
            superseded.discard();
        }
    }

    public List<Patch> snapshot(String sessionId) {
        synchronized (lock) {
            List<Patch> q = pending.get(sessionId);
            return q == null ? List.of() : List.copyOf(q);
        }
    }

    /**
     * Quita de la cabeza de la cola los patches ya entregados, comparando por identidad.
     * Si entretanto alguien drenó la cola, no se toca nada de lo que llegó después.
     *
     * @return cuántos se quitaron
     */
    public int removeDelivered(String sessionId, List<Patch> delivered) {
        synchronized (lock) {
            List<Patch> q = pending.get(sessionId);
            if (q == null) return 0;
            int removed = 0;
            Iterator<Patch> it = q.iterator();
            for (Patch sent : delivered) {
                if (!it.hasNext()) break;
                if (it.next() != sent) break;
                it.remove();
                removed++;
            }
            if (q.isEmpty()) pending.remove(sessionId);
            return removed;
        }
    }

    /** Saca y devuelve toda la cola de la sesión, en orden. */
    public List<Patch> drain(String sessionId) {
        synchronized (lock) {
            List<Patch> q = pending.remove(sessionId);
            return q == null ? List.of() : List.copyOf(q);
        }
    }

    public CleanupAction takeCleanup(String sessionId, String targetId) {
        synchronized (lock) {
            return cleanups.remove(new CleanupKey(sessionId, targetId));
        }
    }

    /**
     * Olvida todo lo de la sesión.
     *
     * @return los cleanups que quedaban registrados, para que el llamador los ejecute
     */
    public List<CleanupAction> forget(String sessionId) {
        List<CleanupAction> out = new ArrayList<>();
        synchronized (lock) {
            pending.remove(sessionId);
            Iterator<Map.Entry<CleanupKey, CleanupAction>> it = cleanups.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<CleanupKey, CleanupAction> e = it.next();
                if (e.getKey().sessionId().equals(sessionId)) {
                    out.add(e.getValue());
                    it.remove();
                }
            }
        }
        return out;
    }

    public int pendingCount(String sessionId) {
        synchronized (lock) {
            List<Patch> q = pending.get(sessionId);
            return q == null ? 0 : q.size();
        }
    }

    public boolean hasCleanup(String sessionId, String targetId) {
        synchronized (lock) {
            return cleanups.containsKey(new CleanupKey(sessionId, targetId));
        }
    }
}
