package com.ciro.livepatch;

import com.ciro.livepatch.spi.PushSink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sesión → conexiones vivas (una por pestaña).
 *
 * <p>Disciplina de lock: un único lock grueso para mutaciones y lecturas; el envío
 * copia la lista bajo el lock, lo suelta y luego escribe en cada conexión. Nunca se
 * hace I/O con el lock tomado.
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ObjectMapper mapper;
    private final Object lock = new Object();
    private final Map<String, List<PushSink>> sessions = new HashMap<>();

    public SessionRegistry(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void register(String sessionId, PushSink sink) {
        if (sessionId == null || sessionId.isEmpty() || sink == null) return;
        synchronized (lock) {
            sessions.computeIfAbsent(sessionId, k -> new ArrayList<>()).add(sink);
        }
        log.debug("Registered {} for session {}", sink, sessionId);
    }

    public void unregister(String sessionId, PushSink sink) {
        if (sessionId == null || sessionId.isEmpty() || sink == null) return;
        synchronized (lock) {
            List<PushSink> sinks = sessions.get(sessionId);
            if (sinks == null) return;
            sinks.remove(sink);
            if (sinks.isEmpty()) {
                sessions.remove(sessionId);
            }
        }
    }

    /**
     * Envía un batch de patches a todas las pestañas de la sesión.
     *
     * @return true si al menos una conexión aceptó el mensaje
     */
    public boolean sendPatches(String sessionId, List<Patch> patches) {
        if (sessionId == null || sessionId.isEmpty() || patches == null || patches.isEmpty()) {
            return false;
        }

        List<PushSink> targets = snapshot(sessionId);
        if (targets.isEmpty()) return false;

        String json = toJson(Envelope.patches(patches));
        if (json == null) return false;

        boolean delivered = false;
        for (PushSink sink : targets) {
            if (sink.send(json)) {
                delivered = true;
            } else {
                unregister(sessionId, sink);
            }
        }
        return delivered;
    }

    /**
     * Pide a todas las pestañas de todas las sesiones que recarguen (live-reload).
     *
     * @return cuántas conexiones aceptaron el mensaje
     */
    public int broadcastReload() {
        String json = toJson(Envelope.reload());
        if (json == null) return 0;

        Map<String, List<PushSink>> copy = new LinkedHashMap<>();
        synchronized (lock) {
            sessions.forEach((sid, sinks) -> copy.put(sid, List.copyOf(sinks)));
        }

        int accepted = 0;
        for (Map.Entry<String, List<PushSink>> e : copy.entrySet()) {
            for (PushSink sink : e.getValue()) {
                if (sink.send(json)) {
                    accepted++;
                } else {
                    unregister(e.getKey(), sink);
                }
            }
        }
        log.debug("Reload broadcast accepted by {} connection(s)", accepted);
        return accepted;
    }

    public boolean hasConnections(String sessionId) {
        return connectionCount(sessionId) > 0;
    }

    public int connectionCount(String sessionId) {
        synchronized (lock) {
            List<PushSink> sinks = sessions.get(sessionId);
            return sinks == null ? 0 : sinks.size();
        }
    }

    public int sessionCount() {
        synchronized (lock) {
            return sessions.size();
        }
    }

    /** Cierra y olvida todas las conexiones (apagado del servidor). */
    public void closeAll() {
        List<PushSink> all = new ArrayList<>();
        synchronized (lock) {
            sessions.values().forEach(all::addAll);
            sessions.clear();
        }
        for (PushSink sink : all) {
            sink.close();
        }
    }

    private List<PushSink> snapshot(String sessionId) {
        synchronized (lock) {
            List<PushSink> sinks = sessions.get(sessionId);
            return sinks == null ? List.of() : List.copyOf(sinks);
        }
    }

    private String toJson(Envelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize {} envelope", envelope.type(), e);
            return null;
        }
    }
}
