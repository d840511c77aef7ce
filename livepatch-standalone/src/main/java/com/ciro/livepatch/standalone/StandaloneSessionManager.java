package com.ciro.livepatch.standalone;

import com.ciro.livepatch.PatchDispatcher;
import com.ciro.livepatch.config.LivePatchConfig;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * Sesiones por cookie. La tabla vive en Caffeine: con TTL o tope configurados, las sesiones
 * abandonadas se desalojan y se olvida su cola (corriendo sus cleanups), salvo que tengan
 * una conexión viva.
 */
public class StandaloneSessionManager {

    private static final Logger log = LoggerFactory.getLogger(StandaloneSessionManager.class);
    private static final SecureRandom RNG = new SecureRandom();

    private final String cookieName;
    private final PatchDispatcher dispatcher;
    private final Cache<String, SessionData> sessions;

    public static final class SessionData {
        public final String id;
        public final long createdAt = System.currentTimeMillis();

        SessionData(String id) {
            this.id = id;
        }
    }

    public StandaloneSessionManager(LivePatchConfig config, PatchDispatcher dispatcher) {
        this(config, dispatcher, Ticker.systemTicker(), ForkJoinPool.commonPool());
    }

    /** Ticker y executor inyectables para poder controlar el desalojo en tests. */
    public StandaloneSessionManager(LivePatchConfig config, PatchDispatcher dispatcher,
                                    Ticker ticker, Executor executor) {
        this.cookieName = config.getCookieName();
        this.dispatcher = dispatcher;

        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .ticker(ticker)
                .executor(executor);
        if (config.getSessionIdleTtlMinutes() > 0) {
            builder.expireAfterAccess(config.getSessionIdleTtlMinutes(), TimeUnit.MINUTES);
        }
        if (config.getMaxSessions() > 0) {
            builder.maximumSize(config.getMaxSessions());
        }
        this.sessions = builder
                .removalListener((String sid, SessionData data, RemovalCause cause) -> {
                    if (sid != null && cause.wasEvicted()) onEvicted(sid, cause);
                })
                .build();
    }

    /**
     * Resuelve la sesión del request; si no trae cookie la crea y la pone en la respuesta
     * (también en un 101).
     */
    public String ensureSession(HttpServerExchange exchange) {
        String cached = exchange.getAttachment(UndertowAttachments.SESSION_ID);
        if (cached != null) return cached;

        String sid = CookieUtil.getCookie(exchange, cookieName);
        if (sid == null) {
            sid = newId();
            CookieUtil.setSessionCookie(exchange, cookieName, sid);
            exchange.putAttachment(UndertowAttachments.SESSION_CREATED, Boolean.TRUE);
            log.debug("New session {}", sid);
        }
        sessions.get(sid, SessionData::new);
        exchange.putAttachment(UndertowAttachments.SESSION_ID, sid);
        return sid;
    }

    /**
     * Sesión de la cookie, sin crear ninguna. Un valor que no conocemos no entra en la tabla:
     * con {@code max-sessions} activo, cookies inventadas podrían desalojar sesiones reales.
     */
    public String currentSessionId(HttpServerExchange exchange) {
        String sid = CookieUtil.getCookie(exchange, cookieName);
        if (sid != null) sessions.getIfPresent(sid);
        return sid;
    }

    /** Marca actividad (un poll, una conexión que se cierra) para el TTL. */
    public void touch(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) return;
        sessions.get(sessionId, SessionData::new);
    }

    public boolean isKnown(String sessionId) {
        return sessions.getIfPresent(sessionId) != null;
    }

    public long sessionCount() {
        return sessions.estimatedSize();
    }

    /** Fuerza el mantenimiento pendiente de Caffeine (desalojos incluidos). */
    public void cleanUp() {
        sessions.cleanUp();
    }

    public void touchNoCache(HttpServerExchange exchange) {
        exchange.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-store, no-cache, must-revalidate, max-age=0");
        exchange.getResponseHeaders().put(Headers.PRAGMA, "no-cache");
    }

    public String getCookieName() {
        return cookieName;
    }

    private void onEvicted(String sid, RemovalCause cause) {
        if (dispatcher.registry().hasConnections(sid)) {
            log.debug("Session {} evicted ({}) but still connected, keeping its queue", sid, cause);
            return;
        }
        log.debug("Session {} evicted ({}), forgetting it", sid, cause);
        dispatcher.forgetSession(sid);
    }

    private static String newId() {
        byte[] b = new byte[18];
        RNG.nextBytes(b);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(b);
    }
}
