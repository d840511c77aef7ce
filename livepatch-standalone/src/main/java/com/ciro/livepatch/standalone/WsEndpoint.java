package com.ciro.livepatch.standalone;

import com.ciro.livepatch.PatchDispatcher;
import com.ciro.livepatch.config.LivePatchConfig;
import com.ciro.livepatch.ws.Connection;
import com.ciro.livepatch.ws.FrameCodec;
import com.ciro.livepatch.ws.HandshakeException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xnio.IoUtils;
import org.xnio.StreamConnection;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * {base}/ws: handshake validado a mano y upgrade del canal crudo.
 *
 * <p>Tras el 101 cada conexión tiene su loop de recepción en un hilo del pool
 * {@code lp-ws-*}: se registra en la sesión, vacía lo que estuviera encolado y queda
 * leyendo hasta el close o el primer error.
 */
public class WsEndpoint implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(WsEndpoint.class);

    private final LivePatchConfig config;
    private final ObjectMapper mapper;
    private final PatchDispatcher dispatcher;
    private final StandaloneSessionManager sessions;
    private final ExecutorService receivers;

    public WsEndpoint(LivePatchConfig config,
                      ObjectMapper mapper,
                      PatchDispatcher dispatcher,
                      StandaloneSessionManager sessions,
                      ExecutorService receivers) {
        this.config = config;
        this.mapper = mapper;
        this.dispatcher = dispatcher;
        this.sessions = sessions;
        this.receivers = receivers;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        if (!Methods.GET.equals(exchange.getRequestMethod())) {
            Responses.plain(exchange, 405, "Only GET is allowed");
            return;
        }

        String upgrade = exchange.getRequestHeaders().getFirst(Headers.UPGRADE);
        if (upgrade == null || !upgrade.trim().equalsIgnoreCase("websocket")) {
            Responses.plain(exchange, 400, "Expected Upgrade: websocket");
            return;
        }

        String accept;
        try {
            accept = FrameCodec.acceptToken(exchange.getRequestHeaders().getFirst(Headers.SEC_WEB_SOCKET_KEY));
        } catch (HandshakeException e) {
            Responses.plain(exchange, e.getStatus(), e.getMessage());
            return;
        }

        String sid = sessions.ensureSession(exchange);
        boolean fresh = exchange.getAttachment(UndertowAttachments.SESSION_CREATED) != null;

        exchange.getResponseHeaders().put(Headers.UPGRADE, "websocket");
        exchange.getResponseHeaders().put(Headers.SEC_WEB_SOCKET_ACCEPT, accept);
        exchange.upgradeChannel((channel, ex) -> accept(sid, channel));
        exchange.endExchange();

        log.debug("WS upgrade for session {}{}", sid, fresh ? " (new)" : "");
    }

    private void accept(String sid, StreamConnection channel) {
        try {
            receivers.execute(() -> serve(sid, channel));
        } catch (RejectedExecutionException e) {
            log.debug("Server stopping, dropping upgraded connection for session {}", sid);
            IoUtils.safeClose(channel);
        }
    }

    private void serve(String sid, StreamConnection channel) {
        Connection conn = new Connection(
                new UndertowTransport(channel, config.getReceiveTimeoutMs()),
                mapper,
                Connection.Role.SERVER,
                config.getMaxFrameBytes());

        dispatcher.registry().register(sid, conn);
        try {
            dispatcher.pushPending(sid);
            conn.run();
        } finally {
            dispatcher.registry().unregister(sid, conn);
            sessions.touch(sid);
            log.debug("{} closed (session {})", conn, sid);
        }
    }
}
