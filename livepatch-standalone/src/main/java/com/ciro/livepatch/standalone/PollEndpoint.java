package com.ciro.livepatch.standalone;

import com.ciro.livepatch.Envelope;
import com.ciro.livepatch.Patch;
import com.ciro.livepatch.PatchDispatcher;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Methods;

import java.util.List;

/**
 * {base}/poll: todo lo pendiente para la sesión del caller, en orden, y la cola queda vacía.
 */
public class PollEndpoint implements HttpHandler {

    private final ObjectMapper mapper;
    private final PatchDispatcher dispatcher;
    private final StandaloneSessionManager sessions;

    public PollEndpoint(ObjectMapper mapper, PatchDispatcher dispatcher, StandaloneSessionManager sessions) {
        this.mapper = mapper;
        this.dispatcher = dispatcher;
        this.sessions = sessions;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (!Methods.GET.equals(exchange.getRequestMethod())) {
            Responses.plain(exchange, 405, "Only GET is allowed");
            return;
        }

        String sid = sessions.ensureSession(exchange);
        sessions.touchNoCache(exchange);

        List<Patch> patches = dispatcher.drainPatches(sid);
        Responses.json(exchange, mapper.writeValueAsString(Envelope.patches(patches)));
    }
}
