package com.ciro.livepatch.standalone;

import com.ciro.livepatch.PatchDispatcher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * {base}/invalid: el cliente avisa que un target ya no está en el DOM. Siempre 204; un body
 * roto o vacío simplemente no dispara nada.
 */
public class InvalidEndpoint implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(InvalidEndpoint.class);

    private final ObjectMapper mapper;
    private final PatchDispatcher dispatcher;
    private final StandaloneSessionManager sessions;

    public InvalidEndpoint(ObjectMapper mapper, PatchDispatcher dispatcher, StandaloneSessionManager sessions) {
        this.mapper = mapper;
        this.dispatcher = dispatcher;
        this.sessions = sessions;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        if (!Methods.POST.equals(exchange.getRequestMethod())) {
            Responses.plain(exchange, 405, "Only POST is allowed");
            return;
        }
        exchange.getRequestReceiver().receiveFullBytes((ex, bytes) -> {
            String sid = sessions.currentSessionId(ex);
            String targetId = targetId(bytes);
            if (sid == null || targetId == null) {
                Responses.noContent(ex);
                return;
            }
            // el cleanup es código de aplicación: fuera del hilo de IO
            ex.dispatch(() -> {
                dispatcher.notifyInvalid(sid, targetId);
                Responses.noContent(ex);
            });
        });
    }

    private String targetId(byte[] body) {
        if (body == null || body.length == 0) return null;
        try {
            JsonNode id = mapper.readTree(body).path("id");
            return id.isTextual() && !id.asText().isEmpty() ? id.asText() : null;
        } catch (IOException e) {
            log.debug("Ignoring malformed invalid-target report: {}", e.getMessage());
            return null;
        }
    }
}
