package com.ciro.livepatch.standalone;

import com.ciro.livepatch.PatchContext;
import com.ciro.livepatch.PatchDispatcher;
import com.ciro.livepatch.config.LivePatchConfig;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

public class PageEndpoint implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(PageEndpoint.class);

    private final LivePatchConfig config;
    private final SimpleRouteRegistry registry;
    private final PatchDispatcher dispatcher;
    private final StandaloneSessionManager sessions;

    public PageEndpoint(LivePatchConfig config,
                        SimpleRouteRegistry registry,
                        PatchDispatcher dispatcher,
                        StandaloneSessionManager sessions) {
        this.config = config;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.sessions = sessions;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }

        String requestPath = exchange.getRequestPath();
        if (requestPath == null || requestPath.isBlank()) requestPath = "/";

        if (!Methods.GET.equals(exchange.getRequestMethod())) {
            Responses.plain(exchange, 405, "Only GET is allowed");
            return;
        }

        Optional<Page> page = registry.resolve(requestPath);
        if (page.isEmpty()) {
            Responses.plain(exchange, 404, "404 Not Found: " + requestPath);
            return;
        }

        String sid = sessions.ensureSession(exchange);
        sessions.touchNoCache(exchange);

        String bodyHtml;
        try {
            bodyHtml = page.get().render(new PatchContext(sid, dispatcher));
        } catch (Exception e) {
            log.error("Page {} failed for session {}", requestPath, sid, e);
            Responses.plain(exchange, 500, "500 Internal Server Error");
            return;
        }

        String full = """
            <!DOCTYPE html>
            <html>
            <head>
                <meta charset="UTF-8">
                <meta name="viewport" content="width=device-width, initial-scale=1">
                <title>LivePatch</title>
                <script src="/js/livepatch-runtime.js" data-base="%s" defer></script>
                <style> body { margin:0; padding:0; font-family: system-ui, -apple-system, Segoe UI, sans-serif; } </style>
            </head>
            <body>
                <div id="app">%s</div>
            </body>
            </html>
            """.formatted(config.getBasePath(), bodyHtml == null ? "" : bodyHtml);

        Responses.html(exchange, full);
    }
}
