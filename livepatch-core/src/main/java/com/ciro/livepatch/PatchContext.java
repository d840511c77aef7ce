package com.ciro.livepatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * API de patches ligada a la sesión del request actual.
 *
 * <p>Se puede guardar y usar desde otros hilos (timers, tareas en background) después de
 * que el request haya terminado: sólo captura el id de sesión y el dispatcher.
 */
public final class PatchContext {

    private static final Logger log = LoggerFactory.getLogger(PatchContext.class);

    private final String sessionId;
    private final PatchDispatcher dispatcher;

    public PatchContext(String sessionId, PatchDispatcher dispatcher) {
        this.sessionId = sessionId == null ? "" : sessionId;
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    public String sessionId() {
        return sessionId;
    }

    public void patch(PatchTarget target, String html) {
        patch(target, html, null);
    }

    /**
     * @param cleanup se ejecuta (una vez) cuando el cliente reporta que el target ya no existe
     */
    public void patch(PatchTarget target, String html, Runnable cleanup) {
        dispatcher.queuePatch(sessionId, target.toPatch(html), cleanup);
    }

    /**
     * HTML calculado en el momento. Si el supplier falla se manda un patch vacío.
     */
    public void patch(PatchTarget target, Supplier<String> html, Runnable cleanup) {
        String resolved;
        try {
            resolved = html.get();
        } catch (RuntimeException e) {
            log.warn("Patch content for target {} failed, sending empty html", target.id(), e);
            resolved = "";
        }
        patch(target, resolved, cleanup);
    }

    /**
     * Contenido diferido (skeleton ahora, contenido real cuando esté listo).
     */
    public CompletableFuture<Void> patchAsync(PatchTarget target, CompletionStage<String> html) {
        return html.handle((value, err) -> {
            if (err != null) {
                log.warn("Deferred patch for target {} failed, sending empty html", target.id(), err);
                patch(target, "", null);
            } else {
                patch(target, value, null);
            }
            return (Void) null;
        }).toCompletableFuture();
    }
}
