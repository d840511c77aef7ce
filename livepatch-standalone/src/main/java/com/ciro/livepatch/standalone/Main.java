package com.ciro.livepatch.standalone;

import com.ciro.livepatch.PatchContext;
import com.ciro.livepatch.PatchTarget;
import com.ciro.livepatch.TimerHandle;
import com.ciro.livepatch.Timers;
import com.ciro.livepatch.config.LivePatchConfig;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

public class Main {

    private static final DateTimeFormatter HMS = DateTimeFormatter.ofPattern("HH:mm:ss");

    public static void main(String[] args) {
        // 1. Config: livepatch.properties + -Dlivepatch.*
        LivePatchConfig config = LivePatchConfig.load();

        // 2. Servidor y páginas
        LivePatchServer server = new LivePatchServer(config);
        server.page("/", ctx -> index());
        server.page("/clock", ctx -> clock(ctx, server.timers()));
        server.page("/deferred", Main::deferred);

        // 3. Arrancar
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "lp-shutdown"));
        server.start();
    }

    static String index() {
        return """
            <h1>LivePatch</h1>
            <ul>
                <li><a href="/clock">Reloj</a> (patch cada segundo)</li>
                <li><a href="/deferred">Contenido diferido</a> (skeleton reemplazado a los 2 s)</li>
            </ul>
            """;
    }

    /**
     * Reloj parcheado cada segundo. Cuando el nodo desaparece (otra página, pestaña cerrada y
     * vuelta a abrir) el cliente lo reporta y el cleanup para el intervalo.
     */
    static String clock(PatchContext ctx, Timers timers) {
        PatchTarget target = PatchTarget.generate();

        AtomicReference<TimerHandle> handle = new AtomicReference<>();
        handle.set(timers.interval(1000, () -> ctx.patch(target, LocalTime.now().format(HMS), handle.get())));

        return """
            <h1>Reloj</h1>
            <p>Hora del servidor: <strong id="%s">%s</strong></p>
            <p><a href="/">Volver</a></p>
            """.formatted(target.id(), LocalTime.now().format(HMS));
    }

    static String deferred(PatchContext ctx) {
        PatchTarget target = PatchTarget.generate();

        CompletableFuture<String> slow = CompletableFuture.supplyAsync(
                () -> "<div id=\"" + target.id() + "\"><p>Listo: cargado en diferido.</p></div>",
                CompletableFuture.delayedExecutor(2, TimeUnit.SECONDS));
        ctx.patchAsync(target.replace(), slow);

        return """
            <h1>Diferido</h1>
            <div id="%s"><p>Cargando…</p></div>
            <p><a href="/">Volver</a></p>
            """.formatted(target.id());
    }
}
