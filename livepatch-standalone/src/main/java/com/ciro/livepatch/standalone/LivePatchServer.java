package com.ciro.livepatch.standalone;

import com.ciro.livepatch.PatchDispatcher;
import com.ciro.livepatch.SessionRegistry;
import com.ciro.livepatch.Timers;
import com.ciro.livepatch.config.LivePatchConfig;
import com.ciro.livepatch.json.ObjectMapperFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.PathHandler;
import io.undertow.server.handlers.resource.ClassPathResourceManager;
import io.undertow.server.handlers.resource.ResourceHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Servidor standalone sobre Undertow: páginas de la aplicación, runtime JS y las tres rutas
 * de transporte ({base}/ws, /poll, /invalid).
 */
public class LivePatchServer {

    private static final Logger log = LoggerFactory.getLogger(LivePatchServer.class);

    private final LivePatchConfig config;
    private final ObjectMapper mapper;

    private final SessionRegistry registry;
    private final PatchDispatcher dispatcher;
    private final StandaloneSessionManager sessionManager;
    private final SimpleRouteRegistry routes;

    private final ScheduledExecutorService scheduler;
    private final Timers timers;
    private final ExecutorService receivers;

    private Undertow server;
    private AutoReloadWatcher watcher;

    public LivePatchServer(LivePatchConfig config) {
        this.config = config;
        this.mapper = ObjectMapperFactory.create();

        this.registry = new SessionRegistry(mapper);
        this.dispatcher = new PatchDispatcher(registry);
        this.sessionManager = new StandaloneSessionManager(config, dispatcher);
        this.routes = new SimpleRouteRegistry();

        this.scheduler = Executors.newScheduledThreadPool(2, named("lp-timer-"));
        this.timers = new Timers(scheduler);
        this.receivers = Executors.newCachedThreadPool(named("lp-ws-"));
    }

    public LivePatchServer page(String path, Page page) {
        routes.add(path, page);
        return this;
    }

    public PatchDispatcher dispatcher() {
        return dispatcher;
    }

    public Timers timers() {
        return timers;
    }

    public StandaloneSessionManager sessions() {
        return sessionManager;
    }

    public LivePatchConfig config() {
        return config;
    }

    public synchronized void start() {
        if (server != null) return;

        ClassLoader cl = LivePatchServer.class.getClassLoader();

        // /js/* -> classpath:/static/js/*
        ResourceHandler jsHandler = new ResourceHandler(new ClassPathResourceManager(cl, "static/js"));
        jsHandler.setCacheTime(0);

        WsEndpoint wsEndpoint = new WsEndpoint(config, mapper, dispatcher, sessionManager, receivers);
        PollEndpoint pollEndpoint = new PollEndpoint(mapper, dispatcher, sessionManager);
        InvalidEndpoint invalidEndpoint = new InvalidEndpoint(mapper, dispatcher, sessionManager);
        PageEndpoint pageEndpoint = new PageEndpoint(config, routes, dispatcher, sessionManager);

        // lo que no matchea ningún path de transporte es una página
        HttpHandler fallback = pageEndpoint;
        PathHandler paths = new PathHandler(fallback);

        paths.addExactPath(config.wsPath(), wsEndpoint);
        paths.addExactPath(config.pollPath(), pollEndpoint);
        paths.addExactPath(config.invalidPath(), invalidEndpoint);
        paths.addPrefixPath("/js", jsHandler);

        server = Undertow.builder()
                .addHttpListener(config.getPort(), config.getHost())
                .setHandler(paths)
                .build();
        server.start();

        if (config.isAutoReload()) {
            List<Path> dirs = config.getAutoReloadDirs().stream().map(Path::of).collect(Collectors.toList());
            watcher = new AutoReloadWatcher(dirs, dispatcher::broadcastReload, scheduler);
            watcher.start(config.getAutoReloadIntervalMs());
        }

        log.info("LivePatch running on http://{}:{} (transport under {})", config.getHost(), getPort(), config.getBasePath());
        log.info("Runtime JS: /js/livepatch-runtime.js");
    }

    /** Puerto real; útil con {@code port=0}. */
    public synchronized int getPort() {
        if (server == null) return config.getPort();
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    public synchronized void stop() {
        if (server == null) return;
        if (watcher != null) watcher.stop();
        registry.closeAll();
        server.stop();
        server = null;
        receivers.shutdownNow();
        scheduler.shutdownNow();
        log.info("LivePatch stopped");
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
