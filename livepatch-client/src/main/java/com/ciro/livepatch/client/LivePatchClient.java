package com.ciro.livepatch.client;

import com.ciro.livepatch.Envelope;
import com.ciro.livepatch.Patch;
import com.ciro.livepatch.json.ObjectMapperFactory;
import com.ciro.livepatch.ws.Connection;
import com.ciro.livepatch.ws.HandshakeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.CookieManager;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reconciliador del lado cliente para la JVM (el equivalente de {@code livepatch-runtime.js}).
 *
 * <p>Máquina de estados {@code CONNECTING → CONNECTED → RECONNECT_WAIT → CONNECTING}. Mientras
 * no está {@code CONNECTED} hace polling; al conectar para el polling y hace un único poll
 * para recoger lo que llegó durante la reconexión.
 *
 * <p>Todo (transiciones, polls, aplicación de patches) corre en un único hilo de scheduler,
 * así el {@link DocumentModel} nunca se toca concurrentemente. El loop de recepción de cada
 * socket tiene su propio hilo y sólo reenvía mensajes a ese scheduler.
 */
public class LivePatchClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LivePatchClient.class);

    public enum State { NEW, CONNECTING, CONNECTED, RECONNECT_WAIT, STOPPED }

    private final ClientOptions options;
    private final DocumentModel document;
    private final ObjectMapper mapper;
    private final CookieManager cookies;
    private final HttpClient http;
    private final WebSocketDialer dialer;
    private final ScheduledExecutorService scheduler;

    private final AtomicLong polls = new AtomicLong();
    private final AtomicLong invalidReports = new AtomicLong();

    private volatile State state = State.NEW;
    private volatile int retry;
    private volatile Connection connection;
    private ScheduledFuture<?> pollTask;

    public LivePatchClient(ClientOptions options, DocumentModel document) {
        this(options, document, ObjectMapperFactory.create(), new CookieManager());
    }

    public LivePatchClient(ClientOptions options, DocumentModel document, ObjectMapper mapper, CookieManager cookies) {
        this.options = Objects.requireNonNull(options, "options");
        this.document = Objects.requireNonNull(document, "document");
        this.mapper = mapper;
        this.cookies = cookies;
        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .cookieHandler(cookies)
                .connectTimeout(Duration.ofMillis(options.getConnectTimeoutMs()))
                .build();
        this.dialer = new WebSocketDialer(options, cookies, mapper);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lp-client");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * {@code min(base * 2^attempt, max)}
     */
    public static long backoffDelay(int attempt, long baseMs, long maxMs) {
        return (long) Math.min(baseMs * Math.pow(2, attempt), maxMs);
    }

    public void start() {
        if (state != State.NEW) {
            throw new IllegalStateException("Client already started (" + state + ")");
        }
        state = State.CONNECTING;
        submit(this::connect);
    }

    public State state() {
        return state;
    }

    public boolean isConnected() {
        return state == State.CONNECTED;
    }

    /** Intentos fallidos desde la última conexión buena (acotado por {@code maxRetry}). */
    public int retryCount() {
        return retry;
    }

    public long pollCount() {
        return polls.get();
    }

    public long invalidReportCount() {
        return invalidReports.get();
    }

    public CookieManager cookies() {
        return cookies;
    }

    // ------------------------------------------------------------------ ciclo de vida

    private void connect() {
        if (state == State.STOPPED) return;
        state = State.CONNECTING;

        Connection conn;
        try {
            conn = dialer.dial();
        } catch (IOException | HandshakeException e) {
            log.debug("WebSocket connect to {} failed: {}", options.getOrigin(), e.getMessage());
            onDisconnected();
            return;
        }

        conn.onText(json -> submit(() -> handleMessage(json)));
        connection = conn;

        Thread reader = new Thread(() -> {
            conn.run();
            submit(() -> onClosed(conn));
        }, "lp-client-recv-" + conn.id());
        reader.setDaemon(true);
        reader.start();

        onOpen();
    }

    private void onOpen() {
        log.info("Live connection open ({})", options.getOrigin());
        state = State.CONNECTED;
        retry = 0;
        stopPolling();
        pollOnce();
    }

    private void onClosed(Connection conn) {
        if (conn != connection) return;
        connection = null;
        log.info("Live connection lost, falling back to polling");
        onDisconnected();
    }

    private void onDisconnected() {
        if (state == State.STOPPED) return;
        state = State.RECONNECT_WAIT;

        long delay = backoffDelay(retry, options.getReconnectBaseMs(), options.getReconnectMaxMs());
        retry = Math.min(retry + 1, options.getMaxRetry());
        log.debug("Reconnecting in {} ms", delay);
        scheduler.schedule(this::connect, delay, TimeUnit.MILLISECONDS);

        startPolling();
    }

    private void startPolling() {
        if (pollTask != null) return;
        pollTask = scheduler.scheduleWithFixedDelay(this::pollOnce, 0, options.getPollIntervalMs(), TimeUnit.MILLISECONDS);
    }

    private void stopPolling() {
        if (pollTask == null) return;
        pollTask.cancel(false);
        pollTask = null;
    }

    // ------------------------------------------------------------------ poll / invalid

    /** Pide un poll fuera de ciclo. */
    public void poll() {
        submit(this::pollOnce);
    }

    private void pollOnce() {
        if (state == State.STOPPED) return;
        HttpRequest request = HttpRequest.newBuilder(options.route("poll"))
                .header("Accept", "application/json")
                .timeout(Duration.ofMillis(options.getConnectTimeoutMs()))
                .GET()
                .build();
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            polls.incrementAndGet();
            if (response.statusCode() != 200) {
                log.debug("Poll answered {}", response.statusCode());
                return;
            }
            handleMessage(response.body());
        } catch (IOException e) {
            log.debug("Poll failed: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Avisa al servidor que un target ya no existe. Fire-and-forget: la respuesta no importa.
     */
    public void notifyInvalid(String targetId) {
        String body;
        try {
            body = mapper.writeValueAsString(Map.of("id", targetId));
        } catch (JsonProcessingException e) {
            log.warn("Could not encode invalid-target report for {}", targetId, e);
            return;
        }
        URI uri = options.route("invalid");
        HttpRequest request = HttpRequest.newBuilder(uri)
                .header("Content-Type", "application/json")
                .timeout(Duration.ofMillis(options.getConnectTimeoutMs()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        invalidReports.incrementAndGet();
        http.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .whenComplete((r, err) -> {
                    if (err != null) log.debug("Invalid-target report for {} failed: {}", targetId, err.getMessage());
                });
    }

    // ------------------------------------------------------------------ reconciliación

    void handleMessage(String json) {
        Envelope envelope;
        try {
            envelope = mapper.readValue(json, Envelope.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed message: {}", e.getOriginalMessage());
            return;
        }
        if (envelope.isReload()) {
            log.info("Reload requested by server");
            document.reload();
            return;
        }
        for (Patch patch : envelope.patchList()) {
            apply(patch);
        }
    }

    void apply(Patch patch) {
        if (!patch.hasTarget()) return;
        String id = patch.targetId();
        if (!document.contains(id)) {
            log.debug("Target {} not in document, reporting", id);
            notifyInvalid(id);
            return;
        }
        switch (patch.swap()) {
            case INLINE -> document.setInner(id, patch.html());
            case OUTLINE -> document.replaceNode(id, patch.html());
            case APPEND -> document.append(id, patch.html());
            case PREPEND -> document.prepend(id, patch.html());
            case NONE -> log.trace("Signal patch for {}", id);
        }
    }

    // ------------------------------------------------------------------ cierre

    @Override
    public void close() {
        if (state == State.STOPPED) return;
        state = State.STOPPED;
        Connection c = connection;
        if (c != null) c.stop();
        scheduler.shutdownNow();
    }

    private void submit(Runnable task) {
        try {
            scheduler.execute(task);
        } catch (RejectedExecutionException e) {
            log.trace("Client stopped, dropping task");
        }
    }
}
