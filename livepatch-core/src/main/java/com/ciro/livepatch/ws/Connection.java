package com.ciro.livepatch.ws;

import com.ciro.livepatch.spi.PushSink;
import com.ciro.livepatch.spi.Transport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Una conexión WebSocket viva sobre un {@link Transport} ya handshakeado.
 *
 * <p>Escrituras: {@code send}/{@code sendJson} desde cualquier hilo, serializadas por un
 * lock propio para que los bytes de dos frames nunca se mezclen. Lecturas: {@link #run()}
 * en un hilo dedicado durante toda la vida de la conexión; contesta ping con pong y sale
 * con close o con cualquier error de transporte.
 *
 * <p>Cualquier fallo cierra sólo esta conexión. {@link #close()} es idempotente.
 */
public class Connection implements PushSink {

    private static final Logger log = LoggerFactory.getLogger(Connection.class);

    private static final AtomicLong SEQ = new AtomicLong();
    private static final SecureRandom MASKS = new SecureRandom();

    public enum State { OPEN, CLOSED }

    /** SERVER: frames salientes sin máscara. CLIENT: enmascarados (RFC 6455 §5.3). */
    public enum Role { SERVER, CLIENT }

    private final long id = SEQ.incrementAndGet();
    private final Transport transport;
    private final ObjectMapper mapper;
    private final Role role;
    private final int maxPayload;

    private final Object sendLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Consumer<String> textListener;

    public Connection(Transport transport, ObjectMapper mapper) {
        this(transport, mapper, Role.SERVER, FrameCodec.DEFAULT_MAX_PAYLOAD);
    }

    public Connection(Transport transport, ObjectMapper mapper, Role role, int maxPayload) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.role = role;
        this.maxPayload = maxPayload;
    }

    /**
     * Listener para frames de texto entrantes. El servidor no lo usa (el canal es push),
     * el cliente JVM sí.
     */
    public Connection onText(Consumer<String> listener) {
        this.textListener = listener;
        return this;
    }

    public long id() {
        return id;
    }

    public State state() {
        return closed.get() ? State.CLOSED : State.OPEN;
    }

    @Override
    public boolean isOpen() {
        return !closed.get();
    }

    // ------------------------------------------------------------------ envío

    @Override
    public boolean send(String text) {
        if (closed.get()) return false;
        if (text == null) {
            log.warn("Connection {}: refusing to send a null message, dropping connection", id);
            close();
            return false;
        }
        return sendFrame(FrameCodec.OP_TEXT, text.getBytes(StandardCharsets.UTF_8));
    }

    public boolean sendJson(Object value) {
        if (closed.get()) return false;
        String json;
        try {
            json = mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Connection {}: could not serialize message, dropping connection", id, e);
            close();
            return false;
        }
        return send(json);
    }

    boolean sendFrame(int opcode, byte[] payload) {
        synchronized (sendLock) {
            if (closed.get()) return false;

            byte[] frame;
            try {
                frame = FrameCodec.encode(opcode, payload, role == Role.CLIENT ? newMaskKey() : null);
            } catch (IllegalArgumentException e) {
                // mejor perder la conexión que corromper el stream
                log.warn("Connection {}: malformed frame ({}), dropping connection", id, e.getMessage());
                close();
                return false;
            }

            try {
                OutputStream out = transport.output();
                out.write(frame);
                out.flush();
                return true;
            } catch (IOException e) {
                log.debug("Connection {} ({}): write failed: {}", id, transport.describe(), e.getMessage());
                close();
                return false;
            }
        }
    }

    // ------------------------------------------------------------------ recepción

    /**
     * Loop de recepción; bloquea hasta que la conexión se cierra.
     */
    public void run() {
        try {
            InputStream in = transport.input();
            while (!closed.get()) {
                Frame frame;
                try {
                    frame = FrameCodec.decode(in, maxPayload);
                } catch (InterruptedIOException idle) {
                    // timeout acotado: volvemos a mirar la señal de parada
                    continue;
                }

                switch (frame.opcode()) {
                    case FrameCodec.OP_CLOSE -> {
                        log.debug("Connection {}: close frame received", id);
                        sendFrame(FrameCodec.OP_CLOSE, closeEcho(frame.payload()));
                        return;
                    }
                    case FrameCodec.OP_PING -> sendFrame(FrameCodec.OP_PONG, frame.payload());
                    case FrameCodec.OP_PONG -> log.trace("Connection {}: pong", id);
                    case FrameCodec.OP_TEXT -> deliverText(frame.text());
                    default -> log.trace("Connection {}: ignoring opcode 0x{}", id, Integer.toHexString(frame.opcode()));
                }
            }
        } catch (IOException e) {
            if (!closed.get()) {
                log.debug("Connection {} ({}): receive loop ended: {}", id, transport.describe(), e.getMessage());
            }
        } finally {
            close();
        }
    }

    private void deliverText(String text) {
        Consumer<String> listener = textListener;
        if (listener == null) {
            log.trace("Connection {}: ignoring client text message", id);
            return;
        }
        try {
            listener.accept(text);
        } catch (RuntimeException e) {
            log.warn("Connection {}: text listener failed", id, e);
        }
    }

    // ------------------------------------------------------------------ cierre

    /**
     * Señal de parada externa: intenta un close frame (1001, going away) y cierra.
     */
    public void stop() {
        if (closed.get()) return;
        sendFrame(FrameCodec.OP_CLOSE, new byte[] { (byte) 0x03, (byte) 0xE9 });
        close();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            transport.close();
        } catch (IOException e) {
            log.debug("Connection {}: error closing transport: {}", id, e.getMessage());
        }
    }

    private static byte[] closeEcho(byte[] payload) {
        if (payload.length < 2) return new byte[0];
        return new byte[] { payload[0], payload[1] };
    }

    private static byte[] newMaskKey() {
        byte[] key = new byte[4];
        MASKS.nextBytes(key);
        return key;
    }

    @Override
    public String toString() {
        return "Connection#" + id + "[" + transport.describe() + ", " + state() + "]";
    }
}
