package com.ciro.livepatch.ws;

import com.ciro.livepatch.spi.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Transport} sobre un {@link Socket} bloqueante clásico.
 */
public class SocketTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(SocketTransport.class);

    private final Socket socket;
    private final InputStream in;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SocketTransport(Socket socket, int readTimeoutMs) throws IOException {
        this(socket, socket.getInputStream(), readTimeoutMs);
    }

    /**
     * Para sockets cuyo stream de entrada ya fue envuelto (p. ej. tras leer las
     * cabeceras HTTP del handshake con un buffer).
     */
    public SocketTransport(Socket socket, InputStream in, int readTimeoutMs) throws SocketException {
        this.socket = socket;
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
        socket.setSoTimeout(readTimeoutMs);
        socket.setTcpNoDelay(true);
    }

    @Override
    public InputStream input() {
        return in;
    }

    @Override
    public OutputStream output() throws IOException {
        return socket.getOutputStream();
    }

    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) return;
        try {
            if (!socket.isClosed()) {
                socket.shutdownInput();
                socket.shutdownOutput();
            }
        } catch (IOException e) {
            // el otro extremo ya cerró; igual hay que liberar el descriptor
            log.trace("Shutdown of {} failed: {}", describe(), e.getMessage());
        } finally {
            socket.close();
        }
    }

    @Override
    public String describe() {
        return String.valueOf(socket.getRemoteSocketAddress());
    }
}
