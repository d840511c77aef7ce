package com.ciro.livepatch.standalone;

import com.ciro.livepatch.spi.Transport;
import org.xnio.StreamConnection;
import org.xnio.channels.ReadTimeoutException;
import org.xnio.streams.ChannelInputStream;
import org.xnio.streams.ChannelOutputStream;

import java.io.BufferedInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Transport} sobre el canal crudo que deja Undertow tras el 101.
 *
 * <p>Se usa en modo bloqueante desde un hilo propio; nunca desde el hilo de IO de XNIO.
 */
public class UndertowTransport implements Transport {

    private final StreamConnection connection;
    private final InputStream in;
    private final OutputStream out;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public UndertowTransport(StreamConnection connection, int readTimeoutMs) {
        this.connection = connection;
        this.in = new BufferedInputStream(new TimeoutTranslatingStream(
                new ChannelInputStream(connection.getSourceChannel(), readTimeoutMs, TimeUnit.MILLISECONDS)));
        this.out = new ChannelOutputStream(connection.getSinkChannel());
    }

    @Override
    public InputStream input() {
        return in;
    }

    @Override
    public OutputStream output() {
        return out;
    }

    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) return;
        connection.close();
    }

    @Override
    public String describe() {
        return String.valueOf(connection.getPeerAddress());
    }

    /** El timeout de lectura de XNIO se presenta como el de un socket. */
    private static final class TimeoutTranslatingStream extends FilterInputStream {

        TimeoutTranslatingStream(InputStream in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            try {
                return super.read();
            } catch (ReadTimeoutException e) {
                throw timeout(e);
            }
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            try {
                return super.read(b, off, len);
            } catch (ReadTimeoutException e) {
                throw timeout(e);
            }
        }

        private static SocketTimeoutException timeout(ReadTimeoutException e) {
            SocketTimeoutException t = new SocketTimeoutException("Read timed out");
            t.initCause(e);
            return t;
        }
    }
}
