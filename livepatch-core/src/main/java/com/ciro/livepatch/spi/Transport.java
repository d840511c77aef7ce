package com.ciro.livepatch.spi;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Socket ya "upgradeado" sobre el que corre el protocolo de frames.
 *
 * <p>Las lecturas de {@link #input()} deben tener un timeout acotado y reportarlo como
 * {@link java.io.InterruptedIOException}, para que el loop de recepción pueda ver la
 * señal de parada.
 */
public interface Transport extends Closeable {

    InputStream input() throws IOException;

    OutputStream output() throws IOException;

    /** Cierra ambos sentidos. Puede llamarse más de una vez. */
    @Override
    void close() throws IOException;

    /** Descripción corta para logs (dirección remota, etc.). */
    String describe();
}
