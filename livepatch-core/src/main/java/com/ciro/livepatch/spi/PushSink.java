package com.ciro.livepatch.spi;

/**
 * Destino de mensajes push de una sesión (una pestaña abierta).
 */
public interface PushSink {

    boolean isOpen();

    /**
     * Envía un mensaje de texto ya serializado.
     *
     * @return false si el destino no aceptó el mensaje; en ese caso queda cerrado
     */
    boolean send(String json);

    void close();
}
