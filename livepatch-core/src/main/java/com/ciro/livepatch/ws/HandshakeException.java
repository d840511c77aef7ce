package com.ciro.livepatch.ws;

/**
 * Handshake inválido. En el servidor (sin Sec-WebSocket-Key, sin Upgrade: websocket)
 * la capa HTTP lo traduce a un 4xx; en el cliente, respuesta que no es un 101 válido.
 */
public class HandshakeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int status;

    public HandshakeException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
