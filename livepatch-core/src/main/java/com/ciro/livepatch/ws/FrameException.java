package com.ciro.livepatch.ws;

import java.io.IOException;

/**
 * Fallo de transporte al leer un frame: stream truncado, longitud inválida, etc.
 * Siempre termina con el cierre de la conexión afectada.
 */
public class FrameException extends IOException {

    private static final long serialVersionUID = 1L;

    public FrameException(String message) {
        super(message);
    }

    public FrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
