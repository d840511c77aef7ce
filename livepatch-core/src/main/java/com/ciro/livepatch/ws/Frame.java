package com.ciro.livepatch.ws;

import java.nio.charset.StandardCharsets;

/**
 * Frame ya decodificado (payload sin máscara).
 */
public record Frame(int opcode, byte[] payload) {

    public boolean isControl() {
        return (opcode & 0x08) != 0;
    }

    public String text() {
        return new String(payload, StandardCharsets.UTF_8);
    }
}
