package com.ciro.livepatch.ws;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Subconjunto mínimo de RFC 6455: handshake, frames de texto, ping/pong y close.
 *
 * <p>Los frames del servidor salen siempre con FIN y sin máscara; los del cliente
 * se enmascaran con {@link #encode(int, byte[], byte[])}. No hay fragmentación ni
 * extensiones.
 */
public final class FrameCodec {

    public static final String WS_GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";

    public static final int OP_CONTINUATION = 0x0;
    public static final int OP_TEXT = 0x1;
    public static final int OP_BINARY = 0x2;
    public static final int OP_CLOSE = 0x8;
    public static final int OP_PING = 0x9;
    public static final int OP_PONG = 0xA;

    public static final int DEFAULT_MAX_PAYLOAD = 16 * 1024 * 1024;

    private FrameCodec() {}

    // ---------------------------------------------------------------- handshake

    /**
     * base64(SHA-1(key + GUID)).
     *
     * @throws HandshakeException si la clave falta o está vacía
     */
    public static String acceptToken(String key) {
        if (key == null || key.isBlank()) {
            throw new HandshakeException(400, "Missing Sec-WebSocket-Key");
        }
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            byte[] hash = sha1.digest((key.trim() + WS_GUID).getBytes(StandardCharsets.US_ASCII));
            return Base64.getEncoder().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            // SHA-1 es obligatorio en toda JVM
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    // ---------------------------------------------------------------- decode

    public static Frame decode(InputStream in) throws IOException {
        return decode(in, DEFAULT_MAX_PAYLOAD);
    }

    /**
     * Lee un frame completo.
     *
     * <p>Un timeout antes del primer byte se propaga tal cual
     * ({@link InterruptedIOException}): la conexión está ociosa, no rota. Cualquier
     * corte a mitad de frame es un {@link FrameException}.
     */
    public static Frame decode(InputStream in, int maxPayload) throws IOException {
        int first = in.read();
        if (first < 0) {
            throw new FrameException("Stream closed before frame header");
        }

        int second = readByte(in);
        int opcode = first & 0x0F;
        boolean masked = (second & 0x80) != 0;
        long length = second & 0x7F;

        if (length == 126) {
            byte[] ext = readFully(in, 2);
            length = ((ext[0] & 0xFFL) << 8) | (ext[1] & 0xFFL);
        } else if (length == 127) {
            byte[] ext = readFully(in, 8);
            length = 0;
            for (byte b : ext) {
                length = (length << 8) | (b & 0xFFL);
            }
            if (length < 0) {
                throw new FrameException("Negative payload length");
            }
        }

        if (length > maxPayload) {
            throw new FrameException("Payload too large: " + length + " > " + maxPayload);
        }

        byte[] mask = masked ? readFully(in, 4) : null;
        byte[] payload = length == 0 ? new byte[0] : readFully(in, (int) length);
        if (mask != null) {
            mask(payload, mask);
        }
        return new Frame(opcode, payload);
    }

    // ---------------------------------------------------------------- encode

    /** Frame de servidor: FIN, sin máscara. */
    public static byte[] encode(int opcode, byte[] payload) {
        return encode(opcode, payload, null);
    }

    /**
     * Frame con FIN. Si {@code maskKey} no es null (rol cliente) el payload viaja
     * enmascarado con esa clave de 4 bytes.
     *
     * @throws IllegalArgumentException si el frame no se puede representar
     */
    public static byte[] encode(int opcode, byte[] payload, byte[] maskKey) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        if (opcode < 0 || opcode > 0x0F) {
            throw new IllegalArgumentException("Invalid opcode: " + opcode);
        }
        if (maskKey != null && maskKey.length != 4) {
            throw new IllegalArgumentException("Mask key must be 4 bytes");
        }
        if ((opcode & 0x08) != 0 && payload.length > 125) {
            throw new IllegalArgumentException("Control frame payload exceeds 125 bytes");
        }

        int len = payload.length;
        int headerLen = 2 + (len < 126 ? 0 : len < 65536 ? 2 : 8) + (maskKey != null ? 4 : 0);
        byte[] frame = new byte[headerLen + len];

        int maskBit = maskKey != null ? 0x80 : 0;
        frame[0] = (byte) (0x80 | opcode);
        int pos;
        if (len < 126) {
            frame[1] = (byte) (maskBit | len);
            pos = 2;
        } else if (len < 65536) {
            frame[1] = (byte) (maskBit | 126);
            frame[2] = (byte) (len >>> 8);
            frame[3] = (byte) len;
            pos = 4;
        } else {
            frame[1] = (byte) (maskBit | 127);
            long l = len;
            for (int i = 0; i < 8; i++) {
                frame[2 + i] = (byte) (l >>> (56 - 8 * i));
            }
            pos = 10;
        }

        if (maskKey != null) {
            System.arraycopy(maskKey, 0, frame, pos, 4);
            pos += 4;
            for (int i = 0; i < len; i++) {
                frame[pos + i] = (byte) (payload[i] ^ maskKey[i % 4]);
            }
        } else {
            System.arraycopy(payload, 0, frame, pos, len);
        }
        return frame;
    }

    public static byte[] encodeText(String text) {
        return encode(OP_TEXT, text.getBytes(StandardCharsets.UTF_8));
    }

    /** XOR in-place; aplicar dos veces con la misma clave deja el dato original. */
    public static void mask(byte[] data, byte[] key) {
        for (int i = 0; i < data.length; i++) {
            data[i] ^= key[i % 4];
        }
    }

    // ---------------------------------------------------------------- helpers

    private static int readByte(InputStream in) throws IOException {
        return readFully(in, 1)[0] & 0xFF;
    }

    private static byte[] readFully(InputStream in, int size) throws IOException {
        byte[] buf = new byte[size];
        int off = 0;
        while (off < size) {
            int n;
            try {
                n = in.read(buf, off, size - off);
            } catch (InterruptedIOException e) {
                throw new FrameException("Timed out inside a frame after " + off + "/" + size + " bytes", e);
            }
            if (n < 0) {
                throw new FrameException("Truncated frame: expected " + size + " bytes, got " + off);
            }
            off += n;
        }
        return buf;
    }
}
