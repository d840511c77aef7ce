package com.ciro.livepatch.ws;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.SequenceInputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class FrameCodecTest {

    private static final byte[] MASK = { 0x37, (byte) 0xfa, 0x21, 0x3d };

    @Test
    void acceptTokenMatchesRfcVector() {
        assertEquals("s3pPLMBiTxaQ9kYGzzhZRbK+xOo=", FrameCodec.acceptToken("dGhlIHNhbXBsZSBub25jZQ=="));
    }

    @Test
    void acceptTokenIsDeterministic() {
        String key = "x3JJHMbDL1EzLkh9GBhXDw==";
        assertEquals(FrameCodec.acceptToken(key), FrameCodec.acceptToken(key));
    }

    @Test
    void acceptTokenRejectsMissingKey() {
        HandshakeException e = assertThrows(HandshakeException.class, () -> FrameCodec.acceptToken(null));
        assertEquals(400, e.getStatus());
        assertThrows(HandshakeException.class, () -> FrameCodec.acceptToken("  "));
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 10, 125, 126, 200, 65535, 65536, 100_000 })
    void maskedTextSurvivesEncodeDecode(int size) throws IOException {
        String text = payloadOf(size);

        byte[] wire = FrameCodec.encode(FrameCodec.OP_TEXT, text.getBytes(StandardCharsets.UTF_8), MASK.clone());
        assertEquals(0x80, wire[1] & 0x80, "client frames carry the mask bit");

        Frame frame = FrameCodec.decode(new ByteArrayInputStream(wire));
        assertEquals(FrameCodec.OP_TEXT, frame.opcode());
        assertEquals(text, frame.text());
    }

    @Test
    void serverFramesAreUnmaskedWithFinSet() {
        byte[] wire = FrameCodec.encodeText("hi");
        assertEquals(0x81, wire[0] & 0xFF);
        assertEquals(2, wire[1]);
        assertEquals("hi", new String(wire, 2, 2, StandardCharsets.UTF_8));
    }

    @Test
    void lengthEncodingUsesTheSmallestForm() {
        assertEquals(2 + 125, FrameCodec.encode(FrameCodec.OP_TEXT, new byte[125]).length);

        byte[] medium = FrameCodec.encode(FrameCodec.OP_TEXT, new byte[200]);
        assertEquals(126, medium[1]);
        assertEquals(200, ((medium[2] & 0xFF) << 8) | (medium[3] & 0xFF));

        byte[] large = FrameCodec.encode(FrameCodec.OP_TEXT, new byte[100_000]);
        assertEquals(127, large[1]);
        assertEquals(2 + 8 + 100_000, large.length);
    }

    @Test
    void unknownOpcodesPassThrough() throws IOException {
        byte[] wire = FrameCodec.encode(0x3, new byte[] { 1, 2, 3 });
        Frame frame = FrameCodec.decode(new ByteArrayInputStream(wire));
        assertEquals(0x3, frame.opcode());
        assertArrayEquals(new byte[] { 1, 2, 3 }, frame.payload());
    }

    @Test
    void truncatedPayloadIsAFrameError() {
        byte[] wire = FrameCodec.encodeText("truncated payload");
        byte[] cut = Arrays.copyOf(wire, wire.length - 4);
        assertThrows(FrameException.class, () -> FrameCodec.decode(new ByteArrayInputStream(cut)));
    }

    @Test
    void truncatedExtendedLengthIsAFrameError() {
        byte[] cut = { (byte) 0x81, 127, 0, 0 };
        assertThrows(FrameException.class, () -> FrameCodec.decode(new ByteArrayInputStream(cut)));
    }

    @Test
    void emptyStreamIsAFrameError() {
        assertThrows(FrameException.class, () -> FrameCodec.decode(new ByteArrayInputStream(new byte[0])));
    }

    @Test
    void oversizedPayloadIsRejected() {
        byte[] wire = FrameCodec.encode(FrameCodec.OP_TEXT, new byte[2048]);
        assertThrows(FrameException.class, () -> FrameCodec.decode(new ByteArrayInputStream(wire), 1024));
    }

    @Test
    void timeoutBeforeFirstByteMeansIdle() {
        InputStream idle = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new SocketTimeoutException("idle");
            }
        };
        assertThrows(InterruptedIOException.class, () -> FrameCodec.decode(idle));
    }

    @Test
    void timeoutInsideAFrameIsAFrameError() {
        InputStream stalls = new SequenceInputStream(
                new ByteArrayInputStream(new byte[] { (byte) 0x81, 10 }),
                new InputStream() {
                    @Override
                    public int read() throws IOException {
                        throw new SocketTimeoutException("stalled");
                    }
                });
        assertThrows(FrameException.class, () -> FrameCodec.decode(stalls));
    }

    @Test
    void malformedFramesAreRefusedOnEncode() {
        assertThrows(IllegalArgumentException.class, () -> FrameCodec.encode(FrameCodec.OP_TEXT, null));
        assertThrows(IllegalArgumentException.class, () -> FrameCodec.encode(0x10, new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> FrameCodec.encode(FrameCodec.OP_PING, new byte[126]));
        assertThrows(IllegalArgumentException.class,
                () -> FrameCodec.encode(FrameCodec.OP_TEXT, new byte[1], new byte[3]));
    }

    private static String payloadOf(int size) {
        StringBuilder sb = new StringBuilder(size);
        for (int i = 0; i < size; i++) {
            sb.append((char) ('a' + (i % 26)));
        }
        return sb.toString();
    }
}
