package com.ciro.livepatch.client;

import com.ciro.livepatch.ws.FrameCodec;
import com.ciro.livepatch.ws.HandshakeException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebSocketDialerTest {

    private static final String KEY = "dGhlIHNhbXBsZSBub25jZQ==";

    @Test
    void readHeadStopsAtTheBlankLineAndLeavesTheFirstFrame() throws IOException {
        byte[] frame = FrameCodec.encodeText("hi");
        byte[] head = ("HTTP/1.1 101 Switching Protocols\r\n"
                + "Upgrade: websocket\r\n"
                + "Connection: Upgrade\r\n\r\n").getBytes(StandardCharsets.ISO_8859_1);
        byte[] all = new byte[head.length + frame.length];
        System.arraycopy(head, 0, all, 0, head.length);
        System.arraycopy(frame, 0, all, head.length, frame.length);
        InputStream in = new ByteArrayInputStream(all);

        List<String> lines = WebSocketDialer.readHead(in);

        assertEquals(3, lines.size());
        assertEquals("hi", FrameCodec.decode(in).text());
    }

    @Test
    void readHeadFailsOnEarlyEof() {
        InputStream in = new ByteArrayInputStream("HTTP/1.1 101\r\nUpgr".getBytes(StandardCharsets.ISO_8859_1));
        assertThrows(EOFException.class, () -> WebSocketDialer.readHead(in));
    }

    @Test
    void validResponseIsAccepted() {
        List<String> head = List.of(
                "HTTP/1.1 101 Switching Protocols",
                "upgrade: WebSocket",
                "Sec-WebSocket-Accept: s3pPLMBiTxaQ9kYGzzhZRbK+xOo=",
                "Set-Cookie: LPSID=abc; Path=/");
        Map<String, List<String>> headers = WebSocketDialer.parseHeaders(head);

        assertDoesNotThrow(() -> WebSocketDialer.verify(head.get(0), headers, KEY));
        assertEquals(List.of("LPSID=abc; Path=/"), headers.get("set-cookie"));
    }

    @Test
    void non101IsRejected() {
        List<String> head = List.of("HTTP/1.1 404 Not Found", "Content-Length: 0");
        HandshakeException e = assertThrows(HandshakeException.class,
                () -> WebSocketDialer.verify(head.get(0), WebSocketDialer.parseHeaders(head), KEY));
        assertTrue(e.getMessage().contains("404"));
    }

    @Test
    void wrongAcceptIsRejected() {
        List<String> head = List.of(
                "HTTP/1.1 101 Switching Protocols",
                "Upgrade: websocket",
                "Sec-WebSocket-Accept: bogus");
        assertThrows(HandshakeException.class,
                () -> WebSocketDialer.verify(head.get(0), WebSocketDialer.parseHeaders(head), KEY));
    }
}
