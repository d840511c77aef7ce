package com.ciro.livepatch.client;

import com.ciro.livepatch.ws.Connection;
import com.ciro.livepatch.ws.FrameCodec;
import com.ciro.livepatch.ws.HandshakeException;
import com.ciro.livepatch.ws.SocketTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.CookieManager;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Handshake de cliente sobre un {@link Socket} plano.
 *
 * <p>Las cookies salen y entran por el mismo {@link CookieManager} que usa el
 * {@code HttpClient} del poll, así WebSocket y polling comparten sesión.
 */
class WebSocketDialer {

    private static final Logger log = LoggerFactory.getLogger(WebSocketDialer.class);

    private static final SecureRandom RNG = new SecureRandom();
    private static final int MAX_HEADER_BYTES = 16 * 1024;

    private final ClientOptions options;
    private final CookieManager cookies;
    private final ObjectMapper mapper;

    WebSocketDialer(ClientOptions options, CookieManager cookies, ObjectMapper mapper) {
        this.options = options;
        this.cookies = cookies;
        this.mapper = mapper;
    }

    /**
     * Abre el socket, hace el handshake y devuelve la conexión lista para {@code run()}.
     *
     * @throws HandshakeException si el servidor no contesta 101 o el accept no coincide
     */
    Connection dial() throws IOException {
        URI http = options.route("ws");
        int port = http.getPort() > 0 ? http.getPort() : 80;

        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(http.getHost(), port), options.getConnectTimeoutMs());
            socket.setSoTimeout(options.getConnectTimeoutMs());

            String key = newKey();
            OutputStream out = socket.getOutputStream();
            out.write(request(http, port, key).getBytes(StandardCharsets.ISO_8859_1));
            out.flush();

            BufferedInputStream in = new BufferedInputStream(socket.getInputStream());
            List<String> head = readHead(in);
            Map<String, List<String>> headers = parseHeaders(head);
            verify(head.get(0), headers, key);

            List<String> setCookie = headers.get("set-cookie");
            if (setCookie != null) {
                cookies.put(http, Map.of("Set-Cookie", setCookie));
            }

            SocketTransport transport = new SocketTransport(socket, in, options.getReceiveTimeoutMs());
            Connection conn = new Connection(transport, mapper, Connection.Role.CLIENT, options.getMaxFrameBytes());
            log.debug("WebSocket open to {} ({})", http, conn);
            return conn;
        } catch (IOException | RuntimeException e) {
            closeQuietly(socket, e);
            throw e;
        }
    }

    private String request(URI http, int port, String key) throws IOException {
        StringBuilder sb = new StringBuilder();
        sb.append("GET ").append(http.getRawPath()).append(" HTTP/1.1\r\n");
        sb.append("Host: ").append(http.getHost()).append(':').append(port).append("\r\n");
        sb.append("Upgrade: websocket\r\n");
        sb.append("Connection: Upgrade\r\n");
        sb.append("Sec-WebSocket-Key: ").append(key).append("\r\n");
        sb.append("Sec-WebSocket-Version: 13\r\n");

        List<String> cookieHeader = cookies.get(http, Map.of()).get("Cookie");
        if (cookieHeader != null && !cookieHeader.isEmpty()) {
            sb.append("Cookie: ").append(String.join("; ", cookieHeader)).append("\r\n");
        }
        sb.append("\r\n");
        return sb.toString();
    }

    /** Lee hasta la línea vacía; lo que venga después queda en el buffer para el loop. */
    static List<String> readHead(InputStream in) throws IOException {
        List<String> lines = new ArrayList<>();
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int total = 0;
        while (true) {
            int b = in.read();
            if (b == -1) throw new EOFException("Connection closed during handshake");
            if (++total > MAX_HEADER_BYTES) throw new HandshakeException(431, "Handshake response headers too large");
            if (b == '\n') {
                String s = line.toString(StandardCharsets.ISO_8859_1);
                if (s.endsWith("\r")) s = s.substring(0, s.length() - 1);
                if (s.isEmpty()) {
                    if (lines.isEmpty()) throw new HandshakeException(502, "Empty handshake response");
                    return lines;
                }
                lines.add(s);
                line.reset();
            } else {
                line.write(b);
            }
        }
    }

    static Map<String, List<String>> parseHeaders(List<String> head) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String h : head.subList(1, head.size())) {
            int colon = h.indexOf(':');
            if (colon <= 0) continue;
            String name = h.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            headers.computeIfAbsent(name, k -> new ArrayList<>()).add(h.substring(colon + 1).trim());
        }
        return headers;
    }

    static void verify(String statusLine, Map<String, List<String>> headers, String key) {
        String[] parts = statusLine.split(" ", 3);
        if (parts.length < 2 || !"101".equals(parts[1])) {
            throw new HandshakeException(502, "Unexpected handshake status: " + statusLine);
        }
        String upgrade = first(headers, "upgrade");
        if (upgrade == null || !upgrade.equalsIgnoreCase("websocket")) {
            throw new HandshakeException(502, "Missing Upgrade: websocket in handshake response");
        }
        String accept = first(headers, "sec-websocket-accept");
        if (!FrameCodec.acceptToken(key).equals(accept)) {
            throw new HandshakeException(502, "Sec-WebSocket-Accept mismatch");
        }
    }

    private static String first(Map<String, List<String>> headers, String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static String newKey() {
        byte[] nonce = new byte[16];
        RNG.nextBytes(nonce);
        return Base64.getEncoder().encodeToString(nonce);
    }

    private static void closeQuietly(Socket socket, Exception cause) {
        try {
            socket.close();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }
}
