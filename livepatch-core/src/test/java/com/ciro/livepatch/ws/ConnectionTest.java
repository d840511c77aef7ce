package com.ciro.livepatch.ws;

import com.ciro.livepatch.json.ObjectMapperFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionTest {

    private static final byte[] MASK = { 1, 2, 3, 4 };

    private ServerSocket listener;
    private Socket client;
    private Socket accepted;
    private Connection connection;
    private Thread receiver;

    @BeforeEach
    void open() throws IOException {
        listener = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        client = new Socket(InetAddress.getLoopbackAddress(), listener.getLocalPort());
        client.setSoTimeout(5000);
        accepted = listener.accept();

        connection = new Connection(new SocketTransport(accepted, 100), ObjectMapperFactory.create());
        receiver = new Thread(connection::run, "test-receive-loop");
        receiver.start();
    }

    @AfterEach
    void close() throws IOException, InterruptedException {
        connection.close();
        receiver.join(2000);
        client.close();
        listener.close();
    }

    @Test
    void sendWritesAnUnmaskedTextFrame() throws IOException {
        assertTrue(connection.send("hello"));

        InputStream in = client.getInputStream();
        int b0 = in.read();
        int b1 = in.read();
        assertEquals(0x81, b0);
        assertEquals(5, b1, "no mask bit, 5 byte payload");
        assertEquals("hello", new String(in.readNBytes(5), StandardCharsets.UTF_8));
    }

    @Test
    void sendJsonSerializesWithJackson() throws IOException {
        assertTrue(connection.sendJson(Map.of("type", "reload")));
        Frame frame = FrameCodec.decode(client.getInputStream());
        assertEquals("{\"type\":\"reload\"}", frame.text());
    }

    @Test
    void pingIsAnsweredWithPongCarryingTheSamePayload() throws IOException {
        writeFromClient(FrameCodec.OP_PING, "are you there".getBytes(StandardCharsets.UTF_8));

        Frame pong = FrameCodec.decode(client.getInputStream());
        assertEquals(FrameCodec.OP_PONG, pong.opcode());
        assertEquals("are you there", pong.text());
    }

    @Test
    void loopSurvivesIdleTimeouts() throws Exception {
        Thread.sleep(350);
        assertTrue(receiver.isAlive());
        assertEquals(Connection.State.OPEN, connection.state());

        writeFromClient(FrameCodec.OP_PING, new byte[] { 42 });
        assertEquals(FrameCodec.OP_PONG, FrameCodec.decode(client.getInputStream()).opcode());
    }

    @Test
    void closeFrameEndsTheLoopAndClosesTheSocket() throws Exception {
        writeFromClient(FrameCodec.OP_CLOSE, new byte[] { 0x03, (byte) 0xE8 });

        Frame reply = FrameCodec.decode(client.getInputStream());
        assertEquals(FrameCodec.OP_CLOSE, reply.opcode());
        assertArrayEquals(new byte[] { 0x03, (byte) 0xE8 }, reply.payload());

        receiver.join(2000);
        assertFalse(receiver.isAlive());
        assertEquals(Connection.State.CLOSED, connection.state());
        assertFalse(connection.send("late"));
        assertEquals(-1, client.getInputStream().read());
    }

    @Test
    void truncatedFrameClosesTheConnection() throws Exception {
        OutputStream out = client.getOutputStream();
        out.write(new byte[] { (byte) 0x81, (byte) 0x8A });
        out.flush();
        client.shutdownOutput();

        receiver.join(2000);
        assertFalse(receiver.isAlive());
        assertFalse(connection.isOpen());
    }

    @Test
    void stopUnblocksTheReceiveLoop() throws Exception {
        connection.stop();
        receiver.join(2000);
        assertFalse(receiver.isAlive());

        Frame goingAway = FrameCodec.decode(client.getInputStream());
        assertEquals(FrameCodec.OP_CLOSE, goingAway.opcode());
    }

    @Test
    void closeIsIdempotent() {
        connection.close();
        connection.close();
        connection.stop();
        assertEquals(Connection.State.CLOSED, connection.state());
        assertFalse(connection.sendJson(Map.of("a", 1)));
    }

    @Test
    void concurrentSendersNeverInterleaveFrames() throws Exception {
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            char fill = (char) ('A' + t);
            pool.submit(() -> {
                start.await();
                String msg = String.valueOf(fill).repeat(300);
                for (int i = 0; i < perThread; i++) {
                    connection.send(msg);
                }
                return null;
            });
        }
        start.countDown();

        Set<Character> seen = new HashSet<>();
        InputStream in = client.getInputStream();
        for (int i = 0; i < threads * perThread; i++) {
            String text = FrameCodec.decode(in).text();
            assertEquals(300, text.length());
            char c = text.charAt(0);
            assertEquals(String.valueOf(c).repeat(300), text, "frame bytes were interleaved");
            seen.add(c);
        }
        assertEquals(threads, seen.size());

        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    void writeFailureMarksTheConnectionClosed() throws Exception {
        client.close();
        // el primer write puede entrar en el buffer del kernel; insistimos hasta el RST
        boolean failed = false;
        for (int i = 0; i < 200 && !failed; i++) {
            failed = !connection.send("x".repeat(1024));
            Thread.sleep(5);
        }
        assertTrue(failed);
        assertEquals(Connection.State.CLOSED, connection.state());
    }

    private void writeFromClient(int opcode, byte[] payload) throws IOException {
        OutputStream out = client.getOutputStream();
        out.write(FrameCodec.encode(opcode, payload, MASK.clone()));
        out.flush();
    }
}
