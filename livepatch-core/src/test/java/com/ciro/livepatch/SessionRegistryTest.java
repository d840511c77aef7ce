package com.ciro.livepatch;

import com.ciro.livepatch.json.ObjectMapperFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionRegistryTest {

    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(ObjectMapperFactory.create());
    }

    @Test
    void emptySessionIsNeverRegistered() {
        registry.register("", new FakeSink());
        registry.register(null, new FakeSink());
        assertEquals(0, registry.sessionCount());
    }

    @Test
    void unregisterDropsEmptySessions() {
        FakeSink a = new FakeSink();
        FakeSink b = new FakeSink();
        registry.register("s1", a);
        registry.register("s1", b);
        assertEquals(2, registry.connectionCount("s1"));

        registry.unregister("s1", a);
        assertEquals(1, registry.connectionCount("s1"));
        registry.unregister("s1", b);
        assertEquals(0, registry.sessionCount());
        assertFalse(registry.hasConnections("s1"));
    }

    @Test
    void sendPatchesWrapsThemInAPatchEnvelope() {
        FakeSink sink = new FakeSink();
        registry.register("s1", sink);

        assertTrue(registry.sendPatches("s1", List.of(Patch.inline("clock", "<b>12:00</b>"))));
        assertEquals(List.of("{\"type\":\"patch\",\"patches\":[{\"id\":\"clock\",\"swap\":\"inline\",\"html\":\"<b>12:00</b>\"}]}"),
                sink.received);
    }

    @Test
    void oneHealthyTabIsEnoughAndTheBrokenOneIsDropped() {
        FakeSink healthy = new FakeSink();
        FakeSink broken = new FakeSink(false);
        registry.register("s1", broken);
        registry.register("s1", healthy);

        assertTrue(registry.sendPatches("s1", List.of(Patch.inline("a", "1"))));
        assertEquals(1, broken.attempts);
        assertEquals(1, registry.connectionCount("s1"));

        assertTrue(registry.sendPatches("s1", List.of(Patch.inline("a", "2"))));
        assertEquals(1, broken.attempts, "removed connection is not tried again");
        assertEquals(2, healthy.received.size());
    }

    @Test
    void noOneAcceptingMeansNotDelivered() {
        registry.register("s1", new FakeSink(false));
        assertFalse(registry.sendPatches("s1", List.of(Patch.inline("a", "1"))));
        assertEquals(0, registry.sessionCount());
        assertFalse(registry.sendPatches("unknown", List.of(Patch.inline("a", "1"))));
        assertFalse(registry.sendPatches("s1", List.of()));
    }

    @Test
    void reloadReachesEverySession() {
        FakeSink a = new FakeSink();
        FakeSink b = new FakeSink();
        FakeSink dead = new FakeSink(false);
        registry.register("s1", a);
        registry.register("s2", b);
        registry.register("s2", dead);

        assertEquals(2, registry.broadcastReload());
        assertEquals(List.of("{\"type\":\"reload\"}"), a.received);
        assertEquals(List.of("{\"type\":\"reload\"}"), b.received);
        assertEquals(1, registry.connectionCount("s2"));
    }

    @Test
    void closeAllClosesAndForgets() {
        FakeSink a = new FakeSink();
        registry.register("s1", a);
        registry.closeAll();
        assertFalse(a.isOpen());
        assertEquals(0, registry.sessionCount());
    }
}
