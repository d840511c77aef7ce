package com.ciro.livepatch;

import com.ciro.livepatch.json.ObjectMapperFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PatchContextTest {

    private final PatchDispatcher dispatcher = new PatchDispatcher(new SessionRegistry(ObjectMapperFactory.create()));
    private final PatchContext ctx = new PatchContext("s1", dispatcher);

    @Test
    void patchUsesTheTargetSwap() {
        ctx.patch(PatchTarget.of("list").append(), "<li>x</li>");
        ctx.patch(PatchTarget.of("box").replace(), "<div id='box'></div>");

        assertEquals(List.of(
                new Patch("list", Swap.APPEND, "<li>x</li>"),
                new Patch("box", Swap.OUTLINE, "<div id='box'></div>")),
                dispatcher.drainPatches("s1"));
    }

    @Test
    void failingSupplierSendsEmptyHtml() {
        ctx.patch(PatchTarget.of("a"), () -> { throw new IllegalStateException("boom"); }, null);
        assertEquals(List.of(Patch.inline("a", "")), dispatcher.drainPatches("s1"));
    }

    @Test
    void supplierCleanupIsRegistered() {
        AtomicInteger runs = new AtomicInteger();
        ctx.patch(PatchTarget.of("a"), () -> "ok", runs::incrementAndGet);
        dispatcher.notifyInvalid("s1", "a");
        assertEquals(1, runs.get());
    }

    @Test
    void deferredContentArrivesWhenReady() throws Exception {
        CompletableFuture<String> slow = new CompletableFuture<>();
        CompletableFuture<Void> done = ctx.patchAsync(PatchTarget.of("d").replace(), slow);
        assertEquals(List.of(), dispatcher.drainPatches("s1"));

        slow.complete("<p id='d'>ready</p>");
        done.get(1, TimeUnit.SECONDS);

        assertEquals(List.of(Patch.outline("d", "<p id='d'>ready</p>")), dispatcher.drainPatches("s1"));
    }

    @Test
    void failedDeferredContentSendsEmptyHtml() throws Exception {
        ctx.patchAsync(PatchTarget.of("d"), CompletableFuture.failedFuture(new IllegalStateException("db down")))
                .get(1, TimeUnit.SECONDS);
        assertEquals(List.of(Patch.inline("d", "")), dispatcher.drainPatches("s1"));
    }

    @Test
    void contextWithoutSessionDropsPatches() {
        PatchContext anonymous = new PatchContext(null, dispatcher);
        AtomicInteger runs = new AtomicInteger();
        anonymous.patch(PatchTarget.of("a"), "x", runs::incrementAndGet);
        assertEquals(1, runs.get());
        assertEquals("", anonymous.sessionId());
    }

    @Test
    void generatedTargetsAreValidDistinctIds() {
        PatchTarget a = PatchTarget.generate();
        PatchTarget b = PatchTarget.generate();
        assertTrue(a.id().matches("t[0-9a-f]{16}"));
        assertNotEquals(a.id(), b.id());
        assertEquals(Swap.INLINE, a.swap());
        assertSame(a, a.render());
    }
}
