package com.ciro.livepatch;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * Nodo destino de un patch (id del DOM) junto con el modo de swap.
 *
 * <pre>
 *   PatchTarget clock = PatchTarget.generate();
 *   html = "&lt;div id='" + clock.id() + "'&gt;...";
 *   ctx.patch(clock.replace(), render(now), stop);
 * </pre>
 */
public record PatchTarget(String id, Swap swap) {

    private static final SecureRandom RNG = new SecureRandom();
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    public PatchTarget {
        Objects.requireNonNull(id, "id");
        swap = swap == null ? Swap.INLINE : swap;
    }

    public static PatchTarget of(String id) {
        return new PatchTarget(id, Swap.INLINE);
    }

    /** Id aleatorio válido como atributo HTML ("t" + 16 hex). */
    public static PatchTarget generate() {
        byte[] b = new byte[8];
        RNG.nextBytes(b);
        StringBuilder sb = new StringBuilder("t");
        for (byte x : b) {
            sb.append(HEX[(x >> 4) & 0x0F]).append(HEX[x & 0x0F]);
        }
        return of(sb.toString());
    }

    public PatchTarget render()  { return with(Swap.INLINE); }
    public PatchTarget replace() { return with(Swap.OUTLINE); }
    public PatchTarget append()  { return with(Swap.APPEND); }
    public PatchTarget prepend() { return with(Swap.PREPEND); }
    public PatchTarget signal()  { return with(Swap.NONE); }

    public Patch toPatch(String html) {
        return new Patch(id, swap, html);
    }

    private PatchTarget with(Swap s) {
        return s == swap ? this : new PatchTarget(id, s);
    }
}
