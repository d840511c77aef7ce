package com.ciro.livepatch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Instrucción inmutable "aplica este HTML a este nodo".
 *
 * <p>En el wire: {@code {"id": targetId, "swap": "inline", "html": "..."}}.
 */
@JsonPropertyOrder({ "id", "swap", "html" })
public record Patch(
        @JsonProperty("id") String targetId,
        @JsonProperty("swap") Swap swap,
        @JsonProperty("html") String html) {

    @JsonCreator
    public Patch {
        targetId = targetId == null ? "" : targetId;
        swap = swap == null ? Swap.INLINE : swap;
        html = html == null ? "" : html;
    }

    public static Patch inline(String targetId, String html) {
        return new Patch(targetId, Swap.INLINE, html);
    }

    public static Patch outline(String targetId, String html) {
        return new Patch(targetId, Swap.OUTLINE, html);
    }

    public boolean hasTarget() {
        return !targetId.isEmpty();
    }
}
