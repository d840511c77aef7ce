package com.ciro.livepatch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Mensaje push/poll: {@code {"type":"patch","patches":[...]}} o {@code {"type":"reload"}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "type", "patches" })
public record Envelope(
        @JsonProperty("type") String type,
        @JsonProperty("patches") List<Patch> patches) {

    public static final String TYPE_PATCH = "patch";
    public static final String TYPE_RELOAD = "reload";

    private static final Envelope RELOAD = new Envelope(TYPE_RELOAD, null);

    @JsonCreator
    public Envelope {
        type = type == null ? TYPE_PATCH : type;
        patches = patches == null ? null : List.copyOf(patches);
    }

    public static Envelope patches(List<Patch> patches) {
        return new Envelope(TYPE_PATCH, patches == null ? List.of() : patches);
    }

    public static Envelope reload() {
        return RELOAD;
    }

    @JsonIgnore
    public boolean isReload() {
        return TYPE_RELOAD.equals(type);
    }

    /** Nunca null, aunque el JSON no traiga la lista. */
    @JsonIgnore
    public List<Patch> patchList() {
        return patches == null ? List.of() : patches;
    }
}
