package com.ciro.livepatch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Cómo aplica el cliente el HTML de un {@link Patch} sobre su nodo destino.
 */
public enum Swap {
    /** Reemplaza el contenido del nodo. */
    INLINE,
    /** Reemplaza el nodo completo. */
    OUTLINE,
    /** Inserta al final del contenido. */
    APPEND,
    /** Inserta al principio del contenido. */
    PREPEND,
    /** Sin efecto en el DOM; el patch sólo actúa como señal. */
    NONE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Nombre de wire a enum. Null o vacío significa {@link #INLINE}; un modo desconocido
     * es {@link #NONE}, así el cliente ignora ese patch y aplica el resto del batch.
     */
    @JsonCreator
    public static Swap fromWire(String value) {
        if (value == null || value.isBlank()) return INLINE;
        String name = value.trim().toUpperCase(Locale.ROOT);
        for (Swap swap : values()) {
            if (swap.name().equals(name)) return swap;
        }
        return NONE;
    }
}
