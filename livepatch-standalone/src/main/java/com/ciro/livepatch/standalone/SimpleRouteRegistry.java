package com.ciro.livepatch.standalone;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registro manual de páginas por path exacto.
 */
public class SimpleRouteRegistry {

    private final Map<String, Page> routes = new ConcurrentHashMap<>();

    /**
     * Ejemplo: {@code registry.add("/clock", ctx -> ...)}
     */
    public void add(String path, Page page) {
        routes.put(normalize(path), Objects.requireNonNull(page, "page"));
    }

    public Optional<Page> resolve(String path) {
        return Optional.ofNullable(routes.get(normalize(path)));
    }

    static String normalize(String path) {
        String p = path == null || path.isBlank() ? "/" : path.trim();
        if (!p.startsWith("/")) p = "/" + p;
        while (p.length() > 1 && p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p;
    }
}
