package com.ciro.livepatch.standalone;

import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.Cookie;
import io.undertow.util.Headers;

public final class CookieUtil {

    private CookieUtil() {}

    public static String getCookie(HttpServerExchange exchange, String name) {
        Cookie cookie = exchange.getRequestCookie(name);
        if (cookie == null) return null;
        String value = cookie.getValue();
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * Cookie de sesión: Path=/ para que llegue a las páginas y a {base}/ws, /poll e /invalid.
     * Va como cabecera directa porque también tiene que salir en el 101 del upgrade.
     */
    public static void setSessionCookie(HttpServerExchange exchange, String name, String value) {
        String cookie = name + "=" + value + "; Path=/; HttpOnly; SameSite=Lax";
        exchange.getResponseHeaders().add(Headers.SET_COOKIE, cookie);
    }
}
