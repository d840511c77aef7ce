package com.ciro.livepatch.client;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Documento plano: id → contenido. Sirve para tests y para clientes headless.
 *
 * <p>Un reemplazo de nodo ({@code outline}) toma el id del primer tag del HTML nuevo; si
 * no trae id, el nodo desaparece (igual que en el navegador, donde ya no se lo encuentra).
 */
public class InMemoryDocument implements DocumentModel {

    private static final Pattern FIRST_TAG = Pattern.compile("^\\s*<([a-zA-Z][\\w-]*)([^>]*)>", Pattern.DOTALL);
    private static final Pattern ID_ATTR = Pattern.compile("\\bid\\s*=\\s*['\"]([^'\"]+)['\"]");

    private final Map<String, String> nodes = new LinkedHashMap<>();
    private final AtomicInteger reloads = new AtomicInteger();

    public InMemoryDocument() {}

    public InMemoryDocument(Map<String, String> initial) {
        nodes.putAll(initial);
    }

    public synchronized InMemoryDocument put(String id, String inner) {
        nodes.put(id, inner);
        return this;
    }

    public synchronized InMemoryDocument remove(String id) {
        nodes.remove(id);
        return this;
    }

    public synchronized Optional<String> inner(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public int reloadCount() {
        return reloads.get();
    }

    @Override
    public synchronized boolean contains(String id) {
        return nodes.containsKey(id);
    }

    @Override
    public synchronized void setInner(String id, String html) {
        nodes.computeIfPresent(id, (k, v) -> html);
    }

    @Override
    public synchronized void replaceNode(String id, String html) {
        if (nodes.remove(id) == null) return;
        Matcher tag = FIRST_TAG.matcher(html);
        if (!tag.find()) return;
        Matcher idAttr = ID_ATTR.matcher(tag.group(2));
        if (!idAttr.find()) return;

        String body = html.substring(tag.end());
        int close = body.lastIndexOf("</");
        nodes.put(idAttr.group(1), close >= 0 ? body.substring(0, close) : body);
    }

    @Override
    public synchronized void append(String id, String html) {
        nodes.computeIfPresent(id, (k, v) -> v + html);
    }

    @Override
    public synchronized void prepend(String id, String html) {
        nodes.computeIfPresent(id, (k, v) -> html + v);
    }

    @Override
    public void reload() {
        reloads.incrementAndGet();
    }

    @Override
    public synchronized String toString() {
        return "InMemoryDocument" + nodes;
    }
}
