package com.ciro.livepatch.client;

import java.net.URI;

/**
 * Opciones del cliente JVM. Los valores por defecto son los del runtime del navegador.
 */
public class ClientOptions {

    /** Origen HTTP del servidor, p. ej. {@code http://127.0.0.1:8080} */
    private URI origin = URI.create("http://127.0.0.1:8080");
    private String basePath = "/lp";
    private long pollIntervalMs = 1500;
    private long reconnectBaseMs = 1200;
    private long reconnectMaxMs = 10_000;
    /** Tope del exponente del backoff */
    private int maxRetry = 6;
    private int receiveTimeoutMs = 1000;
    private int connectTimeoutMs = 3000;
    private int maxFrameBytes = 16 * 1024 * 1024;

    public static ClientOptions forOrigin(String origin) {
        ClientOptions o = new ClientOptions();
        o.setOrigin(URI.create(origin));
        return o;
    }

    public URI getOrigin() { return origin; }
    public void setOrigin(URI origin) { this.origin = origin; }

    public String getBasePath() { return basePath; }
    public void setBasePath(String basePath) { this.basePath = basePath; }

    public long getPollIntervalMs() { return pollIntervalMs; }
    public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }

    public long getReconnectBaseMs() { return reconnectBaseMs; }
    public void setReconnectBaseMs(long reconnectBaseMs) { this.reconnectBaseMs = reconnectBaseMs; }

    public long getReconnectMaxMs() { return reconnectMaxMs; }
    public void setReconnectMaxMs(long reconnectMaxMs) { this.reconnectMaxMs = reconnectMaxMs; }

    public int getMaxRetry() { return maxRetry; }
    public void setMaxRetry(int maxRetry) { this.maxRetry = maxRetry; }

    public int getReceiveTimeoutMs() { return receiveTimeoutMs; }
    public void setReceiveTimeoutMs(int receiveTimeoutMs) { this.receiveTimeoutMs = receiveTimeoutMs; }

    public int getConnectTimeoutMs() { return connectTimeoutMs; }
    public void setConnectTimeoutMs(int connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

    public int getMaxFrameBytes() { return maxFrameBytes; }
    public void setMaxFrameBytes(int maxFrameBytes) { this.maxFrameBytes = maxFrameBytes; }

    URI route(String leaf) {
        String base = basePath.endsWith("/") ? basePath.substring(0, basePath.length() - 1) : basePath;
        return origin.resolve(base + "/" + leaf);
    }
}
