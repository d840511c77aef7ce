package com.ciro.livepatch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Configuración del servidor. Claves {@code livepatch.*} leídas de
 * {@code livepatch.properties} en el classpath y sobreescritas por system properties.
 */
public class LivePatchConfig {

    private static final Logger log = LoggerFactory.getLogger(LivePatchConfig.class);

    public static final String RESOURCE = "livepatch.properties";
    public static final String PREFIX = "livepatch.";

    private int port = 8080;
    private String host = "0.0.0.0";
    /** Prefijo de las rutas de transporte: {basePath}/ws, /poll, /invalid */
    private String basePath = "/lp";
    private String cookieName = "LPSID";
    /** Espera máxima de cada lectura del loop de recepción */
    private int receiveTimeoutMs = 1000;
    private int maxFrameBytes = 16 * 1024 * 1024;
    /** 0 = las sesiones nunca expiran */
    private long sessionIdleTtlMinutes = 0;
    /** 0 = sin límite */
    private long maxSessions = 0;
    private boolean autoReload = false;
    private List<String> autoReloadDirs = new ArrayList<>(List.of("."));
    private long autoReloadIntervalMs = 1000;

    public static LivePatchConfig load() {
        Properties props = new Properties();
        ClassLoader cl = LivePatchConfig.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        System.getProperties().forEach((k, v) -> {
            String key = String.valueOf(k);
            if (key.startsWith(PREFIX)) props.setProperty(key, String.valueOf(v));
        });
        return from(props);
    }

    public static LivePatchConfig from(Properties props) {
        LivePatchConfig c = new LivePatchConfig();
        c.setPort(intProp(props, "port", c.port));
        c.setHost(props.getProperty(PREFIX + "host", c.host).trim());
        c.setBasePath(props.getProperty(PREFIX + "base-path", c.basePath));
        c.setCookieName(props.getProperty(PREFIX + "cookie-name", c.cookieName).trim());
        c.setReceiveTimeoutMs(intProp(props, "receive-timeout-ms", c.receiveTimeoutMs));
        c.setMaxFrameBytes(intProp(props, "max-frame-bytes", c.maxFrameBytes));
        c.setSessionIdleTtlMinutes(longProp(props, "session-idle-ttl-minutes", c.sessionIdleTtlMinutes));
        c.setMaxSessions(longProp(props, "max-sessions", c.maxSessions));
        c.setAutoReload(Boolean.parseBoolean(props.getProperty(PREFIX + "auto-reload", String.valueOf(c.autoReload)).trim()));
        String dirs = props.getProperty(PREFIX + "auto-reload-dirs");
        if (dirs != null && !dirs.isBlank()) {
            List<String> list = new ArrayList<>();
            for (String d : dirs.split(",")) {
                if (!d.isBlank()) list.add(d.trim());
            }
            c.setAutoReloadDirs(list);
        }
        c.setAutoReloadIntervalMs(longProp(props, "auto-reload-interval-ms", c.autoReloadIntervalMs));
        return c;
    }

    private static int intProp(Properties p, String key, int def) {
        return (int) longProp(p, key, def);
    }

    private static long longProp(Properties p, String key, long def) {
        String v = p.getProperty(PREFIX + key);
        if (v == null || v.isBlank()) return def;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value '{}' for {}{}, using {}", v, PREFIX, key, def);
            return def;
        }
    }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public String getBasePath() { return basePath; }
    public void setBasePath(String basePath) {
        String p = basePath == null ? "" : basePath.trim();
        if (!p.startsWith("/")) p = "/" + p;
        while (p.length() > 1 && p.endsWith("/")) p = p.substring(0, p.length() - 1);
        this.basePath = p;
    }

    public String getCookieName() { return cookieName; }
    public void setCookieName(String cookieName) { this.cookieName = cookieName; }

    public int getReceiveTimeoutMs() { return receiveTimeoutMs; }
    public void setReceiveTimeoutMs(int receiveTimeoutMs) { this.receiveTimeoutMs = receiveTimeoutMs; }

    public int getMaxFrameBytes() { return maxFrameBytes; }
    public void setMaxFrameBytes(int maxFrameBytes) { this.maxFrameBytes = maxFrameBytes; }

    public long getSessionIdleTtlMinutes() { return sessionIdleTtlMinutes; }
    public void setSessionIdleTtlMinutes(long sessionIdleTtlMinutes) { this.sessionIdleTtlMinutes = sessionIdleTtlMinutes; }

    public long getMaxSessions() { return maxSessions; }
    public void setMaxSessions(long maxSessions) { this.maxSessions = maxSessions; }

    public boolean isAutoReload() { return autoReload; }
    public void setAutoReload(boolean autoReload) { this.autoReload = autoReload; }

    public List<String> getAutoReloadDirs() { return autoReloadDirs; }
    public void setAutoReloadDirs(List<String> autoReloadDirs) { this.autoReloadDirs = autoReloadDirs; }

    public long getAutoReloadIntervalMs() { return autoReloadIntervalMs; }
    public void setAutoReloadIntervalMs(long autoReloadIntervalMs) { this.autoReloadIntervalMs = autoReloadIntervalMs; }

    public String wsPath()      { return join("ws"); }
    public String pollPath()    { return join("poll"); }
    public String invalidPath() { return join("invalid"); }

    private String join(String leaf) {
        return "/".equals(basePath) ? "/" + leaf : basePath + "/" + leaf;
    }
}
