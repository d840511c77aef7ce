package com.ciro.livepatch.standalone;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Live-reload de desarrollo: compara las fechas de modificación de los directorios vigilados
 * y, si algo cambió, pide a todas las pestañas que recarguen.
 */
public class AutoReloadWatcher {

    private static final Logger log = LoggerFactory.getLogger(AutoReloadWatcher.class);

    static final Set<String> EXTENSIONS = Set.of(
            ".java", ".html", ".htm", ".js", ".ts", ".css", ".json", ".properties");
    static final Set<String> IGNORED_DIRS = Set.of(".git", "target", "node_modules", ".idea");
    static final long DEBOUNCE_MS = 500;

    private final List<Path> roots;
    private final Runnable onChange;
    private final ScheduledExecutorService scheduler;

    private Map<Path, Long> previous = Map.of();
    private long lastSignalNanos;
    private boolean signalled;
    private ScheduledFuture<?> task;

    public AutoReloadWatcher(List<Path> roots, Runnable onChange, ScheduledExecutorService scheduler) {
        this.roots = List.copyOf(roots);
        this.onChange = onChange;
        this.scheduler = scheduler;
    }

    public synchronized void start(long intervalMs) {
        if (task != null) return;
        previous = snapshot();
        task = scheduler.scheduleWithFixedDelay(this::scanQuietly, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Auto-reload watching {} ({} files)", roots, previous.size());
    }

    public synchronized void stop() {
        if (task == null) return;
        task.cancel(false);
        task = null;
    }

    /** Toma la foto inicial sin arrancar el timer. */
    synchronized void prime() {
        previous = snapshot();
    }

    /**
     * Un ciclo de vigilancia.
     *
     * @return true si hubo cambios y se pidió recarga
     */
    synchronized boolean scanOnce() {
        Map<Path, Long> current = snapshot();
        if (current.equals(previous)) return false;
        previous = current;

        long now = System.nanoTime();
        if (signalled && now - lastSignalNanos < TimeUnit.MILLISECONDS.toNanos(DEBOUNCE_MS)) {
            log.debug("Change detected inside debounce window, skipping reload");
            return false;
        }
        signalled = true;
        lastSignalNanos = now;
        log.info("Change detected, reloading connected clients");
        onChange.run();
        return true;
    }

    private void scanQuietly() {
        try {
            scanOnce();
        } catch (RuntimeException e) {
            log.warn("Auto-reload scan failed", e);
        }
    }

    Map<Path, Long> snapshot() {
        Map<Path, Long> out = new HashMap<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) continue;
            try {
                Files.walkFileTree(root, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        Path name = dir.getFileName();
                        if (!dir.equals(root) && name != null && IGNORED_DIRS.contains(name.toString())) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && watched(file)) {
                            out.put(file, attrs.lastModifiedTime().toMillis());
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException e) {
                        log.trace("Skipping {}: {}", file, e.getMessage());
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (IOException e) {
                log.debug("Cannot scan {}: {}", root, e.getMessage());
            }
        }
        return out;
    }

    /** Sin extensión también cuenta. */
    static boolean watched(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0) return true;
        return EXTENSIONS.contains(name.substring(dot).toLowerCase(Locale.ROOT));
    }
}
