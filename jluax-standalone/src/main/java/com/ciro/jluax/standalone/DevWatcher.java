package com.ciro.jluax.standalone;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Modo dev: vigila los .luax/.lua del proyecto y dispara una recarga.
 * Varios cambios seguidos (guardar varios archivos, el editor escribiendo temporales)
 * se agrupan en una sola recarga.
 */
public class DevWatcher implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(DevWatcher.class);

    private final Path root;
    private final long debounceMs;
    private final Runnable onChange;
    private final WatchService watcher;
    private final ScheduledExecutorService scheduler;
    private final Thread thread;
    private ScheduledFuture<?> pending;
    private volatile boolean running = true;

    public DevWatcher(Path root, long debounceMs, Runnable onChange) throws IOException {
        this.root = root.toAbsolutePath().normalize();
        this.debounceMs = debounceMs;
        this.onChange = onChange;
        this.watcher = FileSystems.getDefault().newWatchService();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "jluax-reload");
            t.setDaemon(true);
            return t;
        });
        this.thread = new Thread(this::loop, "jluax-watch");
        this.thread.setDaemon(true);
        registerAll(this.root);
    }

    public void start() {
        thread.start();
        log.info("Watching {} for changes", root);
    }

    private void registerAll(Path dir) throws IOException {
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) throws IOException {
                if (!d.equals(root) && d.getFileName().toString().startsWith(".")) return FileVisitResult.SKIP_SUBTREE;
                d.register(watcher, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void loop() {
        while (running) {
            WatchKey key;
            try {
                key = watcher.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            Path dir = (Path) key.watchable();
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == OVERFLOW) {
                    schedule();
                    continue;
                }
                Path child = dir.resolve((Path) event.context());
                if (event.kind() == ENTRY_CREATE && Files.isDirectory(child)) {
                    try {
                        registerAll(child);
                    } catch (IOException e) {
                        log.warn("Cannot watch {}: {}", child, e.getMessage());
                    }
                }
                if (isSource(child)) {
                    log.debug("{} {}", event.kind().name(), root.relativize(child));
                    schedule();
                }
            }
            key.reset();
        }
    }

    static boolean isSource(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".luax") || name.endsWith(".lua");
    }

    private synchronized void schedule() {
        if (pending != null) pending.cancel(false);
        pending = scheduler.schedule(this::fire, debounceMs, TimeUnit.MILLISECONDS);
    }

    private void fire() {
        try {
            onChange.run();
        } catch (RuntimeException e) {
            log.error("Reload callback failed", e);
        }
    }

    @Override
    public void close() throws IOException {
        running = false;
        scheduler.shutdownNow();
        thread.interrupt();
        watcher.close();
    }
}
