package com.permission.engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Watches a configuration file and runs a callback whenever it is created or modified.
 * The watch loop runs on a daemon thread. A callback that throws is logged and the
 * watcher keeps running, so a broken edit leaves the previously loaded configuration
 * in place until the next successful change.
 */
public class ConfigurationFileWatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationFileWatcher.class);

    static final String THREAD_NAME = "permission-config-watcher";

    private final Path file;
    private final Runnable onChange;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private WatchService watchService;
    private Thread thread;

    public ConfigurationFileWatcher(Path file, Runnable onChange) {
        this.file = file.toAbsolutePath();
        this.onChange = onChange;
    }

    /**
     * Registers the watch on the file's directory and starts the watch thread.
     *
     * @throws UncheckedIOException if the directory cannot be watched
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            watchService = FileSystems.getDefault().newWatchService();
            file.getParent().register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY);
        } catch (IOException e) {
            running.set(false);
            throw new UncheckedIOException("Failed to watch configuration file " + file, e);
        }
        WatchService service = watchService;
        thread = new Thread(() -> watchLoop(service), THREAD_NAME);
        thread.setDaemon(true);
        thread.start();
        log.info("Watching configuration file {}", file);
    }

    private void watchLoop(WatchService service) {
        while (running.get()) {
            WatchKey key;
            try {
                key = service.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            boolean changed = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    changed = true;
                } else if (file.getFileName().equals(event.context())) {
                    changed = true;
                }
            }
            if (changed) {
                fireChange();
            }
            if (!key.reset()) {
                log.warn("Configuration directory of {} is no longer accessible, stopping watcher", file);
                running.set(false);
                return;
            }
        }
    }

    private void fireChange() {
        log.debug("Configuration file {} changed", file);
        try {
            onChange.run();
        } catch (RuntimeException e) {
            log.warn("Reload after change of {} failed, keeping previous configuration: {}", file, e.getMessage());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void close() {
        if (!running.getAndSet(false) && watchService == null) {
            return;
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Failed to close watch service for {}: {}", file, e.getMessage());
            }
            watchService = null;
        }
        if (thread != null) {
            thread.interrupt();
            thread = null;
        }
        log.info("Stopped watching configuration file {}", file);
    }
}
