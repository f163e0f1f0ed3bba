package com.ultron.gateway.config;

import com.ultron.common.config.ConfigService;
import com.ultron.common.config.UltronConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Watches the configuration file and applies changes to the running
 * gateway. A file that fails to parse or validate is rejected and the
 * previous configuration stays in effect.
 */
@Slf4j
public class ConfigReloadService implements AutoCloseable {

    /** At most one reload per 500 ms. */
    private static final long DEBOUNCE_MS = 500;
    private static final long SETTLE_MS = 50;

    private final ConfigService configService;
    private final List<ReloadCallback> callbacks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread watchThread;
    private volatile WatchService watchService;
    private volatile UltronConfig current;

    @FunctionalInterface
    public interface ReloadCallback {
        void onConfigReloaded(UltronConfig oldConfig, UltronConfig newConfig, ConfigDiff diff);
    }

    public ConfigReloadService(ConfigService configService, UltronConfig initial) {
        this.configService = configService;
        this.current = initial != null ? initial : configService.loadConfig();
    }

    public void addCallback(ReloadCallback callback) {
        callbacks.add(callback);
    }

    public UltronConfig getCurrent() {
        return current;
    }

    /**
     * Start watching the config file's directory.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("config reload watcher is already running");
            return;
        }

        Path configPath = configService.getConfigPath().toAbsolutePath();
        Path parentDir = configPath.getParent();
        String fileName = configPath.getFileName().toString();

        try {
            Files.createDirectories(parentDir);
            watchService = FileSystems.getDefault().newWatchService();
            parentDir.register(watchService,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_CREATE);
        } catch (IOException e) {
            log.error("failed to start config file watcher: {}", e.getMessage());
            running.set(false);
            return;
        }

        watchThread = new Thread(() -> {
            log.info("config file watcher started for: {}", configPath);
            long lastReloadAt = 0;

            while (running.get()) {
                try {
                    WatchKey key = watchService.take();
                    boolean relevant = false;
                    for (var event : key.pollEvents()) {
                        if (event.context() instanceof Path changedPath
                                && fileName.equals(changedPath.toString())) {
                            relevant = true;
                        }
                    }
                    key.reset();

                    if (!relevant)
                        continue;

                    long now = System.currentTimeMillis();
                    if (now - lastReloadAt < DEBOUNCE_MS)
                        continue;
                    lastReloadAt = now;

                    // let the writer finish
                    Thread.sleep(SETTLE_MS);
                    reloadNow();

                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (ClosedWatchServiceException e) {
                    break;
                } catch (RuntimeException e) {
                    log.error("config watcher error: {}", e.getMessage(), e);
                }
            }

            log.info("config file watcher stopped");
        }, "config-reload-watcher");
        watchThread.setDaemon(true);
        watchThread.start();
    }

    /**
     * Re-read the config file and notify callbacks.
     *
     * @return the applied config, empty if the file was rejected
     */
    public synchronized Optional<UltronConfig> reloadNow() {
        UltronConfig next;
        try {
            next = configService.readConfig();
        } catch (IOException e) {
            log.error("config reload rejected, keeping previous config: {}", e.getMessage());
            return Optional.empty();
        }

        UltronConfig previous = current;
        ConfigDiff diff = computeDiff(previous, next);
        current = next;
        for (var cb : callbacks) {
            try {
                cb.onConfigReloaded(previous, next, diff);
            } catch (RuntimeException e) {
                log.error("config reload callback failed: {}", e.getMessage(), e);
            }
        }
        log.info("config reloaded (changes: {})", diff.changedPaths());
        return Optional.of(next);
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            try {
                if (watchService != null) {
                    watchService.close();
                }
            } catch (IOException e) {
                log.warn("error closing watch service: {}", e.getMessage());
            }
            if (watchThread != null) {
                watchThread.interrupt();
            }
        }
    }

    // ─── Config diff ────────────────────────────────────────────────────

    /**
     * Top-level sections that differ between two configs.
     */
    static ConfigDiff computeDiff(UltronConfig oldCfg, UltronConfig newCfg) {
        Set<String> changed = new LinkedHashSet<>();
        if (oldCfg == null || newCfg == null) {
            return new ConfigDiff(List.of("agents", "session", "messages", "queue", "gateway", "logging"));
        }
        if (!Objects.equals(oldCfg.getAgents(), newCfg.getAgents()))
            changed.add("agents");
        if (!Objects.equals(oldCfg.getSession(), newCfg.getSession()))
            changed.add("session");
        if (!Objects.equals(oldCfg.getMessages(), newCfg.getMessages()))
            changed.add("messages");
        if (!Objects.equals(oldCfg.getQueue(), newCfg.getQueue()))
            changed.add("queue");
        if (!Objects.equals(oldCfg.getGateway(), newCfg.getGateway()))
            changed.add("gateway");
        if (!Objects.equals(oldCfg.getLogging(), newCfg.getLogging()))
            changed.add("logging");
        return new ConfigDiff(List.copyOf(changed));
    }

    public record ConfigDiff(List<String> changedPaths) {
        public boolean hasChange(String path) {
            return changedPaths.contains(path);
        }

        public boolean isEmpty() {
            return changedPaths.isEmpty();
        }
    }
}
