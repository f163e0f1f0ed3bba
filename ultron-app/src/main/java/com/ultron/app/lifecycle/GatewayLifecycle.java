package com.ultron.app.lifecycle;

import com.ultron.common.config.UltronConfig;
import com.ultron.gateway.config.ConfigReloadService;
import com.ultron.gateway.runtime.GatewayRuntime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Starts the gateway runtime and the config watcher with the application
 * context, and stops them in reverse order.
 */
@Slf4j
@Component
public class GatewayLifecycle implements SmartLifecycle {

    private final GatewayRuntime runtime;
    private final ConfigReloadService reloadService;
    private final LogLevelApplier logLevels;
    private volatile boolean running;

    public GatewayLifecycle(GatewayRuntime runtime,
            ConfigReloadService reloadService,
            LogLevelApplier logLevels) {
        this.runtime = runtime;
        this.reloadService = reloadService;
        this.logLevels = logLevels;
    }

    @Override
    public void start() {
        logLevels.apply(runtime.getConfig());
        reloadService.addCallback(this::onConfigReloaded);
        runtime.start();
        reloadService.start();
        running = true;
    }

    @Override
    public void stop() {
        reloadService.close();
        runtime.shutdown();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void onConfigReloaded(UltronConfig oldConfig, UltronConfig newConfig, ConfigReloadService.ConfigDiff diff) {
        if (diff.isEmpty()) {
            return;
        }
        runtime.applyConfig(newConfig);
        if (diff.hasChange("logging")) {
            log.info("log level changed to {}", logLevels.apply(newConfig));
        }
    }
}
