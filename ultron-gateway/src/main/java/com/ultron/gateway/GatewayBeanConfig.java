package com.ultron.gateway;

import com.ultron.common.config.ConfigPaths;
import com.ultron.common.config.ConfigService;
import com.ultron.common.config.UltronConfig;
import com.ultron.gateway.agent.AgentExecutor;
import com.ultron.gateway.agent.UnavailableAgentExecutor;
import com.ultron.gateway.config.ConfigReloadService;
import com.ultron.gateway.outbound.ChannelAdapter;
import com.ultron.gateway.outbound.OutboundDelivery;
import com.ultron.gateway.runtime.GatewayRuntime;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration for gateway beans. The runtime is started and
 * stopped by the application's lifecycle bean, not by the container.
 */
@Configuration
public class GatewayBeanConfig {

    @Value("${ultron.config.path:}")
    private String configPath;
    @Value("${ultron.state.dir:}")
    private String stateDir;

    @Bean
    public ConfigService configService() {
        if (configPath == null || configPath.isBlank()) {
            return new ConfigService(ConfigPaths.resolveConfigPath());
        }
        return new ConfigService(Path.of(configPath.trim()));
    }

    @Bean
    public UltronConfig ultronConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    public OutboundDelivery outboundDelivery(ObjectProvider<ChannelAdapter> adapters) {
        OutboundDelivery delivery = new OutboundDelivery();
        adapters.orderedStream().forEach(delivery::register);
        return delivery;
    }

    @Bean(destroyMethod = "")
    public GatewayRuntime gatewayRuntime(UltronConfig config,
            ObjectProvider<AgentExecutor> executor,
            OutboundDelivery delivery) {
        Path dir = stateDir == null || stateDir.isBlank()
                ? ConfigPaths.resolveStateDir(config)
                : ConfigPaths.resolveUserPath(stateDir.trim(), System.getProperty("user.home"));
        return new GatewayRuntime(config, dir, executor.getIfAvailable(UnavailableAgentExecutor::new), delivery);
    }

    @Bean(destroyMethod = "close")
    public ConfigReloadService configReloadService(ConfigService configService, UltronConfig config) {
        return new ConfigReloadService(configService, config);
    }
}
