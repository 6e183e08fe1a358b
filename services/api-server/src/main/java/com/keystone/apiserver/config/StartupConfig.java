package com.keystone.apiserver.config;

import com.keystone.apiserver.startup.EmbeddedWebServerListener;
import com.keystone.apiserver.startup.ServerListener;
import com.keystone.apiserver.startup.StartupLifecycle;
import com.keystone.apiserver.startup.StartupSequencer;
import com.keystone.database.verification.DataStoreVerifier;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Verify-then-listen wiring. */
@Configuration(proxyBeanMethods = false)
public class StartupConfig {

    @Bean
    public ServerListener serverListener(ApplicationContext context) {
        return new EmbeddedWebServerListener(context);
    }

    @Bean
    public StartupSequencer startupSequencer(
            DataStoreVerifier dataStoreVerifier,
            ServerListener serverListener,
            ApiServerProperties properties) {
        return new StartupSequencer(dataStoreVerifier, serverListener, properties.port());
    }

    @Bean
    public StartupLifecycle startupLifecycle(StartupSequencer startupSequencer) {
        return new StartupLifecycle(startupSequencer);
    }
}
