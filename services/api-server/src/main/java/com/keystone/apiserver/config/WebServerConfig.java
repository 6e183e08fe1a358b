package com.keystone.apiserver.config;

import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.boot.web.servlet.server.ConfigurableServletWebServerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Points the embedded server at {@code keystone.server.port}, so {@code PORT} is the only port
 * setting an operator needs.
 */
@Configuration(proxyBeanMethods = false)
public class WebServerConfig {

    @Bean
    public WebServerFactoryCustomizer<ConfigurableServletWebServerFactory> keystonePortCustomizer(
            ApiServerProperties properties) {
        return factory -> factory.setPort(properties.port());
    }
}
