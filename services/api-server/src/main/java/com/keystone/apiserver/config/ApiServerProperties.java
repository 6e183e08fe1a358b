package com.keystone.apiserver.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Server settings bound from {@code keystone.server.*}.
 *
 * <pre>
 * keystone:
 *   server:
 *     name: keystone-api-server
 *     environment: production
 *     port: ${PORT:3000}
 * </pre>
 *
 * @param name service name used in logs and {@code /actuator/info}. Required.
 * @param environment deployment environment (development, staging, production)
 * @param port port the listener binds once the database is verified; 0 picks a free port
 */
@ConfigurationProperties(prefix = "keystone.server")
@Validated
public record ApiServerProperties(
        @NotBlank String name,
        String environment,
        @Min(value = 0, message = "PORT must be between 0 and 65535")
        @Max(value = 65535, message = "PORT must be between 0 and 65535")
        Integer port) {

    public static final int DEFAULT_PORT = 3000;

    public ApiServerProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (port == null) {
            port = DEFAULT_PORT;
        }
    }
}
