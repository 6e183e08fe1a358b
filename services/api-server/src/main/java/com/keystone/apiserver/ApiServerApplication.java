package com.keystone.apiserver;

import com.keystone.apiserver.config.ApiServerProperties;
import com.keystone.database.config.DatabaseConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Keystone API server.
 *
 * <p>Startup order:
 *
 * <ol>
 *   <li>bind and validate {@code keystone.server.*} and {@code keystone.database.*}
 *   <li>build and seal the router from every route registrar
 *   <li>verify the database (authenticate, or authenticate and migrate)
 *   <li>bind the HTTP listener on {@code PORT}
 * </ol>
 *
 * <p>If verification fails the context refresh fails, the port is never bound and the JVM exits
 * with status 1.
 */
@SpringBootApplication
@Import(DatabaseConfiguration.class)
@EnableConfigurationProperties(ApiServerProperties.class)
public class ApiServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiServerApplication.class, args);
    }
}
