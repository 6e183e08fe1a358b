package com.keystone.database.config;

import com.keystone.database.migration.FlywayMigrations;
import com.keystone.database.verification.ConnectionAuthenticator;
import com.keystone.database.verification.DataStoreVerifier;
import com.keystone.database.verification.SchemaSynchronizer;
import com.zaxxer.hikari.HikariDataSource;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Spring wiring for the database collaborators.
 *
 * <p>Services import this configuration explicitly. It replaces Spring Boot's {@code DataSource}
 * and Flyway auto-configuration so that:
 *
 * <ul>
 *   <li>the connection is built from the validated {@link DatabaseProperties}
 *   <li>no migration runs as a side effect of context startup; schema synchronization happens
 *       only through the {@link DataStoreVerifier} when {@code verification=sync}
 *   <li>all blocking JDBC work runs on one named executor ({@value #DATA_STORE_EXECUTOR_BEAN})
 * </ul>
 *
 * <p>The Hikari pool is lazy: constructing the {@code DataSource} opens no connection, so nothing
 * touches the database before the startup verification does.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(DatabaseProperties.class)
public class DatabaseConfiguration {

    /** Bean name of the executor that runs JDBC calls off the request threads. */
    public static final String DATA_STORE_EXECUTOR_BEAN = "dataStoreExecutor";

    static final int DATA_STORE_THREADS = 4;

    @Bean
    public DataSource dataSource(DatabaseProperties properties) {
        return DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(properties.jdbcUrl())
                .username(properties.username())
                .password(properties.password())
                .build();
    }

    @Bean(name = DATA_STORE_EXECUTOR_BEAN, destroyMethod = "shutdown")
    public ExecutorService dataStoreExecutor() {
        return Executors.newFixedThreadPool(
                DATA_STORE_THREADS, new CustomizableThreadFactory("data-store-"));
    }

    @Bean
    public Flyway flyway(DataSource dataSource, DatabaseProperties properties) {
        return FlywayMigrations.create(dataSource, properties.seed());
    }

    /**
     * Picks the startup check for the configured {@link DatabaseProperties#verification()} mode.
     */
    @Bean
    public DataStoreVerifier dataStoreVerifier(
            DatabaseProperties properties,
            DataSource dataSource,
            Flyway flyway,
            @Qualifier(DATA_STORE_EXECUTOR_BEAN) ExecutorService executor) {
        var authenticator =
                new ConnectionAuthenticator(dataSource, executor, properties.verifyTimeout());
        return switch (properties.verification()) {
            case AUTHENTICATE -> authenticator;
            case SYNC -> new SchemaSynchronizer(authenticator, flyway, executor);
        };
    }
}
