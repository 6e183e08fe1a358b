package com.keystone.database.verification;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies the data store by authenticating and then applying pending Flyway migrations.
 *
 * <p>Migration only starts once authentication has succeeded; an authentication failure is
 * returned as-is and Flyway is never invoked.
 */
public final class SchemaSynchronizer implements DataStoreVerifier {

    private static final Logger log = LoggerFactory.getLogger(SchemaSynchronizer.class);

    private final DataStoreVerifier authenticator;
    private final Flyway flyway;
    private final Executor executor;

    public SchemaSynchronizer(DataStoreVerifier authenticator, Flyway flyway, Executor executor) {
        if (authenticator == null || flyway == null || executor == null) {
            throw new IllegalArgumentException("authenticator, flyway and executor are required");
        }
        this.authenticator = authenticator;
        this.flyway = flyway;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Void> verify() {
        return authenticator.verify().thenRunAsync(this::migrate, executor);
    }

    @Override
    public String description() {
        return "sync";
    }

    private void migrate() {
        try {
            MigrateResult result = flyway.migrate();
            log.info(
                    "Schema synchronized: {} migration(s) applied, schema version {}",
                    result.migrationsExecuted,
                    result.targetSchemaVersion);
        } catch (FlywayException e) {
            throw new DataStoreVerificationException(
                    "Schema synchronization failed: " + e.getMessage(), e);
        }
    }
}
