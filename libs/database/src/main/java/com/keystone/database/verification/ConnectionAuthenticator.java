package com.keystone.database.verification;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies the data store by borrowing one connection and asking the driver whether it is valid.
 *
 * <p>The JDBC call runs on the supplied executor and is bounded by {@code timeout}; an attempt that
 * exceeds it fails with a {@link DataStoreVerificationException}.
 */
public final class ConnectionAuthenticator implements DataStoreVerifier {

    private static final Logger log = LoggerFactory.getLogger(ConnectionAuthenticator.class);

    private final DataSource dataSource;
    private final Executor executor;
    private final Duration timeout;

    public ConnectionAuthenticator(DataSource dataSource, Executor executor, Duration timeout) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.dataSource = dataSource;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public CompletableFuture<Void> verify() {
        return CompletableFuture.runAsync(this::authenticate, executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle(
                        (ignored, error) -> {
                            if (error != null) {
                                throw translate(error);
                            }
                            return null;
                        });
    }

    @Override
    public String description() {
        return "authenticate";
    }

    private void authenticate() {
        try (Connection connection = dataSource.getConnection()) {
            int validationSeconds = (int) Math.max(1, timeout.toSeconds());
            if (!connection.isValid(validationSeconds)) {
                throw new DataStoreVerificationException("Database connection is not valid");
            }
            log.debug("Database connection is valid");
        } catch (SQLException e) {
            throw new DataStoreVerificationException(
                    "Unable to connect to the database: " + e.getMessage(), e);
        }
    }

    private DataStoreVerificationException translate(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof DataStoreVerificationException verification) {
            return verification;
        }
        if (cause instanceof TimeoutException) {
            return new DataStoreVerificationException(
                    "Database verification timed out after " + timeout.toMillis() + " ms", cause);
        }
        return new DataStoreVerificationException(
                "Database verification failed: " + cause.getMessage(), cause);
    }
}
