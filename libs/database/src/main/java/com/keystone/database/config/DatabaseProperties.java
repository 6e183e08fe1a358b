package com.keystone.database.config;

import com.keystone.database.verification.VerificationMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe database settings, bound once at startup from the {@code keystone.database} prefix.
 *
 * <p>{@code application.yml} maps the environment onto this record:
 *
 * <pre>
 * keystone:
 *   database:
 *     name: ${DB_NAME:}
 *     username: ${DB_USER:}
 *     password: ${DB_PASSWORD:}
 *     host: ${DB_HOST:}
 *     port: ${DB_PORT:5432}
 *     verification: ${DB_VERIFICATION:authenticate}
 *     seed: ${DB_SEED:false}
 * </pre>
 *
 * <p>Each required field carries the name of its environment variable in its constraint message,
 * so a missing variable fails startup with a binding error that lists every absent variable.
 *
 * @param name database name ({@code DB_NAME}). Required.
 * @param username database user ({@code DB_USER}). Required.
 * @param password database password ({@code DB_PASSWORD}); empty when unset.
 * @param host database host ({@code DB_HOST}). Required.
 * @param port database port ({@code DB_PORT}); 5432 when unset.
 * @param url full JDBC URL; when present it replaces the URL built from host, port and name.
 * @param verification how the data store is verified before the server listens.
 * @param seed whether development seed data is applied during schema synchronization.
 * @param verifyTimeout upper bound on the startup verification attempt.
 */
@Validated
@ConfigurationProperties(prefix = "keystone.database")
public record DatabaseProperties(
        @NotBlank(message = "DB_NAME must be set") String name,
        @NotBlank(message = "DB_USER must be set") String username,
        String password,
        @NotBlank(message = "DB_HOST must be set") String host,
        @Min(value = 1, message = "DB_PORT must be between 1 and 65535")
                @Max(value = 65535, message = "DB_PORT must be between 1 and 65535")
                int port,
        String url,
        @NotNull VerificationMode verification,
        boolean seed,
        @NotNull Duration verifyTimeout) {

    public static final int DEFAULT_PORT = 5432;

    public static final Duration DEFAULT_VERIFY_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Compact constructor: applies defaults for optional fields. Runs before Bean Validation, so
     * defaults satisfy the constraints.
     */
    public DatabaseProperties {
        if (password == null) {
            password = "";
        }
        if (port == 0) {
            port = DEFAULT_PORT;
        }
        if (verification == null) {
            verification = VerificationMode.AUTHENTICATE;
        }
        if (verifyTimeout == null || verifyTimeout.isNegative() || verifyTimeout.isZero()) {
            verifyTimeout = DEFAULT_VERIFY_TIMEOUT;
        }
    }

    /**
     * Returns the JDBC URL: the explicit {@code url} when configured, otherwise a PostgreSQL URL
     * built from host, port and name.
     */
    public String jdbcUrl() {
        if (url != null && !url.isBlank()) {
            return url;
        }
        return "jdbc:postgresql://" + host + ":" + port + "/" + name;
    }

    /** Never prints the password. */
    @Override
    public String toString() {
        return "DatabaseProperties[url="
                + jdbcUrl()
                + ", username="
                + username
                + ", password="
                + (password.isEmpty() ? "" : "[REDACTED]")
                + ", verification="
                + verification
                + ", seed="
                + seed
                + ", verifyTimeout="
                + verifyTimeout
                + "]";
    }
}
