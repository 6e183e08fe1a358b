package com.keystone.database.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.keystone.database.verification.VerificationMode;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link DatabaseProperties}: compact-constructor defaults, JDBC URL assembly and
 * password redaction, without a Spring context.
 */
@DisplayName("DatabaseProperties")
class DatabasePropertiesTest {

    private static DatabaseProperties props(String password, int port, String url) {
        return new DatabaseProperties(
                "keystone", "app", password, "db.internal", port, url, null, false, null);
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("defaults port to 5432 when zero")
        void defaultsPort() {
            assertThat(props("pw", 0, null).port()).isEqualTo(DatabaseProperties.DEFAULT_PORT);
        }

        @Test
        @DisplayName("defaults verification to AUTHENTICATE")
        void defaultsVerification() {
            assertThat(props("pw", 5432, null).verification())
                    .isEqualTo(VerificationMode.AUTHENTICATE);
        }

        @Test
        @DisplayName("defaults password to empty string")
        void defaultsPassword() {
            assertThat(props(null, 5432, null).password()).isEmpty();
        }

        @Test
        @DisplayName("defaults verify timeout when missing or non-positive")
        void defaultsVerifyTimeout() {
            assertThat(props("pw", 5432, null).verifyTimeout())
                    .isEqualTo(DatabaseProperties.DEFAULT_VERIFY_TIMEOUT);

            var zero = new DatabaseProperties(
                    "keystone", "app", "pw", "db", 5432, null, null, false, Duration.ZERO);
            assertThat(zero.verifyTimeout()).isEqualTo(DatabaseProperties.DEFAULT_VERIFY_TIMEOUT);
        }

        @Test
        @DisplayName("keeps explicit values")
        void keepsExplicitValues() {
            var props = new DatabaseProperties(
                    "keystone", "app", "pw", "db", 6543, null,
                    VerificationMode.SYNC, true, Duration.ofSeconds(5));

            assertThat(props.port()).isEqualTo(6543);
            assertThat(props.verification()).isEqualTo(VerificationMode.SYNC);
            assertThat(props.seed()).isTrue();
            assertThat(props.verifyTimeout()).isEqualTo(Duration.ofSeconds(5));
        }
    }

    @Nested
    @DisplayName("jdbcUrl")
    class JdbcUrl {

        @Test
        @DisplayName("builds a PostgreSQL URL from host, port and name")
        void buildsPostgresUrl() {
            assertThat(props("pw", 6432, null).jdbcUrl())
                    .isEqualTo("jdbc:postgresql://db.internal:6432/keystone");
        }

        @Test
        @DisplayName("prefers an explicit URL")
        void prefersExplicitUrl() {
            assertThat(props("pw", 5432, "jdbc:h2:mem:x").jdbcUrl()).isEqualTo("jdbc:h2:mem:x");
        }

        @Test
        @DisplayName("ignores a blank explicit URL")
        void ignoresBlankUrl() {
            assertThat(props("pw", 5432, " ").jdbcUrl()).startsWith("jdbc:postgresql://");
        }
    }

    @Nested
    @DisplayName("toString")
    class ToString {

        @Test
        @DisplayName("never prints the password")
        void redactsPassword() {
            String text = props("s3cr3t", 5432, null).toString();

            assertThat(text).doesNotContain("s3cr3t").contains("[REDACTED]").contains("app");
        }
    }
}
