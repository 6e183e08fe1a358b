package com.keystone.database.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.keystone.database.verification.VerificationMode;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

/**
 * Binding tests for {@link DatabaseProperties}: values come from the environment-style
 * properties, and each missing required setting is reported by its variable name.
 */
@DisplayName("DatabaseProperties binding")
class DatabasePropertiesBindingTest {

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(DatabaseProperties.class)
    static class PropertiesOnly {}

    private final ApplicationContextRunner runner =
            new ApplicationContextRunner().withUserConfiguration(PropertiesOnly.class);

    @Test
    @DisplayName("binds a complete configuration")
    void bindsCompleteConfiguration() {
        runner.withPropertyValues(
                        "keystone.database.name=keystone",
                        "keystone.database.username=app",
                        "keystone.database.password=pw",
                        "keystone.database.host=localhost",
                        "keystone.database.port=5433",
                        "keystone.database.verification=sync",
                        "keystone.database.seed=true",
                        "keystone.database.verify-timeout=5s")
                .run(
                        context -> {
                            assertThat(context).hasNotFailed();
                            var props = context.getBean(DatabaseProperties.class);
                            assertThat(props.jdbcUrl())
                                    .isEqualTo("jdbc:postgresql://localhost:5433/keystone");
                            assertThat(props.verification()).isEqualTo(VerificationMode.SYNC);
                            assertThat(props.seed()).isTrue();
                            assertThat(props.verifyTimeout()).isEqualTo(Duration.ofSeconds(5));
                        });
    }

    @Test
    @DisplayName("names every missing required variable")
    void namesMissingVariables() {
        runner.withPropertyValues(
                        "keystone.database.name=",
                        "keystone.database.username=",
                        "keystone.database.host=",
                        "keystone.database.port=5432")
                .run(
                        context -> {
                            assertThat(context).hasFailed();
                            assertThat(context.getStartupFailure())
                                    .hasRootCauseInstanceOf(BindValidationException.class)
                                    .rootCause()
                                    .hasMessageContaining("DB_NAME must be set")
                                    .hasMessageContaining("DB_USER must be set")
                                    .hasMessageContaining("DB_HOST must be set");
                        });
    }

    @Test
    @DisplayName("rejects a port outside 1..65535")
    void rejectsInvalidPort() {
        runner.withPropertyValues(
                        "keystone.database.name=keystone",
                        "keystone.database.username=app",
                        "keystone.database.host=localhost",
                        "keystone.database.port=70000")
                .run(
                        context ->
                                assertThat(context.getStartupFailure())
                                        .rootCause()
                                        .hasMessageContaining("DB_PORT must be between 1 and 65535"));
    }
}
