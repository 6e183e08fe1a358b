package com.keystone.apiserver.startup;

import org.springframework.boot.SpringBootExceptionReporter;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

/**
 * Claims run failures caused by a {@link StartupAbortedException}.
 *
 * <p>The sequencer has already logged the verification error when the abort reaches Spring Boot,
 * so reporting it here keeps Boot from logging it a second time as "Application run failed". Any
 * other failure is left to Boot's own reporters.
 */
@Order(Ordered.HIGHEST_PRECEDENCE)
public class StartupAbortReporter implements SpringBootExceptionReporter {

    @Override
    public boolean reportException(Throwable failure) {
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (current instanceof StartupAbortedException) {
                return true;
            }
        }
        return false;
    }
}
