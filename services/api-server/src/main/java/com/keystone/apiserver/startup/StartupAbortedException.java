package com.keystone.apiserver.startup;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Raised when startup ends in {@link StartupState#ABORTED}.
 *
 * <p>Spring Boot reads the exit code from exceptions implementing {@link ExitCodeGenerator}, so a
 * failed verification terminates the process with {@value #EXIT_CODE} instead of leaving it
 * running without a listener.
 */
public class StartupAbortedException extends RuntimeException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 1;

    public StartupAbortedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
