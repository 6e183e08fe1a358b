package com.keystone.apiserver.startup;

import com.keystone.database.verification.DataStoreVerifier;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gates the network listener on a successful data-store verification.
 *
 * <p>State machine:
 *
 * <ol>
 *   <li>{@link #start()} moves {@code IDLE → VERIFYING} and starts the verification
 *   <li>on success the listener is bound on the configured port, then {@code READY}
 *   <li>on failure the error is logged once and the state becomes {@code ABORTED}; the listener is
 *       never touched
 * </ol>
 *
 * <p>There is a single attempt: no retry, no backoff. A failed bind after a successful
 * verification also ends in {@code ABORTED}.
 */
public final class StartupSequencer {

    private static final Logger log = LoggerFactory.getLogger(StartupSequencer.class);

    private final DataStoreVerifier verifier;
    private final ServerListener listener;
    private final int port;
    private final AtomicReference<StartupState> state = new AtomicReference<>(StartupState.IDLE);

    /**
     * @param verifier the data-store check to run first
     * @param listener the listener to bind afterwards
     * @param port the configured port (0 for ephemeral)
     */
    public StartupSequencer(DataStoreVerifier verifier, ServerListener listener, int port) {
        if (verifier == null || listener == null) {
            throw new IllegalArgumentException("verifier and listener are required");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535: " + port);
        }
        this.verifier = verifier;
        this.listener = listener;
        this.port = port;
    }

    /**
     * Runs the sequence.
     *
     * @return a future that completes with {@link StartupState#READY}, or completes exceptionally
     *     with a {@link StartupAbortedException}
     * @throws IllegalStateException if called more than once
     */
    public CompletableFuture<StartupState> start() {
        if (!state.compareAndSet(StartupState.IDLE, StartupState.VERIFYING)) {
            throw new IllegalStateException("Startup already ran; state is " + state.get());
        }
        log.info("Verifying database connection ({})", verifier.description());

        CompletableFuture<Void> verification;
        try {
            verification = verifier.verify();
        } catch (RuntimeException e) {
            verification = CompletableFuture.failedFuture(e);
        }

        return verification.handle(
                (ignored, error) -> {
                    if (error != null) {
                        throw abort(unwrap(error));
                    }
                    log.info("Database connection verified ({})", verifier.description());
                    return bindListener();
                });
    }

    public StartupState state() {
        return state.get();
    }

    private StartupState bindListener() {
        int bound;
        try {
            bound = listener.bind(port);
        } catch (RuntimeException e) {
            state.set(StartupState.ABORTED);
            log.error("Failed to bind listener on port {}", port, e);
            throw new StartupAbortedException("Listener could not bind port " + port, e);
        }
        state.set(StartupState.READY);
        log.info("Server listening on port {}", bound);
        return StartupState.READY;
    }

    private StartupAbortedException abort(Throwable cause) {
        state.set(StartupState.ABORTED);
        log.error("Database verification failed; server will not listen on port {}", port, cause);
        return new StartupAbortedException(
                "Startup aborted: database verification failed: " + cause.getMessage(), cause);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
