package com.keystone.database.verification;

import java.util.concurrent.CompletableFuture;

/**
 * One-shot check that the external data store is reachable and, depending on the
 * implementation, that its schema is current.
 *
 * <p>Implementations never block the caller: the returned future completes normally on success
 * and exceptionally with a {@link DataStoreVerificationException} otherwise. There is no retry.
 */
public interface DataStoreVerifier {

    /**
     * Starts the verification.
     *
     * @return a future that completes when the data store has been verified
     */
    CompletableFuture<Void> verify();

    /**
     * Short label for log output, e.g. {@code authenticate}.
     */
    String description();
}
