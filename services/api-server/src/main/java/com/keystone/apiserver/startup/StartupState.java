package com.keystone.apiserver.startup;

/**
 * Lifecycle of the {@link StartupSequencer}: {@code IDLE → VERIFYING → READY | ABORTED}.
 */
public enum StartupState {

    /** Not started. */
    IDLE,

    /** Waiting for the data-store verification to complete. */
    VERIFYING,

    /** Verified and listening. Terminal. */
    READY,

    /** Verification or binding failed; the server never listens. Terminal. */
    ABORTED
}
