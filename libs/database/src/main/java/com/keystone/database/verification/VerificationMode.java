package com.keystone.database.verification;

/**
 * How the data store is verified before the server starts listening.
 */
public enum VerificationMode {

    /** Borrow a connection and check that it is valid. */
    AUTHENTICATE,

    /** Authenticate, then bring the schema up to date with Flyway. */
    SYNC
}
