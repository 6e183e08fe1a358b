package com.keystone.database.verification;

/**
 * Thrown when the data store cannot be reached, rejects the credentials, or its schema cannot be
 * synchronized.
 */
public class DataStoreVerificationException extends RuntimeException {

    public DataStoreVerificationException(String message) {
        super(message);
    }

    public DataStoreVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
