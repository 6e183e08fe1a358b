/**
 * Startup verification of the data store.
 *
 * <p>{@link com.keystone.database.verification.DataStoreVerifier} has two implementations, chosen
 * by {@link com.keystone.database.verification.VerificationMode}:
 * {@link com.keystone.database.verification.ConnectionAuthenticator} and
 * {@link com.keystone.database.verification.SchemaSynchronizer}.
 */
package com.keystone.database.verification;
