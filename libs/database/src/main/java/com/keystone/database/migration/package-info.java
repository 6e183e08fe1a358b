/**
 * Flyway schema migrations and development seeds.
 *
 * <p>Contains {@link com.keystone.database.migration.FlywayMigrations}, which decides the
 * migration locations and builds the Flyway instance used by schema synchronization.
 */
package com.keystone.database.migration;
