/**
 * Database support for Keystone services.
 *
 * <p>Three concerns live here:
 *
 * <ul>
 *   <li>{@link com.keystone.database.config}: the validated connection settings and the Spring
 *       wiring of the {@code DataSource}, Flyway and the data-store executor
 *   <li>{@link com.keystone.database.verification}: the one-shot check that gates server startup
 *       ({@code authenticate} or {@code sync})
 *   <li>{@link com.keystone.database.migration}: Flyway migrations under {@code db/migration} and
 *       development seeds under {@code db/seed/development}
 * </ul>
 *
 * <p>Migrations are plain Flyway {@code V{n}__{desc}.sql} files. Outside the running server they are
 * applied with {@code mvn flyway:migrate} from this module.
 */
package com.keystone.database;
