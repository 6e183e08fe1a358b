package com.keystone.database.migration;

import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;

/**
 * Builds the Flyway instance that owns the Keystone schema.
 *
 * <p>Versioned migrations live in {@value #MIGRATION_LOCATION}. Development seed data lives in
 * {@value #SEED_LOCATION} and uses versions from 1000 upwards so it always applies after the
 * schema it fills.
 */
public final class FlywayMigrations {

    /** Location of the versioned schema migrations. */
    public static final String MIGRATION_LOCATION = "classpath:db/migration";

    /** Location of the development seed data. */
    public static final String SEED_LOCATION = "classpath:db/seed/development";

    private FlywayMigrations() {
    }

    /**
     * Returns the migration locations for the given seed setting, schema first.
     */
    public static List<String> locations(boolean seed) {
        List<String> locations = new ArrayList<>();
        locations.add(MIGRATION_LOCATION);
        if (seed) {
            locations.add(SEED_LOCATION);
        }
        return List.copyOf(locations);
    }

    /**
     * Creates a configured Flyway instance. Loading it does not connect to the database.
     *
     * @param dataSource the application's data source
     * @param seed whether development seed data is included
     * @return Flyway configured with baseline-on-migrate and clean disabled
     */
    public static Flyway create(DataSource dataSource, boolean seed) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(locations(seed).toArray(String[]::new))
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
