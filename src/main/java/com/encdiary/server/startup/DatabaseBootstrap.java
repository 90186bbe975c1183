package com.encdiary.server.startup;

import java.util.HashMap;
import java.util.Map;

import javax.sql.DataSource;

import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;

/**
 * Schema migration and EntityManagerFactory construction over an existing
 * DataSource. Flyway owns the schema; Hibernate never touches DDL.
 */
public final class DatabaseBootstrap {

    private static final Logger log = LoggerFactory.getLogger(DatabaseBootstrap.class);

    public static final String PERSISTENCE_UNIT = "DiaryPU";
    static final String MIGRATION_LOCATION = "classpath:db/migration";

    private DatabaseBootstrap() {
    }

    public static void runFlywayMigrations(DataSource ds) {
        log.info("Running Flyway migration...");
        flyway(ds, true).migrate();
        log.info("Flyway migration complete");
    }

    /**
     * Drops every object Flyway manages and migrates from scratch.
     */
    public static void recreateSchema(DataSource ds) {
        Flyway flyway = flyway(ds, false);
        log.warn("Dropping all diary tables");
        flyway.clean();
        flyway.migrate();
        log.info("Schema recreated (users, entry)");
    }

    public static EntityManagerFactory buildEntityManagerFactory(DataSource ds) {
        Map<String, Object> props = new HashMap<>();
        props.put("jakarta.persistence.nonJtaDataSource", ds);
        props.put("hibernate.hbm2ddl.auto", "none");
        return Persistence.createEntityManagerFactory(PERSISTENCE_UNIT, props);
    }

    private static Flyway flyway(DataSource ds, boolean cleanDisabled) {
        return Flyway.configure()
                .dataSource(ds)
                .locations(MIGRATION_LOCATION)
                .baselineOnMigrate(true)
                .cleanDisabled(cleanDisabled)
                .load();
    }
}
