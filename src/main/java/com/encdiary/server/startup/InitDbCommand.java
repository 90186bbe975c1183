package com.encdiary.server.startup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.encdiary.server.config.DataSourceFactory;
import com.encdiary.server.config.DiaryConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * {@code init-db}: drops and recreates the diary tables using the database
 * configured in the environment. Destroys all users and entries.
 * <p>
 * Run with {@code mvn compile exec:java}.
 */
public final class InitDbCommand {

    private static final Logger log = LoggerFactory.getLogger(InitDbCommand.class);

    private InitDbCommand() {
    }

    public static void main(String[] args) {
        try {
            run(DiaryConfig.fromEnv());
        } catch (RuntimeException e) {
            log.error("Error initializing database", e);
            System.exit(1);
        }
    }

    static void run(DiaryConfig config) {
        try (HikariDataSource ds = DataSourceFactory.create(config.getDatabase())) {
            DatabaseBootstrap.recreateSchema(ds);
            log.info("Database initialized! Tables (users, entry) created or reset.");
        }
    }
}
