package com.encdiary.server.support;

import java.util.concurrent.atomic.AtomicInteger;

import com.encdiary.server.config.DataSourceFactory;
import com.encdiary.server.config.DatabaseSettings;
import com.encdiary.server.startup.DatabaseBootstrap;
import com.zaxxer.hikari.HikariDataSource;

import jakarta.persistence.EntityManagerFactory;

/**
 * A private in-memory H2 database migrated by Flyway, with Hibernate on top.
 * Dropped when closed.
 */
public final class TestDatabase implements AutoCloseable {

    private static final AtomicInteger COUNTER = new AtomicInteger();

    private final HikariDataSource dataSource;
    private final EntityManagerFactory emf;

    public TestDatabase() {
        DatabaseSettings settings = new DatabaseSettings(
                "jdbc:h2:mem:diary_test_" + COUNTER.incrementAndGet(), "sa", "", 4, true);
        dataSource = DataSourceFactory.create(settings);
        DatabaseBootstrap.runFlywayMigrations(dataSource);
        emf = DatabaseBootstrap.buildEntityManagerFactory(dataSource);
    }

    public EntityManagerFactory emf() {
        return emf;
    }

    public HikariDataSource dataSource() {
        return dataSource;
    }

    @Override
    public void close() {
        emf.close();
        dataSource.close();
    }
}
