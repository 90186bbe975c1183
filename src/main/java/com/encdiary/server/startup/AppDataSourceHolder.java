package com.encdiary.server.startup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.encdiary.server.config.DataSourceFactory;
import com.encdiary.server.config.DatabaseSettings;
import com.encdiary.server.config.DiaryConfig;
import com.zaxxer.hikari.HikariDataSource;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManagerFactory;

/**
 * Owns the connection pool and the EntityManagerFactory for the lifetime of
 * the application. Postgres is used when configured; otherwise an embedded H2
 * database. A Postgres configuration that fails to start is fatal rather than
 * silently falling back to H2.
 */
@ApplicationScoped
public class AppDataSourceHolder {

    private static final Logger log = LoggerFactory.getLogger(AppDataSourceHolder.class);

    private final DiaryConfig config;

    private HikariDataSource ds;
    private EntityManagerFactory emf;

    // CDI proxy
    AppDataSourceHolder() {
        this(null);
    }

    @Inject
    public AppDataSourceHolder(DiaryConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        DatabaseSettings settings = config.getDatabase();
        if (settings.isEmbedded()) {
            log.info("No DB_URL or DB_HOST configured; falling back to embedded H2 database");
        } else {
            log.info("Initializing datasource: {}", settings.getJdbcUrl());
        }
        try {
            ds = DataSourceFactory.create(settings);
            DatabaseBootstrap.runFlywayMigrations(ds);
            emf = DatabaseBootstrap.buildEntityManagerFactory(ds);
            log.info("EntityManagerFactory initialized ({})", settings.isEmbedded() ? "H2" : "Postgres");
        } catch (RuntimeException e) {
            log.error("Failed to initialize database", e);
            close();
            throw new IllegalStateException("Database initialization failed; application cannot start.", e);
        }
    }

    public synchronized EntityManagerFactory getEmf() {
        if (emf == null) {
            throw new IllegalStateException("EntityManagerFactory not initialized. Configure DB or check logs.");
        }
        return emf;
    }

    @PreDestroy
    public synchronized void close() {
        if (emf != null) {
            try {
                emf.close();
            } catch (RuntimeException e) {
                log.warn("Error closing EntityManagerFactory", e);
            }
            emf = null;
        }
        if (ds != null) {
            ds.close();
            ds = null;
        }
        log.info("AppDataSourceHolder closed resources");
    }
}
