package com.encdiary.server.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates a HikariCP DataSource from {@link DatabaseSettings}.
 */
public final class DataSourceFactory {

    static final String POOL_NAME = "encrypted-diary-hikari";

    private DataSourceFactory() {
    }

    public static HikariDataSource create(DatabaseSettings settings) {
        return new HikariDataSource(toHikariConfig(settings));
    }

    static HikariConfig toHikariConfig(DatabaseSettings settings) {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(settings.getJdbcUrl());
        cfg.setUsername(settings.getUsername());
        if (settings.getPassword() != null) {
            cfg.setPassword(settings.getPassword());
        }
        cfg.setDriverClassName(settings.getDriverClassName());
        cfg.setMaximumPoolSize(settings.getMaxPoolSize() > 0 ? settings.getMaxPoolSize() : 10);
        cfg.setPoolName(POOL_NAME);
        return cfg;
    }
}
