package com.encdiary.server.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import org.junit.jupiter.api.Test;
import org.mockito.MockedConstruction;
import static org.mockito.Mockito.mockConstruction;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

class DataSourceFactoryTest {

    @Test
    void create_usesUrlWhenProvided() {
        DatabaseSettings settings = DatabaseSettings.from(Map.of(
                "DB_URL", "jdbc:postgresql://custom:1234/appdb",
                "DB_HOST", "ignored",
                "DB_PASSWORD", "secret"));

        List<HikariConfig> captured = new ArrayList<>();
        try (MockedConstruction<HikariDataSource> mocked = mockConstruction(HikariDataSource.class,
                (mock, context) -> captured.add((HikariConfig) context.arguments().get(0)))) {

            DataSourceFactory.create(settings);
        }

        HikariConfig cfg = captured.get(0);
        assertEquals("jdbc:postgresql://custom:1234/appdb", cfg.getJdbcUrl());
        assertEquals("postgres", cfg.getUsername());
        assertEquals("secret", cfg.getPassword());
        assertEquals("org.postgresql.Driver", cfg.getDriverClassName());
        assertEquals(10, cfg.getMaximumPoolSize());
        assertEquals("encrypted-diary-hikari", cfg.getPoolName());
    }

    @Test
    void toHikariConfig_buildsUrlFromHostParts() {
        DatabaseSettings settings = DatabaseSettings.from(Map.of(
                "DB_HOST", "dbhost",
                "DB_PORT", "6543",
                "DB_NAME", "example",
                "DB_USER", "diary",
                "DB_POOL_SIZE", "3"));

        HikariConfig cfg = DataSourceFactory.toHikariConfig(settings);

        assertEquals("jdbc:postgresql://dbhost:6543/example", cfg.getJdbcUrl());
        assertEquals("diary", cfg.getUsername());
        assertNull(cfg.getPassword());
        assertEquals(3, cfg.getMaximumPoolSize());
    }

    @Test
    void toHikariConfig_fallsBackToDefaultPoolSize() {
        DatabaseSettings settings = new DatabaseSettings("jdbc:h2:mem:pool_default", "sa", "", 0, true);

        HikariConfig cfg = DataSourceFactory.toHikariConfig(settings);

        assertEquals(10, cfg.getMaximumPoolSize());
        assertEquals("org.h2.Driver", cfg.getDriverClassName());
    }
}
