package com.encdiary.server.config;

import java.util.Map;

/**
 * JDBC connection settings. When neither DB_URL nor DB_HOST is present the
 * application runs on an embedded H2 database.
 */
public final class DatabaseSettings {

    static final String H2_URL = "jdbc:h2:mem:encrypted_diary;DB_CLOSE_DELAY=-1";

    private final String jdbcUrl;
    private final String username;
    private final String password;
    private final int maxPoolSize;
    private final boolean embedded;

    public DatabaseSettings(String jdbcUrl, String username, String password, int maxPoolSize, boolean embedded) {
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.password = password;
        this.maxPoolSize = maxPoolSize;
        this.embedded = embedded;
    }

    public static DatabaseSettings embeddedH2() {
        return new DatabaseSettings(H2_URL, "sa", "", 10, true);
    }

    static DatabaseSettings from(Map<String, String> env) {
        int poolSize = DiaryConfig.intValue(env, "DB_POOL_SIZE", 10);
        String jdbcUrl = env.get("DB_URL");
        String host = env.get("DB_HOST");
        if ((jdbcUrl == null || jdbcUrl.isBlank()) && (host == null || host.isBlank())) {
            return embeddedH2();
        }
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            String port = DiaryConfig.value(env, "DB_PORT", "5432");
            String db = DiaryConfig.value(env, "DB_NAME", "encrypted_diary_db");
            jdbcUrl = "jdbc:postgresql://" + host + ":" + port + "/" + db;
        }
        String user = DiaryConfig.value(env, "DB_USER", "postgres");
        return new DatabaseSettings(jdbcUrl, user, env.get("DB_PASSWORD"), poolSize, false);
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public boolean isEmbedded() {
        return embedded;
    }

    public String getDriverClassName() {
        return jdbcUrl.startsWith("jdbc:h2:") ? "org.h2.Driver" : "org.postgresql.Driver";
    }
}
