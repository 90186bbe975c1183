package com.encdiary.server.config;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application settings, read once from environment variables at startup.
 */
public final class DiaryConfig {

    private static final Logger log = LoggerFactory.getLogger(DiaryConfig.class);

    static final String FALLBACK_SECRET = "DEFAULT_FALLBACK_KEY_CHANGE_ME_IMMEDIATELY_IN_PROD";

    private final String secretKey;
    private final DatabaseSettings database;
    private final MailSettings mail;

    public DiaryConfig(String secretKey, DatabaseSettings database, MailSettings mail) {
        this.secretKey = secretKey;
        this.database = database;
        this.mail = mail;
    }

    public static DiaryConfig fromEnv() {
        return from(System.getenv());
    }

    public static DiaryConfig from(Map<String, String> env) {
        String secret = env.get("SECRET_KEY");
        if (secret == null || secret.isBlank()) {
            log.warn("SECRET_KEY is not set; using the built-in fallback secret. Do not run like this in production.");
            secret = FALLBACK_SECRET;
        }
        return new DiaryConfig(secret, DatabaseSettings.from(env), MailSettings.from(env));
    }

    public String getSecretKey() {
        return secretKey;
    }

    public DatabaseSettings getDatabase() {
        return database;
    }

    public MailSettings getMail() {
        return mail;
    }

    static int intValue(Map<String, String> env, String name, int defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Environment variable " + name + " must be an integer, got '" + value + "'", e);
        }
    }

    static boolean booleanValue(Map<String, String> env, String name, boolean defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String v = value.trim().toLowerCase();
        return v.equals("true") || v.equals("1") || v.equals("t");
    }

    static String value(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
