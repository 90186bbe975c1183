package com.encdiary.server.config;

import java.util.Map;

/**
 * Outbound SMTP settings used for password reset mail.
 */
public final class MailSettings {

    static final String PLACEHOLDER_USERNAME = "YOUR_EMAIL_ADDRESS@gmail.com";

    private final String host;
    private final int port;
    private final boolean startTls;
    private final String username;
    private final String password;
    private final String defaultSender;

    public MailSettings(String host, int port, boolean startTls, String username, String password, String defaultSender) {
        this.host = host;
        this.port = port;
        this.startTls = startTls;
        this.username = username;
        this.password = password;
        this.defaultSender = defaultSender;
    }

    static MailSettings from(Map<String, String> env) {
        String username = DiaryConfig.value(env, "MAIL_USERNAME", PLACEHOLDER_USERNAME);
        return new MailSettings(
                DiaryConfig.value(env, "MAIL_SERVER", "smtp.gmail.com"),
                DiaryConfig.intValue(env, "MAIL_PORT", 587),
                DiaryConfig.booleanValue(env, "MAIL_USE_TLS", true),
                username,
                env.get("MAIL_PASSWORD"),
                DiaryConfig.value(env, "MAIL_DEFAULT_SENDER", username));
    }

    /**
     * False while the username is missing or still the sample placeholder.
     */
    public boolean isConfigured() {
        return username != null && !username.isBlank() && !PLACEHOLDER_USERNAME.equals(username);
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public boolean isStartTls() {
        return startTls;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getDefaultSender() {
        return defaultSender;
    }
}
