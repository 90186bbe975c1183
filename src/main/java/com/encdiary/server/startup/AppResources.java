package com.encdiary.server.startup;

import java.time.Clock;

import com.encdiary.server.config.DiaryConfig;
import com.encdiary.server.mail.Mailer;
import com.encdiary.server.mail.SmtpMailer;
import com.encdiary.server.security.ResetTokenCodec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Dependent;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import jakarta.persistence.EntityManagerFactory;

/**
 * Shared services created once at startup and injected into the stores,
 * servlets and resources.
 */
@ApplicationScoped
public class AppResources {

    @Produces
    @Singleton
    public DiaryConfig config() {
        return DiaryConfig.fromEnv();
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Dependent
    public EntityManagerFactory entityManagerFactory(AppDataSourceHolder holder) {
        return holder.getEmf();
    }

    @Produces
    @Singleton
    public ResetTokenCodec resetTokenCodec(DiaryConfig config, Clock clock) {
        return new ResetTokenCodec(config.getSecretKey(), ResetTokenCodec.PASSWORD_RESET_PURPOSE, clock);
    }

    @Produces
    @Singleton
    public Mailer mailer(DiaryConfig config) {
        return new SmtpMailer(config.getMail());
    }
}
