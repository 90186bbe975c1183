package com.encdiary.server.service;

import java.util.List;
import java.util.Optional;

import org.mindrot.jbcrypt.BCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.encdiary.server.error.DuplicateEmailException;
import com.encdiary.server.error.StoreException;
import com.encdiary.server.error.TokenInvalidException;
import com.encdiary.server.error.ValidationException;
import com.encdiary.server.model.UserAccount;
import com.encdiary.server.security.ResetTokenCodec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;

/**
 * Accounts: registration, password checks and password reset tokens.
 * Emails are stored and matched exactly as entered.
 */
@ApplicationScoped
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private static final int BCRYPT_ROUNDS = 10;

    // checked when the email is unknown so both login failures cost one bcrypt round
    private static final String DUMMY_HASH = BCrypt.hashpw("no-such-account", BCrypt.gensalt(BCRYPT_ROUNDS));

    private final EntityManagerFactory emf;
    private final ResetTokenCodec resetTokens;

    // CDI proxy
    UserService() {
        this(null, null);
    }

    @Inject
    public UserService(EntityManagerFactory emf, ResetTokenCodec resetTokens) {
        this.emf = emf;
        this.resetTokens = resetTokens;
    }

    /**
     * Create an account with a bcrypt-hashed password.
     *
     * @throws ValidationException if email or password is blank
     * @throws DuplicateEmailException if the email is already registered
     */
    public UserAccount register(String email, String password) {
        if (isBlank(email) || isBlank(password)) {
            throw new ValidationException("Both email and password are required.");
        }
        try {
            UserAccount created = Transactions.inTransaction(emf, "An internal error occurred during registration.", em -> {
                if (findByEmail(em, email).isPresent()) {
                    throw new DuplicateEmailException(email);
                }
                UserAccount u = new UserAccount(email, hash(password));
                em.persist(u);
                return u;
            });
            log.info("Registered user id={}", created.getId());
            return created;
        } catch (StoreException e) {
            // lost a race with a concurrent registration of the same email
            if (Transactions.isUniqueViolation(e.getCause())) {
                throw new DuplicateEmailException(email, e.getCause());
            }
            throw e;
        }
    }

    /**
     * Returns the account only when the email exists and the password matches.
     * Callers get no hint which of the two failed.
     */
    public Optional<UserAccount> authenticate(String email, String password) {
        Optional<UserAccount> user = email == null ? Optional.empty() : findByEmail(email);
        String stored = user.map(UserAccount::getPasswordHash).orElse(DUMMY_HASH);
        boolean matches;
        try {
            matches = BCrypt.checkpw(password == null ? "" : password, stored);
        } catch (IllegalArgumentException e) {
            log.warn("Stored password hash for user id={} is not a bcrypt hash", user.map(UserAccount::getId).orElse(null));
            matches = false;
        }
        if (!matches || user.isEmpty()) {
            log.info("Authentication failed");
            return Optional.empty();
        }
        return user;
    }

    public Optional<UserAccount> findByEmail(String email) {
        return Transactions.read(emf, "Unable to look up user.", em -> findByEmail(em, email));
    }

    public Optional<UserAccount> findById(long id) {
        return Transactions.read(emf, "Unable to look up user.", em -> Optional.ofNullable(em.find(UserAccount.class, id)));
    }

    public String issueResetToken(UserAccount user) {
        return resetTokens.issue(user.getId());
    }

    /**
     * Resolves a password reset token to its account. Empty for any invalid,
     * expired or malformed token, and for accounts that no longer exist.
     */
    public Optional<UserAccount> redeemResetToken(String token) {
        long userId;
        try {
            userId = resetTokens.verify(token, ResetTokenCodec.DEFAULT_MAX_AGE_SECONDS);
        } catch (TokenInvalidException e) {
            log.info("Rejected password reset token: {}", e.getMessage());
            return Optional.empty();
        }
        return findById(userId);
    }

    /**
     * Replace the password hash. Reset tokens already issued stay valid until
     * they expire.
     */
    public void setPassword(UserAccount user, String newPassword) {
        if (isBlank(newPassword)) {
            throw new ValidationException("Password is required.");
        }
        String hashed = hash(newPassword);
        Transactions.inTransaction(emf, "Unable to update password.", em -> {
            UserAccount managed = em.find(UserAccount.class, user.getId());
            if (managed == null) {
                throw new ValidationException("Account no longer exists.");
            }
            managed.setPasswordHash(hashed);
            return managed;
        });
        user.setPasswordHash(hashed);
        log.info("Password updated for user id={}", user.getId());
    }

    private static Optional<UserAccount> findByEmail(EntityManager em, String email) {
        List<UserAccount> found = em.createQuery("SELECT u FROM UserAccount u WHERE u.email = :e", UserAccount.class)
                .setParameter("e", email)
                .setMaxResults(1)
                .getResultList();
        return found.stream().findFirst();
    }

    private static String hash(String password) {
        return BCrypt.hashpw(password, BCrypt.gensalt(BCRYPT_ROUNDS));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
