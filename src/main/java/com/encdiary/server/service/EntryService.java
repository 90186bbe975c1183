package com.encdiary.server.service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.encdiary.server.error.EntryAccessDeniedException;
import com.encdiary.server.error.EntryNotFoundException;
import com.encdiary.server.error.ValidationException;
import com.encdiary.server.model.Entry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;

/**
 * Per-user storage of encrypted diary entries. Every operation is scoped to
 * an owner id; entries of other users are never returned or changed.
 */
@ApplicationScoped
public class EntryService {

    private static final Logger log = LoggerFactory.getLogger(EntryService.class);

    static final String MISSING_FIELDS = "Missing encrypted title or content";

    private final EntityManagerFactory emf;
    private final Clock clock;

    // CDI proxy
    EntryService() {
        this(null, null);
    }

    @Inject
    public EntryService(EntityManagerFactory emf, Clock clock) {
        this.emf = emf;
        this.clock = clock;
    }

    /**
     * All entries of {@code ownerId}, most recently modified first.
     */
    public List<Entry> list(long ownerId) {
        return Transactions.read(emf, "Database error while loading entries.", em ->
                em.createQuery("SELECT e FROM Entry e WHERE e.userId = :owner "
                                + "ORDER BY e.dateModified DESC, e.id DESC", Entry.class)
                        .setParameter("owner", ownerId)
                        .getResultList());
    }

    public Entry create(long ownerId, String encryptedTitle, String encryptedContent) {
        validate(encryptedTitle, encryptedContent);
        Entry created = Transactions.inTransaction(emf, "Database error while creating entry.", em -> {
            Instant now = now();
            Entry entry = new Entry();
            entry.setEncryptedTitle(encryptedTitle);
            entry.setEncryptedContent(encryptedContent);
            entry.setUserId(ownerId);
            entry.setDateCreated(now);
            entry.setDateModified(now);
            em.persist(entry);
            return entry;
        });
        log.info("User id={} created entry id={}", ownerId, created.getId());
        return created;
    }

    /**
     * Replace title and content wholesale and refresh the modification time.
     *
     * @throws EntryNotFoundException if no entry has this id
     * @throws EntryAccessDeniedException if the entry belongs to another user
     * @throws ValidationException if either field is empty
     */
    public Entry update(long entryId, long ownerId, String encryptedTitle, String encryptedContent) {
        Entry updated = Transactions.inTransaction(emf, "Database error while updating entry.", em -> {
            Entry entry = findOwned(em, entryId, ownerId);
            validate(encryptedTitle, encryptedContent);
            entry.setEncryptedTitle(encryptedTitle);
            entry.setEncryptedContent(encryptedContent);
            entry.setDateModified(latest(entry.getDateCreated(), now()));
            return entry;
        });
        log.info("User id={} updated entry id={}", ownerId, entryId);
        return updated;
    }

    public void delete(long entryId, long ownerId) {
        Transactions.inTransaction(emf, "Database error while deleting entry.", em -> {
            Entry entry = findOwned(em, entryId, ownerId);
            em.remove(entry);
            return null;
        });
        log.info("User id={} deleted entry id={}", ownerId, entryId);
    }

    private static Entry findOwned(EntityManager em, long entryId, long ownerId) {
        Entry entry = em.find(Entry.class, entryId);
        if (entry == null) {
            throw new EntryNotFoundException(entryId);
        }
        if (!entry.isOwnedBy(ownerId)) {
            log.warn("User id={} attempted to modify entry id={} owned by another user", ownerId, entryId);
            throw new EntryAccessDeniedException(entryId, ownerId);
        }
        return entry;
    }

    private static void validate(String encryptedTitle, String encryptedContent) {
        if (encryptedTitle == null || encryptedTitle.isEmpty()
                || encryptedContent == null || encryptedContent.isEmpty()) {
            throw new ValidationException(MISSING_FIELDS);
        }
        if (encryptedTitle.length() > Entry.MAX_TITLE_LENGTH) {
            throw new ValidationException("Encrypted title exceeds " + Entry.MAX_TITLE_LENGTH + " characters");
        }
    }

    // timestamp columns keep microseconds
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    // a clock stepping backwards must not break date_modified >= date_created
    private static Instant latest(Instant created, Instant now) {
        return created != null && now.isBefore(created) ? created : now;
    }
}
