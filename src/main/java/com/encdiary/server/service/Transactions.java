package com.encdiary.server.service;

import java.sql.SQLException;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.encdiary.server.error.DiaryException;
import com.encdiary.server.error.StoreException;

import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.EntityTransaction;
import jakarta.persistence.PersistenceException;

/**
 * Runs a unit of work on its own EntityManager. Anything that escapes the work
 * rolls the transaction back; persistence failures become {@link StoreException}.
 */
final class Transactions {

    private static final Logger log = LoggerFactory.getLogger(Transactions.class);

    private static final String UNIQUE_VIOLATION = "23505";

    private Transactions() {
    }

    static <T> T inTransaction(EntityManagerFactory emf, String failureMessage, Function<EntityManager, T> work) {
        EntityManager em = emf.createEntityManager();
        EntityTransaction tx = em.getTransaction();
        try {
            tx.begin();
            T result = work.apply(em);
            tx.commit();
            return result;
        } catch (DiaryException e) {
            throw e;
        } catch (PersistenceException e) {
            log.error(failureMessage, e);
            throw new StoreException(failureMessage, e);
        } finally {
            if (tx.isActive()) {
                tx.rollback();
            }
            em.close();
        }
    }

    static <T> T read(EntityManagerFactory emf, String failureMessage, Function<EntityManager, T> work) {
        EntityManager em = emf.createEntityManager();
        try {
            return work.apply(em);
        } catch (PersistenceException e) {
            log.error(failureMessage, e);
            throw new StoreException(failureMessage, e);
        } finally {
            em.close();
        }
    }

    static boolean isUniqueViolation(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLException && UNIQUE_VIOLATION.equals(((SQLException) t).getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
