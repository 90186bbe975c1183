package com.encdiary.server.security;

import java.util.Optional;

import com.encdiary.server.model.UserAccount;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;

/**
 * Binds an account to the HTTP session on login and resolves it on later
 * requests. A session is either anonymous (no user id) or authenticated.
 */
public final class SessionGate {

    public static final String USER_ID = "userId";
    public static final String EMAIL = "email";
    static final String FIRST_LOGIN = "firstLogin";
    static final int MAX_INACTIVE_SECONDS = 30 * 60;

    private SessionGate() {
    }

    public static Optional<DiaryPrincipal> currentUser(HttpServletRequest req) {
        HttpSession session = req.getSession(false);
        if (session == null) {
            return Optional.empty();
        }
        Object id = session.getAttribute(USER_ID);
        if (!(id instanceof Long)) {
            return Optional.empty();
        }
        return Optional.of(new DiaryPrincipal((Long) id, (String) session.getAttribute(EMAIL)));
    }

    public static boolean isAuthenticated(HttpServletRequest req) {
        return currentUser(req).isPresent();
    }

    /**
     * Anonymous to authenticated. The session id is rotated to defeat
     * fixation.
     *
     * @return true when this is the first login seen by the session
     */
    public static boolean bind(HttpServletRequest req, UserAccount user) {
        HttpSession session = req.getSession(true);
        req.changeSessionId();
        session.setAttribute(USER_ID, user.getId());
        session.setAttribute(EMAIL, user.getEmail());
        session.setMaxInactiveInterval(MAX_INACTIVE_SECONDS);
        if (session.getAttribute(FIRST_LOGIN) == null) {
            session.setAttribute(FIRST_LOGIN, Boolean.TRUE);
            return true;
        }
        return false;
    }

    /**
     * Authenticated to anonymous; drops every session attribute.
     */
    public static void clear(HttpServletRequest req) {
        HttpSession session = req.getSession(false);
        if (session != null) {
            session.invalidate();
        }
    }
}
