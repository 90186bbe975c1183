package com.encdiary.server.web;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;

/**
 * One-shot message stored in the session and shown by the next rendered page.
 */
public final class Flash implements Serializable {

    private static final long serialVersionUID = 1L;

    static final String SESSION_KEY = "flash";

    public static final String SUCCESS = "success";
    public static final String INFO = "info";
    public static final String WARNING = "warning";
    public static final String DANGER = "danger";

    private final String category;
    private final String message;

    public Flash(String category, String message) {
        this.category = category;
        this.message = message;
    }

    @SuppressWarnings("unchecked")
    public static void add(HttpServletRequest req, String category, String message) {
        HttpSession session = req.getSession(true);
        List<Flash> pending = (List<Flash>) session.getAttribute(SESSION_KEY);
        List<Flash> updated = pending == null ? new ArrayList<>() : new ArrayList<>(pending);
        updated.add(new Flash(category, message));
        session.setAttribute(SESSION_KEY, updated);
    }

    /**
     * Returns and forgets the pending messages.
     */
    @SuppressWarnings("unchecked")
    public static List<Flash> drain(HttpServletRequest req) {
        HttpSession session = req.getSession(false);
        if (session == null) {
            return List.of();
        }
        List<Flash> pending = (List<Flash>) session.getAttribute(SESSION_KEY);
        if (pending == null) {
            return List.of();
        }
        session.removeAttribute(SESSION_KEY);
        return pending;
    }

    public String getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }
}
