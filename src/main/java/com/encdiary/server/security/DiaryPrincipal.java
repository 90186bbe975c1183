package com.encdiary.server.security;

import java.security.Principal;
import java.util.Objects;
import java.util.Optional;

import jakarta.ws.rs.core.SecurityContext;

/**
 * The authenticated caller of a request: the account id that owns the data
 * being touched, plus the login email.
 */
public final class DiaryPrincipal implements Principal {

    private final long userId;
    private final String email;

    public DiaryPrincipal(long userId, String email) {
        this.userId = userId;
        this.email = email;
    }

    public static Optional<DiaryPrincipal> of(SecurityContext securityContext) {
        if (securityContext != null && securityContext.getUserPrincipal() instanceof DiaryPrincipal) {
            return Optional.of((DiaryPrincipal) securityContext.getUserPrincipal());
        }
        return Optional.empty();
    }

    public long getUserId() {
        return userId;
    }

    public String getEmail() {
        return email;
    }

    @Override
    public String getName() {
        return email;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DiaryPrincipal)) {
            return false;
        }
        DiaryPrincipal other = (DiaryPrincipal) o;
        return userId == other.userId && Objects.equals(email, other.email);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, email);
    }

    @Override
    public String toString() {
        return "DiaryPrincipal[userId=" + userId + "]";
    }
}
