package com.encdiary.server.security;

import java.io.IOException;
import java.security.Principal;
import java.util.Map;
import java.util.Optional;

import jakarta.annotation.Priority;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import jakarta.ws.rs.ext.Provider;

/**
 * Rejects REST calls without a logged-in session and exposes the session's
 * account to resources as the request's {@link SecurityContext} principal.
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class ApiAuthFilter implements ContainerRequestFilter {

    @Context
    HttpServletRequest servletRequest;

    @Override
    public void filter(ContainerRequestContext requestContext) throws IOException {
        // Allow OPTIONS (CORS preflight)
        if ("OPTIONS".equalsIgnoreCase(requestContext.getMethod())) {
            return;
        }

        Optional<DiaryPrincipal> caller = SessionGate.currentUser(servletRequest);
        if (caller.isEmpty()) {
            requestContext.abortWith(Response.status(Response.Status.UNAUTHORIZED)
                    .type(MediaType.APPLICATION_JSON)
                    .entity(Map.of("error", "Authentication required."))
                    .build());
            return;
        }
        boolean secure = requestContext.getSecurityContext() != null && requestContext.getSecurityContext().isSecure();
        requestContext.setSecurityContext(new SessionSecurityContext(caller.get(), secure));
    }

    static final class SessionSecurityContext implements SecurityContext {

        private final DiaryPrincipal principal;
        private final boolean secure;

        SessionSecurityContext(DiaryPrincipal principal, boolean secure) {
            this.principal = principal;
            this.secure = secure;
        }

        @Override
        public Principal getUserPrincipal() {
            return principal;
        }

        @Override
        public boolean isUserInRole(String role) {
            return false;
        }

        @Override
        public boolean isSecure() {
            return secure;
        }

        @Override
        public String getAuthenticationScheme() {
            return FORM_AUTH;
        }
    }
}
