package com.encdiary.server.security;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;

class ApiAuthFilterTest {

    private ApiAuthFilter filter;
    private ContainerRequestContext requestContext;
    private HttpServletRequest servletRequest;
    private HttpSession session;

    @BeforeEach
    void setUp() {
        requestContext = mock(ContainerRequestContext.class);
        servletRequest = mock(HttpServletRequest.class);
        session = mock(HttpSession.class);

        filter = new ApiAuthFilter();
        filter.servletRequest = servletRequest;
        doReturn("GET").when(requestContext).getMethod();
    }

    @Test
    void filter_abortsWithUnauthorized_whenNoSession() throws Exception {
        doReturn(null).when(servletRequest).getSession(false);

        filter.filter(requestContext);

        ArgumentCaptor<Response> captor = ArgumentCaptor.forClass(Response.class);
        verify(requestContext).abortWith(captor.capture());
        assertEquals(401, captor.getValue().getStatus());
        assertEquals(Map.of("error", "Authentication required."), captor.getValue().getEntity());
        verify(requestContext, never()).setSecurityContext(any());
    }

    @Test
    void filter_abortsWithUnauthorized_whenSessionIsAnonymous() throws Exception {
        doReturn(session).when(servletRequest).getSession(false);

        filter.filter(requestContext);

        verify(requestContext).abortWith(any(Response.class));
    }

    @Test
    void filter_installsSessionPrincipal_whenLoggedIn() throws Exception {
        SecurityContext original = mock(SecurityContext.class);
        doReturn(true).when(original).isSecure();
        doReturn(original).when(requestContext).getSecurityContext();
        doReturn(session).when(servletRequest).getSession(false);
        doReturn(9L).when(session).getAttribute(SessionGate.USER_ID);
        doReturn("bob@example.com").when(session).getAttribute(SessionGate.EMAIL);

        filter.filter(requestContext);

        ArgumentCaptor<SecurityContext> captor = ArgumentCaptor.forClass(SecurityContext.class);
        verify(requestContext).setSecurityContext(captor.capture());
        verify(requestContext, never()).abortWith(any());
        SecurityContext installed = captor.getValue();
        assertEquals(new DiaryPrincipal(9L, "bob@example.com"), installed.getUserPrincipal());
        assertTrue(installed.isSecure());
        assertFalse(installed.isUserInRole("admin"));
        assertEquals(SecurityContext.FORM_AUTH, installed.getAuthenticationScheme());
    }

    @Test
    void filter_letsPreflightThrough() throws Exception {
        doReturn("OPTIONS").when(requestContext).getMethod();

        filter.filter(requestContext);

        verify(requestContext, never()).abortWith(any());
        verify(requestContext, never()).setSecurityContext(any());
    }
}
