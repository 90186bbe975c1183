package com.encdiary.server.web;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;

import com.encdiary.server.security.SessionGate;

import jakarta.servlet.ServletContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;

/**
 * Request, response and a map-backed session for driving servlets directly.
 * Templates are served from src/main/webapp.
 */
final class ServletMocks {

    static final String CONTEXT_PATH = "/diary";
    private static final Path WEBAPP = Paths.get("src", "main", "webapp");

    final HttpServletRequest request = mock(HttpServletRequest.class);
    final HttpServletResponse response = mock(HttpServletResponse.class);
    final HttpSession session = mock(HttpSession.class);
    final ServletContext servletContext = mock(ServletContext.class);
    final Map<String, Object> attributes = new HashMap<>();
    final StringWriter body = new StringWriter();

    ServletMocks() throws IOException {
        doReturn(CONTEXT_PATH).when(request).getContextPath();
        doReturn(session).when(request).getSession(false);
        doReturn(session).when(request).getSession(true);
        doReturn(servletContext).when(request).getServletContext();
        doReturn(new PrintWriter(body)).when(response).getWriter();

        doAnswer(inv -> attributes.put(inv.getArgument(0), inv.getArgument(1)))
                .when(session).setAttribute(anyString(), any());
        doAnswer(inv -> attributes.get(inv.<String>getArgument(0)))
                .when(session).getAttribute(anyString());
        doAnswer(inv -> attributes.remove(inv.<String>getArgument(0)))
                .when(session).removeAttribute(anyString());
        doAnswer(inv -> {
            attributes.clear();
            return null;
        }).when(session).invalidate();

        doAnswer(inv -> {
            Path file = WEBAPP.resolve(inv.<String>getArgument(0).substring(1));
            return Files.exists(file) ? Files.newInputStream(file) : null;
        }).when(servletContext).getResourceAsStream(anyString());
    }

    void param(String name, String value) {
        doReturn(value).when(request).getParameter(name);
    }

    void loggedInAs(long userId, String email) {
        attributes.put(SessionGate.USER_ID, userId);
        attributes.put(SessionGate.EMAIL, email);
    }

    @SuppressWarnings("unchecked")
    List<String> pendingFlashes() {
        List<Flash> pending = (List<Flash>) attributes.get(Flash.SESSION_KEY);
        if (pending == null) {
            return List.of();
        }
        return pending.stream().map(Flash::getMessage).collect(Collectors.toList());
    }

    String html() {
        return body.toString();
    }
}
