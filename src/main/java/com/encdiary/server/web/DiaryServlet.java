package com.encdiary.server.web;

import java.io.IOException;
import java.util.Map;

import com.encdiary.server.security.DiaryPrincipal;
import com.encdiary.server.security.SessionGate;

import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * The diary page. Entries are fetched and decrypted by the browser through
 * /api/entries; the page itself carries no diary data.
 */
@WebServlet(name = "DiaryServlet", urlPatterns = {""})
public class DiaryServlet extends HttpServlet {

    private static final String VIEW = "diary.html";

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
        String email = SessionGate.currentUser(req).map(DiaryPrincipal::getEmail).orElse("");
        Views.render(req, resp, VIEW, Map.of("email", email));
    }
}
