package com.encdiary.server.web;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.encdiary.server.security.SessionGate;

import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@WebServlet(name = "LogoutServlet", urlPatterns = {"/logout"})
public class LogoutServlet extends HttpServlet {

    private static final Logger log = LoggerFactory.getLogger(LogoutServlet.class);

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
        SessionGate.currentUser(req).ifPresent(user -> log.info("User id={} logged out", user.getUserId()));
        SessionGate.clear(req);
        Flash.add(req, Flash.SUCCESS, "You have been logged out.");
        Views.redirect(req, resp, "/login");
    }
}
