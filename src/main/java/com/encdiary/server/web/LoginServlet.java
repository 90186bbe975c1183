package com.encdiary.server.web;

import java.io.IOException;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.encdiary.server.error.StoreException;
import com.encdiary.server.model.UserAccount;
import com.encdiary.server.security.SessionGate;
import com.encdiary.server.service.UserService;

import jakarta.inject.Inject;
import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@WebServlet(name = "LoginServlet", urlPatterns = {"/login"})
public class LoginServlet extends HttpServlet {

    private static final Logger log = LoggerFactory.getLogger(LoginServlet.class);

    private static final String VIEW = "login.html";
    static final String INVALID_CREDENTIALS = "Invalid email or password.";
    static final String WELCOME = "Welcome! Please enter your master diary password to unlock your entries.";

    @Inject
    UserService userService;

    public LoginServlet() {
    }

    LoginServlet(UserService userService) {
        this.userService = userService;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
        if (SessionGate.isAuthenticated(req)) {
            Views.redirect(req, resp, "/");
            return;
        }
        Views.render(req, resp, VIEW);
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
        if (SessionGate.isAuthenticated(req)) {
            Views.redirect(req, resp, "/");
            return;
        }
        String email = req.getParameter("email");
        String password = req.getParameter("password");

        Optional<UserAccount> user;
        try {
            user = userService.authenticate(email, password);
        } catch (StoreException e) {
            Flash.add(req, Flash.DANGER, "An internal error occurred. Please try again.");
            Views.redirect(req, resp, "/login");
            return;
        }
        if (user.isEmpty()) {
            Flash.add(req, Flash.DANGER, INVALID_CREDENTIALS);
            Views.redirect(req, resp, "/login");
            return;
        }

        if (SessionGate.bind(req, user.get())) {
            Flash.add(req, Flash.SUCCESS, WELCOME);
        }
        log.info("User id={} logged in", user.get().getId());
        Views.redirect(req, resp, "/");
    }
}
