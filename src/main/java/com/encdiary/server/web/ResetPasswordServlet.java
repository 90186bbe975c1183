package com.encdiary.server.web;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

import com.encdiary.server.error.StoreException;
import com.encdiary.server.error.ValidationException;
import com.encdiary.server.model.UserAccount;
import com.encdiary.server.security.SessionGate;
import com.encdiary.server.service.UserService;

import jakarta.inject.Inject;
import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Redeems a reset token from the emailed link: /reset-password/{token}.
 */
@WebServlet(name = "ResetPasswordServlet", urlPatterns = {"/reset-password/*"})
public class ResetPasswordServlet extends HttpServlet {

    private static final String VIEW = "reset_password.html";
    static final String INVALID_TOKEN = "That is an invalid or expired token.";

    @Inject
    UserService userService;

    public ResetPasswordServlet() {
    }

    ResetPasswordServlet(UserService userService) {
        this.userService = userService;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
        if (SessionGate.isAuthenticated(req)) {
            Views.redirect(req, resp, "/");
            return;
        }
        String token = token(req);
        if (resolve(req, resp, token).isEmpty()) {
            return;
        }
        Views.render(req, resp, VIEW, Map.of("token", token));
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
        if (SessionGate.isAuthenticated(req)) {
            Views.redirect(req, resp, "/");
            return;
        }
        String token = token(req);
        Optional<UserAccount> user = resolve(req, resp, token);
        if (user.isEmpty()) {
            return;
        }

        String password = req.getParameter("password");
        String confirm = req.getParameter("confirm_password");
        if (password == null || password.isBlank()) {
            Flash.add(req, Flash.DANGER, "Password is required.");
            Views.render(req, resp, VIEW, Map.of("token", token));
            return;
        }
        if (!password.equals(confirm)) {
            Flash.add(req, Flash.DANGER, "Passwords must match.");
            Views.render(req, resp, VIEW, Map.of("token", token));
            return;
        }

        try {
            userService.setPassword(user.get(), password);
        } catch (ValidationException e) {
            // account vanished after the token was checked
            Flash.add(req, Flash.DANGER, INVALID_TOKEN);
            Views.redirect(req, resp, "/forgot-password");
            return;
        } catch (StoreException e) {
            Flash.add(req, Flash.DANGER, "An internal error occurred. Please try again.");
            Views.render(req, resp, VIEW, Map.of("token", token));
            return;
        }
        Flash.add(req, Flash.SUCCESS, "Your password has been updated! Please log in with your new password.");
        Views.redirect(req, resp, "/login");
    }

    private Optional<UserAccount> resolve(HttpServletRequest req, HttpServletResponse resp, String token)
            throws IOException {
        Optional<UserAccount> user;
        try {
            user = userService.redeemResetToken(token);
        } catch (StoreException e) {
            user = Optional.empty();
        }
        if (user.isEmpty()) {
            Flash.add(req, Flash.DANGER, INVALID_TOKEN);
            Views.redirect(req, resp, "/forgot-password");
        }
        return user;
    }

    private static String token(HttpServletRequest req) {
        String path = req.getPathInfo();
        if (path == null || path.length() <= 1) {
            return "";
        }
        return path.substring(1);
    }
}
