package com.encdiary.server.web;

import java.io.IOException;

import com.encdiary.server.error.StoreException;
import com.encdiary.server.security.SessionGate;
import com.encdiary.server.service.PasswordResetService;
import com.encdiary.server.service.ResetRequestOutcome;

import jakarta.inject.Inject;
import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Starts a password reset. The response is the same whether or not the email
 * belongs to an account.
 */
@WebServlet(name = "ForgotPasswordServlet", urlPatterns = {"/forgot-password"})
public class ForgotPasswordServlet extends HttpServlet {

    private static final String VIEW = "forgot_password.html";
    static final String ACKNOWLEDGEMENT = "If your email is in our system, you will receive a password reset link shortly.";
    static final String MAIL_WARNING = "Password reset email could not be sent right now. Please try again later.";

    @Inject
    PasswordResetService passwordResetService;

    public ForgotPasswordServlet() {
    }

    ForgotPasswordServlet(PasswordResetService passwordResetService) {
        this.passwordResetService = passwordResetService;
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
        String base = baseUrl(req);
        ResetRequestOutcome outcome;
        try {
            outcome = passwordResetService.requestReset(req.getParameter("email"),
                    token -> base + "/reset-password/" + token);
        } catch (StoreException e) {
            outcome = ResetRequestOutcome.MAIL_FAILED;
        }

        if (outcome == ResetRequestOutcome.MAIL_FAILED || outcome == ResetRequestOutcome.MAIL_NOT_CONFIGURED) {
            Flash.add(req, Flash.WARNING, MAIL_WARNING);
        }
        Flash.add(req, Flash.INFO, ACKNOWLEDGEMENT);
        Views.redirect(req, resp, "/login");
    }

    static String baseUrl(HttpServletRequest req) {
        String scheme = req.getScheme();
        int port = req.getServerPort();
        boolean defaultPort = ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
        return scheme + "://" + req.getServerName() + (defaultPort ? "" : ":" + port) + req.getContextPath();
    }
}
