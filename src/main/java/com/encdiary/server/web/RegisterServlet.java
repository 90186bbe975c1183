package com.encdiary.server.web;

import java.io.IOException;

import com.encdiary.server.error.DuplicateEmailException;
import com.encdiary.server.error.StoreException;
import com.encdiary.server.error.ValidationException;
import com.encdiary.server.security.SessionGate;
import com.encdiary.server.service.UserService;

import jakarta.inject.Inject;
import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@WebServlet(name = "RegisterServlet", urlPatterns = {"/register"})
public class RegisterServlet extends HttpServlet {

    private static final String VIEW = "register.html";

    @Inject
    UserService userService;

    public RegisterServlet() {
    }

    RegisterServlet(UserService userService) {
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
        try {
            userService.register(req.getParameter("email"), req.getParameter("password"));
        } catch (ValidationException e) {
            Flash.add(req, Flash.DANGER, "Both email and password are required.");
            Views.redirect(req, resp, "/register");
            return;
        } catch (DuplicateEmailException e) {
            Flash.add(req, Flash.DANGER, "Email already registered. Please log in or use a different one.");
            Views.redirect(req, resp, "/register");
            return;
        } catch (StoreException e) {
            Flash.add(req, Flash.DANGER, "An internal error occurred during registration. Please try again.");
            Views.redirect(req, resp, "/register");
            return;
        }
        Flash.add(req, Flash.SUCCESS, "Registration successful! Please log in.");
        Views.redirect(req, resp, "/login");
    }
}
