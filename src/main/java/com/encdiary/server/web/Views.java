package com.encdiary.server.web;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import jakarta.servlet.ServletContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Minimal HTML templating: files under /WEB-INF/views with ${name}
 * placeholders. ${contextPath} and ${flashes} are always available; every
 * other value is HTML-escaped.
 */
final class Views {

    static final String VIEW_ROOT = "/WEB-INF/views/";

    private Views() {
    }

    static void render(HttpServletRequest req, HttpServletResponse resp, String view, Map<String, String> values)
            throws IOException {
        String rendered = loadTemplate(req.getServletContext(), VIEW_ROOT + view)
                .replace("${contextPath}", req.getContextPath())
                .replace("${flashes}", renderFlashes(Flash.drain(req)));
        for (Map.Entry<String, String> value : values.entrySet()) {
            rendered = rendered.replace("${" + value.getKey() + "}", escapeHtml(value.getValue()));
        }

        resp.setContentType("text/html;charset=UTF-8");
        try (PrintWriter out = resp.getWriter()) {
            out.print(rendered);
        }
    }

    static void render(HttpServletRequest req, HttpServletResponse resp, String view) throws IOException {
        render(req, resp, view, Map.of());
    }

    static void redirect(HttpServletRequest req, HttpServletResponse resp, String path) throws IOException {
        resp.sendRedirect(req.getContextPath() + path);
    }

    static String renderFlashes(List<Flash> flashes) {
        StringBuilder builder = new StringBuilder();
        for (Flash flash : flashes) {
            builder.append("<div class=\"flash ").append(escapeHtml(flash.getCategory())).append("\">")
                    .append(escapeHtml(flash.getMessage()))
                    .append("</div>");
        }
        return builder.toString();
    }

    static String escapeHtml(String input) {
        if (input == null) {
            return "";
        }
        return input.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#39;");
    }

    private static String loadTemplate(ServletContext context, String path) throws IOException {
        try (InputStream stream = context.getResourceAsStream(path)) {
            if (stream == null) {
                throw new IOException("Template not found: " + path);
            }
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
