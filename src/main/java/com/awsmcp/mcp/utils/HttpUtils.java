package com.awsmcp.mcp.utils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpExchange;

/**
 * Utility methods for HTTP operations on the embedded server
 */
public final class HttpUtils {
    private static final Logger LOG = LoggerFactory.getLogger(HttpUtils.class);

    private HttpUtils() {}

    /**
     * Read the request body as UTF-8 text.
     */
    public static String readBody(HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Parse the request body as a JSON object. An empty body is an empty object.
     *
     * @throws IllegalArgumentException if the body is not a JSON object
     */
    public static Map<String, Object> readJsonObject(HttpExchange exchange) throws IOException {
        String body = readBody(exchange);
        try {
            return Json.readObject(body);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Request body must be a JSON object", e);
        }
    }

    /**
     * Check the request method, answering 405 when it does not match.
     *
     * @return true if the request may proceed
     */
    public static boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
            return true;
        }
        exchange.getResponseHeaders().set("Allow", method);
        sendError(exchange, 405, "Method " + exchange.getRequestMethod() + " not allowed");
        return false;
    }

    /**
     * Send a JSON HTTP response
     */
    public static void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = Json.serialize(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (var os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    /**
     * Send {"error": {"message": ...}} with the given status.
     */
    public static void sendError(HttpExchange exchange, int status, String message) throws IOException {
        LOG.debug("HTTP {} for {} {}: {}", status, exchange.getRequestMethod(), exchange.getRequestURI(), message);
        sendJson(exchange, status, Map.of("error", Map.of("message", message)));
    }
}
