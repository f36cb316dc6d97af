package com.awsmcp.mcp.api;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.awsmcp.mcp.McpServerManager;
import com.awsmcp.mcp.model.ToolResponse;
import com.awsmcp.mcp.utils.HttpUtils;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

/**
 * Registers the HTTP endpoints that expose a {@link ToolGateway}:
 * <ul>
 *   <li>{@code GET /mcp/tools} lists the tool catalog with input schemas</li>
 *   <li>{@code POST /tools/call} takes {@code {"name": ..., "arguments": {...}}}</li>
 *   <li>{@code POST /<tool_name>} takes the arguments object as its body</li>
 * </ul>
 * Tool outcomes, failures included, are answered with HTTP 200; only unreadable requests get 4xx.
 */
public class ApiHandlerRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ApiHandlerRegistry.class);

    private final McpServerManager serverManager;
    private final ToolGateway gateway;

    public ApiHandlerRegistry(McpServerManager serverManager, ToolGateway gateway) {
        this.serverManager = serverManager;
        this.gateway = gateway;
    }

    /**
     * Register all API endpoints with the running server
     *
     * @throws IllegalStateException if the server has not been started
     */
    public void registerAllEndpoints() {
        if (!serverManager.isServerRunning()) {
            throw new IllegalStateException("Cannot register endpoints: server is not running");
        }
        HttpServer server = serverManager.getServer();

        server.createContext("/mcp/tools", exact("/mcp/tools", exchange -> {
            if (!HttpUtils.requireMethod(exchange, "GET")) return;
            HttpUtils.sendJson(exchange, 200, toolListing());
        }));

        server.createContext("/tools/call", exact("/tools/call", exchange -> {
            if (!HttpUtils.requireMethod(exchange, "POST")) return;
            Map<String, Object> body;
            try {
                body = HttpUtils.readJsonObject(exchange);
            } catch (IllegalArgumentException e) {
                HttpUtils.sendError(exchange, 400, e.getMessage());
                return;
            }
            if (!(body.get("name") instanceof String toolName)) {
                HttpUtils.sendError(exchange, 400, "Field 'name' must be a string");
                return;
            }
            Object arguments = body.get("arguments");
            if (arguments != null && !(arguments instanceof Map)) {
                HttpUtils.sendError(exchange, 400, "Field 'arguments' must be an object");
                return;
            }
            HttpUtils.sendJson(exchange, 200, call(toolName, arguments));
        }));

        for (ToolDef tool : gateway.tools()) {
            registerEndpoint(server, tool.getName());
        }
        LOG.info("Registered {} tool endpoints for {}", gateway.tools().size(), gateway.getServerName());
    }

    /**
     * Register a tool endpoint, using the tool name as the path (with leading slash)
     */
    private void registerEndpoint(HttpServer server, String toolName) {
        String endpoint = "/" + toolName;
        server.createContext(endpoint, exact(endpoint, exchange -> {
            if (!HttpUtils.requireMethod(exchange, "POST")) return;
            Map<String, Object> arguments;
            try {
                arguments = HttpUtils.readJsonObject(exchange);
            } catch (IllegalArgumentException e) {
                HttpUtils.sendError(exchange, 400, e.getMessage());
                return;
            }
            HttpUtils.sendJson(exchange, 200, gateway.call(toolName, arguments));
        }));
    }

    @SuppressWarnings("unchecked")
    private ToolResponse call(String toolName, Object arguments) {
        return gateway.call(toolName, arguments == null ? Map.of() : (Map<String, Object>) arguments);
    }

    private Map<String, Object> toolListing() {
        List<Map<String, Object>> tools = gateway.tools().stream().map(ToolDef::toToolMap).toList();
        Map<String, Object> listing = new LinkedHashMap<>();
        listing.put("server", gateway.getServerName());
        listing.put("tools", tools);
        return listing;
    }

    /**
     * Contexts match by path prefix; answer 404 for anything but the exact path.
     */
    private static HttpHandler exact(String path, HttpHandler handler) {
        return exchange -> {
            try {
                if (!path.equals(exchange.getRequestURI().getPath())) {
                    HttpUtils.sendError(exchange, 404, "No endpoint " + exchange.getRequestURI().getPath());
                    return;
                }
                handler.handle(exchange);
            } catch (IOException | RuntimeException e) {
                LOG.error("Error handling {} {}", exchange.getRequestMethod(), path, e);
                throw e;
            } finally {
                exchange.close();
            }
        };
    }
}
