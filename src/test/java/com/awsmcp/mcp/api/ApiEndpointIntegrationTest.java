package com.awsmcp.mcp.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.awsmcp.mcp.McpServerManager;
import com.awsmcp.mcp.model.ToolResult;
import com.awsmcp.mcp.utils.Json;

/**
 * Exercises the HTTP endpoints against a real server bound to a free port.
 */
class ApiEndpointIntegrationTest {

    private McpServerManager serverManager;
    private HttpClient client;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        ToolRegistry registry = new ToolRegistry();
        registry.register(ToolDef.builder("get_widget", "Describe a widget.")
                .required("widget_id", ParamType.STRING, "Widget ID")
                .build(),
            args -> {
                String id = args.require("widget_id", String.class);
                return "w-1".equals(id)
                    ? ToolResult.success(Map.of("WidgetId", id))
                    : ToolResult.notFound("Widget " + id + " not found");
            });

        serverManager = new McpServerManager(0, 2);
        serverManager.startServer();
        new ApiHandlerRegistry(serverManager, new ToolGateway("aws-test", registry, null)).registerAllEndpoints();

        client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
        baseUrl = "http://localhost:" + serverManager.getPort();
    }

    @AfterEach
    void tearDown() {
        serverManager.stopServer();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build(),
            HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(baseUrl + path))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .header("Content-Type", "application/json")
                .build(),
            HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("GET /mcp/tools lists the catalog with input schemas")
    void testToolListing() throws Exception {
        HttpResponse<String> response = get("/mcp/tools");

        assertEquals(200, response.statusCode());
        Map<String, Object> body = Json.readObject(response.body());
        assertEquals("aws-test", body.get("server"));
        List<?> tools = (List<?>) body.get("tools");
        assertEquals(1, tools.size());
        Map<?, ?> tool = (Map<?, ?>) tools.get(0);
        assertEquals("get_widget", tool.get("name"));
        Map<?, ?> schema = (Map<?, ?>) tool.get("inputSchema");
        assertEquals(List.of("widget_id"), schema.get("required"));
    }

    @Test
    @DisplayName("POST /tools/call wraps a success in one envelope")
    void testToolsCall_Success() throws Exception {
        HttpResponse<String> response = post("/tools/call",
            "{\"name\":\"get_widget\",\"arguments\":{\"widget_id\":\"w-1\"}}");

        assertEquals(200, response.statusCode());
        assertEquals("{\"content\":[{\"type\":\"application/json\",\"data\":{\"WidgetId\":\"w-1\"}}]}",
            response.body());
    }

    @Test
    @DisplayName("POST /{tool} takes the arguments object as its body")
    void testDirectEndpoint_NotFoundIsStill200() throws Exception {
        HttpResponse<String> response = post("/get_widget", "{\"widget_id\":\"w-9\"}");

        assertEquals(200, response.statusCode());
        assertEquals(Map.of("error", Map.of("message", "Widget w-9 not found")), Json.readObject(response.body()));
    }

    @Test
    @DisplayName("missing required argument is reported as a tool error")
    void testDirectEndpoint_MissingArgument() throws Exception {
        HttpResponse<String> response = post("/get_widget", "");

        assertEquals(200, response.statusCode());
        assertEquals(Map.of("error", Map.of("message", "Missing required argument: widget_id")),
            Json.readObject(response.body()));
    }

    @Test
    @DisplayName("unknown tool via /tools/call is a tool error")
    void testToolsCall_UnknownTool() throws Exception {
        HttpResponse<String> response = post("/tools/call", "{\"name\":\"nope\"}");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("Unknown tool: nope"));
    }

    @Test
    @DisplayName("malformed bodies get 400")
    void testMalformedBody() throws Exception {
        assertEquals(400, post("/tools/call", "not json").statusCode());
        assertEquals(400, post("/tools/call", "{\"arguments\":{}}").statusCode());
        assertEquals(400, post("/tools/call", "{\"name\":\"get_widget\",\"arguments\":[1]}").statusCode());
        assertEquals(400, post("/get_widget", "[1,2]").statusCode());
    }

    @Test
    @DisplayName("wrong method gets 405 and unknown path gets 404")
    void testMethodAndPath() throws Exception {
        HttpResponse<String> wrongMethod = get("/get_widget");
        assertEquals(405, wrongMethod.statusCode());
        assertEquals("POST", wrongMethod.headers().firstValue("Allow").orElse(null));

        assertEquals(405, post("/mcp/tools", "{}").statusCode());
        assertEquals(404, post("/get_widget/extra", "{}").statusCode());
        assertEquals(404, get("/nothing").statusCode());
    }
}
