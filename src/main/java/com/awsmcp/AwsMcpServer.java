package com.awsmcp;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.awsmcp.mcp.GatewayConfig;
import com.awsmcp.mcp.McpServerManager;
import com.awsmcp.mcp.api.ApiHandlerRegistry;
import com.awsmcp.mcp.api.ToolGateway;
import com.awsmcp.mcp.api.ToolRegistry;
import com.awsmcp.mcp.provider.AwsClients;
import com.awsmcp.mcp.provider.ProviderClients;
import com.awsmcp.mcp.telemetry.TelemetryLogger;

/**
 * Runs one AWS tool server front-end over HTTP.
 * The front-end is chosen by MCP_SERVER or the first command-line argument.
 */
public class AwsMcpServer {
    private static final Logger LOG = LoggerFactory.getLogger(AwsMcpServer.class);

    private final GatewayConfig config;
    private final ProviderClients clients;

    // Core components
    private McpServerManager serverManager;
    private TelemetryLogger telemetryLogger;
    private ToolGateway gateway;

    public AwsMcpServer(GatewayConfig config, ProviderClients clients) {
        this.config = config;
        this.clients = clients;
    }

    public static void main(String[] args) {
        GatewayConfig config;
        try {
            config = GatewayConfig.load(args);
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        AwsClients clients = new AwsClients(config);
        AwsMcpServer server = new AwsMcpServer(config, clients);
        try {
            server.start();
        } catch (IOException e) {
            LOG.error("Failed to start HTTP server on port {}. Port might be in use.", config.port(), e);
            clients.close();
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            clients.close();
        }, "aws-mcp-shutdown"));
    }

    /**
     * Build the tool catalog, start the HTTP server and register endpoints
     *
     * @throws IOException if the HTTP server cannot be started
     */
    public void start() throws IOException {
        String serverName = config.server().serverName();
        LOG.info("{} loading...", serverName);

        ToolRegistry registry = config.server().buildRegistry(clients, config);
        if (config.telemetryEnabled()) {
            telemetryLogger = new TelemetryLogger(config.telemetryDir(), serverName);
            telemetryLogger.init();
        }
        gateway = new ToolGateway(serverName, registry, telemetryLogger);

        serverManager = new McpServerManager(config.port(), config.threads());
        serverManager.startServer();
        new ApiHandlerRegistry(serverManager, gateway).registerAllEndpoints();

        LOG.info("{} ready with {} tools on port {}", serverName, registry.size(), serverManager.getPort());
    }

    public void stop() {
        if (serverManager != null) {
            serverManager.stopServer();
        }
        if (telemetryLogger != null) {
            telemetryLogger.shutdown();
            LOG.info("Telemetry logger shut down successfully");
        }
    }

    public ToolGateway getGateway() {
        return gateway;
    }

    public int getPort() {
        return serverManager != null ? serverManager.getPort() : config.port();
    }
}
