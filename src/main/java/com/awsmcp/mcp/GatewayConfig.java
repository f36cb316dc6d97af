package com.awsmcp.mcp;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Startup configuration, read once from the environment and handed to the components that need it.
 * System properties of the same name override environment variables.
 */
public record GatewayConfig(
    AwsServer server,
    String region,
    String profile,          // null = default credential chain
    int port,
    int threads,
    boolean telemetryEnabled,
    String telemetryDir
) {
    public static final String DEFAULT_REGION = "us-east-1";
    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_THREADS = 8;

    /**
     * Load from {@link System#getenv()} overlaid with system properties.
     *
     * @throws IllegalArgumentException if a value is missing or invalid
     */
    public static GatewayConfig load(String[] args) {
        Map<String, String> environment = new HashMap<>(System.getenv());
        for (String name : System.getProperties().stringPropertyNames()) {
            environment.put(name, System.getProperty(name));
        }
        return fromEnvironment(environment, args);
    }

    /**
     * @param environment variable lookup
     * @param args command-line arguments; the first one names the server when MCP_SERVER is unset
     * @throws IllegalArgumentException if a value is missing or invalid
     */
    public static GatewayConfig fromEnvironment(Map<String, String> environment, String[] args) {
        String serverName = value(environment, "MCP_SERVER");
        if (serverName == null && args != null && args.length > 0) {
            serverName = args[0];
        }
        if (serverName == null) {
            throw new IllegalArgumentException("No server selected: set MCP_SERVER or pass one of "
                + AwsServer.names() + " as the first argument");
        }

        String region = value(environment, "AWS_REGION");
        String telemetryDir = value(environment, "MCP_TELEMETRY_DIR");
        return new GatewayConfig(
            AwsServer.fromName(serverName),
            region != null ? region : DEFAULT_REGION,
            value(environment, "AWS_PROFILE"),
            intValue(environment, "MCP_PORT", DEFAULT_PORT, 0, 65535),
            intValue(environment, "MCP_THREADS", DEFAULT_THREADS, 1, 1024),
            booleanValue(environment, "MCP_TELEMETRY_ENABLED", true),
            telemetryDir != null ? telemetryDir
                : Paths.get(System.getProperty("user.home"), ".aws_mcp", "telemetry").toString());
    }

    private static String value(Map<String, String> environment, String name) {
        String value = environment.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int intValue(Map<String, String> environment, String name, int defaultValue, int min, int max) {
        String value = value(environment, name);
        if (value == null) return defaultValue;
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
        if (parsed < min || parsed > max) {
            throw new IllegalArgumentException(name + " must be between " + min + " and " + max + ", got " + parsed);
        }
        return parsed;
    }

    private static boolean booleanValue(Map<String, String> environment, String name, boolean defaultValue) {
        String value = value(environment, name);
        if (value == null) return defaultValue;
        if (value.equalsIgnoreCase("true")) return true;
        if (value.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException(name + " must be true or false, got '" + value + "'");
    }
}
