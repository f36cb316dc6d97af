package com.awsmcp.mcp.api;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.awsmcp.mcp.model.NormalizedError;
import com.awsmcp.mcp.model.ResultEnvelope;
import com.awsmcp.mcp.model.ToolResponse;
import com.awsmcp.mcp.model.ToolResult;
import com.awsmcp.mcp.provider.ErrorNormalizer;
import com.awsmcp.mcp.telemetry.TelemetryLogger;

/**
 * Single entry point for tool calls: registry dispatch, envelope wrapping and error normalization.
 * Whatever happens inside a tool, the caller gets exactly one envelope or exactly one error.
 */
public class ToolGateway {
    private static final Logger LOG = LoggerFactory.getLogger(ToolGateway.class);

    private final String serverName;
    private final ToolRegistry registry;
    private final ErrorNormalizer errorNormalizer;
    private final TelemetryLogger telemetryLogger;

    /**
     * Creates a new ToolGateway
     *
     * @param serverName front-end name reported in tool listings and logs
     * @param registry populated tool registry
     * @param telemetryLogger telemetry sink, or null when telemetry is disabled
     */
    public ToolGateway(String serverName, ToolRegistry registry, TelemetryLogger telemetryLogger) {
        this.serverName = serverName;
        this.registry = registry;
        this.errorNormalizer = new ErrorNormalizer(serverName);
        this.telemetryLogger = telemetryLogger;
    }

    public ToolResponse call(String toolName, Map<String, Object> arguments) {
        long startTime = telemetryLogger != null
            ? telemetryLogger.logToolStart(toolName, arguments)
            : System.currentTimeMillis();
        LOG.debug("Calling tool {} with {}", toolName, arguments);

        ToolResult result;
        try {
            result = registry.invoke(toolName, arguments);
        } catch (UnknownToolException e) {
            result = ToolResult.validationError(e.getMessage());
        }

        if (result instanceof ToolResult.Success success) {
            if (telemetryLogger != null) {
                telemetryLogger.logToolSuccess(toolName, startTime, success.payload());
            }
            return ToolResponse.of(ResultEnvelope.wrap(success.payload()));
        }

        NormalizedError error = errorNormalizer.normalize(toolName, result);
        if (telemetryLogger != null) {
            telemetryLogger.logToolFailure(toolName, startTime, result.getClass().getSimpleName(), error.message());
        }
        return ToolResponse.failed(error);
    }

    public List<ToolDef> tools() {
        return registry.list();
    }

    public String getServerName() {
        return serverName;
    }
}
