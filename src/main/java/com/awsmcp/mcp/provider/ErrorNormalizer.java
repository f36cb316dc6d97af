package com.awsmcp.mcp.provider;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.awsmcp.mcp.api.ArgumentException;
import com.awsmcp.mcp.model.NormalizedError;
import com.awsmcp.mcp.model.ToolResult;
import com.awsmcp.mcp.utils.Json;

import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;

/**
 * Turns exceptions into {@link ToolResult} failures and failures into the single caller-facing error.
 */
public class ErrorNormalizer {
    private static final Logger LOG = LoggerFactory.getLogger(ErrorNormalizer.class);

    private final String serverName;

    public ErrorNormalizer(String serverName) {
        this.serverName = serverName;
    }

    /**
     * Classify a failure raised while building, sending or shaping a provider call.
     */
    public static ToolResult classify(Throwable failure) {
        if (failure instanceof ArgumentException) {
            return ToolResult.validationError(failure.getMessage());
        }
        if (failure instanceof AwsServiceException serviceException) {
            return fromServiceException(serviceException);
        }
        String message = failure.getMessage() != null ? failure.getMessage() : failure.toString();
        return ToolResult.transportError(message, failure);
    }

    private static ToolResult.ProviderError fromServiceException(AwsServiceException e) {
        AwsErrorDetails details = e.awsErrorDetails();
        String code = details != null && details.errorCode() != null ? details.errorCode() : "Unknown";
        String message = details != null && details.errorMessage() != null ? details.errorMessage() : e.getMessage();

        // shape of the provider's error response
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("Code", code);
        error.put("Message", message);

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (e.requestId() != null) {
            metadata.put("RequestId", e.requestId());
        }
        metadata.put("HTTPStatusCode", e.statusCode());

        Map<String, Object> diagnostic = new LinkedHashMap<>();
        diagnostic.put("Error", error);
        diagnostic.put("ResponseMetadata", metadata);
        return new ToolResult.ProviderError(code, message, diagnostic, e);
    }

    /**
     * Produce the caller-facing error for a failed result and log it. Never throws.
     */
    public NormalizedError normalize(String toolName, ToolResult failure) {
        try {
            return doNormalize(toolName, failure);
        } catch (RuntimeException e) {
            LOG.error("[{}] {} failed and its error could not be rendered", serverName, toolName, e);
            return new NormalizedError(e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    private NormalizedError doNormalize(String toolName, ToolResult failure) {
        if (failure instanceof ToolResult.NotFound notFound) {
            LOG.warn("[{}] {}: {}", serverName, toolName, notFound.message());
            return new NormalizedError(notFound.message());
        }
        if (failure instanceof ToolResult.ValidationError invalid) {
            LOG.warn("[{}] {} rejected: {}", serverName, toolName, invalid.message());
            return new NormalizedError(invalid.message());
        }
        if (failure instanceof ToolResult.ProviderError providerError) {
            Map<String, Object> diagnostic = providerError.diagnostic();
            if (diagnostic == null || diagnostic.isEmpty()) {
                diagnostic = new LinkedHashMap<>();
                diagnostic.put("code", providerError.code());
                diagnostic.put("message", providerError.message());
            }
            LOG.error("[{}] {} provider error {}: {}", serverName, toolName,
                providerError.code(), providerError.message(), providerError.cause());
            return new NormalizedError(Json.serialize(diagnostic));
        }
        if (failure instanceof ToolResult.TransportError transportError) {
            LOG.error("[{}] {} failed: {}", serverName, toolName, transportError.message(), transportError.cause());
            return new NormalizedError(transportError.message());
        }
        throw new IllegalArgumentException("Not a failure: " + failure);
    }
}
