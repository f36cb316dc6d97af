package com.awsmcp.mcp.provider;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.awsmcp.mcp.model.StatusMessage;
import com.awsmcp.mcp.model.ToolResult;
import com.awsmcp.mcp.utils.SdkPojos;

/**
 * One provider operation plus the shaping of its response into a {@link ToolResult}.
 * Anything thrown by the operation or by the shaping step is classified, never rethrown.
 *
 * <pre>
 * return ProviderCall.of(() -&gt; ec2.startInstances(request))
 *     .respond(StartInstancesResponse::startingInstances);
 * </pre>
 */
public final class ProviderCall<R> {

    /** A provider operation. */
    @FunctionalInterface
    public interface Operation<R> {
        R call() throws Exception;
    }

    private final Operation<R> operation;

    private ProviderCall(Operation<R> operation) {
        this.operation = operation;
    }

    public static <R> ProviderCall<R> of(Operation<R> operation) {
        return new ProviderCall<>(operation);
    }

    /** Success with the shaped response converted to plain JSON-compatible values. */
    public ToolResult respond(Function<? super R, ?> shape) {
        return then(response -> ToolResult.success(SdkPojos.toPlain(shape.apply(response))));
    }

    /**
     * Success with the first extracted item; {@link ToolResult.NotFound} when there is none.
     */
    public ToolResult respondFirst(Function<? super R, ? extends List<?>> items, String notFoundMessage) {
        return then(response -> {
            List<?> found = items.apply(response);
            if (found == null || found.isEmpty()) {
                return ToolResult.notFound(notFoundMessage);
            }
            return ToolResult.success(SdkPojos.toPlain(found.get(0)));
        });
    }

    /** Like {@link #respond}, but an empty shaped value becomes {@code {"message": message}}. */
    public ToolResult respondOrStatus(Function<? super R, ?> shape, String message) {
        return then(response -> {
            Object plain = SdkPojos.toPlain(shape.apply(response));
            if (isEmpty(plain)) {
                return ToolResult.success(StatusMessage.of(message));
            }
            return ToolResult.success(plain);
        });
    }

    /** Success with {@code {"message": message}}, discarding the provider response. */
    public ToolResult respondStatus(String message) {
        return then(response -> ToolResult.success(StatusMessage.of(message)));
    }

    /** Run the operation and hand its response to a continuation, e.g. a dependent provider call. */
    public ToolResult then(Function<? super R, ToolResult> continuation) {
        try {
            return continuation.apply(operation.call());
        } catch (Exception e) {
            return ErrorNormalizer.classify(e);
        }
    }

    private static boolean isEmpty(Object plain) {
        if (plain == null) return true;
        if (plain instanceof Map<?, ?> map) return map.isEmpty();
        if (plain instanceof Collection<?> collection) return collection.isEmpty();
        return false;
    }
}
