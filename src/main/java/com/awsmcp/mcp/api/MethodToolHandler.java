package com.awsmcp.mcp.api;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.List;

import com.awsmcp.mcp.model.ToolResult;
import com.awsmcp.mcp.provider.ErrorNormalizer;

/**
 * Adapts an @McpTool-annotated service method to the {@link ToolHandler} contract.
 * Arguments are passed positionally in the order of the method's parameter definitions.
 */
final class MethodToolHandler implements ToolHandler {
    private final Object target;
    private final Method method;
    private final List<ToolParamDef> params;

    MethodToolHandler(Object target, Method method, ToolDef def) {
        this.target = target;
        this.method = method;
        this.params = def.getParams();
        this.method.setAccessible(true);
    }

    @Override
    public ToolResult handle(ToolArguments arguments) {
        Object[] values = new Object[params.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = arguments.raw(params.get(i).name());
        }

        try {
            ToolResult result = (ToolResult) method.invoke(target, values);
            if (result == null) {
                return ErrorNormalizer.classify(
                    new IllegalStateException("Tool method " + method.getName() + " returned no result"));
            }
            return result;
        } catch (InvocationTargetException e) {
            return ErrorNormalizer.classify(e.getCause() != null ? e.getCause() : e);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot invoke tool method " + method.getName(), e);
        }
    }
}
